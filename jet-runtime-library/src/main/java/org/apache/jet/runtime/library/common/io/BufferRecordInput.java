/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.jet.runtime.library.common.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.jet.io.RawRecord;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;

/**
 * Memory based record input over a complete {@link RecordFile} image held in a byte array.
 */
@Private
public class BufferRecordInput extends RecordInput {

  private final Configuration conf;
  private final Class<?> recordClass;
  private final byte[] data;
  private final int offset;
  private final int length;
  private final CompressionCodec codec;
  private final boolean allowRecordReuse;

  public BufferRecordInput(Configuration conf, Class<?> recordClass, byte[] data,
      boolean allowRecordReuse) {
    this(conf, recordClass, data, 0, data.length, null, allowRecordReuse);
  }

  public BufferRecordInput(Configuration conf, Class<?> recordClass, byte[] data, int offset,
      int length, CompressionCodec codec, boolean allowRecordReuse) {
    this.conf = conf;
    this.recordClass = recordClass;
    this.data = data;
    this.offset = offset;
    this.length = length;
    this.codec = codec;
    this.allowRecordReuse = allowRecordReuse;
  }

  @Override
  public boolean isMemoryBased() {
    return true;
  }

  @Override
  public boolean isRawReaderSupported() {
    return true;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected RecordReader<?> createReader() throws IOException {
    return new RecordFile.Reader<Object>(conf, new ByteArrayInputStream(data, offset, length),
        length, (Class<Object>) recordClass, codec, allowRecordReuse);
  }

  @Override
  protected RecordReader<RawRecord> createRawReader() throws IOException {
    return new RecordFile.RawReader(new ByteArrayInputStream(data, offset, length), length,
        codec, allowRecordReuse);
  }
}
