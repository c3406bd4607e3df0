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

import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.jet.io.RawRecord;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record input that reads a {@link RecordFile} from a file system. The reader is created when
 * it is first requested.
 */
@Private
public class FileRecordInput extends RecordInput {

  private static final Logger LOG = LoggerFactory.getLogger(FileRecordInput.class);

  private final Configuration conf;
  private final FileSystem fs;
  private final Path path;
  private final Class<?> recordClass;
  private final CompressionCodec codec;
  private final int bufferSize;
  private final boolean allowRecordReuse;
  private final boolean deleteOnClose;

  public FileRecordInput(Configuration conf, FileSystem fs, Path path, Class<?> recordClass,
      CompressionCodec codec, int bufferSize, boolean allowRecordReuse) {
    this(conf, fs, path, recordClass, codec, bufferSize, allowRecordReuse, false);
  }

  /**
   * @param deleteOnClose <code>true</code> to delete the file when the input is closed, for
   *          intermediate files owned by the reader
   */
  public FileRecordInput(Configuration conf, FileSystem fs, Path path, Class<?> recordClass,
      CompressionCodec codec, int bufferSize, boolean allowRecordReuse, boolean deleteOnClose) {
    this.conf = conf;
    this.fs = fs;
    this.path = path;
    this.recordClass = recordClass;
    this.codec = codec;
    this.bufferSize = bufferSize;
    this.allowRecordReuse = allowRecordReuse;
    this.deleteOnClose = deleteOnClose;
  }

  public Path getPath() {
    return path;
  }

  @Override
  public boolean isMemoryBased() {
    return false;
  }

  @Override
  public boolean isRawReaderSupported() {
    return true;
  }

  @Override
  protected RecordReader<?> createReader() throws IOException {
    return new RecordFile.Reader<Object>(conf, fs, path, castRecordClass(), codec, bufferSize,
        allowRecordReuse);
  }

  @Override
  protected RecordReader<RawRecord> createRawReader() throws IOException {
    return new RecordFile.RawReader(conf, fs, path, codec, bufferSize, allowRecordReuse);
  }

  @Override
  public void close() throws IOException {
    boolean wasClosed = isClosed();
    super.close();
    if (!wasClosed && deleteOnClose) {
      if (!fs.delete(path, false)) {
        LOG.warn("Could not delete intermediate file {}", path);
      }
    }
  }

  @SuppressWarnings("unchecked")
  private Class<Object> castRecordClass() {
    return (Class<Object>) recordClass;
  }

  @Override
  public String toString() {
    return "FileRecordInput [path=" + path + "]";
  }
}
