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

package org.apache.jet.io;

import java.io.Closeable;
import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;

import com.google.common.base.Preconditions;

/**
 * Writes a sequence of records.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public abstract class RecordWriter<T> implements Closeable {

  private long recordsWritten;
  private long writeTimeNanos;

  public final void writeRecord(T record) throws IOException {
    Preconditions.checkNotNull(record, "record");
    long start = System.nanoTime();
    writeRecordInternal(record);
    writeTimeNanos += System.nanoTime() - start;
    ++recordsWritten;
  }

  protected abstract void writeRecordInternal(T record) throws IOException;

  public long getRecordsWritten() {
    return recordsWritten;
  }

  public long getWriteTimeNanos() {
    return writeTimeNanos;
  }

  /**
   * Returns the number of uncompressed bytes written.
   */
  public long getOutputBytes() {
    return 0;
  }

  /**
   * Returns the number of bytes written to the underlying storage.
   */
  public long getBytesWritten() {
    return getOutputBytes();
  }

  /**
   * Flushes buffered records. No records may be written afterwards. Calling this more than
   * once has no effect.
   */
  public void finishWriting() throws IOException {
  }

  @Override
  public void close() throws IOException {
    finishWriting();
  }
}
