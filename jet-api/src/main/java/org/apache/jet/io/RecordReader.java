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

/**
 * Reads a sequence of records.
 * <p/>
 * Call {@link #readRecord()} to advance to the next record and {@link #getCurrentRecord()} to
 * retrieve it. Depending on the reader, the same record instance may be returned for every
 * call; callers that keep records must not assume otherwise unless record reuse is disabled.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public abstract class RecordReader<T> implements Closeable {

  private T currentRecord;
  private long recordsRead;
  private long readTimeNanos;

  /**
   * Advances to the next record.
   * @return <code>false</code> if there are no more records
   */
  public final boolean readRecord() throws IOException {
    long start = System.nanoTime();
    boolean result = readRecordInternal();
    readTimeNanos += System.nanoTime() - start;
    if (result) {
      ++recordsRead;
    }
    return result;
  }

  protected abstract boolean readRecordInternal() throws IOException;

  public T getCurrentRecord() {
    return currentRecord;
  }

  protected void setCurrentRecord(T record) {
    this.currentRecord = record;
  }

  public long getRecordsRead() {
    return recordsRead;
  }

  /**
   * Time spent in {@link #readRecord()}, including waiting for input.
   */
  public long getReadTimeNanos() {
    return readTimeNanos;
  }

  /**
   * Returns the fraction of the input that has been read, between 0 and 1.
   */
  public abstract float getProgress();

  /**
   * Returns the number of uncompressed bytes of input consumed so far.
   */
  public long getInputBytes() {
    return 0;
  }

  /**
   * Returns the number of bytes read from the underlying storage, which differs from
   * {@link #getInputBytes()} when the input is compressed.
   */
  public long getBytesRead() {
    return getInputBytes();
  }

  @Override
  public void close() throws IOException {
  }
}
