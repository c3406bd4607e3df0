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
 * A handle to one segment of records, resident either on disk or in memory. The reader is
 * created lazily; an input can provide either a typed reader or a raw reader, not both.
 */
@Public
@Evolving
public abstract class RecordInput implements Closeable {

  private RecordReader<?> reader;
  private RecordReader<RawRecord> rawReader;
  private boolean closed;

  protected RecordInput() {
  }

  protected RecordInput(RecordReader<?> reader) {
    this.reader = Preconditions.checkNotNull(reader, "reader");
  }

  /**
   * Indicates whether the records are held in memory, in which case reading them performs no
   * I/O.
   */
  public abstract boolean isMemoryBased();

  public abstract boolean isRawReaderSupported();

  public RecordReader<?> getReader() throws IOException {
    checkNotClosed();
    Preconditions.checkState(rawReader == null, "This input already has a raw record reader.");
    if (reader == null) {
      reader = createReader();
    }
    return reader;
  }

  public RecordReader<RawRecord> getRawReader() throws IOException {
    checkNotClosed();
    Preconditions.checkState(reader == null, "This input already has a regular record reader.");
    if (rawReader == null) {
      if (!isRawReaderSupported()) {
        throw new UnsupportedOperationException(getClass().getName()
            + " does not support raw record readers.");
      }
      rawReader = createRawReader();
    }
    return rawReader;
  }

  public boolean isReaderCreated() {
    return reader != null;
  }

  public boolean isRawReaderCreated() {
    return rawReader != null;
  }

  /**
   * Returns the reader that was created for this input, typed or raw, or <code>null</code>.
   */
  public RecordReader<?> getCreatedReader() {
    return reader != null ? reader : rawReader;
  }

  public float getProgress() {
    if (closed) {
      return 1.0f;
    }
    RecordReader<?> created = getCreatedReader();
    return created == null ? 0.0f : created.getProgress();
  }

  public boolean isClosed() {
    return closed;
  }

  protected abstract RecordReader<?> createReader() throws IOException;

  protected RecordReader<RawRecord> createRawReader() throws IOException {
    throw new UnsupportedOperationException();
  }

  @Override
  public void close() throws IOException {
    if (!closed) {
      closed = true;
      RecordReader<?> created = getCreatedReader();
      if (created != null) {
        created.close();
      }
    }
  }

  private void checkNotClosed() {
    Preconditions.checkState(!closed, "The record input has been closed.");
  }
}
