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

package org.apache.jet.runtime.library.common.sort;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.jet.common.PriorityQueue;
import org.apache.jet.io.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The sorted records of a merge pass.
 * <p/>
 * I/O errors while advancing the inputs are thrown as {@link UncheckedIOException}. Closing
 * the result closes every input that has not been exhausted yet.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public final class MergeResult<T> implements Iterator<MergeResultRecord<T>>, Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(MergeResult.class);

  private final PriorityQueue<JetMerger.MergeInput> mergeQueue;
  private final List<RecordReader<?>> readers;
  private final MergeResultRecord<T> record;
  private final AtomicLong bytesRead;
  private boolean advanceNeeded;
  private boolean closed;

  MergeResult(PriorityQueue<JetMerger.MergeInput> mergeQueue, List<RecordReader<?>> readers,
      MergeResultRecord<T> record, AtomicLong bytesRead) {
    this.mergeQueue = mergeQueue;
    this.readers = readers;
    this.record = record;
    this.bytesRead = bytesRead;
  }

  /**
   * Returns the average progress of the readers of this merge pass.
   */
  public float getProgress() {
    if (readers.isEmpty()) {
      return 1.0f;
    }
    float sum = 0;
    for (RecordReader<?> reader : readers) {
      sum += reader.getProgress();
    }
    return sum / readers.size();
  }

  @Override
  public boolean hasNext() {
    if (closed) {
      return false;
    }
    if (advanceNeeded) {
      advanceNeeded = false;
      try {
        advance();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return !mergeQueue.isEmpty();
  }

  @Override
  public MergeResultRecord<T> next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    mergeQueue.peek().getCurrentRecord(record);
    advanceNeeded = true;
    return record;
  }

  private void advance() throws IOException {
    JetMerger.MergeInput front = mergeQueue.peek();
    if (front.readRecord()) {
      mergeQueue.adjustFirstItem();
    } else {
      if (!front.isMemoryBased()) {
        bytesRead.addAndGet(front.getBytesRead());
      }
      mergeQueue.dequeue();
      front.close();
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    while (!mergeQueue.isEmpty()) {
      JetMerger.MergeInput input = mergeQueue.dequeue();
      try {
        input.close();
      } catch (IOException e) {
        LOG.warn("Failed to close merge input", e);
      }
    }
  }
}
