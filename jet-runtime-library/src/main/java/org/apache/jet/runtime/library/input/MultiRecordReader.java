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

package org.apache.jet.runtime.library.input;

import java.io.IOException;
import java.io.InterruptedIOException;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;

/**
 * Multi input record reader that reads the inputs of the current partition one after the
 * other, in the order in which they arrived.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public class MultiRecordReader<T> extends MultiInputRecordReader<T> {

  private RecordInput currentInput;
  private RecordReader<T> currentReader;
  private int currentReaderNumber;
  private long waitTimeNanos;

  public MultiRecordReader(Configuration conf, Class<T> recordClass, int[] partitions,
      int totalInputCount, boolean allowRecordReuse, int bufferSize) {
    super(conf, recordClass, partitions, totalInputCount, allowRecordReuse, bufferSize);
  }

  /**
   * Returns the time spent waiting for inputs to arrive.
   */
  public long getWaitTimeNanos() {
    return waitTimeNanos;
  }

  @Override
  protected boolean readRecordInternal() throws IOException {
    checkNotClosed();
    if (!waitForReader()) {
      setCurrentRecord(null);
      return false;
    }
    while (!currentReader.readRecord()) {
      currentInput.close();
      currentInput = null;
      currentReader = null;
      if (!waitForReader()) {
        setCurrentRecord(null);
        return false;
      }
    }
    setCurrentRecord(currentReader.getCurrentRecord());
    return true;
  }

  @Override
  protected void onCurrentPartitionChanged() {
    currentInput = null;
    currentReader = null;
    currentReaderNumber = 0;
  }

  @SuppressWarnings("unchecked")
  private boolean waitForReader() throws IOException {
    if (currentReader == null) {
      int newReaderNumber = currentReaderNumber + 1;
      if (newReaderNumber > getTotalInputCount()) {
        return false;
      }
      long start = System.nanoTime();
      try {
        waitForInputs(newReaderNumber, -1);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while waiting for input "
            + newReaderNumber);
      }
      waitTimeNanos += System.nanoTime() - start;
      currentInput = getInput(currentReaderNumber);
      currentReader = (RecordReader<T>) currentInput.getReader();
      currentReaderNumber = newReaderNumber;
    }
    return true;
  }
}
