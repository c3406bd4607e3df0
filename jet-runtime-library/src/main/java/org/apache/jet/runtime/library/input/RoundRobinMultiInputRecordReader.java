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
import java.util.ArrayList;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;

/**
 * Multi input record reader that takes one record at a time from each input that is currently
 * available. It does not wait for all inputs to arrive; it only blocks when every available
 * input has been exhausted and more inputs are still expected.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public class RoundRobinMultiInputRecordReader<T> extends MultiInputRecordReader<T> {

  private final List<RecordInput> inputs = new ArrayList<RecordInput>();
  private final List<RecordReader<T>> readers = new ArrayList<RecordReader<T>>();
  private int previousInputsAvailable;
  private int currentReader = -1;

  public RoundRobinMultiInputRecordReader(Configuration conf, Class<T> recordClass,
      int[] partitions, int totalInputCount, boolean allowRecordReuse, int bufferSize) {
    super(conf, recordClass, partitions, totalInputCount, allowRecordReuse, bufferSize);
  }

  @Override
  @SuppressWarnings("unchecked")
  protected boolean readRecordInternal() throws IOException {
    checkNotClosed();
    while (true) {
      int inputsAvailable = getCurrentInputCount();
      if (inputsAvailable > previousInputsAvailable) {
        for (int x = previousInputsAvailable; x < inputsAvailable; ++x) {
          RecordInput input = getInput(x);
          inputs.add(input);
          readers.add((RecordReader<T>) input.getReader());
        }
        previousInputsAvailable = inputsAvailable;
        if (currentReader == -1) {
          currentReader = readers.size() - 1;
        }
      }

      if (readers.isEmpty()) {
        if (previousInputsAvailable == getTotalInputCount()) {
          setCurrentRecord(null);
          return false;
        }
        try {
          waitForInputs(previousInputsAvailable + 1, -1);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new InterruptedIOException("Interrupted while waiting for inputs.");
        }
        continue;
      }

      int nextReader = (currentReader + 1) % readers.size();
      RecordReader<T> reader = readers.get(nextReader);
      if (reader.readRecord()) {
        currentReader = nextReader;
        setCurrentRecord(reader.getCurrentRecord());
        return true;
      }
      readers.remove(nextReader);
      inputs.remove(nextReader).close();
      // The next attempt starts at the same position, which now holds the following reader.
      currentReader = nextReader - 1;
    }
  }

  @Override
  protected void onCurrentPartitionChanged() {
    currentReader = -1;
    inputs.clear();
    readers.clear();
    previousInputsAvailable = 0;
  }
}
