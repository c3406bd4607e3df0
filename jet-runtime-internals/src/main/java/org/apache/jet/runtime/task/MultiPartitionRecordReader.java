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

package org.apache.jet.runtime.task;

import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.PartitionGate;
import org.apache.jet.io.RecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Presents every partition of a multi input record reader as one stream of records, for tasks
 * that process all their input partitions in a single run. Moving to the next partition goes
 * through the task execution so revoked partitions are skipped and additional partitions are
 * requested when the assigned ones are exhausted.
 */
@Private
public class MultiPartitionRecordReader<T> extends RecordReader<T> {

  private static final Logger LOG = LoggerFactory.getLogger(MultiPartitionRecordReader.class);

  private final TaskExecution taskExecution;
  private final MultiInputRecordReader<T> baseReader;
  private boolean allowAdditionalPartitions = true;
  private boolean stopAtEndOfPartition;

  public MultiPartitionRecordReader(TaskExecution taskExecution,
      MultiInputRecordReader<T> baseReader) {
    this.taskExecution = taskExecution;
    this.baseReader = Preconditions.checkNotNull(baseReader, "baseReader");
    LOG.info("Now processing partition {}.", baseReader.getCurrentPartition());
  }

  @Override
  public float getProgress() {
    return baseReader.getProgress();
  }

  public int getCurrentPartition() {
    return baseReader.getCurrentPartition();
  }

  public int getPartitionCount() {
    return baseReader.getPartitionCount();
  }

  public boolean isAllowAdditionalPartitions() {
    return allowAdditionalPartitions;
  }

  public void setAllowAdditionalPartitions(boolean allowAdditionalPartitions) {
    this.allowAdditionalPartitions = allowAdditionalPartitions;
  }

  public boolean isStopAtEndOfPartition() {
    return stopAtEndOfPartition;
  }

  /**
   * When set, the reader reports the end of its input at the end of the current partition
   * instead of moving on to the next one.
   */
  public void setStopAtEndOfPartition(boolean stopAtEndOfPartition) {
    this.stopAtEndOfPartition = stopAtEndOfPartition;
  }

  @Override
  protected boolean readRecordInternal() throws IOException {
    while (!baseReader.readRecord()) {
      if (!nextPartition()) {
        setCurrentRecord(null);
        return false;
      }
    }
    setCurrentRecord(baseReader.getCurrentRecord());
    return true;
  }

  private boolean nextPartition() throws IOException {
    if (stopAtEndOfPartition) {
      return false;
    }
    boolean hasNext;
    if (taskExecution == null) {
      hasNext = baseReader.nextPartition(PartitionGate.ALWAYS);
    } else {
      hasNext = taskExecution.nextInputPartition(baseReader, allowAdditionalPartitions);
    }
    if (hasNext) {
      LOG.info("Now processing partition {}.", baseReader.getCurrentPartition());
    }
    return hasNext;
  }

  /**
   * Does not close the base reader; the task execution still needs it for its metrics.
   */
  @Override
  public void close() throws IOException {
  }
}
