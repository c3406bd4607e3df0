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
import org.apache.jet.io.RecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFS output writer for a task that processes several input partitions one after another.
 * The output is named after the input partition rather than the task, so the writer starts a
 * new output file each time the task execution moves to another partition.
 */
@Private
class PartitionDfsOutputRecordWriter<T> extends RecordWriter<T> {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionDfsOutputRecordWriter.class);

  private final TaskExecution taskExecution;
  private RecordWriter<T> recordWriter;
  private int currentPartition;
  private long previousOutputBytes;
  private long previousBytesWritten;

  PartitionDfsOutputRecordWriter(TaskExecution taskExecution, int partitionNumber)
      throws IOException {
    this.taskExecution = taskExecution;
    createOutputWriter(partitionNumber);
  }

  int getCurrentPartition() {
    return currentPartition;
  }

  @Override
  protected void writeRecordInternal(T record) throws IOException {
    recordWriter.writeRecord(record);
  }

  /**
   * Closes the output of the previous partition and opens the output of the new one.
   */
  void partitionChanged(int partitionNumber) throws IOException {
    if (partitionNumber == currentPartition && recordWriter != null) {
      return;
    }
    closeCurrentWriter();
    createOutputWriter(partitionNumber);
  }

  @Override
  public long getOutputBytes() {
    return recordWriter == null ? previousOutputBytes
        : previousOutputBytes + recordWriter.getOutputBytes();
  }

  @Override
  public long getBytesWritten() {
    return recordWriter == null ? previousBytesWritten
        : previousBytesWritten + recordWriter.getBytesWritten();
  }

  @Override
  public void finishWriting() throws IOException {
    if (recordWriter != null) {
      recordWriter.finishWriting();
    }
  }

  @Override
  public void close() throws IOException {
    closeCurrentWriter();
  }

  private void closeCurrentWriter() throws IOException {
    if (recordWriter != null) {
      RecordWriter<T> writer = recordWriter;
      recordWriter = null;
      writer.close();
      previousOutputBytes += writer.getOutputBytes();
      previousBytesWritten += writer.getBytesWritten();
    }
  }

  @SuppressWarnings("unchecked")
  private void createOutputWriter(int partitionNumber) throws IOException {
    LOG.debug("Creating output for partition {}.", partitionNumber);
    currentPartition = partitionNumber;
    recordWriter = (RecordWriter<T>) taskExecution.createDfsOutputWriter(partitionNumber);
  }
}
