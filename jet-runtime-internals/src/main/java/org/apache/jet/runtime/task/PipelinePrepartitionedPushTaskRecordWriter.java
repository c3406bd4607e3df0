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
import org.apache.jet.io.Partitioner;
import org.apache.jet.io.PrepartitionedRecordWriter;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.runtime.api.PrepartitionedPushTask;

import com.google.common.base.Throwables;

/**
 * Hands records written by a parent task to a pipelined prepartitioned push task, together with
 * the partition the parent's child stage partitioner assigns to them.
 */
@Private
class PipelinePrepartitionedPushTaskRecordWriter<I, O> extends RecordWriter<I> {

  private final TaskExecution taskExecution;
  private final PrepartitionedRecordWriter<O> output;
  private final Partitioner<I> partitioner;

  PipelinePrepartitionedPushTaskRecordWriter(TaskExecution taskExecution,
      RecordWriter<O> output, Partitioner<I> partitioner) {
    this.taskExecution = taskExecution;
    this.output = new PrepartitionedRecordWriter<O>(output, false);
    this.partitioner = partitioner;
  }

  @Override
  protected void writeRecordInternal(I record) throws IOException {
    try {
      getTask().processRecord(record, partitioner.getPartition(record), output);
    } catch (Exception e) {
      throw propagate(e);
    }
  }

  /**
   * Calls the finish method of the current task instance.
   */
  void finish() throws IOException {
    try {
      getTask().finish(output);
    } catch (Exception e) {
      throw propagate(e);
    }
  }

  @SuppressWarnings("unchecked")
  private PrepartitionedPushTask<I, O> getTask() {
    return (PrepartitionedPushTask<I, O>) taskExecution.getTask();
  }

  private IOException propagate(Exception e) throws IOException {
    Throwables.throwIfInstanceOf(e, IOException.class);
    Throwables.throwIfUnchecked(e);
    return new IOException("Pipelined task " + taskExecution.getContext().getTaskAttemptId()
        + " failed.", e);
  }
}
