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
import org.apache.jet.runtime.api.PushTask;

import com.google.common.base.Throwables;

/**
 * Hands every record written by a parent task directly to a pipelined push task.
 */
@Private
class PipelinePushTaskRecordWriter<I, O> extends RecordWriter<I> {

  private final TaskExecution taskExecution;
  private final RecordWriter<O> output;

  PipelinePushTaskRecordWriter(TaskExecution taskExecution, RecordWriter<O> output) {
    this.taskExecution = taskExecution;
    this.output = output;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected void writeRecordInternal(I record) throws IOException {
    // The task instance is replaced between input partitions.
    PushTask<I, O> task = (PushTask<I, O>) taskExecution.getTask();
    try {
      task.processRecord(record, output);
    } catch (Exception e) {
      Throwables.throwIfInstanceOf(e, IOException.class);
      Throwables.throwIfUnchecked(e);
      throw new IOException("Pipelined task " + taskExecution.getContext().getTaskAttemptId()
          + " failed to process a record.", e);
    }
  }
}
