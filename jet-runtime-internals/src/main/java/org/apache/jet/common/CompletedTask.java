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

package org.apache.jet.common;

import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.jet.records.TaskAttemptId;

import com.google.common.base.Preconditions;

/**
 * A task attempt whose output can be read by the stages that consume it.
 */
@Private
public final class CompletedTask {

  private final UUID jobId;
  private final TaskAttemptId taskAttemptId;
  private final String taskServerHost;

  public CompletedTask(UUID jobId, TaskAttemptId taskAttemptId, String taskServerHost) {
    this.jobId = Preconditions.checkNotNull(jobId, "jobId");
    this.taskAttemptId = Preconditions.checkNotNull(taskAttemptId, "taskAttemptId");
    this.taskServerHost = taskServerHost;
  }

  public UUID getJobId() {
    return jobId;
  }

  public TaskAttemptId getTaskAttemptId() {
    return taskAttemptId;
  }

  public String getTaskServerHost() {
    return taskServerHost;
  }

  @Override
  public String toString() {
    return taskAttemptId + "@" + taskServerHost;
  }
}
