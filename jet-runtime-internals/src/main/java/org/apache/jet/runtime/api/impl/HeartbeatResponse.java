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

package org.apache.jet.runtime.api.impl;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.WritableUtils;
import org.apache.jet.records.TaskAttemptId;

import com.google.common.base.Preconditions;

/**
 * A command sent by the job server in reply to a task server heartbeat. The command tag is
 * written first and decides which fields follow.
 */
@Private
public class HeartbeatResponse implements Writable {

  public enum Command {
    RUN_TASK,
    KILL_TASK,
    CLEANUP_JOB
  }

  private Command command;
  private UUID jobId;
  private TaskAttemptId taskAttemptId;

  public HeartbeatResponse() {
  }

  private HeartbeatResponse(Command command, UUID jobId, TaskAttemptId taskAttemptId) {
    this.command = command;
    this.jobId = Preconditions.checkNotNull(jobId, "jobId");
    this.taskAttemptId = taskAttemptId;
  }

  public static HeartbeatResponse runTask(UUID jobId, TaskAttemptId taskAttemptId) {
    return new HeartbeatResponse(Command.RUN_TASK, jobId,
        Preconditions.checkNotNull(taskAttemptId, "taskAttemptId"));
  }

  public static HeartbeatResponse killTask(UUID jobId, TaskAttemptId taskAttemptId) {
    return new HeartbeatResponse(Command.KILL_TASK, jobId,
        Preconditions.checkNotNull(taskAttemptId, "taskAttemptId"));
  }

  public static HeartbeatResponse cleanupJob(UUID jobId) {
    return new HeartbeatResponse(Command.CLEANUP_JOB, jobId, null);
  }

  public Command getCommand() {
    return command;
  }

  public UUID getJobId() {
    return jobId;
  }

  /**
   * @return the task attempt to run or kill; <code>null</code> for {@link Command#CLEANUP_JOB}
   */
  public TaskAttemptId getTaskAttemptId() {
    return taskAttemptId;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    WritableUtils.writeEnum(out, command);
    out.writeLong(jobId.getMostSignificantBits());
    out.writeLong(jobId.getLeastSignificantBits());
    if (command != Command.CLEANUP_JOB) {
      Text.writeString(out, taskAttemptId.toString());
    }
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    command = WritableUtils.readEnum(in, Command.class);
    jobId = new UUID(in.readLong(), in.readLong());
    if (command != Command.CLEANUP_JOB) {
      taskAttemptId = TaskAttemptId.fromString(Text.readString(in));
    } else {
      taskAttemptId = null;
    }
  }

  @Override
  public String toString() {
    return "{ command=" + command
        + ", jobId=" + jobId
        + (taskAttemptId == null ? "" : ", taskAttemptId=" + taskAttemptId)
        + " }";
  }
}
