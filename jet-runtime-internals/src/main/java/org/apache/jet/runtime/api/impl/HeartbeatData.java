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
import org.apache.jet.common.TaskProgress;
import org.apache.jet.records.TaskAttemptId;

import com.google.common.base.Preconditions;

/**
 * Information a task server sends to the job server with a heartbeat: either the status of the
 * server itself, or a change in the status of one of its task attempts.
 */
@Private
public class HeartbeatData implements Writable {

  public enum Kind {
    STATUS,
    TASK_STATUS_CHANGED
  }

  public enum TaskAttemptStatus {
    RUNNING,
    COMPLETED,
    ERROR,
    KILLED
  }

  private Kind kind;
  private String host;
  private int maxTaskCount;
  private UUID jobId;
  private TaskAttemptId taskAttemptId;
  private TaskAttemptStatus status;
  private TaskProgress progress;

  public HeartbeatData() {
  }

  public static HeartbeatData status(String host, int maxTaskCount) {
    HeartbeatData data = new HeartbeatData();
    data.kind = Kind.STATUS;
    data.host = Preconditions.checkNotNull(host, "host");
    data.maxTaskCount = maxTaskCount;
    return data;
  }

  public static HeartbeatData taskStatusChanged(UUID jobId, TaskAttemptId taskAttemptId,
      TaskAttemptStatus status, TaskProgress progress) {
    HeartbeatData data = new HeartbeatData();
    data.kind = Kind.TASK_STATUS_CHANGED;
    data.jobId = Preconditions.checkNotNull(jobId, "jobId");
    data.taskAttemptId = Preconditions.checkNotNull(taskAttemptId, "taskAttemptId");
    data.status = Preconditions.checkNotNull(status, "status");
    data.progress = progress;
    return data;
  }

  public Kind getKind() {
    return kind;
  }

  public String getHost() {
    checkKind(Kind.STATUS);
    return host;
  }

  public int getMaxTaskCount() {
    checkKind(Kind.STATUS);
    return maxTaskCount;
  }

  public UUID getJobId() {
    checkKind(Kind.TASK_STATUS_CHANGED);
    return jobId;
  }

  public TaskAttemptId getTaskAttemptId() {
    checkKind(Kind.TASK_STATUS_CHANGED);
    return taskAttemptId;
  }

  public TaskAttemptStatus getStatus() {
    checkKind(Kind.TASK_STATUS_CHANGED);
    return status;
  }

  public TaskProgress getProgress() {
    checkKind(Kind.TASK_STATUS_CHANGED);
    return progress;
  }

  private void checkKind(Kind expected) {
    Preconditions.checkState(kind == expected, "Heartbeat data of kind %s has no %s payload.",
        kind, expected);
  }

  @Override
  public void write(DataOutput out) throws IOException {
    WritableUtils.writeEnum(out, kind);
    switch (kind) {
    case STATUS:
      Text.writeString(out, host);
      WritableUtils.writeVInt(out, maxTaskCount);
      break;
    case TASK_STATUS_CHANGED:
      out.writeLong(jobId.getMostSignificantBits());
      out.writeLong(jobId.getLeastSignificantBits());
      Text.writeString(out, taskAttemptId.toString());
      WritableUtils.writeEnum(out, status);
      if (progress != null) {
        out.writeBoolean(true);
        progress.write(out);
      } else {
        out.writeBoolean(false);
      }
      break;
    default:
      throw new IllegalStateException("Unknown heartbeat data kind " + kind);
    }
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    kind = WritableUtils.readEnum(in, Kind.class);
    host = null;
    maxTaskCount = 0;
    jobId = null;
    taskAttemptId = null;
    status = null;
    progress = null;
    switch (kind) {
    case STATUS:
      host = Text.readString(in);
      maxTaskCount = WritableUtils.readVInt(in);
      break;
    case TASK_STATUS_CHANGED:
      jobId = new UUID(in.readLong(), in.readLong());
      taskAttemptId = TaskAttemptId.fromString(Text.readString(in));
      status = WritableUtils.readEnum(in, TaskAttemptStatus.class);
      if (in.readBoolean()) {
        progress = new TaskProgress();
        progress.readFields(in);
      }
      break;
    default:
      throw new IOException("Unknown heartbeat data kind " + kind);
    }
  }

  @Override
  public String toString() {
    if (kind == Kind.STATUS) {
      return "{ kind=" + kind + ", host=" + host + ", maxTaskCount=" + maxTaskCount + " }";
    }
    return "{ kind=" + kind + ", jobId=" + jobId + ", taskAttemptId=" + taskAttemptId
        + ", status=" + status + ", progress=" + progress + " }";
  }
}
