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

package org.apache.jet.records;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;

import com.google.common.base.Preconditions;

/**
 * TaskAttemptId identifies one execution attempt of a task. The string form is the task id
 * followed by {@link #ATTEMPT_NUMBER_SEPARATOR} and the 1-based attempt number, for example
 * <code>Map-003_2</code>.
 *
 * @see TaskId
 */
@InterfaceAudience.Public
@InterfaceStability.Stable
public final class TaskAttemptId implements Comparable<TaskAttemptId> {

  public static final char ATTEMPT_NUMBER_SEPARATOR = '_';

  private final TaskId taskId;
  private final int attempt;
  private final String attemptId;

  public TaskAttemptId(TaskId taskId, int attempt) {
    Preconditions.checkNotNull(taskId, "taskId");
    Preconditions.checkArgument(attempt >= 1, "The attempt number must be at least 1.");
    this.taskId = taskId;
    this.attempt = attempt;
    this.attemptId = taskId.toString() + ATTEMPT_NUMBER_SEPARATOR + attempt;
  }

  public static TaskAttemptId fromString(String attemptIdStr) {
    Preconditions.checkNotNull(attemptIdStr, "attemptIdStr");
    int separator = attemptIdStr.lastIndexOf(ATTEMPT_NUMBER_SEPARATOR);
    Preconditions.checkArgument(separator > 0,
        "Task attempt ID %s doesn't have the format TaskId_Attempt.", attemptIdStr);
    int attempt;
    try {
      attempt = Integer.parseInt(attemptIdStr.substring(separator + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid attempt number in task attempt ID "
          + attemptIdStr, e);
    }
    return new TaskAttemptId(TaskId.fromString(attemptIdStr.substring(0, separator)), attempt);
  }

  public TaskId getTaskId() {
    return taskId;
  }

  public int getAttempt() {
    return attempt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TaskAttemptId that = (TaskAttemptId) o;
    return attempt == that.attempt && taskId.equals(that.taskId);
  }

  @Override
  public int hashCode() {
    return attemptId.hashCode();
  }

  @Override
  public int compareTo(TaskAttemptId other) {
    return attemptId.compareTo(other.attemptId);
  }

  @Override
  public String toString() {
    return attemptId;
  }
}
