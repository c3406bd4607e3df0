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

import java.util.Locale;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;

import com.google.common.base.Preconditions;

/**
 * TaskId represents the immutable identifier of a task: a stage id and a task number,
 * formatted as <code>StageId-001</code>. Tasks of a stage that is fused into its parent through
 * a pipeline channel carry their parent's id, separated by {@link #CHILD_STAGE_SEPARATOR}, for
 * example <code>Map-003.Sort-001</code>.
 * <p/>
 * Ordering is ordinal on the string form; equality is structural.
 *
 * @see TaskAttemptId
 */
@InterfaceAudience.Public
@InterfaceStability.Stable
public final class TaskId implements Comparable<TaskId> {

  public static final char CHILD_STAGE_SEPARATOR = '.';
  public static final char TASK_NUMBER_SEPARATOR = '-';

  private final String taskId;
  private final String stageId;
  private final int taskNumber;
  private final TaskId parentTaskId;

  public TaskId(String stageId, int taskNumber) {
    this(null, stageId, taskNumber);
  }

  public TaskId(TaskId parentTaskId, String stageId, int taskNumber) {
    String localId = createTaskIdString(stageId, taskNumber);
    this.stageId = stageId;
    this.taskNumber = taskNumber;
    this.parentTaskId = parentTaskId;
    this.taskId = parentTaskId == null ? localId
        : parentTaskId.toString() + CHILD_STAGE_SEPARATOR + localId;
  }

  private TaskId(TaskId parentTaskId, String taskId, String stageId, int taskNumber) {
    this.parentTaskId = parentTaskId;
    this.taskId = taskId;
    this.stageId = stageId;
    this.taskNumber = taskNumber;
  }

  /**
   * Parses a task id string, including any parent task ids.
   * @throws IllegalArgumentException if the string is not a valid task id
   */
  public static TaskId fromString(String taskIdStr) {
    Preconditions.checkNotNull(taskIdStr, "taskIdStr");
    TaskId parent = null;
    String localId = taskIdStr;
    int lastSeparator = taskIdStr.lastIndexOf(CHILD_STAGE_SEPARATOR);
    if (lastSeparator >= 0) {
      parent = fromString(taskIdStr.substring(0, lastSeparator));
      localId = taskIdStr.substring(lastSeparator + 1);
    }
    String[] parts = localId.split(String.valueOf(TASK_NUMBER_SEPARATOR), -1);
    Preconditions.checkArgument(parts.length == 2 && !parts[0].isEmpty(),
        "Task ID %s doesn't have the format StageId-Number.", taskIdStr);
    int number;
    try {
      number = Integer.parseInt(parts[1]);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid task number in task ID " + taskIdStr, e);
    }
    return new TaskId(parent, taskIdStr, parts[0], number);
  }

  /**
   * Creates the string form of a task id without a parent.
   */
  public static String createTaskIdString(String stageId, int taskNumber) {
    Preconditions.checkNotNull(stageId, "stageId");
    Preconditions.checkArgument(taskNumber >= 0, "Task number cannot be less than zero.");
    Preconditions.checkArgument(isValidStageId(stageId),
        "The characters '-', '.' and '_' may not occur in a stage ID.");
    return String.format(Locale.ROOT, "%s%c%03d", stageId, TASK_NUMBER_SEPARATOR, taskNumber);
  }

  /**
   * Checks that a stage id contains none of the characters used as separators in task and
   * task attempt ids.
   */
  public static boolean isValidStageId(String stageId) {
    return stageId.indexOf(CHILD_STAGE_SEPARATOR) < 0
        && stageId.indexOf(TASK_NUMBER_SEPARATOR) < 0
        && stageId.indexOf(TaskAttemptId.ATTEMPT_NUMBER_SEPARATOR) < 0;
  }

  public TaskId getParentTaskId() {
    return parentTaskId;
  }

  public String getStageId() {
    return stageId;
  }

  /** Returns the 1-based number of this task within its stage. */
  public int getTaskNumber() {
    return taskNumber;
  }

  /**
   * Returns the stage ids of this task and its parents, joined by the child stage separator.
   */
  public String getCompoundStageId() {
    if (parentTaskId == null) {
      return stageId;
    }
    return parentTaskId.getCompoundStageId() + CHILD_STAGE_SEPARATOR + stageId;
  }

  /**
   * Returns the 1-based partition this task works on. A child task that is not internally
   * partitioned works on its parent's partition.
   */
  public int getPartitionNumber() {
    if (parentTaskId == null || taskNumber > 1) {
      return taskNumber;
    }
    return parentTaskId.getPartitionNumber();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return taskId.equals(((TaskId) o).taskId);
  }

  @Override
  public int hashCode() {
    return taskId.hashCode();
  }

  @Override
  public int compareTo(TaskId other) {
    return taskId.compareTo(other.taskId);
  }

  @Override
  public String toString() {
    return taskId;
  }
}
