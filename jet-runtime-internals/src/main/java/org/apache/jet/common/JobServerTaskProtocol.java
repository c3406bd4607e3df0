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

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;
import org.apache.jet.records.TaskId;

/**
 * Protocol used by running tasks to coordinate partition assignment and input availability
 * with the job server.
 */
@InterfaceAudience.Private
@InterfaceStability.Evolving
public interface JobServerTaskProtocol {

  /**
   * Returns the partitions initially assigned to a task, or <code>null</code> if the task
   * only handles the partition matching its task number.
   */
  int[] getPartitionsForTask(UUID jobId, TaskId taskId) throws IOException;

  /**
   * Called by a task before it starts processing a partition.
   * @return <code>false</code> if the partition was reassigned to another task and must be
   *         skipped
   */
  boolean notifyStartPartitionProcessing(UUID jobId, TaskId taskId, int partitionNumber)
      throws IOException;

  /**
   * Asks for more partitions once a task has finished all the partitions it holds.
   * @return the new partitions, or an empty array if there are none
   */
  int[] getAdditionalPartitions(UUID jobId, TaskId taskId) throws IOException;

  /**
   * Returns the tasks among <code>taskIds</code> whose output is available.
   */
  List<CompletedTask> getCompletedTasks(UUID jobId, Collection<TaskId> taskIds)
      throws IOException;
}
