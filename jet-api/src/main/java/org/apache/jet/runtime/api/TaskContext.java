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

package org.apache.jet.runtime.api;

import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.jet.jobs.JobConfiguration;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.jobs.TaskInput;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.records.TaskId;

/**
 * The execution state of one task attempt, made available to tasks, data inputs and outputs.
 * This interface is not supposed to be implemented by users.
 */
@Public
public interface TaskContext {

  public UUID getJobId();

  public JobConfiguration getJobConfiguration();

  public StageConfiguration getStageConfiguration();

  public TaskAttemptId getTaskAttemptId();

  public TaskId getTaskId();

  /**
   * Get the local directory holding the job configuration and intermediate files
   * @return the local job directory
   */
  public Path getLocalJobDirectory();

  /**
   * Get the directory on the distributed file system where output is committed
   * @return the DFS job directory
   */
  public Path getDfsJobDirectory();

  /**
   * Returns the job settings overlaid with the stage settings.
   */
  public Configuration getConfiguration();

  /**
   * Returns the input assigned to this task if the stage reads from a data input, otherwise
   * <code>null</code>.
   */
  public TaskInput getTaskInput();

  public String getStatusMessage();

  /**
   * Sets this task's part of the composite status reported to the coordinator.
   */
  public void setStatusMessage(String message);

  /**
   * Forces the next progress interval to send a report, even if nothing changed.
   */
  public void reportProgress();
}
