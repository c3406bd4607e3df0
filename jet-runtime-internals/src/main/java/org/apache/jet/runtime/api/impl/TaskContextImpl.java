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

import java.util.Map;
import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.jobs.JobConfiguration;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.jobs.TaskInput;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.records.TaskId;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.task.TaskExecution;

import com.google.common.base.Preconditions;

@Private
public class TaskContextImpl implements TaskContext {

  private final UUID jobId;
  private final JobConfiguration jobConfiguration;
  private final StageConfiguration stageConfiguration;
  private final TaskAttemptId taskAttemptId;
  private final Path localJobDirectory;
  private final Path dfsJobDirectory;
  private final Configuration configuration;
  private final TaskExecution taskExecution;
  private TaskInput taskInput;

  /**
   * @param baseConf configuration the job and stage settings are applied to; stage settings
   *          take precedence over job settings
   * @param rootAttemptId attempt of the outermost task, whose local directory holds the
   *          intermediate files of every task in the attempt
   */
  public TaskContextImpl(Configuration baseConf, UUID jobId, JobConfiguration jobConfiguration,
      StageConfiguration stageConfiguration, TaskAttemptId taskAttemptId,
      TaskAttemptId rootAttemptId, Path localJobDirectory, Path dfsJobDirectory,
      TaskExecution taskExecution) {
    this.jobId = Preconditions.checkNotNull(jobId, "jobId");
    this.jobConfiguration = Preconditions.checkNotNull(jobConfiguration, "jobConfiguration");
    this.stageConfiguration = Preconditions.checkNotNull(stageConfiguration,
        "stageConfiguration");
    this.taskAttemptId = Preconditions.checkNotNull(taskAttemptId, "taskAttemptId");
    this.localJobDirectory = Preconditions.checkNotNull(localJobDirectory, "localJobDirectory");
    this.dfsJobDirectory = Preconditions.checkNotNull(dfsJobDirectory, "dfsJobDirectory");
    this.taskExecution = Preconditions.checkNotNull(taskExecution, "taskExecution");

    Configuration conf = baseConf == null ? new Configuration() : new Configuration(baseConf);
    applySettings(conf, jobConfiguration.getSettings());
    applySettings(conf, stageConfiguration.getSettings());
    if (conf.get(JetConfiguration.JET_MERGE_INTERMEDIATE_OUTPUT_DIR) == null) {
      conf.set(JetConfiguration.JET_MERGE_INTERMEDIATE_OUTPUT_DIR,
          new Path(localJobDirectory, rootAttemptId.toString()).toString());
    }
    this.configuration = conf;
  }

  private static void applySettings(Configuration conf, Map<String, String> settings) {
    if (settings != null) {
      for (Map.Entry<String, String> entry : settings.entrySet()) {
        conf.set(entry.getKey(), entry.getValue());
      }
    }
  }

  @Override
  public UUID getJobId() {
    return jobId;
  }

  @Override
  public JobConfiguration getJobConfiguration() {
    return jobConfiguration;
  }

  @Override
  public StageConfiguration getStageConfiguration() {
    return stageConfiguration;
  }

  @Override
  public TaskAttemptId getTaskAttemptId() {
    return taskAttemptId;
  }

  @Override
  public TaskId getTaskId() {
    return taskAttemptId.getTaskId();
  }

  @Override
  public Path getLocalJobDirectory() {
    return localJobDirectory;
  }

  @Override
  public Path getDfsJobDirectory() {
    return dfsJobDirectory;
  }

  @Override
  public Configuration getConfiguration() {
    return configuration;
  }

  @Override
  public TaskInput getTaskInput() {
    return taskInput;
  }

  public void setTaskInput(TaskInput taskInput) {
    this.taskInput = taskInput;
  }

  @Override
  public String getStatusMessage() {
    return taskExecution.getTaskStatusMessage();
  }

  @Override
  public void setStatusMessage(String message) {
    taskExecution.setTaskStatusMessage(message);
  }

  @Override
  public void reportProgress() {
    taskExecution.reportProgress();
  }

  @Override
  public String toString() {
    return "TaskContext{jobId=" + jobId + ", taskAttemptId=" + taskAttemptId + "}";
  }
}
