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
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.util.StringUtils;
import org.apache.jet.common.JobServerTaskProtocol;
import org.apache.jet.common.TaskMetrics;
import org.apache.jet.common.TaskUmbilicalProtocol;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.JobConfiguration;
import org.apache.jet.records.TaskAttemptId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

/**
 * Runs task attempts for a task server: loads the job configuration from the local job
 * directory, executes the attempt and reports its completion or failure over the umbilical.
 */
@Private
public class TaskRunner {

  private static final Logger LOG = LoggerFactory.getLogger(TaskRunner.class);

  private final Configuration conf;
  private final JobComponentRegistry registry;
  private final TaskUmbilicalProtocol umbilical;
  private final JobServerTaskProtocol jobServer;

  public TaskRunner(Configuration conf, JobComponentRegistry registry,
      TaskUmbilicalProtocol umbilical, JobServerTaskProtocol jobServer) {
    this.conf = conf == null ? new Configuration() : conf;
    this.registry = Preconditions.checkNotNull(registry, "registry");
    this.umbilical = Preconditions.checkNotNull(umbilical, "umbilical");
    this.jobServer = Preconditions.checkNotNull(jobServer, "jobServer");
  }

  /**
   * Runs a task attempt to completion.
   *
   * @return <code>true</code> if the attempt succeeded
   */
  public boolean run(UUID jobId, Path localJobDirectory, Path dfsJobDirectory,
      TaskAttemptId taskAttemptId) {
    LOG.info("Running task {} of job {}.", taskAttemptId, jobId);
    long start = System.currentTimeMillis();
    try {
      JobConfiguration job = JobConfiguration.loadJson(conf,
          new Path(localJobDirectory, JobConfiguration.JOB_CONFIG_FILE_NAME), registry);
      TaskMetrics metrics;
      try (TaskExecution execution = TaskExecution.create(conf, jobServer, umbilical, jobId, job,
          taskAttemptId, localJobDirectory, dfsJobDirectory)) {
        metrics = execution.runTask();
      }
      umbilical.reportCompletion(jobId, taskAttemptId, metrics);
      LOG.info("Task {} completed in {}ms.", taskAttemptId, System.currentTimeMillis() - start);
      return true;
    } catch (Throwable t) {
      if (Thread.currentThread().isInterrupted() || isInterruption(t)) {
        // Killed attempts are not reported as errors.
        LOG.info("Task {} was interrupted.", taskAttemptId);
        Thread.currentThread().interrupt();
        return false;
      }
      LOG.error("Error running task " + taskAttemptId + ".", t);
      try {
        umbilical.reportError(jobId, taskAttemptId, StringUtils.stringifyException(t));
      } catch (IOException e) {
        LOG.warn("Failed to report the error of task " + taskAttemptId + ".", e);
      }
      return false;
    }
  }

  private static boolean isInterruption(Throwable t) {
    for (Throwable cause : Throwables.getCausalChain(t)) {
      if (cause instanceof InterruptedException || cause instanceof InterruptedIOException
          || cause instanceof ClosedByInterruptException) {
        return true;
      }
    }
    return false;
  }
}
