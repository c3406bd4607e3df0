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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.runtime.api.impl.HeartbeatData;
import org.apache.jet.runtime.api.impl.HeartbeatData.TaskAttemptStatus;
import org.apache.jet.runtime.api.impl.HeartbeatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

/**
 * Carries out the commands a task server receives in heartbeat responses. Task attempts run on
 * the supplied executor; their status changes are queued as heartbeat data for the next
 * heartbeat.
 */
@Private
public class HeartbeatResponseDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(HeartbeatResponseDispatcher.class);

  private static final String JOB_DIRECTORY_PREFIX = "job_";

  private final TaskRunner taskRunner;
  private final ListeningExecutorService executor;
  private final Configuration conf;
  private final Path localTaskDirectory;
  private final Path dfsJobsDirectory;
  private final Map<String, ListenableFuture<Boolean>> runningTasks =
      new ConcurrentHashMap<String, ListenableFuture<Boolean>>();
  private final Queue<HeartbeatData> pendingHeartbeatData =
      new ConcurrentLinkedQueue<HeartbeatData>();

  public HeartbeatResponseDispatcher(TaskRunner taskRunner, ListeningExecutorService executor,
      Configuration conf, Path localTaskDirectory, Path dfsJobsDirectory) {
    this.taskRunner = Preconditions.checkNotNull(taskRunner, "taskRunner");
    this.executor = Preconditions.checkNotNull(executor, "executor");
    this.conf = conf == null ? new Configuration() : conf;
    this.localTaskDirectory = Preconditions.checkNotNull(localTaskDirectory,
        "localTaskDirectory");
    this.dfsJobsDirectory = Preconditions.checkNotNull(dfsJobsDirectory, "dfsJobsDirectory");
  }

  public static Path getJobDirectory(Path parent, UUID jobId) {
    return new Path(parent, JOB_DIRECTORY_PREFIX + jobId);
  }

  public void dispatch(List<HeartbeatResponse> responses) throws IOException {
    if (responses == null) {
      return;
    }
    for (HeartbeatResponse response : responses) {
      LOG.debug("Received heartbeat response {}", response);
      switch (response.getCommand()) {
      case RUN_TASK:
        runTask(response.getJobId(), response.getTaskAttemptId());
        break;
      case KILL_TASK:
        killTask(response.getJobId(), response.getTaskAttemptId());
        break;
      case CLEANUP_JOB:
        cleanupJob(response.getJobId());
        break;
      default:
        throw new IllegalArgumentException("Unknown heartbeat command "
            + response.getCommand());
      }
    }
  }

  private void runTask(final UUID jobId, final TaskAttemptId taskAttemptId) {
    final String key = getTaskKey(jobId, taskAttemptId);
    if (runningTasks.containsKey(key)) {
      LOG.warn("Task {} of job {} is already running.", taskAttemptId, jobId);
      return;
    }
    final Path localJobDirectory = getJobDirectory(localTaskDirectory, jobId);
    final Path dfsJobDirectory = getJobDirectory(dfsJobsDirectory, jobId);
    pendingHeartbeatData.add(HeartbeatData.taskStatusChanged(jobId, taskAttemptId,
        TaskAttemptStatus.RUNNING, null));
    ListenableFuture<Boolean> future = executor.submit(new Callable<Boolean>() {
      @Override
      public Boolean call() {
        return taskRunner.run(jobId, localJobDirectory, dfsJobDirectory, taskAttemptId);
      }
    });
    runningTasks.put(key, future);
    Futures.addCallback(future, new FutureCallback<Boolean>() {
      @Override
      public void onSuccess(Boolean result) {
        runningTasks.remove(key);
        pendingHeartbeatData.add(HeartbeatData.taskStatusChanged(jobId, taskAttemptId,
            Boolean.TRUE.equals(result) ? TaskAttemptStatus.COMPLETED : TaskAttemptStatus.ERROR,
            null));
      }

      @Override
      public void onFailure(Throwable t) {
        runningTasks.remove(key);
        if (t instanceof CancellationException) {
          LOG.info("Task {} of job {} was killed.", taskAttemptId, jobId);
          pendingHeartbeatData.add(HeartbeatData.taskStatusChanged(jobId, taskAttemptId,
              TaskAttemptStatus.KILLED, null));
        } else {
          LOG.error("Task " + taskAttemptId + " of job " + jobId + " failed.", t);
          pendingHeartbeatData.add(HeartbeatData.taskStatusChanged(jobId, taskAttemptId,
              TaskAttemptStatus.ERROR, null));
        }
      }
    }, MoreExecutors.directExecutor());
  }

  private void killTask(UUID jobId, TaskAttemptId taskAttemptId) {
    ListenableFuture<Boolean> future = runningTasks.get(getTaskKey(jobId, taskAttemptId));
    if (future == null) {
      LOG.warn("Cannot kill task {} of job {}: it is not running.", taskAttemptId, jobId);
    } else {
      LOG.info("Killing task {} of job {}.", taskAttemptId, jobId);
      future.cancel(true);
    }
  }

  private void cleanupJob(UUID jobId) throws IOException {
    Path jobDirectory = getJobDirectory(localTaskDirectory, jobId);
    FileSystem fs = FileSystem.getLocal(conf);
    if (fs.exists(jobDirectory)) {
      LOG.info("Deleting local job directory {}.", jobDirectory);
      fs.delete(jobDirectory, true);
    }
  }

  /**
   * Removes and returns the task status changes queued since the last call.
   */
  public List<HeartbeatData> drainPendingHeartbeatData() {
    List<HeartbeatData> result = new ArrayList<HeartbeatData>();
    HeartbeatData data;
    while ((data = pendingHeartbeatData.poll()) != null) {
      result.add(data);
    }
    return result;
  }

  public int getRunningTaskCount() {
    return runningTasks.size();
  }

  private static String getTaskKey(UUID jobId, TaskAttemptId taskAttemptId) {
    return jobId + "/" + taskAttemptId;
  }
}
