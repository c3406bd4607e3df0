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

package org.apache.jet.runtime.channels;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.channels.InputChannel;
import org.apache.jet.common.CompletedTask;
import org.apache.jet.io.HasAdditionalProgress;
import org.apache.jet.io.HasMetrics;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;
import org.apache.jet.jobs.ChannelConfiguration;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.MultiInputRecordReaderInfo;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.records.TaskId;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.common.io.FileRecordInput;
import org.apache.jet.runtime.task.TaskExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Reads the files written by the file output channels of an input stage. A polling thread asks
 * the job server which input tasks have completed, and adds the files of each completed task to
 * the channel's record reader as they become available.
 * <p/>
 * Only files on the local file system are read.
 */
@Private
public class FileInputChannel implements InputChannel, HasAdditionalProgress, HasMetrics {

  private static final Logger LOG = LoggerFactory.getLogger(FileInputChannel.class);

  private final TaskExecution taskExecution;
  private final TaskContext context;
  private final StageConfiguration inputStage;
  private final ChannelConfiguration channelConfiguration;
  private final List<TaskId> inputTaskIds;
  private final Configuration conf;
  private final FileSystem fs;
  private final CompressionCodec codec;
  private final long pollInterval;
  private final Object progressLock = new Object();
  private final Set<TaskId> tasksLeft = new LinkedHashSet<TaskId>();
  private int[] activePartitions;
  private int filesRetrieved;
  private int partitionsCompleted;
  private int totalPartitions;
  private volatile long localBytesRead;
  private MultiInputRecordReader<?> reader;
  private Thread pollThread;
  private volatile boolean closed;

  public FileInputChannel(TaskExecution taskExecution, StageConfiguration inputStage,
      int[] partitions) throws IOException {
    this.taskExecution = Preconditions.checkNotNull(taskExecution, "taskExecution");
    this.inputStage = Preconditions.checkNotNull(inputStage, "inputStage");
    Preconditions.checkNotNull(partitions, "partitions");
    Preconditions.checkArgument(partitions.length > 0, "No partitions assigned.");
    this.context = taskExecution.getContext();
    this.channelConfiguration = inputStage.getOutputChannel();
    this.activePartitions = partitions.clone();
    this.conf = context.getConfiguration();
    this.fs = FileSystem.getLocal(conf);
    this.codec = ConfigUtils.getIntermediateCompressionCodec(conf);
    this.pollInterval = conf.getLong(JetConfiguration.JET_FILE_CHANNEL_POLL_INTERVAL_MS,
        JetConfiguration.JET_FILE_CHANNEL_POLL_INTERVAL_MS_DEFAULT);

    StageConfiguration sendingStage = inputStage.getRoot();
    List<TaskId> taskIds = new ArrayList<TaskId>(sendingStage.getTaskCount());
    for (int x = 1; x <= sendingStage.getTaskCount(); ++x) {
      taskIds.add(new TaskId(sendingStage.getStageId(), x));
    }
    this.inputTaskIds = taskIds;
  }

  @Override
  public ChannelConfiguration getConfiguration() {
    return channelConfiguration;
  }

  @Override
  public StageConfiguration getInputStage() {
    return inputStage;
  }

  public List<TaskId> getInputTaskIds() {
    return inputTaskIds;
  }

  public int[] getActivePartitions() {
    synchronized (progressLock) {
      return activePartitions.clone();
    }
  }

  @Override
  public RecordReader<?> createRecordReader() throws IOException {
    Preconditions.checkState(reader == null,
        "A record reader for this channel was already created.");
    String type = channelConfiguration.getMultiInputRecordReaderType() == null
        ? JobComponentRegistry.MULTI_RECORD_READER
        : channelConfiguration.getMultiInputRecordReaderType();
    MultiInputRecordReaderInfo info = inputStage.getRegistry().getMultiInputRecordReader(type);
    if (info == null) {
      throw new JetUncheckedException("Unknown multi input record reader type " + type + ".");
    }
    int bufferSize = info.getBufferSizeKey() == null ? ConfigUtils.getReadBufferSize(conf)
        : conf.getInt(info.getBufferSizeKey(), info.getBufferSizeDefault());
    // The intermediate files hold the output records of the input stage, which need not be the
    // input records of this stage.
    Class<?> recordClass = info.getRecordClass(
        inputStage.getTaskTypeInfo().getOutputRecordClass());
    reader = info.getFactory().createReader(conf, recordClass, activePartitions,
        inputTaskIds.size(), context.getStageConfiguration().allowRecordReuse(), bufferSize);
    synchronized (progressLock) {
      totalPartitions = activePartitions.length;
    }
    startPollThread();
    return reader;
  }

  @Override
  public void assignAdditionalPartitions(int[] partitions) {
    Preconditions.checkNotNull(partitions, "partitions");
    Preconditions.checkState(reader != null, "The channel has no record reader.");
    joinPollThread();
    synchronized (progressLock) {
      Preconditions.checkState(tasksLeft.isEmpty(), "Cannot assign additional partitions until "
          + "the current partitions have all their input files.");
      filesRetrieved = 0;
      partitionsCompleted += activePartitions.length;
      activePartitions = partitions.clone();
      totalPartitions += partitions.length;
    }
    startPollThread();
  }

  @Override
  public float getAdditionalProgress() {
    synchronized (progressLock) {
      if (totalPartitions == 0 || inputTaskIds.isEmpty()) {
        return 0;
      }
      return (partitionsCompleted
          + (filesRetrieved * activePartitions.length) / (float) inputTaskIds.size())
          / totalPartitions;
    }
  }

  @Override
  public long getLocalBytesRead() {
    return localBytesRead;
  }

  @Override
  public long getLocalBytesWritten() {
    return 0;
  }

  @Override
  public long getNetworkBytesRead() {
    return 0;
  }

  @Override
  public long getNetworkBytesWritten() {
    return 0;
  }

  @Override
  public void close() throws IOException {
    closed = true;
    Thread thread = pollThread;
    if (thread != null) {
      thread.interrupt();
      joinPollThread();
    }
  }

  private void startPollThread() {
    synchronized (progressLock) {
      tasksLeft.clear();
      tasksLeft.addAll(inputTaskIds);
    }
    pollThread = new Thread(new Runnable() {
      @Override
      public void run() {
        pollForCompletedTasks();
      }
    }, "FileInputChannelPoll-" + context.getTaskAttemptId());
    pollThread.setDaemon(true);
    pollThread.start();
  }

  private void joinPollThread() {
    Thread thread = pollThread;
    if (thread != null) {
      try {
        thread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      pollThread = null;
    }
  }

  @VisibleForTesting
  void pollForCompletedTasks() {
    int[] partitions = getActivePartitions();
    LOG.info("Start checking for output file completion of {} tasks, {} partitions, "
        + "interval {}ms.", inputTaskIds.size(), partitions.length, pollInterval);
    try {
      while (!closed) {
        List<TaskId> waitingFor;
        synchronized (progressLock) {
          waitingFor = new ArrayList<TaskId>(tasksLeft);
        }
        if (waitingFor.isEmpty()) {
          break;
        }
        // Also keeps the task from timing out while it waits for its input.
        taskExecution.reportProgress();
        List<CompletedTask> completedTasks = taskExecution.getJobServer().getCompletedTasks(
            context.getJobId(), waitingFor);
        if (completedTasks != null && !completedTasks.isEmpty()) {
          LOG.info("Received {} new completed tasks.", completedTasks.size());
          for (CompletedTask task : completedTasks) {
            addCompletedTask(task, partitions);
          }
        }
        boolean hasTasksLeft;
        synchronized (progressLock) {
          hasTasksLeft = !tasksLeft.isEmpty();
        }
        if (hasTasksLeft) {
          Thread.sleep(pollInterval);
        }
      }
      if (closed) {
        LOG.info("Input poll thread stopped because the channel was closed.");
      } else {
        LOG.info("All files are available.");
        taskExecution.setChannelStatusMessage(null);
      }
    } catch (InterruptedException e) {
      LOG.info("Input poll thread interrupted.");
    } catch (IOException | RuntimeException e) {
      if (closed) {
        LOG.debug("Input poll thread failed after the channel was closed.", e);
      } else {
        LOG.error("Failed to retrieve the input files of task " + context.getTaskAttemptId()
            + ".", e);
        failReader();
      }
    }
  }

  private void addCompletedTask(CompletedTask task, int[] partitions) throws IOException {
    TaskId taskId = task.getTaskAttemptId().getTaskId();
    synchronized (progressLock) {
      if (!tasksLeft.remove(taskId)) {
        return;
      }
    }
    Path directory = FileOutputChannel.getOutputDirectory(context.getLocalJobDirectory(),
        task.getTaskAttemptId(), context.getStageConfiguration().getStageId());
    LOG.info("Using local input files from task {} for partitions {}.", task.getTaskAttemptId(),
        Arrays.toString(partitions));
    List<RecordInput> inputs = new ArrayList<RecordInput>(partitions.length);
    for (int partition : partitions) {
      Path file = new Path(directory, FileOutputChannel.getPartitionFileName(partition));
      localBytesRead += fs.getFileStatus(file).getLen();
      inputs.add(new FileRecordInput(conf, fs, file, reader.getRecordClass(), codec,
          reader.getBufferSize(), reader.isAllowRecordReuse()));
    }
    reader.addInput(inputs);
    int files;
    synchronized (progressLock) {
      files = ++filesRetrieved;
    }
    taskExecution.setChannelStatusMessage(String.format(Locale.ROOT,
        "Retrieved %d of %d input files.", files, inputTaskIds.size()));
  }

  private void failReader() {
    try {
      reader.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the channel record reader.", e);
    }
  }
}
