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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.channels.InputChannel;
import org.apache.jet.channels.OutputChannel;
import org.apache.jet.channels.TcpChannelProvider;
import org.apache.jet.common.JobServerTaskProtocol;
import org.apache.jet.common.TaskMetrics;
import org.apache.jet.common.TaskProgress;
import org.apache.jet.common.TaskUmbilicalProtocol;
import org.apache.jet.io.HasAdditionalProgress;
import org.apache.jet.io.HasMetrics;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.Partitioner;
import org.apache.jet.io.ReaderRecordInput;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.jobs.ChannelType;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.JobConfiguration;
import org.apache.jet.jobs.MultiInputRecordReaderInfo;
import org.apache.jet.jobs.OutputCommitter;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.jobs.TaskInput;
import org.apache.jet.jobs.TaskTypeInfo;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.records.TaskId;
import org.apache.jet.runtime.api.PushTask;
import org.apache.jet.runtime.api.Task;
import org.apache.jet.runtime.api.impl.TaskContextImpl;
import org.apache.jet.runtime.channels.FileInputChannel;
import org.apache.jet.runtime.channels.FileOutputChannel;
import org.apache.jet.runtime.channels.PipelineOutputChannel;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.input.MultiRecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

/**
 * Runs a single task attempt: creates the task's input and output, runs the task once per input
 * partition, reports progress to the task server and collects the task's metrics.
 * <p/>
 * A task of a compound stage is represented by a tree of executions. Only the root execution is
 * run; the executions of the child stages are driven through the pipeline output channel of
 * their parent.
 */
@Private
public class TaskExecution implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(TaskExecution.class);

  private static final int CHANNEL_STATUS_LEVEL = 0;

  private final Configuration baseConf;
  private final JobServerTaskProtocol jobServer;
  private final TaskUmbilicalProtocol umbilical;
  private final TaskContextImpl context;
  private final StageConfiguration stage;
  private final TaskTypeInfo<?, ?> taskType;
  private final TaskExecution parent;
  private final TaskExecution rootTask;
  private final int statusLevel;
  private final boolean processesAllInputPartitions;
  private final List<TaskExecution> childTasks = new ArrayList<TaskExecution>();
  private final List<InputChannel> inputChannels = new ArrayList<InputChannel>();
  private final List<OutputCommitter> dataOutputs = new ArrayList<OutputCommitter>();
  private final OutputChannel outputChannel;

  // Guards the task instance and the partition counters read by the progress thread.
  private final Object taskProgressLock = new Object();

  private RecordReader<?> inputReader;
  private RecordWriter<?> outputWriter;
  private Task<?, ?> task;
  private boolean hasAddedTaskProgressSource;
  private PipelinePullTaskRecordWriter<?, ?> pipelinePullTaskRecordWriter;
  private PipelinePrepartitionedPushTaskRecordWriter<?, ?> pipelinePrepartitionedPushTaskRecordWriter;
  private boolean inputChannelsCreated;
  private boolean hasRun;
  private boolean closed;
  private int inputPartitionsFinished;
  private int totalInputPartitions;
  private int discardedPartitions;
  private int additionalPartitions;
  private int[] partitions;

  // Only used by the root execution.
  private final List<String> statusMessages;
  private final Map<String, List<HasAdditionalProgress>> additionalProgressSources;
  private final AtomicBoolean mustReportProgress = new AtomicBoolean();
  private final CountDownLatch finishedEvent;
  private Thread progressThread;

  private TaskExecution(Configuration baseConf, JobServerTaskProtocol jobServer,
      TaskUmbilicalProtocol umbilical, UUID jobId, JobConfiguration job,
      StageConfiguration stage, TaskAttemptId taskAttemptId, Path localJobDirectory,
      Path dfsJobDirectory, TaskExecution parent) throws IOException {
    this.baseConf = baseConf;
    this.jobServer = jobServer;
    this.umbilical = umbilical;
    this.stage = stage;
    this.taskType = stage.getTaskTypeInfo();
    Preconditions.checkArgument(taskType != null, "Stage %s has no known task type.",
        stage.getStageId());
    this.parent = parent;
    if (parent == null) {
      rootTask = this;
      statusLevel = 1;
      processesAllInputPartitions = taskType.processesAllInputPartitions();
      statusMessages = Collections.synchronizedList(new ArrayList<String>());
      additionalProgressSources = Collections.synchronizedMap(
          new LinkedHashMap<String, List<HasAdditionalProgress>>());
      finishedEvent = new CountDownLatch(1);
    } else {
      rootTask = parent.rootTask;
      statusLevel = parent.statusLevel + 1;
      processesAllInputPartitions = rootTask.processesAllInputPartitions;
      statusMessages = null;
      additionalProgressSources = null;
      finishedEvent = null;
    }
    this.context = new TaskContextImpl(baseConf, jobId, job, stage, taskAttemptId,
        rootTask == this ? taskAttemptId : rootTask.context.getTaskAttemptId(),
        localJobDirectory, dfsJobDirectory, this);
    this.outputChannel = createOutputChannel();
  }

  /**
   * Creates the execution of the task attempt, together with the executions of the child stages
   * pipelined with it.
   */
  public static TaskExecution create(Configuration conf, JobServerTaskProtocol jobServer,
      TaskUmbilicalProtocol umbilical, UUID jobId, JobConfiguration job,
      TaskAttemptId taskAttemptId, Path localJobDirectory, Path dfsJobDirectory)
      throws IOException {
    Preconditions.checkNotNull(jobServer, "jobServer");
    Preconditions.checkNotNull(umbilical, "umbilical");
    Preconditions.checkNotNull(job, "job");
    Preconditions.checkNotNull(taskAttemptId, "taskAttemptId");
    StageConfiguration stage = job.getStage(taskAttemptId.getTaskId().getStageId());
    Preconditions.checkArgument(stage != null, "Job has no stage %s.",
        taskAttemptId.getTaskId().getStageId());
    return new TaskExecution(conf, jobServer, umbilical, jobId, job, stage, taskAttemptId,
        localJobDirectory, dfsJobDirectory, null);
  }

  /**
   * Creates the execution of a task of a child stage that receives its input from this task.
   */
  public TaskExecution createChildTask(StageConfiguration childStage, int taskNumber)
      throws IOException {
    Preconditions.checkNotNull(childStage, "childStage");
    TaskId childTaskId = new TaskId(context.getTaskId(), childStage.getStageId(), taskNumber);
    TaskAttemptId childAttemptId = new TaskAttemptId(childTaskId,
        context.getTaskAttemptId().getAttempt());
    TaskExecution child = new TaskExecution(baseConf, jobServer, umbilical, context.getJobId(),
        context.getJobConfiguration(), childStage, childAttemptId,
        context.getLocalJobDirectory(), context.getDfsJobDirectory(), this);
    childTasks.add(child);
    return child;
  }

  public TaskContextImpl getContext() {
    return context;
  }

  public TaskExecution getParent() {
    return parent;
  }

  public TaskExecution getRootTask() {
    return rootTask;
  }

  public boolean isChildTask() {
    return parent != null;
  }

  public List<TaskExecution> getChildTasks() {
    return Collections.unmodifiableList(childTasks);
  }

  public JobServerTaskProtocol getJobServer() {
    return jobServer;
  }

  public List<InputChannel> getInputChannels() {
    return Collections.unmodifiableList(inputChannels);
  }

  public OutputChannel getOutputChannel() {
    return outputChannel;
  }

  public boolean processesAllInputPartitions() {
    return processesAllInputPartitions;
  }

  public int getInputPartitionsFinished() {
    synchronized (taskProgressLock) {
      return inputPartitionsFinished;
    }
  }

  public int getTotalInputPartitions() {
    synchronized (taskProgressLock) {
      return totalInputPartitions;
    }
  }

  public int getDiscardedPartitions() {
    return discardedPartitions;
  }

  public int getAdditionalPartitions() {
    return additionalPartitions;
  }

  /**
   * Runs the task, and returns its metrics once the output has been committed.
   */
  public TaskMetrics runTask() throws IOException {
    checkNotClosed();
    Preconditions.checkState(!isChildTask(), "A child task cannot be run directly.");
    Preconditions.checkState(!hasRun, "This task has already been run.");
    hasRun = true;

    RecordReader<?> input = getInputReader();
    RecordWriter<?> output = getOutputWriter();
    // Create the task before the progress thread starts so its progress source is registered.
    getTask();

    startProgressThread();

    long start = System.nanoTime();
    if (usesMultipleInputPartitions()) {
      runTaskMultipleInputPartitions((MultiInputRecordReader<?>) input, output);
    } else {
      callTaskRunMethod(input, output);
    }
    long executionTime = System.nanoTime() - start;

    long waitTime = input instanceof MultiRecordReader
        ? ((MultiRecordReader<?>) input).getWaitTimeNanos() : 0;
    LOG.info("Task finished execution, execution time: {}ms; time spent waiting for input: {}ms.",
        TimeUnit.NANOSECONDS.toMillis(executionTime), TimeUnit.NANOSECONDS.toMillis(waitTime));

    TaskMetrics metrics = new TaskMetrics();
    finalizeTask(metrics);
    metrics.logMetrics();
    return metrics;
  }

  private void runTaskMultipleInputPartitions(MultiInputRecordReader<?> input,
      RecordWriter<?> output) throws IOException {
    if (processesAllInputPartitions) {
      MultiPartitionRecordReader<?> partitionReader =
          new MultiPartitionRecordReader<Object>(this, castReader(input));
      try {
        LOG.info("Running task over all input partitions.");
        callTaskRunMethod(partitionReader, output);
      } finally {
        partitionReader.close();
      }
    } else {
      synchronized (taskProgressLock) {
        totalInputPartitions = input.getPartitionCount();
      }
      boolean firstPartition = true;
      do {
        LOG.info("Running task for partition {}.", input.getCurrentPartition());
        if (firstPartition) {
          firstPartition = false;
        } else {
          resetForNextPartition();
        }
        callTaskRunMethod(input, output);
        LOG.info("Finished running task for partition {}.", input.getCurrentPartition());
      } while (nextInputPartition(input, true));
    }
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private static MultiInputRecordReader<Object> castReader(MultiInputRecordReader<?> reader) {
    return (MultiInputRecordReader) reader;
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private void callTaskRunMethod(RecordReader<?> input, RecordWriter<?> output)
      throws IOException {
    Task rawTask = getTask();
    try {
      rawTask.run(input, output);
    } catch (Exception e) {
      Throwables.throwIfInstanceOf(e, IOException.class);
      Throwables.throwIfUnchecked(e);
      throw new IOException("Task " + context.getTaskAttemptId() + " failed.", e);
    }
    finishTask();
  }

  /**
   * Moves the reader to its next partition, skipping partitions whose assignment was revoked,
   * and asks the job server for additional partitions once the assigned ones are exhausted.
   *
   * @return <code>true</code> if the reader is positioned on a new partition
   */
  public boolean nextInputPartition(MultiInputRecordReader<?> reader,
      boolean allowAdditionalPartitions) throws IOException {
    boolean result = reader.nextPartition(this::notifyStartPartitionProcessing)
        || (allowAdditionalPartitions && getAdditionalPartitions(reader)
            && reader.nextPartition(this::notifyStartPartitionProcessing));
    if (result) {
      notifyPartitionChanged(reader.getCurrentPartition());
    }
    return result;
  }

  private void notifyPartitionChanged(int partitionNumber) throws IOException {
    if (outputWriter instanceof PartitionDfsOutputRecordWriter) {
      ((PartitionDfsOutputRecordWriter<?>) outputWriter).partitionChanged(partitionNumber);
    }
    for (TaskExecution child : childTasks) {
      child.notifyPartitionChanged(partitionNumber);
    }
  }

  boolean notifyStartPartitionProcessing(int partitionNumber) throws IOException {
    if (isDynamicPartitionAssignmentDisabled()) {
      return true;
    }
    boolean result = jobServer.notifyStartPartitionProcessing(context.getJobId(),
        context.getTaskId(), partitionNumber);
    if (!result) {
      LOG.info("Assignment of partition {} has been revoked; skipping.", partitionNumber);
      ++discardedPartitions;
      if (!processesAllInputPartitions) {
        synchronized (taskProgressLock) {
          --totalInputPartitions;
        }
      }
    }
    return result;
  }

  private boolean getAdditionalPartitions(MultiInputRecordReader<?> reader) throws IOException {
    if (isDynamicPartitionAssignmentDisabled()) {
      return false;
    }
    int[] newPartitions = jobServer.getAdditionalPartitions(context.getJobId(),
        context.getTaskId());
    if (newPartitions == null || newPartitions.length == 0) {
      return false;
    }
    LOG.info("Received additional partitions for processing: {}", Arrays.toString(newPartitions));
    additionalPartitions += newPartitions.length;
    if (!processesAllInputPartitions) {
      synchronized (taskProgressLock) {
        totalInputPartitions += newPartitions.length;
      }
    }
    reader.assignAdditionalPartitions(newPartitions);
    for (InputChannel channel : inputChannels) {
      channel.assignAdditionalPartitions(newPartitions);
    }
    return true;
  }

  private boolean isDynamicPartitionAssignmentDisabled() {
    return inputChannels.size() != 1
        || inputChannels.get(0).getConfiguration().isDisableDynamicPartitionAssignment();
  }

  private void resetForNextPartition() {
    if (!processesAllInputPartitions) {
      synchronized (taskProgressLock) {
        if (task != null) {
          ++inputPartitionsFinished;
          task = null;
        }
      }
      for (TaskExecution child : childTasks) {
        child.resetForNextPartition();
      }
    }
  }

  /**
   * Runs the finish method of the child tasks; a root task finishes inside its run method.
   */
  private void finishTask() throws IOException {
    if (isChildTask()) {
      runTaskFinishMethod();
    }
    for (TaskExecution child : childTasks) {
      child.finishTask();
    }
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private void runTaskFinishMethod() throws IOException {
    if (pipelinePrepartitionedPushTaskRecordWriter != null) {
      pipelinePrepartitionedPushTaskRecordWriter.finish();
    } else if (pipelinePullTaskRecordWriter != null) {
      pipelinePullTaskRecordWriter.finish();
    } else if (task instanceof PushTask) {
      try {
        ((PushTask) task).finish(outputWriter);
      } catch (Exception e) {
        Throwables.throwIfInstanceOf(e, IOException.class);
        Throwables.throwIfUnchecked(e);
        throw new IOException("Task " + context.getTaskAttemptId() + " failed to finish.", e);
      }
    }
  }

  private void finalizeTask(TaskMetrics metrics) throws IOException {
    for (TaskExecution child : childTasks) {
      child.finalizeTask(metrics);
    }
    if (!isChildTask()) {
      finishedEvent.countDown();
    }
    calculateMetrics(metrics);
    if (stage.hasDataOutput()) {
      outputWriter.close();
      for (OutputCommitter committer : dataOutputs) {
        committer.commit();
      }
    }
  }

  private void calculateMetrics(TaskMetrics metrics) throws IOException {
    if (!isChildTask()) {
      if (inputReader != null) {
        metrics.setInputRecords(inputReader.getRecordsRead());
        metrics.setInputBytes(inputReader.getInputBytes());
        if (stage.hasDataInput()) {
          metrics.setDfsBytesRead(inputReader.getBytesRead());
        }
      }
      for (InputChannel channel : inputChannels) {
        if (channel instanceof HasMetrics) {
          HasMetrics channelMetrics = (HasMetrics) channel;
          metrics.setLocalBytesRead(metrics.getLocalBytesRead()
              + channelMetrics.getLocalBytesRead());
          metrics.setNetworkBytesRead(metrics.getNetworkBytesRead()
              + channelMetrics.getNetworkBytesRead());
        }
      }
      metrics.setDiscardedPartitions(discardedPartitions);
      metrics.setDynamicallyAssignedPartitions(additionalPartitions);
    }
    if (childTasks.isEmpty() && outputWriter != null) {
      outputWriter.finishWriting();
      metrics.setOutputRecords(metrics.getOutputRecords() + outputWriter.getRecordsWritten());
      metrics.setOutputBytes(metrics.getOutputBytes() + outputWriter.getOutputBytes());
      if (stage.hasDataOutput()) {
        metrics.setDfsBytesWritten(metrics.getDfsBytesWritten()
            + outputWriter.getBytesWritten());
      } else if (outputChannel instanceof HasMetrics) {
        HasMetrics channelMetrics = (HasMetrics) outputChannel;
        metrics.setLocalBytesWritten(metrics.getLocalBytesWritten()
            + channelMetrics.getLocalBytesWritten());
        metrics.setNetworkBytesWritten(metrics.getNetworkBytesWritten()
            + channelMetrics.getNetworkBytesWritten());
      }
    }
  }

  private boolean usesMultipleInputPartitions() {
    return inputReader instanceof MultiInputRecordReader && inputChannels.size() == 1
        && inputChannels.get(0).getConfiguration().getPartitionsPerTask() > 1;
  }

  /**
   * Returns the partitions assigned to this task by the job server; the input channels read only
   * these partitions of their input stages.
   */
  public int[] getPartitions() throws IOException {
    if (rootTask != this) {
      return rootTask.getPartitions();
    }
    if (partitions == null) {
      int[] assigned = jobServer.getPartitionsForTask(context.getJobId(), context.getTaskId());
      partitions = assigned == null || assigned.length == 0
          ? new int[] { context.getTaskId().getTaskNumber() } : assigned;
    }
    return partitions;
  }

  private void createInputChannels() throws IOException {
    if (inputChannelsCreated || isChildTask() || stage.hasDataInput()) {
      return;
    }
    inputChannelsCreated = true;
    JobConfiguration job = context.getJobConfiguration();
    for (StageConfiguration inputStage : job.getInputStagesForStage(stage.getStageId())) {
      ChannelType channelType = inputStage.getOutputChannel().getChannelType();
      InputChannel channel;
      switch (channelType) {
      case FILE:
        channel = new FileInputChannel(this, inputStage, getPartitions());
        break;
      case TCP:
        channel = getTcpChannelProvider().createInputChannel(context, inputStage,
            getPartitions());
        break;
      default:
        throw new IllegalStateException("Invalid input channel type " + channelType + ".");
      }
      inputChannels.add(channel);
      if (channel instanceof HasAdditionalProgress) {
        addAdditionalProgressSource(JobConfiguration.getChannelCounterName(channelType),
            (HasAdditionalProgress) channel);
      }
    }
  }

  private OutputChannel createOutputChannel() throws IOException {
    if (stage.getChildStage() != null) {
      return new PipelineOutputChannel(this);
    }
    if (stage.getOutputChannel() == null) {
      return null;
    }
    ChannelType channelType = stage.getOutputChannel().getChannelType();
    switch (channelType) {
    case FILE:
      return new FileOutputChannel(this);
    case TCP:
      return getTcpChannelProvider().createOutputChannel(context);
    default:
      throw new IllegalStateException("Invalid output channel type " + channelType + ".");
    }
  }

  private TcpChannelProvider getTcpChannelProvider() {
    TcpChannelProvider provider = stage.getRegistry().getTcpChannelProvider();
    if (provider == null) {
      throw new JetUncheckedException("Stage " + stage.getCompoundStageId()
          + " uses a TCP channel, but no TCP channel provider is registered.");
    }
    return provider;
  }

  private RecordReader<?> getInputReader() throws IOException {
    if (inputReader == null) {
      if (stage.hasDataInput()) {
        warnIfNoRecordReuse();
        List<TaskInput> taskInputs = stage.getDataInput().getTaskInputs();
        TaskInput taskInput = taskInputs.get(context.getTaskId().getTaskNumber() - 1);
        context.setTaskInput(taskInput);
        inputReader = stage.getDataInput().createRecordReader(taskInput, context);
      } else {
        createInputChannels();
        if (inputChannels.size() == 1) {
          warnIfNoRecordReuse();
          inputReader = inputChannels.get(0).createRecordReader();
        } else if (inputChannels.size() > 1) {
          warnIfNoRecordReuse();
          inputReader = createStageMultiInputRecordReader();
        }
      }
    }
    return inputReader;
  }

  private RecordReader<?> createStageMultiInputRecordReader() throws IOException {
    String type = stage.getMultiInputRecordReaderType() == null
        ? JobComponentRegistry.MULTI_RECORD_READER : stage.getMultiInputRecordReaderType();
    MultiInputRecordReaderInfo info = stage.getRegistry().getMultiInputRecordReader(type);
    if (info == null) {
      throw new JetUncheckedException("Unknown multi input record reader type " + type + ".");
    }
    Configuration conf = context.getConfiguration();
    int bufferSize = info.getBufferSizeKey() == null ? ConfigUtils.getReadBufferSize(conf)
        : conf.getInt(info.getBufferSizeKey(), info.getBufferSizeDefault());
    MultiInputRecordReader<?> reader = info.getFactory().createReader(conf,
        info.getRecordClass(taskType.getInputRecordClass()), new int[] { 1 },
        inputChannels.size(), stage.allowRecordReuse(), bufferSize);
    if (info.hasAdditionalProgress() && reader instanceof HasAdditionalProgress) {
      addAdditionalProgressSource(reader.getClass().getName(), (HasAdditionalProgress) reader);
    }
    for (InputChannel channel : inputChannels) {
      reader.addInput(Collections.singletonList(
          new ReaderRecordInput(channel.createRecordReader(), false)));
    }
    return reader;
  }

  private RecordWriter<?> getOutputWriter() throws IOException {
    if (outputWriter == null) {
      if (stage.hasDataOutput()) {
        if (stage.getInternalPartitionCount() == 1 && !processesAllInputPartitions
            && rootTask.usesMultipleInputPartitions()) {
          int partition = ((MultiInputRecordReader<?>) rootTask.inputReader)
              .getCurrentPartition();
          outputWriter = new PartitionDfsOutputRecordWriter<Object>(this, partition);
        } else {
          outputWriter = createDfsOutputWriter(context.getTaskId().getPartitionNumber());
        }
      } else if (outputChannel != null) {
        outputWriter = outputChannel.createRecordWriter(taskType.getOutputRecordClass());
      } else {
        throw new IllegalStateException("Stage " + stage.getCompoundStageId()
            + " has no output.");
      }
    }
    return outputWriter;
  }

  RecordWriter<?> createDfsOutputWriter(int partitionNumber) throws IOException {
    OutputCommitter committer = stage.getDataOutput().createOutput(partitionNumber, context);
    dataOutputs.add(committer);
    return committer.getRecordWriter();
  }

  /**
   * Creates the writer the parent task uses to pass records to this child task.
   *
   * @param partitioner the partitioner of the parent's pipeline channel; only used if this task
   *          is a prepartitioned push task
   */
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public RecordWriter<?> createPipelineRecordWriter(Partitioner<?> partitioner)
      throws IOException {
    Preconditions.checkState(isChildTask(),
        "Cannot create a pipeline record writer for a task that is not a child task.");
    RecordWriter output = getOutputWriter();
    warnIfNoRecordReuse();
    switch (taskType.getKind()) {
    case PUSH:
      return new PipelinePushTaskRecordWriter(this, output);
    case PREPARTITIONED_PUSH:
      Preconditions.checkNotNull(partitioner, "partitioner");
      partitioner.setPartitions(stage.getInternalPartitionCount());
      pipelinePrepartitionedPushTaskRecordWriter =
          new PipelinePrepartitionedPushTaskRecordWriter(this, output, partitioner);
      return pipelinePrepartitionedPushTaskRecordWriter;
    default:
      pipelinePullTaskRecordWriter = new PipelinePullTaskRecordWriter(this, output);
      return pipelinePullTaskRecordWriter;
    }
  }

  /**
   * Returns the current task instance, creating it if needed. A new instance is created for each
   * input partition.
   */
  Task<?, ?> getTask() {
    synchronized (taskProgressLock) {
      if (task != null) {
        return task;
      }
    }
    LOG.debug("Creating task instance for task type {}.", taskType.getId());
    Task<?, ?> newTask;
    try {
      newTask = taskType.getFactory().createTask(context);
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new JetUncheckedException("Could not create the task instance for "
          + context.getTaskAttemptId() + ".", e);
    }
    synchronized (taskProgressLock) {
      task = newTask;
    }
    if (!hasAddedTaskProgressSource) {
      hasAddedTaskProgressSource = true;
      if (!processesAllInputPartitions && rootTask.usesMultipleInputPartitions()) {
        if (newTask instanceof HasAdditionalProgress) {
          addAdditionalProgressSource(newTask.getClass().getName(), new TaskProgressSource(this));
        }
      } else if (newTask instanceof HasAdditionalProgress) {
        addAdditionalProgressSource(newTask.getClass().getName(),
            (HasAdditionalProgress) newTask);
      }
    }
    return newTask;
  }

  private void warnIfNoRecordReuse() {
    if (!stage.allowRecordReuse()) {
      LOG.warn("Input record reuse not allowed for task {}.", context.getTaskAttemptId());
    }
  }

  private void addAdditionalProgressSource(String name, HasAdditionalProgress source) {
    Map<String, List<HasAdditionalProgress>> sources = rootTask.additionalProgressSources;
    synchronized (sources) {
      List<HasAdditionalProgress> list = sources.get(name);
      if (list == null) {
        list = new ArrayList<HasAdditionalProgress>();
        sources.put(name, list);
      }
      list.add(source);
    }
  }

  public String getTaskStatusMessage() {
    return getStatusMessage(statusLevel);
  }

  public void setTaskStatusMessage(String message) {
    setStatusMessage(statusLevel, message);
  }

  public void setChannelStatusMessage(String message) {
    setStatusMessage(CHANNEL_STATUS_LEVEL, message);
  }

  private String getStatusMessage(int level) {
    List<String> messages = rootTask.statusMessages;
    synchronized (messages) {
      return level < messages.size() ? messages.get(level) : null;
    }
  }

  private void setStatusMessage(int level, String message) {
    List<String> messages = rootTask.statusMessages;
    synchronized (messages) {
      while (messages.size() <= level) {
        messages.add(null);
      }
      messages.set(level, message);
    }
    reportProgress();
  }

  /**
   * Forces a progress report at the next interval, even if the progress did not change.
   */
  public void reportProgress() {
    rootTask.mustReportProgress.set(true);
  }

  /**
   * Builds the current progress of the task attempt.
   */
  public TaskProgress getProgress() {
    TaskProgress progress = new TaskProgress();
    if (inputReader != null) {
      progress.setProgress(inputReader.getProgress());
    }
    List<String> messages = new ArrayList<String>();
    synchronized (statusMessages) {
      for (String message : statusMessages) {
        if (message != null && !message.isEmpty()) {
          messages.add(message);
        }
      }
    }
    if (!messages.isEmpty()) {
      progress.setStatusMessage(Joiner.on(" > ").join(messages));
    }
    synchronized (additionalProgressSources) {
      for (Map.Entry<String, List<HasAdditionalProgress>> entry
          : additionalProgressSources.entrySet()) {
        float sum = 0;
        for (HasAdditionalProgress source : entry.getValue()) {
          sum += source.getAdditionalProgress();
        }
        progress.addAdditionalProgressValue(entry.getKey(), sum / entry.getValue().size());
      }
    }
    return progress;
  }

  private void startProgressThread() {
    progressThread = new Thread(new Runnable() {
      @Override
      public void run() {
        progressThreadLoop();
      }
    }, "TaskProgress-" + context.getTaskAttemptId());
    progressThread.setDaemon(true);
    progressThread.start();
  }

  private void progressThreadLoop() {
    long interval = context.getConfiguration().getLong(
        JetConfiguration.JET_TASK_PROGRESS_INTERVAL_MS,
        JetConfiguration.JET_TASK_PROGRESS_INTERVAL_MS_DEFAULT);
    TaskProgress previousProgress = null;
    try {
      while (!finishedEvent.await(interval, TimeUnit.MILLISECONDS)) {
        previousProgress = reportProgressIfChanged(previousProgress);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Sends the current progress to the task server if it differs from the last progress sent, or
   * if a report was forced.
   *
   * @return the progress that was last sent
   */
  @VisibleForTesting
  TaskProgress reportProgressIfChanged(TaskProgress previousProgress) {
    TaskProgress progress = getProgress();
    if (mustReportProgress.getAndSet(false) || !progress.equals(previousProgress)) {
      LOG.debug("Reporting progress: {}", progress);
      try {
        umbilical.reportProgress(context.getJobId(), context.getTaskAttemptId(), progress);
      } catch (IOException e) {
        LOG.warn("Failed to report progress to the task server.", e);
        return previousProgress;
      }
      return progress;
    }
    return previousProgress;
  }

  private void checkNotClosed() {
    Preconditions.checkState(!closed, "The task execution has been closed.");
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    IOException error = null;
    for (TaskExecution child : childTasks) {
      error = closeQuietly(child, error);
    }
    error = closeQuietly(pipelinePullTaskRecordWriter, error);
    error = closeQuietly(outputWriter, error);
    error = closeQuietly(inputReader, error);
    for (InputChannel channel : inputChannels) {
      error = closeQuietly(channel, error);
    }
    error = closeQuietly(outputChannel, error);
    if (progressThread != null) {
      finishedEvent.countDown();
      try {
        progressThread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (error != null) {
      throw error;
    }
  }

  private static IOException closeQuietly(Closeable closeable, IOException error) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (IOException e) {
        LOG.warn("Failed to close " + closeable + ".", e);
        return error == null ? e : error;
      }
    }
    return error;
  }

  /**
   * Progress of a task that runs once per input partition: the finished partitions plus the
   * progress of the current instance, relative to all partitions assigned to the task.
   */
  private static final class TaskProgressSource implements HasAdditionalProgress {

    private final TaskExecution execution;

    TaskProgressSource(TaskExecution execution) {
      this.execution = execution;
    }

    @Override
    public float getAdditionalProgress() {
      int total = execution.rootTask.getTotalInputPartitions();
      if (total == 0) {
        return 0;
      }
      synchronized (execution.taskProgressLock) {
        float current = execution.task instanceof HasAdditionalProgress
            ? ((HasAdditionalProgress) execution.task).getAdditionalProgress() : 0;
        return (execution.inputPartitionsFinished + current) / total;
      }
    }
  }
}
