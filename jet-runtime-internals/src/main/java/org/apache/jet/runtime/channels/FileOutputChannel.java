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
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.jet.channels.FileChannelOutputType;
import org.apache.jet.channels.OutputChannel;
import org.apache.jet.io.HasMetrics;
import org.apache.jet.io.MultiRecordWriter;
import org.apache.jet.io.Partitioner;
import org.apache.jet.io.PrepartitionedPartitioner;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.jobs.ChannelConfiguration;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.common.io.RecordFile;
import org.apache.jet.runtime.library.output.SortSpillRecordWriter;
import org.apache.jet.runtime.task.TaskExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Writes a task's output to one local file per partition of the receiving stage. The files are
 * placed in a directory named after the attempt of the outermost task, so the receiving tasks
 * can locate them from the completed task attempt alone.
 * <p/>
 * With the {@link FileChannelOutputType#SORT_SPILL} output type the records of each partition
 * are sorted and spilled through a {@link SortSpillRecordWriter}.
 */
@Private
public class FileOutputChannel implements OutputChannel, HasMetrics {

  private static final Logger LOG = LoggerFactory.getLogger(FileOutputChannel.class);

  private final TaskExecution taskExecution;
  private final ChannelConfiguration channelConfiguration;
  private final StageConfiguration outputStage;
  private RecordWriter<?> writer;

  public FileOutputChannel(TaskExecution taskExecution) {
    this.taskExecution = Preconditions.checkNotNull(taskExecution, "taskExecution");
    TaskContext context = taskExecution.getContext();
    this.channelConfiguration = context.getStageConfiguration().getOutputChannel();
    String outputStageId = channelConfiguration.getOutputStage();
    this.outputStage = outputStageId == null ? null
        : context.getJobConfiguration().getStage(outputStageId);
  }

  /**
   * Returns the directory holding the files a task attempt wrote for a receiving stage.
   */
  public static Path getOutputDirectory(Path localJobDirectory, TaskAttemptId rootAttemptId,
      String outputStageId) {
    return new Path(new Path(localJobDirectory, rootAttemptId.toString()), outputStageId);
  }

  public static String getPartitionFileName(int partition) {
    return "part" + partition + ".output";
  }

  /**
   * Returns the partitions this task writes. Internal partitioning of a compound stage already
   * divides the output, so a task with internal partitions writes only its own partition.
   */
  public int[] getOutputPartitions() {
    StageConfiguration stage = taskExecution.getContext().getStageConfiguration();
    if (stage.getInternalPartitionCount() == 1) {
      int count = outputStage.getTaskCount() * channelConfiguration.getPartitionsPerTask();
      int[] result = new int[count];
      for (int x = 0; x < count; ++x) {
        result[x] = x + 1;
      }
      return result;
    }
    return new int[] { taskExecution.getContext().getTaskId().getPartitionNumber() };
  }

  @Override
  public <T> RecordWriter<T> createRecordWriter(Class<T> recordClass) throws IOException {
    Preconditions.checkState(writer == null,
        "The channel record writer has already been created.");
    TaskContext context = taskExecution.getContext();
    if (outputStage == null) {
      LOG.info("Output channel of task {} has no receiving stage; discarding output.",
          context.getTaskAttemptId());
      RecordWriter<T> result = new RecordWriter<T>() {
        @Override
        protected void writeRecordInternal(T record) {
        }
      };
      writer = result;
      return result;
    }

    Configuration conf = context.getConfiguration();
    FileSystem fs = FileSystem.getLocal(conf);
    Path directory = getOutputDirectory(context.getLocalJobDirectory(),
        taskExecution.getRootTask().getContext().getTaskAttemptId(), outputStage.getStageId());
    fs.mkdirs(directory);
    int[] partitions = getOutputPartitions();
    FileChannelOutputType outputType = ConfigUtils.getFileChannelOutputType(conf);
    LOG.debug("Creating {} file channel output for {} partitions in {}.", outputType,
        partitions.length, directory);

    if (outputType == FileChannelOutputType.SORT_SPILL) {
      List<Path> files = new ArrayList<Path>(partitions.length);
      for (int partition : partitions) {
        files.add(new Path(directory, getPartitionFileName(partition)));
      }
      RecordWriter<T> result = new SortSpillRecordWriter<T>(conf, fs, files, recordClass,
          this.<T>createPartitioner(conf));
      writer = result;
      return result;
    }

    List<RecordWriter<T>> writers = new ArrayList<RecordWriter<T>>(partitions.length);
    try {
      for (int partition : partitions) {
        writers.add(new RecordFile.Writer<T>(conf, fs,
            new Path(directory, getPartitionFileName(partition)), recordClass,
            ConfigUtils.getIntermediateCompressionCodec(conf), ConfigUtils.getWriteBufferSize(conf),
            ConfigUtils.isIntermediateChecksumEnabled(conf)));
      }
    } catch (IOException e) {
      for (RecordWriter<T> created : writers) {
        try {
          created.close();
        } catch (IOException closeError) {
          e.addSuppressed(closeError);
        }
      }
      throw e;
    }

    RecordWriter<T> result;
    if (writers.size() == 1) {
      result = writers.get(0);
    } else {
      result = new MultiRecordWriter<T>(writers, this.<T>createPartitioner(conf));
    }
    writer = result;
    return result;
  }

  private <T> Partitioner<T> createPartitioner(Configuration conf) {
    StageConfiguration stage = taskExecution.getContext().getStageConfiguration();
    if (stage.isOutputPrepartitioned()) {
      return new PrepartitionedPartitioner<T>();
    }
    return ChannelUtils.createPartitioner(channelConfiguration.getPartitionerClassName(), conf);
  }

  @Override
  public long getLocalBytesRead() {
    return 0;
  }

  @Override
  public long getLocalBytesWritten() {
    return writer == null ? 0 : writer.getBytesWritten();
  }

  @Override
  public long getNetworkBytesRead() {
    return 0;
  }

  @Override
  public long getNetworkBytesWritten() {
    return 0;
  }

  /**
   * The writer is owned by the task execution, which closes it before the channel.
   */
  @Override
  public void close() throws IOException {
  }
}
