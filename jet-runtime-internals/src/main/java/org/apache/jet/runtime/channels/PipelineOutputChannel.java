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
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.channels.OutputChannel;
import org.apache.jet.io.MultiRecordWriter;
import org.apache.jet.io.Partitioner;
import org.apache.jet.io.PrepartitionedPartitioner;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.runtime.task.TaskExecution;

import com.google.common.base.Preconditions;

/**
 * Connects a task to the tasks of its child stage running in the same process. Records written
 * to the channel are handed to the child tasks directly, divided among them by the child stage
 * partitioner.
 */
@Private
public class PipelineOutputChannel implements OutputChannel {

  private final TaskExecution taskExecution;
  private final StageConfiguration stage;
  private final StageConfiguration childStage;
  private final List<TaskExecution> childTasks;

  public PipelineOutputChannel(TaskExecution taskExecution) throws IOException {
    this.taskExecution = Preconditions.checkNotNull(taskExecution, "taskExecution");
    this.stage = taskExecution.getContext().getStageConfiguration();
    this.childStage = Preconditions.checkNotNull(stage.getChildStage(), "childStage");
    // A prepartitioned child task receives every internal partition in a single instance.
    int childCount = childStage.isOutputPrepartitioned() ? 1 : childStage.getTaskCount();
    List<TaskExecution> children = new ArrayList<TaskExecution>(childCount);
    for (int x = 1; x <= childCount; ++x) {
      children.add(taskExecution.createChildTask(childStage, x));
    }
    this.childTasks = Collections.unmodifiableList(children);
  }

  public List<TaskExecution> getChildTasks() {
    return childTasks;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> RecordWriter<T> createRecordWriter(Class<T> recordClass) throws IOException {
    Configuration conf = taskExecution.getContext().getConfiguration();
    if (childStage.isOutputPrepartitioned()) {
      Partitioner<T> partitioner = ChannelUtils.createPartitioner(
          stage.getChildStagePartitionerClassName(), conf);
      return (RecordWriter<T>) childTasks.get(0).createPipelineRecordWriter(partitioner);
    } else if (childTasks.size() == 1) {
      return (RecordWriter<T>) childTasks.get(0).createPipelineRecordWriter(null);
    }

    List<RecordWriter<T>> writers = new ArrayList<RecordWriter<T>>(childTasks.size());
    for (TaskExecution child : childTasks) {
      writers.add((RecordWriter<T>) child.createPipelineRecordWriter(null));
    }
    Partitioner<T> partitioner;
    if (stage.isOutputPrepartitioned()) {
      partitioner = new PrepartitionedPartitioner<T>();
    } else {
      partitioner = ChannelUtils.createPartitioner(stage.getChildStagePartitionerClassName(),
          conf);
    }
    return new MultiRecordWriter<T>(writers, partitioner);
  }

  /**
   * The child task executions are closed by their parent execution.
   */
  @Override
  public void close() throws IOException {
  }
}
