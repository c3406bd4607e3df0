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

package org.apache.jet.jobs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.IntWritable;
import org.apache.hadoop.io.Text;
import org.apache.jet.io.ListRecordReader;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.Partitioner;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.runtime.api.PushTask;
import org.apache.jet.runtime.api.Task;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.api.TaskFactory;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

/**
 * Task types, readers and data inputs shared by the job configuration tests.
 */
public final class JobTestComponents {

  public static final String TEXT_TASK = "text";
  public static final String LENGTH_TASK = "length";
  public static final String SUM_TASK = "sum";

  private JobTestComponents() {
  }

  public static JobComponentRegistry createRegistry() {
    JobComponentRegistry registry = new JobComponentRegistry();
    registry.registerTaskType(TaskTypeInfo.newBuilder(TEXT_TASK, Text.class, Text.class,
        new TaskFactory<Text, Text>() {
          @Override
          public Task<Text, Text> createTask(TaskContext context) {
            return new IdentityTask<Text>();
          }
        }).setAdditionalProgress(true).build());
    registry.registerTaskType(TaskTypeInfo.newBuilder(LENGTH_TASK, Text.class,
        IntWritable.class, new TaskFactory<Text, IntWritable>() {
          @Override
          public Task<Text, IntWritable> createTask(TaskContext context) {
            return new LengthTask();
          }
        }).setKind(TaskTypeInfo.Kind.PUSH).build());
    registry.registerTaskType(TaskTypeInfo.newBuilder(SUM_TASK, IntWritable.class,
        IntWritable.class, new TaskFactory<IntWritable, IntWritable>() {
          @Override
          public Task<IntWritable, IntWritable> createTask(TaskContext context) {
            return new IdentityTask<IntWritable>();
          }
        }).build());
    MultiInputRecordReaderFactory unsupported = new MultiInputRecordReaderFactory() {
      @Override
      public MultiInputRecordReader<?> createReader(Configuration conf, Class<?> recordClass,
          int[] partitions, int totalInputCount, boolean allowRecordReuse, int bufferSize) {
        throw new UnsupportedOperationException();
      }
    };
    registry.registerMultiInputRecordReader(new MultiInputRecordReaderInfo(
        JobComponentRegistry.MULTI_RECORD_READER, unsupported));
    registry.registerMultiInputRecordReader(new MultiInputRecordReaderInfo(
        JobComponentRegistry.MERGE_RECORD_READER, unsupported).setAdditionalProgress(true));
    registry.registerMultiInputRecordReader(new MultiInputRecordReaderInfo(
        JobComponentRegistry.ROUND_ROBIN_RECORD_READER, unsupported));
    return registry;
  }

  public static class IdentityTask<T> implements Task<T, T> {
    @Override
    public void run(RecordReader<T> input, RecordWriter<T> output) throws Exception {
      while (input.readRecord()) {
        output.writeRecord(input.getCurrentRecord());
      }
    }
  }

  public static class LengthTask extends PushTask<Text, IntWritable> {
    @Override
    public void processRecord(Text record, RecordWriter<IntWritable> output) throws Exception {
      output.writeRecord(new IntWritable(record.getLength()));
    }
  }

  public static class IntPartitioner implements Partitioner<IntWritable> {
    private int partitions = 1;

    @Override
    public int getPartitions() {
      return partitions;
    }

    @Override
    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    @Override
    public int getPartition(IntWritable value) {
      return value.get() % partitions;
    }
  }

  public static class FakeTaskInput implements TaskInput {
    private int index;

    public FakeTaskInput() {
    }

    public FakeTaskInput(int index) {
      this.index = index;
    }

    public int getIndex() {
      return index;
    }

    @Override
    public List<String> getLocations() {
      return Collections.singletonList("host" + index);
    }

    @Override
    public void writeJson(JSONObject json) throws JSONException {
      json.put("index", index);
    }

    @Override
    public void readJson(JSONObject json) throws JSONException {
      index = json.getInt("index");
    }
  }

  public static class FakeDataInput implements DataInput {
    static final String INPUT_NAME = "fake.input.name";

    private List<TaskInput> taskInputs = new ArrayList<TaskInput>();
    private String name;

    public FakeDataInput() {
    }

    public FakeDataInput(String name, int taskCount) {
      this.name = name;
      for (int i = 0; i < taskCount; i++) {
        taskInputs.add(new FakeTaskInput(i));
      }
    }

    public String getName() {
      return name;
    }

    @Override
    public Class<?> getRecordClass() {
      return Text.class;
    }

    @Override
    public List<TaskInput> getTaskInputs() {
      return taskInputs;
    }

    @Override
    public void notifyAddedToStage(StageConfiguration stage) {
      stage.addSetting(INPUT_NAME, name);
    }

    @Override
    public void restore(StageConfiguration stage, List<TaskInput> inputs) {
      this.name = stage.getSetting(INPUT_NAME, null);
      this.taskInputs = inputs;
    }

    @Override
    public RecordReader<?> createRecordReader(TaskInput input, TaskContext context)
        throws IOException {
      return new ListRecordReader<Text>(Collections.singletonList(
          new Text(name + ((FakeTaskInput) input).getIndex())));
    }
  }

  public static class FakeDataOutput implements DataOutput {
    @Override
    public Class<?> getRecordClass() {
      return IntWritable.class;
    }

    @Override
    public void notifyAddedToStage(StageConfiguration stage) {
    }

    @Override
    public void restore(StageConfiguration stage) {
    }

    @Override
    public OutputCommitter createOutput(int partitionNumber, TaskContext context)
        throws IOException {
      throw new UnsupportedOperationException();
    }
  }
}
