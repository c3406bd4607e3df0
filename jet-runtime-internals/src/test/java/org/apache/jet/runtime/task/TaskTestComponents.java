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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Text;
import org.apache.jet.channels.InputChannel;
import org.apache.jet.channels.OutputChannel;
import org.apache.jet.channels.TcpChannelProvider;
import org.apache.jet.io.ListRecordReader;
import org.apache.jet.io.ListRecordWriter;
import org.apache.jet.io.PrepartitionedRecordWriter;
import org.apache.jet.io.ReaderRecordInput;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.jobs.ChannelConfiguration;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.jobs.TaskTypeInfo;
import org.apache.jet.runtime.api.PrepartitionedPushTask;
import org.apache.jet.runtime.api.PushTask;
import org.apache.jet.runtime.api.Task;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.api.TaskFactory;
import org.apache.jet.runtime.library.BuiltInComponents;
import org.apache.jet.runtime.library.common.io.RecordFile;
import org.apache.jet.runtime.library.input.MultiRecordReader;

/**
 * Task types and channels shared by the task execution tests.
 */
public final class TaskTestComponents {

  public static final String IDENTITY_TASK = "identity";
  public static final String UPPER_CASE_TASK = "upper";
  public static final String FIRST_LETTER_TASK = "firstletter";
  public static final String FAILING_TASK = "failing";
  public static final String BLOCKING_TASK = "blocking";

  /** Counted down when a blocking task starts running. */
  public static volatile CountDownLatch blockingTaskStarted = new CountDownLatch(1);

  private TaskTestComponents() {
  }

  public static JobComponentRegistry createRegistry() {
    JobComponentRegistry registry = BuiltInComponents.createRegistry();
    registry.registerTaskType(TaskTypeInfo.newBuilder(IDENTITY_TASK, Text.class, Text.class,
        new TaskFactory<Text, Text>() {
          @Override
          public Task<Text, Text> createTask(TaskContext context) {
            return new IdentityTask();
          }
        }).build());
    registry.registerTaskType(TaskTypeInfo.newBuilder(UPPER_CASE_TASK, Text.class, Text.class,
        new TaskFactory<Text, Text>() {
          @Override
          public Task<Text, Text> createTask(TaskContext context) {
            return new UpperCaseTask();
          }
        }).setKind(TaskTypeInfo.Kind.PUSH).build());
    registry.registerTaskType(TaskTypeInfo.newBuilder(FIRST_LETTER_TASK, Text.class,
        Text.class, new TaskFactory<Text, Text>() {
          @Override
          public Task<Text, Text> createTask(TaskContext context) {
            return new FirstLetterTask();
          }
        }).setKind(TaskTypeInfo.Kind.PREPARTITIONED_PUSH).build());
    registry.registerTaskType(TaskTypeInfo.newBuilder(FAILING_TASK, Text.class, Text.class,
        new TaskFactory<Text, Text>() {
          @Override
          public Task<Text, Text> createTask(TaskContext context) {
            return new FailingTask();
          }
        }).build());
    registry.registerTaskType(TaskTypeInfo.newBuilder(BLOCKING_TASK, Text.class, Text.class,
        new TaskFactory<Text, Text>() {
          @Override
          public Task<Text, Text> createTask(TaskContext context) {
            return new BlockingTask();
          }
        }).build());
    return registry;
  }

  public static void writeRecordFile(Configuration conf, FileSystem fs, Path path,
      String... records) throws IOException {
    RecordFile.Writer<Text> writer = new RecordFile.Writer<Text>(conf, fs, path, Text.class,
        null, 4096, false);
    try {
      for (String record : records) {
        writer.writeRecord(new Text(record));
      }
    } finally {
      writer.close();
    }
  }

  public static List<String> readRecordFile(Configuration conf, FileSystem fs, Path path)
      throws IOException {
    List<String> result = new ArrayList<String>();
    RecordFile.Reader<Text> reader = new RecordFile.Reader<Text>(conf, fs, path, Text.class,
        null, 4096, false);
    try {
      while (reader.readRecord()) {
        result.add(reader.getCurrentRecord().toString());
      }
    } finally {
      reader.close();
    }
    return result;
  }

  public static class IdentityTask implements Task<Text, Text> {
    @Override
    public void run(RecordReader<Text> input, RecordWriter<Text> output) throws Exception {
      while (input.readRecord()) {
        output.writeRecord(input.getCurrentRecord());
      }
    }
  }

  public static class UpperCaseTask extends PushTask<Text, Text> {
    @Override
    public void processRecord(Text record, RecordWriter<Text> output) throws Exception {
      output.writeRecord(new Text(record.toString().toUpperCase()));
    }
  }

  /**
   * Sends each record to the partition selected by its first letter.
   */
  public static class FirstLetterTask extends PrepartitionedPushTask<Text, Text> {
    @Override
    public void processRecord(Text record, int partition, PrepartitionedRecordWriter<Text> output)
        throws Exception {
      int count = output.getPartitionCount();
      output.writeRecord(record, record.charAt(0) % count);
    }
  }

  public static class FailingTask implements Task<Text, Text> {
    @Override
    public void run(RecordReader<Text> input, RecordWriter<Text> output) throws Exception {
      throw new IllegalArgumentException("Task failure.");
    }
  }

  public static class BlockingTask implements Task<Text, Text> {
    @Override
    public void run(RecordReader<Text> input, RecordWriter<Text> output) throws Exception {
      blockingTaskStarted.countDown();
      Thread.sleep(Long.MAX_VALUE);
    }
  }

  /**
   * TCP channel provider that serves fixed records for each partition and collects the records
   * written to its output channels.
   */
  public static class ListTcpChannelProvider implements TcpChannelProvider {
    private final Map<Integer, List<String>> partitionRecords =
        new TreeMap<Integer, List<String>>();
    private final List<ListRecordWriter<?>> writers = new ArrayList<ListRecordWriter<?>>();

    public ListTcpChannelProvider addPartition(int partition, String... records) {
      List<String> list = new ArrayList<String>();
      Collections.addAll(list, records);
      partitionRecords.put(partition, list);
      return this;
    }

    public List<ListRecordWriter<?>> getWriters() {
      return writers;
    }

    @Override
    public InputChannel createInputChannel(TaskContext context, StageConfiguration inputStage,
        int[] partitions) {
      return new ListInputChannel(this, inputStage, partitions);
    }

    @Override
    public OutputChannel createOutputChannel(TaskContext context) {
      return new OutputChannel() {
        @Override
        public <T> RecordWriter<T> createRecordWriter(Class<T> recordClass) {
          ListRecordWriter<T> writer = new ListRecordWriter<T>(true);
          writers.add(writer);
          return writer;
        }

        @Override
        public void close() {
        }
      };
    }

    List<RecordInput> createInputs(int[] partitions) {
      List<RecordInput> inputs = new ArrayList<RecordInput>(partitions.length);
      for (int partition : partitions) {
        List<Text> records = new ArrayList<Text>();
        List<String> values = partitionRecords.get(partition);
        if (values != null) {
          for (String value : values) {
            records.add(new Text(value));
          }
        }
        inputs.add(new ReaderRecordInput(new ListRecordReader<Text>(records), true));
      }
      return inputs;
    }
  }

  private static class ListInputChannel implements InputChannel {
    private final ListTcpChannelProvider provider;
    private final StageConfiguration inputStage;
    private final int[] partitions;
    private MultiRecordReader<Text> reader;

    ListInputChannel(ListTcpChannelProvider provider, StageConfiguration inputStage,
        int[] partitions) {
      this.provider = provider;
      this.inputStage = inputStage;
      this.partitions = partitions;
    }

    @Override
    public ChannelConfiguration getConfiguration() {
      return inputStage.getOutputChannel();
    }

    @Override
    public StageConfiguration getInputStage() {
      return inputStage;
    }

    @Override
    public RecordReader<?> createRecordReader() {
      reader = new MultiRecordReader<Text>(new Configuration(), Text.class, partitions, 1, false,
          4096);
      reader.addInput(provider.createInputs(partitions));
      return reader;
    }

    @Override
    public void assignAdditionalPartitions(int[] newPartitions) {
      reader.addInput(provider.createInputs(newPartitions));
    }

    @Override
    public void close() throws IOException {
    }
  }
}
