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

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.api.InvalidJobConfigurationException;
import org.apache.jet.io.HashPartitioner;

import com.google.common.base.Preconditions;

/**
 * Describes how a stage receives the output of one of its input stages. Passed to
 * {@link JobConfiguration#addStage(String, String, int, java.util.List, String)}.
 */
@Public
public class InputStageInfo {

  private final StageConfiguration inputStage;
  private ChannelType channelType = ChannelType.FILE;
  private String partitionerClassName;
  private String multiInputRecordReaderType;
  private int partitionsPerTask = 1;
  private boolean disableDynamicPartitionAssignment;
  private PartitionAssignmentMethod partitionAssignmentMethod = PartitionAssignmentMethod.LINEAR;

  public InputStageInfo(StageConfiguration inputStage) {
    this.inputStage = Preconditions.checkNotNull(inputStage, "inputStage");
  }

  public StageConfiguration getInputStage() {
    return inputStage;
  }

  public ChannelType getChannelType() {
    return channelType;
  }

  public InputStageInfo setChannelType(ChannelType channelType) {
    this.channelType = Preconditions.checkNotNull(channelType);
    return this;
  }

  /**
   * Returns the partitioner class name, {@link HashPartitioner} if none was set.
   */
  public String getPartitionerClassName() {
    return partitionerClassName == null ? HashPartitioner.class.getName() : partitionerClassName;
  }

  public InputStageInfo setPartitionerClassName(String partitionerClassName) {
    this.partitionerClassName = partitionerClassName;
    return this;
  }

  /**
   * Returns the multi-input record reader type of the channel. Defaults to
   * {@link JobComponentRegistry#ROUND_ROBIN_RECORD_READER} for TCP channels and
   * {@link JobComponentRegistry#MULTI_RECORD_READER} otherwise.
   */
  public String getMultiInputRecordReaderType() {
    if (multiInputRecordReaderType != null) {
      return multiInputRecordReaderType;
    }
    return channelType == ChannelType.TCP ? JobComponentRegistry.ROUND_ROBIN_RECORD_READER
        : JobComponentRegistry.MULTI_RECORD_READER;
  }

  public InputStageInfo setMultiInputRecordReaderType(String multiInputRecordReaderType) {
    this.multiInputRecordReaderType = multiInputRecordReaderType;
    return this;
  }

  public int getPartitionsPerTask() {
    return partitionsPerTask;
  }

  public InputStageInfo setPartitionsPerTask(int partitionsPerTask) {
    Preconditions.checkArgument(partitionsPerTask >= 1, "partitionsPerTask must be at least 1");
    this.partitionsPerTask = partitionsPerTask;
    return this;
  }

  public boolean isDisableDynamicPartitionAssignment() {
    return disableDynamicPartitionAssignment;
  }

  public InputStageInfo setDisableDynamicPartitionAssignment(boolean value) {
    this.disableDynamicPartitionAssignment = value;
    return this;
  }

  public PartitionAssignmentMethod getPartitionAssignmentMethod() {
    return partitionAssignmentMethod;
  }

  public InputStageInfo setPartitionAssignmentMethod(PartitionAssignmentMethod method) {
    this.partitionAssignmentMethod = Preconditions.checkNotNull(method);
    return this;
  }

  ChannelConfiguration createChannel(String outputStage) {
    ChannelConfiguration channel = new ChannelConfiguration();
    channel.setChannelType(channelType);
    channel.setPartitionerClassName(getPartitionerClassName());
    channel.setMultiInputRecordReaderType(getMultiInputRecordReaderType());
    channel.setOutputStage(outputStage);
    channel.setPartitionsPerTask(partitionsPerTask);
    channel.setDisableDynamicPartitionAssignment(disableDynamicPartitionAssignment);
    channel.setPartitionAssignmentMethod(partitionAssignmentMethod);
    return channel;
  }

  /**
   * Checks that the partitioner and the channel's reader accept the input stage's output, and
   * that the records they produce are accepted by the stage reader (if any) or the receiving
   * task.
   */
  void validateTypes(JobComponentRegistry registry, String stageMultiInputRecordReaderType,
      Class<?> inputRecordClass) {
    Class<?> stageOutputClass = getInputStageOutputClass();
    StageConfiguration.validatePartitionerClass(getPartitionerClassName(), stageOutputClass,
        "Input stage " + inputStage.getCompoundStageId());

    MultiInputRecordReaderInfo channelReader =
        registry.getMultiInputRecordReader(getMultiInputRecordReaderType());
    if (channelReader == null) {
      throw new InvalidJobConfigurationException("Unknown multi input record reader type "
          + getMultiInputRecordReaderType() + ".");
    }
    if (!channelReader.accepts(stageOutputClass)) {
      throw new InvalidJobConfigurationException("The specified channel multi input record "
          + "reader type " + channelReader.getId() + " doesn't accept objects of type "
          + stageOutputClass.getName() + ".");
    }
    Class<?> channelRecordClass = channelReader.getRecordClass(stageOutputClass);
    if (stageMultiInputRecordReaderType != null) {
      MultiInputRecordReaderInfo stageReader =
          registry.getMultiInputRecordReader(stageMultiInputRecordReaderType);
      if (stageReader == null) {
        throw new InvalidJobConfigurationException("Unknown multi input record reader type "
            + stageMultiInputRecordReaderType + ".");
      }
      if (!stageReader.getRecordClass(channelRecordClass).equals(inputRecordClass)) {
        throw new InvalidJobConfigurationException("The specified stage multi input record "
            + "reader type " + stageReader.getId() + " doesn't return objects of type "
            + inputRecordClass.getName() + ".");
      }
      if (!stageReader.accepts(channelRecordClass)) {
        throw new InvalidJobConfigurationException("The specified channel multi input record "
            + "reader type " + channelReader.getId() + " doesn't return objects of the correct "
            + "type.");
      }
    } else if (!channelRecordClass.equals(inputRecordClass)) {
      throw new InvalidJobConfigurationException("The specified channel multi input record "
          + "reader type " + channelReader.getId() + " doesn't return objects of the correct "
          + "type.");
    }
  }

  private Class<?> getInputStageOutputClass() {
    TaskTypeInfo<?, ?> taskType = inputStage.getTaskTypeInfo();
    if (taskType == null) {
      throw new InvalidJobConfigurationException("Input stage " + inputStage.getCompoundStageId()
          + " has an unknown task type.");
    }
    return taskType.getOutputRecordClass();
  }
}
