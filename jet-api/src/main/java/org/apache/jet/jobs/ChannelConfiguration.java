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
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import com.google.common.base.Preconditions;

/**
 * The channel connecting the leaf of a stage to the stage that receives its output.
 */
@Public
public class ChannelConfiguration {

  private ChannelType channelType = ChannelType.FILE;
  private String partitionerClassName;
  private String multiInputRecordReaderType;
  private String outputStage;
  private int partitionsPerTask = 1;
  private boolean disableDynamicPartitionAssignment;
  private PartitionAssignmentMethod partitionAssignmentMethod = PartitionAssignmentMethod.LINEAR;

  public ChannelType getChannelType() {
    return channelType;
  }

  public void setChannelType(ChannelType channelType) {
    this.channelType = Preconditions.checkNotNull(channelType);
  }

  /**
   * Returns the class name of the {@link org.apache.jet.io.Partitioner} that assigns records to
   * the partitions of the channel.
   */
  public String getPartitionerClassName() {
    return partitionerClassName;
  }

  public void setPartitionerClassName(String partitionerClassName) {
    this.partitionerClassName = partitionerClassName;
  }

  /**
   * Returns the id of the multi-input record reader that combines the outputs of the sending
   * tasks for each partition.
   */
  public String getMultiInputRecordReaderType() {
    return multiInputRecordReaderType;
  }

  public void setMultiInputRecordReaderType(String multiInputRecordReaderType) {
    this.multiInputRecordReaderType = multiInputRecordReaderType;
  }

  public String getOutputStage() {
    return outputStage;
  }

  public void setOutputStage(String outputStage) {
    this.outputStage = outputStage;
  }

  /**
   * The number of partitions created for each task of the receiving stage.
   */
  public int getPartitionsPerTask() {
    return partitionsPerTask;
  }

  public void setPartitionsPerTask(int partitionsPerTask) {
    Preconditions.checkArgument(partitionsPerTask >= 1, "partitionsPerTask must be at least 1");
    this.partitionsPerTask = partitionsPerTask;
  }

  public boolean isDisableDynamicPartitionAssignment() {
    return disableDynamicPartitionAssignment;
  }

  public void setDisableDynamicPartitionAssignment(boolean value) {
    this.disableDynamicPartitionAssignment = value;
  }

  public PartitionAssignmentMethod getPartitionAssignmentMethod() {
    return partitionAssignmentMethod;
  }

  public void setPartitionAssignmentMethod(PartitionAssignmentMethod method) {
    this.partitionAssignmentMethod = Preconditions.checkNotNull(method);
  }

  JSONObject toJson() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("type", channelType.name());
    json.putOpt("partitioner", partitionerClassName);
    json.putOpt("multiInputRecordReader", multiInputRecordReaderType);
    json.putOpt("outputStage", outputStage);
    json.put("partitionsPerTask", partitionsPerTask);
    json.put("disableDynamicPartitionAssignment", disableDynamicPartitionAssignment);
    json.put("partitionAssignmentMethod", partitionAssignmentMethod.name());
    return json;
  }

  static ChannelConfiguration fromJson(JSONObject json) throws JSONException {
    ChannelConfiguration channel = new ChannelConfiguration();
    channel.setChannelType(ChannelType.valueOf(json.getString("type")));
    channel.setPartitionerClassName(json.optString("partitioner", null));
    channel.setMultiInputRecordReaderType(json.optString("multiInputRecordReader", null));
    channel.setOutputStage(json.optString("outputStage", null));
    channel.setPartitionsPerTask(json.optInt("partitionsPerTask", 1));
    channel.setDisableDynamicPartitionAssignment(
        json.optBoolean("disableDynamicPartitionAssignment", false));
    channel.setPartitionAssignmentMethod(PartitionAssignmentMethod.valueOf(
        json.optString("partitionAssignmentMethod", PartitionAssignmentMethod.LINEAR.name())));
    return channel;
  }

  @Override
  public String toString() {
    return "ChannelConfiguration [type=" + channelType + ", outputStage=" + outputStage
        + ", partitionsPerTask=" + partitionsPerTask + "]";
  }
}
