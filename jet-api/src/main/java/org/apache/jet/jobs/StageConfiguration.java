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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.serializer.SerializationFactory;
import org.apache.jet.api.InvalidJobConfigurationException;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.common.ReflectionUtils;
import org.apache.jet.io.Partitioner;
import org.apache.jet.records.TaskId;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import com.google.common.base.Preconditions;

/**
 * The configuration of a stage of a job: its task type, task count, inputs, outputs and the
 * stages pipelined into it.
 * <p>
 * Stages are created through {@link JobConfiguration}, which binds them to the
 * {@link JobComponentRegistry} used to resolve task types and multi-input record readers.
 */
@Public
public class StageConfiguration {

  private JobComponentRegistry registry;
  private String stageId;
  private String taskTypeId;
  private int taskCount;
  private final List<String> dependentStages = new ArrayList<String>();
  private StageConfiguration childStage;
  private StageConfiguration parent;
  private DataInput dataInput;
  private String dataInputType;
  private DataOutput dataOutput;
  private String dataOutputType;
  private String childStagePartitionerClassName;
  private Map<String, String> settings;
  private ChannelConfiguration outputChannel;
  private String multiInputRecordReaderType;

  public StageConfiguration(JobComponentRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry, "registry");
  }

  public JobComponentRegistry getRegistry() {
    return registry;
  }

  public String getStageId() {
    return stageId;
  }

  public void setStageId(String stageId) {
    if (stageId != null && !TaskId.isValidStageId(stageId)) {
      throw new IllegalArgumentException(
          "A stage ID cannot contain the character '.', '-' or '_'.");
    }
    this.stageId = stageId;
  }

  public String getTaskTypeId() {
    return taskTypeId;
  }

  public void setTaskTypeId(String taskTypeId) {
    this.taskTypeId = taskTypeId;
  }

  /**
   * @return the registered task type, or <code>null</code> if the task type id is not set or
   *         not registered
   */
  public TaskTypeInfo<?, ?> getTaskTypeInfo() {
    return taskTypeId == null ? null : registry.getTaskType(taskTypeId);
  }

  /**
   * Returns the number of tasks. For a stage with a data input this is the number of task
   * inputs of the data input.
   */
  public int getTaskCount() {
    if (dataInput != null) {
      return dataInput.getTaskInputs().size();
    }
    return taskCount;
  }

  public void setTaskCount(int taskCount) {
    this.taskCount = taskCount;
  }

  public DataInput getDataInput() {
    return dataInput;
  }

  public void setDataInput(DataInput dataInput) {
    TaskTypeInfo<?, ?> taskType = getTaskTypeInfo();
    if (dataInput != null && taskType != null && !taskType.consumes(dataInput.getRecordClass())) {
      throw new InvalidJobConfigurationException("The specified input's record type "
          + dataInput.getRecordClass().getName() + " is not identical to the task type's input "
          + "record type " + taskType.getInputRecordClass().getName() + ".");
    }
    this.dataInput = dataInput;
    this.dataInputType = dataInput == null ? null : dataInput.getClass().getName();
    if (dataInput != null) {
      dataInput.notifyAddedToStage(this);
    }
  }

  public String getDataInputType() {
    return dataInputType;
  }

  public boolean hasDataInput() {
    return dataInputType != null;
  }

  public DataOutput getDataOutput() {
    return dataOutput;
  }

  public void setDataOutput(DataOutput dataOutput) {
    if (dataOutput == null) {
      this.dataOutput = null;
      this.dataOutputType = null;
      return;
    }
    if (outputChannel != null || childStage != null) {
      throw new InvalidJobConfigurationException("Cannot add data output to stage "
          + getCompoundStageId() + " because it already has an output channel or child stage.");
    }
    TaskTypeInfo<?, ?> taskType = getTaskTypeInfo();
    if (taskType != null && !taskType.produces(dataOutput.getRecordClass())) {
      throw new InvalidJobConfigurationException("The specified output's record type "
          + dataOutput.getRecordClass().getName() + " is not identical to the task type's "
          + "output record type " + taskType.getOutputRecordClass().getName() + ".");
    }
    this.dataOutput = dataOutput;
    this.dataOutputType = dataOutput.getClass().getName();
    dataOutput.notifyAddedToStage(this);
  }

  public String getDataOutputType() {
    return dataOutputType;
  }

  public boolean hasDataOutput() {
    return dataOutputType != null;
  }

  public StageConfiguration getChildStage() {
    return childStage;
  }

  public void setChildStage(StageConfiguration childStage) {
    if (this.childStage == childStage) {
      return;
    }
    if (childStage != null && childStage.parent != null) {
      throw new IllegalArgumentException("The stage already has a parent.");
    }
    if (this.childStage != null) {
      this.childStage.parent = null;
    }
    this.childStage = childStage;
    if (childStage != null) {
      childStage.parent = this;
    }
  }

  public StageConfiguration getParent() {
    return parent;
  }

  public StageConfiguration getRoot() {
    StageConfiguration root = this;
    while (root.parent != null) {
      root = root.parent;
    }
    return root;
  }

  public StageConfiguration getLeaf() {
    StageConfiguration leaf = this;
    while (leaf.childStage != null) {
      leaf = leaf.childStage;
    }
    return leaf;
  }

  /**
   * Returns the class name of the partitioner used to divide this stage's output among the
   * tasks of its child stage.
   */
  public String getChildStagePartitionerClassName() {
    return childStagePartitionerClassName;
  }

  public void setChildStagePartitionerClassName(String className) {
    this.childStagePartitionerClassName = className;
  }

  public ChannelConfiguration getOutputChannel() {
    return outputChannel;
  }

  public void setOutputChannel(ChannelConfiguration outputChannel) {
    this.outputChannel = outputChannel;
  }

  /**
   * Returns the id of the multi-input record reader that combines the stage's input channels,
   * or <code>null</code> if the stage has at most one input channel.
   */
  public String getMultiInputRecordReaderType() {
    return multiInputRecordReaderType;
  }

  public void setMultiInputRecordReaderType(String multiInputRecordReaderType) {
    this.multiInputRecordReaderType = multiInputRecordReaderType;
  }

  /**
   * Returns the ids of the stages that may only be scheduled after this stage finished, without
   * receiving its output.
   */
  public List<String> getDependentStages() {
    return dependentStages;
  }

  /**
   * Indicates the stage's task may reuse the same object instance for its input records.
   */
  public boolean allowRecordReuse() {
    TaskTypeInfo<?, ?> taskType = getTaskTypeInfo();
    if (taskType == null) {
      return false;
    }
    switch (taskType.getRecordReuse()) {
    case ALLOWED:
      return true;
    case PASS_THROUGH:
      return allowOutputRecordReuse();
    default:
      return false;
    }
  }

  /**
   * Indicates the stage's task may reuse the same object instance for the records it writes.
   */
  public boolean allowOutputRecordReuse() {
    if (childStage != null && childStage.getTaskTypeInfo() != null) {
      return childStage.getTaskTypeInfo().isPushTask() && childStage.allowRecordReuse();
    }
    return true;
  }

  public String getCompoundStageId() {
    if (parent == null) {
      return stageId;
    }
    return parent.getCompoundStageId() + TaskId.CHILD_STAGE_SEPARATOR + stageId;
  }

  /**
   * Returns the number of partitions the output of this stage is divided into by the stages of
   * its compound stage.
   */
  public int getInternalPartitionCount() {
    if (parent == null) {
      return 1;
    }
    return parent.getInternalPartitionCount() * getTaskCount();
  }

  public boolean isOutputPrepartitioned() {
    TaskTypeInfo<?, ?> taskType = getTaskTypeInfo();
    return taskType != null && taskType.isOutputPrepartitioned();
  }

  public StageConfiguration getNamedChildStage(String childStageId) {
    Preconditions.checkNotNull(childStageId, "childStageId");
    if (childStage != null && childStageId.equals(childStage.stageId)) {
      return childStage;
    }
    return null;
  }

  /**
   * @return the stage settings, or <code>null</code> if none were added
   */
  public Map<String, String> getSettings() {
    return settings == null ? null : Collections.unmodifiableMap(settings);
  }

  public String getSetting(String key, String defaultValue) {
    if (settings == null) {
      return defaultValue;
    }
    String value = settings.get(key);
    return value == null ? defaultValue : value;
  }

  /**
   * Gets a setting from the stage settings, or the job settings if the stage doesn't define it.
   */
  public String getSetting(String key, JobConfiguration job, String defaultValue) {
    String value = getSetting(key, null);
    if (value == null && job != null) {
      value = job.getSetting(key, null);
    }
    return value == null ? defaultValue : value;
  }

  public void addSetting(String key, String value) {
    Preconditions.checkNotNull(key, "key");
    Preconditions.checkNotNull(value, "value");
    if (settings == null) {
      settings = new LinkedHashMap<String, String>();
    }
    settings.put(key, value);
  }

  public void addSettings(Map<String, String> newSettings) {
    if (newSettings != null) {
      for (Map.Entry<String, String> setting : newSettings.entrySet()) {
        addSetting(setting.getKey(), setting.getValue());
      }
    }
  }

  /**
   * Creates the run time configuration for tasks of this stage.
   */
  public Configuration createConfiguration(JobConfiguration job) {
    return JetConfiguration.createConfiguration(job == null ? null : job.getSettings(), settings);
  }

  /**
   * Checks that the stage and its child stages are consistent.
   *
   * @throws InvalidJobConfigurationException if the stage is not valid
   */
  public void validate(JobConfiguration job) {
    Preconditions.checkNotNull(job, "job");
    // Properties are mutable after the stage was added, so checks done by JobConfiguration are
    // repeated here.
    if (stageId == null || stageId.trim().isEmpty()) {
      throw new InvalidJobConfigurationException("A stage cannot have a blank stage ID.");
    }
    TaskTypeInfo<?, ?> taskType = getTaskTypeInfo();
    if (taskType == null) {
      throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
          + " must have a known task type.");
    }
    if (getTaskCount() < 1) {
      throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
          + " must have at least one task.");
    }
    checkSerializable(taskType.getInputRecordClass());
    checkSerializable(taskType.getOutputRecordClass());

    validateInput(job, taskType);
    validateOutput(job, taskType);

    if (!dependentStages.isEmpty()) {
      if (childStage != null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " cannot have dependent stages because it has a child stage.");
      }
      for (String dependentStageId : dependentStages) {
        if (job.getStage(dependentStageId) == null) {
          throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
              + " specifies non-existent dependent stage ID " + dependentStageId + ".");
        }
      }
    }
  }

  private void validateInput(JobConfiguration job, TaskTypeInfo<?, ?> taskType) {
    if (dataInput != null) {
      if (parent != null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " cannot have data input because it is a child stage.");
      }
      if (!job.getInputStagesForStage(stageId).isEmpty()) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " cannot have both data input and an input channel.");
      }
      if (!taskType.consumes(dataInput.getRecordClass())) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s input record type " + taskType.getInputRecordClass().getName()
            + " is incompatible with its data input's record type "
            + dataInput.getRecordClass().getName() + ".");
      }
      if (!dataInput.getClass().getName().equals(dataInputType)) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s data input type must match the data input instance.");
      }
      return;
    }

    if (dataInputType != null) {
      throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
          + "'s data input type must be null when the stage has no data input.");
    }

    if (parent == null) {
      List<StageConfiguration> sendingStages = job.getInputStagesForStage(stageId);
      MultiInputRecordReaderInfo stageReader = null;
      if (sendingStages.size() > 1) {
        if (multiInputRecordReaderType == null) {
          throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
              + " must specify a stage multi-input record reader because it has more than one "
              + "input channel.");
        }
        stageReader = getMultiInputRecordReader(multiInputRecordReaderType);
      }

      for (StageConfiguration sendingStage : sendingStages) {
        ChannelConfiguration channel = sendingStage.getOutputChannel();
        if (channel.getMultiInputRecordReaderType() == null) {
          throw new InvalidJobConfigurationException("Stage " + sendingStage.getCompoundStageId()
              + "'s output channel must specify a multi-input record reader type.");
        }
        MultiInputRecordReaderInfo channelReader =
            sendingStage.getMultiInputRecordReader(channel.getMultiInputRecordReaderType());
        TaskTypeInfo<?, ?> sendingTaskType = sendingStage.getTaskTypeInfo();
        Class<?> channelRecordClass = sendingTaskType == null ? null
            : channelReader.getRecordClass(sendingTaskType.getOutputRecordClass());
        boolean compatible;
        if (stageReader != null) {
          compatible = channelRecordClass != null && stageReader.accepts(channelRecordClass)
              && taskType.consumes(stageReader.getRecordClass(channelRecordClass));
        } else {
          compatible = channelRecordClass != null && taskType.consumes(channelRecordClass);
        }
        if (!compatible) {
          throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
              + "'s input channel from stage " + sendingStage.getCompoundStageId()
              + " uses incompatible record type "
              + (channelRecordClass == null ? "<unknown>" : channelRecordClass.getName()) + ".");
        }
      }
    }
  }

  private void validateOutput(JobConfiguration job, TaskTypeInfo<?, ?> taskType) {
    if (dataOutput != null) {
      if (childStage != null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " cannot have data output because it has a child stage.");
      }
      if (outputChannel != null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " has both data output and an output channel.");
      }
      if (!taskType.produces(dataOutput.getRecordClass())) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s output record type " + taskType.getOutputRecordClass().getName()
            + " is incompatible with its data output's record type "
            + dataOutput.getRecordClass().getName() + ".");
      }
      if (!dataOutput.getClass().getName().equals(dataOutputType)) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s data output type must match the data output instance.");
      }
    } else if (dataOutputType != null) {
      throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
          + "'s data output type must be null when the stage has no data output.");
    }

    if (outputChannel != null) {
      if (childStage != null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " cannot have both a child stage and an output channel.");
      }
      if (outputChannel.getMultiInputRecordReaderType() == null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s output channel must specify a multi-input record reader type.");
      }
      if (outputChannel.getPartitionerClassName() == null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s output channel must specify a partitioner type.");
      }
      validatePartitionerClass(outputChannel.getPartitionerClassName(),
          taskType.getOutputRecordClass(), "Stage " + getCompoundStageId());
      MultiInputRecordReaderInfo channelReader =
          getMultiInputRecordReader(outputChannel.getMultiInputRecordReaderType());
      if (!channelReader.accepts(taskType.getOutputRecordClass())) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s output channel multi-input record reader type " + channelReader.getId()
            + " doesn't accept the stage's output record type "
            + taskType.getOutputRecordClass().getName() + ".");
      }
      // A channel without an output stage is allowed, its output is discarded.
      if (outputChannel.getOutputStage() != null
          && job.getStage(outputChannel.getOutputStage()) == null) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s output channel specifies non-existent output stage ID "
            + outputChannel.getOutputStage() + ".");
      }
    }

    if (childStage != null) {
      if (childStage.getTaskCount() > 1 && getInternalPartitionCount() > 1) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + " cannot have a child stage with internal partitioning because internal "
            + "partitioning was already applied in this compound stage.");
      }
      if (childStage.getTaskCount() > 1) {
        if (childStagePartitionerClassName == null) {
          throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
              + " must have a child stage partitioner because it has a child stage with "
              + "internal partitioning.");
        }
        validatePartitionerClass(childStagePartitionerClassName,
            taskType.getOutputRecordClass(), "Stage " + getCompoundStageId());
      }
      childStage.validate(job);
      if (!childStage.getTaskTypeInfo().consumes(taskType.getOutputRecordClass())) {
        throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
            + "'s output record type " + taskType.getOutputRecordClass().getName()
            + " does not match its child stage's input record type "
            + childStage.getTaskTypeInfo().getInputRecordClass().getName() + ".");
      }
    }
  }

  private MultiInputRecordReaderInfo getMultiInputRecordReader(String id) {
    MultiInputRecordReaderInfo info = registry.getMultiInputRecordReader(id);
    if (info == null) {
      throw new InvalidJobConfigurationException("Stage " + getCompoundStageId()
          + " uses unknown multi-input record reader type " + id + ".");
    }
    return info;
  }

  /**
   * Checks that a partitioner class implements {@link Partitioner} for the specified record
   * type. Partitioners that leave their record type open are accepted for any record type.
   */
  static void validatePartitionerClass(String className, Class<?> recordClass, String owner) {
    Class<?> partitionerClass;
    try {
      partitionerClass = ReflectionUtils.getClazz(className);
    } catch (JetReflectionException e) {
      throw new InvalidJobConfigurationException(owner + "'s partitioner type " + className
          + " could not be loaded.", e);
    }
    if (!Partitioner.class.isAssignableFrom(partitionerClass)) {
      throw new InvalidJobConfigurationException(owner + "'s partitioner type " + className
          + " must implement " + Partitioner.class.getName() + ".");
    }
    Class<?> partitionedClass = ReflectionUtils.getTypeArgument(partitionerClass,
        Partitioner.class);
    if (partitionedClass != null && !partitionedClass.equals(recordClass)) {
      throw new InvalidJobConfigurationException("The partitioner type " + className
          + " cannot partition objects of type " + recordClass.getName() + ".");
    }
  }

  private static void checkSerializable(Class<?> recordClass) {
    SerializationFactory factory = new SerializationFactory(new Configuration());
    if (factory.getSerializer(recordClass) == null) {
      throw new InvalidJobConfigurationException("No serialization found for record type "
          + recordClass.getName() + ".");
    }
  }

  JSONObject toJson() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("id", stageId);
    json.put("taskType", taskTypeId);
    json.put("taskCount", taskCount);
    if (!dependentStages.isEmpty()) {
      json.put("dependentStages", new JSONArray(dependentStages));
    }
    json.putOpt("childStagePartitioner", childStagePartitionerClassName);
    json.putOpt("multiInputRecordReader", multiInputRecordReaderType);
    if (settings != null) {
      json.put("settings", new JSONObject(settings));
    }
    if (outputChannel != null) {
      json.put("outputChannel", outputChannel.toJson());
    }
    if (dataInput != null) {
      JSONObject input = new JSONObject();
      input.put("type", dataInputType);
      JSONArray taskInputs = new JSONArray();
      for (TaskInput taskInput : dataInput.getTaskInputs()) {
        JSONObject taskInputJson = new JSONObject();
        taskInputJson.put("type", taskInput.getClass().getName());
        taskInput.writeJson(taskInputJson);
        taskInputs.put(taskInputJson);
      }
      input.put("taskInputs", taskInputs);
      json.put("dataInput", input);
    }
    if (dataOutput != null) {
      JSONObject output = new JSONObject();
      output.put("type", dataOutputType);
      json.put("dataOutput", output);
    }
    if (childStage != null) {
      json.put("childStage", childStage.toJson());
    }
    return json;
  }

  static StageConfiguration fromJson(JSONObject json, JobComponentRegistry registry)
      throws JSONException {
    StageConfiguration stage = new StageConfiguration(registry);
    stage.setStageId(json.getString("id"));
    stage.setTaskTypeId(json.optString("taskType", null));
    stage.setTaskCount(json.optInt("taskCount", 0));
    JSONArray dependencies = json.optJSONArray("dependentStages");
    if (dependencies != null) {
      for (int i = 0; i < dependencies.length(); i++) {
        stage.dependentStages.add(dependencies.getString(i));
      }
    }
    stage.setChildStagePartitionerClassName(json.optString("childStagePartitioner", null));
    stage.setMultiInputRecordReaderType(json.optString("multiInputRecordReader", null));
    JSONObject settingsJson = json.optJSONObject("settings");
    if (settingsJson != null) {
      Iterator<?> keys = settingsJson.keys();
      while (keys.hasNext()) {
        String key = (String) keys.next();
        stage.addSetting(key, settingsJson.getString(key));
      }
    }
    JSONObject channel = json.optJSONObject("outputChannel");
    if (channel != null) {
      stage.setOutputChannel(ChannelConfiguration.fromJson(channel));
    }
    // Data inputs and outputs are recreated from the stage settings, so settings come first.
    JSONObject input = json.optJSONObject("dataInput");
    if (input != null) {
      List<TaskInput> taskInputs = new ArrayList<TaskInput>();
      JSONArray taskInputsJson = input.getJSONArray("taskInputs");
      for (int i = 0; i < taskInputsJson.length(); i++) {
        JSONObject taskInputJson = taskInputsJson.getJSONObject(i);
        TaskInput taskInput = createInstance(taskInputJson.getString("type"));
        taskInput.readJson(taskInputJson);
        taskInputs.add(taskInput);
      }
      DataInput dataInput = createInstance(input.getString("type"));
      dataInput.restore(stage, taskInputs);
      stage.dataInput = dataInput;
      stage.dataInputType = input.getString("type");
    }
    JSONObject output = json.optJSONObject("dataOutput");
    if (output != null) {
      DataOutput dataOutput = createInstance(output.getString("type"));
      dataOutput.restore(stage);
      stage.dataOutput = dataOutput;
      stage.dataOutputType = output.getString("type");
    }
    JSONObject child = json.optJSONObject("childStage");
    if (child != null) {
      stage.setChildStage(fromJson(child, registry));
    }
    return stage;
  }

  private static <T> T createInstance(String className) {
    try {
      return ReflectionUtils.createClazzInstance(className);
    } catch (JetReflectionException e) {
      throw new InvalidJobConfigurationException("Could not create an instance of "
          + className + ".", e);
    }
  }

  @Override
  public String toString() {
    return "StageConfiguration [stageId=" + stageId + "]";
  }
}
