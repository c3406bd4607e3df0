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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.jet.api.InvalidJobConfigurationException;
import org.apache.jet.io.HashPartitioner;
import org.apache.jet.records.TaskId;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.io.CharStreams;

/**
 * The configuration of a job: a graph of stages connected by channels, plus job wide settings.
 * <p>
 * Root stages are added with {@link #addDataInputStage(String, DataInput, String)} and
 * {@link #addStage(String, String, int, List, String)}. A stage added with a
 * {@link ChannelType#PIPELINE} input becomes a child stage of its input and is executed in the
 * same task.
 */
@Public
public class JobConfiguration {

  private static final Logger LOG = LoggerFactory.getLogger(JobConfiguration.class);

  /** Name of the file, in the local job directory, that holds the job configuration. */
  public static final String JOB_CONFIG_FILE_NAME = "job.json";

  private final JobComponentRegistry registry;
  private final List<StageConfiguration> stages = new ArrayList<StageConfiguration>();
  private final List<AdditionalProgressCounter> additionalProgressCounters =
      new ArrayList<AdditionalProgressCounter>();
  private String jobName;
  private SchedulerOptions schedulerOptions;
  private Map<String, String> settings;

  public JobConfiguration(JobComponentRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry, "registry");
  }

  public JobComponentRegistry getRegistry() {
    return registry;
  }

  public String getJobName() {
    return jobName;
  }

  public void setJobName(String jobName) {
    this.jobName = jobName;
  }

  /**
   * Returns the root stages of the job. Child stages are reached through
   * {@link StageConfiguration#getChildStage()}.
   */
  public List<StageConfiguration> getStages() {
    return stages;
  }

  public List<AdditionalProgressCounter> getAdditionalProgressCounters() {
    return Collections.unmodifiableList(additionalProgressCounters);
  }

  public SchedulerOptions getSchedulerOptions() {
    if (schedulerOptions == null) {
      schedulerOptions = new SchedulerOptions();
    }
    return schedulerOptions;
  }

  public void setSchedulerOptions(SchedulerOptions schedulerOptions) {
    this.schedulerOptions = schedulerOptions;
  }

  /**
   * Adds a stage that reads from a data input. The stage has one task per task input.
   */
  public StageConfiguration addDataInputStage(String stageId, DataInput input,
      String taskTypeId) {
    Preconditions.checkNotNull(stageId, "stageId");
    Preconditions.checkArgument(!stageId.isEmpty(), "Stage ID cannot be empty.");
    Preconditions.checkNotNull(input, "input");
    Preconditions.checkNotNull(taskTypeId, "taskTypeId");

    StageConfiguration stage = createStage(stageId, taskTypeId, 0, input);
    stages.add(stage);
    return stage;
  }

  public StageConfiguration addStage(String stageId, String taskTypeId, int taskCount,
      InputStageInfo inputStage) {
    return addStage(stageId, taskTypeId, taskCount,
        inputStage == null ? null : Collections.singletonList(inputStage), null);
  }

  /**
   * Adds a stage that reads from the output of other stages.
   *
   * @param stageMultiInputRecordReaderType id of the multi-input record reader that combines
   *          the input channels; required if there is more than one input stage
   * @return the new stage; for a pipeline input this is a child stage of the input stage
   */
  public StageConfiguration addStage(String stageId, String taskTypeId, int taskCount,
      List<InputStageInfo> inputStages, String stageMultiInputRecordReaderType) {
    Preconditions.checkNotNull(stageId, "stageId");
    Preconditions.checkNotNull(taskTypeId, "taskTypeId");
    if (taskCount <= 0) {
      throw new InvalidJobConfigurationException("A stage must have at least one task.");
    }
    TaskTypeInfo<?, ?> taskType = getTaskType(taskTypeId);
    Class<?> inputClass = taskType.getInputRecordClass();

    boolean isPipelineChannel = false;
    boolean hasInputs = inputStages != null && !inputStages.isEmpty();
    if (hasInputs) {
      if (inputStages.size() > 1 && stageMultiInputRecordReaderType == null) {
        throw new InvalidJobConfigurationException("You must specify a stage multi input "
            + "record reader if there is more than one input stage.");
      }
      for (InputStageInfo info : inputStages) {
        if (info.getChannelType() == ChannelType.PIPELINE) {
          if (info.getPartitionsPerTask() > 1) {
            throw new InvalidJobConfigurationException("When using a pipeline channel, you "
                + "cannot use multiple partitions per task.");
          }
          if (inputStages.size() > 1) {
            throw new InvalidJobConfigurationException("When using a pipeline channel you can "
                + "specify only one input.");
          }
          isPipelineChannel = true;
        }
        info.validateTypes(registry, stageMultiInputRecordReaderType, inputClass);
      }
    }

    StageConfiguration stage = createStage(stageId, taskTypeId, taskCount, null);
    if (isPipelineChannel) {
      InputStageInfo parentInfo = inputStages.get(0);
      addChildStage(parentInfo.getPartitionerClassName(), stage, parentInfo.getInputStage());
      return stage;
    }

    if (hasInputs) {
      if (inputStages.size() > 1) {
        stage.setMultiInputRecordReaderType(stageMultiInputRecordReaderType);
        addMultiInputRecordReaderCounter(stageMultiInputRecordReaderType);
      }
      validateChannelConnectivityConstraints(inputStages, stage);

      for (InputStageInfo info : inputStages) {
        StageConfiguration inputStage = info.getInputStage();
        if (inputStage.getChildStage() != null) {
          throw new InvalidJobConfigurationException("Input stage "
              + inputStage.getCompoundStageId() + " already has a child stage so cannot be used "
              + "as input.");
        } else if (inputStage.hasDataOutput()) {
          throw new InvalidJobConfigurationException("Input stage "
              + inputStage.getCompoundStageId() + " already has DFS output so cannot be used as "
              + "input.");
        } else if (inputStage.getOutputChannel() != null) {
          throw new InvalidJobConfigurationException("Input stage "
              + inputStage.getCompoundStageId() + " already has an output channel so cannot be "
              + "used as input.");
        }
      }

      for (InputStageInfo info : inputStages) {
        info.getInputStage().setOutputChannel(info.createChannel(stageId));
        addChannelCounter(info.getChannelType());
        addMultiInputRecordReaderCounter(info.getMultiInputRecordReaderType());
      }
    }
    stages.add(stage);
    return stage;
  }

  private static void validateChannelConnectivityConstraints(List<InputStageInfo> inputStages,
      StageConfiguration stage) {
    // Only the first input is checked; with more than one input, partitionsPerTask must be 1.
    InputStageInfo info = inputStages.get(0);
    if (info.getPartitionsPerTask() > 1 && inputStages.size() > 1) {
      throw new InvalidJobConfigurationException("Using multiple partitions per task is not "
          + "supported when using multiple input stages.");
    }
    int internalPartitionCount = info.getInputStage().getInternalPartitionCount();
    if (internalPartitionCount > 1
        && internalPartitionCount != stage.getTaskCount() * info.getPartitionsPerTask()) {
      throw new InvalidJobConfigurationException("A fully connected stage with an internally "
          + "partitioned compound stage as input needs to have the same number of tasks as the "
          + "input child stage.");
    }
  }

  private static void addChildStage(String partitionerClassName, StageConfiguration stage,
      StageConfiguration parentStage) {
    if (parentStage.getChildStage() != null) {
      throw new InvalidJobConfigurationException("Cannot add child stage to stage "
          + parentStage.getCompoundStageId() + " because it already has a child stage.");
    }
    if (stage.getTaskCount() > 1 && parentStage.getInternalPartitionCount() > 1) {
      throw new InvalidJobConfigurationException("Cannot add child stage with internal "
          + "partitioning to stage " + parentStage.getCompoundStageId()
          + " because it already uses internal partitioning.");
    }
    if (stage.getOutputChannel() != null) {
      throw new InvalidJobConfigurationException("Cannot add child stage "
          + stage.getStageId() + " because it already has an output channel.");
    }
    if (!stage.getDependentStages().isEmpty()) {
      throw new InvalidJobConfigurationException("Cannot add child stage "
          + stage.getStageId() + " because other stages have a scheduling dependency on it.");
    }
    parentStage.setChildStage(stage);
    parentStage.setChildStagePartitionerClassName(partitionerClassName == null
        ? HashPartitioner.class.getName() : partitionerClassName);
  }

  private StageConfiguration createStage(String stageId, String taskTypeId, int taskCount,
      DataInput input) {
    TaskTypeInfo<?, ?> taskType = getTaskType(taskTypeId);
    StageConfiguration stage = new StageConfiguration(registry);
    stage.setStageId(stageId);
    stage.setTaskTypeId(taskTypeId);
    stage.setTaskCount(taskCount);
    if (input != null) {
      // Validates the record types.
      stage.setDataInput(input);
    }
    if (taskType.hasAdditionalProgress()) {
      addAdditionalProgressCounter(taskType.getId(), taskType.getId());
    }
    return stage;
  }

  private TaskTypeInfo<?, ?> getTaskType(String taskTypeId) {
    TaskTypeInfo<?, ?> taskType = registry.getTaskType(taskTypeId);
    if (taskType == null) {
      throw new InvalidJobConfigurationException("Unknown task type " + taskTypeId + ".");
    }
    return taskType;
  }

  private void addMultiInputRecordReaderCounter(String id) {
    MultiInputRecordReaderInfo info = registry.getMultiInputRecordReader(id);
    if (info != null && info.hasAdditionalProgress()) {
      addAdditionalProgressCounter(info.getId(), info.getId());
    }
  }

  private void addChannelCounter(ChannelType channelType) {
    switch (channelType) {
    case FILE:
      addAdditionalProgressCounter(getChannelCounterName(channelType), "File input channel");
      break;
    case TCP:
      addAdditionalProgressCounter(getChannelCounterName(channelType), "TCP input channel");
      break;
    default:
      break;
    }
  }

  /**
   * Returns the name under which input channels of the specified type report additional
   * progress.
   */
  public static String getChannelCounterName(ChannelType channelType) {
    return "channel." + channelType.name().toLowerCase(java.util.Locale.ROOT);
  }

  /**
   * Adds a counter for a source of additional progress, unless a counter with the same name
   * exists.
   *
   * @return <code>true</code> if the counter was added
   */
  public boolean addAdditionalProgressCounter(String name, String displayName) {
    AdditionalProgressCounter counter = new AdditionalProgressCounter(name, displayName);
    if (additionalProgressCounters.contains(counter)) {
      return false;
    }
    additionalProgressCounters.add(counter);
    return true;
  }

  /**
   * @return the root stage with the specified id, or <code>null</code>
   */
  public StageConfiguration getStage(String stageId) {
    for (StageConfiguration stage : stages) {
      if (stage.getStageId() != null && stage.getStageId().equals(stageId)) {
        return stage;
      }
    }
    return null;
  }

  /**
   * Returns the stages of a compound stage id from the root to the named stage, or
   * <code>null</code> if any of them doesn't exist.
   */
  public List<StageConfiguration> getPipelinedStages(String compoundStageId) {
    Preconditions.checkNotNull(compoundStageId, "compoundStageId");
    String[] stageIds = splitCompoundStageId(compoundStageId);
    List<StageConfiguration> result = new ArrayList<StageConfiguration>(stageIds.length);
    StageConfiguration current = getStage(stageIds[0]);
    for (int x = 0; x < stageIds.length; ++x) {
      if (x > 0) {
        current = current.getNamedChildStage(stageIds[x]);
      }
      if (current == null) {
        return null;
      }
      result.add(current);
    }
    return result;
  }

  /**
   * @return the stage with the specified compound id, or <code>null</code>
   */
  public StageConfiguration getStageWithCompoundId(String compoundStageId) {
    List<StageConfiguration> pipelined = getPipelinedStages(compoundStageId);
    return pipelined == null ? null : pipelined.get(pipelined.size() - 1);
  }

  private static String[] splitCompoundStageId(String compoundStageId) {
    return compoundStageId.split(java.util.regex.Pattern.quote(
        String.valueOf(TaskId.CHILD_STAGE_SEPARATOR)), -1);
  }

  /**
   * Returns the number of task instances of a stage, which is the product of its task count and
   * the task counts of its parents.
   */
  public int getTotalTaskCount(String compoundStageId) {
    List<StageConfiguration> pipelined = getPipelinedStages(compoundStageId);
    if (pipelined == null) {
      throw new IllegalArgumentException("Unknown stage " + compoundStageId);
    }
    return getTotalTaskCount(pipelined, 0);
  }

  public static int getTotalTaskCount(List<StageConfiguration> stages, int start) {
    Preconditions.checkNotNull(stages, "stages");
    int result = 1;
    for (int x = start; x < stages.size(); ++x) {
      result *= stages.get(x).getTaskCount();
    }
    return result;
  }

  /**
   * Returns the leaf stages whose output channel sends to the specified stage.
   */
  public List<StageConfiguration> getInputStagesForStage(String stageId) {
    Preconditions.checkNotNull(stageId, "stageId");
    List<StageConfiguration> result = new ArrayList<StageConfiguration>();
    for (StageConfiguration stage : stages) {
      StageConfiguration leaf = stage.getLeaf();
      if (leaf.getOutputChannel() != null
          && stageId.equals(leaf.getOutputChannel().getOutputStage())) {
        result.add(leaf);
      }
    }
    return result;
  }

  /**
   * Returns the leaf stages that list the specified stage as a dependent stage.
   */
  public List<StageConfiguration> getExplicitDependenciesForStage(String stageId) {
    Preconditions.checkNotNull(stageId, "stageId");
    List<StageConfiguration> result = new ArrayList<StageConfiguration>();
    for (StageConfiguration stage : stages) {
      StageConfiguration leaf = stage.getLeaf();
      if (leaf.getDependentStages().contains(stageId)) {
        result.add(leaf);
      }
    }
    return result;
  }

  /**
   * Renames a stage. For a root stage, dependencies and channels that refer to it are updated.
   */
  public void renameStage(StageConfiguration stage, String newName) {
    Preconditions.checkNotNull(stage, "stage");
    Preconditions.checkNotNull(newName, "newName");
    if (!TaskId.isValidStageId(newName)) {
      throw new IllegalArgumentException(
          "A stage ID cannot contain the character '.', '-' or '_'.");
    }

    if (stage.getParent() == null) {
      String oldName = stage.getStageId();
      for (StageConfiguration dependency : getExplicitDependenciesForStage(oldName)) {
        dependency.getDependentStages().remove(oldName);
        dependency.getDependentStages().add(newName);
      }
      for (StageConfiguration inputStage : getInputStagesForStage(oldName)) {
        inputStage.getOutputChannel().setOutputStage(newName);
      }
    }
    stage.setStageId(newName);
  }

  public List<ChannelConfiguration> getAllChannels() {
    List<ChannelConfiguration> result = new ArrayList<ChannelConfiguration>();
    for (StageConfiguration stage : stages) {
      StageConfiguration leaf = stage.getLeaf();
      if (leaf.getOutputChannel() != null) {
        result.add(leaf.getOutputChannel());
      }
    }
    return result;
  }

  /**
   * Returns the root stages in an order in which they can be scheduled. A stage with a TCP input
   * channel is placed before the stages that send to it.
   */
  public List<StageConfiguration> getDependencyOrderedStages() {
    List<StageConfiguration> result = new ArrayList<StageConfiguration>(stages.size());
    Deque<StageConfiguration> nextStages = new ArrayDeque<StageConfiguration>();
    for (StageConfiguration stage : stages) {
      if (getExplicitDependenciesForStage(stage.getStageId()).isEmpty()
          && getInputStagesForStage(stage.getStageId()).isEmpty()) {
        nextStages.add(stage);
      }
    }

    while (!nextStages.isEmpty()) {
      StageConfiguration nextStage = nextStages.poll();
      // A stage with multiple inputs may already be in the list; it moves after its last input.
      result.remove(nextStage);

      int tcpInputIndex = Integer.MAX_VALUE;
      for (StageConfiguration inputStage : getInputStagesForStage(nextStage.getStageId())) {
        if (inputStage.getOutputChannel().getChannelType() == ChannelType.TCP) {
          tcpInputIndex = Math.min(tcpInputIndex, result.indexOf(inputStage.getRoot()));
        }
      }
      if (tcpInputIndex != Integer.MAX_VALUE && tcpInputIndex >= 0) {
        result.add(tcpInputIndex, nextStage);
      } else {
        result.add(nextStage);
      }

      StageConfiguration leaf = nextStage.getLeaf();
      if (leaf.getOutputChannel() != null && leaf.getOutputChannel().getOutputStage() != null) {
        StageConfiguration outputStage = getStage(leaf.getOutputChannel().getOutputStage());
        if (outputStage != null) {
          nextStages.add(outputStage);
        }
      }
      for (String stageId : leaf.getDependentStages()) {
        StageConfiguration dependent = getStage(stageId);
        if (dependent != null) {
          nextStages.add(dependent);
        }
      }
    }
    return result;
  }

  /**
   * Checks that the job is consistent.
   *
   * @throws InvalidJobConfigurationException if it is not
   */
  public void validate() {
    if (stages.isEmpty()) {
      throw new InvalidJobConfigurationException("The job has no stages.");
    }
    Set<String> stageIds = new HashSet<String>();
    for (StageConfiguration stage : stages) {
      stage.validate(this);
      if (!stageIds.add(stage.getStageId())) {
        throw new InvalidJobConfigurationException("The job contains duplicate stage ID "
            + stage.getStageId() + ".");
      }
    }
  }

  /**
   * @return the job settings, or <code>null</code> if none were added
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

  public JSONObject toJson() throws JSONException {
    JSONObject json = new JSONObject();
    json.putOpt("name", jobName);
    JSONArray stagesJson = new JSONArray();
    for (StageConfiguration stage : stages) {
      stagesJson.put(stage.toJson());
    }
    json.put("stages", stagesJson);
    JSONArray counters = new JSONArray();
    for (AdditionalProgressCounter counter : additionalProgressCounters) {
      JSONObject counterJson = new JSONObject();
      counterJson.put("name", counter.getName());
      counterJson.put("displayName", counter.getDisplayName());
      counters.put(counterJson);
    }
    json.put("additionalProgressCounters", counters);
    if (schedulerOptions != null) {
      json.put("schedulerOptions", schedulerOptions.toJson());
    }
    if (settings != null) {
      json.put("settings", new JSONObject(settings));
    }
    return json;
  }

  public static JobConfiguration fromJson(JSONObject json, JobComponentRegistry registry)
      throws JSONException {
    JobConfiguration job = new JobConfiguration(registry);
    job.setJobName(json.optString("name", null));
    JSONObject settingsJson = json.optJSONObject("settings");
    if (settingsJson != null) {
      Iterator<?> keys = settingsJson.keys();
      while (keys.hasNext()) {
        String key = (String) keys.next();
        job.addSetting(key, settingsJson.getString(key));
      }
    }
    JSONArray stagesJson = json.getJSONArray("stages");
    for (int i = 0; i < stagesJson.length(); i++) {
      job.stages.add(StageConfiguration.fromJson(stagesJson.getJSONObject(i), registry));
    }
    JSONArray counters = json.optJSONArray("additionalProgressCounters");
    if (counters != null) {
      for (int i = 0; i < counters.length(); i++) {
        JSONObject counter = counters.getJSONObject(i);
        job.addAdditionalProgressCounter(counter.getString("name"),
            counter.optString("displayName", null));
      }
    }
    JSONObject options = json.optJSONObject("schedulerOptions");
    if (options != null) {
      job.setSchedulerOptions(SchedulerOptions.fromJson(options));
    }
    return job;
  }

  public void saveJson(OutputStream stream) throws IOException {
    Preconditions.checkNotNull(stream, "stream");
    Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
    try {
      writer.write(toJson().toString(2));
    } catch (JSONException e) {
      throw new IOException("Could not serialize job configuration", e);
    }
    writer.flush();
  }

  public void saveJson(Configuration conf, Path path) throws IOException {
    FileSystem fs = path.getFileSystem(conf);
    FSDataOutputStream out = fs.create(path, true);
    try {
      saveJson(out);
    } finally {
      out.close();
    }
    LOG.debug("Saved job configuration to {}", path);
  }

  public static JobConfiguration loadJson(InputStream stream, JobComponentRegistry registry)
      throws IOException {
    Preconditions.checkNotNull(stream, "stream");
    String text = CharStreams.toString(new InputStreamReader(stream, StandardCharsets.UTF_8));
    try {
      return fromJson(new JSONObject(text), registry);
    } catch (JSONException e) {
      throw new IOException("Could not parse job configuration", e);
    }
  }

  public static JobConfiguration loadJson(Configuration conf, Path path,
      JobComponentRegistry registry) throws IOException {
    FileSystem fs = path.getFileSystem(conf);
    FSDataInputStream in = fs.open(path);
    try {
      return loadJson(in, registry);
    } finally {
      in.close();
    }
  }
}
