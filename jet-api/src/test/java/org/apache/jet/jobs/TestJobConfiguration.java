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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.jet.api.InvalidJobConfigurationException;
import org.apache.jet.io.HashPartitioner;
import org.apache.jet.jobs.JobTestComponents.FakeDataInput;
import org.apache.jet.jobs.JobTestComponents.FakeDataOutput;
import org.apache.jet.jobs.JobTestComponents.FakeTaskInput;
import org.apache.jet.jobs.JobTestComponents.IntPartitioner;
import org.junit.Before;
import org.junit.Test;

public class TestJobConfiguration {

  private JobComponentRegistry registry;
  private JobConfiguration job;

  @Before
  public void setup() {
    registry = JobTestComponents.createRegistry();
    job = new JobConfiguration(registry);
  }

  private static List<String> stageIds(List<StageConfiguration> stages) {
    List<String> result = new ArrayList<String>();
    for (StageConfiguration stage : stages) {
      result.add(stage.getStageId());
    }
    return result;
  }

  @Test(timeout = 5000)
  public void testDataInputStage() {
    StageConfiguration stage = job.addDataInputStage("Read", new FakeDataInput("in", 4),
        JobTestComponents.TEXT_TASK);
    assertEquals(4, stage.getTaskCount());
    assertTrue(stage.hasDataInput());
    assertEquals(FakeDataInput.class.getName(), stage.getDataInputType());
    assertEquals("in", stage.getSetting(FakeDataInput.INPUT_NAME, null));
    assertSame(stage, job.getStage("Read"));
    job.validate();
  }

  @Test(timeout = 5000)
  public void testDataInputRecordTypeMismatch() {
    try {
      job.addDataInputStage("Read", new FakeDataInput("in", 1), JobTestComponents.SUM_TASK);
      fail("Expected record type mismatch");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("input record type"));
    }
  }

  @Test(timeout = 5000)
  public void testUnknownTaskType() {
    try {
      job.addStage("A", "nosuchtask", 1, null);
      fail("Expected unknown task type");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("nosuchtask"));
    }
  }

  @Test(timeout = 5000)
  public void testLinearJob() {
    StageConfiguration map = job.addDataInputStage("Map", new FakeDataInput("in", 3),
        JobTestComponents.LENGTH_TASK);
    StageConfiguration reduce = job.addStage("Reduce", JobTestComponents.SUM_TASK, 2,
        new InputStageInfo(map));
    StageConfiguration output = job.addStage("Output", JobTestComponents.SUM_TASK, 1,
        new InputStageInfo(reduce));
    output.setDataOutput(new FakeDataOutput());
    job.validate();

    ChannelConfiguration channel = map.getOutputChannel();
    assertEquals(ChannelType.FILE, channel.getChannelType());
    assertEquals("Reduce", channel.getOutputStage());
    assertEquals(HashPartitioner.class.getName(), channel.getPartitionerClassName());
    assertEquals(JobComponentRegistry.MULTI_RECORD_READER,
        channel.getMultiInputRecordReaderType());
    assertEquals(Arrays.asList("Map", "Reduce", "Output"),
        stageIds(job.getDependencyOrderedStages()));
    assertEquals(Arrays.asList(map), job.getInputStagesForStage("Reduce"));
    assertEquals(2, job.getAllChannels().size());
  }

  @Test(timeout = 5000)
  public void testTcpChannelOrdering() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("in", 2),
        JobTestComponents.TEXT_TASK);
    StageConfiguration b = job.addStage("B", JobTestComponents.TEXT_TASK, 2,
        new InputStageInfo(a).setChannelType(ChannelType.TCP));
    job.addStage("C", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(b));

    assertEquals(JobComponentRegistry.ROUND_ROBIN_RECORD_READER,
        a.getOutputChannel().getMultiInputRecordReaderType());
    assertEquals(Arrays.asList("B", "A", "C"), stageIds(job.getDependencyOrderedStages()));
  }

  @Test(timeout = 5000)
  public void testStageWithMultipleUpstreamPaths() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    StageConfiguration b = job.addDataInputStage("B", new FakeDataInput("b", 1),
        JobTestComponents.TEXT_TASK);
    StageConfiguration x = job.addStage("X", JobTestComponents.TEXT_TASK, 1,
        new InputStageInfo(a));
    job.addStage("C", JobTestComponents.TEXT_TASK, 1,
        Arrays.asList(new InputStageInfo(x), new InputStageInfo(b)),
        JobComponentRegistry.MERGE_RECORD_READER);
    job.validate();

    // C is reached through B and through X, and must come after both.
    assertEquals(Arrays.asList("A", "B", "X", "C"), stageIds(job.getDependencyOrderedStages()));
  }

  @Test(timeout = 5000)
  public void testExplicitDependency() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    job.addStage("D", JobTestComponents.TEXT_TASK, 1, null);
    job.addStage("B", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(a));
    a.getDependentStages().add("D");
    job.validate();

    assertEquals(Arrays.asList(a), job.getExplicitDependenciesForStage("D"));
    assertEquals(Arrays.asList("A", "B", "D"), stageIds(job.getDependencyOrderedStages()));
  }

  @Test(timeout = 5000)
  public void testMultipleInputsRequireStageReader() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    StageConfiguration b = job.addDataInputStage("B", new FakeDataInput("b", 1),
        JobTestComponents.TEXT_TASK);
    try {
      job.addStage("C", JobTestComponents.TEXT_TASK, 1,
          Arrays.asList(new InputStageInfo(a), new InputStageInfo(b)), null);
      fail("Expected missing stage reader");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("multi input record reader"));
    }
    assertNull(a.getOutputChannel());
  }

  @Test(timeout = 5000)
  public void testInputStageAlreadyHasOutputChannel() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    job.addStage("B", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(a));
    try {
      job.addStage("C", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(a));
      fail("Expected an error for an input stage with an output channel");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("output channel"));
    }
    assertNull(job.getStage("C"));
  }

  @Test(timeout = 5000)
  public void testIncompatibleRecordTypes() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    try {
      job.addStage("B", JobTestComponents.SUM_TASK, 1, new InputStageInfo(a));
      fail("Expected record type mismatch");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("correct type"));
    }
  }

  @Test(timeout = 5000)
  public void testPartitionerRecordTypeChecked() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    try {
      job.addStage("B", JobTestComponents.TEXT_TASK, 2, new InputStageInfo(a)
          .setPartitionerClassName(IntPartitioner.class.getName()));
      fail("Expected partitioner type mismatch");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("cannot partition"));
    }

    StageConfiguration lengths = job.addDataInputStage("L", new FakeDataInput("l", 1),
        JobTestComponents.LENGTH_TASK);
    StageConfiguration sum = job.addStage("S", JobTestComponents.SUM_TASK, 2,
        new InputStageInfo(lengths).setPartitionerClassName(IntPartitioner.class.getName()));
    assertEquals(IntPartitioner.class.getName(),
        lengths.getOutputChannel().getPartitionerClassName());
    assertEquals("S", sum.getStageId());
  }

  @Test(timeout = 5000)
  public void testPipelineChildStage() {
    StageConfiguration map = job.addDataInputStage("Map", new FakeDataInput("in", 3),
        JobTestComponents.LENGTH_TASK);
    StageConfiguration sort = job.addStage("Sort", JobTestComponents.SUM_TASK, 2,
        new InputStageInfo(map).setChannelType(ChannelType.PIPELINE));

    assertSame(sort, map.getChildStage());
    assertSame(map, sort.getParent());
    assertSame(map, sort.getRoot());
    assertSame(sort, map.getLeaf());
    assertEquals("Map.Sort", sort.getCompoundStageId());
    assertEquals(HashPartitioner.class.getName(), map.getChildStagePartitionerClassName());
    assertEquals(2, sort.getInternalPartitionCount());
    assertEquals(1, map.getInternalPartitionCount());
    assertNull(job.getStage("Sort"));
    assertSame(sort, job.getStageWithCompoundId("Map.Sort"));
    assertNull(job.getStageWithCompoundId("Map.Other"));
    assertNull(job.getPipelinedStages("Other.Sort"));
    assertEquals(Arrays.asList(map, sort), job.getPipelinedStages("Map.Sort"));
    assertEquals(6, job.getTotalTaskCount("Map.Sort"));
    assertEquals(2, JobConfiguration.getTotalTaskCount(job.getPipelinedStages("Map.Sort"), 1));

    StageConfiguration reduce = job.addStage("Reduce", JobTestComponents.SUM_TASK, 2,
        new InputStageInfo(sort));
    assertSame(reduce, job.getStage("Reduce"));
    assertEquals("Reduce", sort.getOutputChannel().getOutputStage());
    assertEquals(Arrays.asList(sort), job.getInputStagesForStage("Reduce"));
    job.validate();
  }

  @Test(timeout = 5000)
  public void testInternalPartitionCountMustMatchTaskCount() {
    StageConfiguration map = job.addDataInputStage("Map", new FakeDataInput("in", 3),
        JobTestComponents.LENGTH_TASK);
    StageConfiguration sort = job.addStage("Sort", JobTestComponents.SUM_TASK, 2,
        new InputStageInfo(map).setChannelType(ChannelType.PIPELINE));
    try {
      job.addStage("Reduce", JobTestComponents.SUM_TASK, 3, new InputStageInfo(sort));
      fail("Expected connectivity error");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("same number of tasks"));
    }
    // Two partitions per task on one task also matches the internal partition count.
    job.addStage("Reduce", JobTestComponents.SUM_TASK, 1,
        new InputStageInfo(sort).setPartitionsPerTask(2));
  }

  @Test(timeout = 5000)
  public void testPipelineRestrictions() {
    StageConfiguration map = job.addDataInputStage("Map", new FakeDataInput("in", 1),
        JobTestComponents.TEXT_TASK);
    try {
      job.addStage("Child", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(map)
          .setChannelType(ChannelType.PIPELINE).setPartitionsPerTask(2));
      fail("Expected pipeline partitions per task error");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("pipeline"));
    }
    job.addStage("Child", JobTestComponents.TEXT_TASK, 2, new InputStageInfo(map)
        .setChannelType(ChannelType.PIPELINE));
    try {
      job.addStage("Other", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(map)
          .setChannelType(ChannelType.PIPELINE));
      fail("Expected an error for a second child stage");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("already has a child stage"));
    }
  }

  @Test(timeout = 5000)
  public void testRenameStage() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    StageConfiguration b = job.addStage("B", JobTestComponents.TEXT_TASK, 1,
        new InputStageInfo(a));
    job.addStage("D", JobTestComponents.TEXT_TASK, 1, null);
    b.getDependentStages().add("D");

    job.renameStage(b, "Merge");
    assertEquals("Merge", a.getOutputChannel().getOutputStage());
    assertSame(b, job.getStage("Merge"));

    job.renameStage(job.getStage("D"), "Final");
    assertEquals(Arrays.asList("Final"), b.getDependentStages());
    job.validate();

    try {
      job.renameStage(a, "bad.name");
      fail("Expected invalid stage id");
    } catch (IllegalArgumentException e) {
      assertEquals("A", a.getStageId());
    }
  }

  @Test(timeout = 5000)
  public void testValidateErrors() {
    try {
      job.validate();
      fail("Expected error for empty job");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("no stages"));
    }

    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    StageConfiguration b = job.addStage("B", JobTestComponents.TEXT_TASK, 1, null);
    job.renameStage(b, "A");
    try {
      job.validate();
      fail("Expected duplicate stage id");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("duplicate"));
    }
    job.renameStage(b, "B");

    a.getDependentStages().add("Missing");
    try {
      job.validate();
      fail("Expected missing dependent stage");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("Missing"));
    }
    a.getDependentStages().clear();

    b.setTaskCount(0);
    try {
      job.validate();
      fail("Expected task count error");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("at least one task"));
    }
  }

  @Test(timeout = 5000)
  public void testDataOutputChecks() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    try {
      a.setDataOutput(new FakeDataOutput());
      fail("Expected output record type mismatch");
    } catch (InvalidJobConfigurationException e) {
      assertFalse(a.hasDataOutput());
    }
    job.addStage("B", JobTestComponents.TEXT_TASK, 1, new InputStageInfo(a));
    try {
      a.setDataOutput(new FakeDataOutput());
      fail("Expected data output error for stage with output channel");
    } catch (InvalidJobConfigurationException e) {
      assertTrue(e.getMessage().contains("output channel"));
    }
  }

  @Test(timeout = 5000)
  public void testSettings() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    job.addSetting("key", "job");
    job.addSetting("jobOnly", "1");
    a.addSetting("key", "stage");

    assertEquals("stage", a.getSetting("key", job, null));
    assertEquals("1", a.getSetting("jobOnly", job, null));
    assertEquals("default", a.getSetting("missing", job, "default"));
    assertNull(a.getSetting("jobOnly", null));
    assertEquals("stage", a.createConfiguration(job).get("key"));
    assertEquals("1", a.createConfiguration(job).get("jobOnly"));
  }

  @Test(timeout = 5000)
  public void testAdditionalProgressCounters() {
    StageConfiguration a = job.addDataInputStage("A", new FakeDataInput("a", 1),
        JobTestComponents.TEXT_TASK);
    StageConfiguration b = job.addDataInputStage("B", new FakeDataInput("b", 1),
        JobTestComponents.TEXT_TASK);
    job.addStage("C", JobTestComponents.TEXT_TASK, 1,
        Arrays.asList(new InputStageInfo(a), new InputStageInfo(b)),
        JobComponentRegistry.MERGE_RECORD_READER);

    List<String> names = new ArrayList<String>();
    for (AdditionalProgressCounter counter : job.getAdditionalProgressCounters()) {
      names.add(counter.getName());
    }
    assertEquals(Arrays.asList(JobTestComponents.TEXT_TASK,
        JobComponentRegistry.MERGE_RECORD_READER,
        JobConfiguration.getChannelCounterName(ChannelType.FILE)), names);
    assertFalse(job.addAdditionalProgressCounter(JobTestComponents.TEXT_TASK, "again"));
  }

  @Test(timeout = 5000)
  public void testJsonRoundTrip() throws Exception {
    job.setJobName("wordcount");
    job.addSetting("job.setting", "value");
    job.getSchedulerOptions().setMaximumDataDistance(1);
    job.getSchedulerOptions().setDataInputSchedulingMode(SchedulingMode.OPTIMAL_LOCALITY);
    StageConfiguration map = job.addDataInputStage("Map", new FakeDataInput("in", 3),
        JobTestComponents.LENGTH_TASK);
    StageConfiguration sort = job.addStage("Sort", JobTestComponents.SUM_TASK, 2,
        new InputStageInfo(map).setChannelType(ChannelType.PIPELINE));
    StageConfiguration reduce = job.addStage("Reduce", JobTestComponents.SUM_TASK, 1,
        new InputStageInfo(sort).setPartitionsPerTask(2)
            .setMultiInputRecordReaderType(JobComponentRegistry.MERGE_RECORD_READER)
            .setDisableDynamicPartitionAssignment(true)
            .setPartitionAssignmentMethod(PartitionAssignmentMethod.STRIPED));
    reduce.setDataOutput(new FakeDataOutput());
    reduce.addSetting("stage.setting", "x");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    job.saveJson(out);
    JobConfiguration loaded = JobConfiguration.loadJson(
        new ByteArrayInputStream(out.toByteArray()), registry);
    loaded.validate();

    assertEquals("wordcount", loaded.getJobName());
    assertEquals("value", loaded.getSetting("job.setting", null));
    assertEquals(1, loaded.getSchedulerOptions().getMaximumDataDistance());
    assertEquals(SchedulingMode.OPTIMAL_LOCALITY,
        loaded.getSchedulerOptions().getDataInputSchedulingMode());
    assertEquals(Arrays.asList("Map", "Reduce"), stageIds(loaded.getStages()));
    assertEquals(job.getAdditionalProgressCounters(), loaded.getAdditionalProgressCounters());

    StageConfiguration loadedMap = loaded.getStage("Map");
    assertEquals(3, loadedMap.getTaskCount());
    assertEquals("in", ((FakeDataInput) loadedMap.getDataInput()).getName());
    assertEquals(2, ((FakeTaskInput) loadedMap.getDataInput().getTaskInputs().get(2))
        .getIndex());
    StageConfiguration loadedSort = loaded.getStageWithCompoundId("Map.Sort");
    assertEquals(2, loadedSort.getTaskCount());
    assertEquals(HashPartitioner.class.getName(),
        loadedMap.getChildStagePartitionerClassName());

    ChannelConfiguration channel = loadedSort.getOutputChannel();
    assertEquals("Reduce", channel.getOutputStage());
    assertEquals(2, channel.getPartitionsPerTask());
    assertTrue(channel.isDisableDynamicPartitionAssignment());
    assertEquals(PartitionAssignmentMethod.STRIPED, channel.getPartitionAssignmentMethod());
    assertEquals(JobComponentRegistry.MERGE_RECORD_READER,
        channel.getMultiInputRecordReaderType());

    StageConfiguration loadedReduce = loaded.getStage("Reduce");
    assertTrue(loadedReduce.getDataOutput() instanceof FakeDataOutput);
    assertEquals("x", loadedReduce.getSetting("stage.setting", null));
  }
}
