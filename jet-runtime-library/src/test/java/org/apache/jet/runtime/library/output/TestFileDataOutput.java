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

package org.apache.jet.runtime.library.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Text;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.OutputCommitter;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.jobs.TaskInput;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.records.TaskId;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.library.input.FileDataInput;
import org.apache.jet.runtime.library.input.FileTaskInput;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestFileDataOutput {

  private static Configuration defaultConf = new Configuration();
  private static FileSystem localFs;
  private static Path workDir;

  static {
    defaultConf.set("fs.defaultFS", "file:///");
    try {
      localFs = FileSystem.getLocal(defaultConf).getRaw();
      workDir = new Path(
          new Path(System.getProperty("test.build.data", "/tmp")),
          TestFileDataOutput.class.getName())
          .makeQualified(localFs.getUri(), localFs.getWorkingDirectory());
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private Path outputDir;
  private Path dfsJobDir;

  @Before
  public void setUp() {
    outputDir = new Path(workDir, "output");
    dfsJobDir = new Path(workDir, "job");
  }

  @Before
  @After
  public void cleanup() throws Exception {
    localFs.delete(workDir, true);
  }

  @Test(timeout = 5000)
  public void testOutputFileName() {
    assertEquals("WordCount-00003", FileDataOutput.getOutputFileName("WordCount", 3));
    assertEquals("Sort-123456", FileDataOutput.getOutputFileName("Sort", 123456));
  }

  @Test(timeout = 5000)
  @SuppressWarnings("unchecked")
  public void testWriteAndCommit() throws IOException {
    StageConfiguration stage = new StageConfiguration(new JobComponentRegistry());
    stage.setStageId("Write");
    TaskContext context = createContext(stage, new TaskId("Write", 2));

    FileDataOutput output = new FileDataOutput(outputDir, Text.class);
    OutputCommitter committer = output.createOutput(2, context);
    Path tempPath = new Path(new Path(dfsJobDir, "temp"), "Write-002_1_part2");
    assertEquals(tempPath, ((FileOutputCommitter) committer).getTempPath());
    RecordWriter<Text> writer = (RecordWriter<Text>) committer.getRecordWriter();
    writer.writeRecord(new Text("hello"));
    writer.writeRecord(new Text("world"));
    writer.close();
    assertTrue(localFs.exists(tempPath));

    Path finalPath = new Path(outputDir, "Write-00002");
    assertFalse(localFs.exists(finalPath));
    committer.commit();
    assertFalse(localFs.exists(tempPath));
    assertTrue(localFs.exists(finalPath));

    // Read the committed output back as a data input.
    FileDataInput input = new FileDataInput(defaultConf, outputDir, Text.class);
    List<TaskInput> taskInputs = input.getTaskInputs();
    assertEquals(1, taskInputs.size());
    assertEquals(finalPath, ((FileTaskInput) taskInputs.get(0)).getPath());
    RecordReader<Text> reader = (RecordReader<Text>) input.createRecordReader(
        taskInputs.get(0), context);
    assertTrue(reader.readRecord());
    assertEquals("hello", reader.getCurrentRecord().toString());
    assertTrue(reader.readRecord());
    assertEquals("world", reader.getCurrentRecord().toString());
    assertFalse(reader.readRecord());
    reader.close();
  }

  @Test(timeout = 5000)
  public void testCommitReplacesExistingOutput() throws IOException {
    Path tempPath = new Path(workDir, "temp1");
    Path finalPath = new Path(outputDir, "Stage-00000");
    localFs.create(tempPath).close();
    localFs.create(finalPath).close();
    RecordWriter<?> writer = mock(RecordWriter.class);
    FileOutputCommitter committer = new FileOutputCommitter(localFs, tempPath, finalPath, writer);
    committer.commit();
    assertFalse(localFs.exists(tempPath));
    assertTrue(localFs.exists(finalPath));
    try {
      committer.commit();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertEquals("The output has already been committed.", e.getMessage());
    }
  }

  @Test(timeout = 5000)
  public void testCommitWithoutTempFile() throws IOException {
    FileOutputCommitter committer = new FileOutputCommitter(localFs, new Path(workDir, "none"),
        new Path(outputDir, "Stage-00000"), mock(RecordWriter.class));
    try {
      committer.commit();
      fail("Expected IOException");
    } catch (IOException e) {
      assertTrue(e.getMessage().startsWith("Could not move"));
    }
  }

  @Test(timeout = 5000)
  public void testRestoreFromSettings() {
    StageConfiguration stage = new StageConfiguration(new JobComponentRegistry());
    stage.setStageId("Write");
    FileDataOutput output = new FileDataOutput(outputDir, Text.class);
    output.notifyAddedToStage(stage);

    FileDataOutput restored = new FileDataOutput();
    restored.restore(stage);
    assertEquals(outputDir, restored.getOutputPath());
    assertEquals(Text.class, restored.getRecordClass());
  }

  private TaskContext createContext(StageConfiguration stage, TaskId taskId) {
    TaskContext context = mock(TaskContext.class);
    doReturn(defaultConf).when(context).getConfiguration();
    doReturn(dfsJobDir).when(context).getDfsJobDirectory();
    doReturn(stage).when(context).getStageConfiguration();
    doReturn(taskId).when(context).getTaskId();
    doReturn(new TaskAttemptId(taskId, 1)).when(context).getTaskAttemptId();
    return context;
  }
}
