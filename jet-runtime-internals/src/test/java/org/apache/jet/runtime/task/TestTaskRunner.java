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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.util.Arrays;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Text;
import org.apache.jet.common.JobServerTaskProtocol;
import org.apache.jet.common.TaskMetrics;
import org.apache.jet.common.TaskUmbilicalProtocol;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.JobConfiguration;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.records.TaskAttemptId;
import org.apache.jet.records.TaskId;
import org.apache.jet.runtime.library.input.FileDataInput;
import org.apache.jet.runtime.library.output.FileDataOutput;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestTaskRunner {

  private static Configuration defaultConf = new Configuration();
  private static FileSystem localFs;
  private static Path workDir;

  static {
    defaultConf.set("fs.defaultFS", "file:///");
    try {
      localFs = FileSystem.getLocal(defaultConf).getRaw();
      workDir = new Path(
          new Path(System.getProperty("test.build.data", "/tmp")),
          TestTaskRunner.class.getName())
          .makeQualified(localFs.getUri(), localFs.getWorkingDirectory());
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private final UUID jobId = UUID.randomUUID();
  private final TaskAttemptId attemptId = new TaskAttemptId(new TaskId("Read", 1), 1);
  private TaskUmbilicalProtocol umbilical;
  private JobComponentRegistry registry;
  private TaskRunner runner;
  private Path inputDir;
  private Path outputDir;
  private Path localJobDir;
  private Path dfsJobDir;

  @Before
  public void setUp() throws IOException {
    localFs.delete(workDir, true);
    inputDir = new Path(workDir, "input");
    outputDir = new Path(workDir, "output");
    localJobDir = new Path(workDir, "local");
    dfsJobDir = new Path(workDir, "dfs");
    umbilical = mock(TaskUmbilicalProtocol.class);
    registry = TaskTestComponents.createRegistry();
    runner = new TaskRunner(defaultConf, registry, umbilical,
        mock(JobServerTaskProtocol.class));
    TaskTestComponents.writeRecordFile(defaultConf, localFs, new Path(inputDir, "file1"),
        "one", "two");
  }

  @After
  public void cleanup() throws IOException {
    localFs.delete(workDir, true);
  }

  @Test(timeout = 10000)
  public void testRunReportsCompletion() throws IOException {
    saveJob(TaskTestComponents.IDENTITY_TASK);

    assertTrue(runner.run(jobId, localJobDir, dfsJobDir, attemptId));

    verify(umbilical).reportCompletion(eq(jobId), eq(attemptId), any(TaskMetrics.class));
    verify(umbilical, never()).reportError(any(UUID.class), any(TaskAttemptId.class),
        anyString());
    assertEquals(Arrays.asList("one", "two"), TaskTestComponents.readRecordFile(defaultConf,
        localFs, new Path(outputDir, "Read-00001")));
  }

  @Test(timeout = 10000)
  public void testRunReportsTaskError() throws IOException {
    saveJob(TaskTestComponents.FAILING_TASK);

    assertFalse(runner.run(jobId, localJobDir, dfsJobDir, attemptId));

    verify(umbilical).reportError(eq(jobId), eq(attemptId), contains("Task failure."));
    verify(umbilical, never()).reportCompletion(any(UUID.class), any(TaskAttemptId.class),
        any(TaskMetrics.class));
  }

  @Test(timeout = 10000)
  public void testMissingJobConfiguration() throws IOException {
    assertFalse(runner.run(jobId, localJobDir, dfsJobDir, attemptId));
    verify(umbilical).reportError(eq(jobId), eq(attemptId), anyString());
  }

  @Test(timeout = 10000)
  public void testErrorReportFailure() throws IOException {
    doThrow(new IOException("Connection refused")).when(umbilical).reportError(
        any(UUID.class), any(TaskAttemptId.class), anyString());
    assertFalse(runner.run(jobId, localJobDir, dfsJobDir, attemptId));
  }

  @Test(timeout = 10000)
  public void testInterruptedTaskIsNotReportedAsError() throws Exception {
    saveJob(TaskTestComponents.BLOCKING_TASK);
    TaskTestComponents.blockingTaskStarted = new CountDownLatch(1);
    final AtomicBoolean result = new AtomicBoolean(true);
    final AtomicBoolean interruptedAfterRun = new AtomicBoolean();
    Thread taskThread = new Thread(new Runnable() {
      @Override
      public void run() {
        result.set(runner.run(jobId, localJobDir, dfsJobDir, attemptId));
        interruptedAfterRun.set(Thread.currentThread().isInterrupted());
      }
    });
    taskThread.start();
    TaskTestComponents.blockingTaskStarted.await();
    taskThread.interrupt();
    taskThread.join();

    assertFalse(result.get());
    assertTrue(interruptedAfterRun.get());
    verify(umbilical, never()).reportError(any(UUID.class), any(TaskAttemptId.class),
        anyString());
    verify(umbilical, never()).reportCompletion(any(UUID.class), any(TaskAttemptId.class),
        any(TaskMetrics.class));
  }

  private void saveJob(String taskTypeId) throws IOException {
    JobConfiguration job = new JobConfiguration(registry);
    StageConfiguration read = job.addDataInputStage("Read",
        new FileDataInput(defaultConf, inputDir, Text.class), taskTypeId);
    read.setDataOutput(new FileDataOutput(outputDir, Text.class));
    job.saveJson(defaultConf, new Path(localJobDir, JobConfiguration.JOB_CONFIG_FILE_NAME));
  }
}
