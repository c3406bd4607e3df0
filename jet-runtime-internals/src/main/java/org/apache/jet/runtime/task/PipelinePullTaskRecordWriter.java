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
import java.io.InterruptedIOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.runtime.api.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Throwables;

/**
 * Feeds the records written by a parent task to a pipelined pull task that runs on its own
 * thread. The records pass through a bounded buffer, so a slow child task blocks the parent.
 * <p/>
 * The writer can be finished more than once: after {@link #finish()} the next record written
 * starts a new run of the child task's current instance.
 */
@Private
class PipelinePullTaskRecordWriter<I, O> extends RecordWriter<I> {

  private static final Logger LOG = LoggerFactory.getLogger(PipelinePullTaskRecordWriter.class);

  private static final Object END_OF_INPUT = new Object();
  private static final long OFFER_TIMEOUT_MS = 100;

  private final TaskExecution taskExecution;
  private final RecordWriter<O> output;
  private final int bufferSize;
  private BlockingQueue<Object> buffer;
  private Thread taskThread;
  private volatile Throwable taskError;

  PipelinePullTaskRecordWriter(TaskExecution taskExecution, RecordWriter<O> output) {
    this.taskExecution = taskExecution;
    this.output = output;
    this.bufferSize = taskExecution.getContext().getConfiguration().getInt(
        JetConfiguration.JET_PIPELINE_PULL_BUFFER_SIZE,
        JetConfiguration.JET_PIPELINE_PULL_BUFFER_SIZE_DEFAULT);
  }

  @Override
  protected void writeRecordInternal(I record) throws IOException {
    ensureTaskStarted();
    put(record);
  }

  /**
   * Signals the end of the input to the child task and waits for it to finish.
   */
  void finish() throws IOException {
    ensureTaskStarted();
    put(END_OF_INPUT);
    try {
      taskThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for pipelined task "
          + taskExecution.getContext().getTaskAttemptId() + " to finish.");
    } finally {
      taskThread = null;
      buffer = null;
    }
    checkTaskError();
  }

  @Override
  public void close() throws IOException {
    Thread thread = taskThread;
    if (thread != null) {
      LOG.warn("Pipelined task {} did not finish; interrupting it.",
          taskExecution.getContext().getTaskAttemptId());
      thread.interrupt();
      try {
        thread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      taskThread = null;
    }
  }

  private void ensureTaskStarted() throws IOException {
    checkTaskError();
    if (taskThread == null) {
      buffer = new ArrayBlockingQueue<Object>(bufferSize);
      final BlockingQueue<Object> taskBuffer = buffer;
      taskThread = new Thread(new Runnable() {
        @Override
        public void run() {
          runTask(taskBuffer);
        }
      }, "PipelinePullTask-" + taskExecution.getContext().getTaskAttemptId());
      taskThread.setDaemon(true);
      taskThread.start();
    }
  }

  @SuppressWarnings("unchecked")
  private void runTask(BlockingQueue<Object> taskBuffer) {
    try {
      Task<I, O> task = (Task<I, O>) taskExecution.getTask();
      task.run(new BufferRecordReader(taskBuffer), output);
    } catch (Throwable t) {
      LOG.error("Pipelined task " + taskExecution.getContext().getTaskAttemptId() + " failed.", t);
      taskError = t;
    }
  }

  private void put(Object record) throws IOException {
    try {
      while (!buffer.offer(record, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        checkTaskError();
        if (!taskThread.isAlive()) {
          if (record == END_OF_INPUT) {
            return;
          }
          throw new IOException("Pipelined task " + taskExecution.getContext().getTaskAttemptId()
              + " stopped reading its input.");
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while writing to pipelined task "
          + taskExecution.getContext().getTaskAttemptId() + ".");
    }
  }

  private void checkTaskError() throws IOException {
    Throwable error = taskError;
    if (error != null) {
      taskError = null;
      Throwables.throwIfInstanceOf(error, IOException.class);
      Throwables.throwIfUnchecked(error);
      throw new IOException("Pipelined task " + taskExecution.getContext().getTaskAttemptId()
          + " failed.", error);
    }
  }

  private final class BufferRecordReader extends RecordReader<I> {

    private final BlockingQueue<Object> taskBuffer;
    private boolean finished;

    BufferRecordReader(BlockingQueue<Object> taskBuffer) {
      this.taskBuffer = taskBuffer;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected boolean readRecordInternal() throws IOException {
      if (finished) {
        return false;
      }
      Object record;
      try {
        record = taskBuffer.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while waiting for input.");
      }
      if (record == END_OF_INPUT) {
        finished = true;
        setCurrentRecord(null);
        return false;
      }
      setCurrentRecord((I) record);
      return true;
    }

    @Override
    public float getProgress() {
      return finished ? 1.0f : 0.0f;
    }
  }
}
