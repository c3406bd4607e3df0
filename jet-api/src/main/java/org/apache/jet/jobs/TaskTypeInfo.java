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
import org.apache.jet.runtime.api.PrepartitionedPushTask;
import org.apache.jet.runtime.api.PushTask;
import org.apache.jet.runtime.api.RecordReuse;
import org.apache.jet.runtime.api.TaskFactory;

import com.google.common.base.Preconditions;

/**
 * Describes a task type registered with a {@link JobComponentRegistry}: its record types, how
 * instances are created and which runtime capabilities it declares.
 *
 * @param <I> the type of the input records
 * @param <O> the type of the output records
 */
@Public
public final class TaskTypeInfo<I, O> {

  /**
   * How the runtime drives a task.
   */
  public enum Kind {
    /** The task reads its input from a record reader. */
    PULL,
    /** The task is a {@link PushTask}. */
    PUSH,
    /** The task is a {@link PrepartitionedPushTask}. */
    PREPARTITIONED_PUSH
  }

  private final String id;
  private final Class<I> inputRecordClass;
  private final Class<O> outputRecordClass;
  private final TaskFactory<I, O> factory;
  private final Kind kind;
  private final RecordReuse recordReuse;
  private final boolean processesAllInputPartitions;
  private final boolean additionalProgress;

  private TaskTypeInfo(Builder<I, O> builder) {
    this.id = builder.id;
    this.inputRecordClass = builder.inputRecordClass;
    this.outputRecordClass = builder.outputRecordClass;
    this.factory = builder.factory;
    this.kind = builder.kind;
    this.recordReuse = builder.recordReuse;
    this.processesAllInputPartitions = builder.processesAllInputPartitions;
    this.additionalProgress = builder.additionalProgress;
  }

  public static <I, O> Builder<I, O> newBuilder(String id, Class<I> inputRecordClass,
      Class<O> outputRecordClass, TaskFactory<I, O> factory) {
    return new Builder<I, O>(id, inputRecordClass, outputRecordClass, factory);
  }

  public String getId() {
    return id;
  }

  public Class<I> getInputRecordClass() {
    return inputRecordClass;
  }

  public Class<O> getOutputRecordClass() {
    return outputRecordClass;
  }

  public TaskFactory<I, O> getFactory() {
    return factory;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isPushTask() {
    return kind != Kind.PULL;
  }

  public boolean isOutputPrepartitioned() {
    return kind == Kind.PREPARTITIONED_PUSH;
  }

  public RecordReuse getRecordReuse() {
    return recordReuse;
  }

  /**
   * Indicates the task receives all of its input partitions in a single run, rather than being
   * recreated for each partition.
   */
  public boolean processesAllInputPartitions() {
    return processesAllInputPartitions;
  }

  /**
   * Indicates task instances implement {@link org.apache.jet.io.HasAdditionalProgress}.
   */
  public boolean hasAdditionalProgress() {
    return additionalProgress;
  }

  public boolean consumes(Class<?> recordClass) {
    return inputRecordClass.equals(recordClass);
  }

  public boolean produces(Class<?> recordClass) {
    return outputRecordClass.equals(recordClass);
  }

  @Override
  public String toString() {
    return "TaskTypeInfo [id=" + id + ", input=" + inputRecordClass.getName()
        + ", output=" + outputRecordClass.getName() + ", kind=" + kind + "]";
  }

  public static final class Builder<I, O> {
    private final String id;
    private final Class<I> inputRecordClass;
    private final Class<O> outputRecordClass;
    private final TaskFactory<I, O> factory;
    private Kind kind = Kind.PULL;
    private RecordReuse recordReuse = RecordReuse.NOT_ALLOWED;
    private boolean processesAllInputPartitions;
    private boolean additionalProgress;

    private Builder(String id, Class<I> inputRecordClass, Class<O> outputRecordClass,
        TaskFactory<I, O> factory) {
      Preconditions.checkArgument(id != null && !id.isEmpty(), "Task type id must be specified");
      this.id = id;
      this.inputRecordClass = Preconditions.checkNotNull(inputRecordClass, "inputRecordClass");
      this.outputRecordClass = Preconditions.checkNotNull(outputRecordClass, "outputRecordClass");
      this.factory = Preconditions.checkNotNull(factory, "factory");
    }

    public Builder<I, O> setKind(Kind kind) {
      this.kind = Preconditions.checkNotNull(kind);
      return this;
    }

    public Builder<I, O> setRecordReuse(RecordReuse recordReuse) {
      this.recordReuse = Preconditions.checkNotNull(recordReuse);
      return this;
    }

    public Builder<I, O> setProcessesAllInputPartitions(boolean value) {
      this.processesAllInputPartitions = value;
      return this;
    }

    public Builder<I, O> setAdditionalProgress(boolean value) {
      this.additionalProgress = value;
      return this;
    }

    public TaskTypeInfo<I, O> build() {
      return new TaskTypeInfo<I, O>(this);
    }
  }
}
