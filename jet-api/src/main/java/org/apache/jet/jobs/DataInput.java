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
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.io.RecordReader;
import org.apache.jet.runtime.api.TaskContext;

/**
 * Provides the input of a stage that reads directly from the file system. There is one task per
 * task input.
 * <p/>
 * A data input stores everything it needs at run time in the stage settings when it is added to a
 * stage. Implementations need a public no-argument constructor; a data input loaded from a saved
 * job configuration is restored with {@link #restore(StageConfiguration, List)}.
 */
@Public
public interface DataInput {

  public Class<?> getRecordClass();

  public List<TaskInput> getTaskInputs();

  public void notifyAddedToStage(StageConfiguration stage);

  public void restore(StageConfiguration stage, List<TaskInput> taskInputs);

  public RecordReader<?> createRecordReader(TaskInput input, TaskContext context)
      throws IOException;
}
