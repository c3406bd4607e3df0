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

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.runtime.api.TaskContext;

/**
 * Writes the output of a stage to the file system. Output only becomes visible once the
 * committer returned by {@link #createOutput(int, TaskContext)} commits it.
 * <p/>
 * Implementations need a public no-argument constructor and store their settings in the stage
 * when added to it.
 */
@Public
public interface DataOutput {

  public Class<?> getRecordClass();

  public void notifyAddedToStage(StageConfiguration stage);

  public void restore(StageConfiguration stage);

  public OutputCommitter createOutput(int partitionNumber, TaskContext context)
      throws IOException;
}
