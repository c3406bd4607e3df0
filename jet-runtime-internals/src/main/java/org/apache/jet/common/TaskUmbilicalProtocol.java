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

package org.apache.jet.common;

import java.io.IOException;
import java.util.UUID;

import org.apache.hadoop.classification.InterfaceAudience;
import org.apache.hadoop.classification.InterfaceStability;
import org.apache.jet.records.TaskAttemptId;

/**
 * Protocol that a task attempt uses to contact the task server that started it. All
 * communication between the task and its host is via this protocol.
 */
@InterfaceAudience.Private
@InterfaceStability.Stable
public interface TaskUmbilicalProtocol {

  void reportProgress(UUID jobId, TaskAttemptId taskAttemptId, TaskProgress progress)
      throws IOException;

  void reportCompletion(UUID jobId, TaskAttemptId taskAttemptId, TaskMetrics metrics)
      throws IOException;

  /**
   * Reports that the task attempt failed. The coordinator decides whether the task is retried.
   */
  void reportError(UUID jobId, TaskAttemptId taskAttemptId, String failureMessage)
      throws IOException;
}
