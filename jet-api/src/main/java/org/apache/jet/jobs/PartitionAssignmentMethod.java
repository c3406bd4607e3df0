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

/**
 * How the partitions of a channel are assigned to the tasks of the receiving stage when a task
 * receives more than one partition.
 */
@Public
public enum PartitionAssignmentMethod {
  /** Task 1 gets partitions 0 to n-1, task 2 gets n to 2n-1, and so on. */
  LINEAR,
  /** Task 1 gets partitions 0, t, 2t, and so on, where t is the number of tasks. */
  STRIPED
}
