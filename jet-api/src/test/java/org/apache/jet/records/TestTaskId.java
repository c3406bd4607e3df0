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

package org.apache.jet.records;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TestTaskId {

  @Test(timeout = 5000)
  public void testFormat() {
    TaskId taskId = new TaskId("Map", 7);
    assertEquals("Map-007", taskId.toString());
    assertEquals("Map", taskId.getCompoundStageId());
    assertNull(taskId.getParentTaskId());
    assertEquals(7, taskId.getPartitionNumber());

    TaskAttemptId attemptId = new TaskAttemptId(taskId, 2);
    assertEquals("Map-007_2", attemptId.toString());
  }

  @Test(timeout = 5000)
  public void testChildTaskIds() {
    TaskId parent = new TaskId("Map", 3);
    TaskId child = new TaskId(parent, "Sort", 1);
    assertEquals("Map-003.Sort-001", child.toString());
    assertEquals("Map.Sort", child.getCompoundStageId());
    // A child that is not internally partitioned works on its parent's partition.
    assertEquals(3, child.getPartitionNumber());
    assertEquals(2, new TaskId(parent, "Sort", 2).getPartitionNumber());
  }

  @Test(timeout = 5000)
  public void testParse() {
    TaskId parsed = TaskId.fromString("Map-003.Sort-002");
    assertEquals(new TaskId(new TaskId("Map", 3), "Sort", 2), parsed);
    assertEquals("Sort", parsed.getStageId());
    assertEquals(2, parsed.getTaskNumber());
    assertEquals(new TaskId("Map", 3), parsed.getParentTaskId());

    TaskAttemptId attemptId = TaskAttemptId.fromString("Map-003.Sort-002_4");
    assertEquals(parsed, attemptId.getTaskId());
    assertEquals(4, attemptId.getAttempt());
  }

  @Test(timeout = 5000, expected = IllegalArgumentException.class)
  public void testParseInvalid() {
    TaskId.fromString("Map");
  }

  @Test(timeout = 5000)
  public void testOrdering() {
    assertTrue(new TaskId("Map", 2).compareTo(new TaskId("Map", 10)) < 0);
    assertTrue(new TaskId("Map", 1).compareTo(new TaskId("Reduce", 1)) < 0);
  }

  @Test(timeout = 5000)
  public void testStageIdValidation() {
    assertTrue(TaskId.isValidStageId("Map"));
    assertFalse(TaskId.isValidStageId("Map.Sort"));
    assertFalse(TaskId.isValidStageId("Map-1"));
    assertFalse(TaskId.isValidStageId("Map_1"));
  }
}
