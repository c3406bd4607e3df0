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

import static org.junit.Assert.assertEquals;

import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.junit.Test;

public class TestTaskMetrics {

  @Test(timeout = 5000)
  public void testAdd() {
    TaskMetrics total = createMetrics(1);
    total.add(createMetrics(10));
    assertEquals(11, total.getInputRecords());
    assertEquals(22, total.getOutputRecords());
    assertEquals(33, total.getInputBytes());
    assertEquals(44, total.getOutputBytes());
    assertEquals(55, total.getDfsBytesRead());
    assertEquals(66, total.getDfsBytesWritten());
    assertEquals(77, total.getLocalBytesRead());
    assertEquals(88, total.getLocalBytesWritten());
    assertEquals(99, total.getNetworkBytesRead());
    assertEquals(110, total.getNetworkBytesWritten());
    assertEquals(121, total.getDynamicallyAssignedPartitions());
    assertEquals(132, total.getDiscardedPartitions());
  }

  @Test(timeout = 5000)
  public void testJson() throws JSONException {
    TaskMetrics metrics = createMetrics(3);
    JSONObject json = new JSONObject(metrics.toJson().toString());
    assertEquals(3, json.getLong("inputRecords"));
    assertEquals(36, json.getInt("discardedPartitions"));
    TaskMetrics restored = TaskMetrics.fromJson(json);
    assertEquals(metrics.toString(), restored.toString());
  }

  private static TaskMetrics createMetrics(int factor) {
    TaskMetrics metrics = new TaskMetrics();
    metrics.setInputRecords(factor);
    metrics.setOutputRecords(2 * factor);
    metrics.setInputBytes(3 * factor);
    metrics.setOutputBytes(4 * factor);
    metrics.setDfsBytesRead(5 * factor);
    metrics.setDfsBytesWritten(6 * factor);
    metrics.setLocalBytesRead(7 * factor);
    metrics.setLocalBytesWritten(8 * factor);
    metrics.setNetworkBytesRead(9 * factor);
    metrics.setNetworkBytesWritten(10 * factor);
    metrics.setDynamicallyAssignedPartitions(11 * factor);
    metrics.setDiscardedPartitions(12 * factor);
    return metrics;
  }
}
