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
import static org.junit.Assert.assertFalse;

import org.junit.Test;

public class TestTaskProgress {

  @Test(timeout = 5000)
  public void testOverallProgress() {
    TaskProgress progress = new TaskProgress();
    progress.setProgress(0.5f);
    assertEquals(0.5f, progress.getOverallProgress(), 0.0001f);
    assertEquals("50.0%", progress.toString());

    progress.addAdditionalProgressValue("channel.file", 1.0f);
    progress.addAdditionalProgressValue("merge", 0.0f);
    assertEquals(0.5f, progress.getOverallProgress(), 0.0001f);

    progress.setFinished();
    assertEquals(1.0f, progress.getProgress(), 0.0001f);
    assertEquals(1.0f, progress.getOverallProgress(), 0.0001f);
  }

  @Test(timeout = 5000)
  public void testEquals() {
    TaskProgress first = new TaskProgress();
    TaskProgress second = new TaskProgress();
    assertEquals(first, second);
    first.setStatusMessage("Sorting");
    assertFalse(first.equals(second));
    second.setStatusMessage("Sorting");
    first.addAdditionalProgressValue("merge", 0.25f);
    second.addAdditionalProgressValue("merge", 0.25f);
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
  }
}
