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
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import com.google.common.base.Preconditions;

/**
 * Options consumed by the coordinator's scheduler.
 */
@Public
public final class SchedulerOptions {

  private int maximumDataDistance = 2;
  private SchedulingMode dataInputSchedulingMode = SchedulingMode.DEFAULT;
  private SchedulingMode nonDataInputSchedulingMode = SchedulingMode.DEFAULT;

  /**
   * The maximum network distance between a task and its data input; 0 means node local, 1 rack
   * local, 2 anywhere.
   */
  public int getMaximumDataDistance() {
    return maximumDataDistance;
  }

  public void setMaximumDataDistance(int maximumDataDistance) {
    Preconditions.checkArgument(maximumDataDistance >= 0,
        "maximumDataDistance must not be negative");
    this.maximumDataDistance = maximumDataDistance;
  }

  public SchedulingMode getDataInputSchedulingMode() {
    return dataInputSchedulingMode;
  }

  public void setDataInputSchedulingMode(SchedulingMode mode) {
    this.dataInputSchedulingMode = Preconditions.checkNotNull(mode);
  }

  public SchedulingMode getNonDataInputSchedulingMode() {
    return nonDataInputSchedulingMode;
  }

  public void setNonDataInputSchedulingMode(SchedulingMode mode) {
    this.nonDataInputSchedulingMode = Preconditions.checkNotNull(mode);
  }

  JSONObject toJson() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("maximumDataDistance", maximumDataDistance);
    json.put("dataInputSchedulingMode", dataInputSchedulingMode.name());
    json.put("nonDataInputSchedulingMode", nonDataInputSchedulingMode.name());
    return json;
  }

  static SchedulerOptions fromJson(JSONObject json) throws JSONException {
    SchedulerOptions options = new SchedulerOptions();
    options.setMaximumDataDistance(json.optInt("maximumDataDistance", 2));
    options.setDataInputSchedulingMode(SchedulingMode.valueOf(
        json.optString("dataInputSchedulingMode", SchedulingMode.DEFAULT.name())));
    options.setNonDataInputSchedulingMode(SchedulingMode.valueOf(
        json.optString("nonDataInputSchedulingMode", SchedulingMode.DEFAULT.name())));
    return options;
  }
}
