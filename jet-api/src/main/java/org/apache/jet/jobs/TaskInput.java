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

import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

/**
 * The part of a data input processed by a single task. Implementations need a public no-argument
 * constructor so they can be restored from a saved job configuration.
 */
@Public
public interface TaskInput {

  /**
   * Returns the hosts that store this input, used by the scheduler for locality. May be empty.
   */
  public List<String> getLocations();

  public void writeJson(JSONObject json) throws JSONException;

  public void readJson(JSONObject json) throws JSONException;
}
