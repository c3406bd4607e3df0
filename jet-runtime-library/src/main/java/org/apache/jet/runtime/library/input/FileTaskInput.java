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

package org.apache.jet.runtime.library.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.fs.Path;
import org.apache.jet.jobs.TaskInput;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

/**
 * Task input naming one record file of a {@link FileDataInput}.
 */
@Public
public class FileTaskInput implements TaskInput {

  private Path path;
  private long length;
  private List<String> locations = Collections.emptyList();

  public FileTaskInput() {
  }

  public FileTaskInput(Path path, long length, List<String> locations) {
    this.path = path;
    this.length = length;
    this.locations = locations == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<String>(locations));
  }

  public Path getPath() {
    return path;
  }

  public long getLength() {
    return length;
  }

  @Override
  public List<String> getLocations() {
    return locations;
  }

  @Override
  public void writeJson(JSONObject json) throws JSONException {
    json.put("path", path.toString());
    json.put("length", length);
    json.put("locations", new JSONArray(locations));
  }

  @Override
  public void readJson(JSONObject json) throws JSONException {
    path = new Path(json.getString("path"));
    length = json.getLong("length");
    JSONArray array = json.optJSONArray("locations");
    List<String> result = new ArrayList<String>();
    if (array != null) {
      for (int x = 0; x < array.length(); ++x) {
        result.add(array.getString(x));
      }
    }
    locations = Collections.unmodifiableList(result);
  }

  @Override
  public String toString() {
    return "FileTaskInput [path=" + path + ", length=" + length + "]";
  }
}
