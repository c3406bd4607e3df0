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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.Writable;

/**
 * Progress of a task attempt: the base progress of its input, a status message and the
 * progress of any additional sources such as merges and channels.
 */
@Private
public class TaskProgress implements Writable {

  /**
   * Progress of one kind of additional progress source.
   */
  public static final class AdditionalProgressValue {
    private final String sourceName;
    private float progress;

    public AdditionalProgressValue(String sourceName, float progress) {
      this.sourceName = sourceName;
      this.progress = progress;
    }

    public String getSourceName() {
      return sourceName;
    }

    public float getProgress() {
      return progress;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof AdditionalProgressValue)) {
        return false;
      }
      AdditionalProgressValue other = (AdditionalProgressValue) o;
      return Objects.equals(sourceName, other.sourceName)
          && Float.compare(progress, other.progress) == 0;
    }

    @Override
    public int hashCode() {
      return Objects.hash(sourceName, progress);
    }

    @Override
    public String toString() {
      return String.format(Locale.ROOT, "%s: %.1f%%", sourceName, progress * 100f);
    }
  }

  private float progress;
  private String statusMessage;
  private final List<AdditionalProgressValue> additionalProgressValues =
      new ArrayList<AdditionalProgressValue>();

  public float getProgress() {
    return progress;
  }

  public void setProgress(float progress) {
    this.progress = progress;
  }

  public String getStatusMessage() {
    return statusMessage;
  }

  public void setStatusMessage(String statusMessage) {
    this.statusMessage = statusMessage;
  }

  public List<AdditionalProgressValue> getAdditionalProgressValues() {
    return Collections.unmodifiableList(additionalProgressValues);
  }

  public void addAdditionalProgressValue(String sourceName, float value) {
    additionalProgressValues.add(new AdditionalProgressValue(sourceName, value));
  }

  /**
   * Returns the average of the base progress and every additional progress value.
   */
  public float getOverallProgress() {
    if (additionalProgressValues.isEmpty()) {
      return progress;
    }
    float sum = progress;
    for (AdditionalProgressValue value : additionalProgressValues) {
      sum += value.progress;
    }
    return sum / (additionalProgressValues.size() + 1);
  }

  public void setFinished() {
    progress = 1.0f;
    for (AdditionalProgressValue value : additionalProgressValues) {
      value.progress = 1.0f;
    }
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeFloat(progress);
    out.writeBoolean(statusMessage != null);
    if (statusMessage != null) {
      Text.writeString(out, statusMessage);
    }
    out.writeInt(additionalProgressValues.size());
    for (AdditionalProgressValue value : additionalProgressValues) {
      Text.writeString(out, value.sourceName);
      out.writeFloat(value.progress);
    }
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    progress = in.readFloat();
    statusMessage = in.readBoolean() ? Text.readString(in) : null;
    additionalProgressValues.clear();
    int count = in.readInt();
    for (int i = 0; i < count; ++i) {
      String sourceName = Text.readString(in);
      additionalProgressValues.add(new AdditionalProgressValue(sourceName, in.readFloat()));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TaskProgress other = (TaskProgress) o;
    return Float.compare(progress, other.progress) == 0
        && Objects.equals(statusMessage, other.statusMessage)
        && additionalProgressValues.equals(other.additionalProgressValues);
  }

  @Override
  public int hashCode() {
    return Objects.hash(progress, statusMessage, additionalProgressValues);
  }

  @Override
  public String toString() {
    if (additionalProgressValues.isEmpty()) {
      return String.format(Locale.ROOT, "%.1f%%", progress * 100f);
    }
    StringBuilder result = new StringBuilder(String.format(Locale.ROOT,
        "Overall: %.1f%%; Base: %.1f%%", getOverallProgress() * 100f, progress * 100f));
    for (AdditionalProgressValue value : additionalProgressValues) {
      result.append("; ").append(value);
    }
    return result.toString();
  }
}
