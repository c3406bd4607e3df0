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

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Record and byte counts of a finished task attempt.
 */
@Private
public final class TaskMetrics {

  private static final Logger LOG = LoggerFactory.getLogger(TaskMetrics.class);

  private long dfsBytesRead;
  private long dfsBytesWritten;
  private long localBytesRead;
  private long localBytesWritten;
  private long networkBytesRead;
  private long networkBytesWritten;
  private long inputBytes;
  private long inputRecords;
  private long outputBytes;
  private long outputRecords;
  private int dynamicallyAssignedPartitions;
  private int discardedPartitions;

  public long getDfsBytesRead() {
    return dfsBytesRead;
  }

  public void setDfsBytesRead(long dfsBytesRead) {
    this.dfsBytesRead = dfsBytesRead;
  }

  public long getDfsBytesWritten() {
    return dfsBytesWritten;
  }

  public void setDfsBytesWritten(long dfsBytesWritten) {
    this.dfsBytesWritten = dfsBytesWritten;
  }

  public long getLocalBytesRead() {
    return localBytesRead;
  }

  public void setLocalBytesRead(long localBytesRead) {
    this.localBytesRead = localBytesRead;
  }

  public long getLocalBytesWritten() {
    return localBytesWritten;
  }

  public void setLocalBytesWritten(long localBytesWritten) {
    this.localBytesWritten = localBytesWritten;
  }

  public long getNetworkBytesRead() {
    return networkBytesRead;
  }

  public void setNetworkBytesRead(long networkBytesRead) {
    this.networkBytesRead = networkBytesRead;
  }

  public long getNetworkBytesWritten() {
    return networkBytesWritten;
  }

  public void setNetworkBytesWritten(long networkBytesWritten) {
    this.networkBytesWritten = networkBytesWritten;
  }

  /**
   * Uncompressed size of the records read by the task.
   */
  public long getInputBytes() {
    return inputBytes;
  }

  public void setInputBytes(long inputBytes) {
    this.inputBytes = inputBytes;
  }

  public long getInputRecords() {
    return inputRecords;
  }

  public void setInputRecords(long inputRecords) {
    this.inputRecords = inputRecords;
  }

  /**
   * Uncompressed size of the records written by the task.
   */
  public long getOutputBytes() {
    return outputBytes;
  }

  public void setOutputBytes(long outputBytes) {
    this.outputBytes = outputBytes;
  }

  public long getOutputRecords() {
    return outputRecords;
  }

  public void setOutputRecords(long outputRecords) {
    this.outputRecords = outputRecords;
  }

  public int getDynamicallyAssignedPartitions() {
    return dynamicallyAssignedPartitions;
  }

  public void setDynamicallyAssignedPartitions(int dynamicallyAssignedPartitions) {
    this.dynamicallyAssignedPartitions = dynamicallyAssignedPartitions;
  }

  public int getDiscardedPartitions() {
    return discardedPartitions;
  }

  public void setDiscardedPartitions(int discardedPartitions) {
    this.discardedPartitions = discardedPartitions;
  }

  public void add(TaskMetrics other) {
    Preconditions.checkNotNull(other, "other");
    dfsBytesRead += other.dfsBytesRead;
    dfsBytesWritten += other.dfsBytesWritten;
    localBytesRead += other.localBytesRead;
    localBytesWritten += other.localBytesWritten;
    networkBytesRead += other.networkBytesRead;
    networkBytesWritten += other.networkBytesWritten;
    inputBytes += other.inputBytes;
    inputRecords += other.inputRecords;
    outputBytes += other.outputBytes;
    outputRecords += other.outputRecords;
    dynamicallyAssignedPartitions += other.dynamicallyAssignedPartitions;
    discardedPartitions += other.discardedPartitions;
  }

  public void logMetrics() {
    LOG.info("Input records: {}", inputRecords);
    LOG.info("Output records: {}", outputRecords);
    LOG.info("Input bytes: {}", inputBytes);
    LOG.info("Output bytes: {}", outputBytes);
    LOG.info("DFS bytes read: {}", dfsBytesRead);
    LOG.info("DFS bytes written: {}", dfsBytesWritten);
    LOG.info("Local bytes read: {}", localBytesRead);
    LOG.info("Local bytes written: {}", localBytesWritten);
    LOG.info("Channel network bytes read: {}", networkBytesRead);
    LOG.info("Channel network bytes written: {}", networkBytesWritten);
    LOG.info("Additional partitions: {}", dynamicallyAssignedPartitions);
    LOG.info("Discarded partitions: {}", discardedPartitions);
  }

  public JSONObject toJson() throws JSONException {
    JSONObject json = new JSONObject();
    json.put("inputRecords", inputRecords);
    json.put("outputRecords", outputRecords);
    json.put("inputBytes", inputBytes);
    json.put("outputBytes", outputBytes);
    json.put("dfsBytesRead", dfsBytesRead);
    json.put("dfsBytesWritten", dfsBytesWritten);
    json.put("localBytesRead", localBytesRead);
    json.put("localBytesWritten", localBytesWritten);
    json.put("networkBytesRead", networkBytesRead);
    json.put("networkBytesWritten", networkBytesWritten);
    json.put("dynamicallyAssignedPartitions", dynamicallyAssignedPartitions);
    json.put("discardedPartitions", discardedPartitions);
    return json;
  }

  public static TaskMetrics fromJson(JSONObject json) throws JSONException {
    TaskMetrics metrics = new TaskMetrics();
    metrics.inputRecords = json.getLong("inputRecords");
    metrics.outputRecords = json.getLong("outputRecords");
    metrics.inputBytes = json.getLong("inputBytes");
    metrics.outputBytes = json.getLong("outputBytes");
    metrics.dfsBytesRead = json.getLong("dfsBytesRead");
    metrics.dfsBytesWritten = json.getLong("dfsBytesWritten");
    metrics.localBytesRead = json.getLong("localBytesRead");
    metrics.localBytesWritten = json.getLong("localBytesWritten");
    metrics.networkBytesRead = json.getLong("networkBytesRead");
    metrics.networkBytesWritten = json.getLong("networkBytesWritten");
    metrics.dynamicallyAssignedPartitions = json.getInt("dynamicallyAssignedPartitions");
    metrics.discardedPartitions = json.getInt("discardedPartitions");
    return metrics;
  }

  @Override
  public String toString() {
    return "TaskMetrics{"
        + "inputRecords=" + inputRecords
        + ", outputRecords=" + outputRecords
        + ", inputBytes=" + inputBytes
        + ", outputBytes=" + outputBytes
        + ", dfsBytesRead=" + dfsBytesRead
        + ", dfsBytesWritten=" + dfsBytesWritten
        + ", localBytesRead=" + localBytesRead
        + ", localBytesWritten=" + localBytesWritten
        + ", networkBytesRead=" + networkBytesRead
        + ", networkBytesWritten=" + networkBytesWritten
        + ", dynamicallyAssignedPartitions=" + dynamicallyAssignedPartitions
        + ", discardedPartitions=" + discardedPartitions
        + "}";
  }
}
