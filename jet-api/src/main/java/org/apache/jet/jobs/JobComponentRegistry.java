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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.channels.TcpChannelProvider;

import com.google.common.base.Preconditions;

/**
 * Maps the task type and multi-input record reader identifiers used in job configurations to
 * their implementations. A registry is passed to every {@link JobConfiguration}; the same
 * registry contents must be available where the job is loaded for execution.
 */
@Public
public class JobComponentRegistry {

  /** Reads the inputs of a partition one after the other. */
  public static final String MULTI_RECORD_READER = "multi";
  /** Merges the sorted inputs of a partition. */
  public static final String MERGE_RECORD_READER = "merge";
  /** Alternates between the inputs of a partition as records become available. */
  public static final String ROUND_ROBIN_RECORD_READER = "roundrobin";

  private final Map<String, TaskTypeInfo<?, ?>> taskTypes =
      new LinkedHashMap<String, TaskTypeInfo<?, ?>>();
  private final Map<String, MultiInputRecordReaderInfo> multiInputRecordReaders =
      new LinkedHashMap<String, MultiInputRecordReaderInfo>();
  private TcpChannelProvider tcpChannelProvider;

  public synchronized <I, O> TaskTypeInfo<I, O> registerTaskType(TaskTypeInfo<I, O> info) {
    Preconditions.checkNotNull(info, "info");
    Preconditions.checkArgument(!taskTypes.containsKey(info.getId()),
        "Task type %s is already registered", info.getId());
    taskTypes.put(info.getId(), info);
    return info;
  }

  /**
   * @return the task type, or <code>null</code> if it is not registered
   */
  public synchronized TaskTypeInfo<?, ?> getTaskType(String id) {
    return taskTypes.get(id);
  }

  public synchronized Collection<TaskTypeInfo<?, ?>> getTaskTypes() {
    return Collections.unmodifiableCollection(taskTypes.values());
  }

  public synchronized MultiInputRecordReaderInfo registerMultiInputRecordReader(
      MultiInputRecordReaderInfo info) {
    Preconditions.checkNotNull(info, "info");
    Preconditions.checkArgument(!multiInputRecordReaders.containsKey(info.getId()),
        "Multi input record reader %s is already registered", info.getId());
    multiInputRecordReaders.put(info.getId(), info);
    return info;
  }

  /**
   * @return the reader type, or <code>null</code> if it is not registered
   */
  public synchronized MultiInputRecordReaderInfo getMultiInputRecordReader(String id) {
    return multiInputRecordReaders.get(id);
  }

  public synchronized TcpChannelProvider getTcpChannelProvider() {
    return tcpChannelProvider;
  }

  public synchronized void setTcpChannelProvider(TcpChannelProvider tcpChannelProvider) {
    this.tcpChannelProvider = tcpChannelProvider;
  }
}
