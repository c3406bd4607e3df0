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
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.io.MultiInputRecordReader;

/**
 * Creates multi-input record readers for a registered reader type.
 */
@Public
@FunctionalInterface
public interface MultiInputRecordReaderFactory {

  /**
   * @param conf the task's configuration
   * @param recordClass the type of the records produced by the reader
   * @param partitions the partitions initially assigned to the reader
   * @param totalInputCount the number of inputs each partition will receive
   * @param allowRecordReuse whether the reader may return the same record instance more than once
   * @param bufferSize the read buffer size for file based inputs
   */
  public MultiInputRecordReader<?> createReader(Configuration conf, Class<?> recordClass,
      int[] partitions, int totalInputCount, boolean allowRecordReuse, int bufferSize);
}
