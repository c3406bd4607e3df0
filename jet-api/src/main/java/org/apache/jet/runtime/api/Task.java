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

package org.apache.jet.runtime.api;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;

/**
 * The processing logic of a stage. One instance is created per task, or per input partition for
 * tasks that are restarted between partitions.
 *
 * @param <I> the type of the input records
 * @param <O> the type of the output records
 */
@Public
public interface Task<I, O> {

  /**
   * Reads the input and writes the output.
   *
   * @param input the input, or <code>null</code> if the stage has no input
   * @param output the output
   */
  public void run(RecordReader<I> input, RecordWriter<O> output) throws Exception;
}
