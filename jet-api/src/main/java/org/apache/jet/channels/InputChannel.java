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

package org.apache.jet.channels;

import java.io.Closeable;
import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.io.RecordReader;
import org.apache.jet.jobs.ChannelConfiguration;
import org.apache.jet.jobs.StageConfiguration;

/**
 * The receiving side of a channel. May implement {@link org.apache.jet.io.HasMetrics} and
 * {@link org.apache.jet.io.HasAdditionalProgress}.
 */
@Public
public interface InputChannel extends Closeable {

  public ChannelConfiguration getConfiguration();

  /**
   * Returns the sending stage.
   */
  public StageConfiguration getInputStage();

  /**
   * Creates the reader for the records of this channel. For channels with more than one
   * partition per task this is a {@link org.apache.jet.io.MultiInputRecordReader}.
   */
  public RecordReader<?> createRecordReader() throws IOException;

  /**
   * Starts receiving the specified partitions in addition to the current ones.
   */
  public void assignAdditionalPartitions(int[] partitions);
}
