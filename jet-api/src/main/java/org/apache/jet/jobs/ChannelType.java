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

/**
 * The transport used between two stages.
 */
@Public
public enum ChannelType {
  /**
   * The sending task writes its output to local files, which the receiving task downloads
   * after the sender finished.
   */
  FILE,
  /**
   * The sending task pushes records to the receiving task over a live connection; the receiver
   * must be running before the sender starts.
   */
  TCP,
  /**
   * The receiving stage runs in the same process as the sender and records are passed
   * directly without serialization.
   */
  PIPELINE
}
