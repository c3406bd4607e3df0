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

import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.runtime.api.TaskContext;

/**
 * Creates the endpoints of TCP channels. Registered with a
 * {@link org.apache.jet.jobs.JobComponentRegistry}; the runtime does not include a TCP transport
 * of its own.
 */
@Public
public interface TcpChannelProvider {

  public InputChannel createInputChannel(TaskContext context, StageConfiguration inputStage,
      int[] partitions) throws IOException;

  public OutputChannel createOutputChannel(TaskContext context) throws IOException;
}
