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

package org.apache.jet.runtime.channels;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.common.ReflectionUtils;
import org.apache.jet.io.HashPartitioner;
import org.apache.jet.io.Partitioner;

@Private
final class ChannelUtils {

  private ChannelUtils() {
  }

  static <T> Partitioner<T> createPartitioner(String className, Configuration conf) {
    String name = className == null ? HashPartitioner.class.getName() : className;
    try {
      return ReflectionUtils.createClazzInstance(name, conf);
    } catch (JetReflectionException e) {
      throw new JetUncheckedException("Could not create partitioner " + name + ".", e);
    }
  }
}
