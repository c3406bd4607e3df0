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

package org.apache.jet.runtime.library;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.jobs.JobComponentRegistry;
import org.apache.jet.jobs.MultiInputRecordReaderFactory;
import org.apache.jet.jobs.MultiInputRecordReaderInfo;
import org.apache.jet.runtime.library.input.MergeRecordReader;
import org.apache.jet.runtime.library.input.MultiRecordReader;
import org.apache.jet.runtime.library.input.RoundRobinMultiInputRecordReader;

/**
 * Registers the multi input record readers that every job can use.
 */
@Public
public final class BuiltInComponents {

  private BuiltInComponents() {
  }

  public static JobComponentRegistry register(JobComponentRegistry registry) {
    registry.registerMultiInputRecordReader(new MultiInputRecordReaderInfo(
        JobComponentRegistry.MULTI_RECORD_READER, new MultiInputRecordReaderFactory() {
          @Override
          public MultiInputRecordReader<?> createReader(Configuration conf,
              Class<?> recordClass, int[] partitions, int totalInputCount,
              boolean allowRecordReuse, int bufferSize) {
            return createMultiRecordReader(conf, recordClass, partitions, totalInputCount,
                allowRecordReuse, bufferSize);
          }
        }));
    registry.registerMultiInputRecordReader(new MultiInputRecordReaderInfo(
        JobComponentRegistry.MERGE_RECORD_READER, new MultiInputRecordReaderFactory() {
          @Override
          public MultiInputRecordReader<?> createReader(Configuration conf,
              Class<?> recordClass, int[] partitions, int totalInputCount,
              boolean allowRecordReuse, int bufferSize) {
            return createMergeRecordReader(conf, recordClass, partitions, totalInputCount,
                allowRecordReuse, bufferSize);
          }
        }).setBufferSize(JetConfiguration.JET_MERGE_READ_BUFFER_SIZE,
            JetConfiguration.JET_MERGE_READ_BUFFER_SIZE_DEFAULT).setAdditionalProgress(true));
    registry.registerMultiInputRecordReader(new MultiInputRecordReaderInfo(
        JobComponentRegistry.ROUND_ROBIN_RECORD_READER, new MultiInputRecordReaderFactory() {
          @Override
          public MultiInputRecordReader<?> createReader(Configuration conf,
              Class<?> recordClass, int[] partitions, int totalInputCount,
              boolean allowRecordReuse, int bufferSize) {
            return createRoundRobinRecordReader(conf, recordClass, partitions,
                totalInputCount, allowRecordReuse, bufferSize);
          }
        }));
    return registry;
  }

  /**
   * Creates a registry that holds only the built-in components.
   */
  public static JobComponentRegistry createRegistry() {
    return register(new JobComponentRegistry());
  }

  private static <T> MultiRecordReader<T> createMultiRecordReader(Configuration conf,
      Class<T> recordClass, int[] partitions, int totalInputCount, boolean allowRecordReuse,
      int bufferSize) {
    return new MultiRecordReader<T>(conf, recordClass, partitions, totalInputCount,
        allowRecordReuse, bufferSize);
  }

  private static <T> MergeRecordReader<T> createMergeRecordReader(Configuration conf,
      Class<T> recordClass, int[] partitions, int totalInputCount, boolean allowRecordReuse,
      int bufferSize) {
    return new MergeRecordReader<T>(conf, recordClass, partitions, totalInputCount,
        allowRecordReuse, bufferSize);
  }

  private static <T> RoundRobinMultiInputRecordReader<T> createRoundRobinRecordReader(
      Configuration conf, Class<T> recordClass, int[] partitions, int totalInputCount,
      boolean allowRecordReuse, int bufferSize) {
    return new RoundRobinMultiInputRecordReader<T>(conf, recordClass, partitions,
        totalInputCount, allowRecordReuse, bufferSize);
  }
}
