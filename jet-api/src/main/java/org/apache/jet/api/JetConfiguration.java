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

package org.apache.jet.api;

import java.util.Map;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;

/**
 * Keys and defaults for the settings consumed by the Jet runtime.
 * <p/>
 * Settings are specified on the job or on individual stages; a stage setting overrides the job
 * setting with the same key. At run time both are merged into a single Hadoop
 * {@link Configuration}, see {@link #createConfiguration(Map, Map)}.
 */
@Public
@Evolving
public class JetConfiguration {

  private static final String JET_PREFIX = "jet.";

  /**
   * Maximum number of disk segments merged in a single pass. When a merge has more disk
   * inputs, intermediate passes are written to disk until the count drops to this value.
   */
  public static final String JET_MERGE_MAX_DISK_INPUTS_PER_PASS = JET_PREFIX +
      "merge.max-disk-inputs-per-pass";
  public static final int JET_MERGE_MAX_DISK_INPUTS_PER_PASS_DEFAULT = 100;

  public static final String JET_MERGE_READ_BUFFER_SIZE = JET_PREFIX +
      "merge.read-buffer-size";
  public static final int JET_MERGE_READ_BUFFER_SIZE_DEFAULT = 64 * 1024;

  /**
   * Class name of the {@link org.apache.hadoop.io.RawComparator} used to order records by the
   * merge record reader. Defaults to the comparator registered for the record class.
   */
  public static final String JET_MERGE_COMPARATOR_CLASS = JET_PREFIX + "merge.comparator.class";

  /**
   * Local directory for intermediate merge pass files. The task runtime sets this to the task
   * attempt's local directory; when absent the system temporary directory is used.
   */
  public static final String JET_MERGE_INTERMEDIATE_OUTPUT_DIR = JET_PREFIX +
      "merge.intermediate-output-dir";

  public static final String JET_FILE_CHANNEL_WRITE_BUFFER_SIZE = JET_PREFIX +
      "file-channel.write-buffer-size";
  public static final int JET_FILE_CHANNEL_WRITE_BUFFER_SIZE_DEFAULT = 64 * 1024;

  public static final String JET_FILE_CHANNEL_READ_BUFFER_SIZE = JET_PREFIX +
      "file-channel.read-buffer-size";
  public static final int JET_FILE_CHANNEL_READ_BUFFER_SIZE_DEFAULT = 64 * 1024;

  /**
   * Interval at which a file input channel asks the job server for newly completed tasks of
   * the sending stage.
   */
  public static final String JET_FILE_CHANNEL_POLL_INTERVAL_MS = JET_PREFIX +
      "file-channel.poll-interval-ms";
  public static final long JET_FILE_CHANNEL_POLL_INTERVAL_MS_DEFAULT = 1000L;

  /**
   * How a file output channel writes its partition files, one of
   * {@link org.apache.jet.channels.FileChannelOutputType}.
   */
  public static final String JET_FILE_CHANNEL_OUTPUT_TYPE = JET_PREFIX +
      "file-channel.output-type";
  public static final String JET_FILE_CHANNEL_OUTPUT_TYPE_DEFAULT = "MULTI_FILE";

  /**
   * Size in bytes of the in-memory buffer of a sort-spill output.
   */
  public static final String JET_FILE_CHANNEL_SPILL_BUFFER_SIZE = JET_PREFIX +
      "file-channel.spill-buffer-size";
  public static final int JET_FILE_CHANNEL_SPILL_BUFFER_SIZE_DEFAULT = 100 * 1024 * 1024;

  /**
   * Fraction of the spill buffer that triggers a spill, between 0.1 and 1.0.
   */
  public static final String JET_FILE_CHANNEL_SPILL_BUFFER_LIMIT = JET_PREFIX +
      "file-channel.spill-buffer-limit";
  public static final float JET_FILE_CHANNEL_SPILL_BUFFER_LIMIT_DEFAULT = 0.8f;

  /**
   * Class name of the comparator a sort-spill output sorts with. A
   * {@link org.apache.hadoop.io.RawComparator} compares the serialized records directly.
   * Defaults to the comparator registered for the record class.
   */
  public static final String JET_FILE_CHANNEL_SPILL_SORT_COMPARATOR_CLASS = JET_PREFIX +
      "file-channel.spill-sort.comparator.class";

  /**
   * Class name of a {@link org.apache.jet.runtime.api.Task} with identical input and output
   * types that a sort-spill output runs over the sorted records of each partition.
   */
  public static final String JET_FILE_CHANNEL_SPILL_SORT_COMBINER_CLASS = JET_PREFIX +
      "file-channel.spill-sort.combiner.class";

  /**
   * Minimum number of spills for the combiner to run again while merging them. Zero never runs
   * the combiner during the merge.
   */
  public static final String JET_FILE_CHANNEL_SPILL_SORT_MIN_SPILLS_FOR_COMBINE_DURING_MERGE =
      JET_PREFIX + "file-channel.spill-sort.min-spills-for-combine-during-merge";
  public static final int JET_FILE_CHANNEL_SPILL_SORT_MIN_SPILLS_FOR_COMBINE_DURING_MERGE_DEFAULT
      = 3;

  /**
   * Class name of the Hadoop compression codec used for intermediate merge passes and
   * channel files. Empty means no compression.
   */
  public static final String JET_MERGE_INTERMEDIATE_COMPRESSION_CODEC = JET_PREFIX +
      "merge.intermediate-compression-codec";

  public static final String JET_MERGE_INTERMEDIATE_CHECKSUM_ENABLED = JET_PREFIX +
      "merge.intermediate-checksum.enabled";
  public static final boolean JET_MERGE_INTERMEDIATE_CHECKSUM_ENABLED_DEFAULT = true;

  public static final String JET_CHANNEL_PARTITIONS_PER_TASK = JET_PREFIX +
      "channel.partitions-per-task";
  public static final int JET_CHANNEL_PARTITIONS_PER_TASK_DEFAULT = 1;

  public static final String JET_CHANNEL_DYNAMIC_PARTITION_ASSIGNMENT_DISABLED = JET_PREFIX +
      "channel.dynamic-partition-assignment.disabled";
  public static final boolean JET_CHANNEL_DYNAMIC_PARTITION_ASSIGNMENT_DISABLED_DEFAULT = false;

  /**
   * Class name of an {@link org.apache.jet.common.EqualityComparer} used by the hash
   * partitioner instead of the record's own hash code.
   */
  public static final String JET_PARTITIONER_HASH_EQUALITY_COMPARER_CLASS = JET_PREFIX +
      "partitioner.hash.equality-comparer.class";

  /**
   * Number of records buffered between a pipelined parent task and a child task that reads its
   * input from a record reader.
   */
  public static final String JET_PIPELINE_PULL_BUFFER_SIZE = JET_PREFIX +
      "pipeline.pull-buffer-size";
  public static final int JET_PIPELINE_PULL_BUFFER_SIZE_DEFAULT = 10000;

  public static final String JET_TASK_PROGRESS_INTERVAL_MS = JET_PREFIX +
      "task.progress-interval-ms";
  public static final long JET_TASK_PROGRESS_INTERVAL_MS_DEFAULT = 5000L;

  /**
   * Time after which the coordinator considers an attempt without progress reports stalled.
   * Not used by the task runtime itself.
   */
  public static final String JET_TASK_ATTEMPT_TIMEOUT_MS = JET_PREFIX +
      "task.attempt-timeout-ms";
  public static final long JET_TASK_ATTEMPT_TIMEOUT_MS_DEFAULT = 600000L;

  /**
   * Class name of the records produced by a file data input.
   */
  public static final String JET_DATA_INPUT_RECORD_CLASS = JET_PREFIX + "data-input.record-class";

  public static final String JET_DATA_INPUT_PATH = JET_PREFIX + "data-input.path";

  public static final String JET_DATA_OUTPUT_RECORD_CLASS = JET_PREFIX + "data-output.record-class";

  public static final String JET_DATA_OUTPUT_PATH = JET_PREFIX + "data-output.path";

  /**
   * Creates the run time configuration of a stage. Stage settings take precedence over job
   * settings; either map may be null.
   */
  public static Configuration createConfiguration(Map<String, String> jobSettings,
      Map<String, String> stageSettings) {
    Configuration conf = new Configuration();
    if (jobSettings != null) {
      for (Map.Entry<String, String> entry : jobSettings.entrySet()) {
        conf.set(entry.getKey(), entry.getValue());
      }
    }
    if (stageSettings != null) {
      for (Map.Entry<String, String> entry : stageSettings.entrySet()) {
        conf.set(entry.getKey(), entry.getValue());
      }
    }
    return conf;
  }
}
