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

package org.apache.jet.runtime.library.common;

import java.io.File;
import java.util.Locale;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.util.ReflectionUtils;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.channels.FileChannelOutputType;

import com.google.common.base.Preconditions;

@Private
public class ConfigUtils {

  private ConfigUtils() {
  }

  public static Class<? extends CompressionCodec> getIntermediateCompressionCodecClass(
      Configuration conf) {
    String name = conf.getTrimmed(JetConfiguration.JET_MERGE_INTERMEDIATE_COMPRESSION_CODEC);
    if (name == null || name.isEmpty()) {
      return null;
    }
    try {
      return conf.getClassByName(name).asSubclass(CompressionCodec.class);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Compression codec " + name
          + " was not found.", e);
    }
  }

  /**
   * @return the codec for intermediate files, or <code>null</code> if they are not compressed
   */
  public static CompressionCodec getIntermediateCompressionCodec(Configuration conf) {
    Class<? extends CompressionCodec> codecClass = getIntermediateCompressionCodecClass(conf);
    return codecClass == null ? null : ReflectionUtils.newInstance(codecClass, conf);
  }

  public static boolean isIntermediateChecksumEnabled(Configuration conf) {
    return conf.getBoolean(JetConfiguration.JET_MERGE_INTERMEDIATE_CHECKSUM_ENABLED,
        JetConfiguration.JET_MERGE_INTERMEDIATE_CHECKSUM_ENABLED_DEFAULT);
  }

  public static int getMaxDiskInputsPerPass(Configuration conf) {
    int value = conf.getInt(JetConfiguration.JET_MERGE_MAX_DISK_INPUTS_PER_PASS,
        JetConfiguration.JET_MERGE_MAX_DISK_INPUTS_PER_PASS_DEFAULT);
    if (value < 2) {
      throw new IllegalArgumentException(JetConfiguration.JET_MERGE_MAX_DISK_INPUTS_PER_PASS
          + " must be at least 2, was " + value);
    }
    return value;
  }

  public static int getMergeReadBufferSize(Configuration conf) {
    return conf.getInt(JetConfiguration.JET_MERGE_READ_BUFFER_SIZE,
        JetConfiguration.JET_MERGE_READ_BUFFER_SIZE_DEFAULT);
  }

  public static int getWriteBufferSize(Configuration conf) {
    return conf.getInt(JetConfiguration.JET_FILE_CHANNEL_WRITE_BUFFER_SIZE,
        JetConfiguration.JET_FILE_CHANNEL_WRITE_BUFFER_SIZE_DEFAULT);
  }

  public static int getReadBufferSize(Configuration conf) {
    return conf.getInt(JetConfiguration.JET_FILE_CHANNEL_READ_BUFFER_SIZE,
        JetConfiguration.JET_FILE_CHANNEL_READ_BUFFER_SIZE_DEFAULT);
  }

  public static FileChannelOutputType getFileChannelOutputType(Configuration conf) {
    String value = conf.getTrimmed(JetConfiguration.JET_FILE_CHANNEL_OUTPUT_TYPE,
        JetConfiguration.JET_FILE_CHANNEL_OUTPUT_TYPE_DEFAULT);
    try {
      return FileChannelOutputType.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid " + JetConfiguration.JET_FILE_CHANNEL_OUTPUT_TYPE
          + ": " + value, e);
    }
  }

  public static int getSpillBufferSize(Configuration conf) {
    int value = conf.getInt(JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_SIZE,
        JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_SIZE_DEFAULT);
    if (value <= 0) {
      throw new IllegalArgumentException("Invalid spill buffer size: " + value);
    }
    return value;
  }

  /**
   * Returns the number of buffered bytes at which a sort-spill output spills.
   */
  public static int getSpillBufferLimitSize(Configuration conf) {
    float limit = conf.getFloat(JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_LIMIT,
        JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_LIMIT_DEFAULT);
    if (limit < 0.1f || limit > 1.0f) {
      throw new IllegalArgumentException("Invalid spill buffer limit: " + limit);
    }
    return (int) (limit * getSpillBufferSize(conf));
  }

  public static int getMinSpillsForCombineDuringMerge(Configuration conf) {
    int value = conf.getInt(
        JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_MIN_SPILLS_FOR_COMBINE_DURING_MERGE,
        JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_MIN_SPILLS_FOR_COMBINE_DURING_MERGE_DEFAULT);
    Preconditions.checkArgument(value >= 0,
        "The minimum number of spills for combining during the merge cannot be negative.");
    return value;
  }

  public static Path getMergeIntermediateOutputPath(Configuration conf) {
    String dir = conf.getTrimmed(JetConfiguration.JET_MERGE_INTERMEDIATE_OUTPUT_DIR);
    if (dir == null || dir.isEmpty()) {
      dir = new File(System.getProperty("java.io.tmpdir")).getAbsolutePath();
    }
    return new Path(dir);
  }
}
