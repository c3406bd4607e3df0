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

package org.apache.jet.runtime.library.input;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.common.ReflectionUtils;
import org.apache.jet.io.HasAdditionalProgress;
import org.apache.jet.io.MultiInputRecordReader;
import org.apache.jet.io.RecordInput;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.common.sort.JetMerger;
import org.apache.jet.runtime.library.common.sort.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi input record reader that merges the sorted inputs of each partition.
 * <p/>
 * The merge of a partition starts when its first record is requested, after all of its inputs
 * have arrived. The comparator is taken from {@link JetConfiguration#JET_MERGE_COMPARATOR_CLASS}
 * if set; otherwise the default comparator of the record class is used.
 * <p/>
 * The additional progress of this reader is the fraction of inputs that have arrived.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public class MergeRecordReader<T> extends MultiInputRecordReader<T>
    implements HasAdditionalProgress {

  private static final Logger LOG = LoggerFactory.getLogger(MergeRecordReader.class);

  private final JetMerger<T> merger;
  private final Comparator<T> comparator;
  private final int maxDiskInputsPerPass;
  private final Path intermediateOutputPath;
  private final CompressionCodec codec;
  private final boolean enableChecksum;
  private MergeResult<T> currentMerge;
  private int finishedPartitions;

  public MergeRecordReader(Configuration conf, Class<T> recordClass, int[] partitions,
      int totalInputCount, boolean allowRecordReuse, int bufferSize) {
    super(conf, recordClass, partitions, totalInputCount, allowRecordReuse, bufferSize);
    Configuration configuration = getConf();
    this.merger = new JetMerger<T>(configuration, recordClass);
    this.comparator = createComparator(configuration);
    this.maxDiskInputsPerPass = ConfigUtils.getMaxDiskInputsPerPass(configuration);
    this.intermediateOutputPath = ConfigUtils.getMergeIntermediateOutputPath(configuration);
    this.codec = ConfigUtils.getIntermediateCompressionCodec(configuration);
    this.enableChecksum = ConfigUtils.isIntermediateChecksumEnabled(configuration);
  }

  public int getMergePassCount() {
    return merger.getMergePassCount();
  }

  @Override
  protected boolean readRecordInternal() throws IOException {
    checkNotClosed();
    if (currentMerge == null) {
      startMerge();
    }
    try {
      if (currentMerge.hasNext()) {
        setCurrentRecord(currentMerge.next().getValue());
        return true;
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    setCurrentRecord(null);
    return false;
  }

  /**
   * Returns the progress of merging the partitions, based on the final merge pass of each.
   */
  @Override
  public float getProgress() {
    int partitionCount = getPartitionCount();
    if (partitionCount == 0) {
      return 0;
    }
    MergeResult<T> merge = currentMerge;
    float current = merge == null ? 0 : merge.getProgress();
    return Math.min(1.0f, (finishedPartitions + current) / partitionCount);
  }

  @Override
  public float getAdditionalProgress() {
    return (float) getCurrentInputCount() / getTotalInputCount();
  }

  /**
   * Includes the intermediate pass files, which are read back in full.
   */
  @Override
  public long getBytesRead() {
    return super.getBytesRead() + merger.getBytesWritten();
  }

  @Override
  protected void onCurrentPartitionChanged() {
    if (currentMerge != null) {
      closeMerge();
      ++finishedPartitions;
    }
  }

  @Override
  public void close() throws IOException {
    if (currentMerge != null) {
      closeMerge();
    }
    super.close();
  }

  private void startMerge() throws IOException {
    try {
      waitForInputs(getTotalInputCount(), -1);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for merge inputs.");
    }
    int partition = getCurrentPartition();
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    List<RecordInput> memoryInputs = new ArrayList<RecordInput>();
    for (int x = 0; x < getTotalInputCount(); ++x) {
      RecordInput input = getInput(x);
      if (input.isMemoryBased()) {
        memoryInputs.add(input);
      } else {
        diskInputs.add(input);
      }
    }
    LOG.info("Merging partition {} with {} disk and {} memory inputs.", partition,
        diskInputs.size(), memoryInputs.size());
    currentMerge = merger.merge(diskInputs, memoryInputs, maxDiskInputsPerPass, comparator,
        isAllowRecordReuse(), false, intermediateOutputPath, "partition" + partition + "_",
        codec, getBufferSize(), enableChecksum);
  }

  private void closeMerge() {
    try {
      currentMerge.close();
    } catch (IOException e) {
      LOG.warn("Failed to close merge result", e);
    }
    currentMerge = null;
  }

  private static <T> Comparator<T> createComparator(Configuration conf) {
    String className = conf.getTrimmed(JetConfiguration.JET_MERGE_COMPARATOR_CLASS);
    if (className == null || className.isEmpty()) {
      return null;
    }
    try {
      return ReflectionUtils.createClazzInstance(className, conf);
    } catch (JetReflectionException e) {
      throw new JetUncheckedException("Could not create merge comparator " + className, e);
    }
  }
}
