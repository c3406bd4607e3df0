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

package org.apache.jet.runtime.library.common.sort;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.RawComparator;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.jet.common.PriorityQueue;
import org.apache.jet.io.RawRecord;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;
import org.apache.jet.runtime.library.common.io.FileRecordInput;
import org.apache.jet.runtime.library.common.io.RecordFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Merges sorted record inputs.
 * <p/>
 * When there are more disk inputs than the maximum allowed per pass, intermediate passes merge
 * the oldest disk inputs into pass files until the number of remaining disk inputs is small
 * enough. The final pass merges the memory inputs and the remaining disk inputs, and is
 * returned to the caller as a {@link MergeResult}.
 * <p/>
 * Records are compared in their serialized form when the comparator is a
 * {@link RawComparator} that does not deserialize, and every input supports raw readers. The
 * generic {@link WritableComparator} used for types without a registered comparator
 * deserializes, so those types are merged as objects.
 * Inputs without records are dropped before the merge; the order of equal records from
 * different inputs is not defined.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public class JetMerger<T> {

  private static final Logger LOG = LoggerFactory.getLogger(JetMerger.class);

  static final class MergeInput implements Closeable {
    private final RecordInput input;
    private final RecordReader<?> reader;
    private final boolean raw;

    MergeInput(RecordInput input, boolean raw) throws IOException {
      this.input = input;
      this.raw = raw;
      this.reader = raw ? input.getRawReader() : input.getReader();
    }

    boolean readRecord() throws IOException {
      return reader.readRecord();
    }

    boolean isMemoryBased() {
      return input.isMemoryBased();
    }

    long getBytesRead() {
      return reader.getBytesRead();
    }

    RecordReader<?> getReader() {
      return reader;
    }

    RawRecord getCurrentRawRecord() {
      return (RawRecord) reader.getCurrentRecord();
    }

    @SuppressWarnings("unchecked")
    <T> void getCurrentRecord(MergeResultRecord<T> record) {
      if (raw) {
        record.reset((RawRecord) reader.getCurrentRecord());
      } else {
        record.reset((T) reader.getCurrentRecord());
      }
    }

    @Override
    public void close() throws IOException {
      input.close();
    }
  }

  private final Configuration conf;
  private final Class<T> recordClass;
  private final AtomicLong bytesRead = new AtomicLong();
  private final AtomicLong bytesWritten = new AtomicLong();
  private int mergePassCount;
  private boolean usingRawRecords;

  public JetMerger(Configuration conf, Class<T> recordClass) {
    this.conf = conf == null ? new Configuration() : conf;
    this.recordClass = Preconditions.checkNotNull(recordClass, "recordClass");
  }

  /**
   * Returns the number of bytes read from disk inputs that have been fully consumed.
   */
  public long getBytesRead() {
    return bytesRead.get();
  }

  /**
   * Returns the number of bytes written to intermediate pass files.
   */
  public long getBytesWritten() {
    return bytesWritten.get();
  }

  public int getMergePassCount() {
    return mergePassCount;
  }

  /**
   * Indicates whether the final pass of the last merge returns raw records.
   */
  public boolean isUsingRawRecords() {
    return usingRawRecords;
  }

  public MergeResult<T> merge(List<? extends RecordInput> diskInputs,
      List<? extends RecordInput> memoryInputs, int maxDiskInputsPerPass,
      Comparator<T> comparator, boolean allowRecordReuse, Path intermediateOutputPath,
      CompressionCodec codec, int bufferSize, boolean enableChecksum) throws IOException {
    return merge(diskInputs, memoryInputs, maxDiskInputsPerPass, comparator, allowRecordReuse,
        false, intermediateOutputPath, "", codec, bufferSize, enableChecksum);
  }

  /**
   * Merges the specified inputs.
   *
   * @param diskInputs the disk inputs, oldest first; may be <code>null</code>
   * @param memoryInputs the memory inputs; may be <code>null</code>
   * @param maxDiskInputsPerPass the maximum number of disk inputs merged in one pass
   * @param comparator the comparator, or <code>null</code> to use the default comparator of the
   *          record class
   * @param allowRecordReuse whether the final pass may reuse record instances
   * @param forceDeserialization <code>true</code> to return deserialized records from the final
   *          pass even if raw records are supported
   * @param intermediateOutputPath the directory for intermediate pass files
   * @param passFilePrefix the prefix of the intermediate pass file names
   * @param codec the codec for intermediate pass files, or <code>null</code>
   * @param bufferSize the buffer size for intermediate pass files
   * @param enableChecksum whether intermediate pass files carry a checksum
   */
  public MergeResult<T> merge(List<? extends RecordInput> diskInputs,
      List<? extends RecordInput> memoryInputs, int maxDiskInputsPerPass,
      Comparator<T> comparator, boolean allowRecordReuse, boolean forceDeserialization,
      Path intermediateOutputPath, String passFilePrefix, CompressionCodec codec,
      int bufferSize, boolean enableChecksum) throws IOException {
    if (diskInputs == null && memoryInputs == null) {
      throw new IllegalArgumentException("diskInputs and memoryInputs cannot both be null.");
    }
    Preconditions.checkNotNull(intermediateOutputPath, "intermediateOutputPath");
    Preconditions.checkNotNull(passFilePrefix, "passFilePrefix");
    Preconditions.checkArgument(maxDiskInputsPerPass > 1,
        "maxDiskInputsPerPass must be greater than one.");

    Comparator<T> effectiveComparator = comparator == null ? getDefaultComparator()
        : comparator;
    boolean rawReaderSupported = isRawComparison(effectiveComparator)
        && allRawReaderSupported(memoryInputs) && allRawReaderSupported(diskInputs);

    List<RecordInput> actualDiskInputs = diskInputs == null ? Collections.<RecordInput>emptyList()
        : new ArrayList<RecordInput>(diskInputs);
    int diskInputsProcessed = 0;
    if (actualDiskInputs.size() > maxDiskInputsPerPass) {
      FileSystem fs = intermediateOutputPath.getFileSystem(conf);
      int pass = 0;
      while (actualDiskInputs.size() - diskInputsProcessed > maxDiskInputsPerPass) {
        Path outputFile = new Path(intermediateOutputPath,
            passFilePrefix + "merge_pass" + pass + ".tmp");
        int remaining = actualDiskInputs.size() - diskInputsProcessed;
        int numDiskInputsForPass = getNumDiskInputsForPass(pass, remaining, maxDiskInputsPerPass);
        LOG.info("Merging {} intermediate segments out of a total of {} disk segments.",
            numDiskInputsForPass, remaining);
        MergeResult<T> passResult = runMergePass(actualDiskInputs.subList(diskInputsProcessed,
            diskInputsProcessed + numDiskInputsForPass), effectiveComparator, true,
            rawReaderSupported);
        writeMergePass(passResult, fs, outputFile, codec, bufferSize, enableChecksum,
            rawReaderSupported);
        actualDiskInputs.add(new FileRecordInput(conf, fs, outputFile, recordClass, codec,
            bufferSize, allowRecordReuse, true));
        diskInputsProcessed += numDiskInputsForPass;
        ++pass;
      }
    }

    List<RecordInput> inputs = new ArrayList<RecordInput>();
    if (memoryInputs != null) {
      inputs.addAll(memoryInputs);
    }
    int memoryInputCount = inputs.size();
    inputs.addAll(actualDiskInputs.subList(diskInputsProcessed, actualDiskInputs.size()));
    int diskInputCount = actualDiskInputs.size() - diskInputsProcessed;

    usingRawRecords = rawReaderSupported && !forceDeserialization;
    LOG.info("Last merge pass with {} disk and {} memory segments; raw records: {}",
        diskInputCount, memoryInputCount, usingRawRecords);
    return runMergePass(inputs, effectiveComparator, allowRecordReuse, usingRawRecords);
  }

  /**
   * Merges the specified inputs and writes the result to a record file.
   *
   * @return the uncompressed size of the records written
   */
  public long writeMerge(Path file, List<? extends RecordInput> diskInputs,
      List<? extends RecordInput> memoryInputs, int maxDiskInputsPerPass,
      Comparator<T> comparator, boolean allowRecordReuse, Path intermediateOutputPath,
      String passFilePrefix, CompressionCodec codec, int bufferSize, boolean enableChecksum)
      throws IOException {
    Preconditions.checkNotNull(file, "file");
    MergeResult<T> result = merge(diskInputs, memoryInputs, maxDiskInputsPerPass, comparator,
        allowRecordReuse, false, intermediateOutputPath, passFilePrefix, codec, bufferSize,
        enableChecksum);
    return writeMergePass(result, file.getFileSystem(conf), file, codec, bufferSize,
        enableChecksum, usingRawRecords);
  }

  private long writeMergePass(MergeResult<T> pass, FileSystem fs, Path outputFile,
      CompressionCodec codec, int bufferSize, boolean enableChecksum, boolean raw)
      throws IOException {
    try {
      if (raw) {
        RecordFile.RawWriter writer = new RecordFile.RawWriter(conf, fs, outputFile, codec,
            bufferSize, enableChecksum);
        try {
          while (pass.hasNext()) {
            pass.next().writeRawRecord(writer);
          }
        } finally {
          writer.close();
        }
        bytesWritten.addAndGet(writer.getBytesWritten());
        return writer.getOutputBytes();
      } else {
        RecordFile.Writer<T> writer = new RecordFile.Writer<T>(conf, fs, outputFile, recordClass,
            codec, bufferSize, enableChecksum);
        try {
          while (pass.hasNext()) {
            pass.next().writeRecord(writer);
          }
        } finally {
          writer.close();
        }
        bytesWritten.addAndGet(writer.getBytesWritten());
        return writer.getOutputBytes();
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } finally {
      pass.close();
    }
  }

  private MergeResult<T> runMergePass(List<? extends RecordInput> inputs,
      Comparator<T> comparator, boolean allowRecordReuse, boolean raw) throws IOException {
    ++mergePassCount;
    List<MergeInput> mergeInputs = new ArrayList<MergeInput>(inputs.size());
    try {
      for (RecordInput input : inputs) {
        MergeInput mergeInput = new MergeInput(input, raw);
        if (mergeInput.readRecord()) {
          mergeInputs.add(mergeInput);
        } else {
          if (!input.isMemoryBased()) {
            bytesRead.addAndGet(mergeInput.getBytesRead());
          }
          mergeInput.close();
        }
      }
    } catch (IOException | RuntimeException e) {
      for (MergeInput mergeInput : mergeInputs) {
        try {
          mergeInput.close();
        } catch (IOException closeException) {
          LOG.warn("Failed to close merge input", closeException);
        }
      }
      throw e;
    }

    List<RecordReader<?>> readers = new ArrayList<RecordReader<?>>(mergeInputs.size());
    for (MergeInput mergeInput : mergeInputs) {
      readers.add(mergeInput.getReader());
    }
    PriorityQueue<MergeInput> mergeQueue = new PriorityQueue<MergeInput>(mergeInputs,
        createInputComparator(comparator, raw));
    return new MergeResult<T>(mergeQueue, readers,
        new MergeResultRecord<T>(conf, recordClass, allowRecordReuse), bytesRead);
  }

  private Comparator<MergeInput> createInputComparator(final Comparator<T> comparator,
      boolean raw) {
    if (raw) {
      final RawComparator<T> rawComparator = (RawComparator<T>) comparator;
      return new Comparator<MergeInput>() {
        @Override
        public int compare(MergeInput o1, MergeInput o2) {
          RawRecord r1 = o1.getCurrentRawRecord();
          RawRecord r2 = o2.getCurrentRawRecord();
          return rawComparator.compare(r1.getBuffer(), r1.getOffset(), r1.getLength(),
              r2.getBuffer(), r2.getOffset(), r2.getLength());
        }
      };
    }
    return new Comparator<MergeInput>() {
      @Override
      @SuppressWarnings("unchecked")
      public int compare(MergeInput o1, MergeInput o2) {
        return comparator.compare((T) o1.getReader().getCurrentRecord(),
            (T) o2.getReader().getCurrentRecord());
      }
    };
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private Comparator<T> getDefaultComparator() {
    if (WritableComparable.class.isAssignableFrom(recordClass)) {
      return (Comparator<T>) WritableComparator.get(
          (Class<? extends WritableComparable>) recordClass, conf);
    }
    if (Comparable.class.isAssignableFrom(recordClass)) {
      return (Comparator<T>) Comparator.naturalOrder();
    }
    throw new IllegalArgumentException("No comparator specified and " + recordClass.getName()
        + " is not comparable.");
  }

  private static boolean isRawComparison(Comparator<?> comparator) {
    if (!(comparator instanceof RawComparator)) {
      return false;
    }
    // The generic comparator returned for types without a registered raw comparator
    // deserializes both records on every comparison.
    if (comparator.getClass() == WritableComparator.class) {
      return false;
    }
    return !(comparator instanceof DeserializingRawComparator)
        || !((DeserializingRawComparator<?>) comparator).usesDeserialization();
  }

  private static boolean allRawReaderSupported(List<? extends RecordInput> inputs) {
    if (inputs == null) {
      return true;
    }
    for (RecordInput input : inputs) {
      if (!input.isRawReaderSupported()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Determines the number of segments to merge in a given pass. Assuming more than the maximum
   * number of segments, the first pass brings the total number of segments - 1 to be divisible
   * by the maximum - 1, since each pass takes X segments and produces 1.
   */
  @VisibleForTesting
  static int getNumDiskInputsForPass(int pass, int diskInputsRemaining,
      int maxDiskInputsPerPass) {
    if (pass > 0 || diskInputsRemaining <= maxDiskInputsPerPass || maxDiskInputsPerPass == 1) {
      return Math.min(diskInputsRemaining, maxDiskInputsPerPass);
    }
    int mod = (diskInputsRemaining - 1) % (maxDiskInputsPerPass - 1);
    if (mod == 0) {
      return Math.min(diskInputsRemaining, maxDiskInputsPerPass);
    }
    return mod + 1;
  }
}
