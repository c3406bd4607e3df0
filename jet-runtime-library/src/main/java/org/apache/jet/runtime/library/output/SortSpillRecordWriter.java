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

package org.apache.jet.runtime.library.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.DataInputBuffer;
import org.apache.hadoop.io.DataOutputBuffer;
import org.apache.hadoop.io.RawComparator;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.serializer.Deserializer;
import org.apache.hadoop.io.serializer.SerializationFactory;
import org.apache.hadoop.io.serializer.Serializer;
import org.apache.hadoop.util.IndexedSortable;
import org.apache.hadoop.util.QuickSort;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.common.ReflectionUtils;
import org.apache.jet.io.HasPartitioner;
import org.apache.jet.io.Partitioner;
import org.apache.jet.io.RawRecord;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.runtime.api.Task;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.common.io.FileRecordInput;
import org.apache.jet.runtime.library.common.io.RecordFile;
import org.apache.jet.runtime.library.common.sort.JetMerger;
import org.apache.jet.runtime.library.common.sort.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

/**
 * Partitioned record writer whose output files are sorted.
 * <p/>
 * Records are serialized into an in-memory buffer. When the buffer reaches its limit the
 * buffered records are sorted by partition and then by the comparator, and every partition with
 * data is spilled to its own record file. Finishing the writer spills what is left and merges
 * the spills of each partition into that partition's output file with {@link JetMerger}. With
 * a single spill the spill files are renamed instead. Partitions without records get an empty
 * output file.
 * <p/>
 * A combiner, if configured, runs over the sorted records of each partition before they are
 * spilled. It runs again over the merged records when there are at least
 * {@link JetConfiguration#JET_FILE_CHANNEL_SPILL_SORT_MIN_SPILLS_FOR_COMBINE_DURING_MERGE}
 * spills, so it must accept being run more than once.
 *
 * @param <T> the type of the records
 */
@Private
public class SortSpillRecordWriter<T> extends RecordWriter<T>
    implements IndexedSortable, HasPartitioner<T> {

  private static final Logger LOG = LoggerFactory.getLogger(SortSpillRecordWriter.class);

  // Metadata of a buffered record: partition, start offset and length.
  private static final int PARTITION = 0;
  private static final int START = 1;
  private static final int LENGTH = 2;
  private static final int META_SIZE = 3;

  private final Configuration conf;
  private final FileSystem fs;
  private final List<Path> outputFiles;
  private final Path spillDirectory;
  private final Class<T> recordClass;
  private final Partitioner<T> partitioner;
  private final Comparator<T> comparator;
  private final RawComparator<T> rawComparator;
  private final Task<T, T> combiner;
  private final int spillLimit;
  private final int writeBufferSize;
  private final CompressionCodec codec;
  private final boolean enableChecksum;
  private final int maxDiskInputsPerPass;
  private final int minSpillsForCombineDuringMerge;
  private final JetMerger<T> merger;
  private final DataOutputBuffer buffer = new DataOutputBuffer();
  private final Serializer<T> serializer;
  private final Deserializer<T> deserializer1;
  private final Deserializer<T> deserializer2;
  private final DataInputBuffer inputBuffer1 = new DataInputBuffer();
  private final DataInputBuffer inputBuffer2 = new DataInputBuffer();
  private final List<Path[]> spills = new ArrayList<Path[]>();
  private T record1;
  private T record2;
  private int[] meta = new int[META_SIZE * 1024];
  private int recordCount;
  private long outputBytes;
  private long bytesWritten;
  private boolean finished;

  /**
   * @param outputFiles the output file of each partition, indexed by the partition returned by
   *          the partitioner; spill files are written to the directory of the first one
   */
  public SortSpillRecordWriter(Configuration conf, FileSystem fs, List<Path> outputFiles,
      Class<T> recordClass, Partitioner<T> partitioner) throws IOException {
    Preconditions.checkNotNull(outputFiles, "outputFiles");
    Preconditions.checkArgument(!outputFiles.isEmpty(), "At least one output file is required");
    this.conf = Preconditions.checkNotNull(conf, "conf");
    this.fs = Preconditions.checkNotNull(fs, "fs");
    this.outputFiles = new ArrayList<Path>(outputFiles);
    this.spillDirectory = outputFiles.get(0).getParent();
    this.recordClass = Preconditions.checkNotNull(recordClass, "recordClass");
    this.partitioner = Preconditions.checkNotNull(partitioner, "partitioner");
    partitioner.setPartitions(outputFiles.size());
    this.comparator = createComparator(conf, recordClass);
    this.rawComparator = comparator instanceof RawComparator
        ? (RawComparator<T>) comparator : null;
    this.combiner = createCombiner(conf);
    this.spillLimit = ConfigUtils.getSpillBufferLimitSize(conf);
    this.writeBufferSize = ConfigUtils.getWriteBufferSize(conf);
    this.codec = ConfigUtils.getIntermediateCompressionCodec(conf);
    this.enableChecksum = ConfigUtils.isIntermediateChecksumEnabled(conf);
    this.maxDiskInputsPerPass = ConfigUtils.getMaxDiskInputsPerPass(conf);
    this.minSpillsForCombineDuringMerge = ConfigUtils.getMinSpillsForCombineDuringMerge(conf);
    this.merger = new JetMerger<T>(conf, recordClass);

    SerializationFactory factory = new SerializationFactory(conf);
    serializer = factory.getSerializer(recordClass);
    deserializer1 = factory.getDeserializer(recordClass);
    deserializer2 = factory.getDeserializer(recordClass);
    if (serializer == null || deserializer1 == null) {
      throw new IllegalArgumentException("No serialization found for " + recordClass.getName());
    }
    serializer.open(buffer);
    deserializer1.open(inputBuffer1);
    deserializer2.open(inputBuffer2);
    LOG.debug("Sort-spill output with spill limit {} bytes for {} partitions; combiner: {}.",
        spillLimit, outputFiles.size(), combiner);
  }

  @Override
  public Partitioner<T> getPartitioner() {
    return partitioner;
  }

  public int getSpillCount() {
    return spills.size();
  }

  @Override
  protected void writeRecordInternal(T record) throws IOException {
    Preconditions.checkState(!finished, "The writer has already finished writing.");
    int partition = outputFiles.size() == 1 ? 0 : partitioner.getPartition(record);
    Preconditions.checkElementIndex(partition, outputFiles.size(), "partition");
    int start = buffer.getLength();
    serializer.serialize(record);
    int length = buffer.getLength() - start;
    if (recordCount * META_SIZE == meta.length) {
      meta = Arrays.copyOf(meta, meta.length * 2);
    }
    int offset = recordCount * META_SIZE;
    meta[offset + PARTITION] = partition;
    meta[offset + START] = start;
    meta[offset + LENGTH] = length;
    ++recordCount;
    outputBytes += length;
    if (buffer.getLength() >= spillLimit) {
      sortAndSpill();
    }
  }

  /**
   * Returns the serialized size of the records written.
   */
  @Override
  public long getOutputBytes() {
    return outputBytes;
  }

  /**
   * Includes the spill files and intermediate merge passes.
   */
  @Override
  public long getBytesWritten() {
    return bytesWritten + merger.getBytesWritten();
  }

  /**
   * Returns the bytes read back while merging spills.
   */
  public long getBytesRead() {
    return merger.getBytesRead();
  }

  @Override
  public void finishWriting() throws IOException {
    if (finished) {
      return;
    }
    finished = true;
    try {
      sortAndSpill();
      for (int partition = 0; partition < outputFiles.size(); ++partition) {
        writePartitionOutput(partition);
      }
      LOG.info("Wrote {} partitions from {} spills.", outputFiles.size(), spills.size());
    } finally {
      serializer.close();
      deleteSpillFiles();
    }
  }

  @Override
  public int compare(int i, int j) {
    int left = i * META_SIZE;
    int right = j * META_SIZE;
    int result = Integer.compare(meta[left + PARTITION], meta[right + PARTITION]);
    if (result != 0) {
      return result;
    }
    byte[] data = buffer.getData();
    if (rawComparator != null) {
      return rawComparator.compare(data, meta[left + START], meta[left + LENGTH], data,
          meta[right + START], meta[right + LENGTH]);
    }
    try {
      inputBuffer1.reset(data, meta[left + START], meta[left + LENGTH]);
      inputBuffer2.reset(data, meta[right + START], meta[right + LENGTH]);
      record1 = deserializer1.deserialize(record1);
      record2 = deserializer2.deserialize(record2);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return comparator.compare(record1, record2);
  }

  @Override
  public void swap(int i, int j) {
    int left = i * META_SIZE;
    int right = j * META_SIZE;
    for (int x = 0; x < META_SIZE; ++x) {
      int temp = meta[left + x];
      meta[left + x] = meta[right + x];
      meta[right + x] = temp;
    }
  }

  private void sortAndSpill() throws IOException {
    if (recordCount == 0) {
      return;
    }
    int spillNumber = spills.size();
    LOG.info("Sorting {} records ({} bytes) for spill {}.", recordCount, buffer.getLength(),
        spillNumber);
    Path[] files = new Path[outputFiles.size()];
    try {
      new QuickSort().sort(this, 0, recordCount);
      int index = 0;
      while (index < recordCount) {
        int partition = meta[index * META_SIZE + PARTITION];
        int end = index + 1;
        while (end < recordCount && meta[end * META_SIZE + PARTITION] == partition) {
          ++end;
        }
        Path file = new Path(spillDirectory, "spill" + spillNumber + "_part" + partition + ".tmp");
        files[partition] = file;
        if (combiner == null) {
          spillRecords(file, index, end);
        } else {
          combineRecords(file, index, end);
        }
        index = end;
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } finally {
      spills.add(files);
    }
    buffer.reset();
    recordCount = 0;
  }

  private void spillRecords(Path file, int start, int end) throws IOException {
    RecordFile.RawWriter writer = new RecordFile.RawWriter(conf, fs, file, codec,
        writeBufferSize, enableChecksum);
    try {
      RawRecord record = new RawRecord();
      for (int x = start; x < end; ++x) {
        int offset = x * META_SIZE;
        record.reset(buffer.getData(), meta[offset + START], meta[offset + LENGTH]);
        writer.writeRecord(record);
      }
    } finally {
      writer.close();
      bytesWritten += writer.getBytesWritten();
    }
  }

  private void combineRecords(Path file, int start, int end) throws IOException {
    RecordFile.Writer<T> writer = new RecordFile.Writer<T>(conf, fs, file, recordClass, codec,
        writeBufferSize, enableChecksum);
    try {
      runCombiner(new BufferedRecordReader(start, end), writer);
    } finally {
      writer.close();
      bytesWritten += writer.getBytesWritten();
    }
  }

  private void writePartitionOutput(int partition) throws IOException {
    Path outputFile = outputFiles.get(partition);
    List<RecordInput> inputs = new ArrayList<RecordInput>(spills.size());
    for (Path[] files : spills) {
      if (files[partition] != null) {
        inputs.add(new FileRecordInput(conf, fs, files[partition], recordClass, codec,
            writeBufferSize, false, true));
      }
    }

    if (inputs.isEmpty()) {
      RecordFile.Writer<T> writer = new RecordFile.Writer<T>(conf, fs, outputFile, recordClass,
          codec, writeBufferSize, enableChecksum);
      writer.close();
      bytesWritten += writer.getBytesWritten();
    } else if (inputs.size() == 1) {
      Path spillFile = ((FileRecordInput) inputs.get(0)).getPath();
      fs.delete(outputFile, false);
      if (!fs.rename(spillFile, outputFile)) {
        throw new IOException("Could not rename " + spillFile + " to " + outputFile);
      }
    } else if (isCombiningDuringMerge()) {
      LOG.info("Merging and combining {} spills of partition {}.", inputs.size(), partition);
      MergeResult<T> result = merger.merge(inputs, null, maxDiskInputsPerPass, comparator, false,
          true, spillDirectory, "part" + partition + "_", codec, writeBufferSize,
          enableChecksum);
      RecordFile.Writer<T> writer = null;
      try {
        writer = new RecordFile.Writer<T>(conf, fs, outputFile, recordClass, codec,
            writeBufferSize, enableChecksum);
        runCombiner(new MergeResultRecordReader<T>(result), writer);
      } finally {
        result.close();
        if (writer != null) {
          writer.close();
          bytesWritten += writer.getBytesWritten();
        }
      }
    } else {
      LOG.info("Merging {} spills of partition {}.", inputs.size(), partition);
      merger.writeMerge(outputFile, inputs, null, maxDiskInputsPerPass, comparator, true,
          spillDirectory, "part" + partition + "_", codec, writeBufferSize, enableChecksum);
    }
  }

  private boolean isCombiningDuringMerge() {
    return combiner != null && minSpillsForCombineDuringMerge > 0
        && spills.size() >= minSpillsForCombineDuringMerge;
  }

  private void runCombiner(RecordReader<T> input, RecordWriter<T> output) throws IOException {
    try {
      combiner.run(input, output);
    } catch (Exception e) {
      Throwables.throwIfInstanceOf(e, IOException.class);
      Throwables.throwIfUnchecked(e);
      throw new IOException("The combiner " + combiner.getClass().getName() + " failed.", e);
    }
  }

  private void deleteSpillFiles() {
    for (Path[] files : spills) {
      for (Path file : files) {
        if (file != null) {
          try {
            fs.delete(file, false);
          } catch (IOException e) {
            LOG.warn("Could not delete spill file " + file, e);
          }
        }
      }
    }
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private static <T> Comparator<T> createComparator(Configuration conf, Class<T> recordClass) {
    String className = conf.getTrimmed(
        JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_COMPARATOR_CLASS);
    if (className != null && !className.isEmpty()) {
      try {
        return ReflectionUtils.createClazzInstance(className, conf);
      } catch (JetReflectionException e) {
        throw new JetUncheckedException("Could not create spill sort comparator " + className, e);
      }
    }
    if (WritableComparable.class.isAssignableFrom(recordClass)) {
      return (Comparator<T>) WritableComparator.get(
          (Class<? extends WritableComparable>) recordClass, conf);
    }
    if (Comparable.class.isAssignableFrom(recordClass)) {
      return (Comparator<T>) Comparator.naturalOrder();
    }
    throw new IllegalArgumentException("No spill sort comparator specified and "
        + recordClass.getName() + " is not comparable.");
  }

  private static <T> Task<T, T> createCombiner(Configuration conf) {
    String className = conf.getTrimmed(
        JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_COMBINER_CLASS);
    if (className == null || className.isEmpty()) {
      return null;
    }
    try {
      return ReflectionUtils.createClazzInstance(className, conf);
    } catch (JetReflectionException e) {
      throw new JetUncheckedException("Could not create combiner " + className, e);
    }
  }

  /**
   * Reads the sorted records of one partition from the spill buffer.
   */
  private final class BufferedRecordReader extends RecordReader<T> {
    private final int start;
    private final int end;
    private final Deserializer<T> deserializer;
    private final DataInputBuffer input = new DataInputBuffer();
    private int position;

    BufferedRecordReader(int start, int end) throws IOException {
      this.start = start;
      this.end = end;
      this.position = start;
      this.deserializer = new SerializationFactory(conf).getDeserializer(recordClass);
      deserializer.open(input);
    }

    @Override
    protected boolean readRecordInternal() throws IOException {
      if (position == end) {
        setCurrentRecord(null);
        return false;
      }
      int offset = position * META_SIZE;
      input.reset(buffer.getData(), meta[offset + START], meta[offset + LENGTH]);
      setCurrentRecord(deserializer.deserialize(null));
      ++position;
      return true;
    }

    @Override
    public float getProgress() {
      return end == start ? 1.0f : (float) (position - start) / (end - start);
    }

    @Override
    public void close() throws IOException {
      deserializer.close();
    }
  }

  private static final class MergeResultRecordReader<T> extends RecordReader<T> {
    private final MergeResult<T> result;

    MergeResultRecordReader(MergeResult<T> result) {
      this.result = result;
    }

    @Override
    protected boolean readRecordInternal() throws IOException {
      try {
        if (result.hasNext()) {
          setCurrentRecord(result.next().getValue());
          return true;
        }
      } catch (UncheckedIOException e) {
        throw e.getCause();
      }
      setCurrentRecord(null);
      return false;
    }

    @Override
    public float getProgress() {
      return result.getProgress();
    }
  }
}
