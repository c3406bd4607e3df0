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

package org.apache.jet.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Base class for record readers that combine the inputs of several channels or tasks.
 * <p/>
 * The reader holds one or more partitions, each of which receives {@link #getTotalInputCount()}
 * inputs through {@link #addInput(List)}. Records are read from the current partition only;
 * {@link #nextPartition(PartitionGate)} moves to the next one. Inputs may arrive on a different
 * thread than the one reading; subclasses use {@link #waitForInputs(int, long)} to block until
 * enough inputs are available.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public abstract class MultiInputRecordReader<T> extends RecordReader<T> {

  private static final Logger LOG = LoggerFactory.getLogger(MultiInputRecordReader.class);

  private static final class Partition {
    private final int partitionNumber;
    private final List<RecordInput> inputs;
    private int firstNonMemoryIndex;
    private long inputBytes = -1;
    private long bytesRead = -1;

    Partition(int partitionNumber, int totalInputCount) {
      this.partitionNumber = partitionNumber;
      this.inputs = new ArrayList<RecordInput>(totalInputCount);
    }

    float getProgressSum() {
      float result = 0;
      for (RecordInput input : inputs) {
        result += input.getProgress();
      }
      return result;
    }

    long getInputBytesSum() {
      if (inputBytes >= 0) {
        return inputBytes;
      }
      long result = 0;
      for (RecordInput input : inputs) {
        RecordReader<?> reader = input.getCreatedReader();
        if (reader != null) {
          result += reader.getInputBytes();
        }
      }
      return result;
    }

    long getBytesReadSum() {
      if (bytesRead >= 0) {
        return bytesRead;
      }
      long result = 0;
      for (RecordInput input : inputs) {
        RecordReader<?> reader = input.getCreatedReader();
        if (reader != null) {
          result += reader.getBytesRead();
        }
      }
      return result;
    }

    void addInput(RecordInput input) {
      // Memory inputs are kept in front of disk inputs, but never ahead of inputs already handed out.
      if (input.isMemoryBased()) {
        inputs.add(firstNonMemoryIndex, input);
        ++firstNonMemoryIndex;
      } else {
        inputs.add(input);
      }
    }

    RecordInput getInput(int index, boolean memoryOnly) {
      RecordInput result = inputs.get(index);
      if (memoryOnly && !result.isMemoryBased()) {
        return null;
      }
      if (index >= firstNonMemoryIndex) {
        firstNonMemoryIndex = index + 1;
      }
      return result;
    }

    void close() {
      if (inputBytes == -1) {
        inputBytes = getInputBytesSum();
      }
      if (bytesRead == -1) {
        bytesRead = getBytesReadSum();
      }
      for (RecordInput input : inputs) {
        try {
          input.close();
        } catch (IOException e) {
          LOG.warn("Failed to close input of partition " + partitionNumber, e);
        }
      }
    }
  }

  private final Configuration conf;
  private final Class<T> recordClass;
  private final int totalInputCount;
  private final boolean allowRecordReuse;
  private final int bufferSize;
  private final List<Partition> partitions = new ArrayList<Partition>();
  private final Map<Integer, Partition> partitionsByNumber = new HashMap<Integer, Partition>();
  private int currentPartitionIndex;
  private int firstActivePartitionIndex;
  private boolean closed;

  protected MultiInputRecordReader(Configuration conf, Class<T> recordClass, int[] partitionNumbers,
      int totalInputCount, boolean allowRecordReuse, int bufferSize) {
    Preconditions.checkNotNull(partitionNumbers, "partitionNumbers");
    Preconditions.checkArgument(totalInputCount >= 1,
        "Multi input record reader must have at least one input.");
    Preconditions.checkArgument(bufferSize > 0, "Buffer size must be larger than zero.");
    this.conf = conf == null ? new Configuration() : conf;
    this.recordClass = recordClass;
    this.totalInputCount = totalInputCount;
    this.allowRecordReuse = allowRecordReuse;
    this.bufferSize = bufferSize;
    for (int partitionNumber : partitionNumbers) {
      addPartition(partitionNumber);
    }
  }

  public Configuration getConf() {
    return conf;
  }

  public Class<T> getRecordClass() {
    return recordClass;
  }

  public int getTotalInputCount() {
    return totalInputCount;
  }

  public boolean isAllowRecordReuse() {
    return allowRecordReuse;
  }

  public int getBufferSize() {
    return bufferSize;
  }

  @Override
  public float getProgress() {
    synchronized (partitions) {
      if (partitions.isEmpty()) {
        return 0;
      }
      float sum = 0;
      for (Partition partition : partitions) {
        sum += partition.getProgressSum();
      }
      return sum / (totalInputCount * partitions.size());
    }
  }

  @Override
  public long getInputBytes() {
    synchronized (partitions) {
      long result = 0;
      for (Partition partition : partitions) {
        result += partition.getInputBytesSum();
      }
      return result;
    }
  }

  @Override
  public long getBytesRead() {
    synchronized (partitions) {
      long result = 0;
      for (Partition partition : partitions) {
        result += partition.getBytesReadSum();
      }
      return result;
    }
  }

  /**
   * Returns the number of inputs that have arrived for the currently active partitions.
   */
  public int getCurrentInputCount() {
    synchronized (partitions) {
      return partitions.isEmpty() ? 0 : partitions.get(firstActivePartitionIndex).inputs.size();
    }
  }

  public List<Integer> getPartitionNumbers() {
    synchronized (partitions) {
      List<Integer> result = new ArrayList<Integer>(partitions.size());
      for (Partition partition : partitions) {
        result.add(partition.partitionNumber);
      }
      return result;
    }
  }

  public int getPartitionCount() {
    synchronized (partitions) {
      return partitions.size();
    }
  }

  public int getCurrentPartition() {
    synchronized (partitions) {
      return partitions.get(currentPartitionIndex).partitionNumber;
    }
  }

  /**
   * Moves to the next partition. The gate is asked whether each candidate partition may be
   * started; partitions it refuses are closed and skipped.
   *
   * @return <code>false</code> if there are no more partitions
   */
  public boolean nextPartition(PartitionGate gate) throws IOException {
    Preconditions.checkNotNull(gate, "gate");
    int candidateIndex;
    synchronized (partitions) {
      checkNotClosed();
      partitions.get(currentPartitionIndex).close();
      candidateIndex = currentPartitionIndex + 1;
    }
    // The gate may call the coordinator, so it runs without holding the lock.
    while (true) {
      Partition candidate;
      synchronized (partitions) {
        checkNotClosed();
        if (candidateIndex >= partitions.size()) {
          // Leave the index on the last partition so additional partitions continue from there.
          currentPartitionIndex = partitions.size() - 1;
          return false;
        }
        candidate = partitions.get(candidateIndex);
      }
      boolean accepted = gate.startPartition(candidate.partitionNumber);
      synchronized (partitions) {
        checkNotClosed();
        if (accepted) {
          currentPartitionIndex = candidateIndex;
          onCurrentPartitionChanged();
          return true;
        }
        LOG.info("Skipping partition {}.", candidate.partitionNumber);
        candidate.close();
      }
      ++candidateIndex;
    }
  }

  /**
   * Adds one input for each active partition.
   */
  public void addInput(List<? extends RecordInput> partitionInputs) {
    Preconditions.checkNotNull(partitionInputs, "partitionInputs");
    synchronized (partitions) {
      checkNotClosed();
      Preconditions.checkArgument(
          partitionInputs.size() == partitions.size() - firstActivePartitionIndex,
          "Incorrect number of partitions.");
      Preconditions.checkState(getCurrentInputCount() < totalInputCount,
          "The multi input record reader already has all inputs.");
      for (int x = 0; x < partitionInputs.size(); ++x) {
        partitions.get(firstActivePartitionIndex + x).addInput(partitionInputs.get(x));
      }
      partitions.notifyAll();
    }
  }

  /**
   * Adds partitions to the reader. The previously assigned partitions must have received all
   * their inputs.
   */
  public void assignAdditionalPartitions(int[] newPartitions) {
    Preconditions.checkNotNull(newPartitions, "newPartitions");
    Preconditions.checkArgument(newPartitions.length > 0, "The list of new partitions is empty.");
    synchronized (partitions) {
      checkNotClosed();
      Preconditions.checkState(partitions.isEmpty()
          || partitions.get(firstActivePartitionIndex).inputs.size() == totalInputCount,
          "You cannot assign new partitions to a record reader until the currently assigned "
          + "partitions have all their inputs.");
      firstActivePartitionIndex = partitions.size();
      for (int partitionNumber : newPartitions) {
        addPartition(partitionNumber);
      }
    }
  }

  /**
   * Blocks until the active partitions have at least the specified number of inputs.
   *
   * @param timeoutMillis the maximum time to wait, 0 to not wait, or a negative value to wait
   *          indefinitely
   * @return <code>false</code> if the timeout expired
   */
  protected boolean waitForInputs(int inputCount, long timeoutMillis) throws InterruptedException {
    Preconditions.checkArgument(inputCount > 0, "inputCount must be greater than zero.");
    int required = Math.min(inputCount, totalInputCount);
    long deadline = timeoutMillis > 0 ? System.nanoTime()
        + TimeUnit.MILLISECONDS.toNanos(timeoutMillis) : 0;
    synchronized (partitions) {
      checkNotClosed();
      while (partitions.get(firstActivePartitionIndex).inputs.size() < required) {
        if (timeoutMillis == 0) {
          return false;
        }
        if (timeoutMillis > 0) {
          long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
          if (remaining <= 0) {
            return false;
          }
          partitions.wait(remaining);
        } else {
          partitions.wait();
        }
        checkNotClosed();
      }
      return true;
    }
  }

  /**
   * Returns the number of inputs that have arrived for the specified partition.
   */
  protected int getInputCount(int partitionNumber) {
    synchronized (partitions) {
      return getPartition(partitionNumber).inputs.size();
    }
  }

  protected RecordInput getInput(int index) {
    synchronized (partitions) {
      return partitions.get(currentPartitionIndex).getInput(index, false);
    }
  }

  /**
   * @return the input, or <code>null</code> if <code>memoryOnly</code> is set and the input is
   *         not memory based
   */
  protected RecordInput getInput(int partitionNumber, int index, boolean memoryOnly) {
    synchronized (partitions) {
      return getPartition(partitionNumber).getInput(index, memoryOnly);
    }
  }

  protected RecordReader<?> getInputReader(int index) throws IOException {
    return getInput(index).getReader();
  }

  /**
   * Called after the current partition changed, with the lock on the partition list held.
   */
  protected void onCurrentPartitionChanged() {
  }

  protected boolean isClosed() {
    return closed;
  }

  protected void checkNotClosed() {
    Preconditions.checkState(!closed, "The record reader has been closed.");
  }

  @Override
  public void close() throws IOException {
    synchronized (partitions) {
      if (!closed) {
        closed = true;
        for (Partition partition : partitions) {
          partition.close();
        }
        partitions.clear();
        partitionsByNumber.clear();
        partitions.notifyAll();
      }
    }
  }

  private void addPartition(int partitionNumber) {
    Partition partition = new Partition(partitionNumber, totalInputCount);
    Preconditions.checkArgument(partitionsByNumber.put(partitionNumber, partition) == null,
        "Duplicate partition %s", partitionNumber);
    partitions.add(partition);
  }

  private Partition getPartition(int partitionNumber) {
    Partition partition = partitionsByNumber.get(partitionNumber);
    Preconditions.checkArgument(partition != null, "Unknown partition %s", partitionNumber);
    return partition;
  }
}
