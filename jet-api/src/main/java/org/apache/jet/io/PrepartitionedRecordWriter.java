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

import java.io.Closeable;
import java.io.IOException;

import org.apache.hadoop.classification.InterfaceAudience.Public;

import com.google.common.base.Preconditions;

/**
 * Writes records to an explicitly specified partition.
 * <p/>
 * If the base writer implements {@link HasPartitioner} with a {@link PrepartitionedPartitioner},
 * the partition selects the writer the record goes to. Any other base writer has a single
 * partition, 0.
 */
@Public
public class PrepartitionedRecordWriter<T> implements Closeable {

  private final RecordWriter<T> baseWriter;
  private final PrepartitionedPartitioner<T> partitioner;
  private final boolean closeBaseWriter;

  public PrepartitionedRecordWriter(RecordWriter<T> baseWriter, boolean closeBaseWriter) {
    this.baseWriter = Preconditions.checkNotNull(baseWriter, "baseWriter");
    this.closeBaseWriter = closeBaseWriter;
    PrepartitionedPartitioner<T> found = null;
    if (baseWriter instanceof HasPartitioner) {
      Partitioner<T> basePartitioner = ((HasPartitioner<T>) baseWriter).getPartitioner();
      if (basePartitioner instanceof PrepartitionedPartitioner) {
        found = (PrepartitionedPartitioner<T>) basePartitioner;
      }
    }
    this.partitioner = found;
  }

  public void writeRecord(T record, int partition) throws IOException {
    if (partitioner == null) {
      Preconditions.checkArgument(partition == 0, "Partition %s out of range [0, 1)", partition);
    } else {
      partitioner.setCurrentPartition(partition);
    }
    baseWriter.writeRecord(record);
  }

  public int getPartitionCount() {
    return partitioner == null ? 1 : partitioner.getPartitions();
  }

  public RecordWriter<T> getBaseWriter() {
    return baseWriter;
  }

  @Override
  public void close() throws IOException {
    if (closeBaseWriter) {
      baseWriter.close();
    }
  }
}
