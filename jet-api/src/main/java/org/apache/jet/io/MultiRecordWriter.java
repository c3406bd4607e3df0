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
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;

import com.google.common.base.Preconditions;

/**
 * Routes each record to one of several writers using a {@link Partitioner}.
 */
@Public
public class MultiRecordWriter<T> extends RecordWriter<T> implements HasPartitioner<T> {

  private final List<RecordWriter<T>> writers;
  private final Partitioner<T> partitioner;
  private boolean finished;

  public MultiRecordWriter(List<? extends RecordWriter<T>> writers, Partitioner<T> partitioner) {
    Preconditions.checkNotNull(writers, "writers");
    Preconditions.checkNotNull(partitioner, "partitioner");
    Preconditions.checkArgument(!writers.isEmpty(), "At least one writer is required");
    this.writers = new ArrayList<RecordWriter<T>>(writers);
    this.partitioner = partitioner;
    partitioner.setPartitions(writers.size());
  }

  public List<RecordWriter<T>> getWriters() {
    return Collections.unmodifiableList(writers);
  }

  @Override
  public Partitioner<T> getPartitioner() {
    return partitioner;
  }

  @Override
  protected void writeRecordInternal(T record) throws IOException {
    int partition = partitioner.getPartition(record);
    writers.get(partition).writeRecord(record);
  }

  @Override
  public long getOutputBytes() {
    long result = 0;
    for (RecordWriter<T> writer : writers) {
      result += writer.getOutputBytes();
    }
    return result;
  }

  @Override
  public long getBytesWritten() {
    long result = 0;
    for (RecordWriter<T> writer : writers) {
      result += writer.getBytesWritten();
    }
    return result;
  }

  @Override
  public void finishWriting() throws IOException {
    if (!finished) {
      finished = true;
      for (RecordWriter<T> writer : writers) {
        writer.finishWriting();
      }
    }
  }

  @Override
  public void close() throws IOException {
    IOException error = null;
    try {
      finishWriting();
    } finally {
      for (RecordWriter<T> writer : writers) {
        try {
          writer.close();
        } catch (IOException e) {
          if (error == null) {
            error = e;
          }
        }
      }
    }
    if (error != null) {
      throw error;
    }
  }
}
