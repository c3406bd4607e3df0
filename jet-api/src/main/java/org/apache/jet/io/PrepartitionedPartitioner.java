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

import org.apache.hadoop.classification.InterfaceAudience.Public;

import com.google.common.base.Preconditions;

/**
 * A partitioner that ignores the record and returns a partition set by the caller. Used by
 * writers whose producer already knows the destination partition of each record.
 */
@Public
public class PrepartitionedPartitioner<T> implements Partitioner<T> {

  private int partitions = 1;
  private int currentPartition;

  @Override
  public int getPartitions() {
    return partitions;
  }

  @Override
  public void setPartitions(int partitions) {
    Preconditions.checkArgument(partitions > 0, "partitions must be positive");
    this.partitions = partitions;
  }

  public int getCurrentPartition() {
    return currentPartition;
  }

  public void setCurrentPartition(int currentPartition) {
    Preconditions.checkArgument(currentPartition >= 0 && currentPartition < partitions,
        "Partition %s out of range [0, %s)", currentPartition, partitions);
    this.currentPartition = currentPartition;
  }

  @Override
  public int getPartition(T value) {
    return currentPartition;
  }
}
