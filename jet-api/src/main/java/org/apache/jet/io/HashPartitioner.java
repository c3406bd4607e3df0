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

import java.util.Objects;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.conf.Configurable;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.common.EqualityComparer;
import org.apache.jet.common.ReflectionUtils;

import com.google.common.base.Preconditions;

/**
 * Partitions records by hash code.
 * <p/>
 * The hash code is taken from an {@link EqualityComparer} named by
 * {@link JetConfiguration#JET_PARTITIONER_HASH_EQUALITY_COMPARER_CLASS} if one is configured, and
 * from {@link Object#hashCode()} otherwise.
 */
@Public
public class HashPartitioner<T> implements Partitioner<T>, Configurable {

  private Configuration conf;
  private EqualityComparer<T> comparer;
  private int partitions = 1;

  public HashPartitioner() {
  }

  public HashPartitioner(EqualityComparer<T> comparer) {
    this.comparer = comparer;
  }

  @Override
  public void setConf(Configuration conf) {
    this.conf = conf;
    String comparerClass = conf == null ? null
        : conf.getTrimmed(JetConfiguration.JET_PARTITIONER_HASH_EQUALITY_COMPARER_CLASS);
    if (comparerClass != null && !comparerClass.isEmpty()) {
      try {
        this.comparer = ReflectionUtils.createClazzInstance(comparerClass, conf);
      } catch (JetReflectionException e) {
        throw new JetUncheckedException("Unable to create equality comparer " + comparerClass, e);
      }
    }
  }

  @Override
  public Configuration getConf() {
    return conf;
  }

  public EqualityComparer<T> getComparer() {
    return comparer;
  }

  @Override
  public int getPartitions() {
    return partitions;
  }

  @Override
  public void setPartitions(int partitions) {
    Preconditions.checkArgument(partitions > 0, "partitions must be positive");
    this.partitions = partitions;
  }

  @Override
  public int getPartition(T value) {
    int hashCode = comparer == null ? Objects.hashCode(value) : comparer.hashCode(value);
    return (hashCode & Integer.MAX_VALUE) % partitions;
  }
}
