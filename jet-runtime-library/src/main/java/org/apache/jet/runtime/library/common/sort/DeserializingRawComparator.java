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

import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.DataInputBuffer;
import org.apache.hadoop.io.RawComparator;
import org.apache.hadoop.io.serializer.Deserializer;
import org.apache.hadoop.io.serializer.SerializationFactory;

import com.google.common.base.Preconditions;

/**
 * Raw comparator that compares serialized records by deserializing them and calling
 * {@link #compare(Object, Object)}.
 * <p/>
 * The merge engine does not call the raw comparison of a comparator that
 * {@linkplain #usesDeserialization() uses deserialization}; it deserializes the records itself
 * and compares the objects instead. Subclasses that override the raw comparison with one that
 * works on the bytes directly should return <code>false</code> from
 * {@link #usesDeserialization()}.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public abstract class DeserializingRawComparator<T> implements RawComparator<T> {

  private final Deserializer<T> deserializer1;
  private final Deserializer<T> deserializer2;
  private final DataInputBuffer buffer1 = new DataInputBuffer();
  private final DataInputBuffer buffer2 = new DataInputBuffer();
  private T record1;
  private T record2;

  protected DeserializingRawComparator(Class<T> recordClass) {
    this(recordClass, new Configuration());
  }

  protected DeserializingRawComparator(Class<T> recordClass, Configuration conf) {
    Preconditions.checkNotNull(recordClass, "recordClass");
    SerializationFactory factory = new SerializationFactory(conf);
    deserializer1 = factory.getDeserializer(recordClass);
    deserializer2 = factory.getDeserializer(recordClass);
    Preconditions.checkArgument(deserializer1 != null, "No serialization found for %s",
        recordClass.getName());
    try {
      deserializer1.open(buffer1);
      deserializer2.open(buffer2);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Indicates whether the raw comparison deserializes the records.
   */
  public boolean usesDeserialization() {
    return true;
  }

  @Override
  public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
    try {
      buffer1.reset(b1, s1, l1);
      record1 = deserializer1.deserialize(record1);
      buffer2.reset(b2, s2, l2);
      record2 = deserializer2.deserialize(record2);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return compare(record1, record2);
  }
}
