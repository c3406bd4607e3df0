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

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.DataInputBuffer;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.serializer.Deserializer;
import org.apache.hadoop.io.serializer.SerializationFactory;
import org.apache.jet.io.RawRecord;
import org.apache.jet.io.RecordWriter;

import com.google.common.base.Preconditions;

/**
 * A record produced by a merge. It holds either a deserialized value or the serialized bytes
 * of the record, depending on whether the merge uses raw records.
 * <p/>
 * Instances are reused by the merge; a record is only valid until the next record is
 * requested.
 *
 * @param <T> the type of the records
 */
@Public
@Evolving
public final class MergeResultRecord<T> {

  private final Configuration conf;
  private final Class<T> recordClass;
  private final boolean allowRecordReuse;
  private T record;
  private RawRecord rawRecord;
  private boolean decoded;
  private T reusableRecord;
  private Deserializer<T> deserializer;
  private DataInputBuffer inputBuffer;

  MergeResultRecord(Configuration conf, Class<T> recordClass, boolean allowRecordReuse) {
    this.conf = conf;
    this.recordClass = recordClass;
    this.allowRecordReuse = allowRecordReuse && recordClass != null
        && Writable.class.isAssignableFrom(recordClass);
  }

  /**
   * Returns the value of the record, deserializing it if it is held in raw form.
   */
  public T getValue() throws IOException {
    if (rawRecord != null && !decoded) {
      if (deserializer == null) {
        Preconditions.checkState(recordClass != null,
            "The record class is needed to deserialize raw records.");
        deserializer = new SerializationFactory(conf).getDeserializer(recordClass);
        inputBuffer = new DataInputBuffer();
        deserializer.open(inputBuffer);
      }
      inputBuffer.reset(rawRecord.getBuffer(), rawRecord.getOffset(), rawRecord.getLength());
      record = deserializer.deserialize(allowRecordReuse ? reusableRecord : null);
      if (allowRecordReuse) {
        reusableRecord = record;
      }
      decoded = true;
    }
    return record;
  }

  public boolean isRaw() {
    return rawRecord != null;
  }

  /**
   * Writes the serialized bytes of the record.
   *
   * @throws IllegalStateException if this instance does not hold a raw record
   */
  public void writeRawRecord(RecordWriter<RawRecord> writer) throws IOException {
    Preconditions.checkNotNull(writer, "writer");
    Preconditions.checkState(rawRecord != null, "No raw record stored in this instance.");
    writer.writeRecord(rawRecord);
  }

  public void writeRecord(RecordWriter<T> writer) throws IOException {
    Preconditions.checkNotNull(writer, "writer");
    writer.writeRecord(getValue());
  }

  void reset(T value) {
    Preconditions.checkNotNull(value, "value");
    record = value;
    rawRecord = null;
    decoded = true;
  }

  void reset(RawRecord value) {
    Preconditions.checkNotNull(value, "value");
    record = null;
    rawRecord = value;
    decoded = false;
  }
}
