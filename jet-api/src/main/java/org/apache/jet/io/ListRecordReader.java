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
import java.util.Collection;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;

import com.google.common.base.Preconditions;

/**
 * Reads records from an in-memory list.
 */
@Public
public class ListRecordReader<T> extends RecordReader<T> {

  private final List<T> records;
  private int position;

  public ListRecordReader(Collection<? extends T> records) {
    Preconditions.checkNotNull(records, "records");
    this.records = new ArrayList<T>(records);
  }

  @Override
  protected boolean readRecordInternal() throws IOException {
    if (position < records.size()) {
      setCurrentRecord(records.get(position++));
      return true;
    }
    setCurrentRecord(null);
    return false;
  }

  @Override
  public float getProgress() {
    return records.isEmpty() ? 1.0f : (float) position / records.size();
  }
}
