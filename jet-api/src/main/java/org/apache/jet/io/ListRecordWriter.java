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
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.WritableUtils;

/**
 * Collects records into an in-memory list. When cloning is enabled, {@link Writable} records
 * are copied before they are stored so that writers that reuse record instances can be used.
 */
@Public
public class ListRecordWriter<T> extends RecordWriter<T> {

  private final List<T> list = new ArrayList<T>();
  private final boolean cloneRecords;
  private final Configuration conf;

  public ListRecordWriter() {
    this(false);
  }

  public ListRecordWriter(boolean cloneRecords) {
    this.cloneRecords = cloneRecords;
    this.conf = cloneRecords ? new Configuration(false) : null;
  }

  public List<T> getList() {
    return Collections.unmodifiableList(list);
  }

  @Override
  @SuppressWarnings("unchecked")
  protected void writeRecordInternal(T record) throws IOException {
    if (cloneRecords && record instanceof Writable) {
      list.add((T) WritableUtils.clone((Writable) record, conf));
    } else {
      list.add(record);
    }
  }
}
