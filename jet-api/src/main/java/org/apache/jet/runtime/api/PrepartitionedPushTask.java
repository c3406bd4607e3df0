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

package org.apache.jet.runtime.api;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.io.PrepartitionedRecordWriter;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;

/**
 * A push task that decides the output partition of every record itself. The partition a record
 * arrived on is passed along with it.
 */
@Public
public abstract class PrepartitionedPushTask<I, O> implements Task<I, O> {

  public abstract void processRecord(I record, int partition,
      PrepartitionedRecordWriter<O> output) throws Exception;

  public void finish(PrepartitionedRecordWriter<O> output) throws Exception {
  }

  @Override
  public void run(RecordReader<I> input, RecordWriter<O> output) throws Exception {
    PrepartitionedRecordWriter<O> prepartitionedOutput =
        new PrepartitionedRecordWriter<O>(output, false);
    if (input != null) {
      while (input.readRecord()) {
        processRecord(input.getCurrentRecord(), 0, prepartitionedOutput);
      }
    }
    finish(prepartitionedOutput);
  }
}
