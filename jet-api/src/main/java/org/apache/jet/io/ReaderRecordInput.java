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

import org.apache.hadoop.classification.InterfaceAudience.Public;

/**
 * A record input for an existing record reader.
 */
@Public
public class ReaderRecordInput extends RecordInput {

  private final boolean memoryBased;

  public ReaderRecordInput(RecordReader<?> reader, boolean memoryBased) {
    super(reader);
    this.memoryBased = memoryBased;
  }

  @Override
  public boolean isMemoryBased() {
    return memoryBased;
  }

  @Override
  public boolean isRawReaderSupported() {
    return false;
  }

  @Override
  protected RecordReader<?> createReader() throws IOException {
    throw new IllegalStateException("The reader was supplied at construction.");
  }
}
