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

import java.util.Arrays;

import org.apache.hadoop.classification.InterfaceAudience.Public;

import com.google.common.base.Preconditions;

/**
 * A record kept in its serialized form. The buffer is owned by the reader that produced the
 * record and is only valid until the reader advances.
 */
@Public
public final class RawRecord {

  private byte[] buffer;
  private int offset;
  private int length;

  public RawRecord() {
  }

  public RawRecord(byte[] buffer, int offset, int length) {
    reset(buffer, offset, length);
  }

  public void reset(byte[] buffer, int offset, int length) {
    Preconditions.checkNotNull(buffer, "buffer");
    Preconditions.checkPositionIndexes(offset, offset + length, buffer.length);
    this.buffer = buffer;
    this.offset = offset;
    this.length = length;
  }

  public byte[] getBuffer() {
    return buffer;
  }

  public int getOffset() {
    return offset;
  }

  public int getLength() {
    return length;
  }

  public byte[] toByteArray() {
    return Arrays.copyOfRange(buffer, offset, offset + length);
  }

  @Override
  public String toString() {
    return "RawRecord[length=" + length + "]";
  }
}
