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

package org.apache.jet.runtime.library.common.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.CheckedOutputStream;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.util.PureJavaCrc32;

import com.google.common.primitives.Ints;

/**
 * Body stream of a record file with the checksum flag set. The CRC32 of the body is appended
 * as a big-endian trailer when the writer finishes the file.
 */
@Private
public class ChecksumOutputStream extends CheckedOutputStream {

  private boolean finished;

  public ChecksumOutputStream(OutputStream out) {
    super(out, new PureJavaCrc32());
  }

  public static int getChecksumSize() {
    return Ints.BYTES;
  }

  /**
   * Writes the trailer without closing the underlying stream.
   */
  public void finish() throws IOException {
    if (finished) {
      return;
    }
    finished = true;
    out.write(Ints.toByteArray((int) getChecksum().getValue()));
    out.flush();
  }

  @Override
  public void write(int b) throws IOException {
    checkNotFinished();
    super.write(b);
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    checkNotFinished();
    super.write(b, off, len);
  }

  @Override
  public void close() throws IOException {
    try {
      finish();
    } finally {
      out.close();
    }
  }

  private void checkNotFinished() throws IOException {
    if (finished) {
      throw new IOException("The checksum has already been written.");
    }
  }
}
