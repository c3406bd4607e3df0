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

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.CheckedInputStream;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.fs.ChecksumException;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.util.PureJavaCrc32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.ByteStreams;
import com.google.common.primitives.Ints;

/**
 * Reads the body of a record file written through {@link ChecksumOutputStream}. The body length
 * includes the trailer; the trailer is checked as soon as the last body byte has been read and
 * is never returned to the caller.
 */
@Private
public class ChecksumInputStream extends CheckedInputStream {

  private static final Logger LOG = LoggerFactory.getLogger(ChecksumInputStream.class);

  private final InputStream source;
  private final long dataLength;
  private long position;
  private boolean verified;

  /**
   * @param len the length of the stream including the trailer
   */
  public ChecksumInputStream(InputStream in, long len) throws IOException {
    super(ByteStreams.limit(in, Math.max(len - ChecksumOutputStream.getChecksumSize(), 0)),
        new PureJavaCrc32());
    if (len < ChecksumOutputStream.getChecksumSize()) {
      throw new EOFException("Stream of " + len + " bytes is too short to hold a checksum.");
    }
    this.source = in;
    this.dataLength = len - ChecksumOutputStream.getChecksumSize();
  }

  public long getPosition() {
    return position;
  }

  public long getDataLength() {
    return dataLength;
  }

  /**
   * Reads any remaining body bytes and checks the trailer.
   */
  public void finish() throws IOException {
    ByteStreams.exhaust(this);
    verifyOnce();
  }

  @Override
  public int read() throws IOException {
    int b = super.read();
    if (b < 0) {
      checkComplete();
    } else {
      advance(1);
    }
    return b;
  }

  @Override
  public int read(byte[] buf, int off, int len) throws IOException {
    if (len == 0) {
      return 0;
    }
    int bytesRead = super.read(buf, off, len);
    if (bytesRead < 0) {
      checkComplete();
    } else {
      advance(bytesRead);
    }
    return bytesRead;
  }

  @Override
  public long skip(long n) throws IOException {
    long skipped = super.skip(n);
    advance(skipped);
    return skipped;
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  private void advance(long count) throws IOException {
    position += count;
    if (position == dataLength) {
      verifyOnce();
    }
  }

  private void checkComplete() throws IOException {
    if (position < dataLength) {
      throw new ChecksumException("Checksum Error: unexpected end of stream at offset "
          + position + ", expected " + dataLength + " data bytes", position);
    }
    verifyOnce();
  }

  private void verifyOnce() throws IOException {
    if (verified) {
      return;
    }
    verified = true;
    byte[] trailer = new byte[ChecksumOutputStream.getChecksumSize()];
    IOUtils.readFully(source, trailer, 0, trailer.length);
    int expected = Ints.fromByteArray(trailer);
    int actual = (int) getChecksum().getValue();
    if (expected != actual) {
      LOG.info("Checksum mismatch after {} bytes: expected {}, computed {}", dataLength,
          Integer.toHexString(expected), Integer.toHexString(actual));
      throw new ChecksumException("Checksum Error: dataLength=" + dataLength
          + ", expected=" + Integer.toHexString(expected) + ", computed="
          + Integer.toHexString(actual), 0);
    }
  }
}
