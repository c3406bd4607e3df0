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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.classification.InterfaceStability.Unstable;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.DataInputBuffer;
import org.apache.hadoop.io.DataOutputBuffer;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.io.WritableUtils;
import org.apache.hadoop.io.compress.CodecPool;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.CompressionInputStream;
import org.apache.hadoop.io.compress.CompressionOutputStream;
import org.apache.hadoop.io.compress.Compressor;
import org.apache.hadoop.io.compress.Decompressor;
import org.apache.hadoop.io.serializer.Deserializer;
import org.apache.hadoop.io.serializer.SerializationFactory;
import org.apache.hadoop.io.serializer.Serializer;
import org.apache.jet.io.RawRecord;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.google.common.io.CountingInputStream;
import com.google.common.io.CountingOutputStream;

/**
 * <code>RecordFile</code> is the file format used for channel files and intermediate merge
 * passes.
 * <p/>
 * A file starts with the bytes <code>JRF</code>, a version byte and a flags byte. The body
 * that follows is optionally compressed and optionally followed by a CRC32 checksum of the
 * (compressed) body. Each record is stored as its vint encoded length followed by its
 * serialized bytes; the end of the records is marked by a length of -1.
 */
@Private
@Unstable
public class RecordFile {

  private static final Logger LOG = LoggerFactory.getLogger(RecordFile.class);

  public static final int EOF_MARKER = -1;
  public static final byte VERSION = 1;
  public static final int HEADER_LENGTH = 5;
  private static final byte[] MAGIC = new byte[] { (byte) 'J', (byte) 'R', (byte) 'F' };

  static final int FLAG_CHECKSUM = 1;
  static final int FLAG_COMPRESSED = 2;

  private RecordFile() {
  }

  /**
   * Writes serialized records to a record file.
   *
   * @param <T> the type of the records
   */
  public static class Writer<T> extends RecordWriter<T> {

    private final CountingOutputStream rawOut;
    private final boolean ownOutputStream;
    private final ChecksumOutputStream checksumOut;
    private final CompressionOutputStream compressedOut;
    private final DataOutputStream out;
    private final Serializer<T> serializer;
    private final DataOutputBuffer buffer;
    private Compressor compressor;
    private long outputBytes;
    private boolean finished;

    public Writer(Configuration conf, FileSystem fs, Path file, Class<T> recordClass,
        CompressionCodec codec, int bufferSize, boolean checksum) throws IOException {
      this(conf, new BufferedOutputStream(fs.create(file, true), bufferSize), recordClass, codec,
          checksum, true);
    }

    public Writer(Configuration conf, OutputStream outputStream, Class<T> recordClass,
        CompressionCodec codec, boolean checksum, boolean ownOutputStream) throws IOException {
      Preconditions.checkNotNull(outputStream, "outputStream");
      this.rawOut = new CountingOutputStream(outputStream);
      this.ownOutputStream = ownOutputStream;
      int flags = (checksum ? FLAG_CHECKSUM : 0) | (codec != null ? FLAG_COMPRESSED : 0);
      rawOut.write(MAGIC);
      rawOut.write(VERSION);
      rawOut.write(flags);

      OutputStream body = rawOut;
      if (checksum) {
        checksumOut = new ChecksumOutputStream(rawOut);
        body = checksumOut;
      } else {
        checksumOut = null;
      }
      if (codec != null) {
        compressor = CodecPool.getCompressor(codec);
        if (compressor != null) {
          compressor.reset();
          compressedOut = codec.createOutputStream(body, compressor);
        } else {
          LOG.warn("Could not obtain compressor from CodecPool");
          compressedOut = codec.createOutputStream(body);
        }
        body = compressedOut;
      } else {
        compressedOut = null;
      }
      this.out = new DataOutputStream(body);

      if (recordClass != null) {
        SerializationFactory serializationFactory = new SerializationFactory(
            conf == null ? new Configuration() : conf);
        serializer = serializationFactory.getSerializer(recordClass);
        if (serializer == null) {
          throw new IllegalArgumentException("No serialization found for record class "
              + recordClass.getName());
        }
        buffer = new DataOutputBuffer();
        serializer.open(buffer);
      } else {
        serializer = null;
        buffer = null;
      }
    }

    @Override
    protected void writeRecordInternal(T record) throws IOException {
      buffer.reset();
      serializer.serialize(record);
      writeBytes(buffer.getData(), 0, buffer.getLength());
    }

    protected final void writeBytes(byte[] data, int offset, int length) throws IOException {
      Preconditions.checkState(!finished, "The writer has already been closed.");
      WritableUtils.writeVInt(out, length);
      out.write(data, offset, length);
      outputBytes += WritableUtils.getVIntSize(length) + length;
    }

    /**
     * Returns the number of uncompressed record bytes written, including length prefixes.
     */
    @Override
    public long getOutputBytes() {
      return outputBytes;
    }

    /**
     * Returns the number of bytes written to the underlying stream. This is only accurate
     * after the writer has been finished.
     */
    @Override
    public long getBytesWritten() {
      return rawOut.getCount();
    }

    @Override
    public void finishWriting() throws IOException {
      if (finished) {
        return;
      }
      finished = true;
      try {
        WritableUtils.writeVInt(out, EOF_MARKER);
        out.flush();
        if (compressedOut != null) {
          compressedOut.finish();
          compressedOut.resetState();
        }
        if (checksumOut != null) {
          checksumOut.finish();
        }
        rawOut.flush();
        if (serializer != null) {
          serializer.close();
        }
      } finally {
        if (compressor != null) {
          CodecPool.returnCompressor(compressor);
          compressor = null;
        }
        if (ownOutputStream) {
          rawOut.close();
        }
      }
    }
  }

  /**
   * Writes records that are already serialized.
   */
  public static class RawWriter extends Writer<RawRecord> {

    public RawWriter(Configuration conf, FileSystem fs, Path file, CompressionCodec codec,
        int bufferSize, boolean checksum) throws IOException {
      this(new BufferedOutputStream(fs.create(file, true), bufferSize), codec, checksum, true);
    }

    public RawWriter(OutputStream outputStream, CompressionCodec codec, boolean checksum,
        boolean ownOutputStream) throws IOException {
      super(null, outputStream, null, codec, checksum, ownOutputStream);
    }

    @Override
    protected void writeRecordInternal(RawRecord record) throws IOException {
      writeBytes(record.getBuffer(), record.getOffset(), record.getLength());
    }
  }

  /**
   * Reads records from a record file.
   *
   * @param <T> the type of the records
   */
  public static class Reader<T> extends RecordReader<T> {

    private final CountingInputStream rawIn;
    private final long length;
    private final ChecksumInputStream checksumIn;
    private final DataInputStream in;
    private final Deserializer<T> deserializer;
    private final DataInputBuffer inputBuffer;
    private final boolean allowRecordReuse;
    private Decompressor decompressor;
    private byte[] recordBuffer = new byte[256];
    private long inputBytes;
    private boolean eof;
    private boolean closed;

    public Reader(Configuration conf, FileSystem fs, Path file, Class<T> recordClass,
        CompressionCodec codec, int bufferSize, boolean allowRecordReuse) throws IOException {
      this(conf, new BufferedInputStream(fs.open(file), bufferSize),
          fs.getFileStatus(file).getLen(), recordClass, codec, allowRecordReuse);
    }

    /**
     * @param length the total length of the file, including the header
     */
    public Reader(Configuration conf, InputStream inputStream, long length, Class<T> recordClass,
        CompressionCodec codec, boolean allowRecordReuse) throws IOException {
      Preconditions.checkNotNull(inputStream, "inputStream");
      this.rawIn = new CountingInputStream(inputStream);
      this.length = length;
      this.allowRecordReuse = allowRecordReuse;
      try {
        int flags = readHeader(rawIn);
        InputStream body = ByteStreams.limit(rawIn, length - HEADER_LENGTH);
        if ((flags & FLAG_CHECKSUM) != 0) {
          checksumIn = new ChecksumInputStream(body, length - HEADER_LENGTH);
          body = checksumIn;
        } else {
          checksumIn = null;
        }
        if ((flags & FLAG_COMPRESSED) != 0) {
          if (codec == null) {
            throw new IOException("The record file is compressed but no codec was specified.");
          }
          decompressor = CodecPool.getDecompressor(codec);
          CompressionInputStream compressedIn;
          if (decompressor != null) {
            decompressor.reset();
            compressedIn = codec.createInputStream(body, decompressor);
          } else {
            LOG.warn("Could not obtain decompressor from CodecPool");
            compressedIn = codec.createInputStream(body);
          }
          body = compressedIn;
        }
        this.in = new DataInputStream(body);

        if (recordClass != null) {
          SerializationFactory serializationFactory = new SerializationFactory(
              conf == null ? new Configuration() : conf);
          deserializer = serializationFactory.getDeserializer(recordClass);
          if (deserializer == null) {
            throw new IllegalArgumentException("No serialization found for record class "
                + recordClass.getName());
          }
          inputBuffer = new DataInputBuffer();
          deserializer.open(inputBuffer);
        } else {
          deserializer = null;
          inputBuffer = null;
        }
      } catch (IOException | RuntimeException e) {
        releaseDecompressor();
        IOUtils.cleanupWithLogger(LOG, inputStream);
        throw e;
      }
    }

    @Override
    protected boolean readRecordInternal() throws IOException {
      int recordLength = readNextLength();
      if (recordLength < 0) {
        setCurrentRecord(null);
        return false;
      }
      inputBuffer.reset(recordBuffer, 0, recordLength);
      setCurrentRecord(deserializer.deserialize(allowRecordReuse ? getCurrentRecord() : null));
      return true;
    }

    protected final boolean isAllowRecordReuse() {
      return allowRecordReuse;
    }

    protected final byte[] getRecordBuffer() {
      return recordBuffer;
    }

    /**
     * Reads the next record into the record buffer.
     *
     * @return the length of the record, or -1 if the end of the file was reached
     */
    protected final int readNextLength() throws IOException {
      if (eof) {
        return -1;
      }
      int recordLength;
      try {
        recordLength = WritableUtils.readVInt(in);
      } catch (EOFException e) {
        throw new EOFException("Unexpected end of record file after " + inputBytes + " bytes.");
      }
      if (recordLength == EOF_MARKER) {
        eof = true;
        inputBytes += WritableUtils.getVIntSize(EOF_MARKER);
        if (checksumIn != null) {
          checksumIn.finish();
        }
        return -1;
      }
      if (recordLength < 0) {
        throw new IOException("Invalid record length " + recordLength);
      }
      if (recordBuffer.length < recordLength) {
        recordBuffer = new byte[Math.max(recordLength, recordBuffer.length * 2)];
      }
      IOUtils.readFully(in, recordBuffer, 0, recordLength);
      inputBytes += WritableUtils.getVIntSize(recordLength) + recordLength;
      return recordLength;
    }

    @Override
    public float getProgress() {
      if (eof || closed || length <= 0) {
        return 1.0f;
      }
      return Math.min(1.0f, (float) rawIn.getCount() / length);
    }

    /**
     * Returns the number of uncompressed record bytes read.
     */
    @Override
    public long getInputBytes() {
      return inputBytes;
    }

    /**
     * Returns the number of bytes read from the underlying stream.
     */
    @Override
    public long getBytesRead() {
      return rawIn.getCount();
    }

    public long getLength() {
      return length;
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      try {
        if (deserializer != null) {
          deserializer.close();
        }
        in.close();
      } finally {
        releaseDecompressor();
      }
    }

    private void releaseDecompressor() {
      if (decompressor != null) {
        decompressor.reset();
        CodecPool.returnDecompressor(decompressor);
        decompressor = null;
      }
    }
  }

  /**
   * Reads records from a record file without deserializing them. Unless record reuse is
   * allowed, every record gets its own buffer.
   */
  public static class RawReader extends Reader<RawRecord> {

    private final RawRecord reusedRecord = new RawRecord();

    public RawReader(Configuration conf, FileSystem fs, Path file, CompressionCodec codec,
        int bufferSize, boolean allowRecordReuse) throws IOException {
      super(conf, fs, file, null, codec, bufferSize, allowRecordReuse);
    }

    public RawReader(InputStream inputStream, long length, CompressionCodec codec,
        boolean allowRecordReuse) throws IOException {
      super(null, inputStream, length, null, codec, allowRecordReuse);
    }

    @Override
    protected boolean readRecordInternal() throws IOException {
      int recordLength = readNextLength();
      if (recordLength < 0) {
        setCurrentRecord(null);
        return false;
      }
      if (isAllowRecordReuse()) {
        reusedRecord.reset(getRecordBuffer(), 0, recordLength);
        setCurrentRecord(reusedRecord);
      } else {
        byte[] copy = new byte[recordLength];
        System.arraycopy(getRecordBuffer(), 0, copy, 0, recordLength);
        setCurrentRecord(new RawRecord(copy, 0, recordLength));
      }
      return true;
    }
  }

  /**
   * Reads and validates the file header.
   *
   * @return the flags byte
   */
  static int readHeader(InputStream in) throws IOException {
    byte[] header = new byte[HEADER_LENGTH];
    IOUtils.readFully(in, header, 0, HEADER_LENGTH);
    for (int x = 0; x < MAGIC.length; ++x) {
      if (header[x] != MAGIC[x]) {
        throw new IOException("Not a valid record file.");
      }
    }
    if (header[3] != VERSION) {
      throw new IOException("Unsupported record file version " + header[3]);
    }
    return header[4];
  }
}
