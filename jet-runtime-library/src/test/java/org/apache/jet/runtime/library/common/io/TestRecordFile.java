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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.zip.CRC32;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.ChecksumException;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IntWritable;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.DefaultCodec;
import org.apache.hadoop.util.ReflectionUtils;
import org.apache.jet.io.RawRecord;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

public class TestRecordFile {

  private static final Logger LOG = LoggerFactory.getLogger(TestRecordFile.class);

  private static Configuration defaultConf = new Configuration();
  private static FileSystem localFs;
  private static Path workDir;

  static {
    defaultConf.set("fs.defaultFS", "file:///");
    try {
      localFs = FileSystem.getLocal(defaultConf).getRaw();
      workDir = new Path(
          new Path(System.getProperty("test.build.data", "/tmp")), TestRecordFile.class.getName())
          .makeQualified(localFs.getUri(), localFs.getWorkingDirectory());
      LOG.info("Using workDir: " + workDir);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private Path outputPath;

  @Before
  public void setUp() throws Exception {
    outputPath = new Path(workDir, "records.out");
  }

  @Before
  @After
  public void cleanup() throws Exception {
    localFs.delete(workDir, true);
  }

  @Test(timeout = 5000)
  public void testWriteAndRead() throws IOException {
    writeInts(outputPath, null, true, 100);

    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(defaultConf,
        localFs, outputPath, IntWritable.class, null, 4096, false);
    assertEquals(0.0f, reader.getProgress(), 0.0f);
    IntWritable previous = null;
    for (int x = 0; x < 100; ++x) {
      assertTrue(reader.readRecord());
      assertEquals(x, reader.getCurrentRecord().get());
      assertNotSame(previous, reader.getCurrentRecord());
      previous = reader.getCurrentRecord();
    }
    assertFalse(reader.readRecord());
    assertEquals(100, reader.getRecordsRead());
    assertEquals(1.0f, reader.getProgress(), 0.0f);
    // 100 records of one length byte and four value bytes, plus the end marker.
    assertEquals(501, reader.getInputBytes());
    assertEquals(localFs.getFileStatus(outputPath).getLen(), reader.getBytesRead());
    reader.close();
  }

  @Test(timeout = 5000)
  public void testWriterCounters() throws IOException {
    RecordFile.Writer<IntWritable> writer = writeInts(outputPath, null, true, 10);
    assertEquals(10, writer.getRecordsWritten());
    assertEquals(50, writer.getOutputBytes());
    // Header, records, end marker and checksum.
    assertEquals(RecordFile.HEADER_LENGTH + 50 + 1 + ChecksumOutputStream.getChecksumSize(),
        writer.getBytesWritten());
    assertEquals(writer.getBytesWritten(), localFs.getFileStatus(outputPath).getLen());
  }

  @Test(timeout = 5000)
  public void testRecordReuse() throws IOException {
    writeInts(outputPath, null, false, 5);
    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(defaultConf,
        localFs, outputPath, IntWritable.class, null, 4096, true);
    assertTrue(reader.readRecord());
    IntWritable first = reader.getCurrentRecord();
    assertTrue(reader.readRecord());
    assertSame(first, reader.getCurrentRecord());
    assertEquals(1, first.get());
    reader.close();
  }

  @Test(timeout = 5000)
  public void testCompressed() throws IOException {
    CompressionCodec codec = ReflectionUtils.newInstance(DefaultCodec.class, defaultConf);
    RecordFile.Writer<Text> writer = new RecordFile.Writer<Text>(defaultConf, localFs,
        outputPath, Text.class, codec, 4096, true);
    for (int x = 0; x < 1000; ++x) {
      writer.writeRecord(new Text("record number " + x));
    }
    writer.close();
    assertTrue(writer.getBytesWritten() < writer.getOutputBytes());

    RecordFile.Reader<Text> reader = new RecordFile.Reader<Text>(defaultConf, localFs,
        outputPath, Text.class, codec, 4096, false);
    int count = 0;
    while (reader.readRecord()) {
      assertEquals("record number " + count, reader.getCurrentRecord().toString());
      ++count;
    }
    reader.close();
    assertEquals(1000, count);
  }

  @Test(timeout = 5000)
  public void testCompressedWithoutCodec() throws IOException {
    CompressionCodec codec = ReflectionUtils.newInstance(DefaultCodec.class, defaultConf);
    new RecordFile.Writer<IntWritable>(defaultConf, localFs, outputPath, IntWritable.class,
        codec, 4096, false).close();
    try {
      new RecordFile.Reader<IntWritable>(defaultConf, localFs, outputPath, IntWritable.class,
          null, 4096, false);
      fail("Expected an IOException for a compressed file without codec");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("codec"));
    }
  }

  @Test(timeout = 5000)
  public void testRawRecords() throws IOException {
    writeInts(outputPath, null, true, 3);

    RecordFile.RawReader rawReader = new RecordFile.RawReader(defaultConf, localFs, outputPath,
        null, 4096, false);
    RecordFile.RawWriter rawWriter = new RecordFile.RawWriter(defaultConf, localFs,
        new Path(workDir, "copy.out"), null, 4096, true);
    while (rawReader.readRecord()) {
      RawRecord record = rawReader.getCurrentRecord();
      assertEquals(4, record.getLength());
      rawWriter.writeRecord(record);
    }
    rawReader.close();
    rawWriter.close();

    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(defaultConf,
        localFs, new Path(workDir, "copy.out"), IntWritable.class, null, 4096, false);
    for (int x = 0; x < 3; ++x) {
      assertTrue(reader.readRecord());
      assertEquals(x, reader.getCurrentRecord().get());
    }
    assertFalse(reader.readRecord());
    reader.close();
  }

  @Test(timeout = 5000)
  public void testEmptyFile() throws IOException {
    writeInts(outputPath, null, true, 0);
    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(defaultConf,
        localFs, outputPath, IntWritable.class, null, 4096, false);
    assertFalse(reader.readRecord());
    assertFalse(reader.readRecord());
    assertEquals(1.0f, reader.getProgress(), 0.0f);
    reader.close();
  }

  @Test(timeout = 5000)
  public void testInMemory() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    RecordFile.Writer<Text> writer = new RecordFile.Writer<Text>(defaultConf, out, Text.class,
        null, true, true);
    writer.writeRecord(new Text("a"));
    writer.writeRecord(new Text("b"));
    writer.close();

    BufferRecordInput input = new BufferRecordInput(defaultConf, Text.class, out.toByteArray(),
        false);
    assertTrue(input.isMemoryBased());
    @SuppressWarnings("unchecked")
    RecordFile.Reader<Text> reader = (RecordFile.Reader<Text>) input.getReader();
    assertTrue(reader.readRecord());
    assertEquals("a", reader.getCurrentRecord().toString());
    assertTrue(reader.readRecord());
    assertEquals("b", reader.getCurrentRecord().toString());
    assertFalse(reader.readRecord());
    input.close();
    assertEquals(1.0f, input.getProgress(), 0.0f);
  }

  @Test(timeout = 5000, expected = ChecksumException.class)
  public void testCorruptFile() throws IOException {
    writeInts(outputPath, null, true, 10);
    File file = new File(outputPath.toUri().getPath());
    byte[] data = Files.readAllBytes(file.toPath());
    // The third value byte of the first record.
    data[RecordFile.HEADER_LENGTH + 3] ^= 0x55;
    Files.write(file.toPath(), data);

    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(defaultConf,
        localFs, outputPath, IntWritable.class, null, 4096, false);
    try {
      while (reader.readRecord()) {
        LOG.debug("Read {}", reader.getCurrentRecord());
      }
    } finally {
      reader.close();
    }
  }

  @Test(timeout = 5000)
  public void testCorruptFileWithoutChecksum() throws IOException {
    writeInts(outputPath, null, false, 10);
    File file = new File(outputPath.toUri().getPath());
    byte[] data = Files.readAllBytes(file.toPath());
    data[RecordFile.HEADER_LENGTH + 4] ^= 0x01;
    Files.write(file.toPath(), data);

    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(defaultConf,
        localFs, outputPath, IntWritable.class, null, 4096, false);
    int count = 0;
    while (reader.readRecord()) {
      ++count;
    }
    reader.close();
    assertEquals(10, count);
  }

  @Test(timeout = 5000)
  public void testInvalidHeader() throws IOException {
    File file = new File(outputPath.toUri().getPath());
    file.getParentFile().mkdirs();
    Files.write(file.toPath(), new byte[] { 'T', 'I', 'F', 1, 0, 0 });
    try {
      new RecordFile.Reader<IntWritable>(defaultConf, localFs, outputPath, IntWritable.class,
          null, 4096, false);
      fail("Should not have allowed wrong header");
    } catch (IOException e) {
      assertEquals("Not a valid record file.", e.getMessage());
    }
  }

  @Test(timeout = 5000)
  public void testChecksumStreams() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ChecksumOutputStream checksumOut = new ChecksumOutputStream(out);
    byte[] data = new byte[10000];
    for (int x = 0; x < data.length; ++x) {
      data[x] = (byte) x;
    }
    checksumOut.write(data, 0, 100);
    checksumOut.write(data, 100, data.length - 100);
    checksumOut.close();
    byte[] written = out.toByteArray();
    assertEquals(data.length + ChecksumOutputStream.getChecksumSize(), written.length);

    ChecksumInputStream checksumIn = new ChecksumInputStream(
        new ByteArrayInputStream(written), written.length);
    byte[] read = new byte[data.length];
    int offset = 0;
    int count;
    while ((count = checksumIn.read(read, offset, Math.min(777, read.length - offset))) > 0) {
      offset += count;
    }
    assertEquals(data.length, offset);
    assertEquals(-1, checksumIn.read());
    assertArrayEquals(data, read);
    checksumIn.close();
  }

  @Test(timeout = 5000)
  public void testChecksumTrailer() throws IOException {
    byte[] data = "record file body".getBytes(StandardCharsets.UTF_8);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ChecksumOutputStream checksumOut = new ChecksumOutputStream(out);
    checksumOut.write(data);
    checksumOut.finish();
    try {
      checksumOut.write(1);
      fail("Should not allow writes after the trailer");
    } catch (IOException e) {
      assertEquals("The checksum has already been written.", e.getMessage());
    }
    checksumOut.close();
    byte[] written = out.toByteArray();

    CRC32 crc = new CRC32();
    crc.update(data);
    assertEquals((int) crc.getValue(), Ints.fromByteArray(
        Arrays.copyOfRange(written, data.length, written.length)));

    written[written.length - 1] ^= 0x01;
    ChecksumInputStream checksumIn = new ChecksumInputStream(
        new ByteArrayInputStream(written), written.length);
    try {
      checksumIn.finish();
      fail("Should have detected the corrupt trailer");
    } catch (ChecksumException e) {
      assertEquals(data.length, checksumIn.getPosition());
    } finally {
      checksumIn.close();
    }
  }

  private RecordFile.Writer<IntWritable> writeInts(Path path, CompressionCodec codec,
      boolean checksum, int count) throws IOException {
    RecordFile.Writer<IntWritable> writer = new RecordFile.Writer<IntWritable>(defaultConf,
        localFs, path, IntWritable.class, codec, 4096, checksum);
    IntWritable value = new IntWritable();
    for (int x = 0; x < count; ++x) {
      value.set(x);
      writer.writeRecord(value);
    }
    writer.close();
    return writer;
  }
}
