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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IntWritable;
import org.apache.hadoop.io.WritableComparable;
import org.apache.jet.io.ListRecordReader;
import org.apache.jet.io.RecordInput;
import org.apache.jet.io.ReaderRecordInput;
import org.apache.jet.runtime.library.common.io.BufferRecordInput;
import org.apache.jet.runtime.library.common.io.FileRecordInput;
import org.apache.jet.runtime.library.common.io.RecordFile;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestJetMerger {

  private static Configuration defaultConf = new Configuration();
  private static FileSystem localFs;
  private static Path workDir;

  static {
    defaultConf.set("fs.defaultFS", "file:///");
    try {
      localFs = FileSystem.getLocal(defaultConf).getRaw();
      workDir = new Path(
          new Path(System.getProperty("test.build.data", "/tmp")), TestJetMerger.class.getName())
          .makeQualified(localFs.getUri(), localFs.getWorkingDirectory());
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private final Random random = new Random(42);
  private final List<Integer> expected = new ArrayList<Integer>();
  private int inputNumber;

  @Before
  @After
  public void cleanup() throws Exception {
    localFs.delete(workDir, true);
  }

  @Test(timeout = 10000)
  public void testSinglePass() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    for (int size : new int[] { 10, 20, 15, 5 }) {
      diskInputs.add(createDiskInput(size));
    }

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, null, 100, null, false,
        workDir, null, 4096, true);
    assertTrue(merger.isUsingRawRecords());
    assertSorted(result, 50);
    assertEquals(1, merger.getMergePassCount());
    assertEquals(0, merger.getBytesWritten());
    assertTrue(merger.getBytesRead() > 0);
  }

  @Test(timeout = 20000)
  public void testMultiplePasses() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    for (int x = 0; x < 10; ++x) {
      diskInputs.add(createDiskInput(100));
    }

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, null, 4, null, true, false,
        workDir, "test_", null, 4096, true);
    // 10 inputs: a pass of 4 leaves 7, another pass of 4 leaves 4 for the final pass.
    assertEquals(3, merger.getMergePassCount());
    assertTrue(merger.getBytesWritten() > 0);
    assertTrue(localFs.exists(new Path(workDir, "test_merge_pass1.tmp")));
    assertSorted(result, 1000);
    assertFalse(localFs.exists(new Path(workDir, "test_merge_pass0.tmp")));
    assertFalse(localFs.exists(new Path(workDir, "test_merge_pass1.tmp")));
  }

  @Test(timeout = 10000)
  public void testMemoryAndDiskInputs() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    List<RecordInput> memoryInputs = new ArrayList<RecordInput>();
    for (int x = 0; x < 5; ++x) {
      diskInputs.add(createDiskInput(20));
      memoryInputs.add(createMemoryInput(30));
    }

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, memoryInputs, 2, null, false,
        workDir, null, 4096, false);
    assertSorted(result, 250);
    assertTrue(merger.isUsingRawRecords());
    assertTrue(merger.getMergePassCount() > 1);
  }

  @Test(timeout = 10000)
  public void testForceDeserialization() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    for (int x = 0; x < 3; ++x) {
      diskInputs.add(createDiskInput(25));
    }

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, null, 10, null, false, true,
        workDir, "", null, 4096, true);
    assertFalse(merger.isUsingRawRecords());
    assertTrue(result.hasNext());
    MergeResultRecord<IntWritable> first = result.next();
    assertFalse(first.isRaw());
    try {
      first.writeRawRecord(new RecordFile.RawWriter(new ByteArrayOutputStream(), null, false,
          true));
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) {
      assertEquals("No raw record stored in this instance.", e.getMessage());
    }
    Collections.sort(expected);
    assertEquals(expected.get(0).intValue(), first.getValue().get());
    int count = 1;
    while (result.hasNext()) {
      assertEquals(expected.get(count).intValue(), result.next().getValue().get());
      ++count;
    }
    assertEquals(75, count);
    result.close();
  }

  @Test(timeout = 10000)
  public void testNonRawInputs() throws IOException {
    List<RecordInput> memoryInputs = new ArrayList<RecordInput>();
    memoryInputs.add(createReaderInput(1, 4, 9));
    memoryInputs.add(createReaderInput(2, 3, 10));
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    diskInputs.add(createDiskInput(10));

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, memoryInputs, 10, null, false,
        workDir, null, 4096, true);
    assertFalse(merger.isUsingRawRecords());
    assertSorted(result, 16);
  }

  @Test(timeout = 10000)
  public void testCustomComparator() throws IOException {
    List<RecordInput> memoryInputs = new ArrayList<RecordInput>();
    memoryInputs.add(createReaderInput(9, 4, 1));
    memoryInputs.add(createReaderInput(10, 3, 2));
    Comparator<IntWritable> descending = new Comparator<IntWritable>() {
      @Override
      public int compare(IntWritable o1, IntWritable o2) {
        return o2.compareTo(o1);
      }
    };

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(null, memoryInputs, 10, descending, false,
        workDir, null, 4096, true);
    List<Integer> values = new ArrayList<Integer>();
    while (result.hasNext()) {
      values.add(result.next().getValue().get());
    }
    result.close();
    assertEquals(java.util.Arrays.asList(10, 9, 4, 3, 2, 1), values);
  }

  @Test(timeout = 10000)
  public void testDeserializingComparator() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    diskInputs.add(createDiskInput(10));
    diskInputs.add(createDiskInput(10));

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, null, 10,
        new IntDeserializingComparator(), false, workDir, null, 4096, true);
    assertFalse(merger.isUsingRawRecords());
    assertSorted(result, 20);
  }

  @Test(timeout = 10000)
  public void testEmptyInputs() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    diskInputs.add(createDiskInput(0));
    diskInputs.add(createDiskInput(7));
    diskInputs.add(createDiskInput(0));
    List<RecordInput> memoryInputs = new ArrayList<RecordInput>();
    memoryInputs.add(createMemoryInput(0));

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, memoryInputs, 10, null, false,
        workDir, null, 4096, true);
    assertTrue(diskInputs.get(0).isClosed());
    assertTrue(memoryInputs.get(0).isClosed());
    assertSorted(result, 7);
  }

  @Test(timeout = 10000)
  public void testWriteMerge() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    for (int x = 0; x < 5; ++x) {
      diskInputs.add(createDiskInput(10));
    }
    Path output = new Path(workDir, "merged.out");

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    long size = merger.writeMerge(output, diskInputs, null, 3, null, false, workDir, "",
        null, 4096, true);
    assertEquals(50 * 5, size);

    FileRecordInput input = new FileRecordInput(defaultConf, localFs, output, IntWritable.class,
        null, 4096, false);
    List<RecordInput> merged = new ArrayList<RecordInput>();
    merged.add(input);
    assertSorted(new JetMerger<IntWritable>(defaultConf, IntWritable.class).merge(merged, null,
        10, null, false, workDir, null, 4096, true), 50);
  }

  @Test(timeout = 5000)
  public void testCloseReleasesInputs() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    diskInputs.add(createDiskInput(10));
    diskInputs.add(createDiskInput(10));

    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    MergeResult<IntWritable> result = merger.merge(diskInputs, null, 10, null, false,
        workDir, null, 4096, true);
    result.next();
    result.close();
    assertFalse(result.hasNext());
    for (RecordInput input : diskInputs) {
      assertTrue(input.isClosed());
    }
  }

  @Test(timeout = 5000)
  public void testNoInputs() throws IOException {
    JetMerger<IntWritable> merger = new JetMerger<IntWritable>(defaultConf, IntWritable.class);
    try {
      merger.merge(null, null, 10, null, false, workDir, null, 4096, true);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertEquals("diskInputs and memoryInputs cannot both be null.", e.getMessage());
    }
  }

  @Test(timeout = 10000)
  public void testUnregisteredWritableComparableIsMergedAsObjects() throws IOException {
    List<RecordInput> diskInputs = new ArrayList<RecordInput>();
    for (int x = 0; x < 4; ++x) {
      Path path = new Path(workDir, "sequence" + x);
      RecordFile.Writer<SequenceNumber> writer = new RecordFile.Writer<SequenceNumber>(
          defaultConf, localFs, path, SequenceNumber.class, null, 4096, true);
      for (int value = x; value < 400; value += 4) {
        writer.writeRecord(new SequenceNumber(value));
      }
      writer.close();
      diskInputs.add(new FileRecordInput(defaultConf, localFs, path, SequenceNumber.class, null,
          4096, false));
    }
    SequenceNumber.DESERIALIZATIONS.set(0);

    JetMerger<SequenceNumber> merger = new JetMerger<SequenceNumber>(defaultConf,
        SequenceNumber.class);
    MergeResult<SequenceNumber> result = merger.merge(diskInputs, null, 10, null, false,
        workDir, null, 4096, true);
    assertFalse(merger.isUsingRawRecords());
    int expectedValue = 0;
    while (result.hasNext()) {
      assertEquals(expectedValue, result.next().getValue().value);
      ++expectedValue;
    }
    result.close();
    assertEquals(400, expectedValue);
    // Each record is deserialized once when reading; comparisons never deserialize.
    assertEquals(400, SequenceNumber.DESERIALIZATIONS.get());
  }

  @Test(timeout = 5000)
  public void testNumDiskInputsForPass() {
    assertEquals(4, JetMerger.getNumDiskInputsForPass(0, 10, 4));
    assertEquals(2, JetMerger.getNumDiskInputsForPass(0, 11, 4));
    assertEquals(4, JetMerger.getNumDiskInputsForPass(1, 11, 4));
    assertEquals(3, JetMerger.getNumDiskInputsForPass(0, 3, 4));
    assertEquals(100, JetMerger.getNumDiskInputsForPass(0, 199, 100));
  }

  public static class IntDeserializingComparator
      extends DeserializingRawComparator<IntWritable> {
    public IntDeserializingComparator() {
      super(IntWritable.class);
    }

    @Override
    public int compare(IntWritable o1, IntWritable o2) {
      return o1.compareTo(o2);
    }
  }

  public static class SequenceNumber implements WritableComparable<SequenceNumber> {
    static final AtomicInteger DESERIALIZATIONS = new AtomicInteger();

    private int value;

    public SequenceNumber() {
    }

    public SequenceNumber(int value) {
      this.value = value;
    }

    @Override
    public void write(DataOutput out) throws IOException {
      out.writeInt(value);
    }

    @Override
    public void readFields(DataInput in) throws IOException {
      DESERIALIZATIONS.incrementAndGet();
      value = in.readInt();
    }

    @Override
    public int compareTo(SequenceNumber other) {
      return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof SequenceNumber && ((SequenceNumber) obj).value == value;
    }

    @Override
    public int hashCode() {
      return value;
    }
  }

  private void assertSorted(MergeResult<IntWritable> result, int expectedCount)
      throws IOException {
    Collections.sort(expected);
    int count = 0;
    int previous = Integer.MIN_VALUE;
    while (result.hasNext()) {
      int value = result.next().getValue().get();
      assertTrue(value >= previous);
      assertEquals(expected.get(count).intValue(), value);
      previous = value;
      ++count;
    }
    assertEquals(1.0f, result.getProgress(), 0.0f);
    result.close();
    assertEquals(expectedCount, count);
  }

  private List<IntWritable> createSortedValues(int count) {
    List<Integer> values = new ArrayList<Integer>();
    for (int x = 0; x < count; ++x) {
      values.add(random.nextInt(1000));
    }
    Collections.sort(values);
    expected.addAll(values);
    List<IntWritable> result = new ArrayList<IntWritable>();
    for (int value : values) {
      result.add(new IntWritable(value));
    }
    return result;
  }

  private RecordInput createDiskInput(int count) throws IOException {
    Path path = new Path(workDir, "input" + (inputNumber++));
    RecordFile.Writer<IntWritable> writer = new RecordFile.Writer<IntWritable>(defaultConf,
        localFs, path, IntWritable.class, null, 4096, true);
    for (IntWritable value : createSortedValues(count)) {
      writer.writeRecord(value);
    }
    writer.close();
    return new FileRecordInput(defaultConf, localFs, path, IntWritable.class, null, 4096,
        false);
  }

  private RecordInput createMemoryInput(int count) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    RecordFile.Writer<IntWritable> writer = new RecordFile.Writer<IntWritable>(defaultConf, out,
        IntWritable.class, null, false, true);
    for (IntWritable value : createSortedValues(count)) {
      writer.writeRecord(value);
    }
    writer.close();
    return new BufferRecordInput(defaultConf, IntWritable.class, out.toByteArray(), false);
  }

  private RecordInput createReaderInput(int... values) {
    List<IntWritable> records = new ArrayList<IntWritable>();
    for (int value : values) {
      records.add(new IntWritable(value));
      expected.add(value);
    }
    return new ReaderRecordInput(new ListRecordReader<IntWritable>(records), true);
  }
}
