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

package org.apache.jet.runtime.library.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IntWritable;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.io.HashPartitioner;
import org.apache.jet.io.RecordReader;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.runtime.api.Task;
import org.apache.jet.runtime.library.common.io.RecordFile;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestSortSpillRecordWriter {

  private static Configuration defaultConf = new Configuration();
  private static FileSystem localFs;
  private static Path workDir;

  static {
    defaultConf.set("fs.defaultFS", "file:///");
    try {
      localFs = FileSystem.getLocal(defaultConf).getRaw();
      workDir = new Path(
          new Path(System.getProperty("test.build.data", "/tmp")),
          TestSortSpillRecordWriter.class.getName())
          .makeQualified(localFs.getUri(), localFs.getWorkingDirectory());
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  private Configuration conf;

  @Before
  @After
  public void cleanup() throws Exception {
    localFs.delete(workDir, true);
    conf = new Configuration(defaultConf);
    // Spill after every 16 IntWritable records.
    conf.setInt(JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_SIZE, 64);
    conf.setFloat(JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_LIMIT, 1.0f);
  }

  @Test(timeout = 20000)
  public void testMultipleSpillsAreMergedPerPartition() throws IOException {
    conf.setInt(JetConfiguration.JET_MERGE_MAX_DISK_INPUTS_PER_PASS, 4);
    List<Path> files = createOutputFiles(3);
    Random random = new Random(42);
    List<List<Integer>> expected = new ArrayList<List<Integer>>();
    for (int x = 0; x < 3; ++x) {
      expected.add(new ArrayList<Integer>());
    }

    SortSpillRecordWriter<IntWritable> writer = createWriter(files);
    for (int x = 0; x < 300; ++x) {
      int value = random.nextInt(1000);
      expected.get(value % 3).add(value);
      writer.writeRecord(new IntWritable(value));
    }
    writer.close();

    assertEquals(19, writer.getSpillCount());
    assertEquals(1200, writer.getOutputBytes());
    assertTrue(writer.getBytesWritten() > 1200);
    for (int x = 0; x < 3; ++x) {
      Collections.sort(expected.get(x));
      assertEquals(expected.get(x), readValues(files.get(x)));
    }
    assertOnlyOutputFilesLeft(3);
  }

  @Test(timeout = 10000)
  public void testSingleSpillIsRenamedAndEmptyPartitionsAreWritten() throws IOException {
    List<Path> files = createOutputFiles(3);
    SortSpillRecordWriter<IntWritable> writer = createWriter(files);
    for (int value : new int[] { 9, 3, 12, 0, 6 }) {
      writer.writeRecord(new IntWritable(value));
    }
    writer.close();

    assertEquals(1, writer.getSpillCount());
    assertEquals(asList(0, 3, 6, 9, 12), readValues(files.get(0)));
    assertEquals(asList(), readValues(files.get(1)));
    assertEquals(asList(), readValues(files.get(2)));
    assertOnlyOutputFilesLeft(3);
  }

  @Test(timeout = 10000)
  public void testNoRecords() throws IOException {
    List<Path> files = createOutputFiles(2);
    SortSpillRecordWriter<IntWritable> writer = createWriter(files);
    writer.close();

    assertEquals(0, writer.getSpillCount());
    assertEquals(asList(), readValues(files.get(0)));
    assertEquals(asList(), readValues(files.get(1)));
  }

  @Test(timeout = 10000)
  public void testCombinerRunsDuringMerge() throws IOException {
    conf.set(JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_COMBINER_CLASS,
        DistinctCombiner.class.getName());
    List<Path> files = createOutputFiles(1);
    SortSpillRecordWriter<IntWritable> writer = createWriter(files);
    writeRepeated(writer, 100);

    assertEquals(7, writer.getSpillCount());
    assertEquals(asList(1, 7), readValues(files.get(0)));
    assertOnlyOutputFilesLeft(1);
  }

  @Test(timeout = 10000)
  public void testCombinerRunsOnlyOnSpillsBelowMinimum() throws IOException {
    conf.set(JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_COMBINER_CLASS,
        DistinctCombiner.class.getName());
    conf.setInt(JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_MIN_SPILLS_FOR_COMBINE_DURING_MERGE,
        0);
    List<Path> files = createOutputFiles(1);
    SortSpillRecordWriter<IntWritable> writer = createWriter(files);
    writeRepeated(writer, 100);

    // Each spill holds one 7 after combining, and the merge keeps all of them.
    List<Integer> values = readValues(files.get(0));
    assertEquals(Integer.valueOf(1), values.get(0));
    assertEquals(writer.getSpillCount() + 1, values.size());
    for (int x = 1; x < values.size(); ++x) {
      assertEquals(Integer.valueOf(7), values.get(x));
    }
  }

  @Test(timeout = 10000)
  public void testCustomComparator() throws IOException {
    conf.set(JetConfiguration.JET_FILE_CHANNEL_SPILL_SORT_COMPARATOR_CLASS,
        ReverseComparator.class.getName());
    List<Path> files = createOutputFiles(1);
    SortSpillRecordWriter<IntWritable> writer = createWriter(files);
    List<Integer> expected = new ArrayList<Integer>();
    Random random = new Random(7);
    for (int x = 0; x < 100; ++x) {
      int value = random.nextInt(500);
      expected.add(value);
      writer.writeRecord(new IntWritable(value));
    }
    writer.close();

    Collections.sort(expected, Collections.reverseOrder());
    assertTrue(writer.getSpillCount() > 1);
    assertEquals(expected, readValues(files.get(0)));
  }

  @Test(timeout = 10000)
  public void testInvalidSpillLimit() throws IOException {
    conf.setFloat(JetConfiguration.JET_FILE_CHANNEL_SPILL_BUFFER_LIMIT, 1.5f);
    try {
      createWriter(createOutputFiles(1));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("spill buffer limit"));
    }
  }

  private void writeRepeated(SortSpillRecordWriter<IntWritable> writer, int count)
      throws IOException {
    writer.writeRecord(new IntWritable(1));
    for (int x = 1; x < count; ++x) {
      writer.writeRecord(new IntWritable(7));
    }
    writer.close();
  }

  private SortSpillRecordWriter<IntWritable> createWriter(List<Path> files) throws IOException {
    return new SortSpillRecordWriter<IntWritable>(conf, localFs, files, IntWritable.class,
        new HashPartitioner<IntWritable>());
  }

  private static List<Path> createOutputFiles(int partitions) {
    List<Path> files = new ArrayList<Path>();
    for (int x = 0; x < partitions; ++x) {
      files.add(new Path(workDir, "part" + (x + 1) + ".output"));
    }
    return files;
  }

  private List<Integer> readValues(Path file) throws IOException {
    List<Integer> result = new ArrayList<Integer>();
    RecordFile.Reader<IntWritable> reader = new RecordFile.Reader<IntWritable>(conf, localFs,
        file, IntWritable.class, null, 4096, false);
    try {
      while (reader.readRecord()) {
        result.add(reader.getCurrentRecord().get());
      }
    } finally {
      reader.close();
    }
    return result;
  }

  private static void assertOnlyOutputFilesLeft(int count) throws IOException {
    FileStatus[] statuses = localFs.listStatus(workDir);
    assertEquals(count, statuses.length);
    for (FileStatus status : statuses) {
      assertTrue(status.getPath().getName().endsWith(".output"));
      assertFalse(status.getPath().getName().startsWith("spill"));
    }
  }

  private static List<Integer> asList(Integer... values) {
    List<Integer> result = new ArrayList<Integer>();
    Collections.addAll(result, values);
    return result;
  }

  public static class DistinctCombiner implements Task<IntWritable, IntWritable> {
    @Override
    public void run(RecordReader<IntWritable> input, RecordWriter<IntWritable> output)
        throws Exception {
      Integer previous = null;
      while (input.readRecord()) {
        int value = input.getCurrentRecord().get();
        if (previous == null || previous != value) {
          output.writeRecord(new IntWritable(value));
          previous = value;
        }
      }
    }
  }

  public static class ReverseComparator implements Comparator<IntWritable> {
    @Override
    public int compare(IntWritable left, IntWritable right) {
      return Integer.compare(right.get(), left.get());
    }
  }
}
