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

package org.apache.jet.runtime.library.input;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.BlockLocation;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.common.ReflectionUtils;
import org.apache.jet.io.RecordReader;
import org.apache.jet.jobs.DataInput;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.jobs.TaskInput;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.common.io.RecordFile;

import com.google.common.base.Preconditions;

/**
 * Data input that reads record files from a file system, one task per file. The path may name
 * a single file or a directory; files whose names start with <code>_</code> or <code>.</code>
 * are ignored.
 */
@Public
@Evolving
public class FileDataInput implements DataInput {

  private Path path;
  private Class<?> recordClass;
  private List<TaskInput> taskInputs = new ArrayList<TaskInput>();

  public FileDataInput() {
  }

  public FileDataInput(Configuration conf, Path path, Class<?> recordClass) throws IOException {
    this.path = Preconditions.checkNotNull(path, "path");
    this.recordClass = Preconditions.checkNotNull(recordClass, "recordClass");
    FileSystem fs = path.getFileSystem(conf);
    FileStatus[] files;
    FileStatus status = fs.getFileStatus(path);
    if (status.isDirectory()) {
      files = fs.listStatus(path, p -> !p.getName().startsWith("_")
          && !p.getName().startsWith("."));
      Arrays.sort(files);
    } else {
      files = new FileStatus[] { status };
    }
    for (FileStatus file : files) {
      if (file.isFile()) {
        taskInputs.add(new FileTaskInput(file.getPath(), file.getLen(), getHosts(fs, file)));
      }
    }
    if (taskInputs.isEmpty()) {
      throw new IOException("No input files found in " + path);
    }
  }

  public Path getPath() {
    return path;
  }

  @Override
  public Class<?> getRecordClass() {
    return recordClass;
  }

  @Override
  public List<TaskInput> getTaskInputs() {
    return Collections.unmodifiableList(taskInputs);
  }

  @Override
  public void notifyAddedToStage(StageConfiguration stage) {
    stage.addSetting(JetConfiguration.JET_DATA_INPUT_PATH, path.toString());
    stage.addSetting(JetConfiguration.JET_DATA_INPUT_RECORD_CLASS, recordClass.getName());
  }

  @Override
  public void restore(StageConfiguration stage, List<TaskInput> inputs) {
    String pathSetting = stage.getSetting(JetConfiguration.JET_DATA_INPUT_PATH, null);
    String classSetting = stage.getSetting(JetConfiguration.JET_DATA_INPUT_RECORD_CLASS, null);
    Preconditions.checkState(pathSetting != null && classSetting != null,
        "Stage %s has no file data input settings.", stage.getStageId());
    path = new Path(pathSetting);
    try {
      recordClass = ReflectionUtils.getClazz(classSetting);
    } catch (JetReflectionException e) {
      throw new JetUncheckedException("Could not load data input record class "
          + classSetting, e);
    }
    taskInputs = new ArrayList<TaskInput>(inputs);
  }

  @Override
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public RecordReader<?> createRecordReader(TaskInput input, TaskContext context)
      throws IOException {
    FileTaskInput fileInput = (FileTaskInput) input;
    Configuration conf = context.getConfiguration();
    FileSystem fs = fileInput.getPath().getFileSystem(conf);
    return new RecordFile.Reader(conf, fs, fileInput.getPath(), recordClass,
        ConfigUtils.getIntermediateCompressionCodec(conf), ConfigUtils.getReadBufferSize(conf),
        context.getStageConfiguration().allowRecordReuse());
  }

  private static List<String> getHosts(FileSystem fs, FileStatus file) throws IOException {
    List<String> hosts = new ArrayList<String>();
    for (BlockLocation location : fs.getFileBlockLocations(file, 0, file.getLen())) {
      for (String host : location.getHosts()) {
        if (!hosts.contains(host)) {
          hosts.add(host);
        }
      }
    }
    return hosts;
  }
}
