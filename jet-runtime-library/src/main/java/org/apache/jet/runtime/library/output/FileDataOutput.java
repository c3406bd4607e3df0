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

import java.io.IOException;
import java.util.Locale;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.classification.InterfaceStability.Evolving;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.jet.api.JetConfiguration;
import org.apache.jet.api.JetReflectionException;
import org.apache.jet.api.JetUncheckedException;
import org.apache.jet.common.ReflectionUtils;
import org.apache.jet.jobs.DataOutput;
import org.apache.jet.jobs.OutputCommitter;
import org.apache.jet.jobs.StageConfiguration;
import org.apache.jet.runtime.api.TaskContext;
import org.apache.jet.runtime.library.common.ConfigUtils;
import org.apache.jet.runtime.library.common.io.RecordFile;

import com.google.common.base.Preconditions;

/**
 * Data output that writes one record file per output partition to a directory. Records are
 * written to <code>&lt;dfsJobDir&gt;/temp/&lt;attemptId&gt;_part&lt;N&gt;</code> and moved to
 * <code>&lt;outputPath&gt;/&lt;stageId&gt;-NNNNN</code> when the task commits.
 */
@Public
@Evolving
public class FileDataOutput implements DataOutput {

  private Path outputPath;
  private Class<?> recordClass;

  public FileDataOutput() {
  }

  public FileDataOutput(Path outputPath, Class<?> recordClass) {
    this.outputPath = Preconditions.checkNotNull(outputPath, "outputPath");
    this.recordClass = Preconditions.checkNotNull(recordClass, "recordClass");
  }

  public Path getOutputPath() {
    return outputPath;
  }

  @Override
  public Class<?> getRecordClass() {
    return recordClass;
  }

  @Override
  public void notifyAddedToStage(StageConfiguration stage) {
    stage.addSetting(JetConfiguration.JET_DATA_OUTPUT_PATH, outputPath.toString());
    stage.addSetting(JetConfiguration.JET_DATA_OUTPUT_RECORD_CLASS, recordClass.getName());
  }

  @Override
  public void restore(StageConfiguration stage) {
    String pathSetting = stage.getSetting(JetConfiguration.JET_DATA_OUTPUT_PATH, null);
    String classSetting = stage.getSetting(JetConfiguration.JET_DATA_OUTPUT_RECORD_CLASS, null);
    Preconditions.checkState(pathSetting != null && classSetting != null,
        "Stage %s has no file data output settings.", stage.getStageId());
    outputPath = new Path(pathSetting);
    try {
      recordClass = ReflectionUtils.getClazz(classSetting);
    } catch (JetReflectionException e) {
      throw new JetUncheckedException("Could not load data output record class "
          + classSetting, e);
    }
  }

  public static String getOutputFileName(String stageId, int partitionNumber) {
    return String.format(Locale.ROOT, "%s-%05d", stageId, partitionNumber);
  }

  @Override
  @SuppressWarnings({ "unchecked", "rawtypes" })
  public OutputCommitter createOutput(int partitionNumber, TaskContext context)
      throws IOException {
    Configuration conf = context.getConfiguration();
    Path tempPath = new Path(new Path(context.getDfsJobDirectory(), "temp"),
        context.getTaskAttemptId() + "_part" + partitionNumber);
    Path finalPath = new Path(outputPath,
        getOutputFileName(context.getStageConfiguration().getStageId(), partitionNumber));
    FileSystem fs = tempPath.getFileSystem(conf);
    RecordFile.Writer writer = new RecordFile.Writer(conf, fs, tempPath, recordClass,
        ConfigUtils.getIntermediateCompressionCodec(conf), ConfigUtils.getWriteBufferSize(conf),
        ConfigUtils.isIntermediateChecksumEnabled(conf));
    return new FileOutputCommitter(fs, tempPath, finalPath, writer);
  }
}
