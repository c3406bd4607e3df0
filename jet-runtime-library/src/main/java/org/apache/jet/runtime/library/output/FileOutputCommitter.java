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

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.jet.io.RecordWriter;
import org.apache.jet.jobs.OutputCommitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Output committer that writes to a temporary file and renames it to the final output file on
 * commit. An existing final file, left behind by an earlier attempt, is replaced.
 */
@Public
public class FileOutputCommitter implements OutputCommitter {

  private static final Logger LOG = LoggerFactory.getLogger(FileOutputCommitter.class);

  private final FileSystem fs;
  private final Path tempPath;
  private final Path outputPath;
  private final RecordWriter<?> recordWriter;
  private boolean committed;

  public FileOutputCommitter(FileSystem fs, Path tempPath, Path outputPath,
      RecordWriter<?> recordWriter) {
    this.fs = Preconditions.checkNotNull(fs, "fs");
    this.tempPath = Preconditions.checkNotNull(tempPath, "tempPath");
    this.outputPath = Preconditions.checkNotNull(outputPath, "outputPath");
    this.recordWriter = Preconditions.checkNotNull(recordWriter, "recordWriter");
  }

  @Override
  public RecordWriter<?> getRecordWriter() {
    return recordWriter;
  }

  public Path getTempPath() {
    return tempPath;
  }

  public Path getOutputPath() {
    return outputPath;
  }

  /**
   * Moves the temporary file to the output file. The record writer must have been closed.
   */
  @Override
  public void commit() throws IOException {
    Preconditions.checkState(!committed, "The output has already been committed.");
    if (fs.exists(outputPath)) {
      LOG.warn("Replacing existing output file {}", outputPath);
      if (!fs.delete(outputPath, false)) {
        throw new IOException("Could not delete existing output file " + outputPath);
      }
    }
    Path parent = outputPath.getParent();
    if (parent != null && !fs.exists(parent) && !fs.mkdirs(parent)) {
      throw new IOException("Could not create output directory " + parent);
    }
    if (!fs.rename(tempPath, outputPath)) {
      throw new IOException("Could not move " + tempPath + " to " + outputPath);
    }
    committed = true;
    LOG.info("Committed output file {}", outputPath);
  }
}
