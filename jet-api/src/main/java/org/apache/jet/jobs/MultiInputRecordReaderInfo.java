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

package org.apache.jet.jobs;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.hadoop.classification.InterfaceAudience.Public;
import org.apache.jet.api.JetConfiguration;

import com.google.common.base.Preconditions;

/**
 * Describes a multi-input record reader type registered with a {@link JobComponentRegistry}.
 * <p/>
 * A reader is either generic, in which case it accepts inputs of any record type and produces
 * records of that same type, or it declares its output record type and the input record types
 * it accepts.
 */
@Public
public final class MultiInputRecordReaderInfo {

  private final String id;
  private final MultiInputRecordReaderFactory factory;
  private final Class<?> recordClass;
  private final Set<Class<?>> acceptedInputClasses;
  private String bufferSizeKey = JetConfiguration.JET_FILE_CHANNEL_READ_BUFFER_SIZE;
  private int bufferSizeDefault = JetConfiguration.JET_FILE_CHANNEL_READ_BUFFER_SIZE_DEFAULT;
  private boolean additionalProgress;

  /**
   * Creates a generic reader type.
   */
  public MultiInputRecordReaderInfo(String id, MultiInputRecordReaderFactory factory) {
    this(id, factory, null);
  }

  public MultiInputRecordReaderInfo(String id, MultiInputRecordReaderFactory factory,
      Class<?> recordClass, Class<?>... acceptedInputClasses) {
    Preconditions.checkArgument(id != null && !id.isEmpty(), "Reader id must be specified");
    this.id = id;
    this.factory = Preconditions.checkNotNull(factory, "factory");
    this.recordClass = recordClass;
    Set<Class<?>> accepted = new LinkedHashSet<Class<?>>();
    if (recordClass != null) {
      if (acceptedInputClasses.length == 0) {
        accepted.add(recordClass);
      } else {
        Collections.addAll(accepted, acceptedInputClasses);
      }
    }
    this.acceptedInputClasses = Collections.unmodifiableSet(accepted);
  }

  public String getId() {
    return id;
  }

  public MultiInputRecordReaderFactory getFactory() {
    return factory;
  }

  public boolean isGeneric() {
    return recordClass == null;
  }

  /**
   * Returns the type of records the reader produces when it is fed with records of the
   * specified type.
   */
  public Class<?> getRecordClass(Class<?> inputRecordClass) {
    return recordClass == null ? inputRecordClass : recordClass;
  }

  public Set<Class<?>> getAcceptedInputClasses() {
    return acceptedInputClasses;
  }

  public boolean accepts(Class<?> inputRecordClass) {
    return recordClass == null || acceptedInputClasses.contains(inputRecordClass);
  }

  public String getBufferSizeKey() {
    return bufferSizeKey;
  }

  public int getBufferSizeDefault() {
    return bufferSizeDefault;
  }

  /**
   * Sets the configuration key that determines the read buffer size passed to the factory.
   */
  public MultiInputRecordReaderInfo setBufferSize(String key, int defaultValue) {
    this.bufferSizeKey = Preconditions.checkNotNull(key);
    this.bufferSizeDefault = defaultValue;
    return this;
  }

  public boolean hasAdditionalProgress() {
    return additionalProgress;
  }

  public MultiInputRecordReaderInfo setAdditionalProgress(boolean additionalProgress) {
    this.additionalProgress = additionalProgress;
    return this;
  }

  @Override
  public String toString() {
    return "MultiInputRecordReaderInfo [id=" + id + "]";
  }
}
