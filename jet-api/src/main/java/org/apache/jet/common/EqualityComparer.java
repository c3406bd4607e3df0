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

package org.apache.jet.common;

import org.apache.hadoop.classification.InterfaceAudience.Public;

/**
 * Defines equality and hashing of values independently of the values' own
 * {@link Object#equals(Object)} and {@link Object#hashCode()}, for instance to compare records
 * on a key extracted from them.
 *
 * @param <T> the type of the values
 */
@Public
public interface EqualityComparer<T> {

  boolean equals(T x, T y);

  int hashCode(T value);
}
