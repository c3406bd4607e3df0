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

import java.lang.reflect.Constructor;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.hadoop.classification.InterfaceAudience.Private;
import org.apache.hadoop.conf.Configurable;
import org.apache.hadoop.conf.Configuration;
import org.apache.jet.api.JetReflectionException;

@Private
public class ReflectionUtils {

  private static final Map<String, Class<?>> CLAZZ_CACHE = new ConcurrentHashMap<String, Class<?>>();

  @Private
  public static Class<?> getClazz(String className) throws JetReflectionException {
    Class<?> clazz = CLAZZ_CACHE.get(className);
    if (clazz == null) {
      try {
        clazz = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
      } catch (ClassNotFoundException e) {
        throw new JetReflectionException("Unable to load class: " + className, e);
      }
      CLAZZ_CACHE.put(className, clazz);
    }
    return clazz;
  }

  private static <T> T getNewInstance(Class<T> clazz) throws JetReflectionException {
    T instance;
    try {
      Constructor<T> constructor = clazz.getDeclaredConstructor();
      instance = constructor.newInstance();
    } catch (Exception e) {
      throw new JetReflectionException(
          "Unable to instantiate class with 0 arguments: " + clazz.getName(), e);
    }
    return instance;
  }

  @Private
  public static <T> T createClazzInstance(String className) throws JetReflectionException {
    Class<?> clazz = getClazz(className);
    @SuppressWarnings("unchecked")
    T instance = (T) getNewInstance(clazz);
    return instance;
  }

  /**
   * Creates an instance of the named class and, if it is {@link Configurable}, hands it the
   * specified configuration.
   */
  @Private
  public static <T> T createClazzInstance(String className, Configuration conf)
      throws JetReflectionException {
    T instance = createClazzInstance(className);
    if (conf != null && instance instanceof Configurable) {
      ((Configurable) instance).setConf(conf);
    }
    return instance;
  }

  /**
   * Returns the class bound to the first type parameter of <code>genericInterface</code> by
   * <code>clazz</code> or one of its superclasses, or <code>null</code> if the class does not
   * bind it to a concrete class.
   */
  @Private
  public static Class<?> getTypeArgument(Class<?> clazz, Class<?> genericInterface) {
    for (Class<?> current = clazz; current != null && current != Object.class;
         current = current.getSuperclass()) {
      for (Type type : current.getGenericInterfaces()) {
        Class<?> result = getTypeArgument(type, genericInterface);
        if (result != null) {
          return result;
        }
      }
      Class<?> result = getTypeArgument(current.getGenericSuperclass(), genericInterface);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  private static Class<?> getTypeArgument(Type type, Class<?> genericInterface) {
    if (type instanceof ParameterizedType) {
      ParameterizedType parameterizedType = (ParameterizedType) type;
      if (parameterizedType.getRawType() == genericInterface) {
        Type argument = parameterizedType.getActualTypeArguments()[0];
        if (argument instanceof Class) {
          return (Class<?>) argument;
        }
        if (argument instanceof ParameterizedType) {
          return (Class<?>) ((ParameterizedType) argument).getRawType();
        }
      }
    }
    return null;
  }
}
