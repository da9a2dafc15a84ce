/*
 * Licensed to SK Telecom Co., LTD. (SK Telecom) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  SK Telecom licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.loki.data;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.loki.common.EvaluationException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Record backed by a map. Scalar values are {@link Number}s, jagged values are primitive numeric arrays or
 * lists of numbers.
 */
public class MapBasedRecord implements Record
{
  public static MapBasedRecord of(Object... keyValues)
  {
    final Map<String, Object> event = Maps.newLinkedHashMap();
    for (int i = 0; i < keyValues.length; i += 2) {
      event.put((String) keyValues[i], keyValues[i + 1]);
    }
    return new MapBasedRecord(event);
  }

  private final Map<String, Object> event;

  public MapBasedRecord(Map<String, Object> event)
  {
    this.event = event == null ? ImmutableMap.<String, Object>of() : event;
  }

  @Override
  public Collection<String> getFields()
  {
    return event.keySet();
  }

  @Override
  public boolean isJagged(String field)
  {
    final Object value = event.get(field);
    return value != null && !(value instanceof Number);
  }

  @Override
  public double getDouble(String field)
  {
    final Object value = event.get(field);
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value == null) {
      throw new EvaluationException("field '%s' is missing", field);
    }
    throw new EvaluationException("field '%s' is not a scalar [%s]", field, value.getClass().getSimpleName());
  }

  @Override
  public int size(String field)
  {
    final Object value = event.get(field);
    if (value instanceof double[]) {
      return ((double[]) value).length;
    } else if (value instanceof float[]) {
      return ((float[]) value).length;
    } else if (value instanceof int[]) {
      return ((int[]) value).length;
    } else if (value instanceof long[]) {
      return ((long[]) value).length;
    } else if (value instanceof List) {
      return ((List) value).size();
    } else if (value instanceof Number) {
      return 1;
    }
    throw unsupported(field, value);
  }

  @Override
  public double getDouble(String field, int index)
  {
    final Object value = event.get(field);
    final int size = size(field);
    if (index < 0 || index >= size) {
      throw new EvaluationException("index %d is out of range for field '%s' of size %d", index, field, size);
    }
    if (value instanceof double[]) {
      return ((double[]) value)[index];
    } else if (value instanceof float[]) {
      return ((float[]) value)[index];
    } else if (value instanceof int[]) {
      return ((int[]) value)[index];
    } else if (value instanceof long[]) {
      return ((long[]) value)[index];
    } else if (value instanceof List) {
      final Object element = ((List) value).get(index);
      if (element instanceof Number) {
        return ((Number) element).doubleValue();
      }
      throw new EvaluationException("element %d of field '%s' is not a number [%s]", index, field, element);
    }
    return ((Number) value).doubleValue();
  }

  private static EvaluationException unsupported(String field, Object value)
  {
    if (value == null) {
      return new EvaluationException("field '%s' is missing", field);
    }
    return new EvaluationException("field '%s' has unsupported type %s", field, value.getClass().getSimpleName());
  }

  @Override
  public String toString()
  {
    return "MapBasedRecord{event=" + event + '}';
  }
}
