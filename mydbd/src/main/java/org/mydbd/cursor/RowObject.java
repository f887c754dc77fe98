/**
 *    Copyright 2024-2026 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mydbd.cursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default shape of a row fetched in {@link FetchMode#OBJECT} mode: one named property per column.
 */
public class RowObject {

  private final Map<String, Object> properties;

  public RowObject(Map<String, Object> properties) {
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public Object get(String name) {
    if (!properties.containsKey(name)) {
      throw new IllegalArgumentException("No property named '" + name + "' in " + this);
    }
    return properties.get(name);
  }

  public boolean has(String name) {
    return properties.containsKey(name);
  }

  public List<String> getPropertyNames() {
    return new ArrayList<>(properties.keySet());
  }

  public int size() {
    return properties.size();
  }

  public Map<String, Object> toMap() {
    return properties;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RowObject)) {
      return false;
    }
    return properties.equals(((RowObject) o).properties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(properties);
  }

  @Override
  public String toString() {
    return "RowObject" + properties;
  }

}
