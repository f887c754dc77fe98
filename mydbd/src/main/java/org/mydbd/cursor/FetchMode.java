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

/**
 * Shape in which a cursor materializes rows.
 */
public enum FetchMode {

  /**
   * Row as a {@code List<Object>} indexed by column position, starting at 0.
   */
  ORDERED,

  /**
   * Row as a {@code Map<String, Object>} keyed by column label. Duplicate labels keep the last value.
   */
  ASSOC,

  /**
   * Row as an object with one property per column label, {@link RowObject} unless another type is given.
   */
  OBJECT,

  /**
   * Only one column of the row, selected by index or label.
   */
  COLUMN

}
