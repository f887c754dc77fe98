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
package org.mydbd.compat;

import java.util.concurrent.atomic.AtomicReference;

import org.mydbd.cursor.FetchMode;

/**
 * PEAR::DB result methods, expressed on top of the cursor API.
 *
 * @deprecated kept for code migrating from PEAR::DB, use the cursor API instead
 */
@Deprecated
public interface PearCompatCursor {

  Object next(FetchMode mode);

  int getRowCount();

  int getFieldCount();

  void close();

  default Object fetchRow() {
    return next(null);
  }

  default Object fetchRow(LegacyFetchMode fetchMode) {
    return next(fetchMode == null ? null : fetchMode.toFetchMode());
  }

  /**
   * Fetches the next row into {@code row}.
   *
   * @return false once the result is exhausted, {@code row} then holds null
   */
  default boolean fetchInto(AtomicReference<Object> row, LegacyFetchMode fetchMode) {
    Object next = fetchRow(fetchMode);
    row.set(next);
    return next != null;
  }

  default boolean fetchInto(AtomicReference<Object> row) {
    return fetchInto(row, LegacyFetchMode.DEFAULT);
  }

  default int numRows() {
    return getRowCount();
  }

  default int numCols() {
    return getFieldCount();
  }

  default void free() {
    close();
  }

}
