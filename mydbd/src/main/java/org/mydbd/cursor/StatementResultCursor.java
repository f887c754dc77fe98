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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;

/**
 * Cursor over the result of a prepared statement execution.
 *
 * <p>Every physical fetch overwrites a bound buffer holding one slot per column, and rows are projected
 * from that buffer. A statement owns at most one such cursor: executing the statement again hands the
 * new result to {@link #reset(ResultSet)} instead of allocating another cursor, so rows must be consumed
 * before the next execution.
 */
public class StatementResultCursor extends ResultCursor {

  private final Object[] boundData;

  public StatementResultCursor(ResultSet resultSet) {
    super(resultSet);
    this.boundData = new Object[getFieldCount()];
  }

  /**
   * Rewinds to the first row and restores the default fetch mode and object type.
   */
  public StatementResultCursor reset() {
    if (getRowCount() > 0) {
      rewind();
    }
    resetFetchMode();
    return this;
  }

  /**
   * Rebinds the cursor to the result of a new execution of the owning statement, then {@link #reset()}s it.
   * The bound buffer and the cached field names are kept: a prepared statement keeps its result shape.
   */
  public StatementResultCursor reset(ResultSet resultSet) {
    bind(resultSet);
    Arrays.fill(boundData, null);
    resetFetchMode();
    return this;
  }

  @Override
  protected boolean fetch() throws SQLException {
    if (!resultSet.next()) {
      return false;
    }
    for (int i = 0; i < boundData.length; i++) {
      boundData[i] = resultSet.getObject(i + 1);
    }
    return true;
  }

  @Override
  protected Object value(int index) {
    return boundData[index];
  }

}
