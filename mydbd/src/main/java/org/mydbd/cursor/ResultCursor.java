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
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.StringJoiner;

import org.mydbd.compat.PearCompatCursor;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.exceptions.ExceptionFactory;
import org.mydbd.logging.Log;
import org.mydbd.logging.LogFactory;
import org.mydbd.reflection.RowObjectFactory;

/**
 * Seekable view over the rows of one executed query.
 *
 * <p>The cursor does not hold rows itself: every fetch asks the driver for the next physical row and
 * shapes it according to the {@link FetchMode}. The driver result set must be scrollable, which is
 * how {@link org.mydbd.session.DbConnection} requests it.
 *
 * <pre>
 * ResultCursor res = dbh.query("SELECT id, name FROM users");
 * for (Object row : res) {
 *   List&lt;?&gt; fields = (List&lt;?&gt;) row;
 * }
 * res.setFetchMode(FetchMode.ASSOC);
 * Map&lt;?, ?&gt; first = (Map&lt;?, ?&gt;) res.current();
 * </pre>
 */
@SuppressWarnings("deprecation")
public class ResultCursor implements Iterable<Object>, PearCompatCursor, AutoCloseable {

  private static final Log log = LogFactory.getLog(ResultCursor.class);

  protected ResultSet resultSet;

  private int cursor;
  private int rowCount;
  private FetchMode fetchMode = FetchMode.ORDERED;
  private Class<?> fetchClass = RowObject.class;
  private Object columnSelector = 0;
  private List<String> fieldNames;
  private boolean headerTraced;

  public ResultCursor(ResultSet resultSet) {
    bind(resultSet);
  }

  /**
   * Points the cursor to a new driver result and moves it to the first row.
   */
  protected void bind(ResultSet resultSet) {
    this.resultSet = resultSet;
    this.rowCount = countRows(resultSet);
    this.cursor = 0;
  }

  private static int countRows(ResultSet resultSet) {
    try {
      int rows = resultSet.last() ? resultSet.getRow() : 0;
      resultSet.beforeFirst();
      return rows;
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  /**
   * Sets the mode used by {@link #next()}, {@link #current()} and {@link #fetchAll()}.
   */
  public ResultCursor setFetchMode(FetchMode mode) {
    return setFetchMode(mode, null);
  }

  /**
   * @param mode the fetch mode
   * @param arg for {@link FetchMode#OBJECT} the target {@link Class} (default {@link RowObject}), for
   *        {@link FetchMode#COLUMN} the column index or label (default 0), ignored otherwise
   */
  public ResultCursor setFetchMode(FetchMode mode, Object arg) {
    if (mode == null) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Invalid fetch mode: null");
    }
    if (mode == FetchMode.OBJECT) {
      if (arg != null && !(arg instanceof Class)) {
        throw new DbException(ErrorKind.INVALID_ARGUMENT, "Object fetch mode expects a class, got: " + arg);
      }
      fetchClass = arg == null ? RowObject.class : (Class<?>) arg;
    } else if (mode == FetchMode.COLUMN) {
      Object selector = arg == null ? Integer.valueOf(0) : arg;
      checkColumnSelector(selector);
      columnSelector = selector;
    }
    fetchMode = mode;
    return this;
  }

  public FetchMode getFetchMode() {
    return fetchMode;
  }

  public int getFieldCount() {
    return getFieldNames().size();
  }

  /**
   * Column labels in result order, resolved from the metadata on first use.
   */
  public List<String> getFieldNames() {
    if (fieldNames == null) {
      try {
        ResultSetMetaData metaData = resultSet.getMetaData();
        List<String> names = new ArrayList<>(metaData.getColumnCount());
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
          names.add(metaData.getColumnLabel(i));
        }
        fieldNames = Collections.unmodifiableList(names);
      } catch (SQLException e) {
        throw ExceptionFactory.wrapException(null, e);
      }
    }
    return fieldNames;
  }

  @Override
  public int getRowCount() {
    return rowCount;
  }

  /**
   * @return the position of the row the next fetch returns
   */
  public int key() {
    return cursor;
  }

  public boolean valid() {
    return cursor >= 0 && cursor < rowCount;
  }

  /**
   * Returns the row at the current position without consuming it.
   */
  public Object current() {
    return current(null);
  }

  public Object current(FetchMode mode) {
    if (!valid()) {
      return null;
    }
    Object row = next(mode);
    seek(cursor - 1);
    return row;
  }

  /**
   * Returns the next row in the configured mode, null when the result is exhausted.
   */
  public Object next() {
    return next(null);
  }

  @Override
  public Object next(FetchMode mode) {
    FetchMode effective = mode == null ? fetchMode : mode;
    switch (effective) {
      case ASSOC:
        return fetchAssoc();
      case OBJECT:
        return fetchObject(fetchClass);
      case COLUMN:
        return fetchColumn(columnSelector);
      case ORDERED:
      default:
        return fetchArray();
    }
  }

  /**
   * Moves the cursor so that the next fetch returns the row at {@code position}.
   *
   * @throws DbException with {@link ErrorKind#OUT_OF_RANGE} if the position is not a row of the result
   */
  public void seek(int position) {
    if (position < 0 || position > rowCount - 1) {
      throw new DbException(ErrorKind.OUT_OF_RANGE, "Invalid seek position: " + position);
    }
    try {
      if (position == 0) {
        resultSet.beforeFirst();
      } else {
        resultSet.absolute(position);
      }
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
    cursor = position;
  }

  public void rewind() {
    seek(0);
  }

  /**
   * Fetches every remaining row in the configured mode. Call {@link #rewind()} first to read the result again.
   */
  public List<Object> fetchAll() {
    List<Object> rows = new ArrayList<>();
    while (valid()) {
      rows.add(next());
    }
    return rows;
  }

  public Object fetchColumn() {
    return fetchColumn(0);
  }

  /**
   * Fetches the next row and returns one of its fields.
   *
   * @param column an {@link Integer} column index or a {@link String} column label
   * @return the field value, null when there is no next row
   */
  public Object fetchColumn(Object column) {
    checkColumnSelector(column);
    if (column instanceof Integer) {
      List<Object> row = fetchArray();
      if (row == null) {
        return null;
      }
      int index = (Integer) column;
      if (index < 0 || index >= row.size()) {
        throw new DbException(ErrorKind.OUT_OF_RANGE, "Invalid column index: " + index);
      }
      return row.get(index);
    }
    Map<String, Object> row = fetchAssoc();
    if (row == null) {
      return null;
    }
    if (!row.containsKey(column)) {
      throw new DbException(ErrorKind.OUT_OF_RANGE, "Invalid column name: " + column);
    }
    return row.get(column);
  }

  private static void checkColumnSelector(Object column) {
    if (!(column instanceof Integer) && !(column instanceof String)) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Column must be an index or a name, got: " + column);
    }
  }

  public List<Object> fetchArray() {
    cursor++;
    try {
      if (!advance()) {
        return null;
      }
      int fieldCount = getFieldCount();
      List<Object> row = new ArrayList<>(fieldCount);
      for (int i = 0; i < fieldCount; i++) {
        row.add(value(i));
      }
      return row;
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  public Map<String, Object> fetchAssoc() {
    cursor++;
    try {
      if (!advance()) {
        return null;
      }
      List<String> names = getFieldNames();
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < names.size(); i++) {
        row.put(names.get(i), value(i));
      }
      return row;
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  public Object fetchObject() {
    return fetchObject(fetchClass);
  }

  public <T> T fetchObject(Class<T> type) {
    Map<String, Object> row = fetchAssoc();
    return row == null ? null : RowObjectFactory.create(type, row);
  }

  /**
   * Builds an object of the configured {@link FetchMode#OBJECT} type from an associative row.
   */
  public Object toObject(Map<String, Object> row) {
    return RowObjectFactory.create(fetchClass, row);
  }

  /**
   * Advances the driver to the next physical row.
   *
   * @return false when there is no next row
   */
  protected boolean fetch() throws SQLException {
    return resultSet.next();
  }

  /**
   * @param index zero based column index
   * @return the value of the column in the row the driver is positioned on
   */
  protected Object value(int index) throws SQLException {
    return resultSet.getObject(index + 1);
  }

  private boolean advance() throws SQLException {
    boolean found = fetch();
    if (found && log.isTraceEnabled()) {
      traceRow();
    }
    return found;
  }

  private void traceRow() throws SQLException {
    if (!headerTraced) {
      headerTraced = true;
      StringJoiner header = new StringJoiner(", ", "   Columns: ", "");
      getFieldNames().forEach(header::add);
      log.trace(header.toString());
    }
    StringJoiner row = new StringJoiner(", ", "       Row: ", "");
    for (int i = 0; i < getFieldCount(); i++) {
      row.add(String.valueOf(value(i)));
    }
    log.trace(row.toString());
  }

  /**
   * Restores the default fetch mode, object type and column selector.
   */
  protected void resetFetchMode() {
    fetchMode = FetchMode.ORDERED;
    fetchClass = RowObject.class;
    columnSelector = 0;
  }

  /**
   * Iterates from the first row in the configured mode.
   */
  @Override
  public Iterator<Object> iterator() {
    if (rowCount > 0) {
      rewind();
    }
    return new Iterator<Object>() {
      @Override
      public boolean hasNext() {
        return valid();
      }

      @Override
      public Object next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return ResultCursor.this.next();
      }
    };
  }

  @Override
  public void close() {
    try {
      resultSet.close();
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  public boolean isClosed() {
    try {
      return resultSet.isClosed();
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

}
