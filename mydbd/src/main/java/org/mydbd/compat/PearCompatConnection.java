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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mydbd.cursor.FetchMode;
import org.mydbd.cursor.ResultCursor;
import org.mydbd.cursor.RowObject;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.session.DbStatement;

/**
 * PEAR::DB flavoured helpers for code written against the old database layer.
 *
 * <p>Every helper runs a query and reads its result in one call. Fetch modes are given as
 * {@link LegacyFetchMode}; {@link LegacyFetchMode#DEFAULT} resolves to the mode set with
 * {@link #setFetchMode(LegacyFetchMode)}, or to {@link LegacyFetchMode#ORDERED}.
 *
 * @deprecated use {@link org.mydbd.session.DbConnection#query(String, Object...)} and the
 *             {@link ResultCursor} API
 */
@Deprecated
public interface PearCompatConnection {

  ResultCursor query(String query, List<?> params);

  int getAffectedRows();

  void begin();

  void setFetchMode(LegacyFetchMode fetchMode);

  LegacyFetchMode getDefaultFetchMode();

  default FetchMode resolveFetchMode(LegacyFetchMode fetchMode) {
    if (fetchMode == null || fetchMode == LegacyFetchMode.DEFAULT) {
      LegacyFetchMode connectionMode = getDefaultFetchMode();
      if (connectionMode == null || connectionMode == LegacyFetchMode.DEFAULT) {
        return FetchMode.ORDERED;
      }
      return connectionMode.toFetchMode();
    }
    return fetchMode.toFetchMode();
  }

  /**
   * Errors are thrown, never returned.
   *
   * @return always false
   */
  default boolean isError(Object value) {
    return false;
  }

  /**
   * @param state false starts a transaction
   * @throws DbException {@link ErrorKind#UNSUPPORTED} when turning auto-commit back on
   */
  default void autoCommit(boolean state) {
    if (state) {
      throw new DbException(ErrorKind.UNSUPPORTED, "autoCommit(true) is not supported, use commit() or rollback()");
    }
    begin();
  }

  default int affectedRows() {
    return getAffectedRows();
  }

  default ResultCursor execute(DbStatement statement, List<?> params) {
    return statement.execute(params == null ? new Object[0] : params.toArray());
  }

  default List<Object> getCol(String query) {
    return getCol(query, 0, Collections.emptyList());
  }

  default List<Object> getCol(String query, Object column) {
    return getCol(query, column, Collections.emptyList());
  }

  /**
   * @param column an {@link Integer} index or a {@link String} column name
   * @return the values of one column of every row
   * @throws DbException {@link ErrorKind#NO_SUCH_FIELD} if the first row has no such column
   */
  default List<Object> getCol(String query, Object column, List<?> params) {
    ResultCursor res = requireResult(query(query, params), query);
    try {
      res.setFetchMode(FetchMode.COLUMN, column);
      Object first = res.current(column instanceof String ? FetchMode.ASSOC : FetchMode.ORDERED);
      if (first != null && !hasField(first, column)) {
        throw new DbException(ErrorKind.NO_SUCH_FIELD, "No such field: " + column);
      }
      return res.fetchAll();
    } finally {
      res.close();
    }
  }

  default Object getOne(String query) {
    return getOne(query, Collections.emptyList());
  }

  /**
   * @return the first column of the first row, null if there is no row
   */
  default Object getOne(String query, List<?> params) {
    ResultCursor res = requireResult(query(query, params), query);
    try {
      return res.fetchColumn(0);
    } finally {
      res.close();
    }
  }

  default Object getRow(String query) {
    return getRow(query, Collections.emptyList(), LegacyFetchMode.DEFAULT);
  }

  /**
   * @return the first row, null if there is no row
   */
  default Object getRow(String query, List<?> params, LegacyFetchMode fetchMode) {
    ResultCursor res = requireResult(query(query, params), query);
    try {
      return res.next(resolveFetchMode(fetchMode));
    } finally {
      res.close();
    }
  }

  default List<Object> getAll(String query) {
    return getAll(query, Collections.emptyList(), LegacyFetchMode.DEFAULT);
  }

  default List<Object> getAll(String query, List<?> params, LegacyFetchMode fetchMode) {
    ResultCursor res = requireResult(query(query, params), query);
    try {
      return res.setFetchMode(resolveFetchMode(fetchMode)).fetchAll();
    } finally {
      res.close();
    }
  }

  default Map<Object, Object> getAssoc(String query) {
    return getAssoc(query, false, Collections.emptyList(), LegacyFetchMode.DEFAULT, false);
  }

  default Map<Object, Object> getAssoc(String query, boolean forceArray) {
    return getAssoc(query, forceArray, Collections.emptyList(), LegacyFetchMode.DEFAULT, false);
  }

  /**
   * Maps the first column of every row to the rest of the row.
   *
   * <p>With exactly two columns, and unless {@code forceArray} is set, the values are the second column.
   * Otherwise the values are the remaining columns, shaped by {@code fetchMode}. With {@code group}, the
   * values of rows sharing a key are collected in a list; otherwise the last row wins.
   *
   * @throws DbException {@link ErrorKind#TRUNCATED_RESULT} if the result has fewer than two columns
   */
  default Map<Object, Object> getAssoc(String query, boolean forceArray, List<?> params,
      LegacyFetchMode fetchMode, boolean group) {
    ResultCursor res = requireResult(query(query, params), query);
    try {
      if (res.getFieldCount() < 2) {
        throw new DbException(ErrorKind.TRUNCATED_RESULT, "At least two columns are required: " + query);
      }
      Map<Object, Object> results = new LinkedHashMap<>();
      FetchMode mode = resolveFetchMode(fetchMode);
      if (res.getFieldCount() == 2 && !forceArray) {
        List<Object> row;
        while ((row = res.fetchArray()) != null) {
          putAssoc(results, row.get(0), row.get(1), group);
        }
      } else if (mode == FetchMode.ASSOC || mode == FetchMode.OBJECT) {
        String keyName = res.getFieldNames().get(0);
        Map<String, Object> row;
        while ((row = res.fetchAssoc()) != null) {
          Map<String, Object> rest = new LinkedHashMap<>(row);
          Object key = rest.remove(keyName);
          putAssoc(results, key, mode == FetchMode.ASSOC ? rest : res.toObject(rest), group);
        }
      } else {
        List<Object> row;
        while ((row = res.fetchArray()) != null) {
          putAssoc(results, row.get(0), new ArrayList<>(row.subList(1, row.size())), group);
        }
      }
      return results;
    } finally {
      res.close();
    }
  }

  @SuppressWarnings("unchecked")
  private static void putAssoc(Map<Object, Object> results, Object key, Object value, boolean group) {
    if (group) {
      ((List<Object>) results.computeIfAbsent(key, k -> new ArrayList<>())).add(value);
    } else {
      results.put(key, value);
    }
  }

  private static boolean hasField(Object row, Object column) {
    if (row instanceof Map) {
      return ((Map<?, ?>) row).containsKey(column);
    }
    if (row instanceof RowObject) {
      return ((RowObject) row).has(String.valueOf(column));
    }
    int index = (Integer) column;
    return index >= 0 && index < ((List<?>) row).size();
  }

  private static ResultCursor requireResult(ResultCursor res, String query) {
    if (res == null) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Query did not return a result set: " + query);
    }
    return res;
  }

}
