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
package org.mydbd.session;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;

import org.mydbd.cursor.ResultCursor;
import org.mydbd.cursor.StatementResultCursor;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.exceptions.ExceptionFactory;
import org.mydbd.logging.Log;
import org.mydbd.logging.LogFactory;
import org.mydbd.logging.query.QueryCommand;
import org.mydbd.logging.query.QueryLogger;

/**
 * A server side prepared query, executed one or several times with different parameters.
 *
 * <pre>
 * DbStatement sth = dbh.prepare("INSERT INTO users (name, age) VALUES (?, ?)");
 * sth.execute("alice", 31);
 * sth.execute("bob", 27);
 * </pre>
 *
 * <p>The statement owns at most one {@link StatementResultCursor}. Every execution that yields rows
 * resets and returns that same cursor, so rows of an execution must be read before the next one.
 */
public class DbStatement implements AutoCloseable {

  private static final Log log = LogFactory.getLog(DbStatement.class);

  private final DbConnection owner;

  private Connection connection;
  private PreparedStatement statement;
  private String preparedQuery;
  private int paramCount;
  private ParamType[] paramTypes;
  private boolean frozen;
  private StatementResultCursor resultCursor;
  private int affectedRows = -1;

  DbStatement(DbConnection owner) {
    this.owner = owner;
  }

  /**
   * Prepares a query for execution.
   *
   * <p>Markers ({@code ?}) are legal only where the server accepts them: in the VALUES() list of an
   * INSERT or in a comparison of a WHERE clause for instance, never for identifiers. Checking this is
   * left to the driver.
   *
   * @param query the SQL query
   * @param typeHints the type of every marker; if omitted, types are guessed from the values of the
   *        first {@link #execute(Object...)} call
   * @throws DbException {@link ErrorKind#FROZEN_STATEMENT} if the statement was frozen,
   *         {@link ErrorKind#TYPE_MISMATCH} if the number of hints differs from the number of markers
   */
  public DbStatement prepare(String query, ParamType... typeHints) {
    if (frozen) {
      throw new DbException(ErrorKind.FROZEN_STATEMENT, "Cannot prepare a frozen statement: " + preparedQuery);
    }
    long start = System.nanoTime();
    Connection link = owner.link();
    PreparedStatement prepared;
    int markers;
    try {
      prepared = link.prepareStatement(query, ResultSet.TYPE_SCROLL_INSENSITIVE, ResultSet.CONCUR_READ_ONLY);
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(query, e);
    }
    try {
      markers = prepared.getParameterMetaData().getParameterCount();
    } catch (SQLException e) {
      discard(prepared);
      throw ExceptionFactory.wrapException(query, e);
    }
    if (typeHints != null && typeHints.length > 0 && typeHints.length != markers) {
      discard(prepared);
      throw new DbException(ErrorKind.TYPE_MISMATCH, String.format(
          "Wrong type count for prepared statement: %d expected, %d given.", markers, typeHints.length));
    }

    try {
      release();
    } catch (DbException e) {
      discard(prepared);
      throw e;
    }
    this.connection = link;
    this.statement = prepared;
    this.preparedQuery = query;
    this.paramCount = markers;
    this.paramTypes = typeHints == null || typeHints.length == 0 ? null : typeHints.clone();
    this.affectedRows = -1;

    if (owner.getOptions().isQueryLog()) {
      QueryLogger.log(QueryCommand.PREPARE, query, null, QueryLogger.millisSince(start));
    }
    return this;
  }

  /**
   * Executes the prepared query, replacing its markers with {@code params}.
   *
   * <p>The type of the values matters: unless type hints were given, the values of the first call
   * decide how every marker is sent, and later values are converted to those types.
   *
   * @return the statement cursor if the query yields rows, null otherwise
   * @throws DbException {@link ErrorKind#NOT_PREPARED} before {@link #prepare(String, ParamType...)},
   *         {@link ErrorKind#PARAM_MISMATCH} if the number of values differs from the number of markers
   */
  public ResultCursor execute(Object... params) {
    if (preparedQuery == null) {
      throw new DbException(ErrorKind.NOT_PREPARED, "Cannot execute a statement that has not been prepared.");
    }
    Object[] values = params == null ? new Object[0] : params;
    if (values.length != paramCount) {
      throw new DbException(ErrorKind.PARAM_MISMATCH, String.format(
          "Wrong parameter count for prepared statement: %d expected, %d given.", paramCount, values.length));
    }
    long start = System.nanoTime();
    ResultCursor result = null;
    try {
      bindParams(values);
      if (statement.execute()) {
        ResultSet resultSet = statement.getResultSet();
        if (resultCursor == null) {
          resultCursor = new StatementResultCursor(resultSet);
        } else {
          resultCursor.reset(resultSet);
        }
        affectedRows = resultCursor.getRowCount();
        result = resultCursor;
      } else {
        affectedRows = statement.getUpdateCount();
      }
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(preparedQuery, e);
    }
    owner.setLastQueryHandle(this::getAffectedRows);

    if (owner.getOptions().isQueryLog()) {
      QueryLogger.log(QueryCommand.EXECUTE, preparedQuery, Arrays.asList(values), QueryLogger.millisSince(start));
    }
    return result;
  }

  private void bindParams(Object[] values) throws SQLException {
    if (paramTypes == null) {
      paramTypes = new ParamType[values.length];
      for (int i = 0; i < values.length; i++) {
        paramTypes[i] = ParamType.infer(values[i]);
      }
      if (log.isDebugEnabled()) {
        log.debug("Inferred parameter types " + Arrays.toString(paramTypes) + " for: " + preparedQuery);
      }
    }
    for (int i = 0; i < values.length; i++) {
      paramTypes[i].bind(statement, i + 1, values[i]);
    }
  }

  /**
   * Makes the statement immutable: later {@link #prepare(String, ParamType...)} calls fail. Used for
   * statements shared through the connection's statement cache.
   */
  public DbStatement freeze() {
    frozen = true;
    return this;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public String getPreparedQuery() {
    return preparedQuery;
  }

  public int getParamCount() {
    return paramCount;
  }

  /**
   * @return the number of rows changed, deleted or inserted by the last execution, the number of rows
   *         returned for a query yielding rows, -1 before the first execution
   */
  public int getAffectedRows() {
    return affectedRows;
  }

  /**
   * @return true if the statement was prepared on {@code link} and is still open
   */
  boolean isBoundTo(Connection link) {
    try {
      return statement != null && connection == link && !statement.isClosed();
    } catch (SQLException e) {
      return false;
    }
  }

  /**
   * Lets the driver close the statement once its result is closed.
   */
  void closeOnCompletion() {
    try {
      statement.closeOnCompletion();
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(preparedQuery, e);
    }
  }

  private void release() {
    resultCursor = null;
    if (statement != null) {
      PreparedStatement previous = statement;
      statement = null;
      try {
        previous.close();
      } catch (SQLException e) {
        throw ExceptionFactory.wrapException(preparedQuery, e);
      }
    }
  }

  private void discard(PreparedStatement prepared) {
    try {
      prepared.close();
    } catch (SQLException e) {
      if (log.isDebugEnabled()) {
        log.debug("Error closing rejected statement.  Cause: " + e);
      }
    }
  }

  /**
   * Releases the driver statement. The statement must be prepared again before the next execution.
   */
  @Override
  public void close() {
    release();
    preparedQuery = null;
    paramTypes = null;
    paramCount = 0;
  }

  @Override
  public String toString() {
    return "DbStatement{" + preparedQuery + (frozen ? ", frozen" : "") + "}";
  }

}
