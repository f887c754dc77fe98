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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.IntSupplier;
import java.util.regex.Pattern;

import javax.sql.DataSource;

import org.mydbd.compat.LegacyFetchMode;
import org.mydbd.compat.PearCompatConnection;
import org.mydbd.cursor.FetchMode;
import org.mydbd.cursor.ResultCursor;
import org.mydbd.datasource.DriverDataSource;
import org.mydbd.datasource.MysqlUrlBuilder;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.exceptions.ExceptionFactory;
import org.mydbd.logging.Log;
import org.mydbd.logging.LogFactory;
import org.mydbd.logging.query.QueryCommand;
import org.mydbd.logging.query.QueryLogger;

/**
 * A connection to a MySQL server.
 *
 * <p>The driver connection is opened lazily: constructing a {@code DbConnection} does not touch the
 * network, the first operation that needs the server does. A connection found dead by that check is
 * re-opened before the operation runs.
 *
 * <pre>
 * DbConnection dbh = new DbConnection(new ConnectionInfo("localhost", "user", "secret", "shop"));
 * try (ResultCursor res = dbh.query("SELECT id, name FROM users WHERE age &gt; ?", 18)) {
 *   for (Object row : res.setFetchMode(FetchMode.ASSOC)) {
 *     ...
 *   }
 * }
 * </pre>
 *
 * <p>A connection is not thread safe.
 */
@SuppressWarnings("deprecation")
public class DbConnection implements PearCompatConnection, AutoCloseable {

  private static final Log log = LogFactory.getLog(DbConnection.class);

  /** Server default for {@code wait_timeout}, in seconds. */
  public static final int DEFAULT_WAIT_TIMEOUT = 28800;

  private static final int PING_TIMEOUT = 5;

  private static final Pattern WRITE_QUERY = Pattern.compile(
      "^\\s*(insert|delete|update|replace|create)\\s", Pattern.CASE_INSENSITIVE);
  private static final Pattern NOT_REPLICATED_TABLE = Pattern.compile(
      "^\\s*(?:(?:insert|replace)(?:\\s+ignore)?(?:\\s+into)?|delete\\s+from|update(?:\\s+ignore)?"
          + "|create\\s+table(?:\\s+if\\s+not\\s+exists)?)\\s+`?norepli_\\w+",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern TEMPORARY_TABLE = Pattern.compile(
      "^\\s*create\\s+temporary\\s+", Pattern.CASE_INSENSITIVE);

  private final DataSource dataSource;
  private final ConnectionOptions options;

  private Connection link;
  private boolean connected;

  private final Map<String, DbStatement> statementCache = new HashMap<>();
  private final Map<String, String> extendedConnectionInfo = new LinkedHashMap<>();
  private final Map<String, String> extendedQueryInfo = new LinkedHashMap<>();

  private IntSupplier lastQueryHandle;

  private Boolean realtime;
  private boolean replicationDelayProbed;
  private Integer replicationDelay;
  private Set<String> engines;

  private LegacyFetchMode defaultFetchMode;

  public DbConnection(ConnectionInfo connectionInfo) {
    this(connectionInfo, new ConnectionOptions());
  }

  public DbConnection(ConnectionInfo connectionInfo, ConnectionOptions options) {
    this(new DriverDataSource(MysqlUrlBuilder.build(connectionInfo, options), connectionInfo.getUsername(),
        connectionInfo.getPassword()), options);
  }

  /**
   * Wraps any JDBC data source. The MySQL specific {@link ConnectionOptions} (compression, ssl, found rows,
   * interactive client, connect timeout) are then up to the data source; the others still apply.
   */
  public DbConnection(DataSource dataSource, ConnectionOptions options) {
    if (dataSource == null) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "A data source is required");
    }
    this.dataSource = dataSource;
    this.options = options == null ? new ConnectionOptions() : options;
  }

  /**
   * Opens the driver connection, closing a previous one if any.
   *
   * @throws DbException {@link ErrorKind#CONNECT_FAILED} if the server refuses the connection
   */
  public DbConnection connect() {
    releaseLink();
    try {
      link = dataSource.getConnection();
    } catch (SQLException e) {
      throw ExceptionFactory.connectFailed(e);
    }
    connected = true;
    if (log.isDebugEnabled()) {
      log.debug("Opened JDBC Connection [" + link + "]");
    }
    if (options.getWaitTimeout() > 0) {
      executeCommand(link, "SET wait_timeout=" + options.getWaitTimeout());
    }
    if (options.isIgnoreSpace()) {
      executeCommand(link, "SET SESSION sql_mode = CONCAT(@@sql_mode, ',IGNORE_SPACE')");
    }
    return this;
  }

  Connection link() {
    return link(true);
  }

  /**
   * Returns the live driver connection.
   *
   * @param autoconnect connect (again) if there is no live connection
   * @throws DbException {@link ErrorKind#NOT_CONNECTED} if there is no live connection and
   *         {@code autoconnect} is false
   */
  Connection link(boolean autoconnect) {
    if (!connected || !isAlive()) {
      if (!autoconnect) {
        throw new DbException(ErrorKind.NOT_CONNECTED, "Not connected to the database");
      }
      connect();
    }
    return link;
  }

  private boolean isAlive() {
    try {
      return link.isValid(PING_TIMEOUT);
    } catch (SQLException e) {
      if (log.isDebugEnabled()) {
        log.debug("Connection check failed for [" + link + "].  Cause: " + e);
      }
      return false;
    }
  }

  ConnectionOptions getOptions() {
    return options;
  }

  void setLastQueryHandle(IntSupplier lastQueryHandle) {
    this.lastQueryHandle = lastQueryHandle;
  }

  /**
   * Sends a query to the server.
   *
   * <p>Without parameters the query is sent as is. With parameters, it is prepared and executed with
   * them, through the statement cache when the {@code queryPrepareCache} option is set.
   *
   * @return a cursor over the rows, null for queries yielding no rows
   * @throws DbException {@link ErrorKind#READ_ONLY_VIOLATION} for a write query on a read only connection
   */
  public ResultCursor query(String query, Object... params) {
    String sql = injectExtendedInfo(query);
    if (isReadOnly()) {
      checkReadOnlyQuery(sql);
    }
    if (params != null && params.length > 0) {
      if (options.isQueryPrepareCache()) {
        return prepareCached(sql).execute(params);
      }
      DbStatement statement = prepare(sql);
      ResultCursor result = statement.execute(params);
      if (result == null) {
        statement.close();
      } else {
        statement.closeOnCompletion();
      }
      return result;
    }

    long start = System.nanoTime();
    Statement statement = null;
    ResultCursor result = null;
    int affected;
    try {
      statement = link().createStatement(ResultSet.TYPE_SCROLL_INSENSITIVE, ResultSet.CONCUR_READ_ONLY);
      if (statement.execute(sql)) {
        result = new ResultCursor(statement.getResultSet());
        statement.closeOnCompletion();
        affected = result.getRowCount();
      } else {
        affected = statement.getUpdateCount();
        statement.close();
      }
    } catch (SQLException e) {
      DbException failure = ExceptionFactory.wrapException(sql, e);
      closeAfterFailure(statement, failure);
      throw failure;
    }
    final int affectedRows = affected;
    lastQueryHandle = () -> affectedRows;

    if (options.isQueryLog()) {
      QueryLogger.log(QueryCommand.QUERY, sql, null, QueryLogger.millisSince(start));
    }
    return result;
  }

  @Override
  public ResultCursor query(String query, List<?> params) {
    return query(query, params == null ? new Object[0] : params.toArray());
  }

  private void closeAfterFailure(Statement statement, DbException failure) {
    if (statement == null) {
      return;
    }
    try {
      statement.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private void checkReadOnlyQuery(String query) {
    if (WRITE_QUERY.matcher(query).find()
        && !NOT_REPLICATED_TABLE.matcher(query).find()
        && !TEMPORARY_TABLE.matcher(query).find()) {
      throw new DbException(ErrorKind.READ_ONLY_VIOLATION, "Write query on a read only connection: " + query);
    }
  }

  /**
   * Prepares a query for execution.
   *
   * @see DbStatement#prepare(String, ParamType...)
   */
  public DbStatement prepare(String query, ParamType... typeHints) {
    return new DbStatement(this).prepare(query, typeHints);
  }

  /**
   * Same as {@link #prepare(String, ParamType...)} but returns a statement shared by every caller
   * preparing the same query on this connection. The returned statement is frozen.
   */
  public DbStatement prepareCached(String query, ParamType... typeHints) {
    String cacheKey = cacheKey(query);
    Connection current = link();
    DbStatement statement = statementCache.get(cacheKey);
    if (statement != null && statement.isBoundTo(current)) {
      if (log.isDebugEnabled()) {
        log.debug("Reusing cached statement for: " + query);
      }
      return statement;
    }
    statement = prepare(query, typeHints).freeze();
    statementCache.put(cacheKey, statement);
    return statement;
  }

  private static String cacheKey(String query) {
    try {
      MessageDigest md5 = MessageDigest.getInstance("MD5");
      StringBuilder key = new StringBuilder();
      for (byte b : md5.digest(query.getBytes(StandardCharsets.UTF_8))) {
        key.append(String.format("%02x", b));
      }
      return key.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 digest is not available", e);
    }
  }

  /**
   * Turns off auto-commit: queries run in a transaction until {@link #commit()} or {@link #rollback()}.
   */
  @Override
  public void begin() {
    Connection connection = link();
    try {
      if (connection.getAutoCommit()) {
        if (log.isDebugEnabled()) {
          log.debug("Setting autocommit to false on JDBC Connection [" + connection + "]");
        }
        connection.setAutoCommit(false);
      }
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  /**
   * @return true if a transaction was committed, false when auto-commit is on
   */
  public boolean commit() {
    Connection connection = link(false);
    try {
      if (connection.getAutoCommit()) {
        return false;
      }
      if (log.isDebugEnabled()) {
        log.debug("Committing JDBC Connection [" + connection + "]");
      }
      connection.commit();
      return true;
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  /**
   * @return true if a transaction was rolled back, false when auto-commit is on
   */
  public boolean rollback() {
    Connection connection = link(false);
    try {
      if (connection.getAutoCommit()) {
        return false;
      }
      if (log.isDebugEnabled()) {
        log.debug("Rolling back JDBC Connection [" + connection + "]");
      }
      connection.rollback();
      return true;
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(null, e);
    }
  }

  /**
   * Asks the server to kill a thread, see {@link #threadId()}.
   */
  public boolean kill(long processId) {
    executeCommand(link(), "KILL " + processId);
    return true;
  }

  /**
   * @return the server thread id of this connection
   */
  public long threadId() {
    return selectLong(link(), "SELECT CONNECTION_ID()");
  }

  /**
   * @return the id generated for an AUTO_INCREMENT column by the last INSERT, 0 if none
   */
  public long getInsertId() {
    return selectLong(link(false), "SELECT LAST_INSERT_ID()");
  }

  private void executeCommand(Connection connection, String command) {
    try (Statement statement = connection.createStatement()) {
      statement.execute(command);
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(command, e);
    }
  }

  private long selectLong(Connection connection, String query) {
    try (Statement statement = connection.createStatement(); ResultSet rs = statement.executeQuery(query)) {
      return rs.next() ? rs.getLong(1) : 0L;
    } catch (SQLException e) {
      throw ExceptionFactory.wrapException(query, e);
    }
  }

  /**
   * Checks the connection to the server. Does not reconnect.
   *
   * @return false if there is no live connection
   */
  public boolean ping() {
    try {
      link(false);
      return true;
    } catch (DbException e) {
      if (e.getKind() != ErrorKind.NOT_CONNECTED) {
        throw e;
      }
      return false;
    }
  }

  /**
   * Closes the driver connection.
   *
   * @return true on success, false if the driver failed to close it, null if it was not connected
   */
  public Boolean disconnect() {
    if (!connected) {
      return null;
    }
    Connection connection = link;
    link = null;
    connected = false;
    try {
      connection.close();
      if (log.isDebugEnabled()) {
        log.debug("Closed JDBC Connection [" + connection + "]");
      }
      return true;
    } catch (SQLException e) {
      log.warn("Error closing JDBC Connection [" + connection + "].  Cause: " + e);
      return false;
    }
  }

  private void releaseLink() {
    if (link != null) {
      Connection stale = link;
      link = null;
      connected = false;
      try {
        stale.close();
      } catch (SQLException e) {
        if (log.isDebugEnabled()) {
          log.debug("Error closing stale JDBC Connection [" + stale + "].  Cause: " + e);
        }
      }
    }
  }

  /**
   * Closes the cached statements, then the driver connection.
   */
  @Override
  public void close() {
    List<DbStatement> cached = new ArrayList<>(statementCache.values());
    statementCache.clear();
    if (connected) {
      for (DbStatement statement : cached) {
        statement.close();
      }
    }
    disconnect();
  }

  public boolean isConnected() {
    return connected;
  }

  /**
   * @return the number of rows affected by the last query or statement execution on this connection,
   *         0 before the first one
   */
  @Override
  public int getAffectedRows() {
    return lastQueryHandle == null ? 0 : lastQueryHandle.getAsInt();
  }

  /**
   * Sets how long the server keeps this connection open while idle.
   *
   * @param seconds idle time, the server default when not positive
   */
  public DbConnection setAutoDisconnect(int seconds) {
    query("SET wait_timeout=" + (seconds > 0 ? seconds : DEFAULT_WAIT_TIMEOUT));
    return this;
  }

  /**
   * Annotates the next query only with {@code key:value}, appended as a SQL comment. A null value
   * removes the key.
   */
  public DbConnection setExtendedQueryInfo(String key, String value) {
    putInfo(extendedQueryInfo, key, value);
    return this;
  }

  public DbConnection flushExtendedQueryInfo() {
    extendedQueryInfo.clear();
    return this;
  }

  /**
   * Annotates every query of this connection with {@code key:value}, until flushed. A null value
   * removes the key.
   */
  public DbConnection setExtendedConnectionInfo(String key, String value) {
    putInfo(extendedConnectionInfo, key, value);
    return this;
  }

  public DbConnection flushExtendedConnectionInfo() {
    extendedConnectionInfo.clear();
    return this;
  }

  private static void putInfo(Map<String, String> info, String key, String value) {
    if (key == null) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Extended info key cannot be null");
    }
    if (value == null) {
      info.remove(key);
    } else {
      info.put(key, value);
    }
  }

  private String injectExtendedInfo(String query) {
    if (extendedConnectionInfo.isEmpty() && extendedQueryInfo.isEmpty()) {
      return query;
    }
    Map<String, String> merged = new LinkedHashMap<>(extendedConnectionInfo);
    merged.putAll(extendedQueryInfo);
    extendedQueryInfo.clear();

    StringJoiner annotations = new StringJoiner(", ");
    for (Map.Entry<String, String> entry : merged.entrySet()) {
      annotations.add(entry.getKey() + ":" + entry.getValue());
    }
    // a value must not close the comment
    return query + " /* " + annotations.toString().replace("*/", "*\\/") + " */";
  }

  public boolean isReadOnly() {
    return options.isReadOnly();
  }

  /**
   * In read only mode, write queries fail unless they target a {@code norepli_} table or create a
   * temporary table.
   */
  public DbConnection setReadOnly(boolean readOnly) {
    options.setReadOnly(readOnly);
    return this;
  }

  /**
   * Tells whether the server is up to date with its master. A read write connection always is.
   * The answer is computed once per connection; a failed check counts as not real time.
   */
  public boolean isRealtime() {
    if (realtime == null) {
      Integer delay;
      try {
        delay = getReplicationDelay();
      } catch (DbException e) {
        log.warn("Could not check the replication status, assuming the server is not real time.  Cause: " + e);
        delay = null;
      }
      realtime = delay != null && delay == 0;
    }
    return realtime;
  }

  /**
   * @return seconds the replica lags behind its master, 0 for a read write connection, null when the
   *         server does not report it
   */
  public Integer getReplicationDelay() {
    if (!isReadOnly()) {
      return 0;
    }
    if (!replicationDelayProbed) {
      Integer delay = null;
      try (ResultCursor res = query("SHOW SLAVE STATUS")) {
        Map<String, Object> status = res == null ? null : res.fetchAssoc();
        Object seconds = status == null ? null : status.get("Seconds_Behind_Master");
        if (seconds != null) {
          delay = Integer.valueOf(seconds.toString().trim());
        }
      } catch (NumberFormatException e) {
        throw new DbException(ErrorKind.TYPE_MISMATCH, "Unexpected Seconds_Behind_Master value", e);
      }
      replicationDelay = delay;
      replicationDelayProbed = true;
    }
    return replicationDelay;
  }

  /**
   * @param name a storage engine name, case insensitive
   * @return true if the server supports the engine
   */
  public boolean hasEngine(String name) {
    if (engines == null) {
      Set<String> supported = new HashSet<>();
      try (ResultCursor res = query("SHOW ENGINES")) {
        if (res != null) {
          for (Object row : res.setFetchMode(FetchMode.ORDERED)) {
            List<?> fields = (List<?>) row;
            String support = String.valueOf(fields.get(1));
            if ("YES".equalsIgnoreCase(support) || "DEFAULT".equalsIgnoreCase(support)) {
              supported.add(String.valueOf(fields.get(0)).toLowerCase(Locale.ROOT));
            }
          }
        }
      }
      engines = supported;
      if (log.isDebugEnabled()) {
        log.debug("Supported storage engines: " + engines);
      }
    }
    return name != null && engines.contains(name.toLowerCase(Locale.ROOT));
  }

  @Override
  public void setFetchMode(LegacyFetchMode fetchMode) {
    this.defaultFetchMode = fetchMode;
  }

  @Override
  public LegacyFetchMode getDefaultFetchMode() {
    return defaultFetchMode;
  }

}
