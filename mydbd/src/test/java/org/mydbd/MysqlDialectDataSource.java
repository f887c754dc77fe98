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
package org.mydbd;

import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import javax.sql.DataSource;

import org.h2.jdbcx.JdbcDataSource;

/**
 * In-memory H2 database in MySQL mode. Connections are proxies that rewrite the MySQL only
 * {@code SHOW ENGINES} and {@code SHOW SLAVE STATUS} commands into queries on the {@code engines} and
 * {@code slave_status} tables.
 */
public class MysqlDialectDataSource implements DataSource {

  private static final AtomicInteger DATABASES = new AtomicInteger();

  private final JdbcDataSource h2 = new JdbcDataSource();
  private final Map<String, String> rewrites = new LinkedHashMap<>();
  private final AtomicInteger connections = new AtomicInteger();
  private Connection lastConnection;

  public MysqlDialectDataSource() {
    h2.setURL("jdbc:h2:mem:mydbd" + DATABASES.incrementAndGet()
        + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
    h2.setUser("sa");
    h2.setPassword("");
    rewrites.put("SHOW ENGINES", "SELECT engine, support FROM engines");
    rewrites.put("SHOW SLAVE STATUS", "SELECT * FROM slave_status");
  }

  /**
   * Runs setup statements on a connection of its own.
   */
  public void run(String... sql) {
    try (Connection connection = h2.getConnection(); Statement statement = connection.createStatement()) {
      for (String command : sql) {
        statement.execute(command);
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Setup failed", e);
    }
  }

  public int getConnectionCount() {
    return connections.get();
  }

  public Connection getLastConnection() {
    return lastConnection;
  }

  String rewrite(String sql) {
    String head = sql.trim().toUpperCase(Locale.ROOT);
    for (Map.Entry<String, String> rewrite : rewrites.entrySet()) {
      if (head.startsWith(rewrite.getKey())) {
        return rewrite.getValue();
      }
    }
    return sql;
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection connection = h2.getConnection();
    connections.incrementAndGet();
    lastConnection = (Connection) Proxy.newProxyInstance(getClass().getClassLoader(),
        new Class<?>[] { Connection.class }, new RewritingHandler(connection, true));
    return lastConnection;
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    return getConnection();
  }

  @Override
  public PrintWriter getLogWriter() {
    return null;
  }

  @Override
  public void setLogWriter(PrintWriter out) {
    // not used
  }

  @Override
  public void setLoginTimeout(int seconds) {
    // not used
  }

  @Override
  public int getLoginTimeout() {
    return 0;
  }

  @Override
  public Logger getParentLogger() {
    return Logger.getLogger(Logger.GLOBAL_LOGGER_NAME);
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    throw new SQLException(getClass().getName() + " is not a wrapper.");
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return false;
  }

  private class RewritingHandler implements InvocationHandler {

    private final Object target;
    private final boolean connection;

    RewritingHandler(Object target, boolean connection) {
      this.target = target;
      this.connection = connection;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      String name = method.getName();
      if (args != null && args.length > 0 && args[0] instanceof String
          && (name.startsWith("execute") || name.equals("prepareStatement") || name.equals("addBatch"))) {
        args[0] = rewrite((String) args[0]);
      }
      try {
        Object result = method.invoke(target, args);
        if (connection && name.equals("createStatement")) {
          return Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] { Statement.class },
              new RewritingHandler(result, false));
        }
        return result;
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    }
  }

}
