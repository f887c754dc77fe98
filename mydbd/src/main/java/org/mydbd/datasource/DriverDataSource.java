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
package org.mydbd.datasource;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.logging.Logger;

import javax.sql.DataSource;

import org.mydbd.logging.Log;
import org.mydbd.logging.LogFactory;

/**
 * Opens a new driver connection on every {@link #getConnection()} call. No pooling.
 */
public class DriverDataSource implements DataSource {

  private static final Log log = LogFactory.getLog(DriverDataSource.class);

  private final String url;
  private final Properties driverProperties;

  public DriverDataSource(String url) {
    this(url, new Properties());
  }

  public DriverDataSource(String url, String username, String password) {
    this(url, credentials(username, password));
  }

  public DriverDataSource(String url, Properties driverProperties) {
    this.url = url;
    this.driverProperties = driverProperties;
  }

  private static Properties credentials(String username, String password) {
    Properties properties = new Properties();
    if (username != null) {
      properties.setProperty("user", username);
    }
    if (password != null) {
      properties.setProperty("password", password);
    }
    return properties;
  }

  @Override
  public Connection getConnection() throws SQLException {
    if (log.isDebugEnabled()) {
      log.debug("Opening JDBC Connection to " + url);
    }
    return DriverManager.getConnection(url, driverProperties);
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    Properties properties = new Properties();
    properties.putAll(driverProperties);
    properties.putAll(credentials(username, password));
    return DriverManager.getConnection(url, properties);
  }

  public String getUrl() {
    return url;
  }

  public Properties getDriverProperties() {
    return driverProperties;
  }

  @Override
  public void setLoginTimeout(int loginTimeout) {
    DriverManager.setLoginTimeout(loginTimeout);
  }

  @Override
  public int getLoginTimeout() {
    return DriverManager.getLoginTimeout();
  }

  @Override
  public void setLogWriter(PrintWriter logWriter) {
    DriverManager.setLogWriter(logWriter);
  }

  @Override
  public PrintWriter getLogWriter() {
    return DriverManager.getLogWriter();
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    throw new SQLException(getClass().getName() + " is not a wrapper.");
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) {
    return false;
  }

  @Override
  public Logger getParentLogger() {
    return Logger.getLogger(Logger.GLOBAL_LOGGER_NAME);
  }

}
