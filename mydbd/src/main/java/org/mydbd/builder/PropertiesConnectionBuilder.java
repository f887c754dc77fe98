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
package org.mydbd.builder;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;
import org.mydbd.parsing.PropertyParser;
import org.mydbd.session.ConnectionInfo;
import org.mydbd.session.ConnectionOptions;
import org.mydbd.session.DbConnection;

/**
 * Builds a {@link DbConnection} from {@code mydbd.*} properties.
 *
 * <pre>
 * mydbd.hostname=db1.internal
 * mydbd.username=${db.user}
 * mydbd.password=${db.password}
 * mydbd.database=shop
 * mydbd.port=${db.port:3306}
 * mydbd.readOnly=true
 * mydbd.queryLog=false
 * </pre>
 *
 * <p>Values may reference {@code ${name}} placeholders, resolved against the variables given to the
 * builder, then against system properties. {@code ${name:default}} supplies a default.
 */
public class PropertiesConnectionBuilder {

  public static final String PREFIX = "mydbd.";

  private final Properties properties;
  private final Properties variables;

  public PropertiesConnectionBuilder(Properties properties) {
    this(properties, null);
  }

  public PropertiesConnectionBuilder(Properties properties, Properties variables) {
    this.properties = properties;
    this.variables = variables;
  }

  public PropertiesConnectionBuilder(InputStream inputStream, Properties variables) {
    this(load(inputStream), variables);
  }

  /**
   * Reads the properties from a classpath resource.
   */
  public static PropertiesConnectionBuilder fromResource(String resource, Properties variables) {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = PropertiesConnectionBuilder.class.getClassLoader();
    }
    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new DbException(ErrorKind.INVALID_ARGUMENT, "Could not find resource " + resource);
      }
      return new PropertiesConnectionBuilder(in, variables);
    } catch (IOException e) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Error reading resource " + resource + ".  Cause: " + e, e);
    }
  }

  private static Properties load(InputStream inputStream) {
    Properties properties = new Properties();
    try {
      properties.load(inputStream);
    } catch (IOException e) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Error reading connection properties.  Cause: " + e, e);
    }
    return properties;
  }

  public DbConnection build() {
    return new DbConnection(buildConnectionInfo(), buildOptions());
  }

  public ConnectionInfo buildConnectionInfo() {
    ConnectionInfo info = new ConnectionInfo(value("hostname"), value("username"), value("password"), value("database"));
    String port = value("port");
    if (port != null) {
      info.setPort(intValue("port", port));
    }
    info.setSocket(value("socket"));
    return info;
  }

  public ConnectionOptions buildOptions() {
    ConnectionOptions options = new ConnectionOptions();
    options.setCompression(booleanValue("compression", options.isCompression()));
    options.setSsl(booleanValue("ssl", options.isSsl()));
    options.setFoundRows(booleanValue("foundRows", options.isFoundRows()));
    options.setIgnoreSpace(booleanValue("ignoreSpace", options.isIgnoreSpace()));
    options.setReadOnly(booleanValue("readOnly", options.isReadOnly()));
    options.setQueryLog(booleanValue("queryLog", options.isQueryLog()));
    options.setQueryPrepareCache(booleanValue("queryPrepareCache", options.isQueryPrepareCache()));
    options.setClientInteractive(booleanValue("clientInteractive", options.isClientInteractive()));
    String connectTimeout = value("connectTimeout");
    if (connectTimeout != null) {
      options.setConnectTimeout(intValue("connectTimeout", connectTimeout));
    }
    String waitTimeout = value("waitTimeout");
    if (waitTimeout != null) {
      options.setWaitTimeout(intValue("waitTimeout", waitTimeout));
    }
    return options;
  }

  private String value(String key) {
    String raw = properties.getProperty(PREFIX + key);
    if (raw == null) {
      return null;
    }
    String value = PropertyParser.parse(raw, variables).trim();
    return value.isEmpty() ? null : value;
  }

  private boolean booleanValue(String key, boolean defaultValue) {
    String value = value(key);
    if (value == null) {
      return defaultValue;
    }
    switch (value.toLowerCase(Locale.ENGLISH)) {
      case "true":
      case "yes":
      case "on":
      case "1":
        return true;
      case "false":
      case "no":
      case "off":
      case "0":
        return false;
      default:
        throw new DbException(ErrorKind.INVALID_ARGUMENT, "Invalid boolean for " + PREFIX + key + ": " + value);
    }
  }

  private static int intValue(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT, "Invalid number for " + PREFIX + key + ": " + value, e);
    }
  }

}
