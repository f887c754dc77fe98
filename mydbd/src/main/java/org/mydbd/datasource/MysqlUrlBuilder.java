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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

import org.mydbd.session.ConnectionInfo;
import org.mydbd.session.ConnectionOptions;

/**
 * Builds the MySQL Connector/J URL matching a {@link ConnectionInfo} and its {@link ConnectionOptions}.
 */
public final class MysqlUrlBuilder {

  private static final String DEFAULT_HOST = "localhost";

  private MysqlUrlBuilder() {
    // Prevent Instantiation
  }

  public static String build(ConnectionInfo info, ConnectionOptions options) {
    StringBuilder url = new StringBuilder("jdbc:mysql://");
    url.append(info.getHostname() == null ? DEFAULT_HOST : info.getHostname());
    if (info.getPort() != null) {
      url.append(':').append(info.getPort());
    }
    url.append('/');
    if (info.getDatabase() != null) {
      url.append(encode(info.getDatabase()));
    }
    StringJoiner query = new StringJoiner("&", "?", "");
    for (Map.Entry<String, String> parameter : parameters(info, options).entrySet()) {
      query.add(parameter.getKey() + "=" + encode(parameter.getValue()));
    }
    return url.append(query).toString();
  }

  static Map<String, String> parameters(ConnectionInfo info, ConnectionOptions options) {
    Map<String, String> parameters = new LinkedHashMap<>();
    if (options.isCompression()) {
      parameters.put("useCompression", "true");
    }
    parameters.put("sslMode", options.isSsl() ? "REQUIRED" : "DISABLED");
    // Connector/J reports found rows unless told otherwise
    parameters.put("useAffectedRows", String.valueOf(!options.isFoundRows()));
    if (options.isClientInteractive()) {
      parameters.put("interactiveClient", "true");
    }
    if (options.getConnectTimeout() > 0) {
      parameters.put("connectTimeout", String.valueOf(options.getConnectTimeout() * 1000));
    }
    if (info.getSocket() != null) {
      parameters.put("socketFactory", "com.mysql.cj.protocol.NamedPipeSocketFactory");
      parameters.put("namedPipePath", info.getSocket());
    }
    return parameters;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

}
