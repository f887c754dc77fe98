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

/**
 * Where and as whom to connect. Every field is optional; the driver applies its defaults for missing ones.
 */
public class ConnectionInfo {

  private String hostname;
  private String username;
  private String password;
  private String database;
  private Integer port;
  private String socket;

  public ConnectionInfo() {
  }

  public ConnectionInfo(String hostname, String username, String password, String database) {
    this.hostname = hostname;
    this.username = username;
    this.password = password;
    this.database = database;
  }

  /**
   * @return the host name or IP address, null or "localhost" for the local host
   */
  public String getHostname() {
    return hostname;
  }

  public void setHostname(String hostname) {
    this.hostname = hostname;
  }

  public String getUsername() {
    return username;
  }

  public void setUsername(String username) {
    this.username = username;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  /**
   * @return the default database used by queries
   */
  public String getDatabase() {
    return database;
  }

  public void setDatabase(String database) {
    this.database = database;
  }

  public Integer getPort() {
    return port;
  }

  public void setPort(Integer port) {
    this.port = port;
  }

  /**
   * @return the socket or named pipe to connect through instead of TCP
   */
  public String getSocket() {
    return socket;
  }

  public void setSocket(String socket) {
    this.socket = socket;
  }

  @Override
  public String toString() {
    return "ConnectionInfo{hostname=" + hostname + ", username=" + username + ", database=" + database
        + ", port=" + port + ", socket=" + socket + "}";
  }

}
