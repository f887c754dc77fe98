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
 * Behaviour switches of a {@link DbConnection}.
 */
public class ConnectionOptions {

  /**
   * Use the compressed client/server protocol.
   */
  private boolean compression;
  /**
   * Encrypt the connection.
   */
  private boolean ssl;
  /**
   * Report matched rows instead of changed rows as the affected row count.
   */
  private boolean foundRows;
  /**
   * Allow spaces after function names.
   */
  private boolean ignoreSpace;
  /**
   * Refuse write queries, see {@link DbConnection#setReadOnly(boolean)}.
   */
  private boolean readOnly;
  /**
   * Record every command in the {@link org.mydbd.logging.query.QueryLogger}.
   */
  private boolean queryLog;
  /**
   * Make {@link DbConnection#query(String, Object...)} share prepared statements through
   * {@link DbConnection#prepareCached(String, ParamType...)}.
   */
  private boolean queryPrepareCache;
  /**
   * Connection timeout in seconds, 0 for the driver default.
   */
  private int connectTimeout;
  /**
   * Seconds the server waits on an idle connection before closing it, 0 for the server default.
   */
  private int waitTimeout;
  /**
   * Use interactive_timeout instead of wait_timeout on the server side.
   */
  private boolean clientInteractive;

  public boolean isCompression() {
    return compression;
  }

  public void setCompression(boolean compression) {
    this.compression = compression;
  }

  public boolean isSsl() {
    return ssl;
  }

  public void setSsl(boolean ssl) {
    this.ssl = ssl;
  }

  public boolean isFoundRows() {
    return foundRows;
  }

  public void setFoundRows(boolean foundRows) {
    this.foundRows = foundRows;
  }

  public boolean isIgnoreSpace() {
    return ignoreSpace;
  }

  public void setIgnoreSpace(boolean ignoreSpace) {
    this.ignoreSpace = ignoreSpace;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  public void setReadOnly(boolean readOnly) {
    this.readOnly = readOnly;
  }

  public boolean isQueryLog() {
    return queryLog;
  }

  public void setQueryLog(boolean queryLog) {
    this.queryLog = queryLog;
  }

  public boolean isQueryPrepareCache() {
    return queryPrepareCache;
  }

  public void setQueryPrepareCache(boolean queryPrepareCache) {
    this.queryPrepareCache = queryPrepareCache;
  }

  public int getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(int connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public int getWaitTimeout() {
    return waitTimeout;
  }

  public void setWaitTimeout(int waitTimeout) {
    this.waitTimeout = waitTimeout;
  }

  public boolean isClientInteractive() {
    return clientInteractive;
  }

  public void setClientInteractive(boolean clientInteractive) {
    this.clientInteractive = clientInteractive;
  }

}
