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
package org.mydbd.exceptions;

/**
 * Base unchecked exception of the library.
 */
public class DbException extends RuntimeException {

  private static final long serialVersionUID = -4431876270343632563L;

  private final ErrorKind kind;
  private final int errorCode;
  private final String sqlState;

  public DbException(ErrorKind kind, String message) {
    this(kind, message, 0, null, null);
  }

  public DbException(ErrorKind kind, String message, Throwable cause) {
    this(kind, message, 0, null, cause);
  }

  public DbException(ErrorKind kind, String message, int errorCode, String sqlState, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.errorCode = errorCode;
    this.sqlState = sqlState;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * @return the vendor error code reported by the driver, 0 when the error did not come from the driver
   */
  public int getErrorCode() {
    return errorCode;
  }

  public String getSqlState() {
    return sqlState;
  }

}
