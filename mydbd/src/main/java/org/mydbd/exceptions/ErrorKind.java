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
 * Named failure categories. Driver failures are translated to one of these by
 * {@link ExceptionFactory}; the others are raised by the library itself.
 */
public enum ErrorKind {

  CONNECT_FAILED,
  NOT_CONNECTED,
  READ_ONLY_VIOLATION,
  FROZEN_STATEMENT,
  PARAM_MISMATCH,
  TYPE_MISMATCH,
  NOT_PREPARED,
  TRUNCATED_RESULT,
  NO_SUCH_FIELD,
  OUT_OF_RANGE,
  INVALID_ARGUMENT,
  UNSUPPORTED,

  // mapped from driver error codes
  ALREADY_EXISTS,
  NO_SUCH_TABLE,
  NO_SUCH_DB,
  SYNTAX_ERROR,
  NOT_LOCKED,
  NOT_FOUND,
  CANNOT_CREATE,
  CANNOT_DROP,
  ACCESS_VIOLATION,
  NO_DB_SELECTED,
  CONSTRAINT,
  VALUE_COUNT_ON_ROW,
  DIVISION_BY_ZERO,

  /**
   * A driver error without a dedicated kind. The raw code, message and SQLSTATE are kept on the exception.
   */
  SQL_ERROR

}
