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

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;

/**
 * Translates driver exceptions into {@link DbException}s using the MySQL server error codes.
 */
public class ExceptionFactory {

  private static final Map<Integer, ErrorKind> ERROR_MAP = new HashMap<>();

  static {
    register(ErrorKind.CANNOT_CREATE, 1004, 1005, 1006);
    register(ErrorKind.ALREADY_EXISTS, 1007, 1022, 1050, 1061, 1062);
    register(ErrorKind.CANNOT_DROP, 1008);
    register(ErrorKind.ACCESS_VIOLATION, 1044, 1142);
    register(ErrorKind.NO_DB_SELECTED, 1046);
    register(ErrorKind.CONSTRAINT, 1048, 1216, 1217, 1451, 1452);
    register(ErrorKind.NO_SUCH_DB, 1049);
    register(ErrorKind.NO_SUCH_TABLE, 1051, 1146);
    register(ErrorKind.NO_SUCH_FIELD, 1054);
    register(ErrorKind.SYNTAX_ERROR, 1064);
    register(ErrorKind.NOT_FOUND, 1091);
    register(ErrorKind.NOT_LOCKED, 1100, 1205);
    register(ErrorKind.VALUE_COUNT_ON_ROW, 1136);
    register(ErrorKind.DIVISION_BY_ZERO, 1356, 1365);
    register(ErrorKind.NOT_PREPARED, 2030);
  }

  private ExceptionFactory() {
    // Prevent Instantiation
  }

  private static void register(ErrorKind kind, int... codes) {
    for (int code : codes) {
      ERROR_MAP.put(code, kind);
    }
  }

  /**
   * @param errorCode the MySQL vendor error code
   * @return the mapped kind, {@link ErrorKind#SQL_ERROR} for unknown codes
   */
  public static ErrorKind kindOf(int errorCode) {
    ErrorKind kind = ERROR_MAP.get(errorCode);
    return kind == null ? ErrorKind.SQL_ERROR : kind;
  }

  public static DbException wrapException(String query, SQLException e) {
    StringBuilder message = new StringBuilder(String.valueOf(e.getMessage()));
    if (query != null) {
      message.append(" [query: ").append(query).append(']');
    }
    return new DbException(kindOf(e.getErrorCode()), message.toString(), e.getErrorCode(), e.getSQLState(), e);
  }

  public static DbException connectFailed(SQLException e) {
    return new DbException(ErrorKind.CONNECT_FAILED, "Cannot connect to the database: " + e.getMessage(),
        e.getErrorCode(), e.getSQLState(), e);
  }

}
