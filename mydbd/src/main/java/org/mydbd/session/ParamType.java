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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;

/**
 * How a statement parameter is sent to the server.
 */
public enum ParamType {

  STRING {
    @Override
    void bind(PreparedStatement ps, int index, Object value) throws SQLException {
      if (value == null) {
        ps.setNull(index, Types.VARCHAR);
      } else if (value instanceof byte[]) {
        ps.setBytes(index, (byte[]) value);
      } else {
        ps.setString(index, String.valueOf(value));
      }
    }
  },

  INTEGER {
    @Override
    void bind(PreparedStatement ps, int index, Object value) throws SQLException {
      if (value == null) {
        ps.setNull(index, Types.BIGINT);
      } else {
        BigDecimal integral = toIntegral(toNumber(value, this), this);
        if (integral.compareTo(LONG_MIN) >= 0 && integral.compareTo(LONG_MAX) <= 0) {
          ps.setLong(index, integral.longValueExact());
        } else {
          // BIGINT UNSIGNED and DECIMAL columns hold values past the long range
          ps.setBigDecimal(index, integral);
        }
      }
    }
  },

  DOUBLE {
    @Override
    void bind(PreparedStatement ps, int index, Object value) throws SQLException {
      if (value == null) {
        ps.setNull(index, Types.DOUBLE);
      } else {
        ps.setDouble(index, toNumber(value, this).doubleValue());
      }
    }
  };

  /**
   * Sets {@code value} as parameter {@code index} (1 based), coerced to this type.
   */
  abstract void bind(PreparedStatement ps, int index, Object value) throws SQLException;

  /**
   * Guesses the type from a Java value: integral numbers are {@link #INTEGER}, floating point numbers
   * {@link #DOUBLE}, anything else (null included) {@link #STRING}.
   */
  public static ParamType infer(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
        || value instanceof BigInteger) {
      return INTEGER;
    }
    if (value instanceof Double || value instanceof Float) {
      return DOUBLE;
    }
    return STRING;
  }

  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private static BigDecimal toIntegral(Number number, ParamType type) {
    if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
      return BigDecimal.valueOf(number.longValue());
    }
    if (number instanceof BigInteger) {
      return new BigDecimal((BigInteger) number);
    }
    try {
      BigDecimal decimal = number instanceof BigDecimal ? (BigDecimal) number : new BigDecimal(number.toString());
      return decimal.setScale(0, RoundingMode.DOWN);
    } catch (NumberFormatException e) {
      throw new DbException(ErrorKind.TYPE_MISMATCH, "Cannot bind '" + number + "' as " + type, e);
    }
  }

  private static Number toNumber(Object value, ParamType type) {
    if (value instanceof Number) {
      return (Number) value;
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? 1 : 0;
    }
    try {
      return new BigDecimal(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new DbException(ErrorKind.TYPE_MISMATCH, "Cannot bind '" + value + "' as " + type, e);
    }
  }

}
