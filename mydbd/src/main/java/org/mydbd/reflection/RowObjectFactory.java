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
package org.mydbd.reflection;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import org.mydbd.cursor.RowObject;
import org.mydbd.exceptions.DbException;
import org.mydbd.exceptions.ErrorKind;

/**
 * Materializes a row as an instance of a caller supplied type. Resolution order:
 * <ol>
 *   <li>{@link RowObject} and {@link Map} targets get the row directly;</li>
 *   <li>a public constructor taking a single {@link Map} receives the row;</li>
 *   <li>otherwise the no-arg constructor is used and every column is copied to the
 *   matching setter or field (searched up the class hierarchy). Columns without a
 *   matching property are skipped.</li>
 * </ol>
 */
public final class RowObjectFactory {

  private RowObjectFactory() {
    // Prevent Instantiation of Static Class
  }

  @SuppressWarnings("unchecked")
  public static <T> T create(Class<T> type, Map<String, Object> row) {
    if (type == RowObject.class || type == Object.class) {
      return (T) new RowObject(row);
    }
    if (type.isAssignableFrom(LinkedHashMap.class)) {
      return (T) new LinkedHashMap<>(row);
    }
    try {
      Constructor<T> mapConstructor = findMapConstructor(type);
      if (mapConstructor != null) {
        return mapConstructor.newInstance(row);
      }
      Constructor<T> constructor = type.getDeclaredConstructor();
      if (!constructor.canAccess(null)) {
        constructor.setAccessible(true);
      }
      T target = constructor.newInstance();
      for (Map.Entry<String, Object> column : row.entrySet()) {
        setProperty(type, target, column.getKey(), column.getValue());
      }
      return target;
    } catch (NoSuchMethodException e) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT,
          "Cannot materialize row as " + type.getName() + ": no default constructor and no Map constructor", e);
    } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
      throw new DbException(ErrorKind.INVALID_ARGUMENT,
          "Cannot materialize row as " + type.getName() + ". Cause: " + e, e);
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> Constructor<T> findMapConstructor(Class<T> type) {
    for (Constructor<?> constructor : type.getConstructors()) {
      Class<?>[] parameterTypes = constructor.getParameterTypes();
      if (parameterTypes.length == 1 && parameterTypes[0].isAssignableFrom(LinkedHashMap.class)) {
        return (Constructor<T>) constructor;
      }
    }
    return null;
  }

  private static void setProperty(Class<?> type, Object target, String name, Object value)
      throws IllegalAccessException, InvocationTargetException {
    Method setter = findSetter(type, name);
    if (setter != null) {
      Class<?> parameterType = setter.getParameterTypes()[0];
      if (value == null && parameterType.isPrimitive()) {
        return;
      }
      setter.invoke(target, convert(value, parameterType));
      return;
    }
    // 从当前类开始，不断向父类查找同名字段
    Class<?> parent = type;
    while (parent != null && parent != Object.class) {
      try {
        Field field = parent.getDeclaredField(name);
        if (Modifier.isStatic(field.getModifiers()) || Modifier.isFinal(field.getModifiers())) {
          return;
        }
        if (value == null && field.getType().isPrimitive()) {
          return;
        }
        if (!field.canAccess(target)) {
          field.setAccessible(true);
        }
        field.set(target, convert(value, field.getType()));
        return;
      } catch (NoSuchFieldException e) {
        parent = parent.getSuperclass();
      }
    }
  }

  private static Method findSetter(Class<?> type, String name) {
    if (name.isEmpty()) {
      return null;
    }
    String setterName = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    for (Method method : type.getMethods()) {
      if (method.getName().equals(setterName) && method.getParameterCount() == 1) {
        return method;
      }
    }
    return null;
  }

  static Object convert(Object value, Class<?> targetType) {
    if (value == null) {
      return null;
    }
    Class<?> boxed = box(targetType);
    if (boxed.isInstance(value)) {
      return value;
    }
    if (boxed == String.class) {
      return value.toString();
    }
    if (value instanceof Number || value instanceof String) {
      String text = value.toString().trim();
      try {
        if (boxed == Integer.class) {
          return value instanceof Number ? ((Number) value).intValue() : Integer.valueOf(text);
        } else if (boxed == Long.class) {
          return value instanceof Number ? ((Number) value).longValue() : Long.valueOf(text);
        } else if (boxed == Short.class) {
          return value instanceof Number ? ((Number) value).shortValue() : Short.valueOf(text);
        } else if (boxed == Byte.class) {
          return value instanceof Number ? ((Number) value).byteValue() : Byte.valueOf(text);
        } else if (boxed == Double.class) {
          return value instanceof Number ? ((Number) value).doubleValue() : Double.valueOf(text);
        } else if (boxed == Float.class) {
          return value instanceof Number ? ((Number) value).floatValue() : Float.valueOf(text);
        } else if (boxed == BigDecimal.class) {
          return new BigDecimal(text);
        } else if (boxed == BigInteger.class) {
          return new BigInteger(text);
        } else if (boxed == Boolean.class) {
          return value instanceof Number ? ((Number) value).intValue() != 0 : Boolean.valueOf(text);
        }
      } catch (NumberFormatException e) {
        throw new DbException(ErrorKind.TYPE_MISMATCH,
            "Cannot convert '" + value + "' to " + targetType.getName(), e);
      }
    }
    throw new DbException(ErrorKind.TYPE_MISMATCH,
        "Cannot assign " + value.getClass().getName() + " to " + targetType.getName());
  }

  private static Class<?> box(Class<?> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    if (type == int.class) {
      return Integer.class;
    } else if (type == long.class) {
      return Long.class;
    } else if (type == double.class) {
      return Double.class;
    } else if (type == float.class) {
      return Float.class;
    } else if (type == short.class) {
      return Short.class;
    } else if (type == byte.class) {
      return Byte.class;
    } else if (type == boolean.class) {
      return Boolean.class;
    } else if (type == char.class) {
      return Character.class;
    }
    return type;
  }

}
