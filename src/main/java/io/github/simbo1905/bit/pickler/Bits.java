// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.HashMap;
import java.util.Map;

import static io.github.simbo1905.bit.pickler.ErrorType.*;

/// Static helpers shared by the accessors, the layout builder and the codec engine
sealed interface Bits permits Bits.Nothing {

  record Nothing() implements Bits {
  }

  int ENUM_NATURAL_WIDTH = Integer.SIZE;

  /// Wire codes of each enum, either [BitEnum#bitValue()] or the ordinal
  ClassValue<Map<Long, Object>> ENUM_CODES = new ClassValue<>() {
    @Override
    protected Map<Long, Object> computeValue(Class<?> type) {
      final Object[] constants = type.getEnumConstants();
      final Map<Long, Object> byCode = new HashMap<>(constants.length * 2);
      for (Object constant : constants) {
        final long code = enumCode((Enum<?>) constant);
        final Object previous = byCode.putIfAbsent(code, constant);
        if (previous != null) {
          throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Enum " + type.getName() + " has duplicate wire code " +
              code + " for " + previous + " and " + constant);
        }
      }
      return Map.copyOf(byCode);
    }
  };

  /// A mask of the low `bits` bits
  static long mask(int bits) {
    return bits >= Long.SIZE ? -1L : (1L << bits) - 1;
  }

  static void checkRange(byte[] buffer, int startBit, int lenBits) {
    if (buffer == null) {
      throw new NullPointerException("buffer must not be null");
    }
    if (lenBits < 1 || lenBits > Long.SIZE) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Bit length must be between 1 and 64 but was " + lenBits);
    }
    if (startBit < 0 || (long) startBit + lenBits > (long) buffer.length * Byte.SIZE) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Bit range [" + startBit + ", " + ((long) startBit + lenBits) +
          ") is outside a buffer of " + buffer.length + " bytes");
    }
  }

  static Class<?> boxed(Class<?> type) {
    if (!type.isPrimitive()) {
      return type;
    }
    if (type == byte.class) return Byte.class;
    if (type == short.class) return Short.class;
    if (type == char.class) return Character.class;
    if (type == int.class) return Integer.class;
    if (type == long.class) return Long.class;
    if (type == boolean.class) return Boolean.class;
    if (type == float.class) return Float.class;
    if (type == double.class) return Double.class;
    return Void.class;
  }

  /// Integral types, chars and booleans are written as raw bits. Floating point types are not supported.
  static boolean isScalar(Class<?> type) {
    final Class<?> b = boxed(type);
    return b == Byte.class || b == Short.class || b == Character.class || b == Integer.class
        || b == Long.class || b == Boolean.class;
  }

  static int naturalWidth(Class<?> type) {
    final Class<?> b = boxed(type);
    if (b == Byte.class) return Byte.SIZE;
    if (b == Short.class) return Short.SIZE;
    if (b == Character.class) return Character.SIZE;
    if (b == Integer.class) return Integer.SIZE;
    if (b == Long.class) return Long.SIZE;
    if (b == Boolean.class) return 1;
    if (type.isEnum()) return ENUM_NATURAL_WIDTH;
    throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "No natural bit width for " + type.getName());
  }

  /// The widest explicit length allowed for a scalar or enum
  static int maxWidth(Class<?> type) {
    if (type.isEnum()) {
      return BitEnum.class.isAssignableFrom(type) ? Long.SIZE : ENUM_NATURAL_WIDTH;
    }
    return naturalWidth(type);
  }

  static long enumCode(Enum<?> constant) {
    return constant instanceof BitEnum bitEnum ? bitEnum.bitValue() : constant.ordinal();
  }

  /// The value as raw bits. Signed values are sign extended here and truncated by the accessor.
  static long toRaw(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    } else if (value instanceof Character c) {
      return c;
    } else if (value instanceof Boolean b) {
      return b ? 1L : 0L;
    } else if (value instanceof Enum<?> e) {
      return enumCode(e);
    }
    throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Cannot write " +
        (value == null ? "null" : value.getClass().getName()) + " as raw bits");
  }

  /// Reinterpret raw bits as the target type by a narrowing copy with no sign extension
  static Object fromRaw(long raw, Class<?> type) {
    final Class<?> b = boxed(type);
    if (b == Byte.class) return (byte) raw;
    if (b == Short.class) return (short) raw;
    if (b == Character.class) return (char) raw;
    if (b == Integer.class) return (int) raw;
    if (b == Long.class) return raw;
    if (b == Boolean.class) return raw != 0;
    if (type.isEnum()) return enumConstant(type, raw);
    throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Cannot read raw bits as " + type.getName());
  }

  static Object enumConstant(Class<?> type, long code) {
    final Object constant = ENUM_CODES.get(type).get(code);
    if (constant == null) {
      throw new BitCodecException(UNKNOWN_ENUM_CONSTANT, "No constant of " + type.getName() + " has wire code " + code);
    }
    return constant;
  }

  static Object defaultValue(Class<?> type) {
    if (!type.isPrimitive()) return null;
    if (type == boolean.class) return false;
    if (type == char.class) return '\0';
    if (type == long.class) return 0L;
    if (type == float.class) return 0.0f;
    if (type == double.class) return 0.0d;
    return fromRaw(0L, type);
  }

  static int bytesFor(long bits) {
    return Math.toIntExact((bits + Byte.SIZE - 1) / Byte.SIZE);
  }
}
