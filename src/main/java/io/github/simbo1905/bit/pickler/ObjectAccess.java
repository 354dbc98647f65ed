// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Type;
import java.util.List;

import static io.github.simbo1905.bit.pickler.ErrorType.UNSUPPORTED_FIELD_TYPE;

/// Reads member values from a live instance and builds new instances from member values.
/// Records are read through their accessors and built through the canonical constructor. Other classes are
/// read and written field by field after a no-argument constructor.
public sealed interface ObjectAccess permits RecordAccess, BeanAccess {

  /// A record component or class field in declaration order
  /// @param name The member name
  /// @param type The erased type
  /// @param genericType The declared type including type arguments or a type variable
  /// @param annotations Where the bit annotations are read from
  record Member(String name, Class<?> type, Type genericType, AnnotatedElement annotations) {
  }

  List<Member> members();

  Object get(Object instance, int index);

  /// A value array pre-filled with the defaults of primitive members
  Object[] defaults();

  Object construct(Object[] values);

  static ObjectAccess forType(Class<?> type) {
    if (type.isRecord()) {
      return new RecordAccess(type);
    }
    if (type.isInterface() || type.isEnum() || type.isArray() || type.isPrimitive()
        || type.getPackageName().startsWith("java.")) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Type " + type.getName() + " is neither a record nor a class with bit fields");
    }
    return new BeanAccess(type);
  }
}
