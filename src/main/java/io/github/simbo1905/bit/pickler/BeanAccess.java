// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static io.github.simbo1905.bit.pickler.ErrorType.INSTANTIATION_FAILED;
import static io.github.simbo1905.bit.pickler.ErrorType.UNSUPPORTED_FIELD_TYPE;

/// Field access to a mutable class. Members are the instance fields of the class and its superclasses, superclass
/// fields first, each class in declaration order. Fields marked [BitIgnore] are not members and are left untouched.
/// Abstract classes can be read and described but not constructed.
final class BeanAccess implements ObjectAccess {
  final Class<?> beanType;
  final List<Member> members;
  final MethodHandle[] getters;
  final MethodHandle[] setters;
  @Nullable
  final MethodHandle beanConstructor;
  final Object[] defaults;

  BeanAccess(Class<?> beanType) {
    this.beanType = beanType;
    final List<Field> fields = instanceFields(beanType);
    this.members = fields.stream()
        .map(f -> new Member(f.getName(), f.getType(), f.getGenericType(), f))
        .toList();

    final var lookup = MethodHandles.lookup();
    this.getters = new MethodHandle[fields.size()];
    this.setters = new MethodHandle[fields.size()];
    for (int i = 0; i < fields.size(); i++) {
      final Field field = fields.get(i);
      if (Modifier.isFinal(field.getModifiers())) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + field.getName() + " of " + beanType.getName() +
            " is final so cannot be set when deserializing");
      }
      try {
        field.setAccessible(true);
        getters[i] = lookup.unreflectGetter(field);
        setters[i] = lookup.unreflectSetter(field);
      } catch (Exception e) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Failed to create field handles for " + field.getName(), e);
      }
    }

    if (Modifier.isAbstract(beanType.getModifiers())) {
      this.beanConstructor = null;
    } else {
      try {
        final Constructor<?> constructor = beanType.getDeclaredConstructor();
        constructor.setAccessible(true);
        this.beanConstructor = lookup.unreflectConstructor(constructor);
      } catch (Exception e) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Class " + beanType.getName() +
            " must be a record or have a no-argument constructor", e);
      }
    }

    this.defaults = fields.stream().map(f -> Bits.defaultValue(f.getType())).toArray();
  }

  static List<Field> instanceFields(Class<?> type) {
    final Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.push(c);
    }
    final List<Field> fields = new ArrayList<>();
    for (Class<?> c : hierarchy) {
      Arrays.stream(c.getDeclaredFields())
          .filter(f -> !Modifier.isStatic(f.getModifiers()))
          .filter(f -> !f.isSynthetic())
          .filter(f -> !f.isAnnotationPresent(BitIgnore.class))
          .forEach(fields::add);
    }
    return fields;
  }

  @Override
  public List<Member> members() {
    return members;
  }

  @Override
  public Object get(Object instance, int index) {
    try {
      return getters[index].invoke(instance);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to read field " + members.get(index).name() + " of " + beanType.getName(), e);
    }
  }

  @Override
  public Object[] defaults() {
    return defaults.clone();
  }

  @Override
  public Object construct(Object[] values) {
    if (beanConstructor == null) {
      throw new BitCodecException(INSTANTIATION_FAILED, "Cannot construct abstract class " + beanType.getName());
    }
    final Object instance;
    try {
      instance = beanConstructor.invoke();
    } catch (Throwable e) {
      throw new BitCodecException(INSTANTIATION_FAILED, "Failed to construct " + beanType.getName(), e);
    }
    for (int i = 0; i < setters.length; i++) {
      try {
        setters[i].invoke(instance, values[i]);
      } catch (Throwable e) {
        throw new BitCodecException(INSTANTIATION_FAILED, "Failed to set field " + members.get(i).name() +
            " of " + beanType.getName() + " to " + values[i], e);
      }
    }
    return instance;
  }

  @Override
  public String toString() {
    return "BeanAccess{" + beanType.getSimpleName() + "}";
  }
}
