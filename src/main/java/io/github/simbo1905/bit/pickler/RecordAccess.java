// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.List;

import static io.github.simbo1905.bit.pickler.ErrorType.INSTANTIATION_FAILED;
import static io.github.simbo1905.bit.pickler.ErrorType.UNSUPPORTED_FIELD_TYPE;

/// Method handle access to a record's components and canonical constructor
final class RecordAccess implements ObjectAccess {
  final Class<?> recordType;
  final List<Member> members;
  final MethodHandle recordConstructor;
  final MethodHandle[] componentAccessors;
  final Object[] defaults;

  RecordAccess(Class<?> recordType) {
    assert recordType.isRecord() : "User type must be a record: " + recordType;
    this.recordType = recordType;
    final RecordComponent[] components = recordType.getRecordComponents();
    this.members = Arrays.stream(components)
        .map(c -> new Member(c.getName(), c.getType(), c.getGenericType(), c))
        .toList();

    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<?> constructor = recordType.getDeclaredConstructor(parameterTypes);
      constructor.setAccessible(true);
      this.recordConstructor = MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (Exception e) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Failed to create constructor handle for " + recordType, e);
    }

    componentAccessors = Arrays.stream(components)
        .map(component -> {
          try {
            final Method accessor = component.getAccessor();
            accessor.setAccessible(true);
            return MethodHandles.lookup().unreflect(accessor);
          } catch (Exception e) {
            throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Failed to create accessor for " + component.getName(), e);
          }
        })
        .toArray(MethodHandle[]::new);

    this.defaults = Arrays.stream(components)
        .map(c -> Bits.defaultValue(c.getType()))
        .toArray();
  }

  @Override
  public List<Member> members() {
    return members;
  }

  @Override
  public Object get(Object instance, int index) {
    try {
      return componentAccessors[index].invoke(instance);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to read component " + members.get(index).name() + " of " + recordType.getName(), e);
    }
  }

  @Override
  public Object[] defaults() {
    return defaults.clone();
  }

  @Override
  public Object construct(Object[] values) {
    try {
      return recordConstructor.invokeWithArguments(values);
    } catch (Throwable e) {
      throw new BitCodecException(INSTANTIATION_FAILED, "Failed to construct " + recordType.getName() +
          " from " + Arrays.toString(values), e);
    }
  }

  @Override
  public String toString() {
    return "RecordAccess{" + recordType.getSimpleName() + "}";
  }
}
