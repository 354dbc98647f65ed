// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import io.github.simbo1905.bit.pickler.FieldDescriptor.ListInfo;
import io.github.simbo1905.bit.pickler.FieldDescriptor.PolyInfo;
import io.github.simbo1905.bit.pickler.FieldDescriptor.PolyMapping;
import io.github.simbo1905.bit.pickler.FieldDescriptor.TypeArgument;
import io.github.simbo1905.bit.pickler.ObjectAccess.Member;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.*;
import java.util.*;

import static io.github.simbo1905.bit.pickler.BitPickler.LOGGER;
import static io.github.simbo1905.bit.pickler.ErrorType.*;

/// Derives the layout of one type in a single pass over its members in declaration order.
/// The cursor starts at the end of the superclass layout, if any, and advances by each field's static length.
final class LayoutBuilder {
  final Class<?> type;
  final Deque<Class<?>> inProgress;
  final List<FieldDescriptor> fields = new ArrayList<>();
  ObjectAccess access;
  int bitCursor;
  int lastDynamicEnd;
  boolean dynamicTail;

  LayoutBuilder(Class<?> type, Deque<Class<?>> inProgress) {
    this.type = type;
    this.inProgress = inProgress;
  }

  TypeLayout build() {
    access = ObjectAccess.forType(type);
    final TypeLayout baseLayout = baseLayout();
    int first = 0;
    if (baseLayout != null) {
      if (baseLayout.fields().stream().anyMatch(f -> f.kind() == FieldKind.GENERIC_SLOT)) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Superclass " + baseLayout.type().getName() + " of " +
            type.getName() + " has a generic slot which cannot be bound through a subclass");
      }
      fields.addAll(baseLayout.fields());
      bitCursor = baseLayout.totalStaticBitLength();
      lastDynamicEnd = baseLayout.tailAnchorBitOffset();
      dynamicTail = baseLayout.hasDynamicTail();
      first = baseLayout.access().members().size();
    }

    final List<Member> members = access.members();
    for (int index = first; index < members.size(); index++) {
      addMember(index, members.get(index));
    }

    final var layout = new TypeLayout(type, fields, bitCursor, dynamicTail, lastDynamicEnd, baseLayout, access,
        type.getTypeParameters().length);
    LOGGER.fine(() -> "Built " + layout);
    return layout;
  }

  @Nullable
  TypeLayout baseLayout() {
    if (type.isRecord()) {
      return null;
    }
    final Class<?> superclass = type.getSuperclass();
    if (superclass == null || superclass == Object.class || BeanAccess.instanceFields(superclass).isEmpty()) {
      return null;
    }
    return Layouts.layoutOf(superclass, inProgress);
  }

  void addMember(int index, Member member) {
    final AnnotatedElement annotations = member.annotations();
    if (annotations.isAnnotationPresent(BitIgnore.class)) {
      LOGGER.finer(() -> type.getSimpleName() + "." + member.name() + " is ignored");
      return;
    }
    final BitField bitField = annotations.getAnnotation(BitField.class);
    if (bitField == null) {
      throw new BitCodecException(MISSING_FIELD_METADATA, "Field " + member.name() + " of " + type.getName() +
          " has neither @BitField nor @BitIgnore");
    }
    final int explicit = bitField.value();
    if (explicit != BitField.NATURAL && explicit < 1) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Field " + member.name() + " of " + type.getName() +
          " declares a bit length of " + explicit);
    }

    final FieldDescriptor descriptor;
    if (member.genericType() instanceof TypeVariable<?> typeVariable) {
      descriptor = genericSlot(index, member, explicit, typeVariable);
    } else if (annotations.getAnnotationsByType(BitPoly.class).length > 0) {
      descriptor = polymorphic(index, member, explicit);
    } else if (member.type().isArray() || member.type() == List.class) {
      descriptor = list(index, member, explicit);
    } else if (Bits.isScalar(member.type())) {
      descriptor = scalar(index, member, explicit, FieldKind.PRIMITIVE);
    } else if (member.type().isEnum()) {
      descriptor = scalar(index, member, explicit, FieldKind.ENUM);
    } else {
      descriptor = nested(index, member, explicit);
    }

    fields.add(descriptor);
    bitCursor = Math.addExact(bitCursor, descriptor.bitLength());
    if (descriptor.dynamic()) {
      dynamicTail = true;
      lastDynamicEnd = bitCursor;
    }
    LOGGER.finer(() -> type.getSimpleName() + "." + descriptor.name() + " " + descriptor.kind() +
        " at " + descriptor.staticBitOffset() + " length " + descriptor.bitLength() +
        (descriptor.dynamic() ? " dynamic" : "") + " anchor delta " + descriptor.anchorDelta());
  }

  FieldDescriptor scalar(int index, Member member, int explicit, FieldKind kind) {
    final int width = scalarWidth(member, member.type(), explicit);
    final BitValueConverter<Object> converter = converterFor(member);
    return new FieldDescriptor(member.name(), kind, member.type(), index, bitCursor, width, anchorDelta(), false,
        null, null, null, converter, List.of(), -1);
  }

  FieldDescriptor nested(int index, Member member, int explicit) {
    rejectConverter(member);
    final Class<?> nestedType = member.type();
    if (nestedType.isPrimitive() || Number.class.isAssignableFrom(nestedType)) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
          " is a " + nestedType.getSimpleName() + " but only integral types, chars and booleans are written as bits");
    }
    requireConcrete(member, nestedType);
    final List<TypeArgument> typeArguments = typeArguments(member, member.genericType());
    final TypeLayout nested = Layouts.layoutOf(nestedType, inProgress);
    if (nested.hasDynamicTail()) {
      if (explicit != BitField.NATURAL) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
            " cannot override the length of " + nestedType.getSimpleName() + " which has a dynamic length");
      }
      return new FieldDescriptor(member.name(), FieldKind.NESTED, nestedType, index, bitCursor, 0, anchorDelta(), true,
          nested, null, null, null, typeArguments, -1);
    }
    final int length = explicit == BitField.NATURAL ? nested.totalStaticBitLength() : explicit;
    if (length < nested.totalStaticBitLength()) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Field " + member.name() + " of " + type.getName() +
          " declares " + length + " bits but " + nestedType.getSimpleName() + " needs " + nested.totalStaticBitLength());
    }
    return new FieldDescriptor(member.name(), FieldKind.NESTED, nestedType, index, bitCursor, length, anchorDelta(), false,
        nested, null, null, null, typeArguments, -1);
  }

  FieldDescriptor list(int index, Member member, int explicit) {
    rejectConverter(member);
    final boolean arrayLike = member.type().isArray();
    final Type elementGeneric;
    if (arrayLike) {
      elementGeneric = member.genericType() instanceof GenericArrayType genericArray
          ? genericArray.getGenericComponentType()
          : member.type().getComponentType();
    } else if (member.genericType() instanceof ParameterizedType parameterized) {
      elementGeneric = parameterized.getActualTypeArguments()[0];
    } else {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "List field " + member.name() + " of " + type.getName() +
          " must declare its element type");
    }
    final Class<?> elementType = erase(member, elementGeneric);

    final FieldKind elementKind;
    final int elementBits;
    TypeLayout elementLayout = null;
    List<TypeArgument> typeArguments = List.of();
    if (Bits.isScalar(elementType)) {
      elementKind = FieldKind.PRIMITIVE;
      elementBits = scalarWidth(member, elementType, explicit);
    } else if (elementType.isEnum()) {
      elementKind = FieldKind.ENUM;
      elementBits = scalarWidth(member, elementType, explicit);
    } else if (elementType.isArray() || elementType == List.class) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "List field " + member.name() + " of " + type.getName() +
          " has list elements which must be wrapped in a record");
    } else {
      elementKind = FieldKind.NESTED;
      requireConcrete(member, elementType);
      typeArguments = typeArguments(member, elementGeneric);
      elementLayout = Layouts.layoutOf(elementType, inProgress);
      if (elementLayout.hasDynamicTail()) {
        if (explicit != BitField.NATURAL) {
          throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "List field " + member.name() + " of " + type.getName() +
              " cannot set a stride for " + elementType.getSimpleName() + " which has a dynamic length");
        }
        elementBits = 0;
      } else {
        elementBits = explicit == BitField.NATURAL ? elementLayout.totalStaticBitLength() : explicit;
        if (elementBits < elementLayout.totalStaticBitLength()) {
          throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "List field " + member.name() + " of " + type.getName() +
              " declares a stride of " + elementBits + " bits but " + elementType.getSimpleName() + " needs " +
              elementLayout.totalStaticBitLength());
        }
      }
    }

    final BitCount bitCount = member.annotations().getAnnotation(BitCount.class);
    final BitRelated related = member.annotations().getAnnotation(BitRelated.class);
    final ListInfo info;
    if (bitCount != null) {
      if (bitCount.value() < 0) {
        throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "List field " + member.name() + " of " + type.getName() +
            " declares a negative count " + bitCount.value());
      }
      if (related != null) {
        LOGGER.finer(() -> type.getSimpleName() + "." + member.name() + " fixed count " + bitCount.value() +
            " takes priority over count field " + related.value());
      }
      info = new ListInfo(elementKind, elementType, elementBits, elementLayout, OptionalInt.of(bitCount.value()),
          Optional.empty(), -1, 0, arrayLike);
    } else if (related != null) {
      final FieldDescriptor countField = related(member, related.value(), "count", EnumSet.of(FieldKind.PRIMITIVE));
      info = new ListInfo(elementKind, elementType, elementBits, elementLayout, OptionalInt.empty(),
          Optional.of(countField.name()), countField.index(), countField.bitLength(), arrayLike);
    } else {
      throw new BitCodecException(LIST_MISSING_CARDINALITY, "List field " + member.name() + " of " + type.getName() +
          " needs @BitCount or a @BitRelated count field");
    }

    final boolean dynamic = info.fixedCount().isEmpty() || !info.staticElements();
    final int length = dynamic ? 0 : Math.multiplyExact(info.fixedCount().getAsInt(), elementBits);
    return new FieldDescriptor(member.name(), FieldKind.LIST, member.type(), index, bitCursor, length, anchorDelta(),
        dynamic, null, info, null, null, typeArguments, -1);
  }

  FieldDescriptor polymorphic(int index, Member member, int explicit) {
    rejectConverter(member);
    final Class<?> declared = member.type();
    if (declared.isArray() || declared == List.class) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
          " is a list of polymorphic values which must be wrapped in a record");
    }
    final BitRelated related = member.annotations().getAnnotation(BitRelated.class);
    if (related == null) {
      throw new BitCodecException(POLYMORPHIC_MISSING_DISCRIMINATOR, "Polymorphic field " + member.name() + " of " +
          type.getName() + " needs a @BitRelated discriminator field");
    }
    final FieldDescriptor discriminator = related(member, related.value(), "discriminator",
        EnumSet.of(FieldKind.PRIMITIVE, FieldKind.ENUM));

    final List<PolyMapping> mappings = new ArrayList<>();
    int widest = 0;
    for (BitPoly poly : member.annotations().getAnnotationsByType(BitPoly.class)) {
      final Class<?> variant = poly.type();
      if (!declared.isAssignableFrom(variant)) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Variant " + variant.getName() + " of field " + member.name() +
            " is not a " + declared.getName());
      }
      requireConcrete(member, variant);
      if (discriminator.bitLength() < Long.SIZE && (poly.id() & ~Bits.mask(discriminator.bitLength())) != 0) {
        throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Variant id " + poly.id() + " of field " + member.name() +
            " does not fit the " + discriminator.bitLength() + " bits of " + discriminator.name());
      }
      if (mappings.stream().anyMatch(m -> m.value() == poly.id() || m.type() == variant)) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
            " maps id " + poly.id() + " or type " + variant.getSimpleName() + " more than once");
      }
      final TypeLayout layout = Layouts.layoutOf(variant, inProgress);
      if (layout.hasDynamicTail()) {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Variant " + variant.getName() + " of field " + member.name() +
            " has a dynamic length and cannot occupy a fixed slot");
      }
      widest = Math.max(widest, layout.totalStaticBitLength());
      mappings.add(new PolyMapping(poly.id(), variant, layout));
    }

    final int slot = explicit == BitField.NATURAL ? widest : explicit;
    if (slot < widest) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Polymorphic field " + member.name() + " of " + type.getName() +
          " declares a slot of " + slot + " bits but a variant needs " + widest);
    }
    final var info = new PolyInfo(discriminator.name(), discriminator.index(), discriminator.bitLength(), mappings, slot);
    return new FieldDescriptor(member.name(), FieldKind.POLYMORPHIC, declared, index, bitCursor, slot, anchorDelta(),
        false, null, null, info, null, List.of(), -1);
  }

  FieldDescriptor genericSlot(int index, Member member, int explicit, TypeVariable<?> typeVariable) {
    rejectConverter(member);
    if (explicit != BitField.NATURAL) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Generic field " + member.name() + " of " + type.getName() +
          " takes its length from its occupant so cannot declare one");
    }
    final int parameterIndex = typeParameterIndex(member, typeVariable);
    return new FieldDescriptor(member.name(), FieldKind.GENERIC_SLOT, member.type(), index, bitCursor, 0, anchorDelta(),
        true, null, null, null, null, List.of(), parameterIndex);
  }

  int anchorDelta() {
    return bitCursor - lastDynamicEnd;
  }

  int scalarWidth(Member member, Class<?> scalarType, int explicit) {
    final int width = explicit == BitField.NATURAL ? Bits.naturalWidth(scalarType) : explicit;
    final int max = Bits.maxWidth(scalarType);
    if (width > max) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Field " + member.name() + " of " + type.getName() +
          " declares " + width + " bits but " + scalarType.getSimpleName() + " holds at most " + max);
    }
    if (scalarType.isEnum() && width < Long.SIZE) {
      for (Long code : Bits.ENUM_CODES.get(scalarType).keySet()) {
        if ((code & ~Bits.mask(width)) != 0) {
          throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Enum " + scalarType.getSimpleName() + " has code " + code +
              " which does not fit the " + width + " bits of field " + member.name());
        }
      }
    }
    return width;
  }

  /// The earlier scalar field a list count or a discriminator refers to
  @NotNull
  FieldDescriptor related(Member member, String relatedName, String role, EnumSet<FieldKind> allowed) {
    for (FieldDescriptor field : fields) {
      if (field.name().equals(relatedName)) {
        if (!allowed.contains(field.kind())) {
          throw new BitCodecException(RELATED_FIELD_NOT_FOUND, "The " + role + " field " + relatedName + " of " +
              member.name() + " in " + type.getName() + " is a " + field.kind() + " but must be one of " + allowed);
        }
        return field;
      }
    }
    final boolean declaredLater = access.members().stream().anyMatch(m -> m.name().equals(relatedName));
    throw new BitCodecException(RELATED_FIELD_NOT_FOUND, "The " + role + " field " + relatedName + " of " +
        member.name() + (declaredLater ? " must be an encoded field declared before it in " : " does not exist in ") +
        type.getName());
  }

  Class<?> erase(Member member, Type elementType) {
    if (elementType instanceof Class<?> c) {
      return c;
    }
    if (elementType instanceof ParameterizedType parameterized && parameterized.getRawType() instanceof Class<?> raw) {
      return raw;
    }
    throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "List field " + member.name() + " of " + type.getName() +
        " has element type " + elementType.getTypeName() + " which is not a concrete type");
  }

  void requireConcrete(Member member, Class<?> concrete) {
    if (!concrete.isRecord() && (concrete.isInterface() || Modifier.isAbstract(concrete.getModifiers()))) {
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
          " has abstract type " + concrete.getName() + " which needs @BitPoly mappings");
    }
  }

  List<TypeArgument> typeArguments(Member member, Type declared) {
    if (!(declared instanceof ParameterizedType parameterized)) {
      return List.of();
    }
    final List<TypeArgument> arguments = new ArrayList<>();
    for (Type argument : parameterized.getActualTypeArguments()) {
      if (argument instanceof Class<?> fixed) {
        arguments.add(new TypeArgument(fixed, -1));
      } else if (argument instanceof TypeVariable<?> typeVariable) {
        arguments.add(new TypeArgument(null, typeParameterIndex(member, typeVariable)));
      } else {
        throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
            " has type argument " + argument.getTypeName() + " which must be a class or a type parameter of " +
            type.getSimpleName());
      }
    }
    return arguments;
  }

  int typeParameterIndex(Member member, TypeVariable<?> typeVariable) {
    final TypeVariable<?>[] parameters = type.getTypeParameters();
    for (int i = 0; i < parameters.length; i++) {
      if (parameters[i].equals(typeVariable)) {
        return i;
      }
    }
    throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Field " + member.name() + " of " + type.getName() +
        " uses type variable " + typeVariable.getName() + " which is not declared by " + type.getSimpleName());
  }

  void rejectConverter(Member member) {
    if (member.annotations().isAnnotationPresent(BitConvert.class)) {
      throw new BitCodecException(INVALID_CONVERTER, "Field " + member.name() + " of " + type.getName() +
          " is not a scalar or enum so cannot have a converter");
    }
  }

  @Nullable
  BitValueConverter<Object> converterFor(Member member) {
    final BitConvert convert = member.annotations().getAnnotation(BitConvert.class);
    if (convert == null) {
      return null;
    }
    final Class<?> converterType = convert.value();
    if (!BitValueConverter.class.isAssignableFrom(converterType)) {
      throw new BitCodecException(INVALID_CONVERTER, "Converter " + converterType.getName() + " of field " +
          member.name() + " does not implement " + BitValueConverter.class.getSimpleName());
    }
    final Class<?> valueType = converterValueType(converterType);
    if (valueType == null) {
      throw new BitCodecException(INVALID_CONVERTER, "Converter " + converterType.getName() + " of field " +
          member.name() + " does not declare the type it converts");
    }
    if (valueType != Bits.boxed(member.type())) {
      throw new BitCodecException(INVALID_CONVERTER, "Converter " + converterType.getName() + " converts " +
          valueType.getSimpleName() + " but field " + member.name() + " is " + member.type().getSimpleName());
    }
    try {
      final Constructor<?> constructor = converterType.getDeclaredConstructor();
      constructor.setAccessible(true);
      @SuppressWarnings("unchecked") final var converter = (BitValueConverter<Object>) constructor.newInstance();
      return converter;
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new BitCodecException(INVALID_CONVERTER, "Converter " + converterType.getName() + " of field " +
          member.name() + " cannot be created through a no-argument constructor", e);
    }
  }

  @Nullable
  static Class<?> converterValueType(Class<?> converterType) {
    for (Class<?> c = converterType; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Type implemented : c.getGenericInterfaces()) {
        if (implemented instanceof ParameterizedType parameterized
            && parameterized.getRawType() == BitValueConverter.class
            && parameterized.getActualTypeArguments()[0] instanceof Class<?> valueType) {
          return valueType;
        }
      }
    }
    return null;
  }
}
