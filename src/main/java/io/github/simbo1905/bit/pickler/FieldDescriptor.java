// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/// The encoding plan of one field.
///
/// `staticBitOffset` is the field's position assuming every dynamic field before it is empty. It is the absolute
/// offset only when no dynamic field precedes it. At traversal time the field starts at `anchor + anchorDelta`
/// where the anchor is the call's bit offset until a dynamic field has been traversed, and that field's runtime end
/// afterwards.
///
/// @param name The record component or field name
/// @param kind How the field is encoded
/// @param type The declared erased type
/// @param index The position of the member in the type's [ObjectAccess#members()]
/// @param staticBitOffset The build-time offset from the start of the type
/// @param bitLength The statically known length. Zero for dynamic fields.
/// @param anchorDelta The distance from the end of the previous dynamic field, or from the start of the type
/// @param dynamic Whether the length is only known when traversing a value
/// @param nested The layout of a NESTED field
/// @param listInfo The element plan of a LIST field
/// @param polyInfo The variant plan of a POLYMORPHIC field
/// @param converter The optional converter of a PRIMITIVE or ENUM field
/// @param typeArguments How to bind the type parameters of a nested type or of list elements
/// @param typeParameterIndex The type parameter of a GENERIC_SLOT field, otherwise -1
public record FieldDescriptor(
    String name,
    FieldKind kind,
    Class<?> type,
    int index,
    int staticBitOffset,
    int bitLength,
    int anchorDelta,
    boolean dynamic,
    @Nullable TypeLayout nested,
    @Nullable ListInfo listInfo,
    @Nullable PolyInfo polyInfo,
    @Nullable BitValueConverter<Object> converter,
    List<TypeArgument> typeArguments,
    int typeParameterIndex
) {

  public FieldDescriptor {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(type, "type must not be null");
    typeArguments = List.copyOf(typeArguments);
    switch (kind) {
      case NESTED -> Objects.requireNonNull(nested, "NESTED field " + name + " requires a nested layout");
      case LIST -> Objects.requireNonNull(listInfo, "LIST field " + name + " requires list info");
      case POLYMORPHIC -> Objects.requireNonNull(polyInfo, "POLYMORPHIC field " + name + " requires poly info");
      case GENERIC_SLOT -> {
        if (typeParameterIndex < 0) {
          throw new IllegalArgumentException("GENERIC_SLOT field " + name + " requires a type parameter index");
        }
      }
      default -> {
      }
    }
  }

  /// The static end of this field from the start of the type
  public int staticBitEnd() {
    return staticBitOffset + bitLength;
  }

  /// Binds one type parameter of a nested type, either to a fixed class or to one of the enclosing type's parameters
  /// @param fixed The class given in the declaration, or null
  /// @param parameterIndex The enclosing type parameter, or -1
  public record TypeArgument(@Nullable Class<?> fixed, int parameterIndex) {
  }

  /// Elements of a list field
  /// @param elementKind PRIMITIVE, ENUM or NESTED
  /// @param elementType The erased element type
  /// @param elementBitLength The bits of each element, or the stride of nested elements. Zero for dynamic elements.
  /// @param elementLayout The layout of NESTED elements
  /// @param fixedCount The declared fixed count
  /// @param countFieldName The field holding the count when there is no fixed count
  /// @param countFieldIndex The member index of the count field, or -1
  /// @param countFieldBitLength The bit length of the count field, or 0
  /// @param arrayLike Whether the field is a Java array rather than a `java.util.List`
  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  public record ListInfo(
      FieldKind elementKind,
      Class<?> elementType,
      int elementBitLength,
      @Nullable TypeLayout elementLayout,
      OptionalInt fixedCount,
      Optional<String> countFieldName,
      int countFieldIndex,
      int countFieldBitLength,
      boolean arrayLike
  ) {
    public ListInfo {
      if (fixedCount.isPresent() == countFieldName.isPresent()) {
        throw new IllegalArgumentException("Exactly one of fixed count and count field must be present");
      }
    }

    /// Whether each element has the same statically known length
    public boolean staticElements() {
      return elementLayout == null || !elementLayout.hasDynamicTail();
    }
  }

  /// Variants of a polymorphic field
  /// @param discriminatorFieldName The field holding the discriminator
  /// @param discriminatorIndex The member index of the discriminator field
  /// @param discriminatorBitLength The bit length of the discriminator field
  /// @param mappings Discriminator values to concrete types in declaration order
  /// @param slotBitLength The bits reserved for every occupant
  public record PolyInfo(
      String discriminatorFieldName,
      int discriminatorIndex,
      int discriminatorBitLength,
      List<PolyMapping> mappings,
      int slotBitLength
  ) {
    public PolyInfo {
      mappings = List.copyOf(mappings);
    }

    public Optional<PolyMapping> forValue(long discriminator) {
      return mappings.stream().filter(m -> m.value() == discriminator).findFirst();
    }

    public Optional<PolyMapping> forType(Class<?> type) {
      return mappings.stream().filter(m -> m.type() == type).findFirst();
    }
  }

  public record PolyMapping(long value, Class<?> type, TypeLayout layout) {
  }
}
