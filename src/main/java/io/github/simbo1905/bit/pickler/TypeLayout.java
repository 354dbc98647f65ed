// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The immutable bit layout of one type, built once and shared by all picklers.
///
/// @param type The record or class
/// @param fields The encoded fields in order, superclass fields first
/// @param totalStaticBitLength The length assuming every dynamic field is empty. Exact when there is no dynamic tail.
/// @param hasDynamicTail Whether any field has a length only known at traversal time
/// @param tailAnchorBitOffset The static end of the last dynamic field, or 0 when there is none
/// @param baseLayout The layout of a superclass whose fields form a prefix of this layout
/// @param access How to read and build instances
/// @param typeParameterCount The number of type parameters of the type
public record TypeLayout(
    Class<?> type,
    List<FieldDescriptor> fields,
    int totalStaticBitLength,
    boolean hasDynamicTail,
    int tailAnchorBitOffset,
    @Nullable TypeLayout baseLayout,
    ObjectAccess access,
    int typeParameterCount
) {

  public TypeLayout {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(access, "access must not be null");
    fields = List.copyOf(fields);
  }

  public Optional<FieldDescriptor> field(String name) {
    return fields.stream().filter(f -> f.name().equals(name)).findFirst();
  }

  /// Bytes needed when there is no dynamic tail, otherwise the minimum
  public int staticByteLength() {
    return Bits.bytesFor(totalStaticBitLength);
  }

  @Override
  public String toString() {
    return "TypeLayout{" + type.getSimpleName() +
        ", fields=" + fields.stream().map(f -> f.name() + ":" + f.kind() + "@" + f.staticBitOffset() + "+" + f.bitLength()).toList() +
        ", totalStaticBitLength=" + totalStaticBitLength +
        ", hasDynamicTail=" + hasDynamicTail +
        "}";
  }
}
