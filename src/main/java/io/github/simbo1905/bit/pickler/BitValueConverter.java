// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// A pure transform between a field's logical value and the value stored in its bits. Implementations must declare
/// their value type as the type argument, have a no-argument constructor and have no side effects.
/// @param <V> The boxed type of the field, or the enum type
public interface BitValueConverter<V> {

  /// Applied after the field's bits have been read
  V toLogical(V raw);

  /// Applied before the field's bits are written
  V toRaw(V logical);
}
