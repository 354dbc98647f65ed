// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// How a field is encoded
public enum FieldKind {
  /// An integral value, char or boolean written as raw bits
  PRIMITIVE,
  /// An enum written as its ordinal or [BitEnum] code
  ENUM,
  /// A record or class with its own layout
  NESTED,
  /// A `java.util.List` or array with a fixed count or a count field
  LIST,
  /// A supertype whose concrete type is picked by a discriminator field
  POLYMORPHIC,
  /// A field typed by a type parameter, bound per pickler
  GENERIC_SLOT
}
