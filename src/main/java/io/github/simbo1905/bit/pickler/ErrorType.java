// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// Types of errors raised by the bit pickler. The first group is raised while building a layout,
/// the second while serializing or deserializing a value.
public enum ErrorType {
  MISSING_FIELD_METADATA,
  UNSUPPORTED_FIELD_TYPE,
  LIST_MISSING_CARDINALITY,
  POLYMORPHIC_MISSING_DISCRIMINATOR,
  RELATED_FIELD_NOT_FOUND,
  INVALID_CONVERTER,

  UNKNOWN_VARIANT,
  BUFFER_TOO_SMALL,
  BIT_RANGE_OUT_OF_BOUNDS,
  COUNT_MISMATCH,
  DISCRIMINATOR_MISMATCH,
  UNKNOWN_ENUM_CONSTANT,
  UNBOUND_TYPE_PARAMETER,
  CONVERTER_FAILED,
  INSTANTIATION_FAILED,
  UNREGISTERED_TYPE
}
