// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// Implemented by enums that are encoded with an explicit code rather than their ordinal.
/// Codes must be unique within the enum and must fit the field's bit length.
public interface BitEnum {
  long bitValue();
}
