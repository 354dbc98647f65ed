// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.Arrays;

/// How serialization treats count and discriminator fields that disagree with the value being written.
/// Set via system property `bit.pickler.Consistency`. The default is STRICT.
///
/// **STRICT** rejects a list whose size differs from its fixed count or count field with
/// [ErrorType#COUNT_MISMATCH], and a polymorphic occupant whose mapped id differs from the discriminator field
/// with [ErrorType#DISCRIMINATOR_MISMATCH].
///
/// **TRUSTING** takes the count as authoritative. Surplus elements are not written, and a list shorter than
/// its count still fails with [ErrorType#COUNT_MISMATCH]. The discriminator field is not checked, so the
/// discriminator bits and the occupant may disagree on the wire.
public enum ConsistencyMode {
  STRICT,
  TRUSTING;

  static final String PROPERTY = "bit.pickler.Consistency";

  static ConsistencyMode current() {
    final String mode = System.getProperty(PROPERTY, "STRICT").toUpperCase();
    try {
      return ConsistencyMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid consistency mode: " + mode + ". Must be one of: " + Arrays.toString(ConsistencyMode.values()));
    }
  }
}
