// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// The two bit orderings. Each is bound to its accessor once, so the codec never branches on the order per field.
public enum BitOrder {
  /// The first bit of a byte is its most significant bit and a field's most significant bit is stored first.
  MSB(new MsbBitAccessor()),
  /// The first bit of a byte is its least significant bit and a field's bit 0 is stored first.
  LSB(new LsbBitAccessor());

  private final BitAccessor accessor;

  BitOrder(BitAccessor accessor) {
    this.accessor = accessor;
  }

  public BitAccessor accessor() {
    return accessor;
  }
}
