// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// Reads and writes a contiguous range of bits in a byte array as an unsigned value of up to 64 bits.
///
/// Both operations validate that `lenBits` is within `[1, 64]` and that the range lies inside the buffer,
/// failing with [ErrorType#BIT_RANGE_OUT_OF_BOUNDS] otherwise. Writes only touch bits inside the range.
public sealed interface BitAccessor permits MsbBitAccessor, LsbBitAccessor {

  /// Read `lenBits` bits starting at absolute bit position `startBit`
  /// @param buffer The bytes to read from
  /// @param startBit The absolute position of the first bit
  /// @param lenBits The number of bits, between 1 and 64
  /// @return The bits as an unsigned value, zero extended to a long
  long read(byte[] buffer, int startBit, int lenBits);

  /// Write the low `lenBits` bits of `value` starting at absolute bit position `startBit`
  /// @param buffer The bytes to write into
  /// @param startBit The absolute position of the first bit
  /// @param lenBits The number of bits, between 1 and 64
  /// @param value The value, of which only the low `lenBits` bits are stored
  void write(byte[] buffer, int startBit, int lenBits, long value);
}
