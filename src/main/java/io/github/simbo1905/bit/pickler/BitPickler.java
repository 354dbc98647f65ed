// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.logging.Logger;

/// Main interface of the bit pickler. Encodes records and classes whose fields declare bit widths into exact,
/// not necessarily byte aligned, bit layouts in either [BitOrder#MSB] or [BitOrder#LSB] order.
///
/// Picklers are immutable and thread safe. The bit order is fixed when the pickler is created.
public sealed interface BitPickler<T> permits LayoutPickler {

  Logger LOGGER = Logger.getLogger(BitPickler.class.getName());

  /// A deserialized value and the number of bits it occupied
  record Decoded<T>(T value, int bitLength) {
  }

  /// Serialize into a new zero filled array of exactly `sizeOf(value)` bytes
  /// @param value The object to serialize
  /// @return The encoded bytes
  byte[] serialize(T value);

  /// Serialize from the first bit of the buffer
  /// @param value The object to serialize
  /// @param buffer The destination which must hold at least `bitLengthOf(value)` bits
  /// @return The number of bits written
  /// @throws BitCodecException with [ErrorType#BUFFER_TOO_SMALL] before writing anything when the buffer is too short
  int serialize(T value, byte[] buffer);

  /// Serialize starting at an arbitrary bit position. Bits outside the written fields are left as they were,
  /// including the unused tail of polymorphic slots and nested padding.
  /// @param value The object to serialize
  /// @param buffer The destination
  /// @param bitOffset The absolute bit position of the first field
  /// @return The number of bits written
  int serialize(T value, byte[] buffer, int bitOffset);

  /// Deserialize from the first bit of the buffer
  T deserialize(byte[] buffer);

  /// Deserialize starting at an arbitrary bit position
  T deserialize(byte[] buffer, int bitOffset);

  /// Deserialize starting at an arbitrary bit position and report the number of bits read
  Decoded<T> decode(byte[] buffer, int bitOffset);

  /// The exact number of bits the value encodes to. Also validates list counts and polymorphic variants.
  int bitLengthOf(T value);

  /// The number of bytes the value encodes to
  default int sizeOf(T value) {
    return Bits.bytesFor(bitLengthOf(value));
  }

  TypeLayout layout();

  BitOrder bitOrder();

  /// A most significant bit first pickler
  /// @param type The record or class to encode
  /// @param typeArguments Classes bound to the type parameters of a generic type, in declaration order
  static <T> BitPickler<T> msb(Class<T> type, Class<?>... typeArguments) {
    return new LayoutPickler<>(type, BitOrder.MSB, ConsistencyMode.current(), typeArguments);
  }

  /// A least significant bit first pickler
  /// @param type The record or class to encode
  /// @param typeArguments Classes bound to the type parameters of a generic type, in declaration order
  static <T> BitPickler<T> lsb(Class<T> type, Class<?>... typeArguments) {
    return new LayoutPickler<>(type, BitOrder.LSB, ConsistencyMode.current(), typeArguments);
  }
}
