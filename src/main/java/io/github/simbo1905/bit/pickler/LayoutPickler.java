// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.Arrays;
import java.util.Objects;

import static io.github.simbo1905.bit.pickler.ErrorType.BIT_RANGE_OUT_OF_BOUNDS;
import static io.github.simbo1905.bit.pickler.ErrorType.BUFFER_TOO_SMALL;

/// A pickler interpreting a cached [TypeLayout] with the accessor of one bit order
final class LayoutPickler<T> implements BitPickler<T> {
  final Class<T> userType;
  final BitOrder bitOrder;
  final TypeLayout layout;
  final Class<?>[] bindings;
  final BitSerde serde;

  LayoutPickler(Class<T> userType, BitOrder bitOrder, ConsistencyMode consistency, Class<?>... typeArguments) {
    Objects.requireNonNull(userType, "Class must not be null");
    Objects.requireNonNull(bitOrder, "Bit order must not be null");
    Objects.requireNonNull(typeArguments, "Type arguments must not be null");
    final int parameters = userType.getTypeParameters().length;
    if (typeArguments.length != 0 && typeArguments.length != parameters) {
      throw new IllegalArgumentException(userType.getName() + " has " + parameters + " type parameters but " +
          typeArguments.length + " type arguments were given");
    }
    this.userType = userType;
    this.bitOrder = bitOrder;
    this.layout = Layouts.layoutOf(userType);
    this.bindings = typeArguments.clone();
    this.serde = new BitSerde(bitOrder.accessor(), consistency);
    LOGGER.fine(() -> "LayoutPickler " + userType.getSimpleName() + " construction complete with bit order " + bitOrder +
        ", consistency " + consistency + ", type arguments " + Arrays.toString(bindings) +
        ", static length " + layout.totalStaticBitLength() + (layout.hasDynamicTail() ? " with dynamic tail" : ""));
  }

  @Override
  public byte[] serialize(T value) {
    final int bits = bitLengthOf(value);
    final byte[] buffer = new byte[Bits.bytesFor(bits)];
    serde.serialize(layout, value, buffer, 0, bindings);
    return buffer;
  }

  @Override
  public int serialize(T value, byte[] buffer) {
    return serialize(value, buffer, 0);
  }

  @Override
  public int serialize(T value, byte[] buffer, int bitOffset) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    if (bitOffset < 0) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "Bit offset must not be negative but was " + bitOffset);
    }
    final int bits = bitLengthOf(value);
    final long required = (long) bitOffset + bits;
    if (required > (long) buffer.length * Byte.SIZE) {
      throw new BitCodecException(BUFFER_TOO_SMALL, userType.getSimpleName() + " needs " + Bits.bytesFor(required) +
          " bytes from bit " + bitOffset + " but the buffer has " + buffer.length);
    }
    LOGGER.finer(() -> "LayoutPickler " + userType.getSimpleName() + " serialize " + bits + " bits at bit " + bitOffset);
    return serde.serialize(layout, value, buffer, bitOffset, bindings);
  }

  @Override
  public T deserialize(byte[] buffer) {
    return decode(buffer, 0).value();
  }

  @Override
  public T deserialize(byte[] buffer, int bitOffset) {
    return decode(buffer, bitOffset).value();
  }

  @Override
  public Decoded<T> decode(byte[] buffer, int bitOffset) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    if (bitOffset < 0 || (long) bitOffset + layout.totalStaticBitLength() > (long) buffer.length * Byte.SIZE) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, userType.getSimpleName() + " needs at least " +
          layout.totalStaticBitLength() + " bits from bit " + bitOffset + " but the buffer has " + buffer.length + " bytes");
    }
    final Decoded<Object> decoded = serde.deserialize(layout, buffer, bitOffset, bindings);
    LOGGER.finer(() -> "LayoutPickler " + userType.getSimpleName() + " deserialized " + decoded.bitLength() +
        " bits from bit " + bitOffset);
    return new Decoded<>(userType.cast(decoded.value()), decoded.bitLength());
  }

  @Override
  public int bitLengthOf(T value) {
    Objects.requireNonNull(value, "value must not be null");
    if (!userType.isInstance(value)) {
      throw new IllegalArgumentException("Expected " + userType + " but got " + value.getClass());
    }
    return serde.bitLengthOf(layout, value, bindings);
  }

  @Override
  public TypeLayout layout() {
    return layout;
  }

  @Override
  public BitOrder bitOrder() {
    return bitOrder;
  }

  @Override
  public String toString() {
    return "LayoutPickler{" + userType.getSimpleName() + ", " + bitOrder + "}";
  }
}
