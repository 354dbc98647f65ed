// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.bit.pickler.BitPickler.LOGGER;
import static io.github.simbo1905.bit.pickler.ErrorType.UNREGISTERED_TYPE;

/// Maps a type to its pickler for callers that only hold an `Object` or a `Class`.
/// Each registry serves one bit order. Registration is idempotent and safe from any thread.
public final class BitPicklerRegistry {

  public static final BitPicklerRegistry MSB = new BitPicklerRegistry(BitOrder.MSB);
  public static final BitPicklerRegistry LSB = new BitPicklerRegistry(BitOrder.LSB);

  private final BitOrder bitOrder;
  private final ConsistencyMode consistency;
  private final ConcurrentHashMap<Class<?>, BitPickler<?>> picklers = new ConcurrentHashMap<>();

  public BitPicklerRegistry(BitOrder bitOrder) {
    this(bitOrder, ConsistencyMode.current());
  }

  BitPicklerRegistry(BitOrder bitOrder, ConsistencyMode consistency) {
    this.bitOrder = Objects.requireNonNull(bitOrder, "Bit order must not be null");
    this.consistency = Objects.requireNonNull(consistency, "Consistency mode must not be null");
  }

  /// Register a type, building its layout if needed
  /// @return The pickler now registered for the type
  public <T> BitPickler<T> register(Class<T> type) {
    Objects.requireNonNull(type, "type must not be null");
    final BitPickler<?> pickler = picklers.computeIfAbsent(type, t -> {
      LOGGER.fine(() -> "Registering " + t.getName() + " with the " + bitOrder + " registry");
      return new LayoutPickler<>(t, bitOrder, consistency);
    });
    return cast(pickler);
  }

  public boolean isRegistered(Class<?> type) {
    return picklers.containsKey(type);
  }

  public Set<Class<?>> registeredTypes() {
    return Set.copyOf(picklers.keySet());
  }

  /// The pickler of a registered type
  /// @throws BitCodecException with [ErrorType#UNREGISTERED_TYPE] when the type was never registered
  public <T> BitPickler<T> resolve(Class<T> type) {
    Objects.requireNonNull(type, "type must not be null");
    final BitPickler<?> pickler = picklers.get(type);
    if (pickler == null) {
      throw new BitCodecException(UNREGISTERED_TYPE, type.getName() + " is not registered with the " + bitOrder + " registry");
    }
    return cast(pickler);
  }

  /// Serialize a value of a registered type chosen by its runtime class
  public byte[] serialize(Object value) {
    Objects.requireNonNull(value, "value must not be null");
    return resolveRuntime(value).serialize(value);
  }

  /// Serialize a value of a registered type into the start of a buffer
  /// @return The number of bits written
  public int serialize(Object value, byte[] buffer) {
    Objects.requireNonNull(value, "value must not be null");
    return resolveRuntime(value).serialize(value, buffer);
  }

  public <T> T deserialize(byte[] buffer, Class<T> type) {
    return resolve(type).deserialize(buffer);
  }

  public BitOrder bitOrder() {
    return bitOrder;
  }

  private BitPickler<Object> resolveRuntime(Object value) {
    return cast(resolve(value.getClass()));
  }

  @SuppressWarnings("unchecked")
  private static <T> BitPickler<T> cast(BitPickler<?> pickler) {
    return (BitPickler<T>) pickler;
  }
}
