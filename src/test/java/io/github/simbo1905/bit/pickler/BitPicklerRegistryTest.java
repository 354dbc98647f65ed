// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.bit.pickler.Fixtures.*;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.simbo1905.bit.pickler.MsbPicklerTests.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitPicklerRegistryTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void registrationIsIdempotent() {
    final var registry = new BitPicklerRegistry(BitOrder.MSB);
    final BitPickler<Header> first = registry.register(Header.class);
    final BitPickler<Header> second = registry.register(Header.class);
    assertThat(second).isSameAs(first);
    assertThat(registry.resolve(Header.class)).isSameAs(first);
    assertThat(registry.isRegistered(Header.class)).isTrue();
    assertThat(registry.registeredTypes()).containsExactly(Header.class);
  }

  @Test
  void serializesByRuntimeClass() {
    final var registry = new BitPicklerRegistry(BitOrder.MSB);
    registry.register(Header.class);
    registry.register(CountedList.class);
    final Object[] values = {new Header(0xA, 0x58, 0x12), new CountedList(1, 0, List.of(0x11))};
    assertThat(registry.serialize(values[0])).containsExactly(bytes(0xAB, 0x12));
    assertThat(registry.serialize(values[1])).containsExactly(bytes(0x10, 0x11));
    assertThat(registry.deserialize(bytes(0x10, 0x11), CountedList.class)).isEqualTo(values[1]);
  }

  @Test
  void serializesIntoACallerBuffer() {
    final var registry = new BitPicklerRegistry(BitOrder.LSB);
    registry.register(Header.class);
    final byte[] buffer = new byte[4];
    assertThat(registry.serialize(new Header(0xA, 0x58, 0x12), buffer)).isEqualTo(16);
    assertThat(buffer).containsExactly(bytes(0x8A, 0x95, 0x00, 0x00));
    assertThat(registry.bitOrder()).isEqualTo(BitOrder.LSB);
  }

  @Test
  void unregisteredTypesAreRejected() {
    final var registry = new BitPicklerRegistry(BitOrder.MSB);
    assertThatThrownBy(() -> registry.resolve(Header.class))
        .isInstanceOfSatisfying(BitCodecException.class, e -> assertThat(e.errorType()).isEqualTo(ErrorType.UNREGISTERED_TYPE));
    assertThatThrownBy(() -> registry.serialize(new Point(1, 2)))
        .isInstanceOfSatisfying(BitCodecException.class, e -> assertThat(e.errorType()).isEqualTo(ErrorType.UNREGISTERED_TYPE));
    assertThatThrownBy(() -> registry.deserialize(bytes(0x12), Point.class))
        .isInstanceOfSatisfying(BitCodecException.class, e -> assertThat(e.errorType()).isEqualTo(ErrorType.UNREGISTERED_TYPE));
  }

  @Test
  void invalidTypesAreNotRegistered() {
    final var registry = new BitPicklerRegistry(BitOrder.MSB);
    assertThatThrownBy(() -> registry.register(LayoutBuilderTests.NoMetadata.class))
        .isInstanceOfSatisfying(BitCodecException.class, e -> assertThat(e.errorType()).isEqualTo(ErrorType.MISSING_FIELD_METADATA));
    assertThat(registry.isRegistered(LayoutBuilderTests.NoMetadata.class)).isFalse();
  }

  @Test
  void registriesPerBitOrderAreIndependent() {
    assertThat(BitPicklerRegistry.MSB.bitOrder()).isEqualTo(BitOrder.MSB);
    assertThat(BitPicklerRegistry.LSB.bitOrder()).isEqualTo(BitOrder.LSB);
    final BitPickler<Point> msb = BitPicklerRegistry.MSB.register(Point.class);
    final BitPickler<Point> lsb = BitPicklerRegistry.LSB.register(Point.class);
    assertThat(msb.serialize(new Point(1, 2))).containsExactly(bytes(0x12));
    assertThat(lsb.serialize(new Point(1, 2))).containsExactly(bytes(0x21));
    assertThat(msb.layout()).isSameAs(lsb.layout());
  }
}
