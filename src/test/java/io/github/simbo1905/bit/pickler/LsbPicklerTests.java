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

/// Layouts are shared between bit orders. Only the placement of bits within the buffer differs.
class LsbPicklerTests {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  record Registers(@BitField(8) int status, @BitField(16) int counter, @BitField(8) int flags) {
  }

  @Test
  void multiByteFieldsAreLittleEndian() {
    final var pickler = BitPickler.lsb(Registers.class);
    final Registers registers = pickler.deserialize(bytes(0xAB, 0xCD, 0xEF, 0x12));
    assertThat(registers).isEqualTo(new Registers(0xAB, 0xEFCD, 0x12));
    assertThat(pickler.serialize(registers)).containsExactly(bytes(0xAB, 0xCD, 0xEF, 0x12));
    assertThat(pickler.bitOrder()).isEqualTo(BitOrder.LSB);
  }

  @Test
  void firstFieldTakesTheLowBits() {
    final var pickler = BitPickler.lsb(Nibbles.class);
    final Nibbles nibbles = pickler.deserialize(bytes(0xA5, 0x67, 0x80));
    assertThat(nibbles).isEqualTo(new Nibbles(0x5, 0xA, 0x067, 0x8));
    assertThat(pickler.serialize(nibbles)).containsExactly(bytes(0xA5, 0x67, 0x80));
  }

  @Test
  void fieldsStraddlingBytes() {
    final var pickler = BitPickler.lsb(Header.class);
    final var header = new Header(0xA, 0x58, 0x12);
    assertThat(pickler.serialize(header)).containsExactly(bytes(0x8A, 0x95));
    assertThat(pickler.deserialize(bytes(0x8A, 0x95))).isEqualTo(header);
  }

  @Test
  void countedList() {
    final var pickler = BitPickler.lsb(CountedList.class);
    final var list = new CountedList(3, 0, List.of(0x11, 0x22, 0x33));
    assertThat(pickler.serialize(list)).containsExactly(bytes(0x03, 0x11, 0x22, 0x33));
    assertThat(pickler.deserialize(bytes(0x03, 0x11, 0x22, 0x33))).isEqualTo(list);
  }

  @Test
  void arrayElementsStraddlingBytes() {
    final var pickler = BitPickler.lsb(Samples.class);
    assertThat(pickler.serialize(new Samples(2, new int[]{0xABC, 0x123}))).containsExactly(bytes(0xC2, 0xAB, 0x23, 0x01));
    assertThat(pickler.deserialize(bytes(0xC2, 0xAB, 0x23, 0x01)).values()).containsExactly(0xABC, 0x123);
  }

  @Test
  void polymorphicSlot() {
    final var pickler = BitPickler.lsb(Container.class);
    assertThat(pickler.serialize(new Container(1, new TypeA(0xAA, 0xBB)))).containsExactly(bytes(0x01, 0xAA, 0xBB, 0x00));
    assertThat(pickler.serialize(new Container(2, new TypeB(0x11, 0x2233)))).containsExactly(bytes(0x02, 0x11, 0x33, 0x22));
    assertThat(pickler.deserialize(bytes(0x02, 0x11, 0x33, 0x22))).isEqualTo(new Container(2, new TypeB(0x11, 0x2233)));
  }

  @Test
  void signedValues() {
    final var pickler = BitPickler.lsb(Signed.class);
    assertThat(pickler.serialize(new Signed(-3, -3))).containsExactly(bytes(0xFD, 0xFF, 0xFF, 0xFF, 0xFD));
    assertThat(pickler.deserialize(bytes(0xFD, 0xFF, 0xFF, 0xFF, 0xFD))).isEqualTo(new Signed(-3, 0xFD));
  }

  @Test
  void enumInTheLowBits() {
    final var pickler = BitPickler.lsb(Pixel.class);
    assertThat(pickler.serialize(new Pixel(Colour.BLUE, 5))).containsExactly(bytes(0x16));
    assertThat(pickler.deserialize(bytes(0x16))).isEqualTo(new Pixel(Colour.BLUE, 5));
  }

  @Test
  @SuppressWarnings({"rawtypes", "unchecked"})
  void genericSlotFollowedByAStaticField() {
    final BitPickler<Envelope> pickler = BitPickler.lsb(Envelope.class, Pong.class);
    final var envelope = new Envelope<>(1, new Pong(0x12, 0x3), 0xEE);
    assertThat(pickler.serialize(envelope)).containsExactly(bytes(0x01, 0x12, 0xE3, 0x0E));
    assertThat(pickler.deserialize(bytes(0x01, 0x12, 0xE3, 0x0E))).isEqualTo(envelope);
  }

  @Test
  void bitOffsetRoundTrip() {
    final var pickler = BitPickler.lsb(Registers.class);
    final var registers = new Registers(0xAB, 0xEFCD, 0x12);
    for (int offset = 0; offset < 16; offset++) {
      final byte[] buffer = new byte[6];
      assertThat(pickler.serialize(registers, buffer, offset)).isEqualTo(32);
      assertThat(pickler.deserialize(buffer, offset)).as("offset %d", offset).isEqualTo(registers);
    }
  }
}
