// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LsbBitAccessorTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  final BitAccessor accessor = BitOrder.LSB.accessor();

  @Test
  void assemblesMultiByteFieldsLittleEndian() {
    final byte[] buffer = {(byte) 0xAB, (byte) 0xCD, (byte) 0xEF, 0x12};
    assertThat(accessor.read(buffer, 0, 8)).isEqualTo(0xAB);
    assertThat(accessor.read(buffer, 8, 16)).isEqualTo(0xEFCD);
    assertThat(accessor.read(buffer, 24, 8)).isEqualTo(0x12);
  }

  @Test
  void lowNibbleComesFirst() {
    final byte[] buffer = {(byte) 0xA5};
    assertThat(accessor.read(buffer, 0, 4)).isEqualTo(0x5);
    assertThat(accessor.read(buffer, 4, 4)).isEqualTo(0xA);
  }

  @Test
  void twelveBitsStartingMidByte() {
    final byte[] buffer = {0x21, 0x43};
    assertThat(accessor.read(buffer, 0, 4)).isEqualTo(0x1);
    assertThat(accessor.read(buffer, 4, 12)).isEqualTo(0x432);
    final byte[] written = new byte[2];
    accessor.write(written, 0, 4, 0x1);
    accessor.write(written, 4, 12, 0x432);
    assertThat(written).containsExactly(0x21, 0x43);
  }

  @Test
  void writePreservesNeighbouringBits() {
    final byte[] buffer = {(byte) 0xFF, (byte) 0xFF};
    accessor.write(buffer, 4, 8, 0);
    assertThat(buffer).containsExactly(0x0F, 0xF0);
  }

  @Test
  void firstBitIsTheLeastSignificant() {
    final byte[] buffer = new byte[1];
    accessor.write(buffer, 0, 1, 1);
    assertThat(buffer).containsExactly(0x01);
    accessor.write(buffer, 7, 1, 1);
    assertThat(buffer).containsExactly(0x81);
  }

  @Test
  void fullWidthValuesAtEveryAlignment() {
    final long value = 0xFEDC_BA98_7654_3210L;
    for (int start = 0; start < 16; start++) {
      final byte[] buffer = new byte[12];
      accessor.write(buffer, start, 64, value);
      assertThat(accessor.read(buffer, start, 64)).as("start %d", start).isEqualTo(value);
    }
  }

  @Test
  void negativeIntAtFullWidth() {
    final byte[] buffer = new byte[4];
    accessor.write(buffer, 0, 32, -3);
    assertThat(buffer).containsExactly(0xFD, 0xFF, 0xFF, 0xFF);
    assertThat((int) accessor.read(buffer, 0, 32)).isEqualTo(-3);
  }

  @Test
  void rejectsRangesOutsideTheBuffer() {
    final byte[] buffer = new byte[1];
    assertThatThrownBy(() -> accessor.read(buffer, 4, 5))
        .isInstanceOfSatisfying(BitCodecException.class, e -> assertThat(e.errorType()).isEqualTo(ErrorType.BIT_RANGE_OUT_OF_BOUNDS));
    assertThatThrownBy(() -> accessor.write(buffer, 0, 0, 0L))
        .isInstanceOfSatisfying(BitCodecException.class, e -> assertThat(e.errorType()).isEqualTo(ErrorType.BIT_RANGE_OUT_OF_BOUNDS));
  }
}
