// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;

import static io.github.simbo1905.bit.pickler.Bits.checkRange;
import static io.github.simbo1905.bit.pickler.Bits.mask;

/// Most significant bit first. Bit position `p` is bit `7 - (p % 8)` of byte `p / 8`, and a field's most
/// significant bit sits at its lowest position, so the buffer reads as one big-endian bit stream.
final class MsbBitAccessor implements BitAccessor {

  private static final VarHandle LONG_BE = MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.BIG_ENDIAN);

  @Override
  public long read(byte[] buffer, int startBit, int lenBits) {
    checkRange(buffer, startBit, lenBits);
    final int startByte = startBit >>> 3;
    final int bitInByte = startBit & 7;
    if (bitInByte + lenBits <= Long.SIZE && startByte + Long.BYTES <= buffer.length) {
      final long word = (long) LONG_BE.get(buffer, startByte);
      return (word << bitInByte) >>> (Long.SIZE - lenBits);
    }
    final int endBit = startBit + lenBits;
    long value = 0L;
    for (int index = startByte; index << 3 < endBit; index++) {
      final int byteStart = index << 3;
      final int lo = Math.max(startBit, byteStart);
      final int hi = Math.min(endBit, byteStart + Byte.SIZE);
      final int count = hi - lo;
      final int shift = byteStart + Byte.SIZE - hi;
      final long bits = ((buffer[index] & 0xFFL) >>> shift) & mask(count);
      value = (value << count) | bits;
    }
    return value;
  }

  @Override
  public void write(byte[] buffer, int startBit, int lenBits, long value) {
    checkRange(buffer, startBit, lenBits);
    final long masked = value & mask(lenBits);
    final int startByte = startBit >>> 3;
    final int bitInByte = startBit & 7;
    if (bitInByte + lenBits <= Long.SIZE && startByte + Long.BYTES <= buffer.length) {
      final int shift = Long.SIZE - bitInByte - lenBits;
      final long fieldMask = mask(lenBits) << shift;
      final long word = (long) LONG_BE.get(buffer, startByte);
      LONG_BE.set(buffer, startByte, (word & ~fieldMask) | (masked << shift));
      return;
    }
    final int endBit = startBit + lenBits;
    for (int index = startByte; index << 3 < endBit; index++) {
      final int byteStart = index << 3;
      final int lo = Math.max(startBit, byteStart);
      final int hi = Math.min(endBit, byteStart + Byte.SIZE);
      final int count = hi - lo;
      final int shift = byteStart + Byte.SIZE - hi;
      // bits still to be written after this byte
      final int remaining = endBit - hi;
      final long chunk = (masked >>> remaining) & mask(count);
      final int byteMask = (int) (mask(count) << shift);
      buffer[index] = (byte) ((buffer[index] & ~byteMask) | (int) (chunk << shift));
    }
  }
}
