// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;

import static io.github.simbo1905.bit.pickler.Bits.checkRange;
import static io.github.simbo1905.bit.pickler.Bits.mask;

/// Least significant bit first. Bit position `p` is bit `p % 8` of byte `p / 8`, and bit `i` of a field
/// sits at position `start + i`, so multi-byte fields assemble little-endian.
final class LsbBitAccessor implements BitAccessor {

  private static final VarHandle LONG_LE = MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.LITTLE_ENDIAN);

  @Override
  public long read(byte[] buffer, int startBit, int lenBits) {
    checkRange(buffer, startBit, lenBits);
    final int startByte = startBit >>> 3;
    final int bitInByte = startBit & 7;
    if (bitInByte + lenBits <= Long.SIZE && startByte + Long.BYTES <= buffer.length) {
      final long word = (long) LONG_LE.get(buffer, startByte);
      return (word >>> bitInByte) & mask(lenBits);
    }
    final int endBit = startBit + lenBits;
    long value = 0L;
    for (int index = startByte; index << 3 < endBit; index++) {
      final int byteStart = index << 3;
      final int lo = Math.max(startBit, byteStart);
      final int hi = Math.min(endBit, byteStart + Byte.SIZE);
      final long bits = ((buffer[index] & 0xFFL) >>> (lo - byteStart)) & mask(hi - lo);
      value |= bits << (lo - startBit);
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
      final long fieldMask = mask(lenBits) << bitInByte;
      final long word = (long) LONG_LE.get(buffer, startByte);
      LONG_LE.set(buffer, startByte, (word & ~fieldMask) | (masked << bitInByte));
      return;
    }
    final int endBit = startBit + lenBits;
    for (int index = startByte; index << 3 < endBit; index++) {
      final int byteStart = index << 3;
      final int lo = Math.max(startBit, byteStart);
      final int hi = Math.min(endBit, byteStart + Byte.SIZE);
      final int shift = lo - byteStart;
      final long chunk = (masked >>> (lo - startBit)) & mask(hi - lo);
      final int byteMask = (int) (mask(hi - lo) << shift);
      buffer[index] = (byte) ((buffer[index] & ~byteMask) | (int) (chunk << shift));
    }
  }
}
