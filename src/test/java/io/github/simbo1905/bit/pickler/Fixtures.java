// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.List;

/// Record and class shapes shared by the tests
public interface Fixtures {

  /// 4 + 7 + 5 bits
  record Header(@BitField(4) int header, @BitField(7) int value, @BitField(5) int footer) {
  }

  /// 4 + 4 + 12 + 4 bits
  record Nibbles(@BitField(4) int nibbleHigh, @BitField(4) int nibbleLow, @BitField(12) int twelveBits,
                 @BitField(4) int tail) {
  }

  record CountedList(@BitField(4) int count, @BitField(4) int reserved,
                     @BitField(8) @BitRelated("count") List<Integer> items) {
  }

  record FixedWins(@BitField(8) int count, @BitField(8) @BitCount(2) @BitRelated("count") List<Integer> items) {
  }

  /// A dynamic list followed by a static field
  record Trailer(@BitField(8) int count, @BitField(8) @BitRelated("count") List<Integer> items,
                 @BitField(8) int checksum) {
  }

  record TwoLists(@BitField(4) int first, @BitField(4) int second,
                  @BitField(8) @BitRelated("first") List<Integer> firstItems,
                  @BitField(8) @BitRelated("second") List<Integer> secondItems,
                  @BitField(8) int end) {
  }

  /// A list of elements which each have a dynamic length
  record Batch(@BitField(8) int size, @BitField @BitRelated("size") List<CountedList> lists) {
  }

  record Samples(@BitField(4) int count, @BitField(12) @BitRelated("count") int[] values) {
  }

  record Point(@BitField(4) int x, @BitField(4) int y) {
  }

  record Segment(@BitField Point from, @BitField Point to, @BitField(4) int colour) {
  }

  /// A nested type padded to 12 bits
  record Padded(@BitField(12) Point point, @BitField(4) int tag) {
  }

  record Polygon(@BitField(8) @BitCount(3) List<Point> corners) {
  }

  record Signed(@BitField int full, @BitField(8) int narrow) {
  }

  record Widths(@BitField byte b, @BitField short s, @BitField char c, @BitField long l, @BitField boolean flag) {
  }

  enum Colour {RED, GREEN, BLUE}

  enum Opcode implements BitEnum {
    NOP(0x0), READ(0x5), WRITE(0xA);

    private final long code;

    Opcode(long code) {
      this.code = code;
    }

    @Override
    public long bitValue() {
      return code;
    }
  }

  record Pixel(@BitField(2) Colour colour, @BitField(6) int level) {
  }

  record Command(@BitField(4) Opcode opcode, @BitField(4) int argument) {
  }

  record Palette(@BitField(4) int size, @BitField(2) @BitRelated("size") List<Colour> colours) {
  }

  record WithIgnored(@BitField(8) int a, @BitIgnore String note, @BitField(8) int b) {
  }

  sealed interface Message permits TypeA, TypeB, TypeC {
  }

  record TypeA(@BitField(8) int commonField, @BitField(8) int fieldA) implements Message {
  }

  record TypeB(@BitField(8) int commonField, @BitField(16) int fieldB) implements Message {
  }

  record TypeC(@BitField(8) int commonField, @BitField(8) int c1, @BitField(8) int c2) implements Message {
  }

  record Container(@BitField(8) int messageType,
                   @BitField @BitRelated("messageType")
                   @BitPoly(id = 1, type = TypeA.class)
                   @BitPoly(id = 2, type = TypeB.class)
                   @BitPoly(id = 3, type = TypeC.class) Message payload) {
  }

  enum Kind {POINT, SEGMENT}

  interface Shape {
  }

  record Dot(@BitField(8) int x) implements Shape {
  }

  record Line(@BitField(8) int x1, @BitField(8) int x2) implements Shape {
  }

  /// A shape no drawing maps
  record Square(@BitField(8) int side) implements Shape {
  }

  /// An enum discriminator and an explicit slot wider than every variant
  record Drawing(@BitField(1) Kind kind,
                 @BitField(20) @BitRelated("kind")
                 @BitPoly(id = 0, type = Dot.class)
                 @BitPoly(id = 1, type = Line.class) Shape shape,
                 @BitField(3) int layer) {
  }

  record Envelope<T>(@BitField(8) int kind, @BitField T payload, @BitField(8) int trailer) {
  }

  record Ping(@BitField(16) int sequence) {
  }

  record Pong(@BitField(8) int sequence, @BitField(4) int code) {
  }

  record Wrapped(@BitField(4) int a, @BitField(4) int b, @BitField Envelope<Ping> envelope) {
  }

  record Relay<T>(@BitField(8) int hops, @BitField Envelope<T> inner) {
  }

  /// Adds 10 when reading and subtracts 10 when writing
  final class OffsetConverter implements BitValueConverter<Integer> {
    @Override
    public Integer toLogical(Integer raw) {
      return raw + 10;
    }

    @Override
    public Integer toRaw(Integer logical) {
      return logical - 10;
    }
  }

  final class InvertConverter implements BitValueConverter<Integer> {
    @Override
    public Integer toLogical(Integer raw) {
      return raw ^ 0xFF;
    }

    @Override
    public Integer toRaw(Integer logical) {
      return logical ^ 0xFF;
    }
  }

  /// Stores half the logical value
  final class HalvingConverter implements BitValueConverter<Integer> {
    @Override
    public Integer toLogical(Integer raw) {
      return raw * 2;
    }

    @Override
    public Integer toRaw(Integer logical) {
      return logical / 2;
    }
  }

  final class FailingConverter implements BitValueConverter<Integer> {
    @Override
    public Integer toLogical(Integer raw) {
      throw new IllegalStateException("cannot read " + raw);
    }

    @Override
    public Integer toRaw(Integer logical) {
      throw new IllegalStateException("cannot write " + logical);
    }
  }

  final class NextColour implements BitValueConverter<Colour> {
    @Override
    public Colour toLogical(Colour raw) {
      return Colour.values()[(raw.ordinal() + 1) % Colour.values().length];
    }

    @Override
    public Colour toRaw(Colour logical) {
      return Colour.values()[(logical.ordinal() + 2) % Colour.values().length];
    }
  }

  record Temperature(@BitField(8) @BitConvert(OffsetConverter.class) int celsius) {
  }

  record Inverted(@BitField(8) @BitConvert(InvertConverter.class) int value) {
  }

  record Halved(@BitField(8) @BitConvert(HalvingConverter.class) int value) {
  }

  record Failing(@BitField(8) @BitConvert(FailingConverter.class) int value) {
  }

  record Shifted(@BitField(2) @BitConvert(NextColour.class) Colour colour, @BitField(6) int level) {
  }

  /// Superclass fields form a prefix of every subclass layout
  abstract class BaseMessage {
    @BitField(8)
    int commonField;
  }

  class MessageTypeA extends BaseMessage {
    @BitField(8)
    int fieldA;
  }

  class MessageTypeB extends BaseMessage {
    @BitField(16)
    int fieldB;
  }

  class MessageTypeC extends BaseMessage {
    @BitField(8)
    int c1;
    @BitField(8)
    int c2;
  }

  class MessageContainer {
    @BitField(8)
    int messageType;

    @BitField
    @BitRelated("messageType")
    @BitPoly(id = 1, type = MessageTypeA.class)
    @BitPoly(id = 2, type = MessageTypeB.class)
    @BitPoly(id = 3, type = MessageTypeC.class)
    BaseMessage payload;
  }

  class FrameHeader {
    @BitField(4)
    int version;
    @BitField(4)
    int flags;
  }

  class Frame extends FrameHeader {
    @BitField(8)
    int length;
    @BitIgnore
    String label;
    @BitField(8)
    @BitRelated("length")
    List<Integer> body;
  }
}
