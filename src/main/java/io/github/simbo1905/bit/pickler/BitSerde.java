// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import io.github.simbo1905.bit.pickler.BitPickler.Decoded;
import io.github.simbo1905.bit.pickler.FieldDescriptor.ListInfo;
import io.github.simbo1905.bit.pickler.FieldDescriptor.PolyInfo;
import io.github.simbo1905.bit.pickler.FieldDescriptor.PolyMapping;
import io.github.simbo1905.bit.pickler.FieldDescriptor.TypeArgument;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import static io.github.simbo1905.bit.pickler.BitPickler.LOGGER;
import static io.github.simbo1905.bit.pickler.ErrorType.*;

/// Walks a [TypeLayout] to write, read or measure a value. Fields are visited in order. Each field starts at
/// `anchor + anchorDelta` where the anchor moves to the runtime end of every dynamic field traversed.
/// A call returns `anchor + (totalStaticBitLength - tailAnchorBitOffset) - bitOffset` bits.
final class BitSerde {
  static final Class<?>[] NO_BINDINGS = new Class<?>[0];

  final BitAccessor accessor;
  final ConsistencyMode consistency;

  BitSerde(BitAccessor accessor, ConsistencyMode consistency) {
    this.accessor = Objects.requireNonNull(accessor);
    this.consistency = Objects.requireNonNull(consistency);
  }

  int serialize(TypeLayout layout, Object value, byte[] buffer, int bitOffset, Class<?>[] bindings) {
    final var access = layout.access();
    int anchor = bitOffset;
    for (FieldDescriptor field : layout.fields()) {
      final int start = anchor + field.anchorDelta();
      final Object fieldValue = access.get(value, field.index());
      switch (field.kind()) {
        case PRIMITIVE, ENUM -> accessor.write(buffer, start, field.bitLength(), Bits.toRaw(convertToRaw(field, required(layout, field, fieldValue))));
        case NESTED -> {
          final int used = serialize(field.nested(), required(layout, field, fieldValue), buffer, start, bind(field, bindings));
          if (field.dynamic()) {
            anchor = start + used;
          }
        }
        case LIST -> {
          final int used = writeList(layout, field, value, required(layout, field, fieldValue), buffer, start, bindings);
          if (field.dynamic()) {
            anchor = start + used;
          }
        }
        case POLYMORPHIC -> {
          final PolyMapping mapping = variantOf(layout, field, value, required(layout, field, fieldValue));
          serialize(mapping.layout(), fieldValue, buffer, start, NO_BINDINGS);
        }
        case GENERIC_SLOT -> {
          final Object occupant = required(layout, field, fieldValue);
          final int used = serialize(Layouts.layoutOf(occupant.getClass()), occupant, buffer, start, NO_BINDINGS);
          anchor = start + used;
        }
      }
    }
    return anchor + layout.totalStaticBitLength() - layout.tailAnchorBitOffset() - bitOffset;
  }

  /// The exact number of bits `serialize` will write. Checks counts and variants without touching a buffer.
  int bitLengthOf(TypeLayout layout, Object value, Class<?>[] bindings) {
    int anchor = 0;
    for (FieldDescriptor field : layout.fields()) {
      final int start = anchor + field.anchorDelta();
      if (field.kind() == FieldKind.PRIMITIVE || field.kind() == FieldKind.ENUM) {
        continue;
      }
      final Object fieldValue = required(layout, field, layout.access().get(value, field.index()));
      switch (field.kind()) {
        case NESTED -> {
          final int used = bitLengthOf(field.nested(), fieldValue, bind(field, bindings));
          if (field.dynamic()) {
            anchor = start + used;
          }
        }
        case LIST -> {
          final int used = listLength(layout, field, value, fieldValue, bindings);
          if (field.dynamic()) {
            anchor = start + used;
          }
        }
        case POLYMORPHIC -> {
          final PolyMapping mapping = variantOf(layout, field, value, fieldValue);
          bitLengthOf(mapping.layout(), fieldValue, NO_BINDINGS);
        }
        case GENERIC_SLOT -> anchor = start + bitLengthOf(Layouts.layoutOf(fieldValue.getClass()), fieldValue, NO_BINDINGS);
        default -> {
        }
      }
    }
    return anchor + layout.totalStaticBitLength() - layout.tailAnchorBitOffset();
  }

  Decoded<Object> deserialize(TypeLayout layout, byte[] buffer, int bitOffset, Class<?>[] bindings) {
    final var access = layout.access();
    final Object[] values = access.defaults();
    int anchor = bitOffset;
    for (FieldDescriptor field : layout.fields()) {
      final int start = anchor + field.anchorDelta();
      switch (field.kind()) {
        case PRIMITIVE, ENUM -> values[field.index()] = convertToLogical(field, Bits.fromRaw(accessor.read(buffer, start, field.bitLength()), field.type()));
        case NESTED -> {
          final Decoded<Object> nested = deserialize(field.nested(), buffer, start, bind(field, bindings));
          values[field.index()] = nested.value();
          if (field.dynamic()) {
            anchor = start + nested.bitLength();
          }
        }
        case LIST -> {
          final Decoded<Object> list = readList(layout, field, values, buffer, start, bindings);
          values[field.index()] = list.value();
          if (field.dynamic()) {
            anchor = start + list.bitLength();
          }
        }
        case POLYMORPHIC -> {
          final PolyInfo poly = field.polyInfo();
          final long discriminator = discriminatorOf(poly, values[poly.discriminatorIndex()]);
          final PolyMapping mapping = poly.forValue(discriminator).orElseThrow(() ->
              new BitCodecException(UNKNOWN_VARIANT, "No variant of " + layout.type().getSimpleName() + "." + field.name() +
                  " is mapped to discriminator " + discriminator));
          LOGGER.finer(() -> "Discriminator " + discriminator + " selects " + mapping.type().getSimpleName() +
              " for " + layout.type().getSimpleName() + "." + field.name());
          values[field.index()] = deserialize(mapping.layout(), buffer, start, NO_BINDINGS).value();
        }
        case GENERIC_SLOT -> {
          final int parameter = field.typeParameterIndex();
          final Class<?> bound = parameter < bindings.length ? bindings[parameter] : null;
          if (bound == null) {
            throw new BitCodecException(UNBOUND_TYPE_PARAMETER, "Field " + field.name() + " of " + layout.type().getName() +
                " has type parameter " + layout.type().getTypeParameters()[parameter].getName() + " with no class bound to it");
          }
          final Decoded<Object> occupant = deserialize(Layouts.layoutOf(bound), buffer, start, NO_BINDINGS);
          values[field.index()] = occupant.value();
          anchor = start + occupant.bitLength();
        }
      }
    }
    final Object instance = access.construct(values);
    return new Decoded<>(instance, anchor + layout.totalStaticBitLength() - layout.tailAnchorBitOffset() - bitOffset);
  }

  int writeList(TypeLayout owner, FieldDescriptor field, Object ownerValue, Object list, byte[] buffer, int start, Class<?>[] bindings) {
    final ListInfo info = field.listInfo();
    final int count = count(owner, field, ownerValue, list);
    final Class<?>[] elementBindings = bind(field, bindings);
    int cursor = start;
    for (int i = 0; i < count; i++) {
      final Object element = element(owner, field, list, i);
      switch (info.elementKind()) {
        case PRIMITIVE, ENUM -> {
          accessor.write(buffer, cursor, info.elementBitLength(), Bits.toRaw(element));
          cursor += info.elementBitLength();
        }
        default -> {
          final int used = serialize(info.elementLayout(), element, buffer, cursor, elementBindings);
          cursor += info.staticElements() ? info.elementBitLength() : used;
        }
      }
    }
    return cursor - start;
  }

  int listLength(TypeLayout owner, FieldDescriptor field, Object ownerValue, Object list, Class<?>[] bindings) {
    final ListInfo info = field.listInfo();
    final int count = count(owner, field, ownerValue, list);
    if (info.elementLayout() == null) {
      return Math.multiplyExact(count, info.elementBitLength());
    }
    final Class<?>[] elementBindings = bind(field, bindings);
    int total = 0;
    for (int i = 0; i < count; i++) {
      final int used = bitLengthOf(info.elementLayout(), element(owner, field, list, i), elementBindings);
      total = Math.addExact(total, info.staticElements() ? info.elementBitLength() : used);
    }
    return total;
  }

  Decoded<Object> readList(TypeLayout owner, FieldDescriptor field, Object[] values, byte[] buffer, int start, Class<?>[] bindings) {
    final ListInfo info = field.listInfo();
    final int count;
    if (info.fixedCount().isPresent()) {
      count = info.fixedCount().getAsInt();
    } else {
      final long raw = Bits.toRaw(values[info.countFieldIndex()]) & Bits.mask(info.countFieldBitLength());
      if (raw > Integer.MAX_VALUE) {
        throw new BitCodecException(COUNT_MISMATCH, "Count field " + info.countFieldName().orElseThrow() + " of " +
            owner.type().getSimpleName() + " holds " + raw + " which is too many elements");
      }
      count = (int) raw;
    }
    // every element occupies at least one bit
    final long minimumBits = Math.max(1, info.staticElements() || info.elementLayout() == null
        ? info.elementBitLength() : info.elementLayout().totalStaticBitLength());
    if ((long) start + count * minimumBits > (long) buffer.length * Byte.SIZE) {
      throw new BitCodecException(BIT_RANGE_OUT_OF_BOUNDS, "List " + owner.type().getSimpleName() + "." + field.name() +
          " of " + count + " elements of at least " + minimumBits + " bits at bit " + start +
          " extends past a buffer of " + buffer.length + " bytes");
    }
    final Class<?>[] elementBindings = bind(field, bindings);
    final List<Object> elements = new ArrayList<>(Math.min(count, 1024));
    int cursor = start;
    for (int i = 0; i < count; i++) {
      switch (info.elementKind()) {
        case PRIMITIVE, ENUM -> {
          elements.add(Bits.fromRaw(accessor.read(buffer, cursor, info.elementBitLength()), info.elementType()));
          cursor += info.elementBitLength();
        }
        default -> {
          final Decoded<Object> element = deserialize(info.elementLayout(), buffer, cursor, elementBindings);
          elements.add(element.value());
          cursor += info.staticElements() ? info.elementBitLength() : element.bitLength();
        }
      }
    }
    if (info.arrayLike()) {
      final Object array = Array.newInstance(info.elementType(), count);
      for (int i = 0; i < count; i++) {
        Array.set(array, i, elements.get(i));
      }
      return new Decoded<>(array, cursor - start);
    }
    return new Decoded<>(elements, cursor - start);
  }

  /// The number of elements to write, checked against the list size
  int count(TypeLayout owner, FieldDescriptor field, Object ownerValue, Object list) {
    final ListInfo info = field.listInfo();
    final int size = list.getClass().isArray() ? Array.getLength(list) : ((List<?>) list).size();
    final long count;
    if (info.fixedCount().isPresent()) {
      count = info.fixedCount().getAsInt();
    } else {
      final String countField = info.countFieldName().orElseThrow();
      final Object countValue = Objects.requireNonNull(owner.access().get(ownerValue, info.countFieldIndex()),
          () -> "Count field " + countField + " of " + owner.type().getName() + " must not be null");
      count = Bits.toRaw(countValue) & Bits.mask(info.countFieldBitLength());
    }
    if (count > size || (consistency == ConsistencyMode.STRICT && count != size)) {
      throw new BitCodecException(COUNT_MISMATCH, owner.type().getSimpleName() + "." + field.name() + " has " + size +
          " elements but its " + (info.fixedCount().isPresent() ? "fixed count" : "count field " +
          info.countFieldName().orElseThrow()) + " is " + count);
    }
    return (int) count;
  }

  /// The mapping of the occupant's class, checked against the discriminator field
  PolyMapping variantOf(TypeLayout owner, FieldDescriptor field, Object ownerValue, Object occupant) {
    final PolyInfo poly = field.polyInfo();
    final PolyMapping mapping = poly.forType(occupant.getClass()).orElseThrow(() ->
        new BitCodecException(UNKNOWN_VARIANT, occupant.getClass().getName() + " is not mapped as a variant of " +
            owner.type().getSimpleName() + "." + field.name()));
    if (consistency == ConsistencyMode.STRICT) {
      final Object discriminatorValue = owner.access().get(ownerValue, poly.discriminatorIndex());
      final long discriminator = discriminatorOf(poly, discriminatorValue);
      if (discriminator != mapping.value()) {
        throw new BitCodecException(DISCRIMINATOR_MISMATCH, owner.type().getSimpleName() + "." + field.name() +
            " holds a " + occupant.getClass().getSimpleName() + " mapped to " + mapping.value() + " but " +
            poly.discriminatorFieldName() + " is " + discriminator);
      }
    }
    return mapping;
  }

  static long discriminatorOf(PolyInfo poly, Object discriminatorValue) {
    Objects.requireNonNull(discriminatorValue, () -> "Discriminator " + poly.discriminatorFieldName() + " must not be null");
    return Bits.toRaw(discriminatorValue) & Bits.mask(poly.discriminatorBitLength());
  }

  static Object element(TypeLayout owner, FieldDescriptor field, Object list, int index) {
    final Object element = field.listInfo().arrayLike() ? Array.get(list, index) : ((List<?>) list).get(index);
    return Objects.requireNonNull(element, () -> "Element " + index + " of " + owner.type().getSimpleName() + "." +
        field.name() + " must not be null");
  }

  /// The classes bound to the type parameters of a nested type or of list elements
  static Class<?>[] bind(FieldDescriptor field, Class<?>[] bindings) {
    final List<TypeArgument> arguments = field.typeArguments();
    if (arguments.isEmpty()) {
      return NO_BINDINGS;
    }
    final Class<?>[] bound = new Class<?>[arguments.size()];
    for (int i = 0; i < bound.length; i++) {
      final TypeArgument argument = arguments.get(i);
      if (argument.fixed() != null) {
        bound[i] = argument.fixed();
      } else if (argument.parameterIndex() < bindings.length) {
        bound[i] = bindings[argument.parameterIndex()];
      }
    }
    return bound;
  }

  static Object required(TypeLayout layout, FieldDescriptor field, Object value) {
    return Objects.requireNonNull(value, () -> "Field " + field.name() + " of " + layout.type().getName() + " must not be null");
  }

  static Object convertToRaw(FieldDescriptor field, Object logical) {
    final var converter = field.converter();
    if (converter == null) {
      return logical;
    }
    return checked(field, () -> converter.toRaw(logical));
  }

  static Object convertToLogical(FieldDescriptor field, Object raw) {
    final var converter = field.converter();
    if (converter == null) {
      return raw;
    }
    return checked(field, () -> converter.toLogical(raw));
  }

  static Object checked(FieldDescriptor field, Supplier<Object> conversion) {
    final Object converted;
    try {
      converted = conversion.get();
    } catch (BitCodecException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BitCodecException(CONVERTER_FAILED, "Converter of field " + field.name() + " failed", e);
    }
    if (!Bits.boxed(field.type()).isInstance(converted)) {
      throw new BitCodecException(CONVERTER_FAILED, "Converter of field " + field.name() + " returned " +
          (converted == null ? "null" : converted.getClass().getName()) + " for a " + field.type().getSimpleName());
    }
    return converted;
  }
}
