// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static io.github.simbo1905.bit.pickler.BitPickler.LOGGER;
import static io.github.simbo1905.bit.pickler.ErrorType.UNSUPPORTED_FIELD_TYPE;

/// The process-wide cache of type layouts. Layouts are built outside the map and published with `putIfAbsent`,
/// so a layout built concurrently by two threads is built twice and one copy is discarded.
sealed interface Layouts permits Layouts.Nothing {

  record Nothing() implements Layouts {
  }

  ConcurrentHashMap<Class<?>, TypeLayout> CACHE = new ConcurrentHashMap<>();

  static TypeLayout layoutOf(Class<?> type) {
    Objects.requireNonNull(type, "type must not be null");
    return layoutOf(type, new ArrayDeque<>());
  }

  /// Fetch or build a layout while other layouts are being built
  /// @param inProgress The types whose layouts are being built on this call stack
  static TypeLayout layoutOf(Class<?> type, Deque<Class<?>> inProgress) {
    final TypeLayout cached = CACHE.get(type);
    if (cached != null) {
      return cached;
    }
    if (inProgress.contains(type)) {
      final String path = StreamSupport.stream(((Iterable<Class<?>>) inProgress::descendingIterator).spliterator(), false)
          .map(Class::getSimpleName)
          .collect(Collectors.joining(" -> "));
      throw new BitCodecException(UNSUPPORTED_FIELD_TYPE, "Recursive layout " + path + " -> " + type.getSimpleName() +
          " has no finite bit length");
    }
    inProgress.push(type);
    final TypeLayout built;
    try {
      built = new LayoutBuilder(type, inProgress).build();
    } finally {
      inProgress.pop();
    }
    final TypeLayout raced = CACHE.putIfAbsent(type, built);
    return raced != null ? raced : built;
  }

  static void clearCache() {
    final int size = CACHE.size();
    CACHE.clear();
    LOGGER.info(() -> "Cleared " + size + " cached bit layouts");
  }
}
