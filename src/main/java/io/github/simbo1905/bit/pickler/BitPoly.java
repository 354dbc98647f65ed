// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.annotation.*;

/// Maps a discriminator value to the concrete type that occupies a polymorphic field
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Documented
@Repeatable(BitPolys.class)
public @interface BitPoly {
  long id();

  Class<?> type();
}
