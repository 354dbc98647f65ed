// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.annotation.*;

/// Marks a record component or field as encoded. The value is its length in bits; when omitted the length is the
/// natural width of a scalar or enum, or the total length of a nested type. On a list it is the length of each element.
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Documented
public @interface BitField {
  int NATURAL = -1;

  int value() default NATURAL;
}
