// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.annotation.*;

/// A fixed number of list elements. Takes priority over a count field named with [BitRelated].
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Documented
public @interface BitCount {
  int value();
}
