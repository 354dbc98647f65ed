// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

import java.lang.annotation.*;

/// Applies a [BitValueConverter] around the raw bits of a scalar or enum field
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
@Documented
public @interface BitConvert {
  Class<? extends BitValueConverter<?>> value();
}
