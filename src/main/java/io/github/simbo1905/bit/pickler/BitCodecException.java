// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.bit.pickler;

/// Thrown by all bit pickler operations. The [ErrorType] says which rule was broken.
public class BitCodecException extends RuntimeException {
  private final ErrorType errorType;

  public BitCodecException(ErrorType errorType, String message) {
    super(message);
    this.errorType = errorType;
  }

  public BitCodecException(ErrorType errorType, String message, Throwable cause) {
    super(message, cause);
    this.errorType = errorType;
  }

  public ErrorType errorType() {
    return errorType;
  }

  @Override
  public String toString() {
    return String.format("BitCodecException{type=%s, message='%s'}", errorType, getMessage());
  }
}
