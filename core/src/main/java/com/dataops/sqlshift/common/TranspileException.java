/*
 * Copyright (c) 2025, The SqlShift Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.dataops.sqlshift.common;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Unchecked exception raised by the pipeline stages. The {@link ErrorKind} tag decides how the
 * orchestrator handles it; callers branch on {@link #getKind()} rather than on exception types.
 */
public class TranspileException extends RuntimeException {
  private final ErrorKind kind;
  private final String detail;

  /**
   * Constructs a new TranspileException with a formatted message.
   *
   * @param kind The kind of failure.
   * @param message The error message format string.
   * @param args The arguments to be used for formatting the error message.
   */
  @FormatMethod
  public TranspileException(ErrorKind kind, String message, Object... args) {
    super(String.format(message, args));
    this.kind = kind;
    this.detail = null;
  }

  /**
   * Constructs a new TranspileException with a cause and a formatted message.
   *
   * @param kind The kind of failure.
   * @param cause The cause of the exception (can be null).
   * @param message The error message format string.
   * @param args The arguments to be used for formatting the error message.
   */
  @FormatMethod
  public TranspileException(ErrorKind kind, Throwable cause, String message, Object... args) {
    super(String.format(message, args), cause);
    this.kind = kind;
    this.detail = null;
  }

  /**
   * Constructs a new TranspileException carrying structured detail, such as a parser diagnostic
   * or the name of an unresolved metric.
   *
   * @param kind The kind of failure.
   * @param message The error message.
   * @param detail Additional detail surfaced to the caller verbatim.
   * @param cause The cause of the exception (can be null).
   */
  public TranspileException(ErrorKind kind, String message, String detail, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.detail = detail;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Gets the structured detail of this failure.
   *
   * @return The detail, or null if none was recorded.
   */
  public String getDetail() {
    return detail;
  }
}
