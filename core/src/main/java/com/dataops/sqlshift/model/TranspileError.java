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
package com.dataops.sqlshift.model;

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import java.util.Objects;

/** The error carried by a failed {@link TranspileResult}: a kind tag plus message and detail. */
public class TranspileError {
  private final ErrorKind kind;
  private final String message;
  private final String detail;
  private final TranspileStage stage;

  public TranspileError(ErrorKind kind, String message, String detail, TranspileStage stage) {
    this.kind = kind;
    this.message = message;
    this.detail = detail;
    this.stage = stage;
  }

  /**
   * Captures an exception raised by a pipeline stage.
   *
   * @param exception The stage failure.
   * @param stage The stage that was running.
   * @return The error value.
   */
  public static TranspileError from(TranspileException exception, TranspileStage stage) {
    return new TranspileError(
        exception.getKind(), exception.getMessage(), exception.getDetail(), stage);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  public String getDetail() {
    return detail;
  }

  public TranspileStage getStage() {
    return stage;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TranspileError that = (TranspileError) o;
    return kind == that.kind
        && Objects.equals(message, that.message)
        && Objects.equals(detail, that.detail)
        && stage == that.stage;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message, detail, stage);
  }

  @Override
  public String toString() {
    return kind + " during " + stage + ": " + message + (detail == null ? "" : " (" + detail + ")");
  }
}
