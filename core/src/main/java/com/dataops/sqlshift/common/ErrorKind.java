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

/**
 * Classifies why a transpile pipeline stopped or degraded. Every failure that crosses the public
 * entry point is tagged with exactly one kind.
 */
public enum ErrorKind {
  /** A placeholder could not be resolved or was malformed. */
  TEMPLATE(false),
  /** The rule provider was unreachable or returned malformed data. */
  RULE_FETCH(true),
  /** A METRIC() call named a metric the provider does not know. */
  METRIC_NOT_FOUND(true),
  /** The SQL contained more METRIC() calls than are supported. */
  MACRO_LIMIT_EXCEEDED(false),
  /** The SQL does not parse for the configured dialect. */
  PARSE(false),
  /** Strict mode and a warning of a blocking kind was detected. */
  BLOCKING_WARNING(false),
  /** Any failure not covered by the other kinds. */
  INTERNAL(false);

  private final boolean recoverable;

  ErrorKind(boolean recoverable) {
    this.recoverable = recoverable;
  }

  /**
   * Indicates whether graceful mode may downgrade this kind of failure to a warning.
   *
   * @return true if the failure can be degraded, false if it always aborts the pipeline.
   */
  public boolean isRecoverable() {
    return recoverable;
  }
}
