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

import com.dataops.sqlshift.common.ValidationException;
import java.util.Objects;

/** A non-fatal advisory attached to a transpile result. */
public class Warning {
  private final WarningKind kind;
  private final String message;
  private final SourceLocation location;

  public Warning(WarningKind kind, String message) {
    this(kind, message, null);
  }

  /**
   * Constructs a warning.
   *
   * @param kind The kind of advisory.
   * @param message A human-readable message.
   * @param location Where the issue was found, or null if unknown.
   */
  public Warning(WarningKind kind, String message, SourceLocation location) {
    this.kind = ValidationException.checkNotNull(kind, "Warning kind cannot be null");
    this.message = ValidationException.checkNotNull(message, "Warning message cannot be null");
    this.location = location;
  }

  public WarningKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Warning warning = (Warning) o;
    return kind == warning.kind
        && message.equals(warning.message)
        && Objects.equals(location, warning.location);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message, location);
  }

  @Override
  public String toString() {
    return location == null
        ? kind + ": " + message
        : kind + " at " + location + ": " + message;
  }
}
