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

import java.util.Objects;

/** A 1-based line and column within SQL text. */
public final class SourceLocation {
  private final int line;
  private final int column;

  public SourceLocation(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /**
   * Computes the location of a character offset.
   *
   * @param text The text the offset points into.
   * @param offset The 0-based character offset.
   * @return The 1-based line and column of the offset.
   */
  public static SourceLocation ofOffset(String text, int offset) {
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset && i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    return new SourceLocation(line, offset - lineStart + 1);
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SourceLocation that)) {
      return false;
    }
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, column);
  }

  @Override
  public String toString() {
    return "line " + line + ", column " + column;
  }
}
