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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A dotted table identifier such as {@code catalog.schema.table}, held as unquoted parts. Quoted
 * parts are unwrapped; a backtick-quoted part containing dots is split into its segments, which is
 * how BigQuery writes whole paths. Comparison ignores case.
 */
public final class QualifiedName {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final List<String> parts;

  private QualifiedName(List<String> parts) {
    ValidationException.check(!parts.isEmpty(), "Qualified name must have at least one part");
    for (String part : parts) {
      ValidationException.check(
          part != null && !part.isBlank(), "Qualified name %s has an empty part", parts);
    }
    this.parts = ImmutableList.copyOf(parts);
  }

  /**
   * Parses dotted text, honoring double quotes, backticks and square brackets.
   *
   * @param text The identifier text, e.g. {@code raw.events} or {@code `proj.ds.t`}.
   * @return The qualified name.
   * @throws ValidationException if the text is blank, has empty parts or an unclosed quote.
   */
  public static QualifiedName parse(String text) {
    ValidationException.checkNotBlank(text, "Table identifier cannot be blank");
    List<String> rawParts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    char closingQuote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (closingQuote != 0) {
        current.append(c);
        if (c == closingQuote) {
          closingQuote = 0;
        }
      } else if (c == '"' || c == '`') {
        closingQuote = c;
        current.append(c);
      } else if (c == '[') {
        closingQuote = ']';
        current.append(c);
      } else if (c == '.') {
        rawParts.add(current.toString().trim());
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    ValidationException.check(closingQuote == 0, "Unclosed quote in identifier %s", text);
    rawParts.add(current.toString().trim());
    return fromRawParts(rawParts);
  }

  /**
   * Builds a name from identifier parts as written in SQL, outermost first.
   *
   * @param rawParts The parts, possibly quoted. Null parts are skipped.
   * @return The qualified name.
   */
  public static QualifiedName fromRawParts(List<String> rawParts) {
    List<String> parts = new ArrayList<>();
    for (String raw : rawParts) {
      if (raw == null) {
        continue;
      }
      if (isQuoted(raw, '`', '`')) {
        DOT_SPLITTER.split(raw.substring(1, raw.length() - 1)).forEach(parts::add);
      } else if (isQuoted(raw, '"', '"')) {
        parts.add(raw.substring(1, raw.length() - 1).replace("\"\"", "\""));
      } else if (isQuoted(raw, '[', ']')) {
        parts.add(raw.substring(1, raw.length() - 1));
      } else {
        parts.add(raw);
      }
    }
    return new QualifiedName(parts);
  }

  private static boolean isQuoted(String raw, char open, char close) {
    return raw.length() >= 2 && raw.charAt(0) == open && raw.charAt(raw.length() - 1) == close;
  }

  public List<String> getParts() {
    return parts;
  }

  public int size() {
    return parts.size();
  }

  /**
   * Checks whether the trailing parts of this name equal all parts of {@code suffix}, ignoring
   * case. {@code hive.raw.events} ends with {@code raw.events} and with {@code events}, but
   * {@code events} does not end with {@code raw.events}.
   *
   * @param suffix The candidate suffix.
   * @return true if this name ends with the suffix.
   */
  public boolean endsWith(QualifiedName suffix) {
    int offset = parts.size() - suffix.parts.size();
    if (offset < 0) {
      return false;
    }
    for (int i = 0; i < suffix.parts.size(); i++) {
      if (!parts.get(offset + i).equalsIgnoreCase(suffix.parts.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Renders the name for a dialect, quoting parts that are not plain identifiers.
   *
   * @param dialect The target dialect.
   * @return The rendered identifier.
   */
  public String render(Dialect dialect) {
    List<String> rendered = new ArrayList<>(parts.size());
    for (String part : parts) {
      rendered.add(dialect.quoteIfNeeded(part));
    }
    return String.join(".", rendered);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QualifiedName other)) {
      return false;
    }
    return parts.size() == other.parts.size() && endsWith(other);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parts.stream().map(p -> p.toLowerCase(Locale.ROOT)).toArray());
  }

  @Override
  public String toString() {
    return String.join(".", parts);
  }
}
