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
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** The SQL flavors the engine parses and renders. The set is closed. */
public enum Dialect {
  TRINO("trino", '"', false),
  BIGQUERY("bigquery", '`', true);

  private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String tag;
  private final char identifierQuote;
  private final boolean backslashEscapes;

  Dialect(String tag, char identifierQuote, boolean backslashEscapes) {
    this.tag = tag;
    this.identifierQuote = identifierQuote;
    this.backslashEscapes = backslashEscapes;
  }

  /**
   * Resolves a dialect from its tag, ignoring case.
   *
   * @param name The dialect tag, e.g. "trino" or "bigquery".
   * @return The matching dialect.
   * @throws ValidationException if the name is null or not a supported dialect.
   */
  public static Dialect fromName(String name) {
    ValidationException.checkNotNull(name, "Dialect name cannot be null.");
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (Dialect dialect : values()) {
      if (dialect.tag.equals(normalized)) {
        return dialect;
      }
    }
    throw new ValidationException(
        "Unsupported dialect %s. Supported dialects are %s",
        name,
        Arrays.stream(values()).map(Dialect::getTag).collect(Collectors.joining(", ")));
  }

  public String getTag() {
    return tag;
  }

  public char getIdentifierQuote() {
    return identifierQuote;
  }

  /**
   * Indicates whether string literals of this dialect use backslash as an escape character.
   *
   * @return true for dialects with backslash escapes.
   */
  public boolean usesBackslashEscapes() {
    return backslashEscapes;
  }

  /**
   * Quotes a single identifier part when it is not a plain identifier.
   *
   * @param part The unquoted identifier part.
   * @return The part, quoted with this dialect's quote character if required.
   */
  public String quoteIfNeeded(String part) {
    if (PLAIN_IDENTIFIER.matcher(part).matches()) {
      return part;
    }
    String quote = String.valueOf(identifierQuote);
    String escaped =
        this == BIGQUERY ? part.replace(quote, "\\" + quote) : part.replace(quote, quote + quote);
    return quote + escaped + quote;
  }

  @Override
  public String toString() {
    return tag;
  }
}
