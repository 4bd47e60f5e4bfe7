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
package com.dataops.sqlshift.template;

import com.dataops.sqlshift.common.ErrorKind;
import com.dataops.sqlshift.common.TranspileException;
import com.dataops.sqlshift.common.ValidationException;
import com.dataops.sqlshift.model.SourceLocation;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@code {{ ... }}} placeholders in SQL text. The recognized forms are the date
 * placeholders ({@code ds}, {@code ds_nodash}, {@code yesterday_ds}, {@code tomorrow_ds}, {@code
 * week_start_ds}, {@code month_start_ds}), {@code ref('name')}, {@code source('src', 'table')} and
 * {@code var('name')} with an optional default. Anything else is a rendering error.
 */
public class TemplateRenderer {
  private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRenderer.class);
  private static final String OPEN = "{{";
  private static final String CLOSE = "}}";
  private static final DateTimeFormatter NO_DASH = DateTimeFormatter.BASIC_ISO_DATE;
  private static final Pattern CALL =
      Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*\\((.*)\\)", Pattern.DOTALL);
  private static final Pattern ARGUMENT =
      Pattern.compile("\\s*(?:'([^']*)'|\"([^\"]*)\")\\s*(,|$)");

  private final Clock clock;

  public TemplateRenderer() {
    this(Clock.systemDefaultZone());
  }

  public TemplateRenderer(Clock clock) {
    this.clock = ValidationException.checkNotNull(clock, "Clock cannot be null");
  }

  /**
   * Renders every placeholder in the SQL text.
   *
   * @param sql The templated SQL.
   * @param context The placeholder values.
   * @return The SQL with all placeholders resolved. Text outside placeholders is unchanged.
   * @throws TranspileException of kind TEMPLATE if a placeholder is malformed, unknown or
   *     unresolvable.
   */
  public String render(String sql, TemplateContext context) {
    if (sql.indexOf(OPEN) < 0) {
      return sql;
    }
    LocalDate date =
        context.getExecutionDate() != null ? context.getExecutionDate() : LocalDate.now(clock);
    StringBuilder out = new StringBuilder(sql.length());
    int position = 0;
    int count = 0;
    while (true) {
      int start = sql.indexOf(OPEN, position);
      if (start < 0) {
        out.append(sql, position, sql.length());
        break;
      }
      int end = sql.indexOf(CLOSE, start + OPEN.length());
      if (end < 0) {
        throw templateError(sql, start, "Unterminated placeholder", sql.substring(start));
      }
      String expression = sql.substring(start + OPEN.length(), end).trim();
      out.append(sql, position, start).append(resolve(expression, date, context, sql, start));
      position = end + CLOSE.length();
      count++;
    }
    LOGGER.debug("Rendered {} placeholders", count);
    return out.toString();
  }

  private String resolve(
      String expression, LocalDate date, TemplateContext context, String sql, int offset) {
    switch (expression) {
      case "ds":
        return date.toString();
      case "ds_nodash":
        return date.format(NO_DASH);
      case "yesterday_ds":
        return date.minusDays(1).toString();
      case "tomorrow_ds":
        return date.plusDays(1).toString();
      case "week_start_ds":
        return date.minusDays(date.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue())
            .toString();
      case "month_start_ds":
        return date.withDayOfMonth(1).toString();
      default:
        return resolveCall(expression, context, sql, offset);
    }
  }

  private String resolveCall(String expression, TemplateContext context, String sql, int offset) {
    Matcher call = CALL.matcher(expression);
    if (!call.matches()) {
      throw templateError(sql, offset, "Unsupported placeholder", expression);
    }
    String function = call.group(1);
    List<String> args = parseArguments(call.group(2));
    if (args == null) {
      throw templateError(sql, offset, "Malformed arguments in placeholder", expression);
    }
    switch (function) {
      case "ref":
        if (args.size() == 1) {
          return lookup(context.getRefs(), args.get(0), "Unresolved reference", sql, offset);
        }
        break;
      case "source":
        if (args.size() == 2) {
          return lookup(
              context.getRefs(), args.get(0) + "." + args.get(1), "Unresolved source", sql, offset);
        }
        break;
      case "var":
        if (args.size() == 2) {
          return context.getVariables().getOrDefault(args.get(0), args.get(1));
        }
        if (args.size() == 1) {
          return lookup(context.getVariables(), args.get(0), "Undefined variable", sql, offset);
        }
        break;
      default:
        throw templateError(sql, offset, "Unsupported placeholder", expression);
    }
    throw templateError(
        sql, offset, "Wrong number of arguments for " + function + "()", expression);
  }

  private static String lookup(
      Map<String, String> values, String name, String problem, String sql, int offset) {
    String value = values.get(name);
    if (value == null) {
      throw templateError(sql, offset, problem, name);
    }
    return value;
  }

  // Returns null when the argument list is not a comma-separated list of quoted strings.
  private static List<String> parseArguments(String text) {
    List<String> args = new ArrayList<>();
    if (text.isBlank()) {
      return args;
    }
    Matcher matcher = ARGUMENT.matcher(text);
    int position = 0;
    while (position < text.length()) {
      matcher.region(position, text.length());
      if (!matcher.lookingAt()) {
        return null;
      }
      args.add(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
      position = matcher.end();
      if (matcher.group(3).isEmpty()) {
        break;
      }
      if (position == text.length()) {
        return null;
      }
    }
    return args;
  }

  private static TranspileException templateError(
      String sql, int offset, String problem, String detail) {
    SourceLocation location = SourceLocation.ofOffset(sql, offset);
    return new TranspileException(
        ErrorKind.TEMPLATE, problem + " at " + location + ": " + detail, detail, null);
  }
}
