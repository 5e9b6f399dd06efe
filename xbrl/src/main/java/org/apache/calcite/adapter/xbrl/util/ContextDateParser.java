/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.xbrl.util;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.Year;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts calendar dates from XBRL context identifiers.
 *
 * <p>Context ids such as {@code D20200101-20200331}, {@code I20191231} or
 * {@code FY2020Q1} embed one date (instant) or two dates (duration).
 * Quarter shorthand is expanded first ({@code Q1} becomes {@code 0331}, and
 * so on), then the grammars below are tried in their fixed order. The
 * first grammar that matches anywhere in the text wins, and every
 * non-overlapping match of that grammar is returned in the order it
 * appears.
 *
 * <ol>
 *   <li>{@code yyyyMMdd}</li>
 *   <li>{@code MMddyyyy}</li>
 *   <li>{@code ddMMMyyyy}</li>
 *   <li>{@code yyMMdd}</li>
 *   <li>{@code MMMddyyyy}</li>
 * </ol>
 */
public final class ContextDateParser {

  private static final String[][] QUARTER_REPLACEMENTS = {
      {"Q1", "0331"},
      {"Q2", "0630"},
      {"Q3", "0930"},
      {"Q4", "1231"},
  };

  private static final List<Grammar> GRAMMARS =
      ImmutableList.of(
          new Grammar("yyyyMMdd", Field.YEAR, Field.MONTH, Field.DAY),
          new Grammar("MMddyyyy", Field.MONTH, Field.DAY, Field.YEAR),
          new Grammar("ddMMMyyyy", Field.DAY, Field.MONTH_NAME, Field.YEAR),
          new Grammar("yyMMdd", Field.SHORT_YEAR, Field.MONTH, Field.DAY),
          new Grammar("MMMddyyyy", Field.MONTH_NAME, Field.DAY, Field.YEAR));

  private ContextDateParser() {
  }

  /**
   * Parses every date embedded in a context identifier.
   *
   * @param raw Context identifier, may be null
   * @return Dates in order of appearance; empty if nothing parses
   */
  public static List<LocalDate> parse(@Nullable String raw) {
    if (raw == null || raw.isEmpty()) {
      return ImmutableList.of();
    }
    String text = raw;
    for (String[] replacement : QUARTER_REPLACEMENTS) {
      text = text.replace(replacement[0], replacement[1]);
    }

    for (Grammar grammar : GRAMMARS) {
      Matcher matcher = grammar.pattern.matcher(text);
      if (!matcher.find()) {
        continue;
      }
      List<LocalDate> dates = new ArrayList<>();
      do {
        LocalDate date = grammar.toDate(matcher);
        if (date != null) {
          dates.add(date);
        }
      } while (matcher.find());
      return dates;
    }
    return ImmutableList.of();
  }

  /**
   * Returns the first date embedded in a context identifier, or null.
   */
  public static @Nullable LocalDate parseFirst(@Nullable String raw) {
    List<LocalDate> dates = parse(raw);
    return dates.isEmpty() ? null : dates.get(0);
  }

  /**
   * Returns the names of the grammars in the order they are tried.
   */
  public static List<String> grammarOrder() {
    List<String> names = new ArrayList<>();
    for (Grammar grammar : GRAMMARS) {
      names.add(grammar.name);
    }
    return names;
  }

  /** Date field with its accepted textual range. */
  private enum Field {
    YEAR("((?:19|20)[0-9]{2})"),
    SHORT_YEAR(shortYearRegex(Year.now().getValue() % 100)),
    MONTH("(0[1-9]|1[0-2])"),
    DAY("(0[1-9]|[12][0-9]|3[01])"),
    MONTH_NAME("(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)");

    final String regex;

    Field(String regex) {
      this.regex = regex;
    }
  }

  /**
   * Builds a regex accepting two-digit years from 01 up to the current year.
   */
  static String shortYearRegex(int currentShortYear) {
    int tens = currentShortYear / 10;
    int units = currentShortYear % 10;
    StringBuilder sb = new StringBuilder("(0[1-9]");
    for (int t = 1; t < tens; t++) {
      sb.append('|').append(t).append("[0-9]");
    }
    if (tens > 0) {
      sb.append('|').append(tens).append("[0-").append(units).append(']');
    }
    return sb.append(')').toString();
  }

  /** One ordered combination of fields. */
  private static class Grammar {
    final String name;
    final List<Field> fields;
    final Pattern pattern;

    Grammar(String name, Field... fields) {
      this.name = name;
      this.fields = Arrays.asList(fields);
      StringBuilder regex = new StringBuilder();
      for (Field field : fields) {
        regex.append(field.regex);
      }
      this.pattern = Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }

    @Nullable LocalDate toDate(Matcher matcher) {
      int year = 0;
      int month = 0;
      int day = 0;
      for (int i = 0; i < fields.size(); i++) {
        String group = matcher.group(i + 1);
        switch (fields.get(i)) {
        case YEAR:
          year = Integer.parseInt(group);
          break;
        case SHORT_YEAR:
          year = 2000 + Integer.parseInt(group);
          break;
        case MONTH:
          month = Integer.parseInt(group);
          break;
        case MONTH_NAME:
          month = monthOf(group);
          break;
        case DAY:
          day = Integer.parseInt(group);
          break;
        default:
          throw new AssertionError(fields.get(i));
        }
      }
      try {
        return LocalDate.of(year, month, day);
      } catch (DateTimeException e) {
        // e.g. 20200231
        return null;
      }
    }

    private static int monthOf(String name) {
      for (Month month : Month.values()) {
        if (month.getDisplayName(TextStyle.SHORT, Locale.US).equalsIgnoreCase(name)) {
          return month.getValue();
        }
      }
      throw new IllegalArgumentException("Unknown month: " + name);
    }
  }
}
