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
package org.apache.calcite.adapter.xbrl.extract;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the many spellings of a concept identifier used across the
 * documents of one filing.
 *
 * <p>The label linkbase writes {@code lab_us-gaap_Revenues}, the
 * presentation linkbase links to {@code ...xsd#us-gaap_Revenues} and the
 * instance document tags facts {@code us-gaap:Revenues}. All of them
 * normalize to {@code us-gaap_Revenues} and share the lookup key
 * {@code us-gaap_revenues}.
 */
public final class ConceptIds {

  static final Pattern CONCEPT =
      Pattern.compile("(?:lab_)?((?:us-gaap|ifrs-full|srt|dei|country|currency|[a-z]{2,8})"
          + "[_:][a-z][a-z0-9]{2,})", Pattern.CASE_INSENSITIVE);

  private ConceptIds() {
  }

  /**
   * Returns the namespace-qualified concept id found in a raw identifier,
   * with {@code :} replaced by {@code _}, or null if there is none.
   */
  public static @Nullable String normalize(@Nullable String raw) {
    if (raw == null) {
      return null;
    }
    Matcher matcher = CONCEPT.matcher(raw);
    if (!matcher.find()) {
      return null;
    }
    return matcher.group(1).replace(':', '_');
  }

  /**
   * Returns the lookup key of a raw identifier: its normalized form (or the
   * raw text if it does not normalize), lower-cased.
   */
  public static String key(String raw) {
    String normalized = normalize(raw);
    return (normalized != null ? normalized : raw).toLowerCase(Locale.ROOT);
  }
}
