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
package org.apache.calcite.adapter.xbrl.document;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Role a document plays in an XBRL filing.
 *
 * <p>Classification looks at the last seven characters of a file name or
 * of an SEC index description ({@code goog-20200331_pre.xml},
 * {@code EX-101.SCH}) and tests the token sets in declaration order.
 */
public enum XbrlDocumentType {
  CALCULATION(true, "cal"),
  DEFINITION(true, "def"),
  PRESENTATION(true, "pre"),
  LABEL(false, "lab"),
  SCHEMA(false, "sch", "xsd"),
  DATA(false, "xml", "ins");

  private static final int TAIL_LENGTH = 7;

  private final boolean reference;
  private final List<String> tokens;

  XbrlDocumentType(boolean reference, String... tokens) {
    this.reference = reference;
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /**
   * Returns whether documents of this type are relationship linkbases that
   * can lay out statement trees.
   */
  public boolean isReference() {
    return reference;
  }

  public List<String> getTokens() {
    return tokens;
  }

  /**
   * Classifies a file name or description.
   *
   * @param nameOrTail File name, path tail or index description
   * @return The first matching type, or null if the document is not part of
   *     an XBRL filing
   */
  public static @Nullable XbrlDocumentType fromName(@Nullable String nameOrTail) {
    if (nameOrTail == null) {
      return null;
    }
    String lower = nameOrTail.trim().toLowerCase(Locale.ROOT);
    String tail = lower.length() > TAIL_LENGTH
        ? lower.substring(lower.length() - TAIL_LENGTH)
        : lower;
    for (XbrlDocumentType type : values()) {
      for (String token : type.tokens) {
        if (tail.contains(token)) {
          return type;
        }
      }
    }
    return null;
  }

  /**
   * Parses a configuration value such as {@code "presentation"} or
   * {@code "pre"}.
   */
  public static XbrlDocumentType fromString(String value) {
    String lower = value.trim().toLowerCase(Locale.ROOT);
    for (XbrlDocumentType type : values()) {
      if (type.name().toLowerCase(Locale.ROOT).equals(lower)
          || type.tokens.contains(lower)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown XBRL document type: " + value);
  }
}
