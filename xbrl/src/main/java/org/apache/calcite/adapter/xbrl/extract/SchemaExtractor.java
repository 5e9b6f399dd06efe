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

import org.apache.calcite.adapter.xbrl.document.XbrlDocument;
import org.apache.calcite.adapter.xbrl.document.XbrlNode;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the statement roles declared by a filing's taxonomy schema.
 *
 * <p>Each {@code link:roleType} becomes one statement header. Its
 * definition text, e.g. {@code 00000004 - Statement - CONSOLIDATED
 * STATEMENTS OF INCOME}, is split on {@code " - "}: the last segment is the
 * label and the first the ordering key, stored as the header's context ref.
 */
public final class SchemaExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaExtractor.class);

  private static final Pattern ROLE_TYPE = Pattern.compile("(?i)(^|:)roletype$");
  private static final Pattern DEFINITION = Pattern.compile("(?i)(^|:)definition$");
  private static final String SEPARATOR = " - ";
  private static final String PARENTHETICAL = "Parenthetical";

  private SchemaExtractor() {
  }

  /**
   * Extracts statement headers keyed by role URI, in schema order.
   *
   * @param schema Taxonomy schema document
   * @param includeParenthetical Whether to keep roles whose definition
   *     mentions "Parenthetical"
   */
  public static Map<String, XbrlElement> extract(XbrlDocument schema,
      boolean includeParenthetical) {
    Map<String, XbrlElement> headers = new LinkedHashMap<>();
    for (XbrlNode roleType : schema.findAll(ROLE_TYPE)) {
      String roleUri = roleType.getAttribute("roleURI");
      XbrlNode definition = roleType.findFirst(DEFINITION);
      if (roleUri == null || definition == null) {
        LOGGER.debug("Skipping role without URI or definition: {}", roleType);
        continue;
      }
      String text = definition.getText();
      if (!includeParenthetical && text.contains(PARENTHETICAL)) {
        continue;
      }
      String[] parts = text.split(SEPARATOR);
      String label = parts[parts.length - 1].trim();
      String orderingKey = parts[0].trim();
      headers.put(roleUri, new XbrlElement(roleUri, label, orderingKey, null));
    }
    LOGGER.debug("Found {} statement roles in {}", headers.size(), schema.getName());
    return headers;
  }
}
