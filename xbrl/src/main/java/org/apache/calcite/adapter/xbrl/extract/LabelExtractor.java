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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the concept to caption lookup from a label linkbase.
 *
 * <p>Keys are {@link ConceptIds#key lookup keys}. A concept usually has
 * several labels (standard, terse, total, ...); the standard label wins,
 * otherwise the first one in document order.
 */
public final class LabelExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(LabelExtractor.class);

  private static final Pattern LABEL = Pattern.compile("(?i)(^|:)label$");
  private static final String STANDARD_ROLE = "/role/label";

  private LabelExtractor() {
  }

  public static Map<String, String> extract(XbrlDocument labels) {
    Map<String, String> lookup = new LinkedHashMap<>();
    Set<String> standard = new HashSet<>();
    int skipped = 0;
    for (XbrlNode label : labels.findAll(LABEL)) {
      String concept = ConceptIds.normalize(label.getAttribute("xlink:label"));
      if (concept == null) {
        concept = ConceptIds.normalize(label.getAttribute("id"));
      }
      if (concept == null) {
        skipped++;
        continue;
      }
      String key = concept.toLowerCase(Locale.ROOT);
      String role = label.getAttribute("xlink:role");
      boolean isStandard = role == null || role.endsWith(STANDARD_ROLE);
      if (!lookup.containsKey(key) || (isStandard && !standard.contains(key))) {
        lookup.put(key, label.getText());
        if (isStandard) {
          standard.add(key);
        }
      }
    }
    if (skipped > 0) {
      LOGGER.debug("Skipped {} labels without a concept id in {}", skipped,
          labels.getName());
    }
    return lookup;
  }
}
