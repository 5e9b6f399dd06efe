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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the reported facts of an instance document.
 *
 * <p>Every element carrying a {@code contextRef} attribute is a fact. It
 * becomes a leaf whose concept id is the tag name with {@code :} replaced
 * by {@code _}, whose value is the element text and whose context ref is
 * the attribute value.
 */
public final class CellExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(CellExtractor.class);

  private static final String CONTEXT_REF = "contextRef";

  private CellExtractor() {
  }

  /**
   * Extracts facts grouped by {@link ConceptIds#key lookup key}, in
   * document order.
   */
  public static Map<String, List<XbrlElement>> extract(XbrlDocument data) {
    Map<String, List<XbrlElement>> cells = new LinkedHashMap<>();
    int count = 0;
    for (XbrlNode node : data.findAllWithAttribute(CONTEXT_REF)) {
      String conceptId = node.getTagName().replace(':', '_');
      XbrlElement fact =
          new XbrlElement(conceptId, null, node.getAttribute(CONTEXT_REF), node.getText());
      cells.computeIfAbsent(ConceptIds.key(conceptId), k -> new ArrayList<>()).add(fact);
      count++;
    }
    LOGGER.debug("Read {} facts for {} concepts from {}", count, cells.size(),
        data.getName());
    return cells;
  }
}
