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
package org.apache.calcite.adapter.xbrl.assemble;

import org.apache.calcite.adapter.xbrl.XbrlException;
import org.apache.calcite.adapter.xbrl.document.XbrlDocument;
import org.apache.calcite.adapter.xbrl.document.XbrlNode;
import org.apache.calcite.adapter.xbrl.extract.ConceptIds;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the tree of one statement from its section of the reference
 * linkbase.
 *
 * <p>The section holding the header's role is located, its {@code loc}
 * records become concept nodes and its {@code arc} records wire them into a
 * tree. Facts of those concepts are attached as leaves, restricted to the
 * contexts chosen by the {@link ContextSelection}.
 *
 * <p>The label and cell lookups and the reference document are only read,
 * so one assembler may serve concurrent assembly of different headers.
 * Reported facts are copied into the tree; the cell lookup is never
 * attached to a tree.
 */
public class StatementAssembler {
  private static final Logger LOGGER = LoggerFactory.getLogger(StatementAssembler.class);

  private static final Pattern SECTION = Pattern.compile("(?i)link$");
  private static final Pattern LOC = Pattern.compile("(?i)(^|:)loc$");
  private static final Pattern ARC = Pattern.compile("(?i)arc$");

  private final Map<String, String> labels;
  private final Map<String, List<XbrlElement>> cells;
  private final XbrlDocument reference;
  private final ContextSelection contextSelection;

  /**
   * Creates an assembler.
   *
   * @param labels Lookup key to caption, from {@code LabelExtractor}
   * @param cells Lookup key to facts, from {@code CellExtractor}
   * @param reference Presentation, definition or calculation linkbase
   * @param contextSelection Policy deciding which contexts are kept
   */
  public StatementAssembler(Map<String, String> labels,
      Map<String, List<XbrlElement>> cells, XbrlDocument reference,
      ContextSelection contextSelection) {
    this.labels = ImmutableMap.copyOf(labels);
    ImmutableMap.Builder<String, List<XbrlElement>> builder = ImmutableMap.builder();
    for (Map.Entry<String, List<XbrlElement>> entry : cells.entrySet()) {
      builder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.cells = builder.build();
    this.reference = reference;
    this.contextSelection = contextSelection;
  }

  public XbrlDocument getReference() {
    return reference;
  }

  public ContextSelection getContextSelection() {
    return contextSelection;
  }

  /**
   * Populates a statement header with its concept tree and facts.
   *
   * <p>The tree is built detached and grafted onto {@code header} only when
   * assembly succeeds; on failure {@code header} is unchanged.
   *
   * @param header Statement header whose concept id is a role URI
   * @return {@code header}
   * @throws XbrlException with {@link XbrlException.Reason#NO_REFERENCE_SECTION}
   *     if the reference document has no section for the role, or
   *     {@link XbrlException.Reason#EMPTY_STATEMENT} if no concept of the
   *     section has facts
   */
  public XbrlElement assemble(XbrlElement header) {
    String role = header.getConceptId();
    List<XbrlNode> sections = reference.findAll(SECTION, "xlink:role", role);
    if (sections.isEmpty()) {
      throw new XbrlException(XbrlException.Reason.NO_REFERENCE_SECTION,
          "Reference document " + reference.getName() + " has no section for " + role);
    }
    XbrlNode section = sections.get(0);

    // Concept nodes by loc anchor, in order of first appearance
    Map<String, XbrlElement> anchors = new LinkedHashMap<>();
    for (XbrlNode loc : section.findAll(LOC)) {
      String anchor = loc.getAttribute("xlink:label");
      String href = loc.getAttribute("xlink:href");
      if (anchor == null || href == null) {
        LOGGER.debug("Skipping loc without label or href in {}: {}", role, loc);
        continue;
      }
      if (anchors.containsKey(anchor)) {
        continue;
      }
      String conceptId = href.substring(href.indexOf('#') + 1);
      anchors.put(anchor, new XbrlElement(conceptId, labels.get(ConceptIds.key(conceptId))));
    }

    Map<String, Integer> contextCounts = new LinkedHashMap<>();
    for (XbrlElement concept : anchors.values()) {
      for (XbrlElement fact : factsOf(concept)) {
        if (fact.getContextRef() != null) {
          contextCounts.merge(fact.getContextRef(), 1, Integer::sum);
        }
      }
    }
    if (contextCounts.isEmpty()) {
      throw new XbrlException(XbrlException.Reason.EMPTY_STATEMENT,
          "No facts for any concept of " + header.getLabel() + " (" + role + ")");
    }

    for (XbrlNode arc : section.findAll(ARC)) {
      XbrlElement parent = resolve(anchors, arc.getAttribute("xlink:from"));
      XbrlElement child = resolve(anchors, arc.getAttribute("xlink:to"));
      if (parent == null || child == null) {
        LOGGER.debug("Skipping arc with unknown anchor in {}: {}", role, arc);
        continue;
      }
      Double order = parseOrder(arc.getAttribute("order"));
      if (order == null) {
        parent.addChild(child);
      } else {
        parent.addChild(child, order);
      }
    }

    Set<String> contexts = contextSelection.select(contextCounts);
    LOGGER.debug("{}: keeping contexts {} of {}", role, contexts, contextCounts);

    XbrlElement staging = new XbrlElement(role);
    Set<XbrlElement> concepts = new LinkedHashSet<>();
    for (XbrlElement concept : anchors.values()) {
      concepts.add(concept.resolve());
    }
    int position = 0;
    for (XbrlElement concept : concepts) {
      if (concept.getParent() == null) {
        staging.addChild(concept, position);
      }
      position++;
      // a root may have merged into an identical earlier root
      XbrlElement target = concept.resolve();
      for (XbrlElement fact : factsOf(target)) {
        if (contexts.contains(fact.getContextRef())) {
          target.addChild(fact.copy());
        }
      }
    }

    header.merge(staging);
    LOGGER.debug("Assembled {} with {} facts", role, header.facts().size());
    return header;
  }

  private List<XbrlElement> factsOf(XbrlElement concept) {
    List<XbrlElement> facts = cells.get(ConceptIds.key(concept.getConceptId()));
    return facts == null ? ImmutableList.of() : facts;
  }

  private static @Nullable XbrlElement resolve(Map<String, XbrlElement> anchors,
      @Nullable String anchor) {
    if (anchor == null) {
      return null;
    }
    XbrlElement element = anchors.get(anchor);
    return element == null ? null : element.resolve();
  }

  private static @Nullable Double parseOrder(@Nullable String order) {
    if (order == null) {
      return null;
    }
    try {
      return Double.valueOf(order.trim());
    } catch (NumberFormatException e) {
      LOGGER.debug("Ignoring non-numeric arc order '{}'", order);
      return null;
    }
  }
}
