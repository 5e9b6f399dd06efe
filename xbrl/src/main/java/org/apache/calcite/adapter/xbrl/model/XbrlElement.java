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
package org.apache.calcite.adapter.xbrl.model;

import org.apache.calcite.adapter.xbrl.util.ContextDateParser;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * A node of a financial statement tree.
 *
 * <p>The same type represents statement headers (concept id is the role
 * URI), taxonomy concepts laid out by the reference linkbase, and fact
 * leaves read from the instance document (which carry a context ref and a
 * value).
 *
 * <p>Every node has at most one owning parent. Two children of one parent
 * are never {@link #sameAs identical}: adding a child that is identical to
 * an existing one merges it into the existing one instead.
 */
public class XbrlElement {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlElement.class);

  private static final Comparator<XbrlElement> SIBLING_ORDER =
      Comparator.comparingDouble(e -> e.order == null ? Double.MAX_VALUE : e.order);

  private final String conceptId;
  private @Nullable String label;
  private final @Nullable String contextRef;
  private @Nullable String value;
  private @Nullable Double order;

  /** Insertion order; {@link #getChildren()} sorts by {@link #order}. */
  private final List<XbrlElement> children = new ArrayList<>();
  private @Nullable XbrlElement parent;
  private @Nullable XbrlElement mergedInto;

  public XbrlElement(String conceptId) {
    this(conceptId, null, null, null);
  }

  public XbrlElement(String conceptId, @Nullable String label) {
    this(conceptId, label, null, null);
  }

  public XbrlElement(String conceptId, @Nullable String label,
      @Nullable String contextRef, @Nullable String value) {
    this.conceptId = Objects.requireNonNull(conceptId, "conceptId");
    this.label = label;
    this.contextRef = contextRef;
    this.value = value;
  }

  public String getConceptId() {
    return conceptId;
  }

  public @Nullable String getLabel() {
    return label;
  }

  /**
   * Returns the context a fact was reported under. For statement headers
   * this is the ordering key taken from the role definition.
   */
  public @Nullable String getContextRef() {
    return contextRef;
  }

  public @Nullable String getValue() {
    return value;
  }

  /**
   * Returns the value as a number, or null if it is absent or not numeric.
   */
  public @Nullable BigDecimal getNumericValue() {
    if (value == null) {
      return null;
    }
    try {
      return new BigDecimal(value.replace(",", "").trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  public @Nullable Double getOrder() {
    return order;
  }

  public @Nullable XbrlElement getParent() {
    return parent;
  }

  /**
   * Returns the children in sibling order; ties keep insertion order.
   */
  public List<XbrlElement> getChildren() {
    List<XbrlElement> sorted = new ArrayList<>(children);
    sorted.sort(SIBLING_ORDER);
    return Collections.unmodifiableList(sorted);
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  /**
   * Returns whether this node is a reported fact: it has a value and no
   * children.
   */
  public boolean isFact() {
    return value != null && children.isEmpty();
  }

  /**
   * Returns whether this node and another are the same node under a common
   * parent: equal concept ids and equal context refs.
   */
  public boolean sameAs(XbrlElement other) {
    return conceptId.equals(other.conceptId)
        && Objects.equals(contextRef, other.contextRef);
  }

  /**
   * Returns whether this node is a proper ancestor of the given node.
   */
  public boolean isAncestorOf(XbrlElement node) {
    for (XbrlElement p = node.parent; p != null; p = p.parent) {
      if (p == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * Appends a child after the existing ones.
   *
   * @see #addChild(XbrlElement, double)
   */
  public @Nullable XbrlElement addChild(XbrlElement child) {
    return addChild(child, children.size());
  }

  /**
   * Attaches a child with a sibling order.
   *
   * <p>If an existing child is {@link #sameAs identical}, the new node is
   * merged into it and discarded. A node that would close a cycle, or that
   * is already owned by another parent, is not attached.
   *
   * @param child Node to attach
   * @param order Sibling ordering hint
   * @return The node now representing {@code child} in this tree, or null
   *     if it was not attached
   */
  public @Nullable XbrlElement addChild(XbrlElement child, double order) {
    if (child == this || child.isAncestorOf(this)) {
      LOGGER.debug("Ignoring edge {} -> {}: would create a cycle", conceptId,
          child.conceptId);
      return null;
    }
    if (child.parent == this) {
      return child;
    }
    if (child.parent != null) {
      LOGGER.debug("Ignoring edge {} -> {}: already a child of {}", conceptId,
          child.conceptId, child.parent.conceptId);
      return null;
    }
    for (XbrlElement existing : children) {
      if (existing.sameAs(child)) {
        existing.merge(child);
        return existing;
      }
    }
    child.order = order;
    child.parent = this;
    children.add(child);
    return child;
  }

  /**
   * Absorbs another node: fills in label and value where this node has
   * none, then moves every child of {@code other} under this node using
   * the identity rule of {@link #addChild(XbrlElement, double)}, so nested
   * duplicates collapse.
   *
   * <p>{@code other} is left without children and {@link #resolve()
   * resolves} to this node afterwards. The parent is not copied from
   * {@code other}; only {@link #addChild(XbrlElement, double)} attaches a
   * node, which keeps a single owner per node.
   */
  public void merge(XbrlElement other) {
    if (other == this) {
      return;
    }
    if (label == null && other.label != null) {
      label = other.label;
    }
    if (value == null && other.value != null) {
      value = other.value;
    }
    List<XbrlElement> moved = new ArrayList<>(other.children);
    other.children.clear();
    for (XbrlElement child : moved) {
      Double childOrder = child.order;
      child.parent = null;
      child.order = null;
      addChild(child, childOrder == null ? children.size() : childOrder);
    }
    other.mergedInto = this;
  }

  /**
   * Returns the node that absorbed this one through {@link #merge}, following
   * chains of merges, or this node if it was never merged away.
   */
  public XbrlElement resolve() {
    XbrlElement element = this;
    while (element.mergedInto != null) {
      element = element.mergedInto;
    }
    return element;
  }

  /**
   * Returns a detached copy of this node without children.
   */
  public XbrlElement copy() {
    return new XbrlElement(conceptId, label, contextRef, value);
  }

  /**
   * Returns the root of the tree this node belongs to.
   */
  public XbrlElement head() {
    XbrlElement element = this;
    while (element.parent != null) {
      element = element.parent;
    }
    return element;
  }

  /**
   * Returns this node and all its descendants in pre-order.
   */
  public List<XbrlElement> flatten() {
    List<XbrlElement> nodes = new ArrayList<>();
    collect(this, nodes);
    return nodes;
  }

  private static void collect(XbrlElement element, List<XbrlElement> nodes) {
    nodes.add(element);
    for (XbrlElement child : element.getChildren()) {
      collect(child, nodes);
    }
  }

  /**
   * Returns every fact in this subtree, in pre-order.
   */
  public List<XbrlElement> facts() {
    return findAll(XbrlElement::isFact);
  }

  /**
   * Returns the first node in pre-order that satisfies the predicate.
   */
  public @Nullable XbrlElement find(Predicate<XbrlElement> predicate) {
    for (XbrlElement element : flatten()) {
      if (predicate.test(element)) {
        return element;
      }
    }
    return null;
  }

  /**
   * Returns every node in pre-order that satisfies the predicate.
   */
  public List<XbrlElement> findAll(Predicate<XbrlElement> predicate) {
    List<XbrlElement> matches = new ArrayList<>();
    for (XbrlElement element : flatten()) {
      if (predicate.test(element)) {
        matches.add(element);
      }
    }
    return matches;
  }

  /**
   * Returns the first node whose concept id or label contains a match of
   * the pattern.
   */
  public @Nullable XbrlElement search(Pattern pattern) {
    return find(e -> pattern.matcher(e.conceptId).find()
        || (e.label != null && pattern.matcher(e.label).find()));
  }

  /**
   * Returns concept id to label for every node in this subtree.
   */
  public Map<String, @Nullable String> ids() {
    Map<String, @Nullable String> ids = new LinkedHashMap<>();
    for (XbrlElement element : flatten()) {
      if (ids.get(element.conceptId) == null) {
        ids.put(element.conceptId, element.label);
      }
    }
    return ids;
  }

  /**
   * Returns each distinct context ref used by a fact in this subtree, with
   * the dates parsed from it.
   */
  public Map<String, List<LocalDate>> references() {
    Map<String, List<LocalDate>> refs = new LinkedHashMap<>();
    for (XbrlElement fact : facts()) {
      if (fact.contextRef != null && !refs.containsKey(fact.contextRef)) {
        refs.put(fact.contextRef, ContextDateParser.parse(fact.contextRef));
      }
    }
    return refs;
  }

  /**
   * Groups the facts in this subtree under the concept that holds them.
   *
   * @return Concept id to its fact children, in pre-order of the concepts
   */
  public Map<String, List<XbrlElement>> factsByConcept() {
    Map<String, List<XbrlElement>> facts = new LinkedHashMap<>();
    for (XbrlElement element : flatten()) {
      for (XbrlElement child : element.getChildren()) {
        if (child.isFact()) {
          facts.computeIfAbsent(element.conceptId, k -> new ArrayList<>()).add(child);
        }
      }
    }
    return facts;
  }

  /**
   * Renders this subtree as indented text, one node per line.
   */
  public String visualize() {
    StringBuilder sb = new StringBuilder();
    visualize(this, 0, sb);
    return sb.toString();
  }

  private static void visualize(XbrlElement element, int depth, StringBuilder sb) {
    sb.append('\n');
    for (int i = 0; i < depth; i++) {
      sb.append('\t');
    }
    sb.append(element);
    for (XbrlElement child : element.getChildren()) {
      visualize(child, depth + 1, sb);
    }
  }

  @Override public String toString() {
    return conceptId + " (label=" + label + ", ref=" + contextRef
        + ", value=" + value + ")";
  }
}
