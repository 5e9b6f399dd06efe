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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link XbrlNode} wrapping one jsoup element.
 */
class JsoupXbrlNode implements XbrlNode {
  private final Element element;

  JsoupXbrlNode(Element element) {
    this.element = element;
  }

  @Override public String getTagName() {
    return element.tagName();
  }

  @Override public String getText() {
    return element.text();
  }

  @Override public @Nullable String getAttribute(String name) {
    if (!element.attributes().hasKeyIgnoreCase(name)) {
      return null;
    }
    return element.attributes().getIgnoreCase(name);
  }

  @Override public boolean hasAttribute(String name) {
    return element.attributes().hasKeyIgnoreCase(name);
  }

  @Override public Map<String, String> getAttributes() {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (Attribute attribute : element.attributes()) {
      attributes.put(attribute.getKey(), attribute.getValue());
    }
    return Collections.unmodifiableMap(attributes);
  }

  @Override public List<XbrlNode> findAll(Pattern tagPattern) {
    List<XbrlNode> nodes = new ArrayList<>();
    for (Element descendant : descendants()) {
      if (tagPattern.matcher(descendant.tagName()).find()) {
        nodes.add(new JsoupXbrlNode(descendant));
      }
    }
    return nodes;
  }

  @Override public List<XbrlNode> findAll(Pattern tagPattern, String attribute,
      String value) {
    List<XbrlNode> nodes = new ArrayList<>();
    for (Element descendant : descendants()) {
      if (tagPattern.matcher(descendant.tagName()).find()
          && descendant.attributes().hasKeyIgnoreCase(attribute)
          && value.equals(descendant.attributes().getIgnoreCase(attribute))) {
        nodes.add(new JsoupXbrlNode(descendant));
      }
    }
    return nodes;
  }

  @Override public List<XbrlNode> findAllWithAttribute(String attribute) {
    List<XbrlNode> nodes = new ArrayList<>();
    for (Element descendant : descendants()) {
      if (descendant.attributes().hasKeyIgnoreCase(attribute)) {
        nodes.add(new JsoupXbrlNode(descendant));
      }
    }
    return nodes;
  }

  private List<Element> descendants() {
    List<Element> all = element.getAllElements();
    // getAllElements() starts with the element itself
    return all.subList(1, all.size());
  }

  @Override public String toString() {
    return "<" + element.tagName() + " " + element.attributes() + ">";
  }
}
