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

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * An element of a parsed XBRL document.
 *
 * <p>Tag and attribute names are matched case-insensitively; attribute
 * values and text are returned as written.
 */
public interface XbrlNode {

  /**
   * Returns the qualified tag name, e.g. {@code link:presentationLink}.
   */
  String getTagName();

  /**
   * Returns the whitespace-normalized text of this node and its descendants.
   */
  String getText();

  /**
   * Returns an attribute value, or null if the attribute is absent.
   *
   * @param name Qualified attribute name, e.g. {@code xlink:href}
   */
  @Nullable String getAttribute(String name);

  boolean hasAttribute(String name);

  /**
   * Returns all attributes in document order.
   */
  Map<String, String> getAttributes();

  /**
   * Returns all descendants whose tag name contains a match of the pattern.
   */
  List<XbrlNode> findAll(Pattern tagPattern);

  /**
   * Returns all descendants whose tag name contains a match of the pattern
   * and whose attribute equals the given value.
   */
  List<XbrlNode> findAll(Pattern tagPattern, String attribute, String value);

  /**
   * Returns all descendants that carry the given attribute.
   */
  List<XbrlNode> findAllWithAttribute(String attribute);

  /**
   * Returns the first descendant whose tag name matches, or null.
   */
  default @Nullable XbrlNode findFirst(Pattern tagPattern) {
    List<XbrlNode> nodes = findAll(tagPattern);
    return nodes.isEmpty() ? null : nodes.get(0);
  }
}
