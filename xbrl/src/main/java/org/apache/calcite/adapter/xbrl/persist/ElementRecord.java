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
package org.apache.calcite.adapter.xbrl.persist;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON form of one {@link org.apache.calcite.adapter.xbrl.model.XbrlElement}
 * and its subtree. Children are stored in sibling order.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ElementRecord {

  @JsonProperty("conceptId")
  private @Nullable String conceptId;

  @JsonProperty("label")
  private @Nullable String label;

  @JsonProperty("contextRef")
  private @Nullable String contextRef;

  @JsonProperty("value")
  private @Nullable String value;

  @JsonProperty("children")
  private List<ElementRecord> children = new ArrayList<>();

  public ElementRecord() {
  }

  public ElementRecord(@Nullable String conceptId, @Nullable String label,
      @Nullable String contextRef, @Nullable String value) {
    this.conceptId = conceptId;
    this.label = label;
    this.contextRef = contextRef;
    this.value = value;
  }

  public @Nullable String getConceptId() {
    return conceptId;
  }

  public @Nullable String getLabel() {
    return label;
  }

  public @Nullable String getContextRef() {
    return contextRef;
  }

  public @Nullable String getValue() {
    return value;
  }

  public List<ElementRecord> getChildren() {
    return children;
  }

  public void setChildren(@Nullable List<ElementRecord> children) {
    this.children = children == null ? new ArrayList<>() : children;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ElementRecord)) {
      return false;
    }
    ElementRecord that = (ElementRecord) o;
    return Objects.equals(conceptId, that.conceptId)
        && Objects.equals(label, that.label)
        && Objects.equals(contextRef, that.contextRef)
        && Objects.equals(value, that.value)
        && Objects.equals(children, that.children);
  }

  @Override public int hashCode() {
    return Objects.hash(conceptId, label, contextRef, value, children);
  }

  @Override public String toString() {
    return "ElementRecord{" + conceptId + ", children=" + children.size() + "}";
  }
}
