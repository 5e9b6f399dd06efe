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
package org.apache.calcite.adapter.xbrl;

import org.apache.calcite.adapter.xbrl.assemble.AssemblyState;
import org.apache.calcite.adapter.xbrl.assemble.XbrlForest;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

import com.google.common.collect.ImmutableMap;

import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Schema with one table per assembled statement of a filing.
 *
 * <p>Table names are the statement captions in lower snake case, for
 * example {@code consolidated_balance_sheets}; clashes get a numeric
 * suffix. Statements that could not be assembled have no table.
 */
public class XbrlSchema extends AbstractSchema {

  private final XbrlForest forest;
  private final Map<String, Table> tableMap;

  public XbrlSchema(XbrlForest forest) {
    this.forest = forest;
    this.tableMap = createTableMap(forest);
  }

  public XbrlForest getForest() {
    return forest;
  }

  @Override protected Map<String, Table> getTableMap() {
    return tableMap;
  }

  private static Map<String, Table> createTableMap(XbrlForest forest) {
    ImmutableMap.Builder<String, Table> builder = ImmutableMap.builder();
    Set<String> names = new HashSet<>();
    for (Map.Entry<String, XbrlElement> entry : forest.getHeaders().entrySet()) {
      XbrlElement header = entry.getValue();
      if (forest.getState(entry.getKey()) != AssemblyState.ASSEMBLED || !header.hasChildren()) {
        continue;
      }
      String base = tableName(header);
      String name = base;
      for (int i = 2; !names.add(name); i++) {
        name = base + "_" + i;
      }
      builder.put(name, new XbrlStatementTable(header));
    }
    return builder.build();
  }

  /** Derives a table name from a statement caption, or its role URI. */
  static String tableName(XbrlElement header) {
    String text = header.getLabel();
    if (text == null || text.trim().isEmpty()) {
      String uri = header.getConceptId();
      text = uri.substring(uri.lastIndexOf('/') + 1)
          .replaceAll("([a-z0-9])([A-Z])", "$1_$2");
    }
    String name = text.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9]+", "_")
        .replaceAll("^_+|_+$", "");
    return name.isEmpty() ? "statement" : name;
  }
}
