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

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.xbrl.model.XbrlElement;
import org.apache.calcite.adapter.xbrl.util.ContextDateParser;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Table of the facts of one assembled statement, one row per fact.
 *
 * <p>The reporting period is read from the context ref: a single date is an
 * instant and fills only {@code period_end}; two or more dates give the
 * start and end of a duration.
 */
public class XbrlStatementTable extends AbstractTable implements ScannableTable {

  private final XbrlElement header;

  public XbrlStatementTable(XbrlElement header) {
    this.header = header;
  }

  public XbrlElement getHeader() {
    return header;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    return typeFactory.builder()
        .add("concept", SqlTypeName.VARCHAR)
        .add("label", SqlTypeName.VARCHAR).nullable(true)
        .add("context_ref", SqlTypeName.VARCHAR).nullable(true)
        .add("period_start", SqlTypeName.DATE).nullable(true)
        .add("period_end", SqlTypeName.DATE).nullable(true)
        .add("value", SqlTypeName.VARCHAR).nullable(true)
        .add("numeric_value", SqlTypeName.DOUBLE).nullable(true)
        .build();
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    List<@Nullable Object[]> rows = new ArrayList<>();
    for (XbrlElement fact : header.facts()) {
      rows.add(toRow(fact));
    }
    return Linq4j.asEnumerable(rows);
  }

  static @Nullable Object[] toRow(XbrlElement fact) {
    List<LocalDate> dates = ContextDateParser.parse(fact.getContextRef());
    Integer start = null;
    Integer end = null;
    if (dates.size() == 1) {
      end = epochDay(dates.get(0));
    } else if (dates.size() > 1) {
      start = epochDay(dates.get(0));
      end = epochDay(dates.get(dates.size() - 1));
    }
    XbrlElement concept = fact.getParent();
    String label = fact.getLabel();
    if (label == null && concept != null) {
      label = concept.getLabel();
    }
    BigDecimal number = fact.getNumericValue();
    return new Object[] {
        fact.getConceptId(),
        label,
        fact.getContextRef(),
        start,
        end,
        fact.getValue(),
        number == null ? null : number.doubleValue()
    };
  }

  private static Integer epochDay(LocalDate date) {
    return (int) date.toEpochDay();
  }

  @Override public String toString() {
    return "XbrlStatementTable(" + header.getConceptId() + ")";
  }
}
