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

import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaPlus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link XbrlSchemaFactory}: SQL over the Acme test filing.
 */
@Tag("unit")
public class XbrlSchemaFactoryTest {

  @TempDir
  Path tempDir;

  private Connection connection;
  private SchemaPlus rootSchema;

  @BeforeEach
  void setUp() throws SQLException {
    connection = DriverManager.getConnection("jdbc:calcite:");
    rootSchema = connection.unwrap(CalciteConnection.class).getRootSchema();
  }

  @AfterEach
  void tearDown() throws SQLException {
    if (connection != null) {
      connection.close();
    }
  }

  @Test void testOneTablePerAssembledStatement() {
    Schema schema = addSchema(operand());
    assertEquals("[consolidated_balance_sheets, consolidated_statements_of_income, "
            + "document_and_entity_information]",
        new TreeSet<>(schema.getTableNames()).toString());
  }

  @Test void testQueryBalanceSheet() throws SQLException {
    addSchema(operand());
    String sql = "SELECT \"value\", \"period_start\", \"period_end\", \"label\"\n"
        + "FROM \"acme\".\"consolidated_balance_sheets\"\n"
        + "WHERE \"concept\" = 'us-gaap_Cash'\n"
        + "ORDER BY \"period_end\" DESC";
    List<String> rows = new ArrayList<>();
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      while (rs.next()) {
        rows.add(rs.getString(1) + "|" + rs.getString(2) + "|" + rs.getString(3) + "|"
            + rs.getString(4));
      }
    }
    assertEquals(2, rows.size());
    assertEquals("125000|null|2020-03-31|Cash", rows.get(0));
    assertEquals("110000|null|2019-12-31|Cash", rows.get(1));
  }

  @Test void testAggregateIncome() throws SQLException {
    addSchema(operand());
    String sql = "SELECT COUNT(*), SUM(\"numeric_value\")\n"
        + "FROM \"acme\".\"consolidated_statements_of_income\"\n"
        + "WHERE \"period_start\" = DATE '2020-01-01'";
    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      assertTrue(rs.next());
      assertEquals(5, rs.getInt(1));
      assertEquals(220000d, rs.getDouble(2), 0.001);
    }
  }

  @Test void testCacheFileIsWrittenAndReused() throws SQLException {
    Path cache = tempDir.resolve("acme.json");
    Map<String, Object> operand = operand();
    operand.put("cacheFile", cache.toString());
    addSchema(operand);
    assertTrue(Files.isRegularFile(cache));

    // the cache alone is enough once it exists
    Map<String, Object> cachedOperand = new HashMap<>();
    cachedOperand.put("cacheFile", cache.toString());
    Schema cached = XbrlSchemaFactory.INSTANCE.create(rootSchema, "cached", cachedOperand);
    rootSchema.add("cached", cached);
    assertEquals(3, cached.getTableNames().size());

    try (Statement statement = connection.createStatement();
         ResultSet rs = statement.executeQuery(
             "SELECT COUNT(*) FROM \"cached\".\"consolidated_balance_sheets\"")) {
      assertTrue(rs.next());
      assertEquals(12, rs.getInt(1));
    }
  }

  @Test void testParallelAssembly() {
    Map<String, Object> operand = operand();
    operand.put("parallelism", 3);
    assertEquals(3, addSchema(operand).getTableNames().size());
  }

  @Test void testDirectoryIsRequired() {
    assertThrows(IllegalArgumentException.class,
        () -> XbrlSchemaFactory.INSTANCE.create(rootSchema, "acme", new HashMap<>()));
  }

  private Schema addSchema(Map<String, Object> operand) {
    Schema schema = XbrlSchemaFactory.INSTANCE.create(rootSchema, "acme", operand);
    rootSchema.add("acme", schema);
    return schema;
  }

  private static Map<String, Object> operand() {
    Map<String, Object> operand = new HashMap<>();
    operand.put("directory", XbrlTestFilings.directory().toString());
    return operand;
  }
}
