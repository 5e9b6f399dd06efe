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

import org.apache.calcite.adapter.xbrl.assemble.XbrlForest;
import org.apache.calcite.adapter.xbrl.assemble.XbrlForestBuilder;
import org.apache.calcite.adapter.xbrl.document.FilingDocuments;
import org.apache.calcite.adapter.xbrl.persist.ForestSerializer;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Factory for {@link XbrlSchema}.
 *
 * <p>Loads the filing in {@code directory}, assembles every statement and
 * exposes the statements as tables. When {@code cacheFile} names an existing
 * file the forest is read from it instead; otherwise the assembled forest is
 * written there.
 *
 * @see XbrlAssemblerConfig for the remaining operands
 */
public class XbrlSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(XbrlSchemaFactory.class);

  public static final XbrlSchemaFactory INSTANCE = new XbrlSchemaFactory();

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    XbrlAssemblerConfig config = XbrlAssemblerConfig.fromMap(operand);
    String cacheFile = (String) operand.get("cacheFile");
    @Nullable Path cache = cacheFile == null ? null : Paths.get(cacheFile);

    try {
      if (cache != null && Files.isRegularFile(cache)) {
        LOGGER.info("Loading schema '{}' from cache {}", name, cache);
        return new XbrlSchema(ForestSerializer.read(cache));
      }
      String directory = (String) operand.get("directory");
      if (directory == null) {
        throw new IllegalArgumentException("XBRL schema '" + name
            + "' requires 'directory' operand");
      }
      XbrlForest forest = load(Paths.get(directory), config);
      if (cache != null) {
        ForestSerializer.write(forest, cache);
      }
      return new XbrlSchema(forest);
    } catch (IOException e) {
      throw new RuntimeException("Failed to create XBRL schema '" + name + "'", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("Interrupted while assembling XBRL schema '" + name + "'", e);
    }
  }

  /**
   * Loads, builds and fully assembles the forest of a filing directory.
   */
  public static XbrlForest load(Path directory, XbrlAssemblerConfig config)
      throws IOException, InterruptedException {
    FilingDocuments documents =
        FilingDocuments.fromDirectory(directory, config.getReferenceDocument());
    XbrlForest forest = new XbrlForestBuilder(config).build(documents);
    if (config.getParallelism() <= 1) {
      return forest.assembleAll();
    }
    ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism());
    try {
      return forest.assembleAll(executor);
    } finally {
      executor.shutdown();
    }
  }
}
