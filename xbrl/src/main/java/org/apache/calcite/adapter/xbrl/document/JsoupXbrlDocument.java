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

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link XbrlDocument} backed by jsoup's XML parser.
 *
 * <p>The XML parser keeps namespace prefixes in tag names
 * ({@code link:roleType}) and preserves case, so concept names read from
 * instance documents keep their original spelling.
 */
public class JsoupXbrlDocument extends JsoupXbrlNode implements XbrlDocument {

  private final String name;

  private JsoupXbrlDocument(Document document, String name) {
    super(document);
    this.name = name;
  }

  /**
   * Parses a document held in memory.
   *
   * @param xml Document text
   * @param name Name used in log and error messages
   */
  public static JsoupXbrlDocument parse(String xml, String name) {
    return new JsoupXbrlDocument(Jsoup.parse(xml, "", Parser.xmlParser()), name);
  }

  /**
   * Parses a document from a stream; the stream is not closed.
   */
  public static JsoupXbrlDocument parse(InputStream in, String name) throws IOException {
    Document document =
        Jsoup.parse(in, StandardCharsets.UTF_8.name(), "", Parser.xmlParser());
    return new JsoupXbrlDocument(document, name);
  }

  /**
   * Parses a document from a file.
   */
  public static JsoupXbrlDocument parse(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return parse(in, file.getFileName().toString());
    }
  }

  @Override public String getName() {
    return name;
  }

  @Override public String toString() {
    return "JsoupXbrlDocument(" + name + ")";
  }
}
