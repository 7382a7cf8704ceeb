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
package org.medallion.engine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Parses declarative pipeline documents (YAML or JSON) into {@link PipelineConfig}s.
 *
 * <p>The parser performs no I/O beyond reading the document and never touches
 * source data. Malformed or incomplete documents are rejected with a
 * {@link ConfigException} naming the document path at fault.
 *
 * <pre>{@code
 * PipelineConfig config = PipelineConfigParser.parse(Paths.get("pipelines/questions.yaml"));
 * }</pre>
 */
public final class PipelineConfigParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfigParser.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> DOCUMENT =
      new TypeReference<Map<String, Object>>() { };

  private PipelineConfigParser() {
  }

  /**
   * Parses a document held in memory. Text starting with '{' is read as JSON,
   * anything else as YAML.
   */
  public static PipelineConfig parse(String text) {
    ObjectMapper mapper = text.trim().startsWith("{") ? JSON_MAPPER : YAML_MAPPER;
    Map<String, Object> document;
    try {
      document = mapper.readValue(text, DOCUMENT);
    } catch (JsonProcessingException e) {
      throw new ConfigException("malformed document: " + e.getOriginalMessage(), "pipeline", e);
    }
    return fromDocument(document);
  }

  /**
   * Parses a document file. Files ending in {@code .json} are read as JSON,
   * anything else as YAML.
   *
   * @throws IOException If the file cannot be read
   */
  public static PipelineConfig parse(Path file) throws IOException {
    LOGGER.debug("Reading pipeline document {}", file);
    String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    if (file.getFileName().toString().endsWith(".json")) {
      try {
        return fromDocument(JSON_MAPPER.readValue(text, DOCUMENT));
      } catch (JsonProcessingException e) {
        throw new ConfigException("malformed document " + file + ": " + e.getOriginalMessage(),
            "pipeline", e);
      }
    }
    return parse(text);
  }

  /**
   * Parses a YAML (or JSON) document from a stream, e.g. a classpath resource.
   *
   * @throws IOException If the stream cannot be read
   */
  public static PipelineConfig parse(InputStream in) throws IOException {
    return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
  }

  /**
   * Converts an already-decoded document ({@code {pipeline: {...}}}).
   */
  public static PipelineConfig fromDocument(Map<String, Object> document) {
    if (document == null) {
      throw new ConfigException("document is empty", "pipeline");
    }
    ConfigReader root = ConfigReader.of(document, "");
    for (String key : document.keySet()) {
      if (!"pipeline".equals(key)) {
        throw new ConfigException("unknown top-level key '" + key + "'; expected 'pipeline'",
            key);
      }
    }
    if (!root.has("pipeline")) {
      throw new ConfigException("missing required key 'pipeline'", "pipeline");
    }
    PipelineConfig config = PipelineConfig.fromMap(root.get("pipeline"), "pipeline");
    LOGGER.debug("Parsed pipeline '{}': {} source tables, {} target tables",
        config.getName(), config.getSourceTables().size(), config.getTargetTables().size());
    return config;
  }
}
