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
package org.medallion.engine.op;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Built-in parsers for JSON and YAML text, backed by Jackson.
 */
public final class StructuredTextParsers {

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private StructuredTextParsers() {
  }

  /**
   * Returns a parser decoding JSON text into maps, lists and scalars.
   */
  public static Parser json() {
    return text -> JSON_MAPPER.readValue(text, Object.class);
  }

  /**
   * Returns a parser decoding a YAML document into maps, lists and scalars.
   */
  public static Parser yaml() {
    return text -> YAML_MAPPER.readValue(text, Object.class);
  }
}
