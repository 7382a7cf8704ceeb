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
package org.medallion.engine.graph;

import org.medallion.engine.path.FieldPath;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A field reference resolved to what produces it.
 *
 * <p>The reference {@code answers_struct.score} resolves to the value of the
 * node {@code answers_struct} (the key, in namespace
 * {@link Namespace#SOURCE_TRANSIENT} or {@link Namespace#TARGET}) followed by
 * the structural path {@code score}. A reference to a plain source field has
 * no producer.
 */
public class InputRef {

  /**
   * Where the value of a reference's first segment lives in a row.
   */
  public enum Namespace {
    /** A field read from the source table. */
    SOURCE_FIELD,
    /** A source-level transient. */
    SOURCE_TRANSIENT,
    /** A target-level transient or column. */
    TARGET
  }

  private final String reference;
  private final Namespace namespace;
  private final String key;
  private final FieldPath path;
  private final @Nullable String producer;

  public InputRef(String reference, Namespace namespace, String key, FieldPath path,
      @Nullable String producer) {
    this.reference = reference;
    this.namespace = namespace;
    this.key = key;
    this.path = path;
    this.producer = producer;
  }

  /**
   * Returns the reference as written in the document.
   */
  public String getReference() {
    return reference;
  }

  public Namespace getNamespace() {
    return namespace;
  }

  /**
   * Returns the name of the source field or node the reference starts at.
   */
  public String getKey() {
    return key;
  }

  /**
   * Returns the structural path applied after the first segment.
   */
  public FieldPath getPath() {
    return path;
  }

  /**
   * Returns the id of the producing node, or null for a source field.
   */
  public @Nullable String getProducer() {
    return producer;
  }

  @Override public String toString() {
    return reference + "->" + namespace + ":" + key + (path.isEmpty() ? "" : "." + path);
  }
}
