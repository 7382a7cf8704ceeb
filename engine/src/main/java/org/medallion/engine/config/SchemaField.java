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

import java.util.Objects;

/**
 * One (name, type) pair of an explicit parse schema.
 */
public final class SchemaField {

  private final String name;
  private final FieldType type;

  public SchemaField(String name, FieldType type) {
    this.name = Objects.requireNonNull(name, "name");
    this.type = Objects.requireNonNull(type, "type");
  }

  public String getName() {
    return name;
  }

  public FieldType getType() {
    return type;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SchemaField)) {
      return false;
    }
    SchemaField that = (SchemaField) o;
    return name.equals(that.name) && type.equals(that.type);
  }

  @Override public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override public String toString() {
    return name + ":" + type;
  }
}
