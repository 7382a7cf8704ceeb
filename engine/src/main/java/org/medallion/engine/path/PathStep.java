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
package org.medallion.engine.path;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One step of a {@link FieldPath}: a named field access, an array index, or
 * an "every element" step written {@code []}.
 */
public final class PathStep {

  /**
   * Step kinds.
   */
  public enum Kind {
    /** {@code .name}: read a field of an object. */
    FIELD,
    /** {@code [n]}: read one element of an array. */
    INDEX,
    /** {@code []}: continue with every element of an array. */
    ELEMENTS
  }

  private static final PathStep ELEMENTS_STEP = new PathStep(Kind.ELEMENTS, null, -1);

  private final Kind kind;
  private final @Nullable String name;
  private final int index;

  private PathStep(Kind kind, @Nullable String name, int index) {
    this.kind = kind;
    this.name = name;
    this.index = index;
  }

  public static PathStep field(String name) {
    return new PathStep(Kind.FIELD, Objects.requireNonNull(name, "name"), -1);
  }

  public static PathStep index(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Negative array index " + index);
    }
    return new PathStep(Kind.INDEX, null, index);
  }

  public static PathStep elements() {
    return ELEMENTS_STEP;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Returns the field name of a {@link Kind#FIELD} step, otherwise null.
   */
  public @Nullable String getName() {
    return name;
  }

  /**
   * Returns the index of an {@link Kind#INDEX} step, otherwise -1.
   */
  public int getIndex() {
    return index;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PathStep)) {
      return false;
    }
    PathStep that = (PathStep) o;
    return kind == that.kind && index == that.index && Objects.equals(name, that.name);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, name, index);
  }

  @Override public String toString() {
    switch (kind) {
      case FIELD:
        return name;
      case INDEX:
        return "[" + index + "]";
      default:
        return "[]";
    }
  }
}
