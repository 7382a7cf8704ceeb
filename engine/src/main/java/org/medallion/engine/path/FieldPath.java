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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parsed dot/bracket path into a nested value, such as {@code answers[].author}
 * or {@code payload.items[0].sku}.
 *
 * <p>Values are addressed in the engine's structural value model: objects are
 * {@link Map}s with string keys, arrays are {@link List}s, and everything else
 * is a scalar. Resolution is null-tolerant: a missing field, an out-of-range
 * index, or a step applied to null yields null rather than an error. A
 * {@code []} step maps the rest of the path over every element, so a path
 * containing one resolves to a list (nested {@code []} steps are flattened).
 *
 * <pre>{@code
 * FieldPath path = FieldPath.parse("answers[].author");
 * path.getRoot();        // "answers"
 * path.tail();           // [].author
 * path.hasElements();    // true
 * path.resolve(row);     // ["alice", "bob"]
 * }</pre>
 */
public final class FieldPath {

  private static final FieldPath EMPTY = new FieldPath(ImmutableList.of());

  private final ImmutableList<PathStep> steps;

  private FieldPath(ImmutableList<PathStep> steps) {
    this.steps = steps;
  }

  public static FieldPath empty() {
    return EMPTY;
  }

  public static FieldPath of(List<PathStep> steps) {
    return steps.isEmpty() ? EMPTY : new FieldPath(ImmutableList.copyOf(steps));
  }

  /**
   * Parses a path expression.
   *
   * @param expression Path text; an empty string denotes the identity path
   * @return Parsed path
   * @throws IllegalArgumentException if the expression is malformed
   */
  public static FieldPath parse(String expression) {
    String text = expression.trim();
    if (text.isEmpty()) {
      return EMPTY;
    }
    List<PathStep> steps = new ArrayList<>();
    int pos = 0;
    boolean expectName = text.charAt(0) != '[';
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '[') {
        int close = text.indexOf(']', pos);
        if (close < 0) {
          throw new IllegalArgumentException("Unclosed '[' in path '" + expression + "'");
        }
        String inside = text.substring(pos + 1, close).trim();
        if (inside.isEmpty()) {
          steps.add(PathStep.elements());
        } else {
          try {
            steps.add(PathStep.index(Integer.parseInt(inside)));
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array index '" + inside
                + "' in path '" + expression + "'", e);
          }
        }
        pos = close + 1;
        expectName = false;
      } else if (c == '.') {
        if (expectName) {
          throw new IllegalArgumentException("Empty field name in path '" + expression + "'");
        }
        pos++;
        expectName = true;
        if (pos == text.length()) {
          throw new IllegalArgumentException("Path '" + expression + "' ends with '.'");
        }
      } else if (c == ']') {
        throw new IllegalArgumentException("Unexpected ']' in path '" + expression + "'");
      } else {
        if (!expectName) {
          throw new IllegalArgumentException("Missing '.' before field name in path '"
              + expression + "'");
        }
        int end = pos;
        while (end < text.length() && "[].".indexOf(text.charAt(end)) < 0) {
          end++;
        }
        steps.add(PathStep.field(text.substring(pos, end).trim()));
        pos = end;
        expectName = false;
      }
    }
    return of(steps);
  }

  public List<PathStep> getSteps() {
    return steps;
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  /**
   * Returns whether the path contains a {@code []} step, i.e. resolves to a
   * list of values rather than a single value.
   */
  public boolean hasElements() {
    for (PathStep step : steps) {
      if (step.getKind() == PathStep.Kind.ELEMENTS) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the name of the leading field step, or null if the path is empty
   * or starts with an array step.
   */
  public @Nullable String getRoot() {
    if (steps.isEmpty() || steps.get(0).getKind() != PathStep.Kind.FIELD) {
      return null;
    }
    return steps.get(0).getName();
  }

  /**
   * Returns the path without its first step.
   */
  public FieldPath tail() {
    return steps.size() <= 1 ? EMPTY : of(steps.subList(1, steps.size()));
  }

  /**
   * Resolves this path against a value.
   *
   * @param value Starting value (object, array, or scalar)
   * @return The addressed value, or a list of values when the path contains
   *     a {@code []} step
   * @throws IllegalArgumentException if a {@code []} step meets a non-array value
   */
  public @Nullable Object resolve(@Nullable Object value) {
    List<Object> current = new ArrayList<>(1);
    current.add(value);
    boolean multi = false;
    for (PathStep step : steps) {
      List<Object> next = new ArrayList<>(current.size());
      for (Object item : current) {
        switch (step.getKind()) {
          case FIELD:
            next.add(item instanceof Map ? ((Map<?, ?>) item).get(step.getName()) : null);
            break;
          case INDEX:
            if (item instanceof List && step.getIndex() < ((List<?>) item).size()) {
              next.add(((List<?>) item).get(step.getIndex()));
            } else {
              next.add(null);
            }
            break;
          default:
            if (item instanceof List) {
              next.addAll((List<?>) item);
            } else if (item != null) {
              throw new IllegalArgumentException("Path " + this + " expects an array but found "
                  + item.getClass().getSimpleName());
            }
        }
      }
      if (step.getKind() == PathStep.Kind.ELEMENTS) {
        multi = true;
      }
      current = next;
    }
    if (multi) {
      return current;
    }
    return current.get(0);
  }

  @Override public boolean equals(Object o) {
    return this == o || o instanceof FieldPath && steps.equals(((FieldPath) o).steps);
  }

  @Override public int hashCode() {
    return steps.hashCode();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (PathStep step : steps) {
      if (step.getKind() == PathStep.Kind.FIELD && sb.length() > 0) {
        sb.append('.');
      }
      sb.append(step);
    }
    return sb.toString();
  }
}
