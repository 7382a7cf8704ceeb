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

import org.medallion.engine.config.ConfigException;
import org.medallion.engine.config.FieldConfig;
import org.medallion.engine.config.JoinConfig;
import org.medallion.engine.path.FieldPath;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The {@code join} operation looks up rows of other source tables.
 *
 * <pre>{@code
 * - name: user_name
 *   op: join
 *   field: bronze.users.display_name
 *   join:
 *     - table: bronze.users
 *       on: {owner_id: id}
 *   parameters: {join_type: left}
 * }</pre>
 *
 * <p>The field names a column of a joined table, or the table itself for the
 * whole matched row. Each {@code on} entry maps a reference in the current
 * row (or a column of a table joined earlier in the list, prefixed by its
 * name) to a column of the joined table. Several matches produce one row
 * each, in the joined table's order. Without a match an {@code inner} join
 * removes the row and a {@code left} join yields null.
 */
public class JoinOperation implements Operation {

  @Override public BoundOperation bind(FieldConfig field, OperationLookup lookup) {
    OperationParameters.requireSingleInput(field);
    OperationParameters params = OperationParameters.of(field, "join_type");
    if (field.getJoins().isEmpty()) {
      throw new ConfigException("op 'join' requires a join definition",
          field.getLocation() + ".join");
    }
    String joinType = params.optString("join_type");
    boolean left;
    if (joinType == null || joinType.toLowerCase(Locale.ROOT).equals("inner")) {
      left = false;
    } else if (joinType.toLowerCase(Locale.ROOT).equals("left")) {
      left = true;
    } else {
      throw params.error("join_type", "unknown join_type '" + joinType
          + "'; expected inner or left");
    }

    List<String> tables = new ArrayList<>();
    Set<String> inputs = new LinkedHashSet<>();
    List<List<KeyPart>> keys = new ArrayList<>();
    for (JoinConfig join : field.getJoins()) {
      List<KeyPart> parts = new ArrayList<>();
      for (String reference : join.getOn().keySet()) {
        KeyPart part = KeyPart.of(reference, tables);
        if (part.table == null) {
          inputs.add(reference);
        }
        parts.add(part);
      }
      keys.add(parts);
      tables.add(join.getTable());
    }
    Target output = Target.of(field.getField(), tables);
    if (output == null) {
      throw new ConfigException("join field '" + field.getField()
          + "' must name a joined table or one of its columns", field.getLocation() + ".fields");
    }
    return new Bound(field, tables, ImmutableList.copyOf(inputs), keys, output, left);
  }

  /** One key component: a current-row input, or a column of an earlier joined table. */
  private static class KeyPart {
    final String reference;
    final @Nullable String table;
    final FieldPath column;

    KeyPart(String reference, @Nullable String table, FieldPath column) {
      this.reference = reference;
      this.table = table;
      this.column = column;
    }

    static KeyPart of(String reference, List<String> joinedTables) {
      Target earlier = Target.of(reference, joinedTables);
      if (earlier != null) {
        return new KeyPart(reference, earlier.table, earlier.column);
      }
      return new KeyPart(reference, null, FieldPath.empty());
    }
  }

  /** A reference into a joined table, by longest matching table name. */
  private static class Target {
    final String table;
    final FieldPath column;

    Target(String table, FieldPath column) {
      this.table = table;
      this.column = column;
    }

    static @Nullable Target of(String reference, List<String> tables) {
      String best = null;
      for (String table : tables) {
        if ((reference.equals(table) || reference.startsWith(table + "."))
            && (best == null || table.length() > best.length())) {
          best = table;
        }
      }
      if (best == null) {
        return null;
      }
      String rest = reference.substring(best.length());
      return new Target(best, rest.isEmpty()
          ? FieldPath.empty() : FieldPath.parse(rest.substring(1)));
    }
  }

  private static class Bound extends BoundOperation {
    private final List<String> tables;
    private final List<String> inputs;
    private final List<List<KeyPart>> keys;
    private final Target output;
    private final boolean left;

    Bound(FieldConfig field, List<String> tables, List<String> inputs,
        List<List<KeyPart>> keys, Target output, boolean left) {
      super(field, Cardinality.ONE_TO_MANY);
      this.tables = ImmutableList.copyOf(tables);
      this.inputs = inputs;
      this.keys = keys;
      this.output = output;
      this.left = left;
    }

    @Override public List<String> getInputs() {
      return inputs;
    }

    @Override public List<String> getLookupTables() {
      return tables;
    }

    @Override public @Nullable Object apply(OperationContext context,
        List<@Nullable Object> values) {
      Map<String, Object> current = new HashMap<>();
      for (int i = 0; i < inputs.size(); i++) {
        current.put(inputs.get(i), values.get(i));
      }
      // Each combination maps joined table name to its matched row
      List<Map<String, Object>> combinations = new ArrayList<>();
      combinations.add(new HashMap<>());
      List<JoinConfig> joins = field.getJoins();
      for (int j = 0; j < joins.size(); j++) {
        List<Map<String, Object>> next = new ArrayList<>();
        for (Map<String, Object> combination : combinations) {
          List<Object> key = new ArrayList<>();
          for (KeyPart part : keys.get(j)) {
            key.add(part.table == null
                ? current.get(part.reference)
                : part.column.resolve(combination.get(part.table)));
          }
          List<Map<String, Object>> matches = context.match(joins.get(j), key);
          if (matches.isEmpty() && left) {
            Map<String, Object> extended = new HashMap<>(combination);
            extended.put(tables.get(j), null);
            next.add(extended);
          }
          for (Map<String, Object> match : matches) {
            Map<String, Object> extended = new HashMap<>(combination);
            extended.put(tables.get(j), match);
            next.add(extended);
          }
        }
        combinations = next;
      }
      List<@Nullable Object> result = new ArrayList<>(combinations.size());
      for (Map<String, Object> combination : combinations) {
        result.add(output.column.resolve(combination.get(output.table)));
      }
      return result;
    }

    @Override public String toString() {
      return (left ? "left " : "") + "join(" + String.join(", ", tables) + " on "
          + String.join(", ", inputs) + " -> " + field.getField() + ")";
    }
  }
}
