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
package org.medallion.engine.io;

import org.medallion.engine.config.WriteMode;
import org.medallion.engine.validation.QuarantineRecord;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link InMemoryTableStore}.
 */
@Tag("unit")
public class InMemoryTableStoreTest {

  private static final List<String> COLUMNS = Arrays.asList("id", "name");

  private static Map<String, Object> row(int id, String name) {
    return ImmutableMap.of("id", id, "name", name);
  }

  private static WriteRequest request(WriteMode mode, List<Map<String, Object>> rows) {
    List<String> key = mode == WriteMode.MERGE
        ? Collections.singletonList("id") : Collections.emptyList();
    return new WriteRequest("silver.t", mode, key, COLUMNS, rows);
  }

  private static WriteRequest quarantineRequest(WriteMode mode,
      Collection<QuarantineRecord> records) {
    List<String> key = mode == WriteMode.MERGE
        ? Collections.singletonList("id") : Collections.emptyList();
    return new WriteRequest("silver.t", mode, key, COLUMNS, Collections.emptyList(),
        new ArrayList<>(records));
  }

  private static QuarantineRecord quarantined(int id) {
    return new QuarantineRecord("silver.t", "not_null", "name", "value null failed not_null",
        ImmutableMap.of("id", id));
  }

  @Test void testReadMissingTableFails() {
    InMemoryTableStore store = new InMemoryTableStore();

    assertThrows(IOException.class, () -> store.read("bronze.missing"));
    assertFalse(store.contains("bronze.missing"));
    assertTrue(store.rows("bronze.missing").isEmpty());
  }

  @Test void testReadReturnsCopies() throws IOException {
    InMemoryTableStore store = new InMemoryTableStore()
        .put("bronze.t", Collections.singletonList(row(1, "a")));

    Iterator<Map<String, Object>> rows = store.read("bronze.t");
    Map<String, Object> first = rows.next();
    assertFalse(rows.hasNext());
    assertEquals(row(1, "a"), first);
    assertThrows(UnsupportedOperationException.class, () -> first.put("id", 2));
  }

  @Test void testOverwriteReplacesRows() {
    InMemoryTableStore store = new InMemoryTableStore();
    store.write(request(WriteMode.OVERWRITE, Arrays.asList(row(1, "a"), row(2, "b"))));

    long written = store.write(request(WriteMode.OVERWRITE,
        Collections.singletonList(row(3, "c"))));

    assertEquals(1, written);
    assertEquals(Collections.singletonList(row(3, "c")), store.rows("silver.t"));
  }

  @Test void testAppendAddsRows() {
    InMemoryTableStore store = new InMemoryTableStore();
    store.write(request(WriteMode.APPEND, Collections.singletonList(row(1, "a"))));
    store.write(request(WriteMode.APPEND, Collections.singletonList(row(1, "a"))));

    assertEquals(2, store.rows("silver.t").size());
  }

  @Test void testMergeUpsertsByKey() {
    InMemoryTableStore store = new InMemoryTableStore();
    List<Map<String, Object>> batch = Arrays.asList(row(1, "a"), row(2, "b"));
    store.write(request(WriteMode.MERGE, batch));
    store.write(request(WriteMode.MERGE, batch));

    assertEquals(batch, store.rows("silver.t"));

    store.write(request(WriteMode.MERGE, Arrays.asList(row(2, "bee"), row(3, "c"))));
    assertEquals(Arrays.asList(row(1, "a"), row(2, "bee"), row(3, "c")),
        store.rows("silver.t"));
  }

  @Test void testQuarantineWrites() {
    InMemoryTableStore store = new InMemoryTableStore();
    QuarantineRecord first = quarantined(1);
    QuarantineRecord second = quarantined(2);

    store.write(quarantineRequest(WriteMode.MERGE, Collections.singletonList(first)));
    store.write(quarantineRequest(WriteMode.MERGE, Arrays.asList(first, second)));
    assertEquals(Arrays.asList(first, second), store.quarantine("silver.t"));

    store.write(quarantineRequest(WriteMode.APPEND, Collections.singletonList(first)));
    assertEquals(3, store.quarantine("silver.t").size());

    store.write(quarantineRequest(WriteMode.OVERWRITE, Collections.<QuarantineRecord>emptyList()));
    assertTrue(store.quarantine("silver.t").isEmpty());
  }

  @Test void testWriteCommitsRowsAndQuarantineTogether() {
    InMemoryTableStore store = new InMemoryTableStore();
    store.write(new WriteRequest("silver.t", WriteMode.OVERWRITE, Collections.emptyList(),
        COLUMNS, Collections.singletonList(row(1, "a")),
        Collections.singletonList(quarantined(2))));

    assertEquals(Collections.singletonList(row(1, "a")), store.rows("silver.t"));
    assertEquals(Collections.singletonList(quarantined(2)), store.quarantine("silver.t"));

    long written = store.write(request(WriteMode.OVERWRITE,
        Collections.singletonList(row(3, "c"))));
    assertEquals(1, written);
    assertTrue(store.quarantine("silver.t").isEmpty());
  }
}
