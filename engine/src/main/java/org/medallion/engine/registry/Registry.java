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
package org.medallion.engine.registry;

import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed registry of implementations.
 *
 * <p>Registries are populated with built-ins when created and with user
 * extensions afterwards, then sealed by the first successful compile.
 * Reads are lock-free; registration and sealing are serialized so that no
 * registration can slip in after the seal.
 *
 * @param <T> Type of registered implementation
 */
public abstract class Registry<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Registry.class);

  private final String kind;
  private final Map<String, T> entries = new ConcurrentHashMap<>();
  private volatile boolean sealed;

  protected Registry(String kind) {
    this.kind = kind;
  }

  /**
   * Registers an implementation under a name.
   *
   * @param name Registered name
   * @param impl Implementation
   * @param override Whether to replace an existing registration
   * @throws DuplicateRegistrationException If the name exists and override is false
   * @throws RegistrySealedException If the registry is sealed
   */
  protected synchronized void put(String name, T impl, boolean override) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException(kind + " name must not be empty");
    }
    if (impl == null) {
      throw new IllegalArgumentException(kind + " '" + name + "' must not be null");
    }
    if (sealed) {
      throw new RegistrySealedException(kind, name);
    }
    if (entries.containsKey(name) && !override) {
      throw new DuplicateRegistrationException(kind, name);
    }
    T previous = entries.put(name, impl);
    LOGGER.debug("{} {} '{}'", previous == null ? "Registered" : "Replaced", kind, name);
  }

  /**
   * Returns the implementation registered under a name.
   *
   * @param name Registered name
   * @param path Document path reported if the name is unknown, or null
   * @throws UnknownNameException If nothing is registered under the name
   */
  public T resolve(String name, @Nullable String path) {
    T impl = entries.get(name);
    if (impl == null) {
      throw unknown(name, names(), path);
    }
    return impl;
  }

  public T resolve(String name) {
    return resolve(name, null);
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  /**
   * Returns the registered names in alphabetical order.
   */
  public Set<String> names() {
    return ImmutableSortedSet.copyOf(entries.keySet());
  }

  /**
   * Forbids further registration. Idempotent.
   */
  public synchronized void seal() {
    if (!sealed) {
      sealed = true;
      LOGGER.debug("Sealed {} registry with {} entries", kind, entries.size());
    }
  }

  public boolean isSealed() {
    return sealed;
  }

  protected abstract UnknownNameException unknown(String name, Set<String> known,
      @Nullable String path);

  @Override public String toString() {
    return getClass().getSimpleName() + names() + (sealed ? " (sealed)" : "");
  }
}
