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

import org.medallion.engine.config.ConfigException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collection;

/**
 * Raised at compile time when a pipeline names something no registry holds.
 */
public abstract class UnknownNameException extends ConfigException {

  private final String name;

  protected UnknownNameException(String kind, String name, Collection<String> known,
      @Nullable String path) {
    super("unknown " + kind + " '" + name + "'; registered: " + known, path);
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
