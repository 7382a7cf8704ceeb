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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The operations every engine provides, by registered name.
 */
public final class BuiltinOperations {

  private BuiltinOperations() {
  }

  public static Map<String, Operation> all() {
    return ImmutableMap.<String, Operation>builder()
        .put("copy", new CopyOperation(false))
        .put("rename", new CopyOperation(true))
        .put("cast", new CastOperation(false))
        .put("date", new CastOperation(true))
        .put("join", new JoinOperation())
        .put("value_conversion", new ValueConversionOperation())
        .put("parse_json", new ParseOperation(false))
        .put("parse_and_flatten", new ParseOperation(true))
        .put(CustomOpDispatch.NAME, new CustomOpDispatch())
        .build();
  }
}
