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

/**
 * How an operation affects the number of rows in its scope.
 */
public enum Cardinality {
  /** One value per input row; the row set is unchanged. */
  ONE_TO_ONE,

  /**
   * A list of values per input row; each element becomes its own row that
   * carries the values of every field derived before it. An empty list
   * removes the row.
   */
  ONE_TO_MANY
}
