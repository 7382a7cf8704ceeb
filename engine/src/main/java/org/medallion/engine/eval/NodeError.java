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
package org.medallion.engine.eval;

/**
 * Placeholder cached in place of a source transient value whose
 * computation failed for a row. Each target reading the value handles the
 * failure under its own error action.
 */
final class NodeError {

  private final Exception cause;

  NodeError(Exception cause) {
    this.cause = cause;
  }

  Exception getCause() {
    return cause;
  }

  @Override public String toString() {
    return "NodeError{" + cause + "}";
  }
}
