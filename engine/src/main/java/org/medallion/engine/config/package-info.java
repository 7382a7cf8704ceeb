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

/**
 * Typed model of a declarative pipeline document.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link org.medallion.engine.config.PipelineConfig} - source tables, target
 *       tables and engine settings of one pipeline</li>
 *   <li>{@link org.medallion.engine.config.SourceTableConfig} - a source table and
 *       its source-level transients</li>
 *   <li>{@link org.medallion.engine.config.TargetTableConfig} - columns, target-level
 *       transients, validations and write mode of a derived table</li>
 *   <li>{@link org.medallion.engine.config.FieldConfig} - one derived field (column
 *       or transient)</li>
 *   <li>{@link org.medallion.engine.config.ValidationConfig} - one validation rule</li>
 * </ul>
 *
 * <p>Documents are read by {@link org.medallion.engine.config.PipelineConfigParser};
 * every error names the document path at fault.
 */
package org.medallion.engine.config;
