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
 * Layer transformation stages of the brewery lakehouse.
 *
 * <h2>Stages</h2>
 * <ul>
 *   <li>{@link io.medallion.lakehouse.etl.RawLanding} - stores fetched source records in the
 *       raw layer</li>
 *   <li>{@link io.medallion.lakehouse.etl.Cleaner} - normalizes raw JSON files into the
 *       cleaned layer</li>
 *   <li>{@link io.medallion.lakehouse.etl.PartitionBuilder} - writes one Parquet file per
 *       partition key to the silver layer</li>
 *   <li>{@link io.medallion.lakehouse.etl.Aggregator} - counts silver rows per category and
 *       key into the gold layer</li>
 *   <li>{@link io.medallion.lakehouse.etl.LakehousePipeline} - runs the three transformation
 *       stages in order</li>
 * </ul>
 *
 * <p>Failures are {@link io.medallion.lakehouse.etl.PipelineException}s tagged with an
 * {@link io.medallion.lakehouse.etl.ErrorKind}; {@code execute()} turns them into a
 * {@link io.medallion.lakehouse.etl.StageResult}.
 */
package io.medallion.lakehouse.etl;
