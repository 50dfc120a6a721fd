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
package io.medallion.lakehouse.etl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a {@link LakehousePipeline} run: the result of every stage that
 * was invoked, in order. Stages after a failed one are absent.
 */
public class PipelineResult {

  private final List<StageResult<?>> stages;
  private final long elapsedMillis;

  public PipelineResult(List<StageResult<?>> stages, long elapsedMillis) {
    this.stages = Collections.unmodifiableList(new ArrayList<StageResult<?>>(stages));
    this.elapsedMillis = elapsedMillis;
  }

  public List<StageResult<?>> getStages() {
    return stages;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  /**
   * Returns true if every stage ran and succeeded.
   */
  public boolean isSuccess() {
    return stages.size() == LakehousePipeline.STAGE_COUNT && getFailedStage() == null;
  }

  /**
   * Returns the result of the stage that failed, or null if none failed.
   */
  public @Nullable StageResult<?> getFailedStage() {
    for (StageResult<?> stage : stages) {
      if (stage.isFailure()) {
        return stage;
      }
    }
    return null;
  }

  /**
   * Returns the result of the named stage, or null if it was not invoked.
   */
  public @Nullable StageResult<?> getStage(String stageName) {
    for (StageResult<?> stage : stages) {
      if (stage.getStageName().equals(stageName)) {
        return stage;
      }
    }
    return null;
  }

  @Override public String toString() {
    return "PipelineResult{success=" + isSuccess() + ", stages=" + stages
        + ", elapsed=" + elapsedMillis + "ms}";
  }
}
