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

/**
 * Result of one stage run: either the stage output or a description of the
 * failure.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * StageResult<List<AggregateRow>> result = aggregator.execute();
 * if (result.isSuccess()) {
 *   System.out.println("Wrote " + result.getOutput().size() + " rows");
 * } else {
 *   System.err.println(result.getKind() + " at " + result.getContext()
 *       + ": " + result.getMessage());
 * }
 * }</pre>
 *
 * @param <T> Type of the stage output
 */
public class StageResult<T> {

  private final String stageName;
  private final @Nullable T output;
  private final @Nullable ErrorKind kind;
  private final @Nullable String context;
  private final @Nullable String message;
  private final @Nullable PipelineException cause;
  private final long elapsedMillis;

  private StageResult(String stageName, @Nullable T output, @Nullable PipelineException cause,
      long elapsedMillis) {
    this.stageName = stageName;
    this.output = output;
    this.cause = cause;
    this.kind = cause != null ? cause.getKind() : null;
    this.context = cause != null ? cause.getContext() : null;
    this.message = cause != null ? cause.getMessage() : null;
    this.elapsedMillis = elapsedMillis;
  }

  /**
   * Creates a successful result.
   *
   * @param stageName Stage that produced the output
   * @param output Stage output
   * @param elapsedMillis Time taken in milliseconds
   * @param <T> Type of the output
   * @return Success result
   */
  public static <T> StageResult<T> success(String stageName, T output, long elapsedMillis) {
    return new StageResult<T>(stageName, output, null, elapsedMillis);
  }

  /**
   * Creates a failed result.
   *
   * @param stageName Stage that failed
   * @param cause Failure raised by the stage
   * @param elapsedMillis Time taken before the failure
   * @param <T> Type the output would have had
   * @return Failure result
   */
  public static <T> StageResult<T> failure(String stageName, PipelineException cause,
      long elapsedMillis) {
    return new StageResult<T>(stageName, null, cause, elapsedMillis);
  }

  public String getStageName() {
    return stageName;
  }

  public boolean isSuccess() {
    return cause == null;
  }

  public boolean isFailure() {
    return cause != null;
  }

  /**
   * Returns the stage output.
   *
   * @throws IllegalStateException if the stage failed
   */
  public T getOutput() {
    if (cause != null) {
      throw new IllegalStateException("Stage " + stageName + " failed: " + message);
    }
    return output;
  }

  /**
   * Returns the failure category, or null on success.
   */
  public @Nullable ErrorKind getKind() {
    return kind;
  }

  /**
   * Returns the prefix or key the failure relates to, or null on success.
   */
  public @Nullable String getContext() {
    return context;
  }

  public @Nullable String getMessage() {
    return message;
  }

  public @Nullable PipelineException getCause() {
    return cause;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  /**
   * Returns the output, or rethrows the exception the stage failed with.
   */
  public T orElseThrow() throws PipelineException {
    if (cause != null) {
      throw cause;
    }
    return output;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("StageResult{stage=").append(stageName);
    sb.append(", status=").append(isSuccess() ? "SUCCESS" : "FAILURE");
    if (kind != null) {
      sb.append(", kind=").append(kind);
    }
    if (context != null) {
      sb.append(", context='").append(context).append("'");
    }
    if (elapsedMillis > 0) {
      sb.append(", elapsed=").append(elapsedMillis).append("ms");
    }
    if (message != null) {
      sb.append(", message='").append(message).append("'");
    }
    sb.append("}");
    return sb.toString();
  }
}
