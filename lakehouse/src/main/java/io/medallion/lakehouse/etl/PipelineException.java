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

import java.io.IOException;

/**
 * Base class of the failures raised by the layer stages.
 *
 * <p>Each failure carries its {@link ErrorKind} and a context string naming
 * the prefix or object key involved.
 */
public class PipelineException extends IOException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final String context;

  public PipelineException(ErrorKind kind, String context, String message) {
    this(kind, context, message, null);
  }

  public PipelineException(ErrorKind kind, String context, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.context = context;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** Returns the prefix or object key the failure relates to. */
  public String getContext() {
    return context;
  }
}
