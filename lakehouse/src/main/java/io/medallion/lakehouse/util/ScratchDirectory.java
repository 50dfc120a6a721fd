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
package io.medallion.lakehouse.util;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Local temporary directory owned by one stage run.
 *
 * <p>Each instance is a fresh, uniquely named directory, so concurrent or
 * back-to-back runs never share files. {@link #close()} deletes the directory
 * and everything below it; use it with try-with-resources.
 */
public class ScratchDirectory implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchDirectory.class);

  private final Path path;

  private ScratchDirectory(Path path) {
    this.path = path;
  }

  /**
   * Creates a scratch directory.
   *
   * @param root Parent directory, or null for {@code java.io.tmpdir}
   * @param runName Short label included in the directory name
   * @return New scratch directory
   * @throws IOException If the directory cannot be created
   */
  public static ScratchDirectory create(@Nullable Path root, String runName)
      throws IOException {
    Path parent = root != null ? root : Paths.get(System.getProperty("java.io.tmpdir"));
    Files.createDirectories(parent);
    Path path = Files.createTempDirectory(parent, "lakehouse-" + runName + "-");
    LOGGER.debug("Created scratch directory: {}", path);
    return new ScratchDirectory(path);
  }

  public Path getPath() {
    return path;
  }

  /** Resolves a slash-separated relative key below this directory. */
  public Path resolve(String relativeKey) {
    return path.resolve(relativeKey).normalize();
  }

  @Override public void close() {
    if (!Files.exists(path)) {
      return;
    }
    try {
      Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
        @Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
            throws IOException {
          Files.deleteIfExists(file);
          return FileVisitResult.CONTINUE;
        }

        @Override public FileVisitResult postVisitDirectory(Path dir, IOException exc)
            throws IOException {
          Files.deleteIfExists(dir);
          return FileVisitResult.CONTINUE;
        }
      });
      LOGGER.debug("Deleted scratch directory: {}", path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete scratch directory {}: {}", path, e.getMessage());
    }
  }
}
