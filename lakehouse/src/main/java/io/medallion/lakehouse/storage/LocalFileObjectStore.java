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
package io.medallion.lakehouse.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Object store backed by a directory on the local filesystem.
 *
 * <p>Each key maps to the file at the same relative path below the root
 * directory. Writes go to a sibling temporary file that is then moved into
 * place, so readers never observe a half-written object.
 */
public class LocalFileObjectStore implements ObjectStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileObjectStore.class);

  private final Path root;

  public LocalFileObjectStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path getRoot() {
    return root;
  }

  @Override public List<ObjectEntry> list(String prefix) throws IOException {
    if (!Files.isDirectory(root)) {
      return new ArrayList<ObjectEntry>();
    }
    List<Path> files;
    try (Stream<Path> stream = Files.walk(root)) {
      files = stream.filter(Files::isRegularFile).collect(Collectors.toList());
    }

    List<ObjectEntry> entries = new ArrayList<ObjectEntry>();
    for (Path file : files) {
      String key = toKey(file);
      if (key.startsWith(prefix) && !isStagingFile(file)) {
        entries.add(new ObjectEntry(key, Files.size(file)));
      }
    }
    entries.sort(Comparator.comparing(ObjectEntry::getKey));
    LOGGER.debug("Listed {} objects under '{}'", entries.size(), prefix);
    return entries;
  }

  @Override public InputStream get(String key) throws IOException {
    Path file = resolve(key);
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString(), null, "No object with key '" + key + "'");
    }
    return Files.newInputStream(file);
  }

  @Override public void put(String key, byte[] content) throws IOException {
    Path target = resolve(key);
    Path staging = prepareStaging(target);
    try {
      Files.write(staging, content);
      Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(staging);
    }
    LOGGER.debug("Wrote {} bytes to '{}'", content.length, key);
  }

  @Override public void put(String key, Path localFile) throws IOException {
    Path target = resolve(key);
    Path staging = prepareStaging(target);
    try {
      Files.copy(localFile, staging, StandardCopyOption.REPLACE_EXISTING);
      Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(staging);
    }
    LOGGER.debug("Copied {} to '{}'", localFile, key);
  }

  @Override public String getStoreType() {
    return "local";
  }

  private Path prepareStaging(Path target) throws IOException {
    Path parent = target.getParent();
    if (Files.exists(parent) && !Files.isDirectory(parent)) {
      throw new FileAlreadyExistsException(parent.toString(), null,
          "A file already exists where a directory is required");
    }
    Files.createDirectories(parent);
    return parent.resolve("." + target.getFileName() + ".staging");
  }

  private static boolean isStagingFile(Path file) {
    String name = file.getFileName().toString();
    return name.startsWith(".") && name.endsWith(".staging");
  }

  /**
   * Resolves a key below the root, rejecting keys that would escape it.
   */
  private Path resolve(String key) throws IOException {
    String normalizedKey = ObjectKeys.join(key);
    if (normalizedKey.isEmpty()) {
      throw new IOException("Object key must not be empty");
    }
    Path resolved = root.resolve(normalizedKey).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new IOException("Object key '" + key + "' resolves outside of " + root);
    }
    return resolved;
  }

  private String toKey(Path file) {
    Path relative = root.relativize(file);
    StringBuilder sb = new StringBuilder();
    for (Path part : relative) {
      if (sb.length() > 0) {
        sb.append('/');
      }
      sb.append(part.toString());
    }
    return sb.toString();
  }
}
