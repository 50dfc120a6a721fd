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

import com.amazonaws.AmazonClientException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectSummary;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Object store backed by one bucket of Amazon S3 or an S3-compatible service
 * such as MinIO.
 *
 * <p>Keys are used verbatim as S3 object keys. Every SDK failure is rethrown
 * as an {@link IOException} naming the bucket and key, with the SDK exception
 * as its cause.
 */
public class S3ObjectStore implements ObjectStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStore.class);

  private final AmazonS3 s3Client;
  private final String bucket;

  public S3ObjectStore(AmazonS3 s3Client, String bucket) {
    if (bucket == null || bucket.isEmpty()) {
      throw new IllegalArgumentException("Bucket name is required");
    }
    this.s3Client = s3Client;
    this.bucket = bucket;
  }

  /**
   * Creates a store from a configuration map.
   *
   * <p>Recognized keys: {@code bucket} (required), {@code endpoint},
   * {@code region}, {@code accessKeyId}, {@code secretAccessKey}. Without a
   * configured endpoint the {@code AWS_ENDPOINT_OVERRIDE} environment variable
   * is consulted; without a region, {@code AWS_REGION}, then "us-east-1".
   * A custom endpoint switches the client to path-style access, which MinIO
   * requires.
   *
   * @param config Store configuration
   * @return S3 object store
   */
  public static S3ObjectStore create(Map<String, Object> config) {
    String bucket = stringValue(config, "bucket");
    if (bucket == null) {
      throw new IllegalArgumentException("S3 store configuration requires 'bucket'");
    }

    ClientConfiguration clientConfig = new ClientConfiguration();
    clientConfig.setSocketTimeout(15 * 60 * 1000);
    clientConfig.setConnectionTimeout(60 * 1000);

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(clientConfig);

    String accessKeyId = stringValue(config, "accessKeyId");
    String secretAccessKey = stringValue(config, "secretAccessKey");
    if (accessKeyId != null && secretAccessKey != null) {
      builder.withCredentials(
          new AWSStaticCredentialsProvider(
              new BasicAWSCredentials(accessKeyId, secretAccessKey)));
    } else {
      builder.withCredentials(new DefaultAWSCredentialsProviderChain());
    }

    String endpoint = stringValue(config, "endpoint");
    if (endpoint == null) {
      endpoint = System.getenv("AWS_ENDPOINT_OVERRIDE");
    }
    String region = stringValue(config, "region");
    if (region == null) {
      region = System.getenv("AWS_REGION");
    }
    if (region == null) {
      region = "us-east-1";
    }

    if (endpoint != null) {
      builder.withEndpointConfiguration(new EndpointConfiguration(endpoint, region));
      builder.withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(region);
    }

    LOGGER.info("Created S3 object store for bucket '{}' (endpoint: {}, region: {})",
        bucket, endpoint != null ? endpoint : "aws", region);
    return new S3ObjectStore(builder.build(), bucket);
  }

  public String getBucket() {
    return bucket;
  }

  @Override public List<ObjectEntry> list(String prefix) throws IOException {
    List<ObjectEntry> entries = new ArrayList<ObjectEntry>();
    ListObjectsV2Request request = new ListObjectsV2Request()
        .withBucketName(bucket)
        .withPrefix(prefix);

    try {
      ListObjectsV2Result result;
      do {
        result = s3Client.listObjectsV2(request);
        for (S3ObjectSummary summary : result.getObjectSummaries()) {
          // zero-byte "directory" markers
          if (summary.getKey().endsWith("/")) {
            continue;
          }
          entries.add(new ObjectEntry(summary.getKey(), summary.getSize()));
        }
        request.setContinuationToken(result.getNextContinuationToken());
      } while (result.isTruncated());
    } catch (AmazonClientException e) {
      throw new IOException("Failed to list s3://" + bucket + "/" + prefix, e);
    }

    entries.sort(Comparator.comparing(ObjectEntry::getKey));
    LOGGER.debug("Listed {} objects under s3://{}/{}", entries.size(), bucket, prefix);
    return entries;
  }

  @Override public InputStream get(String key) throws IOException {
    try {
      S3Object object = s3Client.getObject(bucket, key);
      return object.getObjectContent();
    } catch (AmazonClientException e) {
      throw new IOException("Failed to read s3://" + bucket + "/" + key, e);
    }
  }

  @Override public void put(String key, byte[] content) throws IOException {
    ObjectMetadata metadata = new ObjectMetadata();
    metadata.setContentLength(content.length);
    metadata.setContentType(guessContentType(key));

    try (InputStream input = new ByteArrayInputStream(content)) {
      s3Client.putObject(new PutObjectRequest(bucket, key, input, metadata));
    } catch (AmazonClientException e) {
      throw new IOException("Failed to write s3://" + bucket + "/" + key, e);
    }
    LOGGER.debug("Uploaded {} bytes to s3://{}/{}", content.length, bucket, key);
  }

  @Override public void put(String key, Path localFile) throws IOException {
    try {
      s3Client.putObject(new PutObjectRequest(bucket, key, localFile.toFile()));
    } catch (AmazonClientException e) {
      throw new IOException("Failed to upload " + localFile + " to s3://" + bucket + "/" + key, e);
    }
    LOGGER.debug("Uploaded {} to s3://{}/{}", localFile, bucket, key);
  }

  @Override public String getStoreType() {
    return "s3";
  }

  private static String guessContentType(String key) {
    String lowercaseKey = key.toLowerCase(Locale.ROOT);
    if (lowercaseKey.endsWith(".json")) {
      return "application/json";
    } else if (lowercaseKey.endsWith(".parquet")) {
      return "application/x-parquet";
    }
    return "application/octet-stream";
  }

  private static @Nullable String stringValue(Map<String, Object> config, String name) {
    Object value = config.get(name);
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isEmpty() ? null : text;
  }
}
