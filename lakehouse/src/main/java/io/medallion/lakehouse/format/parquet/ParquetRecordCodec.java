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
package io.medallion.lakehouse.format.parquet;

import io.medallion.lakehouse.model.DataRecord;
import io.medallion.lakehouse.model.FieldValue;
import io.medallion.lakehouse.model.RecordBatch;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes the columnar files of the silver and gold layers.
 *
 * <p>Records are schema-on-read, so the Avro schema of a file is inferred from
 * the rows being written. A column whose non-null values all share one kind
 * gets that type (integral and fractional numbers together widen to
 * {@code double}); a column of mixed kinds becomes a union of those kinds; a
 * column holding only nulls is a string column. Every column is nullable.
 *
 * <p>Column names that are not valid Avro names, such as the dotted names of
 * flattened objects, are sanitized and the original name is stored in the
 * field property {@value #ORIGINAL_NAME_PROP}, which is used again on read.
 */
public class ParquetRecordCodec {
  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetRecordCodec.class);

  /** Avro field property holding the column name before sanitizing. */
  public static final String ORIGINAL_NAME_PROP = "originalName";

  private static final String AVRO_SCHEMA_KEY = "parquet.avro.schema";

  /** Kinds of Avro branch a column may hold, in union order after null. */
  private enum Branch {
    BOOLEAN(Schema.Type.BOOLEAN),
    LONG(Schema.Type.LONG),
    DOUBLE(Schema.Type.DOUBLE),
    STRING(Schema.Type.STRING);

    private final Schema.Type avroType;

    Branch(Schema.Type avroType) {
      this.avroType = avroType;
    }
  }

  private final CompressionCodecName compression;
  private final Configuration hadoopConf;

  public ParquetRecordCodec() {
    this("snappy");
  }

  /**
   * Creates a codec.
   *
   * @param compression Parquet compression codec name, e.g. "snappy", "gzip"
   *     or "uncompressed"
   */
  public ParquetRecordCodec(String compression) {
    try {
      this.compression = CompressionCodecName.fromConf(compression);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown Parquet compression codec: " + compression, e);
    }
    this.hadoopConf = new Configuration();
  }

  public CompressionCodecName getCompression() {
    return compression;
  }

  /**
   * Infers the Avro schema for a set of rows.
   *
   * @param recordName Name of the Avro record
   * @param columns Column names, in output order
   * @param rows Rows to describe
   * @return Record schema with one nullable field per column
   */
  public Schema inferSchema(String recordName, List<String> columns, List<DataRecord> rows) {
    List<Schema.Field> fields = new ArrayList<Schema.Field>();
    Set<String> usedNames = new HashSet<String>();

    for (String column : columns) {
      EnumSet<Branch> branches = EnumSet.noneOf(Branch.class);
      for (DataRecord row : rows) {
        FieldValue value = row.get(column);
        if (value != null && !value.isNull()) {
          branches.add(branchOf(value));
        }
      }
      if (branches.contains(Branch.LONG) && branches.contains(Branch.DOUBLE)) {
        branches.remove(Branch.LONG);
      }
      if (branches.isEmpty()) {
        branches.add(Branch.STRING);
      }

      List<Schema> types = new ArrayList<Schema>();
      types.add(Schema.create(Schema.Type.NULL));
      for (Branch branch : branches) {
        types.add(Schema.create(branch.avroType));
      }

      String fieldName = uniqueName(sanitize(column), usedNames);
      Schema.Field field =
          new Schema.Field(fieldName, Schema.createUnion(types), null,
              Schema.Field.NULL_DEFAULT_VALUE);
      if (!fieldName.equals(column)) {
        field.addProp(ORIGINAL_NAME_PROP, column);
      }
      fields.add(field);
    }

    return Schema.createRecord(sanitize(recordName), null, "io.medallion.lakehouse", false,
        fields);
  }

  /**
   * Writes rows to a local Parquet file, replacing any existing file.
   *
   * @param file Local file to write
   * @param recordName Name of the Avro record
   * @param columns Column names, in output order
   * @param rows Rows to write
   * @return Schema the file was written with
   * @throws IOException If the file cannot be written
   */
  @SuppressWarnings("deprecation")
  public Schema write(Path file, String recordName, List<String> columns, List<DataRecord> rows)
      throws IOException {
    Schema schema = inferSchema(recordName, columns, rows);
    Files.createDirectories(file.toAbsolutePath().getParent());

    try (ParquetWriter<GenericRecord> writer =
             AvroParquetWriter
                 .<GenericRecord>builder(new org.apache.hadoop.fs.Path(file.toUri()))
                 .withSchema(schema)
                 .withConf(hadoopConf)
                 .withCompressionCodec(compression)
                 .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                 .build()) {
      for (DataRecord row : rows) {
        writer.write(toGenericRecord(schema, columns, row));
      }
    }
    LOGGER.debug("Wrote {} rows with {} columns to {}", rows.size(), columns.size(), file);
    return schema;
  }

  /**
   * Reads a local Parquet file.
   *
   * <p>Columns come from the file schema, so a file without rows still
   * reports its columns. Null values are omitted from the decoded rows.
   *
   * @param sourceKey Key to record as the batch source
   * @param file Local Parquet file
   * @return Decoded batch
   * @throws IOException If the file is not readable Parquet
   */
  public RecordBatch read(String sourceKey, Path file) throws IOException {
    InputFile inputFile =
        HadoopInputFile.fromPath(new org.apache.hadoop.fs.Path(file.toUri()), hadoopConf);
    List<String> columns = readColumns(inputFile);
    List<DataRecord> rows = new ArrayList<DataRecord>();

    try (ParquetReader<GenericRecord> reader =
             AvroParquetReader.<GenericRecord>builder(inputFile)
                 .withDataModel(GenericData.get())
                 .withConf(hadoopConf)
                 .build()) {
      GenericRecord record;
      while ((record = reader.read()) != null) {
        DataRecord.Builder builder = DataRecord.builder();
        for (Schema.Field field : record.getSchema().getFields()) {
          Object value = record.get(field.pos());
          if (value == null) {
            continue;
          }
          builder.put(originalName(field), toJavaValue(value));
        }
        rows.add(builder.build());
      }
    }
    return new RecordBatch(sourceKey, columns, rows);
  }

  /**
   * Reads Parquet content from a stream. The content is first copied to a
   * temporary file in {@code scratchDir}, which is deleted afterwards.
   *
   * @param sourceKey Key the content was read from
   * @param input Parquet content
   * @param scratchDir Directory for the temporary copy
   * @return Decoded batch
   * @throws IOException If the content cannot be copied or is not Parquet
   */
  public RecordBatch read(String sourceKey, InputStream input, Path scratchDir)
      throws IOException {
    Files.createDirectories(scratchDir);
    Path tempFile = Files.createTempFile(scratchDir, "read_", ".parquet");
    try {
      Files.copy(input, tempFile, StandardCopyOption.REPLACE_EXISTING);
      return read(sourceKey, tempFile);
    } finally {
      Files.deleteIfExists(tempFile);
    }
  }

  private List<String> readColumns(InputFile inputFile) throws IOException {
    try (ParquetFileReader fileReader = ParquetFileReader.open(inputFile)) {
      String avroSchema = fileReader.getFooter().getFileMetaData()
          .getKeyValueMetaData().get(AVRO_SCHEMA_KEY);
      List<String> columns = new ArrayList<String>();
      if (avroSchema != null) {
        for (Schema.Field field : new Schema.Parser().parse(avroSchema).getFields()) {
          columns.add(originalName(field));
        }
      } else {
        MessageType messageType = fileReader.getFooter().getFileMetaData().getSchema();
        for (Type type : messageType.getFields()) {
          columns.add(type.getName());
        }
      }
      return columns;
    }
  }

  private static GenericRecord toGenericRecord(Schema schema, List<String> columns,
      DataRecord row) {
    GenericRecord record = new GenericData.Record(schema);
    List<Schema.Field> fields = schema.getFields();
    for (int i = 0; i < columns.size(); i++) {
      Schema.Field field = fields.get(i);
      FieldValue value = row.get(columns.get(i));
      record.put(field.pos(), value == null ? null : toAvroValue(value, field.schema()));
    }
    return record;
  }

  private static @Nullable Object toAvroValue(FieldValue value, Schema unionSchema) {
    switch (value.getKind()) {
      case NULL:
        return null;
      case BOOLEAN:
        return value.asBoolean();
      case TEXT:
        return value.asText();
      default:
        Number number = value.asNumber();
        if (value.isIntegral() && hasBranch(unionSchema, Schema.Type.LONG)) {
          return number.longValue();
        }
        return number.doubleValue();
    }
  }

  private static boolean hasBranch(Schema unionSchema, Schema.Type type) {
    for (Schema branch : unionSchema.getTypes()) {
      if (branch.getType() == type) {
        return true;
      }
    }
    return false;
  }

  private static Object toJavaValue(Object avroValue) {
    if (avroValue instanceof CharSequence) {
      return avroValue.toString();
    }
    if (avroValue instanceof Boolean || avroValue instanceof Number) {
      return avroValue;
    }
    return avroValue.toString();
  }

  private static Branch branchOf(FieldValue value) {
    switch (value.getKind()) {
      case BOOLEAN:
        return Branch.BOOLEAN;
      case NUMBER:
        return value.isIntegral() ? Branch.LONG : Branch.DOUBLE;
      default:
        return Branch.STRING;
    }
  }

  private static String originalName(Schema.Field field) {
    String original = field.getProp(ORIGINAL_NAME_PROP);
    return original != null ? original : field.name();
  }

  /**
   * Maps a column name to a valid Avro name: letters, digits and underscores,
   * not starting with a digit.
   */
  static String sanitize(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 1);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean valid = c < 128 && (Character.isLetterOrDigit(c) || c == '_');
      sb.append(valid ? c : '_');
    }
    if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
      sb.insert(0, '_');
    }
    return sb.toString();
  }

  private static String uniqueName(String candidate, Set<String> usedNames) {
    String name = candidate;
    int suffix = 2;
    while (!usedNames.add(name)) {
      name = candidate + "_" + suffix++;
    }
    return name;
  }
}
