/*
 * Licensed to SK Telecom Co., LTD. (SK Telecom) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  SK Telecom licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.factcube.segment.loading;

import com.google.common.collect.Lists;
import io.factcube.common.logger.Logger;
import io.factcube.data.ParseException;
import io.factcube.data.input.impl.CSVParser;
import io.factcube.segment.Catalog;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.Table;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * Loads table contents. The data file holds one block of comma separated rows per table, in schema order,
 * blocks separated by a blank line. Every table is sealed once all blocks are read, which builds the bitmap
 * indexes of the fact table.
 */
public class DataLoader
{
  private static final Logger log = new Logger(DataLoader.class);

  private final SchemaParser schemaParser = new SchemaParser();
  private final CSVParser parser = new CSVParser();

  public Catalog load(File schemaFile, File dataFile) throws IOException
  {
    final List<TableSchema> schemas = schemaParser.parse(schemaFile);
    try (Reader reader = Files.newBufferedReader(dataFile.toPath(), StandardCharsets.UTF_8)) {
      return load(schemas, reader, dataFile.getName());
    }
  }

  public Catalog load(List<TableSchema> schemas, Reader reader, String source) throws IOException
  {
    final List<Table> tables = createTables(schemas);
    final long start = System.currentTimeMillis();

    final BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    int tableIndex = 0;
    int lineNumber = 0;
    boolean inBlock = false;
    for (String line = lines.readLine(); line != null; line = lines.readLine()) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        // switch to the next table
        if (tableIndex < tables.size()) {
          tableIndex++;
        }
        inBlock = false;
        continue;
      }
      if (tableIndex >= tables.size()) {
        throw new ParseException("Unexpected data for no table at %s:%d", source, lineNumber);
      }
      final Table table = tables.get(tableIndex);
      try {
        table.addRow(Row.of(parser.parseLine(line)));
      }
      catch (IllegalArgumentException e) {
        throw new ParseException(e, "Invalid row for table [%s] at %s:%d", table.getName(), source, lineNumber);
      }
      inBlock = true;
    }
    final int filled = inBlock ? tableIndex + 1 : tableIndex;
    if (filled < tables.size()) {
      log.warn("%s has no data for tables %s", source, tables.subList(filled, tables.size()));
    }
    for (Table table : tables) {
      table.seal();
    }
    log.info(
        "Loaded %d tables from %s, %,d lines in %,d msec",
        tables.size(), source, lineNumber, System.currentTimeMillis() - start
    );
    return new Catalog((FactTable) tables.get(0), tables.subList(1, tables.size()));
  }

  private static List<Table> createTables(List<TableSchema> schemas)
  {
    final TableSchema fact = schemas.get(0);
    final List<String> dimensions = Lists.newArrayList();
    for (TableSchema schema : schemas.subList(1, schemas.size())) {
      dimensions.add(schema.getName());
    }
    final List<Table> tables = Lists.newArrayList();
    tables.add(new FactTable(fact.getName(), fact.getColumns(), dimensions));
    for (TableSchema schema : schemas.subList(1, schemas.size())) {
      tables.add(new Table(schema.getName(), schema.getColumns()));
    }
    return tables;
  }
}
