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

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import io.factcube.data.ParseException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * Reads table definitions, one {@code Name(column1,column2,..)} per line. The first table is the fact table and
 * each following table describes the dimension column of the same name.
 */
public class SchemaParser
{
  private static final Splitter COLUMN_SPLITTER = Splitter.on(',').trimResults();

  public List<TableSchema> parse(File file) throws IOException
  {
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return parse(reader, file.getName());
    }
  }

  public List<TableSchema> parse(Reader reader, String source) throws IOException
  {
    final BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    final List<TableSchema> schemas = Lists.newArrayList();
    int lineNumber = 0;
    for (String line = lines.readLine(); line != null; line = lines.readLine()) {
      lineNumber++;
      if (!line.trim().isEmpty()) {
        schemas.add(parseLine(line.trim(), source, lineNumber));
      }
    }
    if (schemas.isEmpty()) {
      throw new ParseException("No table defined in %s", source);
    }
    return schemas;
  }

  public TableSchema parseLine(String line, String source, int lineNumber)
  {
    final int open = line.indexOf('(');
    if (open <= 0 || !line.endsWith(")")) {
      throw new ParseException("Invalid table definition [%s] at %s:%d", line, source, lineNumber);
    }
    final String name = line.substring(0, open).trim();
    final List<String> columns = COLUMN_SPLITTER.splitToList(line.substring(open + 1, line.length() - 1));
    for (String column : columns) {
      if (Strings.isNullOrEmpty(column)) {
        throw new ParseException("Empty column name in [%s] at %s:%d", line, source, lineNumber);
      }
    }
    return new TableSchema(name, columns);
  }
}
