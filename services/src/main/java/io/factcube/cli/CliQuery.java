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

package io.factcube.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import io.airlift.airline.Command;
import io.airlift.airline.Option;
import io.airlift.airline.ParseException;
import io.factcube.common.logger.Logger;
import io.factcube.data.Pair;
import io.factcube.jackson.DefaultObjectMapper;
import io.factcube.query.QueryException;
import io.factcube.query.aggregation.AggregateFunction;
import io.factcube.query.aggregation.AggregatorFactory;
import io.factcube.query.filter.Conditions;
import io.factcube.query.filter.DimFilter;
import io.factcube.query.search.QueryEngine;
import io.factcube.query.search.QueryResult;
import io.factcube.query.search.SearchQuery;
import io.factcube.segment.Catalog;
import io.factcube.segment.loading.DataLoader;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 */
@Command(name = "query", description = "Loads tables and runs queries with and without bitmap indexes.")
public class CliQuery extends ConfiguredCommand
{
  private static final Logger log = new Logger(CliQuery.class);

  public enum Mode
  {
    SCAN, BITMAP, BOTH;

    boolean scan()
    {
      return this != BITMAP;
    }

    boolean bitmap()
    {
      return this != SCAN;
    }

    /**
     * @throws ParseException for an unknown mode, reported with the usage like any other bad argument
     */
    static Mode fromString(String name)
    {
      final String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ENGLISH);
      for (Mode mode : values()) {
        if (mode.name().equals(normalized)) {
          return mode;
        }
      }
      throw new ParseException("Unknown mode [%s], expected one of scan, bitmap or both", name);
    }
  }

  // AND only, then AND/OR
  static final List<SearchQuery> DEMO_QUERIES = ImmutableList.of(
      new SearchQuery(
          Conditions.of(Arrays.asList(Arrays.asList(Pair.of("D1", "A"), Pair.of("D2", "X")))),
          null,
          ImmutableList.of(AggregatorFactory.of("Fact1", AggregateFunction.AVG))
      ),
      new SearchQuery(
          Conditions.of(
              Arrays.asList(
                  Arrays.asList(Pair.of("D1", "A"), Pair.of("D2", "X")),
                  Arrays.asList(Pair.of("D1", "B"), Pair.of("D2", "Y")),
                  Arrays.asList(Pair.of("D2", "Y"))
              )
          ),
          null,
          ImmutableList.of(
              AggregatorFactory.of("Fact1", AggregateFunction.COUNT),
              AggregatorFactory.of("Fact2", AggregateFunction.SUM)
          )
      )
  );

  @Option(name = "--schema", title = "file", description = "Schema file. factcube.schemaFile if not set")
  public String schemaFile;

  @Option(name = "--data", title = "file", description = "Data file. factcube.dataFile if not set")
  public String dataFile;

  @Option(name = {"-q", "--query"}, title = "file", description = "Json query file. Runs demo queries if not set")
  public String queryFile;

  @Option(name = {"-m", "--mode"}, title = "mode", description = "scan, bitmap or both (default)")
  public String mode = "both";

  private final ObjectMapper mapper = new DefaultObjectMapper();

  @Override
  public void run()
  {
    final Mode runMode = Mode.fromString(mode);
    final FactcubeConfig config = loadConfig();
    final File schema = new File(schemaFile != null ? schemaFile : config.getSchemaFile());
    final File data = new File(dataFile != null ? dataFile : config.getDataFile());
    try {
      final Catalog catalog = new DataLoader().load(schema, data);
      final List<SearchQuery> queries = queryFile == null
                                        ? DEMO_QUERIES
                                        : ImmutableList.of(mapper.readValue(new File(queryFile), SearchQuery.class));
      for (SearchQuery query : queries) {
        run(catalog, query, runMode, System.out);
      }
    }
    catch (IOException e) {
      throw Throwables.propagate(e);
    }
  }

  /**
   * Runs one query on the requested paths and prints results with elapsed times.
   *
   * @return false if both paths ran and disagree
   */
  boolean run(Catalog catalog, SearchQuery query, Mode mode, PrintStream out) throws IOException
  {
    final ObjectWriter writer = mapper.writerWithDefaultPrettyPrinter();
    final QueryEngine engine = new QueryEngine(catalog.getFactTable());
    final DimFilter conditions = query.toDimFilter();
    out.println("Query: " + conditions);

    QueryResult scanned = null;
    long scanTime = -1;
    if (mode.scan()) {
      final long start = System.nanoTime();
      try {
        scanned = engine.searchWithoutIndexes(conditions, query.getAggregations());
        out.println(writer.writeValueAsString(scanned));
      }
      catch (RuntimeException e) {
        final QueryException error = QueryException.wrapIfNeeded(e);
        log.warn("Failed to scan %s: [%s] %s", conditions, error.getErrorCode(), error.getMessage());
        out.println(writer.writeValueAsString(error));
      }
      scanTime = System.nanoTime() - start;
      out.println(String.format("Without indexes: %,d usec", scanTime / 1000));
    }

    QueryResult indexed = null;
    long bitmapTime = -1;
    if (mode.bitmap()) {
      final long start = System.nanoTime();
      try {
        indexed = engine.searchWithBitmap(
            QueryEngine.referencedTables(conditions, catalog.getDimensionTables()),
            conditions,
            query.getAggregations()
        );
        out.println(writer.writeValueAsString(indexed));
      }
      catch (RuntimeException e) {
        final QueryException error = QueryException.wrapIfNeeded(e);
        log.warn("Failed to evaluate %s with bitmaps: [%s] %s", conditions, error.getErrorCode(), error.getMessage());
        out.println(writer.writeValueAsString(error));
      }
      bitmapTime = System.nanoTime() - start;
      out.println(String.format("With bitmap indexes: %,d usec", bitmapTime / 1000));
    }

    if (scanTime < 0 || bitmapTime < 0) {
      return true;
    }
    out.println(String.format("Difference: %,d usec", (scanTime - bitmapTime) / 1000));
    if (scanned == null || indexed == null || !sameResults(scanned, indexed)) {
      log.warn("Results differ between paths for %s: %s vs %s", conditions, scanned, indexed);
      return false;
    }
    return true;
  }

  static boolean sameResults(QueryResult scanned, QueryResult indexed)
  {
    if (scanned.getNumRows() != indexed.getNumRows()) {
      return false;
    }
    final Map<String, Number> expected = scanned.getResults();
    final Map<String, Number> actual = indexed.getResults();
    if (!expected.keySet().equals(actual.keySet())) {
      return false;
    }
    for (Map.Entry<String, Number> entry : expected.entrySet()) {
      final double value = entry.getValue().doubleValue();
      final double other = actual.get(entry.getKey()).doubleValue();
      if (Math.abs(value - other) > 1e-9 * Math.max(1, Math.abs(value))) {
        return false;
      }
    }
    return true;
  }
}
