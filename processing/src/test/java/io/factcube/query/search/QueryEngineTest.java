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

package io.factcube.query.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.factcube.common.IAE;
import io.factcube.common.ISE;
import io.factcube.data.Pair;
import io.factcube.query.EmptyAggregateException;
import io.factcube.query.UnknownColumnException;
import io.factcube.query.UnknownDimensionValueException;
import io.factcube.query.aggregation.AggregateFunction;
import io.factcube.query.aggregation.AggregatorFactory;
import io.factcube.query.filter.DimFilter;
import io.factcube.query.filter.DimFilters;
import io.factcube.query.filter.SelectorDimFilter;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.Table;
import io.factcube.segment.TestTables;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class QueryEngineTest
{
  private final FactTable table = TestTables.scenario();
  private final List<Table> dimensions = ImmutableList.of(TestTables.d1(), TestTables.d2());
  private final QueryEngine engine = new QueryEngine(table);

  @SafeVarargs
  private static List<List<Pair<String, String>>> groups(Pair<String, String>[]... groups)
  {
    ImmutableList.Builder<List<Pair<String, String>>> builder = ImmutableList.builder();
    for (Pair<String, String>[] group : groups) {
      builder.add(Arrays.asList(group));
    }
    return builder.build();
  }

  @SafeVarargs
  private static Pair<String, String>[] and(Pair<String, String>... predicates)
  {
    return predicates;
  }

  private static Pair<String, String> eq(String dimension, String value)
  {
    return Pair.of(dimension, value);
  }

  @Test
  public void testSingleGroup()
  {
    DimFilter conditions = DimFilters.dnf(groups(and(eq("D1", "A"), eq("D2", "X"))));
    List<AggregatorFactory> aggregations = ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.AVG));

    QueryResult scanned = engine.searchWithoutIndexes(conditions, aggregations);
    QueryResult indexed = engine.searchWithBitmap(dimensions, conditions, aggregations);

    Assert.assertEquals(1, scanned.getNumRows());
    Assert.assertEquals(ImmutableMap.of("measure", 10.0), scanned.getResults());
    Assert.assertEquals(conditions, scanned.getConditions());
    Assert.assertNull(scanned.getIndexedColumns());

    Assert.assertEquals(scanned.getResults(), indexed.getResults());
    Assert.assertEquals(1, indexed.getNumRows());
    Assert.assertNull(indexed.getConditions());
    Assert.assertEquals(
        ImmutableMap.of(
            "D1", ImmutableList.of(Row.of("A", "Alfa")),
            "D2", ImmutableList.of(Row.of("X", "Xray"))
        ),
        indexed.getIndexedColumns()
    );
  }

  @Test
  public void testOverlappingGroups()
  {
    DimFilter conditions = DimFilters.dnf(groups(and(eq("D1", "A")), and(eq("D2", "X"))));
    List<AggregatorFactory> aggregations = ImmutableList.of(
        new AggregatorFactory("count", "measure", AggregateFunction.COUNT),
        new AggregatorFactory("sum", "measure", AggregateFunction.SUM)
    );
    // row 1 matches both groups but is counted once
    Map<String, Number> expected = ImmutableMap.<String, Number>of("count", 3L, "sum", 60.0);

    QueryResult scanned = engine.searchWithoutIndexes(conditions, aggregations);
    QueryResult indexed = engine.searchWithBitmap(dimensions, conditions, aggregations);
    Assert.assertEquals(expected, scanned.getResults());
    Assert.assertEquals(expected, indexed.getResults());
    Assert.assertEquals(3, scanned.getNumRows());
    Assert.assertEquals(3, indexed.getNumRows());
  }

  @Test
  public void testUnknownValue()
  {
    DimFilter conditions = DimFilters.dnf(groups(and(eq("D1", "Z"))));
    List<AggregatorFactory> aggregations = ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.AVG));

    try {
      engine.searchWithBitmap(dimensions, conditions, aggregations);
      Assert.fail();
    }
    catch (UnknownDimensionValueException e) {
      Assert.assertEquals("Value 'Z' is not referenced in the dimension 'D1'", e.getMessage());
    }
    QueryResult scanned = engine.searchWithoutIndexes(conditions, aggregations);
    Assert.assertEquals(0, scanned.getNumRows());
    Assert.assertEquals(ImmutableMap.of(), scanned.getResults());
  }

  @Test
  public void testNoMatch()
  {
    // both values exist but never together
    DimFilter conditions = DimFilters.dnf(groups(and(eq("D1", "B"), eq("D2", "Y"))));
    List<AggregatorFactory> aggregations = ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.MIN));

    Assert.assertEquals(ImmutableMap.of(), engine.searchWithoutIndexes(conditions, aggregations).getResults());
    QueryResult indexed = engine.searchWithBitmap(dimensions, conditions, aggregations);
    Assert.assertEquals(0, indexed.getNumRows());
    Assert.assertEquals(ImmutableMap.of(), indexed.getResults());

    Assert.assertEquals(ImmutableMap.of(), engine.searchWithoutIndexes(DimFilters.NONE, aggregations).getResults());
    Assert.assertEquals(
        ImmutableMap.of(),
        engine.searchWithBitmap(dimensions, DimFilters.NONE, aggregations).getResults()
    );
  }

  @Test
  public void testMatchAll()
  {
    List<AggregatorFactory> aggregations = ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.MAX));
    DimFilter conditions = DimFilters.dnf(groups(and()));
    Assert.assertEquals(ImmutableMap.of("measure", 30.0), engine.searchWithoutIndexes(conditions, aggregations).getResults());
    Assert.assertEquals(
        ImmutableMap.of("measure", 30.0),
        engine.searchWithBitmap(dimensions, conditions, aggregations).getResults()
    );
  }

  @Test
  public void testDistinct()
  {
    FactTable duplicated = new FactTable(
        "fact",
        Arrays.asList("id", "D1", "D2", "measure"),
        Arrays.asList("D1", "D2")
    );
    duplicated.addRow(Row.of("1", "A", "X", "10"));
    duplicated.addRow(Row.of("1", "A", "X", "10"));
    duplicated.addRow(Row.of("2", "B", "X", "20"));
    duplicated.seal();

    QueryEngine engine = new QueryEngine(duplicated);
    DimFilter conditions = DimFilters.dnf(groups(and(eq("D2", "X")), and(eq("D1", "A"))));
    List<AggregatorFactory> aggregations = ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.SUM));

    Assert.assertEquals(
        ImmutableList.of(Row.of("1", "A", "X", "10"), Row.of("2", "B", "X", "20")),
        engine.selectWithoutIndexes(conditions)
    );
    Assert.assertEquals(engine.selectWithoutIndexes(conditions), engine.selectWithBitmap(conditions));
    Assert.assertEquals(ImmutableMap.of("measure", 30.0), engine.searchWithoutIndexes(conditions, aggregations).getResults());
    Assert.assertEquals(
        ImmutableMap.of("measure", 30.0),
        engine.searchWithBitmap(ImmutableList.<Table>of(), conditions, aggregations).getResults()
    );
  }

  @Test
  public void testNonNumericMeasure()
  {
    FactTable table = new FactTable("fact", Arrays.asList("id", "D1", "measure"), Arrays.asList("D1"));
    table.addRow(Row.of("1", "A", "n/a"));
    table.addRow(Row.of("2", "A", "-"));
    table.addRow(Row.of("3", "B", "5"));
    table.seal();
    QueryEngine engine = new QueryEngine(table);
    DimFilter conditions = SelectorDimFilter.of("D1", "A");

    Assert.assertEquals(
        ImmutableMap.of("measure", 0L),
        engine.searchWithoutIndexes(
            conditions, ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.COUNT))
        ).getResults()
    );
    try {
      engine.searchWithBitmap(
          ImmutableList.<Table>of(), conditions, ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.AVG))
      );
      Assert.fail();
    }
    catch (EmptyAggregateException e) {
      Assert.assertEquals("No numeric value in column 'measure' to compute AVG", e.getMessage());
    }
  }

  @Test
  public void testInvalidColumns()
  {
    List<AggregatorFactory> aggregations = ImmutableList.of(AggregatorFactory.of("measure", AggregateFunction.SUM));
    DimFilter onMeasure = DimFilters.dnf(groups(and(eq("measure", "10"))));
    try {
      engine.searchWithoutIndexes(onMeasure, aggregations);
      Assert.fail();
    }
    catch (UnknownColumnException e) {
      Assert.assertEquals("measure", e.getColumn());
    }
    try {
      engine.searchWithBitmap(dimensions, onMeasure, aggregations);
      Assert.fail();
    }
    catch (UnknownColumnException e) {
      Assert.assertEquals("measure", e.getColumn());
    }

    // checked before any row is selected
    List<AggregatorFactory> unknown = ImmutableList.of(AggregatorFactory.of("price", AggregateFunction.SUM));
    try {
      engine.searchWithoutIndexes(DimFilters.NONE, unknown);
      Assert.fail();
    }
    catch (UnknownColumnException e) {
      Assert.assertEquals("price", e.getColumn());
    }
    try {
      engine.searchWithBitmap(dimensions, DimFilters.NONE, unknown);
      Assert.fail();
    }
    catch (UnknownColumnException e) {
      Assert.assertEquals("price", e.getColumn());
    }
  }

  @Test
  public void testSameColumnTwice()
  {
    List<AggregatorFactory> aggregations = ImmutableList.of(
        AggregatorFactory.of("measure", AggregateFunction.MIN),
        AggregatorFactory.of("measure", AggregateFunction.MAX)
    );
    Map<String, Number> expected = ImmutableMap.<String, Number>of("measure_min", 10.0, "measure_max", 30.0);

    QueryResult scanned = engine.searchWithoutIndexes(DimFilters.ALL, aggregations);
    QueryResult indexed = engine.searchWithBitmap(dimensions, DimFilters.ALL, aggregations);
    Assert.assertEquals(expected, scanned.getResults());
    Assert.assertEquals(expected, indexed.getResults());
  }

  @Test(expected = IAE.class)
  public void testDuplicatedExplicitName()
  {
    engine.searchWithoutIndexes(
        DimFilters.ALL,
        ImmutableList.of(
            new AggregatorFactory("total", "measure", AggregateFunction.SUM),
            new AggregatorFactory("total", "measure", AggregateFunction.COUNT)
        )
    );
  }

  @Test(expected = ISE.class)
  public void testNotSealed()
  {
    new QueryEngine(new FactTable("fact", Arrays.asList("id", "D1"), Arrays.asList("D1")));
  }

  @Test
  public void testReferencedTables()
  {
    Table d3 = TestTables.dimension("D3", new String[]{"I", "India"});
    List<Table> tables = ImmutableList.of(TestTables.d1(), TestTables.d2(), d3);
    DimFilter conditions = DimFilters.dnf(groups(and(eq("D2", "X")), and(eq("D3", "I"))));
    List<Table> referenced = QueryEngine.referencedTables(conditions, tables);
    Assert.assertEquals(2, referenced.size());
    Assert.assertEquals("D2", referenced.get(0).getName());
    Assert.assertEquals("D3", referenced.get(1).getName());
  }
}
