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

import com.google.common.collect.ImmutableList;
import io.factcube.data.ParseException;
import io.factcube.segment.Catalog;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.Table;
import io.factcube.segment.bitmap.BitmapIndex;
import io.factcube.segment.generator.DataGenerator;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

public class DataLoaderTest
{
  @Rule
  public final TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final SchemaParser schemaParser = new SchemaParser();
  private final DataLoader loader = new DataLoader();

  private List<TableSchema> schemas() throws Exception
  {
    return schemaParser.parse(new StringReader("Fact(Id,D1,Fact1)\n\nD1(D1,Alfa)\n"), "schema");
  }

  @Test
  public void testParseSchema() throws Exception
  {
    List<TableSchema> schemas = schemaParser.parse(
        new StringReader("Fact(Id, D1,D2 ,Fact1)\nD1(D1,Alfa,Beta)\n\n  D2(D2,Delta)  \n"), "schema"
    );
    Assert.assertEquals(
        Arrays.asList(
            new TableSchema("Fact", Arrays.asList("Id", "D1", "D2", "Fact1")),
            new TableSchema("D1", Arrays.asList("D1", "Alfa", "Beta")),
            new TableSchema("D2", Arrays.asList("D2", "Delta"))
        ),
        schemas
    );
  }

  @Test
  public void testInvalidSchema() throws Exception
  {
    for (String line : Arrays.asList("Fact", "(a,b)", "Fact(a,,b)", "Fact(a,b")) {
      try {
        schemaParser.parse(new StringReader(line), "schema");
        Assert.fail(line);
      }
      catch (ParseException e) {
        Assert.assertTrue(e.getMessage(), e.getMessage().contains("schema:1"));
      }
    }
  }

  @Test(expected = ParseException.class)
  public void testEmptySchema() throws Exception
  {
    schemaParser.parse(new StringReader("\n\n"), "schema");
  }

  @Test
  public void testLoad() throws Exception
  {
    Catalog catalog = loader.load(
        schemas(),
        new StringReader("1,A,10\n2,B,\"1,5\"\n3,A,n/a\n\nA,Alfa1\nB,Alfa2\n"),
        "data"
    );
    FactTable fact = catalog.getFactTable();
    Assert.assertEquals("Fact", fact.getName());
    Assert.assertEquals(ImmutableList.of("D1"), fact.getDimensions());
    Assert.assertEquals(3, fact.getNumRows());
    Assert.assertEquals(Row.of("2", "B", "1,5"), fact.getRow(1));
    Assert.assertFalse(fact.getRow(2).get(2).isNumeric());
    Assert.assertTrue(fact.isSealed());

    BitmapIndex index = fact.getBitmapIndex("D1");
    Assert.assertEquals(2, index.getCardinality());
    Assert.assertTrue(index.isPartition());

    Table d1 = catalog.getDimensionTable("D1");
    Assert.assertTrue(d1.isSealed());
    Assert.assertEquals(ImmutableList.of(Row.of("A", "Alfa1"), Row.of("B", "Alfa2")), d1.getRows());
  }

  @Test
  public void testMissingBlock() throws Exception
  {
    Catalog catalog = loader.load(schemas(), new StringReader("1,A,10\n"), "data");
    Assert.assertEquals(1, catalog.getFactTable().getNumRows());
    Assert.assertEquals(0, catalog.getDimensionTable("D1").getNumRows());
    Assert.assertTrue(catalog.getDimensionTable("D1").isSealed());
  }

  @Test
  public void testInvalidRow() throws Exception
  {
    try {
      loader.load(schemas(), new StringReader("1,A,10\n2,B\n"), "data");
      Assert.fail();
    }
    catch (ParseException e) {
      Assert.assertEquals("Invalid row for table [Fact] at data:2", e.getMessage());
    }
  }

  @Test(expected = ParseException.class)
  public void testExtraBlock() throws Exception
  {
    loader.load(schemas(), new StringReader("1,A,10\n\nA,Alfa1\n\nB,Alfa2\n"), "data");
  }

  @Test
  public void testGenerated() throws Exception
  {
    File schemaFile = temporaryFolder.newFile("schema.txt");
    File dataFile = temporaryFolder.newFile("data.txt");
    DataGenerator generator = new DataGenerator(42L);
    generator.writeSchema(schemaFile);
    generator.writeData(dataFile, 500);

    Catalog catalog = loader.load(schemaFile, dataFile);
    FactTable fact = catalog.getFactTable();
    Assert.assertEquals(DataGenerator.FACT_TABLE, fact.getName());
    Assert.assertEquals(DataGenerator.FACT_COLUMNS, fact.getColumns());
    Assert.assertEquals(ImmutableList.of("D1", "D2", "D3"), fact.getDimensions());
    Assert.assertEquals(500, fact.getNumRows());
    Assert.assertEquals(3, catalog.getDimensionTables().size());
    Assert.assertEquals(2, catalog.getDimensionTable("D1").getNumRows());
    Assert.assertEquals(3, catalog.getDimensionTable("D2").getNumRows());
    Assert.assertEquals(4, catalog.getDimensionTable("D3").getNumRows());

    for (String dimension : fact.getDimensions()) {
      BitmapIndex index = fact.getBitmapIndex(dimension);
      Assert.assertTrue(index.isPartition());
      for (String value : index.getValues()) {
        Assert.assertTrue(catalog.getDimensionTable(dimension).getRows().stream().anyMatch(
            row -> row.getText(0).equals(value)
        ));
      }
    }
    for (Row row : fact.getRows()) {
      double fact1 = row.get(4).doubleValue();
      double fact2 = row.get(5).doubleValue();
      Assert.assertTrue(fact1 >= 10 && fact1 <= 100);
      Assert.assertTrue(fact2 >= 100 && fact2 <= 1000);
    }
  }
}
