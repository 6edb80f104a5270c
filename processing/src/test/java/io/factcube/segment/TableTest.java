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

package io.factcube.segment;

import io.factcube.common.IAE;
import io.factcube.common.ISE;
import io.factcube.query.UnknownColumnException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class TableTest
{
  @Test
  public void testColumns()
  {
    Table table = new Table("t", Arrays.asList("a", "b", "c"));
    Assert.assertEquals(0, table.findColumnIndex("a"));
    Assert.assertEquals(2, table.findColumnIndex("c"));
    Assert.assertTrue(table.hasColumn("b"));
    Assert.assertFalse(table.hasColumn("d"));
    try {
      table.findColumnIndex("d");
      Assert.fail();
    }
    catch (UnknownColumnException e) {
      Assert.assertEquals("d", e.getColumn());
      Assert.assertEquals("t", e.getTable());
      Assert.assertEquals("Column 'd' does not exist in the table 't'", e.getMessage());
    }
  }

  @Test(expected = IAE.class)
  public void testDuplicatedColumn()
  {
    new Table("t", Arrays.asList("a", "b", "a"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoColumn()
  {
    new Table("t", Arrays.<String>asList());
  }

  @Test
  public void testRowLength()
  {
    Table table = new Table("t", Arrays.asList("a", "b"));
    table.addRow(Row.of("1", "2"));
    try {
      table.addRow(Row.of("1", "2", "3"));
      Assert.fail();
    }
    catch (IAE e) {
      Assert.assertTrue(e.getMessage().contains("has 3 values"));
    }
    Assert.assertEquals(1, table.getNumRows());
  }

  @Test
  public void testSealed()
  {
    Table table = new Table("t", Arrays.asList("a"));
    try {
      table.ensureSealed();
      Assert.fail();
    }
    catch (ISE e) {
      // expected
    }
    table.addRow(Row.of("1"));
    table.seal();
    table.ensureSealed();
    try {
      table.addRow(Row.of("2"));
      Assert.fail();
    }
    catch (ISE e) {
      Assert.assertEquals("table [t] is sealed", e.getMessage());
    }
    try {
      table.getRows().add(Row.of("3"));
      Assert.fail();
    }
    catch (UnsupportedOperationException e) {
      // expected
    }
    Assert.assertEquals(1, table.getNumRows());
  }

  @Test
  public void testRowEquality()
  {
    Assert.assertEquals(Row.of("1", "A"), Row.of("1", "A"));
    Assert.assertEquals(Row.of("1", "A").hashCode(), Row.of("1", "A").hashCode());
    Assert.assertNotEquals(Row.of("1", "A"), Row.of("1", "B"));
    Assert.assertNotEquals(Row.of("1"), Row.of("1.0"));
    Assert.assertEquals(Arrays.asList("1", "A"), Row.of("1", "A").toList());
  }

  @Test
  public void testFactTable()
  {
    FactTable table = TestTables.scenario();
    Assert.assertEquals(Arrays.asList("D1", "D2"), table.getDimensions());
    Assert.assertTrue(table.isDimension("D1"));
    Assert.assertFalse(table.isDimension("measure"));
    Assert.assertEquals(2, table.getBitmapIndexes().size());
    Assert.assertEquals(2, table.getBitmapIndex("D1").getCardinality());

    try {
      table.getBitmapIndex("measure");
      Assert.fail();
    }
    catch (UnknownColumnException e) {
      Assert.assertEquals("Column 'measure' is not an indexed dimension in the table 'fact'", e.getMessage());
    }
  }

  @Test(expected = UnknownColumnException.class)
  public void testUnknownDimension()
  {
    new FactTable("fact", Arrays.asList("id", "D1"), Arrays.asList("D2"));
  }

  @Test(expected = ISE.class)
  public void testIndexBeforeSeal()
  {
    FactTable table = new FactTable("fact", Arrays.asList("id", "D1"), Arrays.asList("D1"));
    table.addRow(Row.of("1", "A"));
    table.getBitmapIndex("D1");
  }
}
