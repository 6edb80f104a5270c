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

package io.factcube.data;

import org.junit.Assert;
import org.junit.Test;

public class RowsTest
{
  @Test
  public void testNumbers()
  {
    Assert.assertEquals(10d, Rows.tryParseDouble("10"), 0d);
    Assert.assertEquals(-10d, Rows.tryParseDouble("-10"), 0d);
    Assert.assertEquals(10d, Rows.tryParseDouble("+10"), 0d);
    Assert.assertEquals(0.5d, Rows.tryParseDouble(".5"), 0d);
    Assert.assertEquals(5d, Rows.tryParseDouble("5."), 0d);
    Assert.assertEquals(1.5e3d, Rows.tryParseDouble("1.5e3"), 0d);
    Assert.assertEquals(-2.5e-3d, Rows.tryParseDouble("-2.5E-3"), 0d);
    Assert.assertEquals(42d, Rows.tryParseDouble("  42 "), 0d);
  }

  @Test
  public void testSpecials()
  {
    Assert.assertTrue(Double.isNaN(Rows.tryParseDouble("nan")));
    Assert.assertTrue(Double.isNaN(Rows.tryParseDouble("NaN")));
    Assert.assertEquals(Double.POSITIVE_INFINITY, Rows.tryParseDouble("inf"), 0d);
    Assert.assertEquals(Double.POSITIVE_INFINITY, Rows.tryParseDouble("Infinity"), 0d);
    Assert.assertEquals(Double.NEGATIVE_INFINITY, Rows.tryParseDouble("-INF"), 0d);
  }

  @Test
  public void testNotNumbers()
  {
    Assert.assertNull(Rows.tryParseDouble(null));
    Assert.assertNull(Rows.tryParseDouble(""));
    Assert.assertNull(Rows.tryParseDouble("   "));
    Assert.assertNull(Rows.tryParseDouble("A"));
    Assert.assertNull(Rows.tryParseDouble("-"));
    Assert.assertNull(Rows.tryParseDouble("1.2.3"));
    Assert.assertNull(Rows.tryParseDouble("1e"));
    Assert.assertNull(Rows.tryParseDouble("10d"));
    Assert.assertNull(Rows.tryParseDouble("2f"));
    Assert.assertNull(Rows.tryParseDouble("0x10"));
    Assert.assertNull(Rows.tryParseDouble("Alfa1"));
  }

  @Test
  public void testCell()
  {
    Cell numeric = Cell.of("30");
    Assert.assertTrue(numeric.isNumeric());
    Assert.assertEquals(30d, numeric.doubleValue(), 0d);
    Assert.assertEquals("30", numeric.text());

    Cell text = Cell.of("X");
    Assert.assertFalse(text.isNumeric());
    Assert.assertEquals(Cell.of("X"), text);
    Assert.assertNotEquals(Cell.of("30.0"), numeric);
    try {
      text.doubleValue();
      Assert.fail("expected failure on text cell");
    }
    catch (IllegalStateException e) {
      Assert.assertTrue(e.getMessage().contains("X"));
    }
  }
}
