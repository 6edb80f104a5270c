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

package io.factcube.segment.bitmap;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.TestTables;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

public class BitmapIndexTest
{
  @Test
  public void testBuild()
  {
    FactTable table = TestTables.scenario();
    BitmapIndex d1 = table.getBitmapIndex("D1");
    Assert.assertEquals("D1", d1.getDimension());
    Assert.assertEquals(3, d1.getNumRows());
    Assert.assertEquals(ImmutableSet.of("A", "B"), d1.getValues());
    Assert.assertArrayEquals(new int[]{0, 1}, IntIterators.toArray(d1.getBitmap("A").iterator()));
    Assert.assertArrayEquals(new int[]{2}, IntIterators.toArray(d1.getBitmap("B").iterator()));
    Assert.assertNull(d1.getBitmap("C"));
    Assert.assertFalse(d1.contains("C"));

    BitmapIndex d2 = table.getBitmapIndex("D2");
    Assert.assertArrayEquals(new int[]{0, 2}, IntIterators.toArray(d2.getBitmap("X").iterator()));
    Assert.assertArrayEquals(new int[]{1}, IntIterators.toArray(d2.getBitmap("Y").iterator()));
    Assert.assertEquals(3, d2.getBitmap("Y").size());
  }

  @Test
  public void testPartition()
  {
    Random random = new Random(1234);
    List<Row> rows = Lists.newArrayList();
    for (int i = 0; i < 1000; i++) {
      rows.add(Row.of(String.valueOf(i), "v" + random.nextInt(7)));
    }
    BitmapIndex index = BitmapIndex.build("dim", rows, 1);
    Assert.assertTrue(index.isPartition());

    BitSet union = new BitSet();
    int cardinality = 0;
    for (String value : index.getValues()) {
      ImmutableBitmap bitmap = index.getBitmap(value);
      Assert.assertEquals(1000, bitmap.size());
      for (String other : index.getValues()) {
        if (!other.equals(value)) {
          Assert.assertFalse(bitmap.intersects(index.getBitmap(other)));
        }
      }
      bitmap.unionInto(union);
      cardinality += bitmap.cardinality();
    }
    Assert.assertEquals(1000, cardinality);
    Assert.assertEquals(BitSets.ones(1000), union);
  }

  @Test
  public void testEmpty()
  {
    BitmapIndex index = BitmapIndex.build("dim", Arrays.<Row>asList(), 0);
    Assert.assertEquals(0, index.getCardinality());
    Assert.assertTrue(index.isPartition());
    Assert.assertEquals(0, index.estimatedBytes());
  }

  @Test
  public void testReadOnly()
  {
    BitmapIndex index = TestTables.scenario().getBitmapIndex("D1");
    BitSet copy = index.getBitmap("A").toBitSet();
    copy.clear();
    Assert.assertEquals(2, index.getBitmap("A").cardinality());

    BitSet target = BitSets.ones(3);
    index.getBitmap("A").intersectInto(target);
    Assert.assertEquals(2, target.cardinality());
    Assert.assertEquals(2, index.getBitmap("A").cardinality());
  }
}
