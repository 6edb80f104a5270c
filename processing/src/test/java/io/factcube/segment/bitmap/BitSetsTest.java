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

import org.junit.Assert;
import org.junit.Test;

import java.util.BitSet;

public class BitSetsTest
{
  @Test
  public void testIterator()
  {
    BitSet bitSet = new BitSet();
    int[] expected = {0, 1, 63, 64, 65, 127, 128, 1000, 4095};
    for (int x : expected) {
      bitSet.set(x);
    }
    Assert.assertArrayEquals(expected, IntIterators.toArray(BitSets.iterator(bitSet)));

    Assert.assertArrayEquals(new int[0], IntIterators.toArray(BitSets.iterator(new BitSet())));
    Assert.assertArrayEquals(new int[0], IntIterators.toArray(BitSets.iterator(null)));
  }

  @Test
  public void testIdentities()
  {
    Assert.assertEquals(0, BitSets.ones(0).cardinality());
    Assert.assertEquals(130, BitSets.ones(130).cardinality());
    Assert.assertEquals(130, BitSets.ones(130).length());
    Assert.assertTrue(BitSets.zeros(130).isEmpty());
  }

  @Test
  public void testWords()
  {
    Assert.assertEquals(0, BitSets.numWords(0));
    Assert.assertEquals(1, BitSets.numWords(1));
    Assert.assertEquals(1, BitSets.numWords(64));
    Assert.assertEquals(2, BitSets.numWords(65));
    Assert.assertEquals(1, BitSets.wordIndex(64));
    Assert.assertEquals(3, BitSets.indexInWord(67));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOutOfRange()
  {
    BitSet bitSet = new BitSet();
    bitSet.set(10);
    ImmutableBitmap.wrap(bitSet, 10);
  }
}
