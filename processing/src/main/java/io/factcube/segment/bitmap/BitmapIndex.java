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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.factcube.segment.Row;

import javax.annotation.Nullable;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-value bitmaps over the rows of one indexed column. Built once from fully loaded rows, never updated.
 */
public class BitmapIndex
{
  public static BitmapIndex build(String dimension, List<Row> rows, int columnIndex)
  {
    final int numRows = rows.size();
    final Map<String, BitSet> bitSets = Maps.newHashMap();
    for (int i = 0; i < numRows; i++) {
      final String value = rows.get(i).getText(columnIndex);
      bitSets.computeIfAbsent(value, k -> new BitSet(numRows)).set(i);
    }
    final ImmutableMap.Builder<String, ImmutableBitmap> bitmaps = ImmutableMap.builder();
    for (Map.Entry<String, BitSet> entry : bitSets.entrySet()) {
      bitmaps.put(entry.getKey(), ImmutableBitmap.wrap(entry.getValue(), numRows));
    }
    return new BitmapIndex(dimension, numRows, bitmaps.build());
  }

  private final String dimension;
  private final int numRows;
  private final Map<String, ImmutableBitmap> bitmaps;

  private BitmapIndex(String dimension, int numRows, Map<String, ImmutableBitmap> bitmaps)
  {
    this.dimension = dimension;
    this.numRows = numRows;
    this.bitmaps = bitmaps;
  }

  public String getDimension()
  {
    return dimension;
  }

  public int getNumRows()
  {
    return numRows;
  }

  public int getCardinality()
  {
    return bitmaps.size();
  }

  public Set<String> getValues()
  {
    return bitmaps.keySet();
  }

  public boolean contains(String value)
  {
    return bitmaps.containsKey(value);
  }

  /**
   * @return bitmap of rows holding the value, or null when no row holds it
   */
  @Nullable
  public ImmutableBitmap getBitmap(String value)
  {
    return bitmaps.get(value);
  }

  /**
   * Checks that the bitmaps of this column are pairwise disjoint and cover every row.
   */
  public boolean isPartition()
  {
    final BitSet union = BitSets.zeros(numRows);
    int cardinality = 0;
    for (ImmutableBitmap bitmap : bitmaps.values()) {
      if (bitmap.size() != numRows) {
        return false;
      }
      bitmap.unionInto(union);
      cardinality += bitmap.cardinality();
    }
    return cardinality == numRows && union.cardinality() == numRows;
  }

  public long estimatedBytes()
  {
    return (long) bitmaps.size() * BitSets.numWords(numRows) * Long.BYTES;
  }

  @Override
  public String toString()
  {
    return "BitmapIndex{" +
           "dimension='" + dimension + '\'' +
           ", numRows=" + numRows +
           ", cardinality=" + bitmaps.size() +
           '}';
  }
}
