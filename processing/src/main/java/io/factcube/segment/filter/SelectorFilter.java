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

package io.factcube.segment.filter;

import com.google.common.collect.ImmutableList;
import io.factcube.query.UnknownDimensionValueException;
import io.factcube.query.filter.Filter;
import io.factcube.query.filter.RowMatcher;
import io.factcube.segment.FactTable;
import io.factcube.segment.Table;
import io.factcube.segment.bitmap.BitmapIndex;
import io.factcube.segment.bitmap.ImmutableBitmap;

import java.util.List;

/**
 */
public class SelectorFilter implements Filter
{
  private final String dimension;
  private final String value;
  private final int columnIndex;

  public SelectorFilter(String dimension, String value, int columnIndex)
  {
    this.dimension = dimension;
    this.value = value;
    this.columnIndex = columnIndex;
  }

  @Override
  public ImmutableBitmap getBitmapIndex(FactTable table)
  {
    final BitmapIndex bitmapIndex = table.getBitmapIndex(dimension);
    final ImmutableBitmap bitmap = bitmapIndex.getBitmap(value);
    if (bitmap == null) {
      throw new UnknownDimensionValueException(dimension, value);
    }
    return bitmap;
  }

  @Override
  public RowMatcher makeMatcher(Table table)
  {
    return row -> value.equals(row.getText(columnIndex));
  }

  @Override
  public List<Filter> getChildren()
  {
    return ImmutableList.of();
  }

  @Override
  public String toString()
  {
    return "SelectorFilter{" +
           "dimension='" + dimension + '\'' +
           ", value='" + value + '\'' +
           '}';
  }
}
