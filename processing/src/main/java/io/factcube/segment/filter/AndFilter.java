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

import io.factcube.query.filter.Filter;
import io.factcube.query.filter.RowMatcher;
import io.factcube.segment.FactTable;
import io.factcube.segment.Table;
import io.factcube.segment.bitmap.BitSets;
import io.factcube.segment.bitmap.ImmutableBitmap;

import java.util.BitSet;
import java.util.List;

/**
 */
public class AndFilter implements Filter
{
  private final List<Filter> filters;

  public AndFilter(List<Filter> filters)
  {
    this.filters = filters;
  }

  @Override
  public ImmutableBitmap getBitmapIndex(FactTable table)
  {
    final int numRows = table.getNumRows();
    final BitSet bitmap = BitSets.ones(numRows);
    for (Filter filter : filters) {
      filter.getBitmapIndex(table).intersectInto(bitmap);
    }
    return ImmutableBitmap.wrap(bitmap, numRows);
  }

  @Override
  public RowMatcher makeMatcher(Table table)
  {
    if (filters.isEmpty()) {
      return RowMatcher.TRUE;
    }
    if (filters.size() == 1) {
      return filters.get(0).makeMatcher(table);
    }
    final RowMatcher[] matchers = new RowMatcher[filters.size()];
    for (int i = 0; i < matchers.length; i++) {
      matchers[i] = filters.get(i).makeMatcher(table);
    }
    return row -> {
      for (RowMatcher matcher : matchers) {
        if (!matcher.matches(row)) {
          return false;
        }
      }
      return true;
    };
  }

  @Override
  public List<Filter> getChildren()
  {
    return filters;
  }

  @Override
  public String toString()
  {
    return "AND " + filters;
  }
}
