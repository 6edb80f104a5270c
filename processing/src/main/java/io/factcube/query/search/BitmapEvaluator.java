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

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import io.factcube.query.filter.Filter;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.bitmap.ImmutableBitmap;
import io.factcube.segment.bitmap.IntIterators;

import java.util.List;

/**
 * Selects rows by combining dimension bitmaps: AND inside a group, OR across groups.
 */
public class BitmapEvaluator
{
  public ImmutableBitmap evaluate(FactTable table, Filter filter)
  {
    return filter.getBitmapIndex(table);
  }

  public List<Row> select(FactTable table, Filter filter)
  {
    final ImmutableBitmap bitmap = evaluate(table, filter);
    final List<Row> selected = Lists.newArrayListWithCapacity(bitmap.cardinality());
    Iterators.addAll(selected, IntIterators.transform(bitmap.iterator(), table::getRow));
    return selected;
  }
}
