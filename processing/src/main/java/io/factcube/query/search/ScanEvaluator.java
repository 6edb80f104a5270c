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

import com.google.common.collect.Lists;
import io.factcube.query.filter.Filter;
import io.factcube.query.filter.RowMatcher;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.filter.Filters;

import java.util.List;

/**
 * Selects rows without index: every row is tested once per OR branch. Rows matching several branches are
 * returned once per branch.
 */
public class ScanEvaluator
{
  public List<Row> select(FactTable table, Filter filter)
  {
    final List<Row> rows = table.getRows();
    final List<Row> selected = Lists.newArrayList();
    for (Filter branch : Filters.branches(filter)) {
      final RowMatcher matcher = branch.makeMatcher(table);
      for (Row row : rows) {
        if (matcher.matches(row)) {
          selected.add(row);
        }
      }
    }
    return selected;
  }
}
