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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import io.factcube.query.filter.DimFilter;
import io.factcube.query.filter.DimFilters;
import io.factcube.query.filter.SelectorDimFilter;
import io.factcube.segment.Row;
import io.factcube.segment.Table;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes which dimension table rows each predicate refers to. Purely descriptive, it never takes part in
 * row selection.
 */
public class ConditionFormatter
{
  /**
   * @return column name to the distinct dimension rows matching any predicate on that column, in predicate order
   */
  public Map<String, List<Row>> format(DimFilter filter, List<Table> dimensionTables)
  {
    final Map<String, Set<Row>> matched = Maps.newLinkedHashMap();
    for (SelectorDimFilter selector : DimFilters.selectors(filter)) {
      final String column = selector.getDimension();
      for (Table table : dimensionTables) {
        if (!column.equals(table.getName())) {
          continue;
        }
        final int columnIndex = table.findColumnIndex(column);
        final Set<Row> rows = matched.computeIfAbsent(column, k -> Sets.newLinkedHashSet());
        for (Row row : table.getRows()) {
          if (selector.getValue().equals(row.getText(columnIndex))) {
            rows.add(row);
          }
        }
      }
    }
    final Map<String, List<Row>> formatted = Maps.newLinkedHashMap();
    for (Map.Entry<String, Set<Row>> entry : matched.entrySet()) {
      formatted.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    return formatted;
  }
}
