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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import io.factcube.common.logger.Logger;
import io.factcube.query.filter.DimFilter;
import io.factcube.query.filter.DimFilters;
import io.factcube.query.filter.Filter;
import io.factcube.query.aggregation.AggregatorFactory;
import io.factcube.query.aggregation.Aggregators;
import io.factcube.segment.FactTable;
import io.factcube.segment.Row;
import io.factcube.segment.Table;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs searches on a sealed fact table, with or without its bitmap indexes. Both paths select the same rows;
 * selected rows are de-duplicated by full row equality and then aggregated.
 */
public class QueryEngine
{
  private static final Logger log = new Logger(QueryEngine.class);

  private final FactTable table;
  private final ScanEvaluator scanEvaluator = new ScanEvaluator();
  private final BitmapEvaluator bitmapEvaluator = new BitmapEvaluator();
  private final ConditionFormatter formatter = new ConditionFormatter();

  public QueryEngine(FactTable table)
  {
    table.ensureSealed();
    this.table = table;
  }

  public FactTable getTable()
  {
    return table;
  }

  public List<Row> selectWithoutIndexes(DimFilter conditions)
  {
    return distinct(scanEvaluator.select(table, conditions.toFilter(table)));
  }

  public List<Row> selectWithBitmap(DimFilter conditions)
  {
    return distinct(bitmapEvaluator.select(table, conditions.toFilter(table)));
  }

  public QueryResult searchWithoutIndexes(DimFilter conditions, List<AggregatorFactory> aggregations)
  {
    Aggregators.validate(table, aggregations);
    final Filter filter = conditions.toFilter(table);
    final List<Row> rows = distinct(scanEvaluator.select(table, filter));
    log.debug("Scanned %s, %d distinct rows", conditions, rows.size());

    return QueryResult.scanned(conditions, rows.size(), aggregate(rows, aggregations));
  }

  /**
   * @param dimensionTables dimension tables referenced by the conditions, used only to describe the matched
   *                        dimension values
   */
  public QueryResult searchWithBitmap(
      List<Table> dimensionTables,
      DimFilter conditions,
      List<AggregatorFactory> aggregations
  )
  {
    Aggregators.validate(table, aggregations);
    final Filter filter = conditions.toFilter(table);
    final List<Row> rows = distinct(bitmapEvaluator.select(table, filter));
    log.debug("Indexed %s, %d distinct rows", conditions, rows.size());

    final Map<String, List<Row>> indexedColumns = formatter.format(conditions, dimensionTables);
    return QueryResult.indexed(indexedColumns, rows.size(), aggregate(rows, aggregations));
  }

  private Map<String, Number> aggregate(List<Row> rows, List<AggregatorFactory> aggregations)
  {
    if (rows.isEmpty()) {
      return ImmutableMap.of();
    }
    return Aggregators.aggregate(table, rows, aggregations);
  }

  /**
   * @return dimension tables named after a column the conditions refer to, in the order of {@code tables}
   */
  public static List<Table> referencedTables(DimFilter conditions, Collection<? extends Table> tables)
  {
    final Set<String> dependents = DimFilters.dependents(conditions);
    final List<Table> referenced = Lists.newArrayList();
    for (Table table : tables) {
      if (dependents.contains(table.getName())) {
        referenced.add(table);
      }
    }
    return referenced;
  }

  /**
   * Removes rows equal to a row seen before, keeping first-seen order.
   */
  public static List<Row> distinct(Collection<Row> rows)
  {
    return ImmutableList.copyOf(Sets.newLinkedHashSet(rows));
  }
}
