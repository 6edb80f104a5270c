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

package io.factcube.query.aggregation;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import io.factcube.common.IAE;
import io.factcube.data.Cell;
import io.factcube.query.EmptyAggregateException;
import io.factcube.segment.Row;
import io.factcube.segment.Table;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 */
public class Aggregators
{
  /**
   * Checks every aggregated column exists in the table and resolves the output names.
   *
   * @see #outputNames(List)
   */
  public static List<String> validate(Table table, List<AggregatorFactory> factories)
  {
    for (AggregatorFactory factory : factories) {
      table.findColumnIndex(factory.getFieldName());
    }
    return outputNames(factories);
  }

  /**
   * Resolves the output name of each aggregation, in request order. An explicit name is kept as given. An unnamed
   * aggregation is named by its column, unless that column is aggregated again in the same request or the column
   * name is taken by an explicit name, in which case it is named {@code fieldName_function}. The same unnamed
   * (column, function) pair requested twice shares one output.
   *
   * @throws IAE if two explicit names clash, or an explicit name clashes with a resolved one
   */
  public static List<String> outputNames(List<AggregatorFactory> factories)
  {
    final Set<String> explicit = Sets.newHashSet();
    final Multiset<String> unnamedColumns = HashMultiset.create();
    for (AggregatorFactory factory : factories) {
      if (!factory.hasName()) {
        unnamedColumns.add(factory.getFieldName());
      } else if (!explicit.add(factory.getName())) {
        throw new IAE("duplicated aggregation output name [%s]", factory.getName());
      }
    }
    final List<String> names = Lists.newArrayListWithCapacity(factories.size());
    for (AggregatorFactory factory : factories) {
      if (factory.hasName()) {
        names.add(factory.getName());
        continue;
      }
      final String fieldName = factory.getFieldName();
      final String name = unnamedColumns.count(fieldName) > 1 || explicit.contains(fieldName)
                          ? factory.getDerivedName()
                          : fieldName;
      if (explicit.contains(name)) {
        throw new IAE("aggregation output name [%s] is already given to another aggregation", name);
      }
      names.add(name);
    }
    return names;
  }

  /**
   * Computes every requested aggregation over the numeric cells of the rows. Non-numeric cells are skipped
   * for that column only.
   *
   * @return output name to value, in request order, named as {@link #outputNames(List)} resolves them
   *
   * @throws EmptyAggregateException if a function other than COUNT finds no numeric value
   */
  public static Map<String, Number> aggregate(Table table, Collection<Row> rows, List<AggregatorFactory> factories)
  {
    final List<String> names = validate(table, factories);
    final Map<String, Number> results = Maps.newLinkedHashMap();
    for (int i = 0; i < factories.size(); i++) {
      final AggregatorFactory factory = factories.get(i);
      final int columnIndex = table.findColumnIndex(factory.getFieldName());
      final Aggregator<Object> aggregator = factory.factorize();
      Object current = null;
      for (Row row : rows) {
        final Cell cell = row.get(columnIndex);
        if (cell.isNumeric()) {
          current = aggregator.aggregate(current, cell.doubleValue());
        }
      }
      final Number result = aggregator.get(current);
      if (result == null) {
        throw new EmptyAggregateException(factory.getFieldName(), factory.getFunction());
      }
      results.put(names.get(i), result);
    }
    return results;
  }
}
