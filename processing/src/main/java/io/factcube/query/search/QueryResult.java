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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import io.factcube.query.filter.DimFilter;
import io.factcube.segment.Row;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one search. The scan path reports the submitted {@code conditions}, the bitmap path the dimension
 * rows its predicates matched ({@code indexedColumns}). {@code results} is empty when no row matched.
 */
public class QueryResult
{
  public static QueryResult scanned(DimFilter conditions, int numRows, Map<String, Number> results)
  {
    return new QueryResult(conditions, null, numRows, results);
  }

  public static QueryResult indexed(Map<String, List<Row>> indexedColumns, int numRows, Map<String, Number> results)
  {
    return new QueryResult(null, indexedColumns, numRows, results);
  }

  private final DimFilter conditions;
  private final Map<String, List<Row>> indexedColumns;
  private final int numRows;
  private final Map<String, Number> results;

  @JsonCreator
  public QueryResult(
      @JsonProperty("conditions") @Nullable DimFilter conditions,
      @JsonProperty("indexedColumns") @Nullable Map<String, List<Row>> indexedColumns,
      @JsonProperty("numRows") int numRows,
      @JsonProperty("results") Map<String, Number> results
  )
  {
    this.conditions = conditions;
    this.indexedColumns = indexedColumns;
    this.numRows = numRows;
    this.results = results == null ? ImmutableMap.of() : results;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public DimFilter getConditions()
  {
    return conditions;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public Map<String, List<Row>> getIndexedColumns()
  {
    return indexedColumns;
  }

  // number of distinct rows selected
  @JsonProperty
  public int getNumRows()
  {
    return numRows;
  }

  @JsonProperty
  public Map<String, Number> getResults()
  {
    return results;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    QueryResult that = (QueryResult) o;
    return numRows == that.numRows &&
           Objects.equals(conditions, that.conditions) &&
           Objects.equals(indexedColumns, that.indexedColumns) &&
           results.equals(that.results);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(conditions, indexedColumns, numRows, results);
  }

  @Override
  public String toString()
  {
    return "QueryResult{" +
           (conditions != null ? "conditions=" + conditions : "indexedColumns=" + indexedColumns) +
           ", numRows=" + numRows +
           ", results=" + results +
           '}';
  }
}
