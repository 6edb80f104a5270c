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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.factcube.query.filter.Conditions;
import io.factcube.query.filter.DimFilter;
import io.factcube.query.aggregation.AggregatorFactory;

import java.util.List;

/**
 * Json query: the expression, either as {@code conditions} in disjunctive normal form or as a {@code filter} tree,
 * and the aggregations to compute.
 */
public class SearchQuery
{
  private final Conditions conditions;
  private final DimFilter filter;
  private final List<AggregatorFactory> aggregations;

  @JsonCreator
  public SearchQuery(
      @JsonProperty("conditions") Conditions conditions,
      @JsonProperty("filter") DimFilter filter,
      @JsonProperty("aggregations") List<AggregatorFactory> aggregations
  )
  {
    Preconditions.checkArgument(
        conditions == null ^ filter == null, "exactly one of 'conditions' or 'filter' is required"
    );
    this.conditions = conditions;
    this.filter = filter;
    this.aggregations = aggregations == null ? ImmutableList.of() : ImmutableList.copyOf(aggregations);
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public Conditions getConditions()
  {
    return conditions;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public DimFilter getFilter()
  {
    return filter;
  }

  @JsonProperty
  public List<AggregatorFactory> getAggregations()
  {
    return aggregations;
  }

  public DimFilter toDimFilter()
  {
    return filter != null ? filter : conditions.toDimFilter();
  }

  @Override
  public String toString()
  {
    return "SearchQuery{" +
           "filter=" + toDimFilter() +
           ", aggregations=" + aggregations +
           '}';
  }
}
