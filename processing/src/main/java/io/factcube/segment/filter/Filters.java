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
import com.google.common.collect.Lists;
import io.factcube.query.filter.DimFilter;
import io.factcube.query.filter.Filter;
import io.factcube.segment.FactTable;

import java.util.List;

/**
 */
public class Filters
{
  public static List<Filter> toFilters(List<DimFilter> dimFilters, FactTable table)
  {
    final List<Filter> filters = Lists.newArrayListWithCapacity(dimFilters.size());
    for (DimFilter dimFilter : dimFilters) {
      filters.add(dimFilter.toFilter(table));
    }
    return filters;
  }

  /**
   * @return disjuncts of the filter, or the filter itself when it is not a disjunction
   */
  public static List<Filter> branches(Filter filter)
  {
    return filter instanceof OrFilter ? filter.getChildren() : ImmutableList.of(filter);
  }
}
