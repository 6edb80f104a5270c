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

package io.factcube.query.filter;

import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import io.factcube.data.Pair;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 */
public class DimFilters
{
  public static final DimFilter ALL = new AndDimFilter(ImmutableList.of());
  public static final DimFilter NONE = new OrDimFilter(ImmutableList.of());

  public static List<DimFilter> filterNulls(List<DimFilter> filters)
  {
    return ImmutableList.copyOf(Iterables.filter(filters, Predicates.notNull()));
  }

  public static DimFilter and(DimFilter... filters)
  {
    return and(Arrays.asList(filters));
  }

  public static DimFilter and(List<DimFilter> filters)
  {
    final List<DimFilter> fields = filterNulls(filters);
    return fields.size() == 1 ? fields.get(0) : new AndDimFilter(fields);
  }

  public static DimFilter or(DimFilter... filters)
  {
    return or(Arrays.asList(filters));
  }

  public static DimFilter or(List<DimFilter> filters)
  {
    final List<DimFilter> fields = filterNulls(filters);
    return fields.size() == 1 ? fields.get(0) : new OrDimFilter(fields);
  }

  /**
   * Builds the disjunctive normal form: AND within each group, OR across groups. Groups and predicates keep their
   * order. An empty group matches every row, no group at all matches nothing.
   */
  public static OrDimFilter dnf(List<? extends List<Pair<String, String>>> groups)
  {
    return Conditions.of(groups).toDimFilter();
  }

  /**
   * @return selector predicates of the expression in the order they appear
   */
  public static List<SelectorDimFilter> selectors(DimFilter filter)
  {
    final List<SelectorDimFilter> selectors = Lists.newArrayList();
    collectSelectors(filter, selectors);
    return selectors;
  }

  private static void collectSelectors(DimFilter filter, List<SelectorDimFilter> selectors)
  {
    if (filter instanceof SelectorDimFilter) {
      selectors.add((SelectorDimFilter) filter);
    }
    for (DimFilter child : filter.getChildren()) {
      collectSelectors(child, selectors);
    }
  }

  public static Set<String> dependents(DimFilter filter)
  {
    final Set<String> dependents = Sets.newLinkedHashSet();
    filter.addDependent(dependents);
    return dependents;
  }
}
