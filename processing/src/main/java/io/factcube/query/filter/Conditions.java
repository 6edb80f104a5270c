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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.factcube.data.Pair;

import java.util.List;

/**
 * Json form of an expression in disjunctive normal form, {@code [[{"dimension": "D1", "value": "A"}, ..], ..]}.
 */
public class Conditions
{
  public static Conditions of(List<? extends List<Pair<String, String>>> groups)
  {
    final List<List<SelectorDimFilter>> converted = Lists.newArrayList();
    for (List<Pair<String, String>> group : groups) {
      converted.add(Lists.transform(group, p -> SelectorDimFilter.of(p.lhs, p.rhs)));
    }
    return new Conditions(converted);
  }

  private final List<List<SelectorDimFilter>> groups;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public Conditions(List<List<SelectorDimFilter>> groups)
  {
    final ImmutableList.Builder<List<SelectorDimFilter>> builder = ImmutableList.builder();
    for (List<SelectorDimFilter> group : groups == null ? ImmutableList.<List<SelectorDimFilter>>of() : groups) {
      builder.add(ImmutableList.copyOf(group));
    }
    this.groups = builder.build();
  }

  @JsonValue
  public List<List<SelectorDimFilter>> getGroups()
  {
    return groups;
  }

  public OrDimFilter toDimFilter()
  {
    final List<DimFilter> ands = Lists.newArrayList();
    for (List<SelectorDimFilter> group : groups) {
      ands.add(new AndDimFilter(ImmutableList.<DimFilter>copyOf(group)));
    }
    return new OrDimFilter(ands);
  }

  @Override
  public boolean equals(Object o)
  {
    return o instanceof Conditions && groups.equals(((Conditions) o).groups);
  }

  @Override
  public int hashCode()
  {
    return groups.hashCode();
  }

  @Override
  public String toString()
  {
    return toDimFilter().toString();
  }
}
