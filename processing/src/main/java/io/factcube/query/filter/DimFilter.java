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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.collect.ImmutableList;
import io.factcube.segment.FactTable;

import java.util.List;
import java.util.Set;

/**
 * Boolean expression over dimension columns, as submitted by a caller. Resolved against a fact table into a
 * {@link Filter} which can be evaluated by scanning rows or by combining bitmaps.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = SelectorDimFilter.class)
@JsonSubTypes(value = {
    @JsonSubTypes.Type(name = "and", value = AndDimFilter.class),
    @JsonSubTypes.Type(name = "or", value = OrDimFilter.class),
    @JsonSubTypes.Type(name = "selector", value = SelectorDimFilter.class),
})
public interface DimFilter
{
  /**
   * @param handler accumulate dependent dimensions
   */
  void addDependent(Set<String> handler);

  /**
   * Returns a Filter that implements this DimFilter on the given table.
   *
   * @throws io.factcube.query.UnknownColumnException if a referenced column is not an indexed dimension
   */
  Filter toFilter(FactTable table);

  default List<DimFilter> getChildren()
  {
    return ImmutableList.of();
  }
}
