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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import io.factcube.segment.FactTable;
import io.factcube.segment.filter.SelectorFilter;

import java.util.Objects;
import java.util.Set;

/**
 * {@code dimension = value}, compared by exact string equality.
 */
public class SelectorDimFilter implements DimFilter
{
  public static SelectorDimFilter of(String dimension, String value)
  {
    return new SelectorDimFilter(dimension, value);
  }

  private final String dimension;
  private final String value;

  @JsonCreator
  public SelectorDimFilter(
      @JsonProperty("dimension") String dimension,
      @JsonProperty("value") String value
  )
  {
    Preconditions.checkArgument(dimension != null, "dimension must not be null");
    Preconditions.checkArgument(value != null, "value must not be null");
    this.dimension = dimension;
    this.value = value;
  }

  @JsonProperty
  public String getDimension()
  {
    return dimension;
  }

  @JsonProperty
  public String getValue()
  {
    return value;
  }

  @Override
  public void addDependent(Set<String> handler)
  {
    handler.add(dimension);
  }

  @Override
  public Filter toFilter(FactTable table)
  {
    // validates the column is an indexed dimension, for both paths
    table.getBitmapIndex(dimension);
    return new SelectorFilter(dimension, value, table.findColumnIndex(dimension));
  }

  @Override
  public String toString()
  {
    return String.format("%s=='%s'", dimension, value);
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
    SelectorDimFilter that = (SelectorDimFilter) o;
    return dimension.equals(that.dimension) && value.equals(that.value);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(dimension, value);
  }
}
