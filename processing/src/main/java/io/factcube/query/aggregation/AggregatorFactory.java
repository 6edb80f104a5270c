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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Requests {@code function} over the numeric values of column {@code fieldName}, reported as {@code name}.
 * Without a name, the output is named by the column, or by {@code fieldName_function} when the same column
 * is aggregated more than once in a request (see {@link Aggregators#outputNames}).
 */
public class AggregatorFactory
{
  public static AggregatorFactory of(String fieldName, AggregateFunction function)
  {
    return new AggregatorFactory(null, fieldName, function);
  }

  private final String name;
  private final String fieldName;
  private final AggregateFunction function;

  @JsonCreator
  public AggregatorFactory(
      @JsonProperty("name") String name,
      @JsonProperty("fieldName") String fieldName,
      @JsonProperty("function") AggregateFunction function
  )
  {
    this.fieldName = Preconditions.checkNotNull(fieldName, "fieldName must not be null");
    this.function = Preconditions.checkNotNull(function, "function must not be null");
    this.name = name;
  }

  @Nullable
  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getName()
  {
    return name;
  }

  public boolean hasName()
  {
    return name != null;
  }

  @JsonIgnore
  public String getDerivedName()
  {
    return fieldName + "_" + function.getName();
  }

  @JsonProperty
  public String getFieldName()
  {
    return fieldName;
  }

  @JsonProperty
  public AggregateFunction getFunction()
  {
    return function;
  }

  @SuppressWarnings("unchecked")
  public Aggregator<Object> factorize()
  {
    return (Aggregator<Object>) function.factorize();
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
    AggregatorFactory that = (AggregatorFactory) o;
    return Objects.equals(name, that.name) && fieldName.equals(that.fieldName) && function == that.function;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, fieldName, function);
  }

  @Override
  public String toString()
  {
    return function + "(" + fieldName + ")" + (name == null ? "" : " AS " + name);
  }
}
