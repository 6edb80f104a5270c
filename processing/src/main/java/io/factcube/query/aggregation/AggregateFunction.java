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
import com.fasterxml.jackson.annotation.JsonValue;
import io.factcube.query.UnknownAggregateFunctionException;

import java.util.Locale;

/**
 */
public enum AggregateFunction
{
  MIN {
    @Override
    public Aggregator<?> factorize()
    {
      return new DoubleMinAggregator();
    }
  },
  MAX {
    @Override
    public Aggregator<?> factorize()
    {
      return new DoubleMaxAggregator();
    }
  },
  AVG {
    @Override
    public Aggregator<?> factorize()
    {
      return new AverageAggregator();
    }
  },
  SUM {
    @Override
    public Aggregator<?> factorize()
    {
      return new DoubleSumAggregator();
    }
  },
  COUNT {
    @Override
    public Aggregator<?> factorize()
    {
      return new CountAggregator();
    }
  };

  public abstract Aggregator<?> factorize();

  @JsonValue
  public String getName()
  {
    return name().toLowerCase(Locale.ENGLISH);
  }

  @JsonCreator
  public static AggregateFunction fromString(String name)
  {
    if (name != null) {
      for (AggregateFunction function : values()) {
        if (function.name().equalsIgnoreCase(name.trim())) {
          return function;
        }
      }
    }
    throw new UnknownAggregateFunctionException(name);
  }
}
