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

package io.factcube.query;

import io.factcube.query.aggregation.AggregateFunction;

/**
 * MIN, MAX, AVG or SUM over a column without any numeric value in the selected rows.
 */
public class EmptyAggregateException extends QueryException
{
  private final String column;
  private final AggregateFunction function;

  public EmptyAggregateException(String column, AggregateFunction function)
  {
    super(Code.EMPTY_AGGREGATE, "No numeric value in column '%s' to compute %s", column, function);
    this.column = column;
    this.function = function;
  }

  public String getColumn()
  {
    return column;
  }

  public AggregateFunction getFunction()
  {
    return function;
  }
}
