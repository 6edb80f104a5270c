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

/**
 * Raised by the bitmap path when a predicate value has no bitmap in the dimension index, which means a stale index
 * or a mistyped literal. The scan path just matches nothing for the same predicate.
 */
public class UnknownDimensionValueException extends QueryException
{
  private final String dimension;
  private final String value;

  public UnknownDimensionValueException(String dimension, String value)
  {
    super(Code.UNKNOWN_DIMENSION_VALUE, "Value '%s' is not referenced in the dimension '%s'", value, dimension);
    this.dimension = dimension;
    this.value = value;
  }

  public String getDimension()
  {
    return dimension;
  }

  public String getValue()
  {
    return value;
  }
}
