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

package io.factcube.data;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;

/**
 * A cell value tagged once, when it is loaded, as numeric or text.
 */
public final class Cell
{
  public static Cell of(String text)
  {
    return new Cell(text, Rows.tryParseDouble(text));
  }

  private final String text;
  private final Double numeric;

  private Cell(String text, @Nullable Double numeric)
  {
    this.text = Preconditions.checkNotNull(text, "text");
    this.numeric = numeric;
  }

  @JsonValue
  public String text()
  {
    return text;
  }

  public boolean isNumeric()
  {
    return numeric != null;
  }

  public double doubleValue()
  {
    Preconditions.checkState(numeric != null, "not a numeric cell [%s]", text);
    return numeric;
  }

  @Override
  public boolean equals(Object o)
  {
    return o instanceof Cell && text.equals(((Cell) o).text);
  }

  @Override
  public int hashCode()
  {
    return text.hashCode();
  }

  @Override
  public String toString()
  {
    return text;
  }
}
