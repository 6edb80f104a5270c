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

package io.factcube.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.Lists;
import io.factcube.data.Cell;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable row of a {@link Table}. Two rows are equal when all of their cell texts are equal.
 */
public final class Row
{
  public static Row of(String... values)
  {
    return of(Arrays.asList(values));
  }

  @JsonCreator
  public static Row of(List<String> values)
  {
    final Cell[] cells = new Cell[values.size()];
    for (int i = 0; i < cells.length; i++) {
      cells[i] = Cell.of(values.get(i));
    }
    return new Row(cells);
  }

  private final Cell[] cells;
  private final int hashCode;

  private Row(Cell[] cells)
  {
    this.cells = cells;
    this.hashCode = Arrays.hashCode(cells);
  }

  public int size()
  {
    return cells.length;
  }

  public Cell get(int index)
  {
    return cells[index];
  }

  public String getText(int index)
  {
    return cells[index].text();
  }

  @JsonValue
  public List<String> toList()
  {
    return Lists.transform(Arrays.asList(cells), Cell::text);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    return o instanceof Row && hashCode == o.hashCode() && Arrays.equals(cells, ((Row) o).cells);
  }

  @Override
  public int hashCode()
  {
    return hashCode;
  }

  @Override
  public String toString()
  {
    return toList().toString();
  }
}
