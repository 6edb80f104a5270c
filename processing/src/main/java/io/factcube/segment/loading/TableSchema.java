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

package io.factcube.segment.loading;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 */
public class TableSchema
{
  private final String name;
  private final List<String> columns;

  public TableSchema(String name, List<String> columns)
  {
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
  }

  public String getName()
  {
    return name;
  }

  public List<String> getColumns()
  {
    return columns;
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
    TableSchema that = (TableSchema) o;
    return name.equals(that.name) && columns.equals(that.columns);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(name, columns);
  }

  @Override
  public String toString()
  {
    return name + "(" + String.join(",", columns) + ")";
  }
}
