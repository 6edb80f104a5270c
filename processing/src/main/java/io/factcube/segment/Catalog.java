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

import com.google.common.collect.ImmutableList;
import io.factcube.query.UnknownColumnException;

import java.util.List;

/**
 * Loaded fact table and its dimension tables.
 */
public class Catalog
{
  private final FactTable factTable;
  private final List<Table> dimensionTables;

  public Catalog(FactTable factTable, List<Table> dimensionTables)
  {
    this.factTable = factTable;
    this.dimensionTables = ImmutableList.copyOf(dimensionTables);
  }

  public FactTable getFactTable()
  {
    return factTable;
  }

  public List<Table> getDimensionTables()
  {
    return dimensionTables;
  }

  public Table getDimensionTable(String name)
  {
    for (Table table : dimensionTables) {
      if (table.getName().equals(name)) {
        return table;
      }
    }
    throw new UnknownColumnException(name, factTable.getName(), "has no dimension table");
  }
}
