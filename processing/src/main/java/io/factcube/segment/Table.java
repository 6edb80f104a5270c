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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.factcube.common.IAE;
import io.factcube.common.ISE;
import io.factcube.query.UnknownColumnException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collections;
import java.util.List;

/**
 * Named table of string encoded rows. Rows are appended while loading and the table is read-only once
 * {@link #seal()} is called.
 */
public class Table
{
  private final String name;
  private final List<String> columns;
  private final Object2IntMap<String> columnIndex;

  private List<Row> rows = Lists.newArrayList();
  private boolean sealed;

  public Table(String name, List<String> columns)
  {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "table name must not be empty");
    Preconditions.checkArgument(columns != null && !columns.isEmpty(), "table [%s] requires columns", name);
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    this.columnIndex = new Object2IntOpenHashMap<>();
    this.columnIndex.defaultReturnValue(-1);
    for (int i = 0; i < this.columns.size(); i++) {
      if (columnIndex.put(this.columns.get(i), i) >= 0) {
        throw new IAE("duplicated column [%s] in table [%s]", this.columns.get(i), name);
      }
    }
  }

  public String getName()
  {
    return name;
  }

  public List<String> getColumns()
  {
    return columns;
  }

  public List<Row> getRows()
  {
    return sealed ? rows : Collections.unmodifiableList(rows);
  }

  public int getNumRows()
  {
    return rows.size();
  }

  public Row getRow(int index)
  {
    return rows.get(index);
  }

  public boolean hasColumn(String column)
  {
    return columnIndex.containsKey(column);
  }

  public int findColumnIndex(String column)
  {
    final int index = columnIndex.getInt(column);
    if (index < 0) {
      throw new UnknownColumnException(column, name);
    }
    return index;
  }

  public Table addRow(Row row)
  {
    if (sealed) {
      throw new ISE("table [%s] is sealed", name);
    }
    if (row.size() != columns.size()) {
      throw new IAE(
          "row %s has %d values but table [%s] has %d columns", row, row.size(), name, columns.size()
      );
    }
    rows.add(row);
    return this;
  }

  public boolean isSealed()
  {
    return sealed;
  }

  /**
   * Finishes loading. No row can be added afterwards.
   */
  public void seal()
  {
    if (!sealed) {
      rows = Collections.unmodifiableList(rows);
      sealed = true;
    }
  }

  public void ensureSealed()
  {
    if (!sealed) {
      throw new ISE("table [%s] is still loading", name);
    }
  }

  @Override
  public String toString()
  {
    return name + columns;
  }
}
