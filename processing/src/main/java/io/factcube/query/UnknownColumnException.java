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
 * A predicate or aggregation names a column the table cannot serve.
 */
public class UnknownColumnException extends QueryException
{
  private final String column;
  private final String table;

  public UnknownColumnException(String column, String table)
  {
    this(column, table, "does not exist");
  }

  public UnknownColumnException(String column, String table, String reason)
  {
    super(Code.UNKNOWN_COLUMN, "Column '%s' %s in the table '%s'", column, reason, table);
    this.column = column;
    this.table = table;
  }

  public String getColumn()
  {
    return column;
  }

  public String getTable()
  {
    return table;
  }
}
