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

package io.factcube.cli;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bound from {@code factcube.*} runtime properties.
 */
public class FactcubeConfig
{
  public static final String PROPERTY_PREFIX = "factcube";

  @JsonProperty
  private String schemaFile = "schema_and_data/meta_schema.txt";

  @JsonProperty
  private String dataFile = "schema_and_data/data.txt";

  @JsonProperty
  private GeneratorConfig generator = new GeneratorConfig();

  public String getSchemaFile()
  {
    return schemaFile;
  }

  public String getDataFile()
  {
    return dataFile;
  }

  public GeneratorConfig getGenerator()
  {
    return generator;
  }

  public static class GeneratorConfig
  {
    @JsonProperty
    private int rows = 10000;

    @JsonProperty
    private Long seed;

    public int getRows()
    {
      return rows;
    }

    public Long getSeed()
    {
      return seed;
    }
  }
}
