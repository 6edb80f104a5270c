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

package io.factcube.data.input.impl;

import com.google.common.base.Function;
import com.google.common.base.Functions;
import com.google.common.collect.Lists;
import io.factcube.data.ParseException;

import java.util.List;

/**
 * Splits one comma separated line into its values.
 */
public class CSVParser
{
  private static final Function<String, String> NULL_TO_EMPTY = input -> input == null ? "" : input;
  private static final Function<String, String> TRIM = String::trim;

  private final au.com.bytecode.opencsv.CSVParser parser;
  private final Function<String, String> valueFunction;

  public CSVParser(char separator, boolean trim)
  {
    this.parser = new au.com.bytecode.opencsv.CSVParser(separator);
    this.valueFunction = trim ? Functions.compose(TRIM, NULL_TO_EMPTY) : NULL_TO_EMPTY;
  }

  public CSVParser()
  {
    this(au.com.bytecode.opencsv.CSVParser.DEFAULT_SEPARATOR, true);
  }

  public List<String> parseLine(String input)
  {
    try {
      final String[] values = parser.parseLine(input);
      return Lists.newArrayList(Lists.transform(Lists.newArrayList(values), valueFunction));
    }
    catch (Exception e) {
      throw new ParseException(e, "Unable to parse row [%s]", input);
    }
  }
}
