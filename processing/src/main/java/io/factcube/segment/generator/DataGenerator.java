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

package io.factcube.segment.generator;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import io.factcube.common.logger.Logger;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Random;

/**
 * Writes a synthetic schema and data file: a fact table {@code Fact(Id,D1,D2,D3,Fact1,Fact2)} with three
 * dimensions, followed by one block per dimension table.
 */
public class DataGenerator
{
  private static final Logger log = new Logger(DataGenerator.class);

  private static final Joiner COMMA = Joiner.on(',');

  public static final String FACT_TABLE = "Fact";
  public static final List<String> FACT_COLUMNS = ImmutableList.of("Id", "D1", "D2", "D3", "Fact1", "Fact2");

  private static final List<String> D1_VALUES = ImmutableList.of("A", "B");
  private static final List<String> D2_VALUES = ImmutableList.of("X", "Y", "Z");
  private static final List<String> D3_VALUES = ImmutableList.of("I", "J", "K", "L");

  private static final List<String> SCHEMA = ImmutableList.of(
      FACT_TABLE + "(" + COMMA.join(FACT_COLUMNS) + ")",
      "D1(D1,Alfa,Beta,Gamma)",
      "D2(D2,Delta)",
      "D3(D3,Epsilon,Eta)"
  );

  private static final String DIMENSION_BLOCKS =
      "A,Alfa1,Beta1,Gamma1\nB,Alfa2,Beta2,Gamma2\n\n" +
      "X,Delta1\nY,Delta2\nZ,Delta3\n\n" +
      "I,Epsilon1,Eta1\nJ,Epsilon2,Eta2\nK,Epsilon3,Eta3\nL,Epsilon4,Eta4\n\n";

  private final Random random;

  public DataGenerator(@Nullable Long seed)
  {
    this.random = seed == null ? new Random() : new Random(seed);
  }

  public void writeSchema(File schemaFile) throws IOException
  {
    try (Writer writer = Files.newBufferedWriter(schemaFile.toPath(), StandardCharsets.UTF_8)) {
      for (String line : SCHEMA) {
        writer.write(line);
        writer.write('\n');
      }
    }
  }

  public void writeData(File dataFile, int numRows) throws IOException
  {
    try (Writer writer = Files.newBufferedWriter(dataFile.toPath(), StandardCharsets.UTF_8)) {
      writeData(writer, numRows);
    }
    log.info("Generated %,d fact rows into %s", numRows, dataFile);
  }

  public void writeData(Writer writer, int numRows) throws IOException
  {
    for (int i = 1; i <= numRows; i++) {
      writer.write(
          COMMA.join(
              i,
              pick(D1_VALUES),
              pick(D2_VALUES),
              pick(D3_VALUES),
              between(10, 100),
              between(100, 1000)
          )
      );
      writer.write('\n');
    }
    writer.write('\n');
    writer.write(DIMENSION_BLOCKS);
  }

  private String pick(List<String> values)
  {
    return values.get(random.nextInt(values.size()));
  }

  // inclusive on both ends
  private int between(int from, int to)
  {
    return from + random.nextInt(to - from + 1);
  }
}
