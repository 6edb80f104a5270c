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

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import io.airlift.airline.Command;
import io.airlift.airline.Option;
import io.factcube.common.logger.Logger;
import io.factcube.segment.generator.DataGenerator;

import java.io.File;
import java.io.IOException;

/**
 */
@Command(name = "generate", description = "Writes a random fact table with its dimension tables.")
public class CliGenerate extends ConfiguredCommand
{
  private static final Logger log = new Logger(CliGenerate.class);

  @Option(name = {"-r", "--rows"}, title = "rows", description = "Number of fact rows")
  public Integer rows;

  @Option(name = {"-s", "--seed"}, title = "seed", description = "Random seed, for reproducible data")
  public Long seed;

  @Option(name = {"-o", "--output"}, title = "dir", description = "Output directory. Configured paths are used if not set")
  public String output;

  @Override
  public void run()
  {
    final FactcubeConfig config = loadConfig();
    final int numRows = rows != null ? rows : config.getGenerator().getRows();
    Preconditions.checkArgument(numRows > 0, "rows should be positive but was %s", numRows);

    final File schemaFile = resolve(config.getSchemaFile());
    final File dataFile = resolve(config.getDataFile());
    try {
      generate(new DataGenerator(seed != null ? seed : config.getGenerator().getSeed()), schemaFile, dataFile, numRows);
    }
    catch (IOException e) {
      throw Throwables.propagate(e);
    }
  }

  private File resolve(String path)
  {
    return output == null ? new File(path) : new File(output, new File(path).getName());
  }

  static void generate(DataGenerator generator, File schemaFile, File dataFile, int numRows) throws IOException
  {
    for (File file : new File[]{schemaFile, dataFile}) {
      final File parent = file.getAbsoluteFile().getParentFile();
      if (!parent.exists() && !parent.mkdirs()) {
        throw new IOException("Cannot create directory " + parent);
      }
    }
    generator.writeSchema(schemaFile);
    generator.writeData(dataFile, numRows);
    log.info("Schema written to %s, data to %s", schemaFile, dataFile);
  }
}
