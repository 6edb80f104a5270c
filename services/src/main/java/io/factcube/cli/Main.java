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

import io.airlift.airline.Cli;
import io.airlift.airline.Help;
import io.airlift.airline.ParseException;
import io.factcube.common.logger.Logger;

/**
 */
public class Main
{
  private static final Logger LOG = new Logger(Main.class);

  public static void main(String[] args)
  {
    final Cli<Runnable> cli = createCli();
    try {
      final Runnable command = cli.parse(args);
      if (!(command instanceof Help)) {
        LOG.info("Running.. %s", command.getClass().getSimpleName());
      }
      command.run();
    }
    catch (ParseException e) {
      System.out.println("ERROR!!!!");
      System.out.println(e.getMessage());
      System.out.println("===");
      cli.parse(new String[]{"help"}).run();
    }
  }

  @SuppressWarnings("unchecked")
  static Cli<Runnable> createCli()
  {
    final Cli.CliBuilder<Runnable> builder = Cli.builder("factcube");

    builder.withDescription("In-memory fact table query runner.")
           .withDefaultCommand(Help.class)
           .withCommands(Help.class, CliGenerate.class, CliQuery.class);

    return builder.build();
  }
}
