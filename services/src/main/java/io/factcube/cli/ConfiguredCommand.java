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

import com.google.common.base.Throwables;
import io.factcube.common.config.PropertiesConfigurator;
import io.factcube.jackson.DefaultObjectMapper;

import java.io.IOException;
import java.util.Properties;

/**
 */
public abstract class ConfiguredCommand implements Runnable
{
  protected FactcubeConfig loadConfig()
  {
    try {
      final Properties properties = PropertiesConfigurator.loadProperties(getClass().getClassLoader());
      return new PropertiesConfigurator(new DefaultObjectMapper()).configurate(
          properties,
          FactcubeConfig.PROPERTY_PREFIX,
          FactcubeConfig.class
      );
    }
    catch (IOException e) {
      throw Throwables.propagate(e);
    }
  }
}
