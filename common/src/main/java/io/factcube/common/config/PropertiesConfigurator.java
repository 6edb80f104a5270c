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

package io.factcube.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Maps;
import io.factcube.common.IAE;
import io.factcube.common.logger.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Binds properties sharing a prefix onto a jackson annotated config bean. Values looking like json objects or
 * arrays are read as json, other values as json strings, so {@code prefix.rows=10} binds to an int field.
 */
public class PropertiesConfigurator
{
  private static final Logger log = new Logger(PropertiesConfigurator.class);

  public static final String RUNTIME_PROPERTIES = "runtime.properties";

  private final ObjectMapper jsonMapper;

  public PropertiesConfigurator(ObjectMapper jsonMapper)
  {
    this.jsonMapper = jsonMapper;
  }

  public <T> T configurate(Properties props, String propertyPrefix, Class<T> clazz)
  {
    // Make it end with a period so we only include properties with sub-object thingies.
    final String propertyBase = propertyPrefix.endsWith(".") ? propertyPrefix : propertyPrefix + ".";

    final Map<String, Object> values = Maps.newTreeMap();
    for (String prop : props.stringPropertyNames()) {
      if (!prop.startsWith(propertyBase)) {
        continue;
      }
      final String propValue = props.getProperty(prop).trim();
      final String path = prop.substring(propertyBase.length());
      Object value;
      try {
        // If it's a String Jackson wants it to be quoted, so check if it's not an object or array and quote.
        String modifiedPropValue = propValue;
        if (!(modifiedPropValue.startsWith("[") || modifiedPropValue.startsWith("{"))) {
          modifiedPropValue = jsonMapper.writeValueAsString(propValue);
        }
        value = jsonMapper.readValue(modifiedPropValue, Object.class);
      }
      catch (IOException e) {
        log.info(e, "Unable to parse [%s]=[%s] as a json object, using as is.", prop, propValue);
        value = propValue;
      }
      put(values, path, value);
    }
    try {
      return jsonMapper.convertValue(values, clazz);
    }
    catch (IllegalArgumentException e) {
      throw new IAE(e, "Unable to bind properties [%s*] to %s", propertyBase, clazz.getSimpleName());
    }
  }

  // "generator.rows" -> {"generator": {"rows": ..}}
  @SuppressWarnings("unchecked")
  private static void put(Map<String, Object> values, String path, Object value)
  {
    final int index = path.indexOf('.');
    if (index < 0) {
      values.put(path, value);
      return;
    }
    final String key = path.substring(0, index);
    Object child = values.get(key);
    if (!(child instanceof Map)) {
      child = Maps.newTreeMap();
      values.put(key, child);
    }
    put((Map<String, Object>) child, path.substring(index + 1), value);
  }

  /**
   * Loads {@link #RUNTIME_PROPERTIES} from the classpath, then overlays system properties.
   */
  public static Properties loadProperties(ClassLoader loader) throws IOException
  {
    final Properties props = new Properties();
    try (InputStream stream = loader.getResourceAsStream(RUNTIME_PROPERTIES)) {
      if (stream != null) {
        log.debug("Loading properties from %s", RUNTIME_PROPERTIES);
        props.load(stream);
      } else {
        log.warn("%s not found on classpath, using defaults", RUNTIME_PROPERTIES);
      }
    }
    props.putAll(System.getProperties());
    return props;
  }
}
