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

package io.factcube.common.utils;

import com.google.common.base.Joiner;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.Locale;

/**
 */
public class StringUtils
{
  private static final Joiner COMMA = Joiner.on(", ").useForNull("null");

  public static String format(String message, Object... formatArgs)
  {
    return String.format(Locale.ENGLISH, message, formatArgs);
  }

  // never fails.. used for logging and exception messages
  public static String safeFormat(String message, Object... formatArgs)
  {
    if (formatArgs == null || formatArgs.length == 0) {
      return message;
    }
    try {
      return format(message, formatArgs);
    }
    catch (IllegalFormatException e) {
      return message + " [" + COMMA.join(Arrays.asList(formatArgs)) + "]";
    }
  }
}
