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

package io.factcube.data;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;

import javax.annotation.Nullable;
import java.util.Locale;

/**
 */
public class Rows
{
  /**
   * Parses a cell text as a number the way a float parser does: surrounding whitespace is ignored, an optional
   * sign, decimal or scientific notation, {@code nan}, {@code inf} and {@code infinity} in any case.
   * Hexadecimal forms and java type suffixes ({@code 1d}, {@code 2f}) are not numbers.
   *
   * @return parsed value or null if the text is not numeric
   */
  @Nullable
  public static Double tryParseDouble(@Nullable final String value)
  {
    if (value == null) {
      return null;
    }
    final String target = value.trim();
    if (target.isEmpty()) {
      return null;
    }
    final Double special = parseSpecial(target);
    if (special != null) {
      return special;
    }
    boolean allDigit = true;
    for (int i = 0; i < target.length(); i++) {
      final char aChar = target.charAt(i);
      if (i == 0 && (aChar == '+' || aChar == '-')) {
        continue;
      }
      if (Character.isDigit(aChar)) {
        continue;
      }
      if (aChar != '.' && aChar != 'e' && aChar != 'E' && aChar != '+' && aChar != '-') {
        return null;    // rejects hex, suffixes and named constants other than the special ones
      }
      allDigit = false;
    }
    if (allDigit) {
      final Long longValue = Longs.tryParse(target.charAt(0) == '+' ? target.substring(1) : target);
      if (longValue != null) {
        return longValue.doubleValue();
      }
    }
    return Doubles.tryParse(target);
  }

  public static boolean isNumeric(@Nullable final String value)
  {
    return tryParseDouble(value) != null;
  }

  private static Double parseSpecial(final String value)
  {
    final char first = value.charAt(0);
    final boolean signed = first == '+' || first == '-';
    final String body = (signed ? value.substring(1) : value).toLowerCase(Locale.ENGLISH);
    switch (body) {
      case "nan":
        return Double.NaN;
      case "inf":
      case "infinity":
        return first == '-' ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
      default:
        return null;
    }
  }
}
