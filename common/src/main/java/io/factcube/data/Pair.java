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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 */
public class Pair<K, V> implements Map.Entry<K, V>
{
  public static <T1, T2> Pair<T1, T2> of(T1 lhs, T2 rhs)
  {
    return new Pair<>(lhs, rhs);
  }

  public final K lhs;
  public final V rhs;

  @JsonCreator
  public Pair(@JsonProperty("lhs") K lhs, @JsonProperty("rhs") V rhs)
  {
    this.lhs = lhs;
    this.rhs = rhs;
  }

  @Override
  @JsonProperty("lhs")
  public K getKey()
  {
    return lhs;
  }

  @Override
  @JsonProperty("rhs")
  public V getValue()
  {
    return rhs;
  }

  @Override
  public V setValue(V value)
  {
    throw new UnsupportedOperationException("setValue");
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Pair<?, ?> pair = (Pair<?, ?>) o;
    return Objects.equals(lhs, pair.lhs) && Objects.equals(rhs, pair.rhs);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(lhs, rhs);
  }

  @Override
  public String toString()
  {
    return "Pair{lhs=" + lhs + ", rhs=" + rhs + '}';
  }
}
