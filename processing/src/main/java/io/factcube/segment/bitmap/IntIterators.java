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

package io.factcube.segment.bitmap;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.roaringbitmap.IntIterator;

import java.util.Iterator;
import java.util.function.IntFunction;

public class IntIterators
{
  public static final IntIterator EMPTY = new IntIterator()
  {
    @Override
    public boolean hasNext()
    {
      return false;
    }

    @Override
    public int next()
    {
      return -1;
    }

    @Override
    public IntIterator clone()
    {
      return this;
    }
  };

  public static <T> Iterator<T> transform(IntIterator iterator, IntFunction<T> function)
  {
    return new Iterator<T>()
    {
      @Override
      public boolean hasNext()
      {
        return iterator.hasNext();
      }

      @Override
      public T next()
      {
        return function.apply(iterator.next());
      }
    };
  }

  public static int[] toArray(final IntIterator iterator)
  {
    final IntArrayList list = new IntArrayList();
    while (iterator.hasNext()) {
      list.add(iterator.next());
    }
    return list.toIntArray();
  }
}
