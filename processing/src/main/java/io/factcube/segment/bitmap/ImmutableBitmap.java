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

import com.google.common.base.Preconditions;
import org.roaringbitmap.IntIterator;

import java.util.BitSet;

/**
 * Read-only view of a dense bitmap covering {@link #size()} rows.
 */
public final class ImmutableBitmap
{
  public static ImmutableBitmap wrap(BitSet bitmap, int size)
  {
    return new ImmutableBitmap(bitmap, size);
  }

  private final BitSet bitmap;
  private final int size;

  private ImmutableBitmap(BitSet bitmap, int size)
  {
    Preconditions.checkArgument(bitmap.length() <= size, "bit %s is out of range %s", bitmap.length() - 1, size);
    this.bitmap = bitmap;
    this.size = size;
  }

  public int size()
  {
    return size;
  }

  public boolean get(int index)
  {
    return bitmap.get(index);
  }

  public int cardinality()
  {
    return bitmap.cardinality();
  }

  public boolean isEmpty()
  {
    return bitmap.isEmpty();
  }

  public IntIterator iterator()
  {
    return BitSets.iterator(bitmap);
  }

  public void intersectInto(BitSet target)
  {
    target.and(bitmap);
  }

  public void unionInto(BitSet target)
  {
    target.or(bitmap);
  }

  public boolean intersects(ImmutableBitmap other)
  {
    return bitmap.intersects(other.bitmap);
  }

  public BitSet toBitSet()
  {
    return (BitSet) bitmap.clone();
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ImmutableBitmap)) {
      return false;
    }
    final ImmutableBitmap that = (ImmutableBitmap) o;
    return size == that.size && bitmap.equals(that.bitmap);
  }

  @Override
  public int hashCode()
  {
    return 31 * bitmap.hashCode() + size;
  }

  @Override
  public String toString()
  {
    return bitmap + "/" + size;
  }
}
