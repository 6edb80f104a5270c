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

import org.roaringbitmap.IntIterator;

import java.util.BitSet;

public class BitSets
{
  public static final int ADDRESS_BITS_PER_WORD = 6;
  public static final int BITS_PER_WORD = 1 << ADDRESS_BITS_PER_WORD;
  private final static int BIT_INDEX_MASK = BITS_PER_WORD - 1;

  public static int wordIndex(int bitIndex)
  {
    return bitIndex >> ADDRESS_BITS_PER_WORD;
  }

  public static int indexInWord(int bitIndex)
  {
    return bitIndex & BIT_INDEX_MASK;
  }

  public static int numWords(int numRows)
  {
    return numRows == 0 ? 0 : wordIndex(numRows - 1) + 1;
  }

  // AND identity over numRows
  public static BitSet ones(int numRows)
  {
    final BitSet bitSet = new BitSet(numRows);
    bitSet.set(0, numRows);
    return bitSet;
  }

  // OR identity over numRows
  public static BitSet zeros(int numRows)
  {
    return new BitSet(numRows);
  }

  public static IntIterator iterator(BitSet bitmap)
  {
    return bitmap == null ? IntIterators.EMPTY : new WordIterator(bitmap.toLongArray());
  }

  // walks set bits word by word, taking the lowest set bit of the current word each time
  private static class WordIterator implements IntIterator
  {
    private final long[] words;
    private int wx;
    private long word;

    private WordIterator(long[] words)
    {
      this(words, 0, words.length == 0 ? 0 : words[0]);
    }

    private WordIterator(long[] words, int wx, long word)
    {
      this.words = words;
      this.wx = wx;
      this.word = word;
      skipEmpty();
    }

    private void skipEmpty()
    {
      while (word == 0 && ++wx < words.length) {
        word = words[wx];
      }
    }

    @Override
    public boolean hasNext()
    {
      return word != 0;
    }

    @Override
    public int next()
    {
      final int next = wx * BITS_PER_WORD + Long.numberOfTrailingZeros(word);
      word &= word - 1;
      skipEmpty();
      return next;
    }

    @Override
    public IntIterator clone()
    {
      return new WordIterator(words, wx, word);
    }
  }
}
