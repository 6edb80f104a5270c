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

package io.factcube.segment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import io.factcube.common.IAE;
import io.factcube.common.logger.Logger;
import io.factcube.query.UnknownColumnException;
import io.factcube.segment.bitmap.BitmapIndex;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fact table whose dimension columns carry a {@link BitmapIndex}, keyed by column name.
 * Indexes are built when the table is sealed.
 */
public class FactTable extends Table
{
  private static final Logger log = new Logger(FactTable.class);

  private final List<String> dimensions;
  private Map<String, BitmapIndex> bitmapIndexes = ImmutableMap.of();

  public FactTable(String name, List<String> columns, List<String> dimensions)
  {
    super(name, columns);
    final Set<String> unique = Sets.newHashSet();
    for (String dimension : dimensions) {
      if (!hasColumn(dimension)) {
        throw new UnknownColumnException(dimension, name);
      }
      if (!unique.add(dimension)) {
        throw new IAE("duplicated dimension [%s] in table [%s]", dimension, name);
      }
    }
    this.dimensions = ImmutableList.copyOf(dimensions);
  }

  public List<String> getDimensions()
  {
    return dimensions;
  }

  public boolean isDimension(String column)
  {
    return dimensions.contains(column);
  }

  /**
   * Seals rows and builds a bitmap index for each dimension.
   */
  @Override
  public void seal()
  {
    if (isSealed()) {
      return;
    }
    super.seal();
    final long start = System.currentTimeMillis();
    final ImmutableMap.Builder<String, BitmapIndex> builder = ImmutableMap.builder();
    for (String dimension : dimensions) {
      final BitmapIndex index = BitmapIndex.build(dimension, getRows(), findColumnIndex(dimension));
      log.debug("Indexed %s, %d values in %,d bytes", dimension, index.getCardinality(), index.estimatedBytes());
      builder.put(dimension, index);
    }
    bitmapIndexes = builder.build();
    log.info(
        "Built %d bitmap indexes on [%s] (%,d rows) in %,d msec",
        dimensions.size(), getName(), getNumRows(), System.currentTimeMillis() - start
    );
  }

  /**
   * @return bitmap index of the dimension
   *
   * @throws UnknownColumnException if the column is not an indexed dimension of this table
   */
  public BitmapIndex getBitmapIndex(String dimension)
  {
    ensureSealed();
    final BitmapIndex index = bitmapIndexes.get(dimension);
    if (index == null) {
      throw new UnknownColumnException(dimension, getName(), "is not an indexed dimension");
    }
    return index;
  }

  public Map<String, BitmapIndex> getBitmapIndexes()
  {
    ensureSealed();
    return bitmapIndexes;
  }
}
