/*
 * Copyright (C) 2017-2019 Dremio Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.rivulet.exec.op.sort;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.exec.context.ExecutionAdministration;
import com.rivulet.exec.physical.config.SortProcedureSpec;
import com.rivulet.exec.record.Block;
import com.rivulet.exec.record.BlockBuilder;
import com.rivulet.exec.record.BlockUtil;
import com.rivulet.exec.record.ColumnIndexMap;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import com.rivulet.exec.stream.AccumulationMode;
import com.rivulet.exec.stream.BlockBuilderCache;
import com.rivulet.exec.stream.CreatedTransformation;
import com.rivulet.exec.stream.Dataset;
import com.rivulet.exec.stream.DatasetId;
import com.rivulet.exec.stream.DefaultBlockBuilderCache;
import com.rivulet.exec.stream.DefaultDataset;
import com.rivulet.exec.stream.Transformation;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.arrow.memory.OutOfMemoryException;

/**
 * Sorts the rows of every incoming block by the configured columns.
 *
 * <p>Each block becomes one output block. When sort columns are part of the partition key, the
 * output key lists them first, in sort order, followed by the other key columns. Two input blocks
 * that map to the same output key are an error.
 */
public class SortTransformation implements Transformation {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(SortTransformation.class);

  private final Dataset dataset;
  private final BlockBuilderCache cache;
  private final ImmutableList<String> columns;
  private final boolean descending;
  private final ColumnIndexMap columnMap = new ColumnIndexMap();
  private boolean finished;

  public SortTransformation(Dataset dataset, BlockBuilderCache cache, SortProcedureSpec spec) {
    this.dataset = Preconditions.checkNotNull(dataset);
    this.cache = Preconditions.checkNotNull(cache);
    this.columns = ImmutableList.copyOf(spec.getColumns());
    this.descending = spec.isDescending();
  }

  public static CreatedTransformation create(DatasetId id, AccumulationMode mode, SortProcedureSpec spec,
                                             ExecutionAdministration administration) {
    final BlockBuilderCache cache = new DefaultBlockBuilderCache(administration.getAllocator(),
        administration.getConfig());
    final Dataset dataset = new DefaultDataset(id, mode, cache);
    return new CreatedTransformation(new SortTransformation(dataset, cache, spec), dataset);
  }

  @Override
  public void process(DatasetId id, Block block) {
    if (finished) {
      logger.debug("Sort already finished, ignoring block {} from {}", block.getKey(), id);
      return;
    }
    final PartitionKey key = sortedKey(block.getKey());
    final BlockBuilderCache.Lookup lookup = cache.blockBuilder(key);
    if (!lookup.isCreated()) {
      throw UserException.executionError()
          .message("sort found duplicate block with key: %s", block.getKey())
          .addContext("dataset", id.toString())
          .build(logger);
    }

    final BlockBuilder builder = lookup.getBuilder();
    try {
      BlockUtil.addBlockColumns(block, builder);
      BlockUtil.appendBlock(block, builder, columnMap.resize(block.getColumnCount()));
      builder.sort(columns, descending);
    } catch (OutOfMemoryException e) {
      cache.expireBlock(key);
      throw UserException.memoryError(e)
          .addContext("key", key.toString())
          .addContext("rows", block.getRowCount())
          .build(logger);
    } catch (RuntimeException e) {
      cache.expireBlock(key);
      throw e;
    }
  }

  /**
   * Moves the sort columns found in the key to its front, in sort order. Returns the key
   * unchanged when it holds none of them.
   */
  PartitionKey sortedKey(PartitionKey key) {
    boolean reorder = false;
    for (String label : columns) {
      if (key.hasColumn(label)) {
        reorder = true;
        break;
      }
    }
    if (!reorder) {
      return key;
    }

    final PartitionKey.Builder builder = PartitionKey.builder();
    final Set<String> added = new HashSet<>();
    for (String label : columns) {
      int i = key.indexOf(label);
      if (i >= 0 && added.add(label)) {
        builder.add(key.getColumns().get(i), key.getValue(i));
      }
    }
    for (int i = 0; i < key.size(); i++) {
      if (!added.contains(key.getColumns().get(i).getLabel())) {
        builder.add(key.getColumns().get(i), key.getValue(i));
      }
    }
    return builder.build();
  }

  @Override
  public void retractBlock(DatasetId id, PartitionKey key) {
    if (finished) {
      logger.debug("Sort already finished, ignoring retraction of {}", key);
      return;
    }
    dataset.retractBlock(key);
  }

  @Override
  public void updateWatermark(DatasetId id, Time watermark) {
    if (finished) {
      logger.debug("Sort already finished, ignoring watermark {}", watermark);
      return;
    }
    dataset.updateWatermark(watermark);
  }

  @Override
  public void updateProcessingTime(DatasetId id, Time time) {
    if (finished) {
      logger.debug("Sort already finished, ignoring processing time {}", time);
      return;
    }
    dataset.updateProcessingTime(time);
  }

  @Override
  public void finish(DatasetId id, Throwable error) {
    if (finished) {
      logger.debug("Sort already finished, ignoring finish from {}", id);
      return;
    }
    finished = true;
    dataset.finish(error);
  }

  List<String> getColumns() {
    return columns;
  }
}
