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
package com.rivulet.exec.stream;

import com.google.common.collect.ImmutableList;
import com.rivulet.exec.record.Block;
import com.rivulet.exec.record.HeapBlock;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import java.util.ArrayList;
import java.util.List;

/**
 * Terminal transformation that keeps heap copies of the blocks it receives. A retraction removes
 * the blocks collected for the key.
 */
public class BlockCollector implements Transformation {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(BlockCollector.class);

  private final List<HeapBlock> blocks = new ArrayList<>();
  private final List<PartitionKey> retractions = new ArrayList<>();
  private Time watermark = Time.MIN_VALUE;
  private Time processingTime = Time.MIN_VALUE;
  private boolean finished;
  private Throwable error;

  @Override
  public void process(DatasetId id, Block block) {
    blocks.add(HeapBlock.copyOf(block));
  }

  @Override
  public void retractBlock(DatasetId id, PartitionKey key) {
    retractions.add(key);
    blocks.removeIf(b -> b.getKey().equals(key));
  }

  @Override
  public void updateWatermark(DatasetId id, Time watermark) {
    this.watermark = watermark;
  }

  @Override
  public void updateProcessingTime(DatasetId id, Time time) {
    this.processingTime = time;
  }

  @Override
  public void finish(DatasetId id, Throwable error) {
    if (error != null) {
      logger.debug("Dataset {} finished with error", id, error);
    }
    this.finished = true;
    this.error = error;
  }

  public ImmutableList<HeapBlock> getBlocks() {
    return ImmutableList.copyOf(blocks);
  }

  public ImmutableList<PartitionKey> getRetractions() {
    return ImmutableList.copyOf(retractions);
  }

  public Time getWatermark() {
    return watermark;
  }

  public Time getProcessingTime() {
    return processingTime;
  }

  public boolean isFinished() {
    return finished;
  }

  public Throwable getError() {
    return error;
  }
}
