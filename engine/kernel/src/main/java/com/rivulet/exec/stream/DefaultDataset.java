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

import com.google.common.base.Preconditions;
import com.rivulet.common.exceptions.UserException;
import com.rivulet.exec.record.ArrowBlock;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import com.rivulet.exec.stream.trigger.TriggerContext;
import com.rivulet.exec.stream.trigger.TriggerSpec;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.arrow.memory.OutOfMemoryException;

/**
 * Dataset that emits the blocks of a {@link BlockBuilderCache} when their triggers fire.
 *
 * <p>Triggers are evaluated on every watermark and processing time update. A key is emitted only
 * if it has never been emitted or its row count changed since the last emission. Blocks built for
 * emission are closed once every downstream transformation has processed them.
 */
public class DefaultDataset implements Dataset {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(DefaultDataset.class);

  private final DatasetId id;
  private final AccumulationMode mode;
  private final BlockBuilderCache cache;
  private final List<Transformation> transformations = new ArrayList<>();
  // row count of each key at its last emission
  private final Map<PartitionKey, Integer> emitted = new HashMap<>();

  private Time watermark = Time.MIN_VALUE;
  private Time processingTime = Time.MIN_VALUE;
  private boolean finished;

  public DefaultDataset(DatasetId id, AccumulationMode mode, BlockBuilderCache cache) {
    this.id = Preconditions.checkNotNull(id);
    this.mode = Preconditions.checkNotNull(mode);
    this.cache = Preconditions.checkNotNull(cache);
  }

  @Override
  public DatasetId getId() {
    return id;
  }

  @Override
  public void addTransformation(Transformation transformation) {
    transformations.add(Preconditions.checkNotNull(transformation));
  }

  @Override
  public void setTriggerSpec(TriggerSpec spec) {
    cache.setTriggerSpec(spec);
  }

  @Override
  public void retractBlock(PartitionKey key) {
    if (isFinished("retraction")) {
      return;
    }
    cache.discardBlock(key);
    emitted.remove(key);
    for (Transformation t : transformations) {
      t.retractBlock(id, key);
    }
  }

  @Override
  public void updateWatermark(Time watermark) {
    if (isFinished("watermark")) {
      return;
    }
    this.watermark = watermark;
    evaluateTriggers();
    for (Transformation t : transformations) {
      t.updateWatermark(id, watermark);
    }
  }

  @Override
  public void updateProcessingTime(Time time) {
    if (isFinished("processing time")) {
      return;
    }
    this.processingTime = time;
    evaluateTriggers();
    for (Transformation t : transformations) {
      t.updateProcessingTime(id, time);
    }
  }

  @Override
  public void finish(Throwable error) {
    if (isFinished("finish")) {
      return;
    }
    finished = true;
    Throwable cause = error;
    try {
      if (error == null) {
        cache.forEachWithContext((key, trigger, rowCount) -> emit(key, rowCount));
      }
    } catch (RuntimeException e) {
      cause = e;
      throw e;
    } finally {
      cache.close();
      emitted.clear();
      for (Transformation t : transformations) {
        t.finish(id, cause);
      }
    }
  }

  public boolean isFinished() {
    return finished;
  }

  private boolean isFinished(String signal) {
    if (finished) {
      logger.debug("Dataset {} already finished, ignoring {}", id, signal);
    }
    return finished;
  }

  private void evaluateTriggers() {
    cache.forEachWithContext((key, trigger, rowCount) -> {
      final TriggerContext context = new TriggerContext(key, rowCount, watermark, processingTime);
      if (trigger.triggers(context)) {
        logger.debug("Trigger fired for {}", context);
        emit(key, rowCount);
      }
      if (trigger.finished()) {
        cache.expireBlock(key);
        emitted.remove(key);
      }
    });
  }

  private void emit(PartitionKey key, int rowCount) {
    final Integer previous = emitted.get(key);
    if (previous != null && previous == rowCount) {
      return;
    }

    final Optional<ArrowBlock> built;
    try {
      built = cache.buildBlock(key);
    } catch (OutOfMemoryException e) {
      throw UserException.memoryError(e)
          .addContext("dataset", id.toString())
          .build(logger);
    }
    if (!built.isPresent()) {
      return;
    }

    try (ArrowBlock block = built.get()) {
      if (previous != null && mode == AccumulationMode.ACCUMULATING_RETRACTING) {
        for (Transformation t : transformations) {
          t.retractBlock(id, key);
        }
      }
      for (Transformation t : transformations) {
        t.process(id, block);
      }
    }

    if (mode == AccumulationMode.DISCARDING) {
      cache.discardBlock(key);
      emitted.put(key, 0);
    } else {
      emitted.put(key, rowCount);
    }
  }
}
