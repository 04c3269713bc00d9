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
import com.rivulet.common.config.RivuletConfig;
import com.rivulet.exec.record.ArrowBlock;
import com.rivulet.exec.record.ArrowBlockBuilder;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.stream.trigger.Trigger;
import com.rivulet.exec.stream.trigger.TriggerSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.arrow.memory.BufferAllocator;

/**
 * In memory cache of {@link ArrowBlockBuilder}s allocated from one allocator.
 *
 * <p>Not thread safe.
 */
public class DefaultBlockBuilderCache implements BlockBuilderCache {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(DefaultBlockBuilderCache.class);

  private final BufferAllocator allocator;
  private final int initialCapacity;
  private final Map<PartitionKey, Entry> entries = new LinkedHashMap<>();
  private TriggerSpec triggerSpec = TriggerSpec.DEFAULT;

  public DefaultBlockBuilderCache(BufferAllocator allocator, int initialCapacity) {
    this.allocator = Preconditions.checkNotNull(allocator);
    this.initialCapacity = initialCapacity;
  }

  public DefaultBlockBuilderCache(BufferAllocator allocator, RivuletConfig config) {
    this(allocator, config.getInt(RivuletConfig.BUILDER_INITIAL_CAPACITY));
  }

  @Override
  public Lookup blockBuilder(PartitionKey key) {
    Entry entry = entries.get(key);
    if (entry != null) {
      return new Lookup(entry.builder, false);
    }
    entry = new Entry(new ArrowBlockBuilder(key, allocator, initialCapacity), triggerSpec.newTrigger());
    entries.put(key, entry);
    return new Lookup(entry.builder, true);
  }

  @Override
  public void setTriggerSpec(TriggerSpec spec) {
    this.triggerSpec = Preconditions.checkNotNull(spec);
  }

  @Override
  public void forEachWithContext(EntryVisitor visitor) {
    for (PartitionKey key : new ArrayList<>(entries.keySet())) {
      final Entry entry = entries.get(key);
      if (entry != null) {
        visitor.visit(key, entry.trigger, entry.builder.getRowCount());
      }
    }
  }

  @Override
  public Optional<ArrowBlock> buildBlock(PartitionKey key) {
    final Entry entry = entries.get(key);
    return entry == null ? Optional.empty() : Optional.of(entry.builder.build());
  }

  @Override
  public void discardBlock(PartitionKey key) {
    final Entry entry = entries.get(key);
    if (entry != null) {
      entry.builder.clearData();
    }
  }

  @Override
  public void expireBlock(PartitionKey key) {
    final Entry entry = entries.remove(key);
    if (entry != null) {
      logger.debug("Expiring block builder for {}", key);
      entry.builder.close();
    }
  }

  @Override
  public int size() {
    return entries.size();
  }

  @Override
  public void close() {
    for (Entry entry : entries.values()) {
      entry.builder.close();
    }
    entries.clear();
  }

  private static final class Entry {
    private final ArrowBlockBuilder builder;
    private final Trigger trigger;

    private Entry(ArrowBlockBuilder builder, Trigger trigger) {
      this.builder = builder;
      this.trigger = trigger;
    }
  }
}
