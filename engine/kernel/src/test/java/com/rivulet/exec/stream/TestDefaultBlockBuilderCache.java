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

import static org.assertj.core.api.Assertions.assertThat;

import com.rivulet.exec.BaseTestWithAllocator;
import com.rivulet.exec.record.ArrowBlock;
import com.rivulet.exec.record.BlockBuilder;
import com.rivulet.exec.record.ColumnMeta;
import com.rivulet.exec.record.ColumnType;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import com.rivulet.exec.stream.trigger.AfterAtLeastCountTriggerSpec;
import com.rivulet.exec.stream.trigger.TriggerContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestDefaultBlockBuilderCache extends BaseTestWithAllocator {

  private DefaultBlockBuilderCache cache;

  private static PartitionKey key(String host) {
    return PartitionKey.builder().add("host", ColumnType.STRING, host).build();
  }

  @Before
  public void setupCache() {
    cache = new DefaultBlockBuilderCache(allocator, 4);
  }

  @After
  public void closeCache() {
    cache.close();
  }

  private static void fill(BlockBuilder builder, int rows) {
    int col = builder.addColumn(ColumnMeta.of("_value", ColumnType.INT));
    for (int i = 0; i < rows; i++) {
      builder.appendValue(col, i);
    }
  }

  @Test
  public void lookupCreatesOnce() {
    BlockBuilderCache.Lookup first = cache.blockBuilder(key("a"));
    BlockBuilderCache.Lookup second = cache.blockBuilder(key("a"));

    assertThat(first.isCreated()).isTrue();
    assertThat(second.isCreated()).isFalse();
    assertThat(second.getBuilder()).isSameAs(first.getBuilder());
    assertThat(first.getBuilder().getKey()).isEqualTo(key("a"));
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  public void buildDiscardExpire() {
    fill(cache.blockBuilder(key("a")).getBuilder(), 3);

    Optional<ArrowBlock> block = cache.buildBlock(key("a"));
    assertThat(block).isPresent();
    try (ArrowBlock b = block.get()) {
      assertThat(b.getRowCount()).isEqualTo(3);
    }
    assertThat(cache.buildBlock(key("missing"))).isEmpty();

    cache.discardBlock(key("a"));
    assertThat(cache.blockBuilder(key("a")).getBuilder().getRowCount()).isZero();
    assertThat(cache.size()).isEqualTo(1);

    cache.expireBlock(key("a"));
    assertThat(cache.size()).isZero();
    assertThat(cache.blockBuilder(key("a")).isCreated()).isTrue();

    // unknown keys are ignored
    cache.discardBlock(key("missing"));
    cache.expireBlock(key("missing"));
  }

  @Test
  public void forEachVisitsInCreationOrder() {
    cache.setTriggerSpec(new AfterAtLeastCountTriggerSpec(2));
    fill(cache.blockBuilder(key("b")).getBuilder(), 1);
    fill(cache.blockBuilder(key("a")).getBuilder(), 2);

    List<PartitionKey> visited = new ArrayList<>();
    List<Boolean> fired = new ArrayList<>();
    cache.forEachWithContext((key, trigger, rows) -> {
      visited.add(key);
      fired.add(trigger.triggers(new TriggerContext(key, rows, Time.MIN_VALUE, Time.MIN_VALUE)));
      // expiring the visited key is allowed
      cache.expireBlock(key);
    });

    assertThat(visited).containsExactly(key("b"), key("a"));
    assertThat(fired).containsExactly(false, true);
    assertThat(cache.size()).isZero();
  }

  @Test
  public void closeReleasesMemory() {
    fill(cache.blockBuilder(key("a")).getBuilder(), 100);
    fill(cache.blockBuilder(key("b")).getBuilder(), 100);
    assertThat(allocator.getAllocatedMemory()).isPositive();

    cache.close();
    assertThat(allocator.getAllocatedMemory()).isZero();
    assertThat(cache.size()).isZero();
  }
}
