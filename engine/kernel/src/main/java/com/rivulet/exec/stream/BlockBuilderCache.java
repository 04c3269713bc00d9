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

import com.rivulet.exec.record.ArrowBlock;
import com.rivulet.exec.record.BlockBuilder;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.stream.trigger.Trigger;
import com.rivulet.exec.stream.trigger.TriggerSpec;
import java.util.Optional;

/**
 * Holds one block builder and one trigger per partition key.
 */
public interface BlockBuilderCache extends AutoCloseable {

  /**
   * Returns the builder for a key, creating an empty one when the key is new.
   */
  Lookup blockBuilder(PartitionKey key);

  /**
   * Sets the trigger used for keys created from now on.
   */
  void setTriggerSpec(TriggerSpec spec);

  /**
   * Visits every cached key in creation order. The visitor may expire or discard the visited key.
   */
  void forEachWithContext(EntryVisitor visitor);

  /**
   * Builds a block from the cached rows of a key.
   *
   * @return the block, owned by the caller, or empty if the key is not cached
   */
  Optional<ArrowBlock> buildBlock(PartitionKey key);

  /**
   * Drops the rows cached for a key but keeps its builder and trigger.
   */
  void discardBlock(PartitionKey key);

  /**
   * Releases the builder of a key and forgets the key.
   */
  void expireBlock(PartitionKey key);

  int size();

  /**
   * Releases every builder.
   */
  @Override
  void close();

  /**
   * Callback of {@link #forEachWithContext(EntryVisitor)}.
   */
  interface EntryVisitor {
    /**
     * @param rowCount rows currently cached for the key
     */
    void visit(PartitionKey key, Trigger trigger, int rowCount);
  }

  /**
   * Result of {@link #blockBuilder(PartitionKey)}.
   */
  final class Lookup {
    private final BlockBuilder builder;
    private final boolean created;

    public Lookup(BlockBuilder builder, boolean created) {
      this.builder = builder;
      this.created = created;
    }

    public BlockBuilder getBuilder() {
      return builder;
    }

    /**
     * @return true if the builder was created by this lookup
     */
    public boolean isCreated() {
      return created;
    }
  }
}
