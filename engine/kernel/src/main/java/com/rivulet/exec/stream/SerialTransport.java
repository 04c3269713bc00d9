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
import com.google.common.util.concurrent.MoreExecutors;
import com.rivulet.common.config.RivuletConfig;
import com.rivulet.exec.record.Block;
import com.rivulet.exec.record.HeapBlock;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Delivers calls made from any thread to a wrapped transformation one at a time, in the order
 * they were made.
 *
 * <p>Blocks are copied to the heap before they are queued, so callers keep ownership of theirs.
 * Messages queued after finish was delivered are dropped. If the wrapped transformation throws,
 * it is finished with that error and later messages are dropped.
 */
public class SerialTransport implements Transformation {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(SerialTransport.class);

  private final Transformation target;
  private final Executor executor;
  private final long drainTimeoutMillis;
  private final CountDownLatch finishedLatch = new CountDownLatch(1);

  // only touched by the sequential executor
  private boolean finished;
  private volatile Throwable error;

  public SerialTransport(Transformation target, Executor executor, long drainTimeoutMillis) {
    this.target = Preconditions.checkNotNull(target);
    this.executor = MoreExecutors.newSequentialExecutor(Preconditions.checkNotNull(executor));
    this.drainTimeoutMillis = drainTimeoutMillis;
  }

  public SerialTransport(Transformation target, Executor executor, RivuletConfig config) {
    this(target, executor, config.getLong(RivuletConfig.TRANSPORT_DRAIN_TIMEOUT_MS));
  }

  @Override
  public void process(DatasetId id, Block block) {
    enqueue(TransportMessage.process(id, HeapBlock.copyOf(block)));
  }

  @Override
  public void retractBlock(DatasetId id, PartitionKey key) {
    enqueue(TransportMessage.retract(id, key));
  }

  @Override
  public void updateWatermark(DatasetId id, Time watermark) {
    enqueue(TransportMessage.watermark(id, watermark));
  }

  @Override
  public void updateProcessingTime(DatasetId id, Time time) {
    enqueue(TransportMessage.processingTime(id, time));
  }

  @Override
  public void finish(DatasetId id, Throwable error) {
    enqueue(TransportMessage.finish(id, error));
  }

  /**
   * Waits until the wrapped transformation has been finished.
   *
   * @return false if the timeout elapsed first
   */
  public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
    return finishedLatch.await(timeout, unit);
  }

  /**
   * Waits for completion for at most the configured drain timeout.
   */
  public boolean awaitFinished() throws InterruptedException {
    return awaitFinished(drainTimeoutMillis, TimeUnit.MILLISECONDS);
  }

  public boolean isFinished() {
    return finishedLatch.getCount() == 0;
  }

  /**
   * @return the error the wrapped transformation was finished with, or null
   */
  public Throwable getError() {
    return error;
  }

  private void enqueue(TransportMessage message) {
    executor.execute(() -> deliver(message));
  }

  private void deliver(TransportMessage message) {
    if (finished) {
      logger.debug("Dropping {}, transformation already finished", message);
      return;
    }
    try {
      message.deliver(target);
      if (message.getType() == TransportMessage.Type.FINISH) {
        markFinished(message.getError());
      }
    } catch (RuntimeException e) {
      logger.warn("Failed to deliver {}", message, e);
      if (message.getType() == TransportMessage.Type.FINISH) {
        markFinished(e);
        return;
      }
      try {
        target.finish(message.getSource(), e);
      } catch (RuntimeException suppressed) {
        e.addSuppressed(suppressed);
        logger.error("Failed to finish transformation after error", suppressed);
      }
      markFinished(e);
    }
  }

  private void markFinished(Throwable cause) {
    finished = true;
    error = cause;
    finishedLatch.countDown();
  }
}
