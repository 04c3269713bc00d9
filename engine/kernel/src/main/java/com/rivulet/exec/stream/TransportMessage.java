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

import com.rivulet.exec.record.HeapBlock;
import com.rivulet.exec.record.PartitionKey;
import com.rivulet.exec.record.Time;

/**
 * A queued call to a transformation, tagged with its type.
 */
abstract class TransportMessage {

  enum Type {
    PROCESS, RETRACT, WATERMARK, PROCESSING_TIME, FINISH
  }

  private final Type type;
  private final DatasetId source;

  private TransportMessage(Type type, DatasetId source) {
    this.type = type;
    this.source = source;
  }

  Type getType() {
    return type;
  }

  DatasetId getSource() {
    return source;
  }

  abstract void deliver(Transformation target);

  /**
   * @return the error carried by a finish message, null for any other message
   */
  Throwable getError() {
    return null;
  }

  @Override
  public String toString() {
    return type + " from " + source;
  }

  static TransportMessage process(DatasetId source, HeapBlock block) {
    return new TransportMessage(Type.PROCESS, source) {
      @Override
      void deliver(Transformation target) {
        target.process(source, block);
      }
    };
  }

  static TransportMessage retract(DatasetId source, PartitionKey key) {
    return new TransportMessage(Type.RETRACT, source) {
      @Override
      void deliver(Transformation target) {
        target.retractBlock(source, key);
      }
    };
  }

  static TransportMessage watermark(DatasetId source, Time watermark) {
    return new TransportMessage(Type.WATERMARK, source) {
      @Override
      void deliver(Transformation target) {
        target.updateWatermark(source, watermark);
      }
    };
  }

  static TransportMessage processingTime(DatasetId source, Time time) {
    return new TransportMessage(Type.PROCESSING_TIME, source) {
      @Override
      void deliver(Transformation target) {
        target.updateProcessingTime(source, time);
      }
    };
  }

  static TransportMessage finish(DatasetId source, Throwable error) {
    return new TransportMessage(Type.FINISH, source) {
      @Override
      void deliver(Transformation target) {
        target.finish(source, error);
      }

      @Override
      Throwable getError() {
        return error;
      }
    };
  }
}
