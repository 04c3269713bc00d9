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
package com.rivulet.exec.record;

import com.google.common.math.LongMath;
import java.time.Instant;

/**
 * A point in time with nanosecond precision, counted from the epoch.
 */
public final class Time implements Comparable<Time> {

  public static final Time MIN_VALUE = new Time(Long.MIN_VALUE);
  public static final Time MAX_VALUE = new Time(Long.MAX_VALUE);

  private final long nanos;

  private Time(long nanos) {
    this.nanos = nanos;
  }

  public static Time ofNanos(long nanos) {
    return new Time(nanos);
  }

  public static Time ofSeconds(long seconds) {
    return new Time(LongMath.saturatedMultiply(seconds, 1_000_000_000L));
  }

  public long getNanos() {
    return nanos;
  }

  /**
   * Adds a duration, saturating at the representable bounds.
   */
  public Time plusNanos(long duration) {
    return new Time(LongMath.saturatedAdd(nanos, duration));
  }

  @Override
  public int compareTo(Time o) {
    return Long.compare(nanos, o.nanos);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Time && nanos == ((Time) o).nanos;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(nanos);
  }

  @Override
  public String toString() {
    if (nanos == Long.MIN_VALUE || nanos == Long.MAX_VALUE) {
      return nanos == Long.MIN_VALUE ? "-inf" : "+inf";
    }
    return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L))
        .toString();
  }
}
