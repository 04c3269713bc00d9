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
import com.google.common.base.Strings;

/**
 * Identifies the dataset a signal comes from, so that a transformation with several parents can
 * tell them apart.
 */
public final class DatasetId {
  private final String id;

  private DatasetId(String id) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "dataset id must not be empty");
    this.id = id;
  }

  public static DatasetId of(String id) {
    return new DatasetId(id);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DatasetId && id.equals(((DatasetId) o).id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
