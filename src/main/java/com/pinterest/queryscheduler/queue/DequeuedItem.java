/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.pinterest.queryscheduler.queue;

import com.google.common.base.Preconditions;

/**
 * Result of a {@link Tree} dequeue: the path of the node the item came from and the item itself.
 * When nothing could be dequeued the path is empty and the item is null.
 */
public class DequeuedItem {

  static final DequeuedItem EMPTY = new DequeuedItem(QueuePath.empty(), null);

  private final QueuePath path;
  private final Object item;

  DequeuedItem(QueuePath path, Object item) {
    this.path = Preconditions.checkNotNull(path);
    this.item = item;
  }

  public QueuePath getPath() {
    return path;
  }

  public Object getItem() {
    return item;
  }

  @Override
  public String toString() {
    return "DequeuedItem{path=" + path + ", item=" + item + "}";
  }
}
