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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of node names addressing a node in a {@link Tree}, starting below the root.
 * The first segment of a request path is always the tenant ID.
 */
public final class QueuePath implements Iterable<String> {

  private static final QueuePath EMPTY = new QueuePath(ImmutableList.<String>of());

  private final ImmutableList<String> segments;

  private QueuePath(ImmutableList<String> segments) {
    this.segments = segments;
  }

  public static QueuePath empty() {
    return EMPTY;
  }

  public static QueuePath of(String... segments) {
    return of(ImmutableList.copyOf(segments));
  }

  public static QueuePath of(List<String> segments) {
    for (String segment : segments) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(segment),
          "queue path segments must not be empty: %s", segments);
    }
    return new QueuePath(ImmutableList.copyOf(segments));
  }

  /**
   * Returns a new path with the given segments appended to this one.
   */
  public QueuePath append(List<String> more) {
    return of(ImmutableList.<String>builder().addAll(segments).addAll(more).build());
  }

  /**
   * Returns a new path with the given segment prepended to this one.
   */
  public QueuePath prepend(String segment) {
    return of(ImmutableList.<String>builder().add(segment).addAll(segments).build());
  }

  public QueuePath prefix(int length) {
    Preconditions.checkArgument(length >= 0 && length <= segments.size());
    return new QueuePath(segments.subList(0, length));
  }

  public String get(int index) {
    return segments.get(index);
  }

  public int size() {
    return segments.size();
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public List<String> asList() {
    return segments;
  }

  @Override
  public Iterator<String> iterator() {
    return segments.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueuePath)) {
      return false;
    }
    return segments.equals(((QueuePath) o).segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return "[" + Joiner.on('/').join(segments) + "]";
  }
}
