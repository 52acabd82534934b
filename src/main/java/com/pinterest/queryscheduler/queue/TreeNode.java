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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * A node of the request {@link Tree}. Each node owns a local FIFO of items and the child nodes
 * registered under it by name. The rotation order over child names and the cursor into it are
 * maintained by the {@link QueuingAlgorithm} governing this node's depth.
 *
 * Not thread-safe; callers serialize access through {@link RequestQueue}.
 */
public class TreeNode {

  /**
   * Cursor value selecting the node's own local queue instead of a child.
   */
  public static final int LOCAL_QUEUE_INDEX = -1;

  private final String name;
  private final int depth;
  private final QueuingAlgorithm queuingAlgorithm;
  private final Deque<Object> localQueue = new ArrayDeque<Object>();
  private final Map<String, TreeNode> queueMap = Maps.newHashMap();

  // Rotation state, owned by queuingAlgorithm.
  private final List<String> queueOrder = Lists.newArrayList();
  private final Deque<String> skippedOrder = new ArrayDeque<String>();
  private int queuePosition = LOCAL_QUEUE_INDEX;
  private int childrenChecked;

  TreeNode(String name, int depth, QueuingAlgorithm queuingAlgorithm) {
    this.name = Preconditions.checkNotNull(name);
    this.depth = depth;
    this.queuingAlgorithm = Preconditions.checkNotNull(queuingAlgorithm);
  }

  public String getName() {
    return name;
  }

  public int getDepth() {
    return depth;
  }

  /**
   * A node is empty when it has nothing in its local queue and no child nodes. Empty children are
   * pruned on dequeue, so this also means the subtree holds no items.
   */
  public boolean isEmpty() {
    return localQueue.isEmpty() && queueMap.isEmpty();
  }

  /**
   * Counts the items in this node's local queue and, recursively, in all of its children.
   */
  public int itemCount() {
    int items = localQueue.size();
    for (TreeNode child : queueMap.values()) {
      items += child.itemCount();
    }
    return items;
  }

  public TreeNode getChild(String childName) {
    return queueMap.get(childName);
  }

  /**
   * Returns the node at {@code path} relative to this node, or null if no such node exists.
   */
  public TreeNode getNode(QueuePath path) {
    TreeNode node = this;
    for (String segment : path) {
      node = node.queueMap.get(segment);
      if (node == null) {
        return null;
      }
    }
    return node;
  }

  @VisibleForTesting
  public List<String> getQueueOrderSnapshot() {
    return ImmutableList.copyOf(queueOrder);
  }

  @VisibleForTesting
  public int getLocalQueueSize() {
    return localQueue.size();
  }

  void enqueueBack(Object item) {
    localQueue.addLast(item);
  }

  void enqueueFront(Object item) {
    localQueue.addFirst(item);
  }

  QueuingAlgorithm getQueuingAlgorithm() {
    return queuingAlgorithm;
  }

  /**
   * Dequeues one item from this subtree. The returned path is relative to this node, so an item
   * taken from the local queue comes back with an empty path.
   */
  DequeuedItem dequeue() {
    if (isEmpty()) {
      return DequeuedItem.EMPTY;
    }

    resetDequeueState();
    Object item = null;
    QueuePath path = QueuePath.empty();
    while (item == null && !queuingAlgorithm.checkedAllNodes(this)) {
      TreeNode selected = queuingAlgorithm.dequeueSelectNode(this);
      if (selected == null) {
        // Skipped over on this attempt; the algorithm has already advanced.
        continue;
      }

      if (selected == this) {
        item = localQueue.pollFirst();
      } else {
        DequeuedItem fromChild = selected.dequeue();
        item = fromChild.getItem();
        if (item != null) {
          path = fromChild.getPath().prepend(selected.getName());
        }
      }
      queuingAlgorithm.dequeueUpdateState(this, selected);
    }

    return item == null ? DequeuedItem.EMPTY : new DequeuedItem(path, item);
  }

  // Rotation helpers used by the QueuingAlgorithm implementations.

  void putChild(TreeNode child) {
    Preconditions.checkState(!queueMap.containsKey(child.getName()),
        "child %s already registered under %s", child.getName(), name);
    queueMap.put(child.getName(), child);
  }

  List<String> queueOrder() {
    return queueOrder;
  }

  Deque<String> skippedOrder() {
    return skippedOrder;
  }

  int getQueuePosition() {
    return queuePosition;
  }

  void setQueuePosition(int queuePosition) {
    this.queuePosition = queuePosition;
  }

  int getChildrenChecked() {
    return childrenChecked;
  }

  void incrementChildrenChecked() {
    childrenChecked++;
  }

  /**
   * Moves the cursor to the next child, wrapping to the local queue past the last one, and from
   * the local queue to the first child.
   */
  void advanceQueuePosition() {
    queuePosition++;
    if (queuePosition >= queueOrder.size()) {
      queuePosition = LOCAL_QUEUE_INDEX;
    }
  }

  /**
   * Removes a child from the map, the rotation order and the skipped list. The cursor keeps
   * pointing at the same logical position: if the removed child was at the cursor, the next
   * child has shifted into its slot.
   *
   * @return the index the child held in the rotation order, or -1 if it was not in it.
   */
  int removeChild(String childName) {
    queueMap.remove(childName);
    skippedOrder.remove(childName);
    int index = queueOrder.indexOf(childName);
    if (index >= 0) {
      queueOrder.remove(index);
      if (index < queuePosition) {
        queuePosition--;
      }
      if (queuePosition >= queueOrder.size()) {
        queuePosition = LOCAL_QUEUE_INDEX;
      }
    }
    return index;
  }

  private void resetDequeueState() {
    childrenChecked = 0;
    skippedOrder.clear();
  }

  @Override
  public String toString() {
    return "TreeNode{name=" + name + ", depth=" + depth + ", localItems=" + localQueue.size()
        + ", children=" + queueOrder + ", position=" + queuePosition + "}";
  }
}
