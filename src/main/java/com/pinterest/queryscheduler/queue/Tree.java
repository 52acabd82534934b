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
import com.google.common.collect.ImmutableList;

/**
 * Hierarchical queue of items addressed by {@link QueuePath}. Nodes are created lazily on
 * enqueue and pruned as soon as a dequeue leaves them empty. Each depth of the tree has its own
 * {@link QueuingAlgorithm}: the root node uses the first one, its children the second, and so on,
 * which also bounds the length of an enqueue path.
 *
 * Not thread-safe.
 */
public class Tree {

  static final String ROOT_NAME = "root";

  private final ImmutableList<QueuingAlgorithm> algosByDepth;
  private final TreeNode rootNode;
  private int itemCount;

  public Tree(QueuingAlgorithm... algosByDepth) {
    Preconditions.checkArgument(algosByDepth.length > 0,
        "at least one queuing algorithm is required");
    this.algosByDepth = ImmutableList.copyOf(algosByDepth);
    this.rootNode = new TreeNode(ROOT_NAME, 0, this.algosByDepth.get(0));
  }

  public void enqueueBackByPath(QueuePath path, Object item) {
    findOrCreateNode(path, item).enqueueBack(item);
    itemCount++;
  }

  /**
   * Places the item ahead of everything else pending at the node addressed by {@code path}.
   * Only meant for putting back an item that was dequeued but could not be dispatched.
   */
  public void enqueueFrontByPath(QueuePath path, Object item) {
    findOrCreateNode(path, item).enqueueFront(item);
    itemCount++;
  }

  /**
   * Dequeues the next item according to the per-depth queuing algorithms. The returned path is
   * relative to the root. Returns an empty path and a null item if nothing could be dequeued.
   */
  public DequeuedItem dequeue() {
    DequeuedItem dequeued = rootNode.dequeue();
    if (dequeued.getItem() != null) {
      itemCount--;
    }
    return dequeued;
  }

  /**
   * Returns the node at {@code path} below the root, the root itself for an empty path, or null.
   */
  public TreeNode getNode(QueuePath path) {
    return rootNode.getNode(path);
  }

  public TreeNode getRootNode() {
    return rootNode;
  }

  public boolean isEmpty() {
    return rootNode.isEmpty();
  }

  public int itemCount() {
    return itemCount;
  }

  private TreeNode findOrCreateNode(QueuePath path, Object item) {
    Preconditions.checkNotNull(item);
    Preconditions.checkArgument(path.size() < algosByDepth.size(),
        "path %s exceeds max tree depth %s", path, algosByDepth.size() - 1);

    TreeNode node = rootNode;
    for (String name : path) {
      TreeNode child = node.getChild(name);
      if (child == null) {
        int childDepth = node.getDepth() + 1;
        child = new TreeNode(name, childDepth, algosByDepth.get(childDepth));
        node.getQueuingAlgorithm().addChildNode(node, child);
      }
      node = child;
    }
    return node;
  }
}
