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

/**
 * Node selection policy for one depth of a {@link Tree}. Every node at that depth delegates to
 * the same instance; rotation order and cursor live on the {@link TreeNode} itself so that one
 * instance can serve any number of sibling nodes.
 *
 * A dequeue at a node resets the node's per-pass state, then repeatedly calls
 * {@link #dequeueSelectNode} until an item is found or {@link #checkedAllNodes} returns true.
 * After each selection that was acted on, {@link #dequeueUpdateState} is invoked.
 */
public interface QueuingAlgorithm {

  /**
   * Registers a newly created child with its parent and places it in the parent's rotation.
   */
  void addChildNode(TreeNode parent, TreeNode child);

  /**
   * Picks what to dequeue from next: the node itself (its local queue), one of its children, or
   * null if nothing should be dequeued on this attempt.
   */
  TreeNode dequeueSelectNode(TreeNode node);

  /**
   * Updates rotation state after an attempt to dequeue from {@code dequeuedFrom}, pruning it
   * from {@code node} if it is now empty.
   */
  void dequeueUpdateState(TreeNode node, TreeNode dequeuedFrom);

  /**
   * Whether every candidate under {@code node} has been considered in the current pass.
   */
  boolean checkedAllNodes(TreeNode node);
}
