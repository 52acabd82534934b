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
 * Plain round-robin over a node's children in the order they were first created, with the
 * node's local queue taking one turn per rotation.
 */
public class RoundRobinState implements QueuingAlgorithm {

  @Override
  public void addChildNode(TreeNode parent, TreeNode child) {
    parent.putChild(child);
    parent.queueOrder().add(child.getName());
  }

  @Override
  public TreeNode dequeueSelectNode(TreeNode node) {
    node.incrementChildrenChecked();
    int position = node.getQueuePosition();
    if (position == TreeNode.LOCAL_QUEUE_INDEX) {
      return node;
    }
    return node.getChild(node.queueOrder().get(position));
  }

  @Override
  public void dequeueUpdateState(TreeNode node, TreeNode dequeuedFrom) {
    if (dequeuedFrom != node && dequeuedFrom.isEmpty()) {
      // Removal shifts the next child into the current slot; no need to advance.
      node.removeChild(dequeuedFrom.getName());
    } else {
      node.advanceQueuePosition();
    }
  }

  @Override
  public boolean checkedAllNodes(TreeNode node) {
    return node.getChildrenChecked() >= node.queueOrder().size() + 1;
  }
}
