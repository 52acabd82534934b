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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Round-robin over query component nodes that passes over, for now, any node whose component is
 * using querier workers beyond its reserved-capacity threshold.
 *
 * <p>Skipped node names are remembered in order. If a whole rotation pass yields nothing from the
 * nodes that were not skipped, the skipped nodes are drained first-skipped-first, so a dequeue
 * still makes progress when every component is over its threshold.
 *
 * <p>New nodes are inserted directly behind the cursor rather than at the end of the rotation:
 * a node that just received its first item is serviced within the current pass, and cannot
 * repeatedly jump ahead of nodes already waiting.
 */
public class QueryComponentUtilizationDequeueSkipOverThreshold implements QueuingAlgorithm {

  private static final Logger LOG =
      LoggerFactory.getLogger(QueryComponentUtilizationDequeueSkipOverThreshold.class);

  private final QueryComponentUtilizationCheck utilizationCheck;

  public QueryComponentUtilizationDequeueSkipOverThreshold(
      QueryComponentUtilizationCheck utilizationCheck) {
    this.utilizationCheck = Preconditions.checkNotNull(utilizationCheck);
  }

  @Override
  public void addChildNode(TreeNode parent, TreeNode child) {
    parent.putChild(child);
    int position = parent.getQueuePosition();
    if (position == TreeNode.LOCAL_QUEUE_INDEX) {
      // The last slot before the local queue.
      parent.queueOrder().add(child.getName());
    } else {
      parent.queueOrder().add(position, child.getName());
      parent.setQueuePosition(position + 1);
    }
  }

  @Override
  public TreeNode dequeueSelectNode(TreeNode node) {
    if (completedFirstPass(node)) {
      // Nothing was dequeued from the nodes under threshold; fall back to the skipped ones.
      String skippedName = node.skippedOrder().pollFirst();
      return skippedName == null ? null : node.getChild(skippedName);
    }

    node.incrementChildrenChecked();
    int position = node.getQueuePosition();
    if (position == TreeNode.LOCAL_QUEUE_INDEX) {
      return node;
    }

    String currentNodeName = node.queueOrder().get(position);
    if (utilizationCheck.triggerUtilizationCheck()) {
      QueryComponentUtilizationCheck.ThresholdResult result =
          utilizationCheck.exceedsThresholdForComponentName(currentNodeName);
      if (result.exceedsThreshold()) {
        LOG.debug("Skipping queue node {}: {} over reserved capacity threshold",
            currentNodeName, result.getComponent());
        node.skippedOrder().addLast(currentNodeName);
        node.advanceQueuePosition();
        return null;
      }
    }
    return node.getChild(currentNodeName);
  }

  @Override
  public void dequeueUpdateState(TreeNode node, TreeNode dequeuedFrom) {
    if (dequeuedFrom != node && dequeuedFrom.isEmpty()) {
      node.removeChild(dequeuedFrom.getName());
    } else if (dequeuedFrom == node || isAtCursor(node, dequeuedFrom)) {
      node.advanceQueuePosition();
    }
    // A node drained from the skipped list is off-cursor; the rotation stays where it was.
  }

  @Override
  public boolean checkedAllNodes(TreeNode node) {
    return completedFirstPass(node) && node.skippedOrder().isEmpty();
  }

  private static boolean completedFirstPass(TreeNode node) {
    // Every child plus the local queue.
    return node.getChildrenChecked() >= node.queueOrder().size() + 1;
  }

  private static boolean isAtCursor(TreeNode node, TreeNode child) {
    int position = node.getQueuePosition();
    return position != TreeNode.LOCAL_QUEUE_INDEX
        && node.queueOrder().get(position).equals(child.getName());
  }
}
