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

import java.util.List;

/**
 * Tenant selection for the root of the request tree. Rotates over tenants in the order they
 * were first enqueued, skipping (without removing) tenants the current querier is not shuffle
 * sharded to.
 *
 * The rotation cursor is shared scheduling state rather than per-node state. One instance serves
 * every querier, so consecutive dequeues from different queriers continue the same rotation.
 */
public class ShuffleShardState implements QueuingAlgorithm {

  private final TenantQuerierAssignments tenantQuerierAssignments;
  private String currentQuerier;
  private int sharedQueuePosition = TreeNode.LOCAL_QUEUE_INDEX;

  public ShuffleShardState(TenantQuerierAssignments tenantQuerierAssignments) {
    this.tenantQuerierAssignments = Preconditions.checkNotNull(tenantQuerierAssignments);
  }

  public void setCurrentQuerier(String currentQuerier) {
    this.currentQuerier = currentQuerier;
  }

  public int getSharedQueuePosition() {
    return sharedQueuePosition;
  }

  @Override
  public void addChildNode(TreeNode parent, TreeNode child) {
    parent.putChild(child);
    parent.queueOrder().add(child.getName());
  }

  /**
   * Scans every tenant once, starting right after the shared position. Either returns the first
   * tenant eligible for the current querier, or null when there is none.
   */
  @Override
  public TreeNode dequeueSelectNode(TreeNode node) {
    node.incrementChildrenChecked();
    if (currentQuerier == null) {
      return null;
    }

    List<String> tenantOrder = node.queueOrder();
    int checkIndex = sharedQueuePosition;
    for (int iters = 0; iters < tenantOrder.size(); iters++) {
      checkIndex++;
      if (checkIndex < 0 || checkIndex >= tenantOrder.size()) {
        checkIndex = 0;
      }
      String tenantId = tenantOrder.get(checkIndex);
      if (tenantQuerierAssignments.isQuerierEligible(tenantId, currentQuerier)) {
        sharedQueuePosition = checkIndex;
        return node.getChild(tenantId);
      }
    }
    return null;
  }

  @Override
  public void dequeueUpdateState(TreeNode node, TreeNode dequeuedFrom) {
    if (dequeuedFrom != node && dequeuedFrom.isEmpty()) {
      int removedIndex = node.removeChild(dequeuedFrom.getName());
      if (removedIndex >= 0 && removedIndex <= sharedQueuePosition) {
        // The next tenant shifted down by one; step back so the next dequeue lands on it.
        sharedQueuePosition--;
      }
    }
  }

  @Override
  public boolean checkedAllNodes(TreeNode node) {
    return node.getChildrenChecked() >= 1;
  }
}
