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
 * Utilization check that keeps a minimum number of querier-worker connections free for the
 * other query component whenever querier workers are contended.
 *
 * The worker and queue counts are a snapshot refreshed by the {@link QueueBroker} before every
 * dequeue.
 */
public class QueryComponentUtilizationReserveConnections implements QueryComponentUtilizationCheck {

  private final QueryComponentUtilization utilization;
  private int connectedWorkers;
  private int waitingWorkers;
  private int queueLen;

  public QueryComponentUtilizationReserveConnections(QueryComponentUtilization utilization) {
    this.utilization = Preconditions.checkNotNull(utilization);
  }

  public void update(int connectedWorkers, int waitingWorkers, int queueLen) {
    this.connectedWorkers = connectedWorkers;
    this.waitingWorkers = waitingWorkers;
    this.queueLen = queueLen;
  }

  public QueryComponentUtilization getUtilization() {
    return utilization;
  }

  @Override
  public boolean triggerUtilizationCheck() {
    // More waiting workers than queued requests: there is spare capacity, nothing to reserve.
    return waitingWorkers <= queueLen;
  }

  @Override
  public ThresholdResult exceedsThresholdForComponentName(String name) {
    if (connectedWorkers <= 1) {
      // Cannot reserve capacity with a single worker.
      return ThresholdResult.WITHIN_THRESHOLD;
    }
    double targetReservedCapacity = utilization.getTargetReservedCapacity();
    if (targetReservedCapacity == 0) {
      return ThresholdResult.WITHIN_THRESHOLD;
    }

    // Reserve at least one connection even when capacity * workers rounds below one.
    int minReservedConnections =
        (int) Math.ceil(Math.max(targetReservedCapacity * connectedWorkers, 1));

    if (QueryComponent.INGESTER.matches(name)
        && connectedWorkers - utilization.getForComponent(QueryComponent.INGESTER)
        <= minReservedConnections) {
      return new ThresholdResult(true, QueryComponent.INGESTER);
    }
    if (QueryComponent.STORE_GATEWAY.matches(name)
        && connectedWorkers - utilization.getForComponent(QueryComponent.STORE_GATEWAY)
        <= minReservedConnections) {
      return new ThresholdResult(true, QueryComponent.STORE_GATEWAY);
    }
    return ThresholdResult.WITHIN_THRESHOLD;
  }
}
