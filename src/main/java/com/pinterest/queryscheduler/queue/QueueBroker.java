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

import com.pinterest.queryscheduler.ErrorCode;
import com.pinterest.queryscheduler.SchedulerException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Owns the request tree and the tenant-querier assignments and keeps them consistent with each
 * other. Requests are queued under {@code [tenant, additional dimensions...]}; the root level
 * picks tenants by shuffle shard, the tenant level picks query components by utilization, and
 * the component level is plain round-robin.
 *
 * Not thread-safe; {@link RequestQueue} serializes all calls.
 */
public class QueueBroker {

  private static final Logger LOG = LoggerFactory.getLogger(QueueBroker.class);

  /**
   * Shared tenant rotation position before any tenant has been served.
   */
  public static final int FIRST_TENANT_INDEX = TreeNode.LOCAL_QUEUE_INDEX;

  // The query component; one tree level below the tenant.
  private static final int MAX_ADDITIONAL_QUEUE_DIMENSIONS = 1;

  private final Tree tree;
  private final TenantQuerierAssignments tenantQuerierAssignments;
  private final ShuffleShardState shuffleShardState;
  private final QueryComponentUtilizationReserveConnections utilizationCheck;
  private final int maxTenantQueueSize;
  private final boolean additionalQueueDimensionsEnabled;

  public QueueBroker(int maxTenantQueueSize,
                     boolean additionalQueueDimensionsEnabled,
                     long querierForgetDelayMillis,
                     QueryComponentUtilization utilization) {
    Preconditions.checkArgument(maxTenantQueueSize > 0);
    this.maxTenantQueueSize = maxTenantQueueSize;
    this.additionalQueueDimensionsEnabled = additionalQueueDimensionsEnabled;
    this.tenantQuerierAssignments = new TenantQuerierAssignments(querierForgetDelayMillis);
    this.shuffleShardState = new ShuffleShardState(tenantQuerierAssignments);
    this.utilizationCheck = new QueryComponentUtilizationReserveConnections(utilization);
    this.tree = new Tree(
        shuffleShardState,                                                      // tenants
        new QueryComponentUtilizationDequeueSkipOverThreshold(utilizationCheck), // components
        new RoundRobinState());                                                 // requests
  }

  @VisibleForTesting
  QueueBroker(int maxTenantQueueSize,
              boolean additionalQueueDimensionsEnabled,
              long querierForgetDelayMillis) {
    this(maxTenantQueueSize, additionalQueueDimensionsEnabled, querierForgetDelayMillis,
        new QueryComponentUtilization(0));
  }

  public boolean isEmpty() {
    return tree.isEmpty();
  }

  public int itemCount() {
    return tree.itemCount();
  }

  public int getTenantItemCount(String tenantId) {
    TreeNode tenantNode = tree.getNode(QueuePath.of(tenantId));
    return tenantNode == null ? 0 : tenantNode.itemCount();
  }

  public int getConnectedQuerierWorkers() {
    return tenantQuerierAssignments.getConnectedQuerierWorkers();
  }

  @VisibleForTesting
  Tree getTree() {
    return tree;
  }

  @VisibleForTesting
  TenantQuerierAssignments getTenantQuerierAssignments() {
    return tenantQuerierAssignments;
  }

  /**
   * Queues a new request at the back of its tenant's queue. Tenants and their shuffle shards are
   * created or updated as needed.
   *
   * @throws SchedulerException with {@link ErrorCode#TOO_MANY_REQUESTS} if the tenant already has
   *                            the maximum number of requests queued.
   */
  public void enqueueRequestBack(TenantRequest request, int tenantMaxQueriers)
      throws SchedulerException {
    QueuePath queuePath = makeQueuePath(request);
    tenantQuerierAssignments.createOrUpdateTenant(request.getTenantId(), tenantMaxQueriers);

    TreeNode tenantNode = tree.getNode(queuePath.prefix(1));
    if (tenantNode != null && tenantNode.itemCount() + 1 > maxTenantQueueSize) {
      throw new SchedulerException(ErrorCode.TOO_MANY_REQUESTS,
          "too many outstanding requests for tenant " + request.getTenantId()
              + ", max " + maxTenantQueueSize);
    }
    tree.enqueueBackByPath(queuePath, request);
  }

  /**
   * Puts a previously dequeued request back at the front of its queue after it could not be
   * dispatched to a querier. The tenant queue size limit is not enforced.
   */
  public void enqueueRequestFront(TenantRequest request, int tenantMaxQueriers)
      throws SchedulerException {
    QueuePath queuePath = makeQueuePath(request);
    tenantQuerierAssignments.createOrUpdateTenant(request.getTenantId(), tenantMaxQueriers);
    tree.enqueueFrontByPath(queuePath, request);
  }

  public DequeueResult dequeueRequestForQuerier(String querierId) throws SchedulerException {
    return dequeueRequestForQuerier(querierId, 0);
  }

  /**
   * Dequeues the next request the querier may serve. All queriers continue one tenant rotation,
   * so consecutive dequeues move on to the next tenant whichever querier asks. The result is empty
   * if there is nothing the querier is eligible for.
   *
   * @param waitingQuerierWorkers querier workers currently waiting for a request, used to decide
   *                              whether capacity needs reserving for other query components.
   * @throws SchedulerException with {@link ErrorCode#QUERIER_SHUTTING_DOWN} if the querier is
   *                            unknown, shutting down, or has no open connection.
   */
  public DequeueResult dequeueRequestForQuerier(String querierId, int waitingQuerierWorkers)
      throws SchedulerException {
    QuerierConnection querier = tenantQuerierAssignments.getQuerier(querierId);
    if (querier == null || querier.isShuttingDown() || querier.getConnections() == 0) {
      throw new SchedulerException(ErrorCode.QUERIER_SHUTTING_DOWN,
          "querier " + querierId + " is not connected or shutting down");
    }

    shuffleShardState.setCurrentQuerier(querierId);
    utilizationCheck.update(
        tenantQuerierAssignments.getConnectedQuerierWorkers(), waitingQuerierWorkers, itemCount());

    DequeuedItem dequeued = tree.dequeue();
    if (dequeued.getItem() == null) {
      return DequeueResult.empty(shuffleShardState.getSharedQueuePosition());
    }

    String tenantId = dequeued.getPath().get(0);
    QueueTenant tenant = tenantQuerierAssignments.getTenant(tenantId);
    Preconditions.checkState(tenant != null,
        "dequeued from path %s but tenant %s is not registered", dequeued.getPath(), tenantId);

    if (tree.getNode(QueuePath.of(tenantId)) == null) {
      // The tenant's queue was pruned after becoming empty.
      tenantQuerierAssignments.removeTenant(tenantId);
    }

    LOG.debug("Dequeued request from {} for querier {}", dequeued.getPath(), querierId);
    return new DequeueResult((TenantRequest) dequeued.getItem(), tenant,
        shuffleShardState.getSharedQueuePosition());
  }

  public boolean addQuerierConnection(String querierId) {
    return tenantQuerierAssignments.addQuerierConnection(querierId);
  }

  public boolean removeQuerierConnection(String querierId, long nowMillis) {
    return tenantQuerierAssignments.removeQuerierConnection(querierId, nowMillis);
  }

  /**
   * Open connections of the querier, or zero if it is not known.
   */
  public int getQuerierConnections(String querierId) {
    QuerierConnection querier = tenantQuerierAssignments.getQuerier(querierId);
    return querier == null ? 0 : querier.getConnections();
  }

  public boolean notifyQuerierShutdown(String querierId) {
    return tenantQuerierAssignments.notifyQuerierShutdown(querierId);
  }

  public boolean forgetDisconnectedQueriers(long nowMillis) {
    return tenantQuerierAssignments.forgetDisconnectedQueriers(nowMillis);
  }

  private QueuePath makeQueuePath(TenantRequest request) throws SchedulerException {
    if (Strings.isNullOrEmpty(request.getTenantId())) {
      throw new SchedulerException(ErrorCode.INVALID_TENANT_ID, "tenant ID must not be empty");
    }
    QueuePath tenantPath = QueuePath.of(request.getTenantId());
    if (additionalQueueDimensionsEnabled && request.getRequest() instanceof SchedulerRequest) {
      List<String> dimensions =
          ((SchedulerRequest) request.getRequest()).getAdditionalQueueDimensions();
      Preconditions.checkArgument(dimensions.size() <= MAX_ADDITIONAL_QUEUE_DIMENSIONS,
          "at most %s additional queue dimensions supported, got %s",
          MAX_ADDITIONAL_QUEUE_DIMENSIONS, dimensions);
      return tenantPath.append(dimensions);
    }
    return tenantPath;
  }
}
