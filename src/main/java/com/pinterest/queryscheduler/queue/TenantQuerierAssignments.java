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
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Keeps track of connected queriers and of which queriers each tenant is shuffle-sharded to.
 *
 * A tenant with max queriers of zero (or at least as many as there are eligible queriers) can be
 * served by any querier. Otherwise the tenant gets a pseudo-random subset of the eligible
 * queriers, seeded by its tenant ID, so the same tenant maps to the same queriers as long as the
 * querier population does not change. Queriers that announced shutdown are not eligible.
 *
 * Not thread-safe; callers serialize access through {@link RequestQueue}.
 */
public class TenantQuerierAssignments {

  private static final Logger LOG = LoggerFactory.getLogger(TenantQuerierAssignments.class);

  private final long querierForgetDelayMillis;
  private final Map<String, QuerierConnection> queriersById = Maps.newHashMap();
  private final Map<String, QueueTenant> tenantsById = Maps.newHashMap();
  // Sorted IDs of the queriers shards are drawn from.
  private ImmutableList<String> eligibleQuerierIds = ImmutableList.of();

  public TenantQuerierAssignments(long querierForgetDelayMillis) {
    Preconditions.checkArgument(querierForgetDelayMillis >= 0);
    this.querierForgetDelayMillis = querierForgetDelayMillis;
  }

  /**
   * Registers the tenant if it is not known yet, and reshards it if its max queriers changed.
   * Negative max queriers is treated as zero, which disables shuffle sharding for the tenant.
   */
  public QueueTenant createOrUpdateTenant(String tenantId, int maxQueriers)
      throws SchedulerException {
    if (Strings.isNullOrEmpty(tenantId)) {
      throw new SchedulerException(ErrorCode.INVALID_TENANT_ID, "tenant ID must not be empty");
    }
    if (maxQueriers < 0) {
      maxQueriers = 0;
    }

    QueueTenant tenant = tenantsById.get(tenantId);
    if (tenant == null) {
      tenant = new QueueTenant(tenantId);
      tenantsById.put(tenantId, tenant);
    }
    if (tenant.getMaxQueriers() != maxQueriers) {
      tenant.setMaxQueriers(maxQueriers);
      shuffleTenantQueriers(tenant);
    }
    return tenant;
  }

  public void removeTenant(String tenantId) {
    if (tenantsById.remove(tenantId) != null) {
      LOG.debug("Removed tenant {} with no queued requests", tenantId);
    }
  }

  public QueueTenant getTenant(String tenantId) {
    return tenantsById.get(tenantId);
  }

  public QuerierConnection getQuerier(String querierId) {
    return queriersById.get(querierId);
  }

  /**
   * Whether the querier may serve requests of the tenant. Unknown tenants are never eligible.
   */
  public boolean isQuerierEligible(String tenantId, String querierId) {
    QueueTenant tenant = tenantsById.get(tenantId);
    if (tenant == null) {
      return false;
    }
    ImmutableSet<String> querierIds = tenant.getQuerierIds();
    return querierIds == null || querierIds.contains(querierId);
  }

  /**
   * Returns the queriers the tenant is sharded to, every eligible querier if the tenant is not
   * sharded, or an empty set for an unknown tenant.
   */
  public ImmutableSet<String> getQuerierIdsForTenant(String tenantId) {
    QueueTenant tenant = tenantsById.get(tenantId);
    if (tenant == null) {
      return ImmutableSet.of();
    }
    return tenant.getQuerierIds() == null
           ? ImmutableSet.copyOf(eligibleQuerierIds)
           : tenant.getQuerierIds();
  }

  /**
   * Total number of open querier connections, each of which is one querier worker.
   */
  public int getConnectedQuerierWorkers() {
    int workers = 0;
    for (QuerierConnection querier : queriersById.values()) {
      workers += querier.getConnections();
    }
    return workers;
  }

  @VisibleForTesting
  ImmutableList<String> getEligibleQuerierIds() {
    return eligibleQuerierIds;
  }

  /**
   * Registers a new connection from the querier. Reshards tenants if the querier was not known
   * before or had announced shutdown, since the eligible pool grows.
   *
   * @return whether any tenant's querier assignment changed.
   */
  public boolean addQuerierConnection(String querierId) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(querierId));
    QuerierConnection querier = queriersById.get(querierId);
    if (querier == null) {
      querier = new QuerierConnection(querierId);
      querier.connect();
      queriersById.put(querierId, querier);
      LOG.info("Querier {} connected", querierId);
      return recomputeTenantQueriers();
    }

    querier.connect();
    if (querier.isShuttingDown()) {
      // Reconnected after announcing shutdown; it is eligible again.
      querier.setShuttingDown(false);
      LOG.info("Querier {} reconnected after shutdown notification", querierId);
      return recomputeTenantQueriers();
    }
    return false;
  }

  /**
   * Unregisters one connection of the querier. When the last connection goes away the querier is
   * removed right away if it announced shutdown or no forget delay is configured; otherwise it is
   * kept in its shards until the forget delay expires.
   *
   * @return whether any tenant's querier assignment changed.
   */
  public boolean removeQuerierConnection(String querierId, long nowMillis) {
    QuerierConnection querier = queriersById.get(querierId);
    Preconditions.checkState(querier != null, "unknown querier %s", querierId);
    querier.disconnect(nowMillis);
    if (querier.getConnections() > 0) {
      return false;
    }

    if (querier.isShuttingDown() || querierForgetDelayMillis == 0) {
      return removeQueriers(ImmutableList.of(querierId));
    }
    LOG.info("Querier {} has no connections left, forgetting it in {} ms unless it reconnects",
        querierId, querierForgetDelayMillis);
    return false;
  }

  /**
   * Marks the querier as shutting down: it is excluded from shuffle shards at once, and removed
   * entirely when it has no open connections.
   *
   * @return whether any tenant's querier assignment changed.
   */
  public boolean notifyQuerierShutdown(String querierId) {
    QuerierConnection querier = queriersById.get(querierId);
    if (querier == null) {
      // May already have been removed.
      return false;
    }
    LOG.info("Querier {} notified shutdown", querierId);
    if (querier.getConnections() == 0) {
      return removeQueriers(ImmutableList.of(querierId));
    }
    if (querier.isShuttingDown()) {
      return false;
    }
    querier.setShuttingDown(true);
    return recomputeTenantQueriers();
  }

  /**
   * Removes queriers with no connections that disconnected at least the forget delay ago.
   * Does nothing when no forget delay is configured, since removal then happens on disconnect.
   *
   * @return whether any tenant's querier assignment changed.
   */
  public boolean forgetDisconnectedQueriers(long nowMillis) {
    if (querierForgetDelayMillis == 0) {
      return false;
    }

    long threshold = nowMillis - querierForgetDelayMillis;
    List<String> queriersToForget = Lists.newArrayList();
    for (QuerierConnection querier : queriersById.values()) {
      if (querier.getConnections() == 0 && querier.getDisconnectedAtMillis() <= threshold) {
        queriersToForget.add(querier.getQuerierId());
      }
    }
    if (queriersToForget.isEmpty()) {
      return false;
    }
    LOG.info("Forgetting disconnected queriers: {}", queriersToForget);
    return removeQueriers(queriersToForget);
  }

  private boolean removeQueriers(List<String> querierIds) {
    for (String querierId : querierIds) {
      queriersById.remove(querierId);
    }
    return recomputeTenantQueriers();
  }

  private boolean recomputeTenantQueriers() {
    List<String> sorted = Lists.newArrayList();
    for (QuerierConnection querier : queriersById.values()) {
      if (!querier.isShuttingDown()) {
        sorted.add(querier.getQuerierId());
      }
    }
    Collections.sort(sorted);
    eligibleQuerierIds = ImmutableList.copyOf(sorted);

    boolean resharded = false;
    for (QueueTenant tenant : tenantsById.values()) {
      resharded |= shuffleTenantQueriers(tenant);
    }
    if (resharded) {
      LOG.info("Resharded tenants over {} eligible queriers", eligibleQuerierIds.size());
    }
    return resharded;
  }

  /**
   * Recomputes the tenant's querier subset from the current eligible pool.
   *
   * @return whether the tenant's assignment changed.
   */
  private boolean shuffleTenantQueriers(QueueTenant tenant) {
    ImmutableSet<String> previous = tenant.getQuerierIds();
    int maxQueriers = tenant.getMaxQueriers();
    if (maxQueriers <= 0 || eligibleQuerierIds.size() <= maxQueriers) {
      tenant.setQuerierIds(null);
      return previous != null;
    }

    List<String> scratchpad = Lists.newArrayList(eligibleQuerierIds);
    Random random = new Random(tenant.getShuffleShardSeed());
    ImmutableSet.Builder<String> selected = ImmutableSet.builder();
    for (int i = 0; i < maxQueriers; i++) {
      int r = random.nextInt(scratchpad.size());
      selected.add(scratchpad.get(r));
      scratchpad.set(r, scratchpad.get(scratchpad.size() - 1));
      scratchpad.remove(scratchpad.size() - 1);
    }
    ImmutableSet<String> querierIds = selected.build();
    tenant.setQuerierIds(querierIds);
    return !Objects.equal(previous, querierIds);
  }
}
