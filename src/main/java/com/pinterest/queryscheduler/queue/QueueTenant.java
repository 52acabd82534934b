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

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;

/**
 * A tenant with requests in the queue, its shuffle shard width and the queriers currently
 * assigned to it.
 */
public class QueueTenant {

  private final String tenantId;
  // Derived from the tenant ID only, so every scheduler computes the same shard.
  private final long shuffleShardSeed;
  private int maxQueriers;
  // Null means every eligible querier may serve this tenant.
  private ImmutableSet<String> querierIds;

  QueueTenant(String tenantId) {
    this.tenantId = Preconditions.checkNotNull(tenantId);
    this.shuffleShardSeed = shuffleShardSeed(tenantId);
  }

  static long shuffleShardSeed(String tenantId) {
    return Hashing.murmur3_128().hashString(tenantId, Charsets.UTF_8).asLong();
  }

  public String getTenantId() {
    return tenantId;
  }

  public int getMaxQueriers() {
    return maxQueriers;
  }

  long getShuffleShardSeed() {
    return shuffleShardSeed;
  }

  void setMaxQueriers(int maxQueriers) {
    this.maxQueriers = maxQueriers;
  }

  /**
   * Returns the queriers assigned to this tenant, or null if the tenant is not sharded and any
   * querier may serve it.
   */
  public ImmutableSet<String> getQuerierIds() {
    return querierIds;
  }

  void setQuerierIds(ImmutableSet<String> querierIds) {
    this.querierIds = querierIds;
  }

  @Override
  public String toString() {
    return "QueueTenant{tenantId=" + tenantId + ", maxQueriers=" + maxQueriers
        + ", querierIds=" + querierIds + "}";
  }
}
