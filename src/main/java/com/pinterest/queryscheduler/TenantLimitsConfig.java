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
package com.pinterest.queryscheduler;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.ByteStreams;
import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.map.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-tenant limits for the scheduler queue. Currently this is the shuffle shard width, i.e. the
 * max number of queriers a tenant's requests may be dispatched to. Tenants not listed in the
 * limits file get the configured default.
 */
public class TenantLimitsConfig {

  private static final Logger LOG = LoggerFactory.getLogger(TenantLimitsConfig.class);

  private final AtomicReference<ImmutableMap<String, Integer>> maxQueriersByTenantRef =
      new AtomicReference<ImmutableMap<String, Integer>>(ImmutableMap.<String, Integer>of());
  private final int defaultMaxQueriers;
  private final String tenantLimitsFilePath;

  public TenantLimitsConfig(SchedulerConfig schedulerConfig) {
    this(schedulerConfig.getDefaultMaxQueriersPerTenant(),
        schedulerConfig.getTenantLimitsFilePath());
  }

  @VisibleForTesting
  public TenantLimitsConfig(int defaultMaxQueriers, String tenantLimitsFilePath) {
    this.defaultMaxQueriers = defaultMaxQueriers;
    this.tenantLimitsFilePath = tenantLimitsFilePath;
  }

  /**
   * Loads the per-tenant overrides from the classpath, if a limits file is configured.
   */
  public void initialize() throws IOException {
    if (Strings.isNullOrEmpty(tenantLimitsFilePath)) {
      LOG.info("Tenant limits file not specified, all tenants use max queriers {}",
          defaultMaxQueriers);
      return;
    }

    LOG.info("Loading tenant limits from {}", tenantLimitsFilePath);
    InputStream in = getClass().getResourceAsStream("/" + tenantLimitsFilePath);
    if (in == null) {
      throw new IOException("Tenant limits file not found: " + tenantLimitsFilePath);
    }
    try {
      update(ByteStreams.toByteArray(in));
    } finally {
      in.close();
    }
  }

  /**
   * Replaces the per-tenant overrides with the ones in the given JSON document. An invalid
   * document leaves the current overrides in place.
   *
   * @throws IOException if the document does not parse, or a tenant entry has no name, no limits,
   *                     or repeats a name listed before.
   */
  public void update(byte[] bytes) throws IOException {
    TenantLimitsSchema schema = TenantLimitsSchema.load(bytes);

    Map<String, Integer> maxQueriersByTenant = Maps.newHashMap();
    if (schema.tenants != null) {
      for (TenantLimitsSchema.Tenant tenant : schema.tenants) {
        if (tenant == null || Strings.isNullOrEmpty(tenant.name)) {
          throw new IOException("Tenant limits entry without a tenant name");
        }
        if (tenant.limits == null) {
          throw new IOException("No limits specified for tenant " + tenant.name);
        }
        if (maxQueriersByTenant.containsKey(tenant.name)) {
          throw new IOException("Duplicate tenant limits entry for tenant " + tenant.name);
        }
        maxQueriersByTenant.put(tenant.name, tenant.limits.maxQueriers);
      }
    }
    LOG.info("Tenant limits update, new value: {}", schema);
    maxQueriersByTenantRef.set(ImmutableMap.copyOf(maxQueriersByTenant));
  }

  public int getMaxQueriersPerTenant(String tenantId) {
    Integer maxQueriers = maxQueriersByTenantRef.get().get(tenantId);
    return maxQueriers == null ? defaultMaxQueriers : maxQueriers;
  }

  /**
   * Defines the tenant limits json schema.
   */
  public static class TenantLimitsSchema {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public List<Tenant> tenants;

    public static class Tenant {

      public String name;
      public Limits limits;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Limits {

      public int maxQueriers;
    }

    public static TenantLimitsSchema load(byte[] bytes) throws IOException {
      return OBJECT_MAPPER.readValue(bytes, TenantLimitsSchema.class);
    }

    @Override
    public String toString() {
      StringBuilder out = new StringBuilder();
      out.append("\nTenant Limits:");
      if (tenants != null) {
        for (Tenant t : tenants) {
          if (t == null) {
            continue;
          }
          out.append("\nTenant: ").append(t.name);
          out.append(" maxQueriers: ").append(t.limits == null ? null : t.limits.maxQueriers);
        }
      }
      return out.toString();
    }
  }
}
