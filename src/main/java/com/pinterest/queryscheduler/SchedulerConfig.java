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
import com.google.common.base.Preconditions;
import com.google.common.io.Closeables;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;

import java.io.InputStream;
import java.util.concurrent.TimeUnit;

/**
 * Static configuration of the scheduler request queue.
 */
public class SchedulerConfig {

  private final int maxOutstandingRequestsPerTenant;
  private final boolean additionalQueueDimensionsEnabled;
  private final long querierForgetDelayMillis;
  private final long querierForgetCheckPeriodMillis;
  private final double targetReservedCapacity;
  private final int defaultMaxQueriersPerTenant;
  private final String tenantLimitsFilePath;

  public SchedulerConfig(PropertiesConfiguration configuration) {
    this(configuration.getInt("MAX_OUTSTANDING_REQUESTS_PER_TENANT"),
        configuration.getBoolean("ADDITIONAL_QUEUE_DIMENSIONS_ENABLED", false),
        TimeUnit.SECONDS.toMillis(configuration.getInt("QUERIER_FORGET_DELAY_SECONDS", 0)),
        TimeUnit.SECONDS.toMillis(
            configuration.getInt("QUERIER_FORGET_CHECK_PERIOD_SECONDS", 5)),
        configuration.getDouble("TARGET_RESERVED_CAPACITY", 0.0),
        configuration.getInt("DEFAULT_MAX_QUERIERS_PER_TENANT", 0),
        configuration.getString("TENANT_LIMITS_FILE_PATH", ""));
  }

  @VisibleForTesting
  public SchedulerConfig(int maxOutstandingRequestsPerTenant,
                         boolean additionalQueueDimensionsEnabled,
                         long querierForgetDelayMillis,
                         long querierForgetCheckPeriodMillis,
                         double targetReservedCapacity,
                         int defaultMaxQueriersPerTenant,
                         String tenantLimitsFilePath) {
    Preconditions.checkArgument(maxOutstandingRequestsPerTenant > 0,
        "max outstanding requests per tenant must be positive");
    Preconditions.checkArgument(querierForgetDelayMillis >= 0);
    Preconditions.checkArgument(querierForgetCheckPeriodMillis > 0);
    Preconditions.checkArgument(targetReservedCapacity >= 0 && targetReservedCapacity < 1,
        "target reserved capacity must be in [0, 1): %s", targetReservedCapacity);
    this.maxOutstandingRequestsPerTenant = maxOutstandingRequestsPerTenant;
    this.additionalQueueDimensionsEnabled = additionalQueueDimensionsEnabled;
    this.querierForgetDelayMillis = querierForgetDelayMillis;
    this.querierForgetCheckPeriodMillis = querierForgetCheckPeriodMillis;
    this.targetReservedCapacity = targetReservedCapacity;
    this.defaultMaxQueriersPerTenant = defaultMaxQueriersPerTenant;
    this.tenantLimitsFilePath = tenantLimitsFilePath;
  }

  /**
   * Loads the configuration from a properties file on the classpath.
   */
  public static SchedulerConfig load(String resourceName) throws ConfigurationException {
    InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(resourceName);
    if (in == null) {
      throw new ConfigurationException(
          "Scheduler config not found on classpath: " + resourceName);
    }
    PropertiesConfiguration configuration = new PropertiesConfiguration();
    try {
      configuration.load(in);
    } finally {
      Closeables.closeQuietly(in);
    }
    return new SchedulerConfig(configuration);
  }

  public int getMaxOutstandingRequestsPerTenant() {
    return maxOutstandingRequestsPerTenant;
  }

  public boolean isAdditionalQueueDimensionsEnabled() {
    return additionalQueueDimensionsEnabled;
  }

  public long getQuerierForgetDelayMillis() {
    return querierForgetDelayMillis;
  }

  public long getQuerierForgetCheckPeriodMillis() {
    return querierForgetCheckPeriodMillis;
  }

  public double getTargetReservedCapacity() {
    return targetReservedCapacity;
  }

  public int getDefaultMaxQueriersPerTenant() {
    return defaultMaxQueriersPerTenant;
  }

  public String getTenantLimitsFilePath() {
    return tenantLimitsFilePath;
  }
}
