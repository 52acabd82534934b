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

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SchedulerConfigTest {

  @Test
  public void testLoad() throws ConfigurationException {
    SchedulerConfig config = SchedulerConfig.load("scheduler-test.properties");

    Assert.assertEquals(3, config.getMaxOutstandingRequestsPerTenant());
    Assert.assertTrue(config.isAdditionalQueueDimensionsEnabled());
    Assert.assertEquals(30000, config.getQuerierForgetDelayMillis());
    Assert.assertEquals(5000, config.getQuerierForgetCheckPeriodMillis());
    Assert.assertEquals(0.4, config.getTargetReservedCapacity(), 0.0001);
    Assert.assertEquals(2, config.getDefaultMaxQueriersPerTenant());
    Assert.assertEquals("tenant-limits-test.json", config.getTenantLimitsFilePath());
  }

  @Test
  public void testDefaults() {
    PropertiesConfiguration configuration = new PropertiesConfiguration();
    configuration.setProperty("MAX_OUTSTANDING_REQUESTS_PER_TENANT", 100);
    SchedulerConfig config = new SchedulerConfig(configuration);

    Assert.assertEquals(100, config.getMaxOutstandingRequestsPerTenant());
    Assert.assertFalse(config.isAdditionalQueueDimensionsEnabled());
    Assert.assertEquals(0, config.getQuerierForgetDelayMillis());
    Assert.assertEquals(5000, config.getQuerierForgetCheckPeriodMillis());
    Assert.assertEquals(0.0, config.getTargetReservedCapacity(), 0.0001);
    Assert.assertEquals(0, config.getDefaultMaxQueriersPerTenant());
    Assert.assertEquals("", config.getTenantLimitsFilePath());
  }

  @Test
  public void testShippedConfig() throws ConfigurationException {
    SchedulerConfig config = SchedulerConfig.load("scheduler.properties");
    Assert.assertEquals(100, config.getMaxOutstandingRequestsPerTenant());
    Assert.assertEquals("", config.getTenantLimitsFilePath());
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingConfig() throws ConfigurationException {
    SchedulerConfig.load("does-not-exist.properties");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidTargetReservedCapacity() {
    new SchedulerConfig(100, false, 0, 5000, 1.5, 0, "");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidMaxOutstandingRequests() {
    new SchedulerConfig(0, false, 0, 5000, 0.0, 0, "");
  }
}
