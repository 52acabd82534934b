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

import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class QueryComponentUtilizationTest {

  private static TenantRequest newRequest(String queryComponent) {
    return new TenantRequest("tenant",
        new SchedulerRequest("query", "payload", ImmutableList.of(queryComponent)));
  }

  private static QueryComponentUtilizationReserveConnections newCheck(
      QueryComponentUtilization utilization, int connectedWorkers) {
    QueryComponentUtilizationReserveConnections check =
        new QueryComponentUtilizationReserveConnections(utilization);
    check.update(connectedWorkers, 0, 1);
    return check;
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTargetReservedCapacityTooHigh() {
    new QueryComponentUtilization(1.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTargetReservedCapacityNegative() {
    new QueryComponentUtilization(-0.1);
  }

  @Test
  public void testComponentNameMatching() {
    Assert.assertTrue(QueryComponent.INGESTER.matches("ingester"));
    Assert.assertFalse(QueryComponent.STORE_GATEWAY.matches("ingester"));
    Assert.assertTrue(QueryComponent.INGESTER.matches("ingester-and-store-gateway"));
    Assert.assertTrue(QueryComponent.STORE_GATEWAY.matches("ingester-and-store-gateway"));
    Assert.assertFalse(QueryComponent.INGESTER.matches("unknown"));
    Assert.assertFalse(QueryComponent.STORE_GATEWAY.matches("unknown"));
    Assert.assertFalse(QueryComponent.INGESTER.matches(null));
  }

  @Test
  public void testInflightCounts() {
    QueryComponentUtilization utilization = new QueryComponentUtilization(0.4);
    TenantRequest both = newRequest("ingester-and-store-gateway");
    TenantRequest ingester = newRequest("ingester");

    utilization.markRequestSent(both);
    utilization.markRequestSent(ingester);
    utilization.markRequestSent(new TenantRequest("tenant", "not a scheduler request"));
    Assert.assertEquals(2, utilization.getForComponent(QueryComponent.INGESTER));
    Assert.assertEquals(1, utilization.getForComponent(QueryComponent.STORE_GATEWAY));
    Assert.assertEquals(3, utilization.getQuerierInflightRequestsTotal());

    utilization.markRequestCompleted(both);
    Assert.assertEquals(1, utilization.getForComponent(QueryComponent.INGESTER));
    Assert.assertEquals(0, utilization.getForComponent(QueryComponent.STORE_GATEWAY));
    Assert.assertEquals(2, utilization.getQuerierInflightRequestsTotal());
  }

  @Test
  public void testTriggerUtilizationCheck() {
    QueryComponentUtilizationReserveConnections check =
        new QueryComponentUtilizationReserveConnections(new QueryComponentUtilization(0.4));
    check.update(10, 5, 5);
    Assert.assertTrue(check.triggerUtilizationCheck());
    check.update(10, 4, 5);
    Assert.assertTrue(check.triggerUtilizationCheck());
    check.update(10, 6, 5);
    Assert.assertFalse(check.triggerUtilizationCheck());
  }

  @Test
  public void testExceedsThreshold() {
    QueryComponentUtilization utilization = new QueryComponentUtilization(0.4);
    QueryComponentUtilizationReserveConnections check = newCheck(utilization, 10);

    for (int i = 0; i < 5; i++) {
      utilization.incrementForComponentName("ingester");
    }
    // 10 - 5 leaves more than the 4 reserved connections.
    Assert.assertFalse(check.exceedsThresholdForComponentName("ingester").exceedsThreshold());

    utilization.incrementForComponentName("ingester");
    QueryComponentUtilizationCheck.ThresholdResult result =
        check.exceedsThresholdForComponentName("ingester");
    Assert.assertTrue(result.exceedsThreshold());
    Assert.assertEquals(QueryComponent.INGESTER, result.getComponent());

    Assert.assertFalse(
        check.exceedsThresholdForComponentName("store-gateway").exceedsThreshold());
    Assert.assertFalse(check.exceedsThresholdForComponentName("unknown").exceedsThreshold());

    result = check.exceedsThresholdForComponentName("ingester-and-store-gateway");
    Assert.assertTrue(result.exceedsThreshold());
    Assert.assertEquals(QueryComponent.INGESTER, result.getComponent());
  }

  @Test
  public void testStoreGatewayExceedsThreshold() {
    QueryComponentUtilization utilization = new QueryComponentUtilization(0.4);
    QueryComponentUtilizationReserveConnections check = newCheck(utilization, 10);
    for (int i = 0; i < 6; i++) {
      utilization.incrementForComponentName("store-gateway");
    }

    QueryComponentUtilizationCheck.ThresholdResult result =
        check.exceedsThresholdForComponentName("ingester-and-store-gateway");
    Assert.assertTrue(result.exceedsThreshold());
    Assert.assertEquals(QueryComponent.STORE_GATEWAY, result.getComponent());
    Assert.assertFalse(check.exceedsThresholdForComponentName("ingester").exceedsThreshold());
  }

  @Test
  public void testReservesAtLeastOneConnection() {
    QueryComponentUtilization utilization = new QueryComponentUtilization(0.01);
    QueryComponentUtilizationReserveConnections check = newCheck(utilization, 2);

    Assert.assertFalse(check.exceedsThresholdForComponentName("ingester").exceedsThreshold());
    utilization.incrementForComponentName("ingester");
    Assert.assertTrue(check.exceedsThresholdForComponentName("ingester").exceedsThreshold());
  }

  @Test
  public void testNoReservationWithSingleWorker() {
    QueryComponentUtilization utilization = new QueryComponentUtilization(0.4);
    QueryComponentUtilizationReserveConnections check = newCheck(utilization, 1);
    utilization.incrementForComponentName("ingester");

    Assert.assertFalse(check.exceedsThresholdForComponentName("ingester").exceedsThreshold());
  }

  @Test
  public void testNoReservationWithZeroTargetCapacity() {
    QueryComponentUtilization utilization = new QueryComponentUtilization(0);
    QueryComponentUtilizationReserveConnections check = newCheck(utilization, 10);
    for (int i = 0; i < 10; i++) {
      utilization.incrementForComponentName("ingester");
    }

    Assert.assertFalse(check.exceedsThresholdForComponentName("ingester").exceedsThreshold());
  }
}
