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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TenantQuerierAssignmentsTest {

  private static final long FORGET_DELAY_MILLIS = 1000;

  private static TenantQuerierAssignments newAssignments(long forgetDelayMillis,
                                                         String... querierIds) {
    TenantQuerierAssignments assignments = new TenantQuerierAssignments(forgetDelayMillis);
    for (String querierId : querierIds) {
      assignments.addQuerierConnection(querierId);
    }
    return assignments;
  }

  @Test
  public void testShuffleShardIsDeterministic() throws SchedulerException {
    TenantQuerierAssignments first = newAssignments(0, "q-1", "q-2", "q-3", "q-4", "q-5");
    first.createOrUpdateTenant("tenant", 2);
    // Same queriers connecting in a different order.
    TenantQuerierAssignments second = newAssignments(0, "q-5", "q-3", "q-1", "q-4", "q-2");
    second.createOrUpdateTenant("tenant", 2);

    ImmutableSet<String> querierIds = first.getTenant("tenant").getQuerierIds();
    Assert.assertEquals(2, querierIds.size());
    Assert.assertEquals(querierIds, second.getTenant("tenant").getQuerierIds());
    Assert.assertEquals(querierIds, first.getQuerierIdsForTenant("tenant"));

    // Updating with an unchanged width keeps the shard.
    first.createOrUpdateTenant("tenant", 2);
    Assert.assertEquals(querierIds, first.getTenant("tenant").getQuerierIds());

    for (String querierId : ImmutableList.of("q-1", "q-2", "q-3", "q-4", "q-5")) {
      Assert.assertEquals(querierIds.contains(querierId),
          first.isQuerierEligible("tenant", querierId));
    }
  }

  @Test
  public void testShardWidthChange() throws SchedulerException {
    TenantQuerierAssignments assignments =
        newAssignments(0, "q-1", "q-2", "q-3", "q-4", "q-5");
    assignments.createOrUpdateTenant("tenant", 2);
    Assert.assertEquals(2, assignments.getTenant("tenant").getQuerierIds().size());

    assignments.createOrUpdateTenant("tenant", 3);
    Assert.assertEquals(3, assignments.getTenant("tenant").getQuerierIds().size());

    assignments.createOrUpdateTenant("tenant", 5);
    Assert.assertNull(assignments.getTenant("tenant").getQuerierIds());
    Assert.assertEquals(ImmutableSet.of("q-1", "q-2", "q-3", "q-4", "q-5"),
        assignments.getQuerierIdsForTenant("tenant"));
  }

  @Test
  public void testUnshardedTenant() throws SchedulerException {
    TenantQuerierAssignments assignments = newAssignments(0, "q-1", "q-2", "q-3");
    assignments.createOrUpdateTenant("zero", 0);
    assignments.createOrUpdateTenant("negative", -1);

    Assert.assertNull(assignments.getTenant("zero").getQuerierIds());
    Assert.assertEquals(0, assignments.getTenant("negative").getMaxQueriers());
    Assert.assertNull(assignments.getTenant("negative").getQuerierIds());
    Assert.assertTrue(assignments.isQuerierEligible("zero", "q-3"));
    Assert.assertFalse(assignments.isQuerierEligible("unknown-tenant", "q-3"));
    Assert.assertTrue(assignments.getQuerierIdsForTenant("unknown-tenant").isEmpty());
  }

  @Test
  public void testEmptyTenantId() {
    TenantQuerierAssignments assignments = newAssignments(0);
    try {
      assignments.createOrUpdateTenant("", 1);
      Assert.fail();
    } catch (SchedulerException e) {
      Assert.assertEquals(ErrorCode.INVALID_TENANT_ID, e.getErrorCode());
    }
  }

  @Test
  public void testNewQuerierReshards() throws SchedulerException {
    TenantQuerierAssignments assignments = newAssignments(0, "q-1", "q-2");
    assignments.createOrUpdateTenant("tenant", 2);
    Assert.assertNull(assignments.getTenant("tenant").getQuerierIds());

    Assert.assertTrue(assignments.addQuerierConnection("q-3"));
    Assert.assertEquals(2, assignments.getTenant("tenant").getQuerierIds().size());
    Assert.assertEquals(ImmutableList.of("q-1", "q-2", "q-3"),
        assignments.getEligibleQuerierIds());

    // Another connection from a known querier does not change anything.
    Assert.assertFalse(assignments.addQuerierConnection("q-3"));
    Assert.assertEquals(4, assignments.getConnectedQuerierWorkers());
  }

  @Test
  public void testQuerierRemovedOnDisconnectWithoutForgetDelay() throws SchedulerException {
    TenantQuerierAssignments assignments = newAssignments(0, "q-1", "q-2", "q-3");
    assignments.addQuerierConnection("q-1");
    assignments.createOrUpdateTenant("tenant", 2);

    Assert.assertFalse(assignments.removeQuerierConnection("q-1", 100));
    Assert.assertNotNull(assignments.getQuerier("q-1"));

    Assert.assertTrue(assignments.removeQuerierConnection("q-1", 200));
    Assert.assertNull(assignments.getQuerier("q-1"));
    Assert.assertNull(assignments.getTenant("tenant").getQuerierIds());
    Assert.assertEquals(ImmutableList.of("q-2", "q-3"), assignments.getEligibleQuerierIds());
  }

  @Test
  public void testForgetDelay() throws SchedulerException {
    TenantQuerierAssignments assignments = newAssignments(FORGET_DELAY_MILLIS, "q-1", "q-2");
    assignments.createOrUpdateTenant("tenant", 1);
    Assert.assertEquals(1, assignments.getTenant("tenant").getQuerierIds().size());

    Assert.assertFalse(assignments.removeQuerierConnection("q-1", 10000));
    // Still part of the shards during the grace period.
    Assert.assertEquals(0, assignments.getQuerier("q-1").getConnections());
    Assert.assertEquals(ImmutableList.of("q-1", "q-2"), assignments.getEligibleQuerierIds());

    Assert.assertFalse(assignments.forgetDisconnectedQueriers(10999));
    Assert.assertNotNull(assignments.getQuerier("q-1"));

    Assert.assertTrue(assignments.forgetDisconnectedQueriers(11000));
    Assert.assertNull(assignments.getQuerier("q-1"));
    Assert.assertEquals(ImmutableList.of("q-2"), assignments.getEligibleQuerierIds());
    Assert.assertNull(assignments.getTenant("tenant").getQuerierIds());
  }

  @Test
  public void testReconnectDuringForgetDelay() {
    TenantQuerierAssignments assignments = newAssignments(FORGET_DELAY_MILLIS, "q-1");
    assignments.removeQuerierConnection("q-1", 10000);
    Assert.assertFalse(assignments.addQuerierConnection("q-1"));

    Assert.assertFalse(assignments.forgetDisconnectedQueriers(20000));
    Assert.assertEquals(1, assignments.getQuerier("q-1").getConnections());
    Assert.assertEquals(0, assignments.getQuerier("q-1").getDisconnectedAtMillis());
  }

  @Test
  public void testForgetWithoutForgetDelayIsNoop() {
    TenantQuerierAssignments assignments = newAssignments(0, "q-1");
    Assert.assertFalse(assignments.forgetDisconnectedQueriers(Long.MAX_VALUE));
    Assert.assertNotNull(assignments.getQuerier("q-1"));
  }

  @Test
  public void testQuerierShutdown() throws SchedulerException {
    TenantQuerierAssignments assignments =
        newAssignments(FORGET_DELAY_MILLIS, "q-1", "q-2", "q-3");
    assignments.createOrUpdateTenant("tenant", 2);

    assignments.notifyQuerierShutdown("q-1");
    Assert.assertTrue(assignments.getQuerier("q-1").isShuttingDown());
    Assert.assertEquals(ImmutableList.of("q-2", "q-3"), assignments.getEligibleQuerierIds());
    Assert.assertEquals(ImmutableSet.of("q-2", "q-3"),
        assignments.getQuerierIdsForTenant("tenant"));
    Assert.assertFalse(assignments.notifyQuerierShutdown("q-1"));

    // A shutting down querier is removed with its last connection, regardless of forget delay.
    assignments.removeQuerierConnection("q-1", 10000);
    Assert.assertNull(assignments.getQuerier("q-1"));

    Assert.assertFalse(assignments.notifyQuerierShutdown("q-1"));
  }

  @Test
  public void testQuerierShutdownWithoutConnections() {
    TenantQuerierAssignments assignments = newAssignments(FORGET_DELAY_MILLIS, "q-1", "q-2");
    assignments.removeQuerierConnection("q-1", 10000);
    Assert.assertNotNull(assignments.getQuerier("q-1"));

    assignments.notifyQuerierShutdown("q-1");
    Assert.assertNull(assignments.getQuerier("q-1"));
  }

  @Test
  public void testReconnectAfterShutdown() throws SchedulerException {
    TenantQuerierAssignments assignments = newAssignments(0, "q-1", "q-2", "q-3");
    assignments.createOrUpdateTenant("tenant", 2);
    assignments.notifyQuerierShutdown("q-1");
    Assert.assertNull(assignments.getTenant("tenant").getQuerierIds());

    Assert.assertTrue(assignments.addQuerierConnection("q-1"));
    Assert.assertFalse(assignments.getQuerier("q-1").isShuttingDown());
    Assert.assertEquals(ImmutableList.of("q-1", "q-2", "q-3"),
        assignments.getEligibleQuerierIds());
    Assert.assertEquals(2, assignments.getTenant("tenant").getQuerierIds().size());
  }

  @Test(expected = IllegalStateException.class)
  public void testRemoveConnectionOfUnknownQuerier() {
    newAssignments(0).removeQuerierConnection("q-1", 0);
  }
}
