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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks how many dispatched requests are in flight against each downstream query component,
 * together with the fraction of querier-worker capacity that should stay reserved for the other
 * components.
 *
 * Thread-safe: requests complete outside the request queue lock.
 */
public class QueryComponentUtilization {

  private static final Logger LOG = LoggerFactory.getLogger(QueryComponentUtilization.class);

  private final double targetReservedCapacity;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private int ingesterInflightRequests;
  private int storeGatewayInflightRequests;
  private int querierInflightRequestsTotal;

  /**
   * @param targetReservedCapacity fraction in [0, 1) of connected querier workers to keep
   *                               available for other components; 0 disables the reservation.
   */
  public QueryComponentUtilization(double targetReservedCapacity) {
    Preconditions.checkArgument(targetReservedCapacity >= 0 && targetReservedCapacity < 1,
        "invalid target reserved capacity %s, must be in [0, 1)", targetReservedCapacity);
    this.targetReservedCapacity = targetReservedCapacity;
  }

  public double getTargetReservedCapacity() {
    return targetReservedCapacity;
  }

  public void incrementForComponentName(String expectedQueryComponent) {
    updateForComponentName(expectedQueryComponent, 1);
  }

  public void decrementForComponentName(String expectedQueryComponent) {
    updateForComponentName(expectedQueryComponent, -1);
  }

  /**
   * Counts a request dispatched to a querier against the components it is expected to query.
   */
  public void markRequestSent(TenantRequest request) {
    incrementForComponentName(request.getExpectedQueryComponentName());
  }

  /**
   * Releases a request previously passed to {@link #markRequestSent}.
   */
  public void markRequestCompleted(TenantRequest request) {
    decrementForComponentName(request.getExpectedQueryComponentName());
  }

  public int getForComponent(QueryComponent component) {
    lock.readLock().lock();
    try {
      switch (component) {
        case INGESTER:
          return ingesterInflightRequests;
        case STORE_GATEWAY:
          return storeGatewayInflightRequests;
        default:
          throw new IllegalArgumentException("unknown query component " + component);
      }
    } finally {
      lock.readLock().unlock();
    }
  }

  public int getQuerierInflightRequestsTotal() {
    lock.readLock().lock();
    try {
      return querierInflightRequestsTotal;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void updateForComponentName(String expectedQueryComponent, int increment) {
    boolean isIngester = QueryComponent.INGESTER.matches(expectedQueryComponent);
    boolean isStoreGateway = QueryComponent.STORE_GATEWAY.matches(expectedQueryComponent);

    lock.writeLock().lock();
    try {
      if (isIngester) {
        ingesterInflightRequests += increment;
      }
      if (isStoreGateway) {
        storeGatewayInflightRequests += increment;
      }
      querierInflightRequestsTotal += increment;
      if (ingesterInflightRequests < 0 || storeGatewayInflightRequests < 0
          || querierInflightRequestsTotal < 0) {
        LOG.warn("Negative in-flight request count after completing a {} request; "
            + "completions do not match dispatches", expectedQueryComponent);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }
}
