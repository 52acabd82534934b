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
import com.pinterest.queryscheduler.SchedulerConfig;
import com.pinterest.queryscheduler.SchedulerException;
import com.pinterest.queryscheduler.TenantLimitsConfig;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe front of the scheduler queue. Producers enqueue requests on behalf of tenants and
 * querier workers block in {@link #getNextRequestForQuerier} until a request they may serve is
 * available.
 *
 * All broker state (request tree, tenants, querier assignments and the shared tenant rotation
 * position) is guarded by a single lock. A background task periodically forgets queriers that
 * stayed disconnected past the forget delay.
 */
public class RequestQueue {

  private static final Logger LOG = LoggerFactory.getLogger(RequestQueue.class);

  private final ReentrantLock lock = new ReentrantLock();
  // Signalled on enqueue, on reshard, on querier removal and on stop.
  private final Condition queueChanged = lock.newCondition();

  private final QueueBroker queueBroker;
  private final QueryComponentUtilization utilization;
  private final TenantLimitsConfig tenantLimits;
  private final long querierForgetDelayMillis;
  private final long querierForgetCheckPeriodMillis;
  private final ScheduledExecutorService scheduledExecutorService;

  // Guarded by lock.
  private int waitingQuerierWorkers;
  private boolean stopped;

  public RequestQueue(SchedulerConfig config, TenantLimitsConfig tenantLimits) {
    this.utilization = new QueryComponentUtilization(config.getTargetReservedCapacity());
    this.queueBroker = new QueueBroker(
        config.getMaxOutstandingRequestsPerTenant(),
        config.isAdditionalQueueDimensionsEnabled(),
        config.getQuerierForgetDelayMillis(),
        utilization);
    this.tenantLimits = Preconditions.checkNotNull(tenantLimits);
    this.querierForgetDelayMillis = config.getQuerierForgetDelayMillis();
    this.querierForgetCheckPeriodMillis = config.getQuerierForgetCheckPeriodMillis();
    this.scheduledExecutorService = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat("RequestQueue-querier-forget-%d")
            .build());
  }

  /**
   * Starts the background task forgetting disconnected queriers, if a forget delay is set.
   */
  public void start() {
    if (querierForgetDelayMillis == 0) {
      LOG.info("Querier forget delay disabled, queriers are removed as soon as they disconnect");
      return;
    }
    scheduledExecutorService.scheduleWithFixedDelay(
        new Runnable() {
          @Override
          public void run() {
            try {
              forgetDisconnectedQueriers(System.currentTimeMillis());
            } catch (RuntimeException e) {
              LOG.error("Failed to forget disconnected queriers", e);
            }
          }
        },
        querierForgetCheckPeriodMillis,
        querierForgetCheckPeriodMillis,
        TimeUnit.MILLISECONDS);
    LOG.info("Started request queue, forgetting disconnected queriers after {} ms",
        querierForgetDelayMillis);
  }

  /**
   * Stops the queue: further enqueues are rejected and waiting queriers are released with
   * {@link ErrorCode#STOPPED}.
   */
  public void stop() {
    lock.lock();
    try {
      stopped = true;
      queueChanged.signalAll();
      LOG.info("Stopping request queue with {} requests still queued", queueBroker.itemCount());
    } finally {
      lock.unlock();
    }
    scheduledExecutorService.shutdownNow();
  }

  /**
   * Enqueues a request using the tenant's configured max queriers.
   */
  public void enqueueRequest(String tenantId, Object request) throws SchedulerException {
    enqueueRequest(tenantId, request, tenantLimits.getMaxQueriersPerTenant(tenantId));
  }

  /**
   * Enqueues a new request at the back of the tenant's queue.
   *
   * @throws SchedulerException with {@link ErrorCode#TOO_MANY_REQUESTS} if the tenant's queue is
   *                            full, or {@link ErrorCode#STOPPED} once the queue is stopped.
   */
  public void enqueueRequest(String tenantId, Object request, int maxQueriers)
      throws SchedulerException {
    TenantRequest tenantRequest = new TenantRequest(tenantId, request);
    lock.lock();
    try {
      checkNotStopped();
      try {
        queueBroker.enqueueRequestBack(tenantRequest, maxQueriers);
      } catch (SchedulerException e) {
        LOG.warn("Rejected request for tenant {}: {}", tenantId, e.getMessage());
        throw e;
      }
      queueChanged.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Puts a dequeued request back at the front of its queue after dispatching it to a querier
   * failed. The request is no longer counted as in flight.
   */
  public void enqueueRequestFront(TenantRequest request, int maxQueriers)
      throws SchedulerException {
    lock.lock();
    try {
      checkNotStopped();
      queueBroker.enqueueRequestFront(request, maxQueriers);
      utilization.markRequestCompleted(request);
      queueChanged.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code timeout} for a request the querier may serve. The dequeued request is
   * counted as in flight until {@link #markRequestCompleted} is called for it.
   *
   * @return the dequeued request, or an empty result if the timeout elapsed first.
   * @throws SchedulerException with {@link ErrorCode#QUERIER_SHUTTING_DOWN} if the querier is not
   *                            active, or {@link ErrorCode#STOPPED} once the queue is stopped.
   */
  public DequeueResult getNextRequestForQuerier(String querierId, long timeout, TimeUnit unit)
      throws SchedulerException, InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    lock.lock();
    try {
      while (true) {
        checkNotStopped();
        // This worker counts as waiting while it looks for a request.
        DequeueResult result =
            queueBroker.dequeueRequestForQuerier(querierId, waitingQuerierWorkers + 1);
        if (!result.isEmpty()) {
          utilization.markRequestSent(result.getRequest());
          return result;
        }
        if (remainingNanos <= 0) {
          return result;
        }

        waitingQuerierWorkers++;
        try {
          remainingNanos = queueChanged.awaitNanos(remainingNanos);
        } finally {
          waitingQuerierWorkers--;
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases a request returned by {@link #getNextRequestForQuerier} once the querier is done.
   */
  public void markRequestCompleted(TenantRequest request) {
    utilization.markRequestCompleted(request);
  }

  public boolean registerQuerierConnection(String querierId) {
    lock.lock();
    try {
      return signalIfResharded(queueBroker.addQuerierConnection(querierId));
    } finally {
      lock.unlock();
    }
  }

  public boolean unregisterQuerierConnection(String querierId) {
    lock.lock();
    try {
      boolean resharded =
          queueBroker.removeQuerierConnection(querierId, System.currentTimeMillis());
      if (resharded || queueBroker.getQuerierConnections(querierId) == 0) {
        // Release the querier's waiting workers so they observe it has disconnected.
        queueChanged.signalAll();
      }
      return resharded;
    } finally {
      lock.unlock();
    }
  }

  public boolean notifyQuerierShutdown(String querierId) {
    lock.lock();
    try {
      boolean resharded = queueBroker.notifyQuerierShutdown(querierId);
      // Release the querier's waiting workers so they observe the shutdown.
      queueChanged.signalAll();
      return resharded;
    } finally {
      lock.unlock();
    }
  }

  public boolean forgetDisconnectedQueriers(long nowMillis) {
    lock.lock();
    try {
      return signalIfResharded(queueBroker.forgetDisconnectedQueriers(nowMillis));
    } finally {
      lock.unlock();
    }
  }

  public int getQueueLength() {
    lock.lock();
    try {
      return queueBroker.itemCount();
    } finally {
      lock.unlock();
    }
  }

  public int getConnectedQuerierWorkers() {
    lock.lock();
    try {
      return queueBroker.getConnectedQuerierWorkers();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  QueueBroker getQueueBroker() {
    return queueBroker;
  }

  @VisibleForTesting
  QueryComponentUtilization getUtilization() {
    return utilization;
  }

  @VisibleForTesting
  int getWaitingQuerierWorkers() {
    lock.lock();
    try {
      return waitingQuerierWorkers;
    } finally {
      lock.unlock();
    }
  }

  private boolean signalIfResharded(boolean resharded) {
    if (resharded) {
      // Tenants may now be served by queriers that were waiting for something else.
      queueChanged.signalAll();
    }
    return resharded;
  }

  private void checkNotStopped() throws SchedulerException {
    if (stopped) {
      throw new SchedulerException(ErrorCode.STOPPED, "request queue is stopped");
    }
  }
}
