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
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A query request as received by the scheduler: an opaque payload plus the additional queue
 * dimensions used to route it below its tenant's queue.
 */
public class SchedulerRequest {

  private final String queryId;
  private final Object payload;
  private final ImmutableList<String> additionalQueueDimensions;
  private final long enqueueTimeMillis;

  public SchedulerRequest(String queryId, Object payload, List<String> additionalQueueDimensions) {
    this(queryId, payload, additionalQueueDimensions, System.currentTimeMillis());
  }

  public SchedulerRequest(String queryId,
                          Object payload,
                          List<String> additionalQueueDimensions,
                          long enqueueTimeMillis) {
    this.queryId = Preconditions.checkNotNull(queryId);
    this.payload = payload;
    this.additionalQueueDimensions = additionalQueueDimensions == null
                                     ? ImmutableList.<String>of()
                                     : ImmutableList.copyOf(additionalQueueDimensions);
    this.enqueueTimeMillis = enqueueTimeMillis;
  }

  public String getQueryId() {
    return queryId;
  }

  public Object getPayload() {
    return payload;
  }

  public ImmutableList<String> getAdditionalQueueDimensions() {
    return additionalQueueDimensions;
  }

  public long getEnqueueTimeMillis() {
    return enqueueTimeMillis;
  }

  /**
   * The first additional queue dimension names the query component the request will hit.
   */
  public String getExpectedQueryComponentName() {
    return additionalQueueDimensions.isEmpty() ? "" : additionalQueueDimensions.get(0);
  }

  @Override
  public String toString() {
    return "SchedulerRequest{queryId=" + queryId + ", dimensions=" + additionalQueueDimensions
        + "}";
  }
}
