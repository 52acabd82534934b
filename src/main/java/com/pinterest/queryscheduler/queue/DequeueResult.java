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

/**
 * What a querier gets back from a dequeue: the request and its tenant, or neither when nothing
 * was available, plus the shared tenant rotation position after the dequeue.
 */
public class DequeueResult {

  private final TenantRequest request;
  private final QueueTenant tenant;
  private final int tenantIndex;

  DequeueResult(TenantRequest request, QueueTenant tenant, int tenantIndex) {
    this.request = request;
    this.tenant = tenant;
    this.tenantIndex = tenantIndex;
  }

  static DequeueResult empty(int tenantIndex) {
    return new DequeueResult(null, null, tenantIndex);
  }

  public boolean isEmpty() {
    return request == null;
  }

  public TenantRequest getRequest() {
    return request;
  }

  public QueueTenant getTenant() {
    return tenant;
  }

  public int getTenantIndex() {
    return tenantIndex;
  }

  @Override
  public String toString() {
    return "DequeueResult{request=" + request + ", tenant=" + tenant
        + ", tenantIndex=" + tenantIndex + "}";
  }
}
