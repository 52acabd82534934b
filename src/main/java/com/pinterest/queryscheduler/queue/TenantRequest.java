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

/**
 * A pending request together with the tenant it belongs to. This is what the request tree
 * stores, and what a dequeue hands back.
 */
public class TenantRequest {

  private final String tenantId;
  private final Object request;

  public TenantRequest(String tenantId, Object request) {
    this.tenantId = tenantId;
    this.request = Preconditions.checkNotNull(request);
  }

  public String getTenantId() {
    return tenantId;
  }

  public Object getRequest() {
    return request;
  }

  /**
   * Returns the query component the request is expected to hit, or an empty string when the
   * request carries no queue dimensions.
   */
  public String getExpectedQueryComponentName() {
    if (request instanceof SchedulerRequest) {
      return ((SchedulerRequest) request).getExpectedQueryComponentName();
    }
    return "";
  }

  @Override
  public String toString() {
    return "TenantRequest{tenantId=" + tenantId + ", request=" + request + "}";
  }
}
