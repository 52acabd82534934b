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

/**
 * Error codes carried by {@link SchedulerException}.
 */
public enum ErrorCode {

  /** The tenant already has the maximum number of outstanding requests queued. */
  TOO_MANY_REQUESTS,

  /** The querier is not connected, or has announced it is shutting down. */
  QUERIER_SHUTTING_DOWN,

  /** The request carries no tenant ID. */
  INVALID_TENANT_ID,

  /** The request queue has been stopped. */
  STOPPED
}
