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

import com.google.common.base.Preconditions;

/**
 * Recoverable condition surfaced to the caller of the scheduler queue. None of these are retried
 * internally; the caller decides whether to back off, shed the request or stop polling.
 */
public class SchedulerException extends Exception {

  private final ErrorCode errorCode;

  public SchedulerException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = Preconditions.checkNotNull(errorCode);
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return "SchedulerException{errorCode=" + errorCode + ", message=" + getMessage() + "}";
  }
}
