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
 * Decides whether dequeueing for a query component would eat into capacity reserved for the
 * other components.
 */
public interface QueryComponentUtilizationCheck {

  /**
   * Whether component utilization should be consulted at all for the current dequeue.
   */
  boolean triggerUtilizationCheck();

  /**
   * Checks the component named by a queue node against its reserved-capacity threshold.
   */
  ThresholdResult exceedsThresholdForComponentName(String name);

  /**
   * Outcome of a threshold check, with the component found over threshold, if any.
   */
  final class ThresholdResult {

    static final ThresholdResult WITHIN_THRESHOLD = new ThresholdResult(false, null);

    private final boolean exceedsThreshold;
    private final QueryComponent component;

    ThresholdResult(boolean exceedsThreshold, QueryComponent component) {
      this.exceedsThreshold = exceedsThreshold;
      this.component = component;
    }

    public boolean exceedsThreshold() {
      return exceedsThreshold;
    }

    public QueryComponent getComponent() {
      return component;
    }

    @Override
    public String toString() {
      return "ThresholdResult{exceedsThreshold=" + exceedsThreshold
          + ", component=" + component + "}";
    }
  }
}
