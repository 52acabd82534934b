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
 * Downstream components a query may read from. The name is what requests carry as their first
 * additional queue dimension.
 */
public enum QueryComponent {

  INGESTER("ingester"),
  STORE_GATEWAY("store-gateway");

  private final String componentName;

  QueryComponent(String componentName) {
    this.componentName = componentName;
  }

  public String getComponentName() {
    return componentName;
  }

  /**
   * Whether a query component name refers to this component. Names are matched by substring,
   * so "ingester-and-store-gateway" refers to both components and "unknown" to neither.
   */
  public boolean matches(String queryComponentName) {
    return queryComponentName != null && queryComponentName.contains(componentName);
  }
}
