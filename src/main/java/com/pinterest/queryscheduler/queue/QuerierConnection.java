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
 * Connection bookkeeping for one querier. A querier with no open connections that has not
 * announced shutdown is in its forget grace period: it keeps its place in the shuffle shards
 * until {@link TenantQuerierAssignments#forgetDisconnectedQueriers} purges it.
 */
public class QuerierConnection {

  private final String querierId;
  private int connections;
  private boolean shuttingDown;
  // Zero while at least one connection is open.
  private long disconnectedAtMillis;

  QuerierConnection(String querierId) {
    this.querierId = Preconditions.checkNotNull(querierId);
  }

  public String getQuerierId() {
    return querierId;
  }

  public int getConnections() {
    return connections;
  }

  public boolean isShuttingDown() {
    return shuttingDown;
  }

  public long getDisconnectedAtMillis() {
    return disconnectedAtMillis;
  }

  void connect() {
    connections++;
    disconnectedAtMillis = 0;
  }

  void disconnect(long nowMillis) {
    Preconditions.checkState(connections > 0,
        "unexpected number of connections for querier %s: %s", querierId, connections);
    connections--;
    if (connections == 0) {
      disconnectedAtMillis = nowMillis;
    }
  }

  void setShuttingDown(boolean shuttingDown) {
    this.shuttingDown = shuttingDown;
  }

  @Override
  public String toString() {
    return "QuerierConnection{querierId=" + querierId + ", connections=" + connections
        + ", shuttingDown=" + shuttingDown + ", disconnectedAtMillis=" + disconnectedAtMillis + "}";
  }
}
