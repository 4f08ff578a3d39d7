/*
 * Copyright 2016 VMware, Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License.  You may obtain a copy of
 * the License at http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, without warranties or
 * conditions of any kind, EITHER EXPRESS OR IMPLIED.  See the License for the
 * specific language governing permissions and limitations under the License.
 */

package com.vmware.netvirt.nvpclient;

import com.vmware.netvirt.nvpclient.apis.LogicalSwitchApi;
import com.vmware.netvirt.nvpclient.apis.TransportZoneApi;

import java.io.Closeable;
import java.io.IOException;

/**
 * This class represents the NVP client.
 */
public class NvpClient implements Closeable {

  private final RestClient restClient;

  private final LogicalSwitchApi logicalSwitchApi;
  private final TransportZoneApi transportZoneApi;

  /**
   * Constructs a NVP client.
   */
  public NvpClient(String target,
                   String username,
                   String password) {
    this(target, username, password, RestClient.DEFAULT_REQUEST_TIMEOUT_MILLIS);
  }

  /**
   * Constructs a NVP client whose requests give up after the given timeout.
   */
  public NvpClient(String target,
                   String username,
                   String password,
                   long requestTimeoutMillis) {
    this(new RestClient(normalizeTarget(target), username, password, requestTimeoutMillis, null));
  }

  /**
   * Constructs a NVP client on top of an existing RestClient.
   */
  public NvpClient(RestClient restClient) {
    this.restClient = restClient;

    this.logicalSwitchApi = new LogicalSwitchApi(restClient);
    this.transportZoneApi = new TransportZoneApi(restClient);
  }

  /**
   * Returns the controller this client talks to.
   */
  public String getTarget() {
    return this.restClient.getTarget();
  }

  /**
   * Returns NVP logical switch API client.
   */
  public LogicalSwitchApi getLogicalSwitchApi() {
    return this.logicalSwitchApi;
  }

  /**
   * Returns NVP transport zone API client.
   */
  public TransportZoneApi getTransportZoneApi() {
    return this.transportZoneApi;
  }

  @Override
  public void close() throws IOException {
    this.restClient.close();
  }

  private static String normalizeTarget(String target) {
    if (target != null && !target.startsWith("https://") && !target.startsWith("http://")) {
      return "https://" + target;
    }

    return target;
  }
}
