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

package com.vmware.netvirt.nvpdriver;

import com.vmware.netvirt.nvpclient.NvpClient;
import com.vmware.netvirt.nvpclient.models.LogicalPort;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpdriver.lswitch.PortAllocator;
import com.vmware.netvirt.nvpdriver.lswitch.SwitchCapacityManager;
import com.vmware.netvirt.nvpdriver.network.ProviderNetworkParams;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

import java.io.IOException;

/**
 * Backs tenant networks and their ports with NVP logical switches and logical ports.
 * <p>
 * Every operation runs against one controller taken from the {@link NvpConnectionPool}, and reads the state
 * it needs from that controller afresh.
 */
@Singleton
public class NvpDriver {

  private final NvpConnectionPool connectionPool;
  private final SwitchCapacityManager switchCapacityManager;
  private final PortAllocator portAllocator;

  @Inject
  public NvpDriver(NvpConnectionPool connectionPool,
                   SwitchCapacityManager switchCapacityManager,
                   PortAllocator portAllocator) {
    this.connectionPool = connectionPool;
    this.switchCapacityManager = switchCapacityManager;
    this.portAllocator = portAllocator;
  }

  /**
   * Creates the first switch of a network.
   *
   * @return the uuid of the created switch.
   */
  public String createNetwork(String networkId, @Nullable String networkName, ProviderNetworkParams params)
      throws IOException {
    checkNotNull(params, "params cannot be null");

    NvpClient client = connectionPool.getClient();
    LogicalSwitch logicalSwitch = switchCapacityManager.createSwitch(client, networkId, networkName, params);
    return logicalSwitch.getUuid();
  }

  public void deleteNetwork(String networkId) {
    switchCapacityManager.deleteNetwork(connectionPool.getClient(), networkId);
  }

  public LogicalPort createPort(String networkId, String portId) throws IOException {
    return createPort(networkId, portId, true);
  }

  public LogicalPort createPort(String networkId, String portId, boolean adminStatusEnabled) throws IOException {
    return portAllocator.createPort(connectionPool.getClient(), networkId, portId, adminStatusEnabled);
  }

  public void deletePort(String portUuid) {
    deletePort(portUuid, null);
  }

  public void deletePort(String portUuid, @Nullable String switchUuid) {
    portAllocator.deleteNetworkPort(connectionPool.getClient(), portUuid, switchUuid);
  }
}
