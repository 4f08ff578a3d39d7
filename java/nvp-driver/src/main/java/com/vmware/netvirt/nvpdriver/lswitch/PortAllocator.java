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

package com.vmware.netvirt.nvpdriver.lswitch;

import com.vmware.netvirt.nvpclient.NvpClient;
import com.vmware.netvirt.nvpclient.apis.LogicalSwitchApi;
import com.vmware.netvirt.nvpclient.builders.LogicalPortCreateSpecBuilder;
import com.vmware.netvirt.nvpclient.builders.ResourceQueryBuilder;
import com.vmware.netvirt.nvpclient.exceptions.NvpApiException;
import com.vmware.netvirt.nvpclient.models.LogicalPort;
import com.vmware.netvirt.nvpclient.models.LogicalPortCreateSpec;
import com.vmware.netvirt.nvpclient.models.LogicalPortRelations;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpclient.models.ResourceReference;
import com.vmware.netvirt.nvpclient.utils.NameUtils;
import com.vmware.netvirt.nvpclient.utils.TagUtils;
import com.vmware.netvirt.nvpdriver.exceptions.PortPlacementException;

import com.google.common.base.Strings;
import com.google.inject.Inject;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Creates and deletes the logical ports of networks.
 */
public class PortAllocator {

  private static final Logger logger = LoggerFactory.getLogger(PortAllocator.class);

  private final SwitchCapacityManager switchCapacityManager;

  @Inject
  public PortAllocator(SwitchCapacityManager switchCapacityManager) {
    this.switchCapacityManager = switchCapacityManager;
  }

  /**
   * Creates a port for the network on the switch chosen by {@link SwitchCapacityManager}.
   *
   * @return the created port, its relations naming the hosting switch.
   */
  public LogicalPort createPort(NvpClient client,
                                String networkId,
                                String portId,
                                boolean adminStatusEnabled) throws IOException {
    checkNotNull(networkId, "networkId cannot be null");
    checkNotNull(portId, "portId cannot be null");

    LogicalSwitch logicalSwitch = switchCapacityManager.selectOrCreateSwitch(client, networkId);

    LogicalPortCreateSpec spec = new LogicalPortCreateSpecBuilder()
        .displayName(NameUtils.getLogicalPortName(portId))
        .adminStatusEnabled(adminStatusEnabled)
        .tags(TagUtils.getLogicalPortTags(networkId, portId))
        .build();

    LogicalPort logicalPort = client.getLogicalSwitchApi().createLogicalPort(logicalSwitch.getUuid(), spec);
    if (logicalPort.getLogicalSwitchUuid() == null) {
      LogicalPortRelations relations = new LogicalPortRelations();
      relations.setLogicalSwitchConfig(new ResourceReference(logicalSwitch.getUuid()));
      logicalPort.setRelations(relations);
    }

    logger.info("Created port {} for port {} of network {} on switch {}", logicalPort.getUuid(), portId, networkId,
        logicalSwitch.getUuid());
    return logicalPort;
  }

  /**
   * Deletes a port by the uuid the controller gave it.
   * <p>
   * When the hosting switch is not given, it is looked up across all switches, and the port has to be found
   * on exactly one of them.
   */
  public void deleteNetworkPort(NvpClient client, String portUuid, @Nullable String switchUuid) {
    checkNotNull(portUuid, "portUuid cannot be null");

    LogicalSwitchApi logicalSwitchApi = client.getLogicalSwitchApi();
    String hostingSwitchUuid = switchUuid;
    if (Strings.isNullOrEmpty(hostingSwitchUuid)) {
      hostingSwitchUuid = findHostingSwitch(logicalSwitchApi, portUuid);
    }

    try {
      logicalSwitchApi.deleteLogicalPort(hostingSwitchUuid, portUuid);
      logger.info("Deleted port {} from switch {}", portUuid, hostingSwitchUuid);
    } catch (NvpApiException e) {
      if (e.getStatusCode() != HttpStatus.SC_NOT_FOUND) {
        throw e;
      }
      logger.warn("Port {} was already deleted from switch {}", portUuid, hostingSwitchUuid);
    }
  }

  private String findHostingSwitch(LogicalSwitchApi logicalSwitchApi, String portUuid) {
    Iterable<LogicalPort> ports = logicalSwitchApi.queryLogicalPorts(LogicalSwitchApi.ANY_SWITCH,
        new ResourceQueryBuilder()
            .uuid(portUuid)
            .relation(LogicalPortRelations.LOGICAL_SWITCH_CONFIG)
            .build());

    Set<String> switchUuids = new LinkedHashSet<>();
    for (LogicalPort port : ports) {
      if (port.getLogicalSwitchUuid() != null) {
        switchUuids.add(port.getLogicalSwitchUuid());
      }
    }

    if (switchUuids.size() != 1) {
      throw new PortPlacementException(portUuid, switchUuids);
    }

    String hostingSwitchUuid = switchUuids.iterator().next();
    logger.debug("Port {} is hosted by switch {}", portUuid, hostingSwitchUuid);
    return hostingSwitchUuid;
  }
}
