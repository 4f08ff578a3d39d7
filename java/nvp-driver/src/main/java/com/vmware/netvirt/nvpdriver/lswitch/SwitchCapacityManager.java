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
import com.vmware.netvirt.nvpclient.apis.QueryCursor;
import com.vmware.netvirt.nvpclient.builders.LogicalSwitchCreateSpecBuilder;
import com.vmware.netvirt.nvpclient.builders.ResourceQueryBuilder;
import com.vmware.netvirt.nvpclient.exceptions.NvpApiException;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpclient.models.LogicalSwitchRelations;
import com.vmware.netvirt.nvpclient.utils.NameUtils;
import com.vmware.netvirt.nvpclient.utils.TagUtils;
import com.vmware.netvirt.nvpdriver.exceptions.BadNvpStateException;
import com.vmware.netvirt.nvpdriver.network.NetworkDetails;
import com.vmware.netvirt.nvpdriver.network.NetworkDetailsExtractor;
import com.vmware.netvirt.nvpdriver.network.ProviderNetworkConfigurator;
import com.vmware.netvirt.nvpdriver.network.ProviderNetworkParams;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.apache.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Decides which logical switch of a network hosts the next port.
 * <p>
 * A network spans as many switches as its ports need: the first switch with room is reused, and a new
 * switch, bound like the existing ones, is created only when every switch is full or there is none.
 * A limit of 0 ports per switch means switches never fill up.
 */
public class SwitchCapacityManager {

  private static final Logger logger = LoggerFactory.getLogger(SwitchCapacityManager.class);

  private final NetworkDetailsExtractor networkDetailsExtractor;
  private final ProviderNetworkConfigurator providerNetworkConfigurator;
  private final int maxPortsPerSwitch;
  private final int queryPageLength;

  public SwitchCapacityManager(NetworkDetailsExtractor networkDetailsExtractor,
                               ProviderNetworkConfigurator providerNetworkConfigurator,
                               int maxPortsPerSwitch,
                               int queryPageLength) {
    checkArgument(maxPortsPerSwitch >= 0, "maxPortsPerSwitch cannot be negative");
    checkArgument(queryPageLength > 0, "queryPageLength must be positive");

    this.networkDetailsExtractor = networkDetailsExtractor;
    this.providerNetworkConfigurator = providerNetworkConfigurator;
    this.maxPortsPerSwitch = maxPortsPerSwitch;
    this.queryPageLength = queryPageLength;
  }

  public int getMaxPortsPerSwitch() {
    return maxPortsPerSwitch;
  }

  /**
   * Queries the switches tagged with the network, along with their port counts.
   */
  public QueryCursor<LogicalSwitch> lswitchesForNetwork(NvpClient client, String networkId) {
    checkNotNull(networkId, "networkId cannot be null");

    return client.getLogicalSwitchApi().queryLogicalSwitches(new ResourceQueryBuilder()
        .tag(TagUtils.getNetworkTag(networkId))
        .relation(LogicalSwitchRelations.LOGICAL_SWITCH_STATUS)
        .pageLength(queryPageLength)
        .build());
  }

  /**
   * Returns the switch that should host the next port of the network, creating one when none has room.
   */
  public LogicalSwitch selectOrCreateSwitch(NvpClient client, String networkId) throws IOException {
    QueryCursor<LogicalSwitch> switches = lswitchesForNetwork(client, networkId);

    Optional<NetworkDetails> details = networkDetailsExtractor.extract(networkId, switches);
    if (!details.isPresent()) {
      throw new BadNvpStateException(networkId);
    }

    for (LogicalSwitch logicalSwitch : switches) {
      if (hasRoom(logicalSwitch)) {
        logger.debug("Selected switch {} of network {} with {} port(s)", logicalSwitch.getUuid(), networkId,
            getPortCount(logicalSwitch));
        return logicalSwitch;
      }
    }

    logger.debug("No switch of network {} has room for another port", networkId);
    NetworkDetails networkDetails = details.get();
    return createSwitch(client, networkId, networkDetails.getNetworkName(),
        networkDetails.toProviderNetworkParams());
  }

  /**
   * Creates a switch for the network, bound as the provider attributes say.
   * The attributes are validated before the switch is created.
   */
  public LogicalSwitch createSwitch(NvpClient client,
                                    String networkId,
                                    @Nullable String networkName,
                                    ProviderNetworkParams params) throws IOException {
    checkNotNull(networkId, "networkId cannot be null");

    LogicalSwitchCreateSpecBuilder builder = new LogicalSwitchCreateSpecBuilder()
        .displayName(NameUtils.getLogicalSwitchName(networkId, networkName))
        .tags(TagUtils.getLogicalSwitchTags(networkId));
    providerNetworkConfigurator.configure(client, builder, params).checkValid();

    LogicalSwitch logicalSwitch = client.getLogicalSwitchApi().createLogicalSwitch(builder.build());
    logger.info("Created switch {} for network {}", logicalSwitch.getUuid(), networkId);
    return logicalSwitch;
  }

  /**
   * Deletes every switch of the network. A network without switches is left as is.
   */
  public void deleteNetwork(NvpClient client, String networkId) {
    List<LogicalSwitch> switches = ImmutableList.copyOf(lswitchesForNetwork(client, networkId));
    if (switches.isEmpty()) {
      logger.info("Network {} has no switch to delete", networkId);
      return;
    }

    LogicalSwitchApi logicalSwitchApi = client.getLogicalSwitchApi();
    for (LogicalSwitch logicalSwitch : switches) {
      try {
        logicalSwitchApi.deleteLogicalSwitch(logicalSwitch.getUuid());
        logger.info("Deleted switch {} of network {}", logicalSwitch.getUuid(), networkId);
      } catch (NvpApiException e) {
        if (e.getStatusCode() != HttpStatus.SC_NOT_FOUND) {
          throw e;
        }
        logger.warn("Switch {} of network {} was already deleted", logicalSwitch.getUuid(), networkId);
      }
    }
  }

  private boolean hasRoom(LogicalSwitch logicalSwitch) {
    if (maxPortsPerSwitch == 0) {
      return true;
    }

    Integer portCount = getPortCount(logicalSwitch);
    if (portCount == null) {
      logger.warn("Switch {} came back without a port count, treating it as full", logicalSwitch.getUuid());
      return false;
    }

    return portCount < maxPortsPerSwitch;
  }

  @Nullable
  private static Integer getPortCount(LogicalSwitch logicalSwitch) {
    if (logicalSwitch.getRelations() == null || logicalSwitch.getRelations().getLogicalSwitchStatus() == null) {
      return null;
    }

    return logicalSwitch.getRelations().getLogicalSwitchStatus().getLogicalPortCount();
  }
}
