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

package com.vmware.netvirt.nvpdriver.network;

import com.vmware.netvirt.nvpclient.models.BindingConfig;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpclient.models.TransportZoneBinding;
import com.vmware.netvirt.nvpdriver.NetworkRegistry;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;
import java.util.List;

/**
 * Reads the provider configuration of a network from its existing logical switches.
 * <p>
 * Only the first switch, and its first transport zone binding, are looked at.
 */
public class NetworkDetailsExtractor {

  private static final Logger logger = LoggerFactory.getLogger(NetworkDetailsExtractor.class);

  private final NetworkRegistry networkRegistry;

  @Inject
  public NetworkDetailsExtractor(NetworkRegistry networkRegistry) {
    this.networkRegistry = networkRegistry;
  }

  /**
   * Returns the details of the network, or absent if the network itself is unknown.
   * A known network without switches has {@link NetworkDetails#EMPTY} details.
   */
  public Optional<NetworkDetails> extract(String networkId, Iterable<LogicalSwitch> switches) {
    checkNotNull(switches, "switches cannot be null");

    if (!networkRegistry.contains(networkId)) {
      logger.debug("Network {} is not registered", networkId);
      return Optional.absent();
    }

    Iterator<LogicalSwitch> iterator = switches.iterator();
    if (!iterator.hasNext()) {
      return Optional.of(NetworkDetails.EMPTY);
    }

    LogicalSwitch first = iterator.next();
    List<TransportZoneBinding> zones = first.getTransportZones();
    if (zones == null || zones.isEmpty()) {
      return Optional.of(new NetworkDetails(first.getDisplayName(), null, null, null));
    }

    TransportZoneBinding zone = zones.get(0);
    String physType = zone.getTransportType();
    Integer segmentId = null;
    BindingConfig bindingConfig = zone.getBindingConfig();
    if (bindingConfig != null
        && bindingConfig.getVlanTranslation() != null
        && !bindingConfig.getVlanTranslation().isEmpty()) {
      segmentId = bindingConfig.getVlanTranslation().get(0).getTransport();
    }

    NetworkDetails details = new NetworkDetails(first.getDisplayName(), zone.getZoneUuid(), physType, segmentId);
    logger.debug("Network {} has details {}", networkId, details);
    return Optional.of(details);
  }
}
