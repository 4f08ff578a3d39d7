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

import com.vmware.netvirt.nvpclient.NvpClient;
import com.vmware.netvirt.nvpclient.builders.LogicalSwitchCreateSpecBuilder;
import com.vmware.netvirt.nvpdriver.exceptions.ErrorCode;

import com.google.common.base.Strings;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;

/**
 * Validates provider network attributes and turns them into the transport zone binding of a logical switch.
 * <p>
 * The checks run in this order, the first failing one decides the outcome:
 * <ol>
 *   <li>physical network and network type are both given, or both absent;</li>
 *   <li>the network type is a known one;</li>
 *   <li>a VLAN network has a segment id;</li>
 *   <li>any other network has none;</li>
 *   <li>the physical network is a transport zone the controller knows.</li>
 * </ol>
 */
public class ProviderNetworkConfigurator {

  private static final Logger logger = LoggerFactory.getLogger(ProviderNetworkConfigurator.class);

  private final TransportZoneResolver transportZoneResolver;

  @Inject
  public ProviderNetworkConfigurator(TransportZoneResolver transportZoneResolver) {
    this.transportZoneResolver = transportZoneResolver;
  }

  /**
   * Validates the attributes without touching any switch. Only the transport zone lookup goes to the controller.
   */
  public ProviderNetworkValidation validate(NvpClient client, ProviderNetworkParams params) throws IOException {
    checkNotNull(params, "params cannot be null");

    String physNet = params.getPhysNet();
    String netType = params.getNetType();
    Integer segmentId = params.getSegmentId();

    if (Strings.isNullOrEmpty(physNet) && Strings.isNullOrEmpty(netType)) {
      return ProviderNetworkValidation.unbound();
    }

    if (Strings.isNullOrEmpty(physNet) || Strings.isNullOrEmpty(netType)) {
      return ProviderNetworkValidation.failed(ErrorCode.PROVIDERNET_PARAM_ERROR,
          "Both a physical network and a network type are required, or neither");
    }

    NetworkType networkType = NetworkType.fromValue(netType);
    if (networkType == null) {
      return ProviderNetworkValidation.failed(ErrorCode.INVALID_PHYSICAL_NETWORK_TYPE,
          "Unknown physical network type: " + netType);
    }

    if (networkType == NetworkType.VLAN && segmentId == null) {
      return ProviderNetworkValidation.failed(ErrorCode.SEGMENT_ID_REQUIRED,
          "A segment id is required for network type vlan");
    }

    if (networkType != NetworkType.VLAN && segmentId != null) {
      return ProviderNetworkValidation.failed(ErrorCode.SEGMENT_ID_UNSUPPORTED,
          "A segment id is not supported for network type " + networkType.getValue());
    }

    if (!transportZoneResolver.resolve(client, physNet)) {
      return ProviderNetworkValidation.failed(ErrorCode.PHYSICAL_NETWORK_NOT_FOUND,
          "Physical network " + physNet + " not found");
    }

    return ProviderNetworkValidation.bound(physNet, networkType.getTransportType(),
        networkType == NetworkType.VLAN ? segmentId : null);
  }

  /**
   * Validates the attributes and, when they name a transport zone, binds the switch being built to it.
   * Nothing is applied to the builder unless the validation succeeds.
   */
  public ProviderNetworkValidation configure(NvpClient client,
                                             LogicalSwitchCreateSpecBuilder switchBuilder,
                                             ProviderNetworkParams params) throws IOException {
    checkNotNull(switchBuilder, "switchBuilder cannot be null");

    ProviderNetworkValidation validation = validate(client, params);
    if (!validation.isValid()) {
      logger.debug("Rejected provider network attributes {}: {}", params, validation);
      return validation;
    }

    if (validation.isBound()) {
      logger.debug("Binding switch to transport zone {} as {}", validation.getZoneUuid(),
          validation.getTransportType());
      switchBuilder.transportZone(validation.getZoneUuid(), validation.getTransportType(), validation.getVlanId());
    }

    return validation;
  }
}
