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

import com.vmware.netvirt.nvpclient.datatypes.NvpTransportType;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * Provider configuration of a network as read back from one of its logical switches.
 */
public class NetworkDetails {

  /**
   * Details of a network that has no switch yet.
   */
  public static final NetworkDetails EMPTY = new NetworkDetails(null, null, null, null);

  private final String networkName;
  private final String physNet;
  private final String physType;
  private final Integer segmentId;

  public NetworkDetails(@Nullable String networkName,
                        @Nullable String physNet,
                        @Nullable String physType,
                        @Nullable Integer segmentId) {
    this.networkName = networkName;
    this.physNet = physNet;
    this.physType = physType;
    this.segmentId = segmentId;
  }

  @Nullable
  public String getNetworkName() {
    return networkName;
  }

  @Nullable
  public String getPhysNet() {
    return physNet;
  }

  /**
   * Returns the transport type of the switch's zone binding as the controller reported it.
   */
  @Nullable
  public String getPhysType() {
    return physType;
  }

  @Nullable
  public Integer getSegmentId() {
    return segmentId;
  }

  public boolean isEmpty() {
    return networkName == null && physNet == null && physType == null && segmentId == null;
  }

  /**
   * Expresses these details as the provider attributes of a further switch of the same network.
   * A bridge binding with a VLAN id reads back as a vlan network. Any other transport type is
   * passed on as the network type, and is rejected there if it is not one a switch can be created with.
   */
  public ProviderNetworkParams toProviderNetworkParams() {
    if (physNet == null) {
      return ProviderNetworkParams.none();
    }

    if (physType == null) {
      return new ProviderNetworkParams(physNet, null, null);
    }

    if (NvpTransportType.BRIDGE.getValue().equals(physType) && segmentId != null) {
      return new ProviderNetworkParams(physNet, NetworkType.VLAN.getValue(), segmentId);
    }

    return new ProviderNetworkParams(physNet, physType, null);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    NetworkDetails other = (NetworkDetails) o;
    return Objects.equals(networkName, other.networkName)
        && Objects.equals(physNet, other.physNet)
        && Objects.equals(physType, other.physType)
        && Objects.equals(segmentId, other.segmentId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(networkName, physNet, physType, segmentId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("networkName", networkName)
        .add("physNet", physNet)
        .add("physType", physType)
        .add("segmentId", segmentId)
        .toString();
  }
}
