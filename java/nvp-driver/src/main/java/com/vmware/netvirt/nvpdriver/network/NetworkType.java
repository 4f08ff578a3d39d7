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

/**
 * Network types a provider network may ask for, with the transport type each one rides on.
 */
public enum NetworkType {
  FLAT("flat", NvpTransportType.BRIDGE),
  /**
   * A bridge transport tagged with a VLAN id.
   */
  VLAN("vlan", NvpTransportType.BRIDGE),
  GRE("gre", NvpTransportType.GRE),
  STT("stt", NvpTransportType.STT),
  LOCAL("local", NvpTransportType.LOCAL),
  BRIDGE("bridge", NvpTransportType.BRIDGE);

  private final String value;
  private final NvpTransportType transportType;

  NetworkType(String value, NvpTransportType transportType) {
    this.value = value;
    this.transportType = transportType;
  }

  public String getValue() {
    return value;
  }

  public NvpTransportType getTransportType() {
    return transportType;
  }

  /**
   * Returns the network type with the given name, or null if there is none.
   */
  public static NetworkType fromValue(String value) {
    for (NetworkType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }

    return null;
  }
}
