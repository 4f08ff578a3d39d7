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

package com.vmware.netvirt.nvpclient.datatypes;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Transport types a logical switch can use when bound to a transport zone.
 */
public enum NvpTransportType {
  /**
   * Bridged onto a physical network. A VLAN id may be attached through a
   * VLAN translation binding.
   */
  @JsonProperty("bridge")
  BRIDGE("bridge"),

  @JsonProperty("gre")
  GRE("gre"),

  @JsonProperty("stt")
  STT("stt"),

  /**
   * Traffic stays local to the hypervisor.
   */
  @JsonProperty("local")
  LOCAL("local");

  private final String value;

  NvpTransportType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Returns the transport type with the given wire value, or null if there is none.
   */
  public static NvpTransportType fromValue(String value) {
    for (NvpTransportType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }

    return null;
  }
}
