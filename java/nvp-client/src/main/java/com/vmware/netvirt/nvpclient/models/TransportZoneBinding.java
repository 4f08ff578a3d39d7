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

package com.vmware.netvirt.nvpclient.models;

import com.vmware.netvirt.nvpclient.datatypes.NvpTransportType;
import com.vmware.netvirt.nvpclient.utils.ToStringHelper;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Attachment of a logical switch to a transport zone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransportZoneBinding {
  @JsonProperty(value = "zone_uuid", required = true)
  private String zoneUuid;

  @JsonProperty(value = "transport_type", required = true)
  private String transportType;

  @JsonProperty(value = "binding_config", required = false)
  private BindingConfig bindingConfig;

  public String getZoneUuid() {
    return zoneUuid;
  }

  public void setZoneUuid(String zoneUuid) {
    this.zoneUuid = zoneUuid;
  }

  /**
   * Returns the transport type as the controller reported it. Controllers know more types
   * than {@link NvpTransportType} lists, e.g. {@code ipsec_stt}.
   */
  public String getTransportType() {
    return transportType;
  }

  public void setTransportType(String transportType) {
    this.transportType = transportType;
  }

  /**
   * Returns the transport type, or null if it is not one this client creates switches with.
   */
  @JsonIgnore
  public NvpTransportType getKnownTransportType() {
    return NvpTransportType.fromValue(transportType);
  }

  public BindingConfig getBindingConfig() {
    return bindingConfig;
  }

  public void setBindingConfig(BindingConfig bindingConfig) {
    this.bindingConfig = bindingConfig;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || this.getClass() != o.getClass()) {
      return false;
    }

    TransportZoneBinding other = (TransportZoneBinding) o;
    return Objects.equals(this.zoneUuid, other.zoneUuid)
        && Objects.equals(this.transportType, other.transportType)
        && Objects.equals(this.bindingConfig, other.bindingConfig);
  }

  @Override
  public int hashCode() {
    return Objects.hash(zoneUuid, transportType, bindingConfig);
  }

  @Override
  public String toString() {
    return ToStringHelper.jsonObjectToString(this);
  }
}
