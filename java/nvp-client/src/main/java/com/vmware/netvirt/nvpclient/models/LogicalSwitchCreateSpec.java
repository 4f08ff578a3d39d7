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

import com.vmware.netvirt.nvpclient.utils.ToStringHelper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical switch creation spec to be sent to the NVP controller.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogicalSwitchCreateSpec {
  @JsonProperty(value = "type")
  private String type = "LogicalSwitchConfig";

  @JsonProperty(value = "display_name")
  private String displayName;

  @JsonProperty(value = "port_isolation_enabled")
  private Boolean portIsolationEnabled = false;

  @JsonProperty(value = "tags")
  private List<Tag> tags = new ArrayList<>();

  @JsonProperty(value = "transport_zones")
  private List<TransportZoneBinding> transportZones = new ArrayList<>();

  public String getType() {
    return type;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public Boolean getPortIsolationEnabled() {
    return portIsolationEnabled;
  }

  public void setPortIsolationEnabled(Boolean portIsolationEnabled) {
    this.portIsolationEnabled = portIsolationEnabled;
  }

  public List<Tag> getTags() {
    return tags;
  }

  public void setTags(List<Tag> tags) {
    this.tags = tags;
  }

  public List<TransportZoneBinding> getTransportZones() {
    return transportZones;
  }

  public void setTransportZones(List<TransportZoneBinding> transportZones) {
    this.transportZones = transportZones;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || this.getClass() != o.getClass()) {
      return false;
    }

    LogicalSwitchCreateSpec other = (LogicalSwitchCreateSpec) o;
    return Objects.equals(this.type, other.type)
        && Objects.equals(this.displayName, other.displayName)
        && Objects.equals(this.portIsolationEnabled, other.portIsolationEnabled)
        && Objects.equals(this.tags, other.tags)
        && Objects.equals(this.transportZones, other.transportZones);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, displayName, portIsolationEnabled, tags, transportZones);
  }

  @Override
  public String toString() {
    return ToStringHelper.jsonObjectToString(this);
  }
}
