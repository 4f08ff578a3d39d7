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
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Represent the information of an NVP logical switch as returned by the controller.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogicalSwitch {
  @JsonProperty(value = "uuid", required = true)
  private String uuid;

  @JsonProperty(value = "display_name", required = false)
  private String displayName;

  @JsonProperty(value = "tags", required = false)
  private List<Tag> tags;

  @JsonProperty(value = "transport_zones", required = false)
  private List<TransportZoneBinding> transportZones;

  @JsonProperty(value = "_relations", required = false)
  private LogicalSwitchRelations relations;

  public String getUuid() {
    return uuid;
  }

  public void setUuid(String uuid) {
    this.uuid = uuid;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
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

  public LogicalSwitchRelations getRelations() {
    return relations;
  }

  public void setRelations(LogicalSwitchRelations relations) {
    this.relations = relations;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || this.getClass() != o.getClass()) {
      return false;
    }

    LogicalSwitch other = (LogicalSwitch) o;
    return Objects.equals(this.uuid, other.uuid)
        && Objects.equals(this.displayName, other.displayName)
        && Objects.equals(this.tags, other.tags)
        && Objects.equals(this.transportZones, other.transportZones)
        && Objects.equals(this.relations, other.relations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, displayName, tags, transportZones, relations);
  }

  @Override
  public String toString() {
    return ToStringHelper.jsonObjectToString(this);
  }
}
