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

import java.util.Objects;

/**
 * Relations that can be requested alongside a logical port.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogicalPortRelations {
  public static final String LOGICAL_SWITCH_CONFIG = "LogicalSwitchConfig";

  @JsonProperty(value = LOGICAL_SWITCH_CONFIG, required = false)
  private ResourceReference logicalSwitchConfig;

  public ResourceReference getLogicalSwitchConfig() {
    return logicalSwitchConfig;
  }

  public void setLogicalSwitchConfig(ResourceReference logicalSwitchConfig) {
    this.logicalSwitchConfig = logicalSwitchConfig;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || this.getClass() != o.getClass()) {
      return false;
    }

    LogicalPortRelations other = (LogicalPortRelations) o;
    return Objects.equals(this.logicalSwitchConfig, other.logicalSwitchConfig);
  }

  @Override
  public int hashCode() {
    return Objects.hash(logicalSwitchConfig);
  }

  @Override
  public String toString() {
    return ToStringHelper.jsonObjectToString(this);
  }
}
