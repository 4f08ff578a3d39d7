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

import java.util.List;
import java.util.Objects;

/**
 * Binding configuration of a transport zone attachment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BindingConfig {
  @JsonProperty(value = "vlan_translation", required = false)
  private List<VlanTranslation> vlanTranslation;

  public List<VlanTranslation> getVlanTranslation() {
    return vlanTranslation;
  }

  public void setVlanTranslation(List<VlanTranslation> vlanTranslation) {
    this.vlanTranslation = vlanTranslation;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || this.getClass() != o.getClass()) {
      return false;
    }

    BindingConfig other = (BindingConfig) o;
    return Objects.equals(this.vlanTranslation, other.vlanTranslation);
  }

  @Override
  public int hashCode() {
    return Objects.hash(vlanTranslation);
  }

  @Override
  public String toString() {
    return ToStringHelper.jsonObjectToString(this);
  }
}
