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

package com.vmware.netvirt.nvpdriver;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * Address and credentials of one NVP controller.
 */
public class ControllerConfig {

  @NotBlank
  @JsonProperty("address")
  private String address;

  @NotNull
  @JsonProperty("username")
  private String username;

  @NotNull
  @JsonProperty("password")
  private String password;

  public ControllerConfig() {
  }

  public ControllerConfig(String address, String username, String password) {
    this.address = address;
    this.username = username;
    this.password = password;
  }

  public String getAddress() {
    return address;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("address", address)
        .add("username", username)
        .toString();
  }
}
