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
import org.hibernate.validator.constraints.Range;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * NVP driver configuration.
 */
public class NvpDriverConfig {

  /**
   * Sentinel of {@link #getMaxPortsPerSwitch()} for switches without a port limit.
   */
  public static final int UNBOUNDED = 0;

  @NotNull
  @Range(min = 0, max = Integer.MAX_VALUE)
  @JsonProperty("max_ports_per_switch")
  private Integer maxPortsPerSwitch = UNBOUNDED;

  @NotNull
  @Range(min = 1, max = 5000)
  @JsonProperty("query_page_length")
  private Integer queryPageLength = 1000;

  @NotNull
  @Range(min = 1, max = Integer.MAX_VALUE)
  @JsonProperty("request_timeout_millis")
  private Long requestTimeoutMillis = 30000L;

  @Valid
  @NotEmpty
  @JsonProperty("controllers")
  private List<ControllerConfig> controllers = new ArrayList<>();

  public Integer getMaxPortsPerSwitch() {
    return maxPortsPerSwitch;
  }

  public void setMaxPortsPerSwitch(Integer maxPortsPerSwitch) {
    this.maxPortsPerSwitch = maxPortsPerSwitch;
  }

  public Integer getQueryPageLength() {
    return queryPageLength;
  }

  public void setQueryPageLength(Integer queryPageLength) {
    this.queryPageLength = queryPageLength;
  }

  public Long getRequestTimeoutMillis() {
    return requestTimeoutMillis;
  }

  public void setRequestTimeoutMillis(Long requestTimeoutMillis) {
    this.requestTimeoutMillis = requestTimeoutMillis;
  }

  public List<ControllerConfig> getControllers() {
    return controllers;
  }

  public void setControllers(List<ControllerConfig> controllers) {
    this.controllers = controllers;
  }
}
