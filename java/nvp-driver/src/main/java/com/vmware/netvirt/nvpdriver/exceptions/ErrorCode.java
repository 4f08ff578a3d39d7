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

package com.vmware.netvirt.nvpdriver.exceptions;

/**
 * Error codes reported by the NVP driver.
 */
public enum ErrorCode {
  PROVIDERNET_PARAM_ERROR("ProvidernetParamError"),
  INVALID_PHYSICAL_NETWORK_TYPE("InvalidPhysicalNetworkType"),
  SEGMENT_ID_REQUIRED("SegmentIdRequired"),
  SEGMENT_ID_UNSUPPORTED("SegmentIdUnsupported"),
  PHYSICAL_NETWORK_NOT_FOUND("PhysicalNetworkNotFound"),
  BAD_NVP_STATE("BadNVPState"),
  AMBIGUOUS_PORT_PLACEMENT("AmbiguousPortPlacement");

  private final String code;

  ErrorCode(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
