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
 * Raised when the provider context of a network cannot be resolved.
 */
public class BadNvpStateException extends NvpDriverException {

  public BadNvpStateException(String networkId) {
    super(ErrorCode.BAD_NVP_STATE, "Could not resolve the provider context of network " + networkId);
  }
}
