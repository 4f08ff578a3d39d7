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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class of the failures the NVP driver raises on its own account.
 * Failures of the controller requests surface as
 * {@link com.vmware.netvirt.nvpclient.exceptions.NvpApiException} instead.
 */
public class NvpDriverException extends RuntimeException {

  private final ErrorCode errorCode;

  public NvpDriverException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = checkNotNull(errorCode, "errorCode cannot be null");
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return String.format("%s: %s", errorCode.getCode(), getMessage());
  }
}
