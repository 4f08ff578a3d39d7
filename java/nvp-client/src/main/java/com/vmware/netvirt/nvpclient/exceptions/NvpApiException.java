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

package com.vmware.netvirt.nvpclient.exceptions;

/**
 * Raised when a request to the NVP controller does not complete with the expected status.
 * <p>
 * A status code of {@link #NO_STATUS} means the request never produced a response,
 * e.g. it timed out or the connection failed.
 */
public class NvpApiException extends RuntimeException {

  public static final int NO_STATUS = 0;

  private final int statusCode;

  public NvpApiException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public NvpApiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_STATUS;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
