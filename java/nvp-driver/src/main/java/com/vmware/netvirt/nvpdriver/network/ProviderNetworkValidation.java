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

package com.vmware.netvirt.nvpdriver.network;

import com.vmware.netvirt.nvpclient.datatypes.NvpTransportType;
import com.vmware.netvirt.nvpdriver.exceptions.ErrorCode;
import com.vmware.netvirt.nvpdriver.exceptions.ProviderNetworkException;

import com.google.common.base.MoreObjects;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * Outcome of validating provider network attributes: either a failure with its error code, or a
 * success that carries the transport zone binding to apply, if any.
 */
public class ProviderNetworkValidation {

  private static final ProviderNetworkValidation UNBOUND = new ProviderNetworkValidation(null, null, null, null, null);

  private final ErrorCode errorCode;
  private final String message;
  private final String zoneUuid;
  private final NvpTransportType transportType;
  private final Integer vlanId;

  private ProviderNetworkValidation(ErrorCode errorCode, String message, String zoneUuid,
                                    NvpTransportType transportType, Integer vlanId) {
    this.errorCode = errorCode;
    this.message = message;
    this.zoneUuid = zoneUuid;
    this.transportType = transportType;
    this.vlanId = vlanId;
  }

  /**
   * Valid attributes that leave the switch out of any transport zone.
   */
  public static ProviderNetworkValidation unbound() {
    return UNBOUND;
  }

  /**
   * Valid attributes that bind the switch to a transport zone.
   */
  public static ProviderNetworkValidation bound(String zoneUuid, NvpTransportType transportType,
                                                @Nullable Integer vlanId) {
    checkNotNull(zoneUuid, "zoneUuid cannot be null");
    checkNotNull(transportType, "transportType cannot be null");
    return new ProviderNetworkValidation(null, null, zoneUuid, transportType, vlanId);
  }

  public static ProviderNetworkValidation failed(ErrorCode errorCode, String message) {
    checkNotNull(errorCode, "errorCode cannot be null");
    return new ProviderNetworkValidation(errorCode, message, null, null, null);
  }

  public boolean isValid() {
    return errorCode == null;
  }

  public boolean isBound() {
    return zoneUuid != null;
  }

  @Nullable
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  @Nullable
  public String getMessage() {
    return message;
  }

  @Nullable
  public String getZoneUuid() {
    return zoneUuid;
  }

  @Nullable
  public NvpTransportType getTransportType() {
    return transportType;
  }

  @Nullable
  public Integer getVlanId() {
    return vlanId;
  }

  /**
   * Throws {@link ProviderNetworkException} if the validation failed.
   */
  public ProviderNetworkValidation checkValid() {
    if (!isValid()) {
      throw new ProviderNetworkException(errorCode, message);
    }

    return this;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("errorCode", errorCode)
        .add("message", message)
        .add("zoneUuid", zoneUuid)
        .add("transportType", transportType)
        .add("vlanId", vlanId)
        .toString();
  }
}
