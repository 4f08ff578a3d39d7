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

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * Provider network attributes as requested by the caller, before validation.
 */
public class ProviderNetworkParams {

  private static final ProviderNetworkParams NONE = new ProviderNetworkParams(null, null, null);

  private final String physNet;
  private final String netType;
  private final Integer segmentId;

  public ProviderNetworkParams(@Nullable String physNet, @Nullable String netType, @Nullable Integer segmentId) {
    this.physNet = physNet;
    this.netType = netType;
    this.segmentId = segmentId;
  }

  /**
   * Attributes of a private network, which is not bound to any transport zone.
   */
  public static ProviderNetworkParams none() {
    return NONE;
  }

  @Nullable
  public String getPhysNet() {
    return physNet;
  }

  @Nullable
  public String getNetType() {
    return netType;
  }

  @Nullable
  public Integer getSegmentId() {
    return segmentId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    ProviderNetworkParams other = (ProviderNetworkParams) o;
    return Objects.equals(physNet, other.physNet)
        && Objects.equals(netType, other.netType)
        && Objects.equals(segmentId, other.segmentId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(physNet, netType, segmentId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("physNet", physNet)
        .add("netType", netType)
        .add("segmentId", segmentId)
        .toString();
  }
}
