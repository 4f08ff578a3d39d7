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

package com.vmware.netvirt.nvpclient.builders;

import com.vmware.netvirt.nvpclient.datatypes.NvpTransportType;
import com.vmware.netvirt.nvpclient.models.BindingConfig;
import com.vmware.netvirt.nvpclient.models.LogicalSwitchCreateSpec;
import com.vmware.netvirt.nvpclient.models.Tag;
import com.vmware.netvirt.nvpclient.models.TransportZoneBinding;
import com.vmware.netvirt.nvpclient.models.VlanTranslation;
import com.vmware.netvirt.nvpclient.utils.NameUtils;

import com.google.common.collect.ImmutableList;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

import java.util.List;

/**
 * Builder for {@link com.vmware.netvirt.nvpclient.models.LogicalSwitchCreateSpec}.
 */
public class LogicalSwitchCreateSpecBuilder {
  private LogicalSwitchCreateSpec spec;

  public LogicalSwitchCreateSpecBuilder() {
    spec = new LogicalSwitchCreateSpec();
  }

  public LogicalSwitchCreateSpecBuilder displayName(String displayName) {
    spec.setDisplayName(NameUtils.truncate(displayName));
    return this;
  }

  public LogicalSwitchCreateSpecBuilder tags(List<Tag> tags) {
    spec.getTags().addAll(tags);
    return this;
  }

  /**
   * Binds the switch to a transport zone. A VLAN translation binding is added when a VLAN id is given.
   */
  public LogicalSwitchCreateSpecBuilder transportZone(String zoneUuid,
                                                      NvpTransportType transportType,
                                                      @Nullable Integer vlanId) {
    checkNotNull(zoneUuid, "zoneUuid cannot be null");
    checkNotNull(transportType, "transportType cannot be null");

    TransportZoneBinding binding = new TransportZoneBinding();
    binding.setZoneUuid(zoneUuid);
    binding.setTransportType(transportType.getValue());
    if (vlanId != null) {
      BindingConfig bindingConfig = new BindingConfig();
      bindingConfig.setVlanTranslation(ImmutableList.of(new VlanTranslation(vlanId)));
      binding.setBindingConfig(bindingConfig);
    }

    spec.getTransportZones().add(binding);
    return this;
  }

  public LogicalSwitchCreateSpec build() {
    return spec;
  }
}
