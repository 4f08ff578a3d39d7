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

package com.vmware.netvirt.nvpclient.utils;

import com.vmware.netvirt.nvpclient.models.Tag;

import java.util.ArrayList;
import java.util.List;

/**
 * Helper class related to tagging NVP objects.
 */
public class TagUtils {
  public static final String NETWORK_TAG_SCOPE = "neutron_net_id";
  public static final String PORT_TAG_SCOPE = "neutron_port_id";

  public static List<Tag> getLogicalSwitchTags(String networkId) {
    List<Tag> tags = new ArrayList<>();
    tags.add(getNetworkTag(networkId));

    return tags;
  }

  public static List<Tag> getLogicalPortTags(String networkId, String portId) {
    List<Tag> tags = new ArrayList<>();
    tags.add(getNetworkTag(networkId));
    tags.add(getPortTag(portId));

    return tags;
  }

  public static Tag getNetworkTag(String networkId) {
    return new Tag(NETWORK_TAG_SCOPE, NameUtils.truncate(networkId));
  }

  public static Tag getPortTag(String portId) {
    return new Tag(PORT_TAG_SCOPE, NameUtils.truncate(portId));
  }
}
