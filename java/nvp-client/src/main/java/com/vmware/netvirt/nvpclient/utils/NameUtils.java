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

/**
 * Helper class to generate the names for NVP related objects.
 */
public class NameUtils {

  /**
   * Longest display name or tag value the controller accepts.
   */
  public static final int MAX_NAME_LENGTH = 40;

  public static final String LOGICAL_PORT_NAME_PREFIX = "port-";

  public static String truncate(String name) {
    if (name == null || name.length() <= MAX_NAME_LENGTH) {
      return name;
    }

    return name.substring(0, MAX_NAME_LENGTH);
  }

  public static String getLogicalSwitchName(String networkId, String networkName) {
    return truncate(networkName == null || networkName.isEmpty() ? networkId : networkName);
  }

  public static String getLogicalPortName(String portId) {
    return truncate(LOGICAL_PORT_NAME_PREFIX + portId);
  }
}
