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

import java.util.Collection;

/**
 * Raised when a port does not resolve to exactly one hosting logical switch.
 */
public class PortPlacementException extends NvpDriverException {

  public PortPlacementException(String portId, Collection<String> switchUuids) {
    super(ErrorCode.AMBIGUOUS_PORT_PLACEMENT,
        String.format("Port %s is hosted by %d logical switches %s, expected exactly one",
            portId, switchUuids.size(), switchUuids));
  }
}
