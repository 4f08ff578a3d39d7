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

import com.vmware.netvirt.nvpclient.NvpClient;
import com.vmware.netvirt.nvpclient.builders.ResourceQueryBuilder;
import com.vmware.netvirt.nvpclient.models.QueryResult;
import com.vmware.netvirt.nvpclient.models.TransportZone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;

/**
 * Looks up transport zones on the NVP controller.
 */
public class TransportZoneResolver {

  private static final Logger logger = LoggerFactory.getLogger(TransportZoneResolver.class);

  /**
   * Returns whether the controller knows a transport zone with the given uuid.
   */
  public boolean resolve(NvpClient client, String zoneUuid) throws IOException {
    checkNotNull(zoneUuid, "zoneUuid cannot be null");

    QueryResult<TransportZone> result = client.getTransportZoneApi().queryTransportZones(
        new ResourceQueryBuilder()
            .fields("uuid")
            .uuid(zoneUuid)
            .build());

    int count = result.getResultCount() != null
        ? result.getResultCount()
        : (result.getResults() == null ? 0 : result.getResults().size());
    logger.debug("Transport zone {} matched {} zone(s)", zoneUuid, count);
    return count >= 1;
  }
}
