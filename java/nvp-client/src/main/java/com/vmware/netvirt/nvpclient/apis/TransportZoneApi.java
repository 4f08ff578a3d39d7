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

package com.vmware.netvirt.nvpclient.apis;

import com.vmware.netvirt.nvpclient.RestClient;
import com.vmware.netvirt.nvpclient.models.QueryResult;
import com.vmware.netvirt.nvpclient.models.ResourceQuery;
import com.vmware.netvirt.nvpclient.models.TransportZone;

import com.fasterxml.jackson.core.type.TypeReference;
import org.apache.http.HttpStatus;

import java.io.IOException;

/**
 * Class for NVP transport zone related APIs.
 */
public class TransportZoneApi extends NvpClientApi {
  public final String transportZoneBasePath = BASE_PATH + "/transport-zone";

  public TransportZoneApi(RestClient restClient) {
    super(restClient);
  }

  /**
   * Returns the first page of transport zones matching the query.
   */
  public QueryResult<TransportZone> queryTransportZones(ResourceQuery query) throws IOException {
    return get(buildPath(transportZoneBasePath, query.toParameters(null)),
        HttpStatus.SC_OK,
        new TypeReference<QueryResult<TransportZone>>() {
        });
  }
}
