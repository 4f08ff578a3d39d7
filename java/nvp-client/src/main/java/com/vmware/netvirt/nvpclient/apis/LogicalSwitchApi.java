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
import com.vmware.netvirt.nvpclient.models.LogicalPort;
import com.vmware.netvirt.nvpclient.models.LogicalPortCreateSpec;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpclient.models.LogicalSwitchCreateSpec;
import com.vmware.netvirt.nvpclient.models.QueryResult;
import com.vmware.netvirt.nvpclient.models.ResourceQuery;

import com.fasterxml.jackson.core.type.TypeReference;
import org.apache.http.HttpStatus;

import java.io.IOException;

/**
 * Class for NVP logical switch and logical port related APIs.
 */
public class LogicalSwitchApi extends NvpClientApi {

  /**
   * Stands for every switch when querying logical ports.
   */
  public static final String ANY_SWITCH = "*";

  public final String logicalSwitchBasePath = BASE_PATH + "/lswitch";

  public LogicalSwitchApi(RestClient restClient) {
    super(restClient);
  }

  public LogicalSwitch createLogicalSwitch(LogicalSwitchCreateSpec spec) throws IOException {
    return post(logicalSwitchBasePath,
        serializeObjectAsJson(spec),
        HttpStatus.SC_CREATED,
        new TypeReference<LogicalSwitch>() {
        });
  }

  public QueryCursor<LogicalSwitch> queryLogicalSwitches(ResourceQuery query) {
    return query(logicalSwitchBasePath,
        query,
        new TypeReference<QueryResult<LogicalSwitch>>() {
        });
  }

  public void deleteLogicalSwitch(String uuid) {
    delete(logicalSwitchBasePath + "/" + uuid, HttpStatus.SC_NO_CONTENT);
  }

  public String getLogicalPortBasePath(String switchUuid) {
    return logicalSwitchBasePath + "/" + switchUuid + "/lport";
  }

  public LogicalPort createLogicalPort(String switchUuid, LogicalPortCreateSpec spec) throws IOException {
    return post(getLogicalPortBasePath(switchUuid),
        serializeObjectAsJson(spec),
        HttpStatus.SC_CREATED,
        new TypeReference<LogicalPort>() {
        });
  }

  /**
   * Queries the logical ports of one switch, or of every switch when given {@link #ANY_SWITCH}.
   */
  public QueryCursor<LogicalPort> queryLogicalPorts(String switchUuid, ResourceQuery query) {
    return query(getLogicalPortBasePath(switchUuid),
        query,
        new TypeReference<QueryResult<LogicalPort>>() {
        });
  }

  public void deleteLogicalPort(String switchUuid, String portUuid) {
    delete(getLogicalPortBasePath(switchUuid) + "/" + portUuid, HttpStatus.SC_NO_CONTENT);
  }
}
