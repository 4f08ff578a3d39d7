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

package com.vmware.netvirt.nvpdriver.lswitch;

import com.vmware.netvirt.nvpclient.NvpClient;
import com.vmware.netvirt.nvpclient.apis.LogicalSwitchApi;
import com.vmware.netvirt.nvpclient.apis.QueryCursor;
import com.vmware.netvirt.nvpclient.exceptions.NvpApiException;
import com.vmware.netvirt.nvpclient.models.LogicalPort;
import com.vmware.netvirt.nvpclient.models.LogicalPortCreateSpec;
import com.vmware.netvirt.nvpclient.models.LogicalPortRelations;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpclient.models.QueryResult;
import com.vmware.netvirt.nvpclient.models.ResourceQuery;
import com.vmware.netvirt.nvpclient.models.ResourceReference;
import com.vmware.netvirt.nvpclient.models.Tag;
import com.vmware.netvirt.nvpdriver.exceptions.BadNvpStateException;
import com.vmware.netvirt.nvpdriver.exceptions.ErrorCode;
import com.vmware.netvirt.nvpdriver.exceptions.PortPlacementException;

import com.google.common.collect.ImmutableList;
import org.apache.http.HttpStatus;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.fail;

import java.util.List;

/**
 * Tests for {@link com.vmware.netvirt.nvpdriver.lswitch.PortAllocator}.
 */
public class PortAllocatorTest {

  private static final String NETWORK_ID = "12345678-1234-1234-1234-123412341234";
  private static final String PORT_ID = "12345678-0000-0000-0000-123412341234";
  private static final String LSWITCH_UUID = "12345678-1234-1234-1234-123456781234";
  private static final String LPORT_UUID = "12345678-0000-0000-0000-123456781234";

  /**
   * Tests for creating ports.
   */
  public static class CreatePortTest {
    private NvpClient client;
    private LogicalSwitchApi logicalSwitchApi;
    private SwitchCapacityManager switchCapacityManager;
    private PortAllocator portAllocator;

    @BeforeMethod
    public void setup() throws Exception {
      client = mock(NvpClient.class);
      logicalSwitchApi = mock(LogicalSwitchApi.class);
      doReturn(logicalSwitchApi).when(client).getLogicalSwitchApi();

      LogicalSwitch logicalSwitch = new LogicalSwitch();
      logicalSwitch.setUuid(LSWITCH_UUID);
      switchCapacityManager = mock(SwitchCapacityManager.class);
      doReturn(logicalSwitch).when(switchCapacityManager).selectOrCreateSwitch(client, NETWORK_ID);

      LogicalPort logicalPort = new LogicalPort();
      logicalPort.setUuid(LPORT_UUID);
      doReturn(logicalPort).when(logicalSwitchApi)
          .createLogicalPort(eq(LSWITCH_UUID), any(LogicalPortCreateSpec.class));

      portAllocator = new PortAllocator(switchCapacityManager);
    }

    @Test(dataProvider = "adminStatus")
    public void testCreatePort(boolean adminStatusEnabled) throws Exception {
      LogicalPort logicalPort = portAllocator.createPort(client, NETWORK_ID, PORT_ID, adminStatusEnabled);

      assertThat(logicalPort.getUuid(), is(LPORT_UUID));
      assertThat(logicalPort.getLogicalSwitchUuid(), is(LSWITCH_UUID));

      ArgumentCaptor<LogicalPortCreateSpec> spec = ArgumentCaptor.forClass(LogicalPortCreateSpec.class);
      verify(logicalSwitchApi).createLogicalPort(eq(LSWITCH_UUID), spec.capture());
      assertThat(spec.getValue().getAdminStatusEnabled(), is(adminStatusEnabled));
      assertThat(spec.getValue().getDisplayName(), is("port-" + PORT_ID.substring(0, 35)));
      assertThat(spec.getValue().getTags(), contains(
          new Tag("neutron_net_id", NETWORK_ID),
          new Tag("neutron_port_id", PORT_ID)));
    }

    @DataProvider(name = "adminStatus")
    public Object[][] getAdminStatus() {
      return new Object[][]{
          {true},
          {false}
      };
    }

    @Test
    public void testNoPortWithoutSwitch() throws Exception {
      doThrow(new BadNvpStateException(NETWORK_ID)).when(switchCapacityManager)
          .selectOrCreateSwitch(client, NETWORK_ID);

      try {
        portAllocator.createPort(client, NETWORK_ID, PORT_ID, true);
        fail("Should have failed with " + ErrorCode.BAD_NVP_STATE);
      } catch (BadNvpStateException e) {
        assertThat(e.getErrorCode(), is(ErrorCode.BAD_NVP_STATE));
      }
      verify(logicalSwitchApi, never()).createLogicalPort(anyString(), any(LogicalPortCreateSpec.class));
    }
  }

  /**
   * Tests for deleting ports.
   */
  public static class DeletePortTest {
    private NvpClient client;
    private LogicalSwitchApi logicalSwitchApi;
    private PortAllocator portAllocator;

    @BeforeMethod
    public void setup() {
      client = mock(NvpClient.class);
      logicalSwitchApi = mock(LogicalSwitchApi.class);
      doReturn(logicalSwitchApi).when(client).getLogicalSwitchApi();
      portAllocator = new PortAllocator(mock(SwitchCapacityManager.class));
    }

    @Test
    public void testSwitchGiven() {
      portAllocator.deleteNetworkPort(client, LPORT_UUID, LSWITCH_UUID);

      verify(logicalSwitchApi, never()).queryLogicalPorts(anyString(), any(ResourceQuery.class));
      verify(logicalSwitchApi).deleteLogicalPort(LSWITCH_UUID, LPORT_UUID);
    }

    @Test
    public void testSingleHostingSwitch() {
      givenPorts(createPort(LSWITCH_UUID));

      portAllocator.deleteNetworkPort(client, LPORT_UUID, null);

      ArgumentCaptor<ResourceQuery> query = ArgumentCaptor.forClass(ResourceQuery.class);
      verify(logicalSwitchApi).queryLogicalPorts(eq(LogicalSwitchApi.ANY_SWITCH), query.capture());
      assertThat(query.getValue().getUuid(), is(LPORT_UUID));
      assertThat(query.getValue().getRelations(), contains(LogicalPortRelations.LOGICAL_SWITCH_CONFIG));
      verify(logicalSwitchApi).deleteLogicalPort(LSWITCH_UUID, LPORT_UUID);
    }

    @Test
    public void testManySwitches() {
      givenPorts(createPort(LSWITCH_UUID), createPort("another-switch"));

      try {
        portAllocator.deleteNetworkPort(client, LPORT_UUID, null);
        fail("Should have failed with " + ErrorCode.AMBIGUOUS_PORT_PLACEMENT);
      } catch (PortPlacementException e) {
        assertThat(e.getErrorCode(), is(ErrorCode.AMBIGUOUS_PORT_PLACEMENT));
      }
      verify(logicalSwitchApi, never()).deleteLogicalPort(anyString(), anyString());
    }

    @Test
    public void testSameSwitchReportedTwice() {
      givenPorts(createPort(LSWITCH_UUID), createPort(LSWITCH_UUID));

      portAllocator.deleteNetworkPort(client, LPORT_UUID, null);

      verify(logicalSwitchApi).deleteLogicalPort(LSWITCH_UUID, LPORT_UUID);
    }

    @Test
    public void testNoHostingSwitch() {
      givenPorts();

      try {
        portAllocator.deleteNetworkPort(client, LPORT_UUID, null);
        fail("Should have failed with " + ErrorCode.AMBIGUOUS_PORT_PLACEMENT);
      } catch (PortPlacementException e) {
        assertThat(e.getErrorCode(), is(ErrorCode.AMBIGUOUS_PORT_PLACEMENT));
      }
      verify(logicalSwitchApi, never()).deleteLogicalPort(anyString(), anyString());
    }

    @Test
    public void testVanishedPortIsDeleted() {
      doThrow(new NvpApiException(HttpStatus.SC_NOT_FOUND, "HTTP request failed with: 404"))
          .when(logicalSwitchApi).deleteLogicalPort(LSWITCH_UUID, LPORT_UUID);

      portAllocator.deleteNetworkPort(client, LPORT_UUID, LSWITCH_UUID);
    }

    @Test
    public void testControllerFailurePropagates() {
      doThrow(new NvpApiException(NvpApiException.NO_STATUS, "timed out"))
          .when(logicalSwitchApi).deleteLogicalPort(LSWITCH_UUID, LPORT_UUID);

      try {
        portAllocator.deleteNetworkPort(client, LPORT_UUID, LSWITCH_UUID);
        fail("Should have failed");
      } catch (NvpApiException e) {
        assertThat(e.getStatusCode(), is(NvpApiException.NO_STATUS));
      }
    }

    private void givenPorts(LogicalPort... ports) {
      List<LogicalPort> results = ImmutableList.copyOf(ports);
      doReturn(new QueryCursor<LogicalPort>(pageCursor -> {
        QueryResult<LogicalPort> page = new QueryResult<>();
        page.setResultCount(results.size());
        page.setResults(results);
        return page;
      })).when(logicalSwitchApi).queryLogicalPorts(anyString(), any(ResourceQuery.class));
    }

    private static LogicalPort createPort(String switchUuid) {
      LogicalPortRelations relations = new LogicalPortRelations();
      relations.setLogicalSwitchConfig(new ResourceReference(switchUuid));

      LogicalPort logicalPort = new LogicalPort();
      logicalPort.setUuid(LPORT_UUID);
      logicalPort.setRelations(relations);
      return logicalPort;
    }
  }
}
