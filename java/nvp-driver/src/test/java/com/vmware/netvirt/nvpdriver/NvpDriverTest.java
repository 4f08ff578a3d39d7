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

package com.vmware.netvirt.nvpdriver;

import com.vmware.netvirt.nvpclient.datatypes.NvpTransportType;
import com.vmware.netvirt.nvpclient.models.LogicalPort;
import com.vmware.netvirt.nvpclient.models.LogicalSwitch;
import com.vmware.netvirt.nvpclient.models.TransportZoneBinding;
import com.vmware.netvirt.nvpdriver.exceptions.BadNvpStateException;
import com.vmware.netvirt.nvpdriver.exceptions.ErrorCode;
import com.vmware.netvirt.nvpdriver.exceptions.ProviderNetworkException;
import com.vmware.netvirt.nvpdriver.helpers.FakeNvpController;
import com.vmware.netvirt.nvpdriver.lswitch.PortAllocator;
import com.vmware.netvirt.nvpdriver.lswitch.SwitchCapacityManager;
import com.vmware.netvirt.nvpdriver.network.NetworkDetailsExtractor;
import com.vmware.netvirt.nvpdriver.network.ProviderNetworkConfigurator;
import com.vmware.netvirt.nvpdriver.network.ProviderNetworkParams;
import com.vmware.netvirt.nvpdriver.network.TransportZoneResolver;

import com.google.common.collect.ImmutableList;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.testng.Assert.fail;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tests for {@link com.vmware.netvirt.nvpdriver.NvpDriver} against an in-memory controller.
 */
public class NvpDriverTest {

  private static final String NETWORK_ID = "net1";
  private static final String ZONE_UUID = "zone_uuid";

  private FakeNvpController controller;
  private Set<String> knownNetworks;

  @BeforeMethod
  public void setup() {
    controller = new FakeNvpController();
    controller.addTransportZone(ZONE_UUID);
    knownNetworks = new HashSet<>();
    knownNetworks.add(NETWORK_ID);
  }

  @Test
  public void testPortsSpanSwitchesAtCapacity() throws Exception {
    NvpDriver driver = createDriver(3, 1000);

    List<LogicalPort> ports = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      ports.add(driver.createPort(NETWORK_ID, "port" + i));
    }

    List<LogicalSwitch> switches = controller.getSwitches();
    assertThat(switches, hasSize(2));
    String switchA = switches.get(0).getUuid();
    String switchB = switches.get(1).getUuid();

    assertThat(ports.get(0).getLogicalSwitchUuid(), is(switchA));
    assertThat(ports.get(1).getLogicalSwitchUuid(), is(switchA));
    assertThat(ports.get(2).getLogicalSwitchUuid(), is(switchA));
    assertThat(ports.get(3).getLogicalSwitchUuid(), is(switchB));
    assertThat(controller.getPorts(switchA), hasSize(3));
    assertThat(controller.getPorts(switchB), hasSize(1));
    for (LogicalPort port : ports) {
      assertThat(port.getAdminStatusEnabled(), is(true));
    }
  }

  @Test
  public void testUnboundedNetworkKeepsOneSwitch() throws Exception {
    NvpDriver driver = createDriver(0, 1000);

    for (int i = 0; i < 10; i++) {
      driver.createPort(NETWORK_ID, "port" + i);
    }

    assertThat(controller.getSwitches(), hasSize(1));
    assertThat(controller.getPorts(controller.getSwitches().get(0).getUuid()), hasSize(10));
  }

  @Test
  public void testSwitchScanPagesThroughSwitches() throws Exception {
    NvpDriver driver = createDriver(1, 2);

    for (int i = 0; i < 5; i++) {
      driver.createPort(NETWORK_ID, "port" + i);
    }

    assertThat(controller.getSwitches(), hasSize(5));
    for (LogicalSwitch logicalSwitch : controller.getSwitches()) {
      assertThat(controller.getPorts(logicalSwitch.getUuid()), hasSize(1));
    }
  }

  @Test
  public void testSpannedSwitchesKeepProviderBinding() throws Exception {
    NvpDriver driver = createDriver(1, 1000);

    String firstSwitch = driver.createNetwork(NETWORK_ID, "public", new ProviderNetworkParams(ZONE_UUID, "vlan", 42));
    driver.createPort(NETWORK_ID, "port0");
    LogicalPort spanned = driver.createPort(NETWORK_ID, "port1");

    assertThat(spanned.getLogicalSwitchUuid(), is(not(firstSwitch)));
    assertThat(controller.getSwitches(), hasSize(2));
    for (LogicalSwitch logicalSwitch : controller.getSwitches()) {
      assertThat(logicalSwitch.getDisplayName(), is("public"));
      TransportZoneBinding binding = logicalSwitch.getTransportZones().get(0);
      assertThat(binding.getZoneUuid(), is(ZONE_UUID));
      assertThat(binding.getKnownTransportType(), is(NvpTransportType.BRIDGE));
      assertThat(binding.getBindingConfig().getVlanTranslation().get(0).getTransport(), is(42));
    }
  }

  @Test
  public void testInvalidProviderNetworkCreatesNothing() throws Exception {
    NvpDriver driver = createDriver(0, 1000);

    try {
      driver.createNetwork(NETWORK_ID, "public", new ProviderNetworkParams("missing_zone", "flat", null));
      fail("Should have failed with " + ErrorCode.PHYSICAL_NETWORK_NOT_FOUND);
    } catch (ProviderNetworkException e) {
      assertThat(e.getErrorCode(), is(ErrorCode.PHYSICAL_NETWORK_NOT_FOUND));
    }

    assertThat(controller.getSwitches(), is(empty()));
    assertThat(controller.getRequests(), not(hasItem("POST lswitch")));
  }

  @Test
  public void testUnknownNetworkGetsNoPort() throws Exception {
    NvpDriver driver = createDriver(0, 1000);

    try {
      driver.createPort("unknown", "port0");
      fail("Should have failed with " + ErrorCode.BAD_NVP_STATE);
    } catch (BadNvpStateException e) {
      assertThat(e.getErrorCode(), is(ErrorCode.BAD_NVP_STATE));
    }

    assertThat(controller.getSwitches(), is(empty()));
  }

  @Test
  public void testDisabledPort() throws Exception {
    NvpDriver driver = createDriver(0, 1000);

    LogicalPort port = driver.createPort(NETWORK_ID, "port0", false);

    assertThat(port.getAdminStatusEnabled(), is(false));
  }

  @Test
  public void testDeletePortLooksUpSwitch() throws Exception {
    NvpDriver driver = createDriver(0, 1000);
    LogicalPort port = driver.createPort(NETWORK_ID, "port0");

    driver.deletePort(port.getUuid());

    assertThat(controller.getPorts(port.getLogicalSwitchUuid()), is(empty()));
  }

  @Test
  public void testDeletePortOnGivenSwitch() throws Exception {
    NvpDriver driver = createDriver(0, 1000);
    LogicalPort port = driver.createPort(NETWORK_ID, "port0");
    controller.getRequests().clear();

    driver.deletePort(port.getUuid(), port.getLogicalSwitchUuid());
    driver.deletePort(port.getUuid(), port.getLogicalSwitchUuid());

    assertThat(controller.getPorts(port.getLogicalSwitchUuid()), is(empty()));
    assertThat(controller.getRequests(), is(ImmutableList.of("DELETE lport", "DELETE lport")));
  }

  @Test
  public void testDeleteNetwork() throws Exception {
    NvpDriver driver = createDriver(1, 1000);
    driver.createPort(NETWORK_ID, "port0");
    driver.createPort(NETWORK_ID, "port1");
    driver.createNetwork("net2", null, ProviderNetworkParams.none());

    driver.deleteNetwork(NETWORK_ID);

    assertThat(controller.getSwitches(), hasSize(1));
    assertThat(controller.getSwitches().get(0).getDisplayName(), is("net2"));

    controller.getRequests().clear();
    driver.deleteNetwork(NETWORK_ID);
    assertThat(controller.getRequests(), is(ImmutableList.of("GET lswitch")));
  }

  private NvpDriver createDriver(int maxPortsPerSwitch, int queryPageLength) {
    NvpConnectionPool connectionPool = new NvpConnectionPool(ImmutableList.of(controller.getClient()));
    NetworkRegistry networkRegistry = networkId -> knownNetworks.contains(networkId);
    SwitchCapacityManager switchCapacityManager = new SwitchCapacityManager(
        new NetworkDetailsExtractor(networkRegistry),
        new ProviderNetworkConfigurator(new TransportZoneResolver()),
        maxPortsPerSwitch,
        queryPageLength);

    return new NvpDriver(connectionPool, switchCapacityManager, new PortAllocator(switchCapacityManager));
  }
}
