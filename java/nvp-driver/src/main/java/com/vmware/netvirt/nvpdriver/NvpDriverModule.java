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

import com.vmware.netvirt.nvpclient.NvpClientFactory;
import com.vmware.netvirt.nvpdriver.config.BadConfigException;
import com.vmware.netvirt.nvpdriver.config.NvpDriverConfigLoader;
import com.vmware.netvirt.nvpdriver.lswitch.PortAllocator;
import com.vmware.netvirt.nvpdriver.lswitch.SwitchCapacityManager;
import com.vmware.netvirt.nvpdriver.network.NetworkDetailsExtractor;
import com.vmware.netvirt.nvpdriver.network.ProviderNetworkConfigurator;
import com.vmware.netvirt.nvpdriver.network.TransportZoneResolver;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * NVP driver Guice module.
 */
public class NvpDriverModule extends AbstractModule {

  private final NvpDriverConfig config;
  private final NetworkRegistry networkRegistry;

  public NvpDriverModule(NvpDriverConfig config, NetworkRegistry networkRegistry) {
    this.config = config;
    this.networkRegistry = networkRegistry;
  }

  /**
   * Creates the module from a YAML configuration file.
   */
  public static NvpDriverModule fromConfigFile(String configFile, NetworkRegistry networkRegistry)
      throws BadConfigException {
    return new NvpDriverModule(NvpDriverConfigLoader.load(configFile), networkRegistry);
  }

  @Override
  protected void configure() {
    bind(NvpDriverConfig.class).toInstance(config);
    bind(NetworkRegistry.class).toInstance(networkRegistry);
    bind(NvpClientFactory.class).in(Singleton.class);

    bind(TransportZoneResolver.class).in(Singleton.class);
    bind(ProviderNetworkConfigurator.class).in(Singleton.class);
    bind(NetworkDetailsExtractor.class).in(Singleton.class);
    bind(PortAllocator.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  public NvpConnectionPool getNvpConnectionPool(NvpClientFactory clientFactory) {
    return NvpConnectionPool.create(config, clientFactory);
  }

  @Provides
  @Singleton
  public SwitchCapacityManager getSwitchCapacityManager(NetworkDetailsExtractor networkDetailsExtractor,
                                                        ProviderNetworkConfigurator providerNetworkConfigurator) {
    return new SwitchCapacityManager(networkDetailsExtractor, providerNetworkConfigurator,
        config.getMaxPortsPerSwitch(), config.getQueryPageLength());
  }
}
