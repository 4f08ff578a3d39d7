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

import com.vmware.netvirt.nvpclient.NvpClient;
import com.vmware.netvirt.nvpclient.NvpClientFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Closer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds one client per configured NVP controller and hands them out in turn.
 */
public class NvpConnectionPool implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(NvpConnectionPool.class);

  private final ImmutableList<NvpClient> clients;
  private final AtomicInteger next = new AtomicInteger();

  public NvpConnectionPool(List<NvpClient> clients) {
    checkNotNull(clients, "clients cannot be null");
    checkArgument(!clients.isEmpty(), "at least one NVP client is required");

    this.clients = ImmutableList.copyOf(clients);
  }

  /**
   * Creates one client for every controller of the configuration.
   */
  public static NvpConnectionPool create(NvpDriverConfig config, NvpClientFactory clientFactory) {
    ImmutableList.Builder<NvpClient> clients = ImmutableList.builder();
    for (ControllerConfig controller : config.getControllers()) {
      logger.info("Adding NVP controller {}", controller.getAddress());
      clients.add(clientFactory.create(controller.getAddress(), controller.getUsername(), controller.getPassword(),
          config.getRequestTimeoutMillis()));
    }

    return new NvpConnectionPool(clients.build());
  }

  /**
   * Returns the client to use for the next operation.
   */
  public NvpClient getClient() {
    int index = Math.floorMod(next.getAndIncrement(), clients.size());
    NvpClient client = clients.get(index);
    logger.debug("Using NVP controller {}", client.getTarget());
    return client;
  }

  public int size() {
    return clients.size();
  }

  /**
   * Closes every client, even when closing one of them fails.
   */
  @Override
  public void close() throws IOException {
    Closer closer = Closer.create();
    for (NvpClient client : clients) {
      closer.register(client);
    }
    closer.close();
  }
}
