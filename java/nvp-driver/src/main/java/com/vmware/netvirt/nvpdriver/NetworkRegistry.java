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

/**
 * Tells whether the embedding application knows a network.
 * <p>
 * Port creation consults it before trusting what the controller reports for the network: a network it
 * does not know has no resolvable provider context.
 */
public interface NetworkRegistry {

  boolean contains(String networkId);
}
