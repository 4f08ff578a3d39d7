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

package com.vmware.netvirt.nvpclient.builders;

import com.vmware.netvirt.nvpclient.models.LogicalPortCreateSpec;
import com.vmware.netvirt.nvpclient.models.Tag;
import com.vmware.netvirt.nvpclient.utils.NameUtils;

import java.util.List;

/**
 * Builder for {@link com.vmware.netvirt.nvpclient.models.LogicalPortCreateSpec}.
 */
public class LogicalPortCreateSpecBuilder {
  private LogicalPortCreateSpec spec;

  public LogicalPortCreateSpecBuilder() {
    spec = new LogicalPortCreateSpec();
  }

  public LogicalPortCreateSpecBuilder displayName(String displayName) {
    spec.setDisplayName(NameUtils.truncate(displayName));
    return this;
  }

  public LogicalPortCreateSpecBuilder adminStatusEnabled(boolean adminStatusEnabled) {
    spec.setAdminStatusEnabled(adminStatusEnabled);
    return this;
  }

  public LogicalPortCreateSpecBuilder tags(List<Tag> tags) {
    spec.getTags().addAll(tags);
    return this;
  }

  public LogicalPortCreateSpec build() {
    return spec;
  }
}
