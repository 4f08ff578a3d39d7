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

import com.vmware.netvirt.nvpclient.models.ResourceQuery;
import com.vmware.netvirt.nvpclient.models.Tag;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for {@link com.vmware.netvirt.nvpclient.models.ResourceQuery}.
 */
public class ResourceQueryBuilder {
  private String fields = ResourceQuery.ALL_FIELDS;
  private String uuid;
  private List<Tag> tags = new ArrayList<>();
  private List<String> relations = new ArrayList<>();
  private Integer pageLength;

  public ResourceQueryBuilder fields(String fields) {
    this.fields = fields;
    return this;
  }

  public ResourceQueryBuilder uuid(String uuid) {
    this.uuid = uuid;
    return this;
  }

  public ResourceQueryBuilder tag(Tag tag) {
    this.tags.add(tag);
    return this;
  }

  public ResourceQueryBuilder tags(List<Tag> tags) {
    this.tags.addAll(tags);
    return this;
  }

  public ResourceQueryBuilder relation(String relation) {
    this.relations.add(relation);
    return this;
  }

  public ResourceQueryBuilder pageLength(Integer pageLength) {
    this.pageLength = pageLength;
    return this;
  }

  public ResourceQuery build() {
    return new ResourceQuery(fields, uuid, tags, relations, pageLength);
  }
}
