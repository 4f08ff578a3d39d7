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

package com.vmware.netvirt.nvpclient.models;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.http.NameValuePair;
import org.apache.http.message.BasicNameValuePair;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Filters and paging options of an NVP collection query.
 */
public class ResourceQuery {

  public static final String ALL_FIELDS = "*";

  private final String fields;
  private final String uuid;
  private final ImmutableList<Tag> tags;
  private final ImmutableList<String> relations;
  private final Integer pageLength;

  public ResourceQuery(String fields, String uuid, List<Tag> tags, List<String> relations, Integer pageLength) {
    this.fields = fields;
    this.uuid = uuid;
    this.tags = ImmutableList.copyOf(tags);
    this.relations = ImmutableList.copyOf(relations);
    this.pageLength = pageLength;
  }

  public String getFields() {
    return fields;
  }

  public String getUuid() {
    return uuid;
  }

  public List<Tag> getTags() {
    return tags;
  }

  public List<String> getRelations() {
    return relations;
  }

  public Integer getPageLength() {
    return pageLength;
  }

  /**
   * Renders the query as request parameters, continuing at the given page cursor.
   */
  public List<NameValuePair> toParameters(@Nullable String pageCursor) {
    List<NameValuePair> parameters = new ArrayList<>();
    if (!Strings.isNullOrEmpty(fields)) {
      parameters.add(new BasicNameValuePair("fields", fields));
    }

    if (!Strings.isNullOrEmpty(uuid)) {
      parameters.add(new BasicNameValuePair("uuid", uuid));
    }

    for (Tag tag : tags) {
      parameters.add(new BasicNameValuePair("tag", tag.getTag()));
      if (tag.getScope() != null) {
        parameters.add(new BasicNameValuePair("tag_scope", tag.getScope()));
      }
    }

    for (String relation : relations) {
      parameters.add(new BasicNameValuePair("relations", relation));
    }

    if (pageLength != null) {
      parameters.add(new BasicNameValuePair("_page_length", pageLength.toString()));
    }

    if (!Strings.isNullOrEmpty(pageCursor)) {
      parameters.add(new BasicNameValuePair("_page_cursor", pageCursor));
    }

    return parameters;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("fields", fields)
        .add("uuid", uuid)
        .add("tags", tags)
        .add("relations", relations)
        .add("pageLength", pageLength)
        .toString();
  }
}
