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

import com.vmware.netvirt.nvpclient.utils.ToStringHelper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One page of an NVP collection query.
 *
 * @param <T> the type of the queried objects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryResult<T> {
  @JsonProperty(value = "result_count", required = true)
  private Integer resultCount;

  @JsonProperty(value = "results", required = true)
  private List<T> results;

  @JsonProperty(value = "page_cursor", required = false)
  private String pageCursor;

  public Integer getResultCount() {
    return resultCount;
  }

  public void setResultCount(Integer resultCount) {
    this.resultCount = resultCount;
  }

  public List<T> getResults() {
    return results;
  }

  public void setResults(List<T> results) {
    this.results = results;
  }

  public String getPageCursor() {
    return pageCursor;
  }

  public void setPageCursor(String pageCursor) {
    this.pageCursor = pageCursor;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || this.getClass() != o.getClass()) {
      return false;
    }

    QueryResult<?> other = (QueryResult<?>) o;
    return Objects.equals(this.resultCount, other.resultCount)
        && Objects.equals(this.results, other.results)
        && Objects.equals(this.pageCursor, other.pageCursor);
  }

  @Override
  public int hashCode() {
    return Objects.hash(resultCount, results, pageCursor);
  }

  @Override
  public String toString() {
    return ToStringHelper.jsonObjectToString(this);
  }
}
