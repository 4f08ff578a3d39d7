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

import com.vmware.netvirt.nvpclient.models.QueryResult;

import com.google.common.base.Strings;
import com.google.common.collect.AbstractIterator;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Lazily pages through the results of an NVP collection query.
 * <p>
 * Nothing is fetched until the first iteration. Each call to {@link #iterator()} starts over
 * from the first result; pages already fetched through this cursor are not requested again.
 *
 * @param <T> the type of the queried objects.
 */
public class QueryCursor<T> implements Iterable<T> {

  /**
   * Fetches one page of results.
   */
  @FunctionalInterface
  public interface PageFetcher<T> {
    /**
     * @param pageCursor cursor returned with the previous page, null for the first page.
     */
    QueryResult<T> fetch(@Nullable String pageCursor);
  }

  private final PageFetcher<T> fetcher;
  private final List<QueryResult<T>> pages = new ArrayList<>();

  public QueryCursor(PageFetcher<T> fetcher) {
    this.fetcher = checkNotNull(fetcher, "fetcher cannot be null");
  }

  /**
   * Returns the total number of matching objects as reported with the first page.
   */
  public int getResultCount() {
    Integer resultCount = page(0).getResultCount();
    if (resultCount != null) {
      return resultCount;
    }

    List<T> results = page(0).getResults();
    return results == null ? 0 : results.size();
  }

  @Override
  public Iterator<T> iterator() {
    return new AbstractIterator<T>() {
      private int pageIndex = 0;
      private int itemIndex = 0;

      @Override
      protected T computeNext() {
        while (true) {
          QueryResult<T> page = page(pageIndex);
          List<T> results = page.getResults();
          if (results != null && itemIndex < results.size()) {
            return results.get(itemIndex++);
          }

          if (Strings.isNullOrEmpty(page.getPageCursor())) {
            return endOfData();
          }

          pageIndex++;
          itemIndex = 0;
        }
      }
    };
  }

  private QueryResult<T> page(int index) {
    while (pages.size() <= index) {
      String pageCursor = pages.isEmpty() ? null : pages.get(pages.size() - 1).getPageCursor();
      QueryResult<T> page = fetcher.fetch(pageCursor);
      checkNotNull(page, "fetched page cannot be null");
      pages.add(page);
    }

    return pages.get(index);
  }
}
