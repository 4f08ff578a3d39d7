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

import com.vmware.netvirt.nvpclient.RestClient;
import com.vmware.netvirt.nvpclient.exceptions.NvpApiException;
import com.vmware.netvirt.nvpclient.models.QueryResult;
import com.vmware.netvirt.nvpclient.models.ResourceQuery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Base class of the NVP API clients. It owns the JSON mapping and turns unexpected
 * response codes into {@link NvpApiException}s.
 */
public class NvpClientApi {

  protected static final String BASE_PATH = "/ws.v1";

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  /**
   * Constructs a NVP client api base class.
   */
  public NvpClientApi(RestClient restClient) {
    checkNotNull(restClient, "restClient cannot be null");

    this.restClient = restClient;
    this.objectMapper = new ObjectMapper();
    this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    this.objectMapper.configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
  }

  /**
   * Creates a resource and returns the controller's view of it.
   */
  protected <T> T post(final String path,
                       final HttpEntity payload,
                       final int expectedResponseStatus,
                       final TypeReference<T> typeReference) throws IOException {
    HttpResponse result = exchange(RestClient.Method.POST, path, payload, expectedResponseStatus);
    return deserializeObjectFromJson(result.getEntity(), typeReference);
  }

  protected <T> T get(final String path,
                      final int expectedResponseStatus,
                      final TypeReference<T> typeReference) throws IOException {
    HttpResponse result = exchange(RestClient.Method.GET, path, null, expectedResponseStatus);
    return deserializeObjectFromJson(result.getEntity(), typeReference);
  }

  protected void delete(final String path,
                        final int expectedResponseStatus) {
    exchange(RestClient.Method.DELETE, path, null, expectedResponseStatus);
  }

  /**
   * Returns a cursor over a collection. Each page is fetched with a GET request when the cursor reaches it.
   */
  protected <T> QueryCursor<T> query(final String path,
                                     final ResourceQuery query,
                                     final TypeReference<QueryResult<T>> typeReference) {
    checkNotNull(query, "query cannot be null");

    return new QueryCursor<>(pageCursor -> {
      String pagePath = buildPath(path, query.toParameters(pageCursor));
      try {
        return get(pagePath, HttpStatus.SC_OK, typeReference);
      } catch (IOException e) {
        throw new NvpApiException("Could not read the response of GET " + pagePath, e);
      }
    });
  }

  /**
   * Appends URL encoded query parameters to a path.
   */
  protected String buildPath(String path, List<NameValuePair> parameters) {
    if (parameters == null || parameters.isEmpty()) {
      return path;
    }

    return path + "?" + URLEncodedUtils.format(parameters, StandardCharsets.UTF_8);
  }

  /**
   * Serializes HTTP request to JSON string.
   */
  protected StringEntity serializeObjectAsJson(Object o) throws JsonProcessingException {
    String payload = objectMapper.writeValueAsString(o);
    return new StringEntity(payload, ContentType.APPLICATION_JSON);
  }

  /**
   * Deserializes HTTP response from JSON string.
   */
  protected <T> T deserializeObjectFromJson(HttpEntity entity, TypeReference<T> typeReference)
      throws IOException {
    return objectMapper.readValue(entity.getContent(), typeReference);
  }

  private HttpResponse exchange(RestClient.Method method, String path, HttpEntity payload, int expectedResponseStatus) {
    HttpResponse result = restClient.send(method, path, payload);
    restClient.check(result, expectedResponseStatus);
    return result;
  }
}
