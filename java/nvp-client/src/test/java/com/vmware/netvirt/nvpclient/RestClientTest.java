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

package com.vmware.netvirt.nvpclient;

import com.vmware.netvirt.nvpclient.exceptions.NvpApiException;

import org.apache.http.HttpEntityEnclosingRequest;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.HttpVersion;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.DefaultHttpResponseFactory;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.protocol.HttpContext;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.fail;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tests for {@link com.vmware.netvirt.nvpclient.RestClient}.
 */
public class RestClientTest {

  /**
   * Tests for checking response status codes.
   */
  public static class CheckTest {
    private RestClient restClient;

    @BeforeMethod
    public void setup() {
      restClient = new RestClient("https://nvp", "admin", "admin", 1000, mock(CloseableHttpAsyncClient.class));
    }

    @Test
    public void testExpectedStatus() {
      HttpResponse response = new DefaultHttpResponseFactory()
          .newHttpResponse(HttpVersion.HTTP_1_1, HttpStatus.SC_OK, null);
      restClient.check(response, HttpStatus.SC_OK);
    }

    @Test
    public void testUnexpectedStatusCarriesBody() {
      HttpResponse response = new DefaultHttpResponseFactory()
          .newHttpResponse(HttpVersion.HTTP_1_1, HttpStatus.SC_CONFLICT, null);
      response.setEntity(new StringEntity("duplicate", ContentType.TEXT_PLAIN));

      try {
        restClient.check(response, HttpStatus.SC_CREATED);
        fail("Should have failed with " + HttpStatus.SC_CONFLICT);
      } catch (NvpApiException e) {
        assertThat(e.getStatusCode(), is(HttpStatus.SC_CONFLICT));
        assertThat(e.getMessage(), is("HTTP request failed with: 409, duplicate"));
      }
    }
  }

  /**
   * Tests for transport failures of synchronous requests.
   */
  public static class SendTest {
    private CloseableHttpAsyncClient asyncClient;
    private Future<HttpResponse> future;
    private RestClient restClient;

    @BeforeMethod
    @SuppressWarnings("unchecked")
    public void setup() {
      asyncClient = mock(CloseableHttpAsyncClient.class);
      future = mock(Future.class);
      doReturn(future).when(asyncClient).execute(any(HttpUriRequest.class), any(HttpContext.class), any());
      restClient = new RestClient("https://nvp", "admin", "admin", 1000, asyncClient);
    }

    @Test
    public void testResponseReturned() throws Exception {
      HttpResponse response = new DefaultHttpResponseFactory()
          .newHttpResponse(HttpVersion.HTTP_1_1, HttpStatus.SC_OK, null);
      when(future.get(anyLong(), any(TimeUnit.class))).thenReturn(response);

      assertThat(restClient.send(RestClient.Method.GET, "/ws.v1/lswitch", null), is(response));
    }

    @Test
    public void testRequestTargetsController() throws Exception {
      HttpResponse response = new DefaultHttpResponseFactory()
          .newHttpResponse(HttpVersion.HTTP_1_1, HttpStatus.SC_CREATED, null);
      when(future.get(anyLong(), any(TimeUnit.class))).thenReturn(response);
      StringEntity payload = new StringEntity("{}", ContentType.APPLICATION_JSON);

      restClient.send(RestClient.Method.POST, "/ws.v1/lswitch", payload);

      ArgumentCaptor<HttpUriRequest> request = ArgumentCaptor.forClass(HttpUriRequest.class);
      verify(asyncClient).execute(request.capture(), any(HttpContext.class), any());
      assertThat(request.getValue().getMethod(), is("POST"));
      assertThat(request.getValue().getURI().toString(), is("https://nvp/ws.v1/lswitch"));
      assertThat(((HttpEntityEnclosingRequest) request.getValue()).getEntity(), is(payload));
    }

    @Test
    public void testCloseStopsTransport() throws IOException {
      restClient.close();
      verify(asyncClient).close();
    }

    @Test
    public void testTimeout() throws Exception {
      when(future.get(anyLong(), any(TimeUnit.class))).thenThrow(new TimeoutException());

      try {
        restClient.send(RestClient.Method.GET, "/ws.v1/lswitch", null);
        fail("Should have timed out");
      } catch (NvpApiException e) {
        assertThat(e.getStatusCode(), is(NvpApiException.NO_STATUS));
        assertThat(e.getCause(), instanceOf(TimeoutException.class));
      }
    }

    @Test
    public void testConnectionFailure() throws Exception {
      when(future.get(anyLong(), any(TimeUnit.class)))
          .thenThrow(new ExecutionException(new ConnectException("refused")));

      try {
        restClient.send(RestClient.Method.DELETE, "/ws.v1/lswitch/s1", null);
        fail("Should have failed to connect");
      } catch (NvpApiException e) {
        assertThat(e.getStatusCode(), is(NvpApiException.NO_STATUS));
        assertThat(e.getMessage(), is("DELETE /ws.v1/lswitch/s1 failed"));
      }
    }
  }
}
