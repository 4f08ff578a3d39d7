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

import org.apache.http.HttpEntity;
import org.apache.http.HttpHost;
import org.apache.http.HttpResponse;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.AuthCache;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.concurrent.FutureCallback;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.auth.BasicScheme;
import org.apache.http.impl.client.BasicAuthCache;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClientBuilder;
import org.apache.http.ssl.SSLContexts;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import javax.net.ssl.SSLContext;

import java.io.Closeable;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues authenticated HTTP requests against one NVP controller.
 *
 * <p>Controllers present self-signed certificates, so the default transport trusts any certificate and
 * host name. Every request reuses one context whose auth cache makes basic authentication preemptive.
 */
public class RestClient implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(RestClient.class);

  public static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(30);

  /**
   * HTTP methods used by the NVP API.
   */
  public enum Method {
    GET,
    POST,
    DELETE
  }

  private final String target;
  private final long requestTimeoutMillis;
  private final HttpClientContext clientContext;
  private final CloseableHttpAsyncClient asyncClient;

  public RestClient(String target, String username, String password) {
    this(target, username, password, DEFAULT_REQUEST_TIMEOUT_MILLIS, null);
  }

  /**
   * Constructs a RestClient. A null {@code asyncClient} makes the client build and start its own transport.
   */
  public RestClient(String target, String username, String password, long requestTimeoutMillis,
                    CloseableHttpAsyncClient asyncClient) {
    checkNotNull(target, "target cannot be null");
    checkNotNull(username, "username cannot be null");
    checkNotNull(password, "password cannot be null");
    checkArgument(requestTimeoutMillis > 0, "requestTimeoutMillis must be positive");

    this.target = target;
    this.requestTimeoutMillis = requestTimeoutMillis;
    this.clientContext = createPreemptiveAuthContext(HttpHost.create(target),
        new UsernamePasswordCredentials(username, password));
    this.asyncClient = asyncClient != null ? asyncClient : startTrustingClient(requestTimeoutMillis);
  }

  public String getTarget() {
    return target;
  }

  /**
   * Sends a request and waits at most the request timeout for its response.
   *
   * @throws NvpApiException without a status code when no response arrives
   */
  public HttpResponse send(final Method method, final String path, final HttpEntity payload) {
    Future<HttpResponse> response;
    try {
      response = sendAsync(method, path, payload, null);
    } catch (IOException e) {
      throw new NvpApiException(String.format("%s %s failed", method, path), e);
    }

    try {
      return response.get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NvpApiException(String.format("%s %s was interrupted", method, path), e);
    } catch (TimeoutException e) {
      response.cancel(true);
      throw new NvpApiException(String.format("%s %s timed out after %d ms", method, path, requestTimeoutMillis), e);
    } catch (ExecutionException e) {
      throw new NvpApiException(String.format("%s %s failed", method, path), e.getCause());
    }
  }

  public Future<HttpResponse> sendAsync(final Method method, final String path, final HttpEntity payload,
                                        final FutureCallback<HttpResponse> responseHandler) throws IOException {
    HttpUriRequest request = RequestBuilder.create(method.name())
        .setUri(target + path)
        .setEntity(payload)
        .build();
    logger.debug("{} {}", method, request.getURI());
    return asyncClient.execute(request, clientContext, responseHandler);
  }

  /**
   * Fails with the response status and body unless the status is the expected one.
   */
  public void check(HttpResponse httpResponse, int expectedResponseCode) {
    int statusCode = httpResponse.getStatusLine().getStatusCode();
    if (statusCode == expectedResponseCode) {
      return;
    }

    String body = readBody(httpResponse.getEntity());
    throw new NvpApiException(statusCode, body == null
        ? "HTTP request failed with: " + statusCode
        : "HTTP request failed with: " + statusCode + ", " + body);
  }

  @Override
  public void close() throws IOException {
    asyncClient.close();
  }

  private static String readBody(HttpEntity entity) {
    if (entity == null) {
      return null;
    }

    try {
      return EntityUtils.toString(entity);
    } catch (IOException e) {
      logger.debug("Could not read the body of a failed response", e);
      return null;
    }
  }

  private static HttpClientContext createPreemptiveAuthContext(HttpHost host, UsernamePasswordCredentials credentials) {
    CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
    credentialsProvider.setCredentials(AuthScope.ANY, credentials);

    AuthCache authCache = new BasicAuthCache();
    authCache.put(host, new BasicScheme());

    HttpClientContext context = HttpClientContext.create();
    context.setCredentialsProvider(credentialsProvider);
    context.setAuthCache(authCache);
    return context;
  }

  private static CloseableHttpAsyncClient startTrustingClient(long requestTimeoutMillis) {
    SSLContext sslContext;
    try {
      sslContext = SSLContexts.custom()
          .loadTrustMaterial((chain, authType) -> true)
          .build();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Cannot set up TLS for NVP controllers", e);
    }

    int timeout = (int) Math.min(requestTimeoutMillis, Integer.MAX_VALUE);
    CloseableHttpAsyncClient httpAsyncClient = HttpAsyncClientBuilder.create()
        .setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE)
        .setSSLContext(sslContext)
        .setDefaultRequestConfig(RequestConfig.custom()
            .setConnectTimeout(timeout)
            .setSocketTimeout(timeout)
            .build())
        .build();
    httpAsyncClient.start();
    return httpAsyncClient;
  }
}
