/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.log4j.Log4j2;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.opensearch.federation.common.utils.StringUtils;
import org.opensearch.federation.exception.TransportException;
import org.opensearch.federation.exception.UpstreamProtocolException;
import org.opensearch.federation.registry.ServiceDescriptor;
import org.opensearch.federation.transport.ConcurrencyLimitingTransport;
import org.opensearch.federation.transport.SubgraphResponse;
import org.opensearch.federation.transport.SubgraphTransport;

/**
 * Sends subgraph operations as GraphQL over HTTP: a POST of {@code {"query", "variables"}} to the
 * service URL, answered by a {@code {"data", "errors"}} body. Calls are asynchronous; completing
 * the returned future exceptionally, by cancellation or timeout, cancels the HTTP call.
 */
@Log4j2
public class OkHttpSubgraphTransport implements SubgraphTransport {

  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

  private final OkHttpClient client;

  public OkHttpSubgraphTransport(OkHttpClient client) {
    this.client = client;
  }

  public OkHttpSubgraphTransport(HttpTransportSettings settings) {
    this(newClient(settings));
  }

  /**
   * Creates the HTTP transport wrapped in a {@link ConcurrencyLimitingTransport} bounded by the
   * per-service limit of {@code settings}.
   */
  public static SubgraphTransport create(HttpTransportSettings settings) {
    log.info("Creating HTTP subgraph transport with {}", settings);
    return new ConcurrencyLimitingTransport(
        new OkHttpSubgraphTransport(settings), settings.getMaxConcurrentCallsPerService());
  }

  @Override
  public CompletableFuture<SubgraphResponse> send(
      ServiceDescriptor service, String query, Map<String, Object> variables) {
    Request request;
    try {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("query", query);
      payload.put("variables", variables == null ? Map.of() : variables);
      request =
          new Request.Builder()
              .url(service.url())
              .header("Accept", "application/json")
              .post(RequestBody.create(OBJECT_MAPPER.writeValueAsBytes(payload), JSON))
              .build();
    } catch (JsonProcessingException | IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new TransportException(
              service.id(),
              StringUtils.format(
                  "Unable to build request for service %s: %s", service.id(), e.getMessage()),
              e));
    }

    Call call = client.newCall(request);
    CompletableFuture<SubgraphResponse> future = new CompletableFuture<>();
    future.whenComplete(
        (response, error) -> {
          if (error != null && !call.isCanceled()) {
            call.cancel();
          }
        });
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(Call failed, IOException e) {
            future.completeExceptionally(
                new TransportException(
                    service.id(),
                    StringUtils.format(
                        "Request to service %s failed: %s", service.id(), e.getMessage()),
                    e));
          }

          @Override
          public void onResponse(Call completed, Response response) {
            try (ResponseBody body = response.body()) {
              if (!response.isSuccessful()) {
                future.completeExceptionally(
                    new TransportException(
                        service.id(),
                        StringUtils.format(
                            "Service %s responded with HTTP %d", service.id(), response.code())));
                return;
              }
              future.complete(parse(service, body == null ? new byte[0] : body.bytes()));
            } catch (IOException e) {
              onFailure(completed, e);
            } catch (RuntimeException e) {
              future.completeExceptionally(e);
            }
          }
        });
    return future;
  }

  /** Parses a GraphQL response body. */
  static SubgraphResponse parse(ServiceDescriptor service, byte[] content) {
    Map<String, Object> body;
    try {
      body = OBJECT_MAPPER.readValue(content, BODY_TYPE);
    } catch (IOException e) {
      log.warn("Malformed response body from service {}", service.id(), e);
      throw new UpstreamProtocolException(
          service.id(),
          StringUtils.format("Service %s returned a malformed response body", service.id()));
    }
    if (body == null) {
      throw new UpstreamProtocolException(
          service.id(), StringUtils.format("Service %s returned an empty body", service.id()));
    }
    return new SubgraphResponse(dataOf(service, body.get("data")), errorsOf(body.get("errors")));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> dataOf(ServiceDescriptor service, Object data) {
    if (data == null) {
      return null;
    }
    if (!(data instanceof Map)) {
      throw new UpstreamProtocolException(
          service.id(),
          StringUtils.format("Service %s returned data that is not an object", service.id()));
    }
    return (Map<String, Object>) data;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> errorsOf(Object errors) {
    List<Map<String, Object>> result = new ArrayList<>();
    if (errors instanceof List<?> list) {
      for (Object error : list) {
        if (error instanceof Map) {
          result.add((Map<String, Object>) error);
        } else {
          result.add(Map.of("message", String.valueOf(error)));
        }
      }
    }
    return result;
  }

  private static OkHttpClient newClient(HttpTransportSettings settings) {
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequestsPerHost(settings.getMaxConcurrentCallsPerService());
    return new OkHttpClient.Builder()
        .dispatcher(dispatcher)
        .connectTimeout(settings.getConnectTimeout())
        .readTimeout(settings.getReadTimeout())
        .build();
  }
}
