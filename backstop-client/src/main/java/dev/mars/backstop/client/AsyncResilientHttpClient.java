/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.backstop.client;

import dev.mars.backstop.client.config.ClientConfig;
import dev.mars.backstop.logging.CorrelationContext;
import dev.mars.backstop.retry.AsyncRetryExecutor;
import dev.mars.backstop.transport.HttpResult;
import dev.mars.backstop.transport.RequestDescription;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.PoolOptions;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-blocking HTTP client using Vert.x WebClient, with every call run through an
 * {@link AsyncRetryExecutor}. Backoff waits are Vert.x timers, so calls may be made
 * from an event loop.
 *
 * <p>Example usage:
 * <pre>{@code
 * AsyncResilientHttpClient client = new AsyncResilientHttpClient(vertx, ClientConfig.builder()
 *     .timeout(Duration.ofSeconds(5))
 *     .build());
 *
 * client.get("http://localhost:8080/api/items")
 *     .onSuccess(result -> logger.info("Got {}", result.statusCode()))
 *     .onFailure(error -> logger.error("Gave up", error));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class AsyncResilientHttpClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncResilientHttpClient.class);

    private final ClientConfig config;
    private final WebClient webClient;
    private final boolean ownsWebClient;
    private final AsyncRetryExecutor retryExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a new client with its own WebClient.
     *
     * @param vertx the Vert.x instance, owned by the caller
     * @param config the client configuration
     */
    public AsyncResilientHttpClient(Vertx vertx, ClientConfig config) {
        Objects.requireNonNull(vertx, "vertx must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");

        // Vert.x 5.x uses PoolOptions for connection pool configuration
        PoolOptions poolOptions = new PoolOptions()
            .setHttp1MaxSize(config.getPoolSize());

        HttpClientOptions httpClientOptions = new HttpClientOptions()
            .setConnectTimeout((int) config.getTimeout().toMillis());

        HttpClient httpClient = vertx.createHttpClient(httpClientOptions, poolOptions);

        WebClientOptions webClientOptions = new WebClientOptions(httpClientOptions)
            .setFollowRedirects(config.isFollowRedirects())
            .setUserAgentEnabled(true);

        this.webClient = WebClient.wrap(httpClient, webClientOptions);
        this.ownsWebClient = true;
        this.retryExecutor = new AsyncRetryExecutor(vertx, config.getRetryPolicy(),
            config.getCircuitBreaker(), config.getCallbacks());

        logger.info("Created AsyncResilientHttpClient (poolSize: {}, timeout: {})",
            config.getPoolSize(), config.getTimeout());
    }

    /**
     * Uses a caller-supplied WebClient, which is not closed by {@link #close()}.
     */
    public AsyncResilientHttpClient(Vertx vertx, ClientConfig config, WebClient webClient) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.ownsWebClient = false;
        this.retryExecutor = new AsyncRetryExecutor(vertx, config.getRetryPolicy(),
            config.getCircuitBreaker(), config.getCallbacks());
    }

    public Future<HttpResult> get(String url) {
        return request("GET", url, Map.of(), null);
    }

    public Future<HttpResult> get(String url, Map<String, String> headers) {
        return request("GET", url, headers, null);
    }

    public Future<HttpResult> post(String url, String body) {
        return request("POST", url, Map.of(), body);
    }

    public Future<HttpResult> post(String url, String body, Map<String, String> headers) {
        return request("POST", url, headers, body);
    }

    public Future<HttpResult> put(String url, String body) {
        return request("PUT", url, Map.of(), body);
    }

    public Future<HttpResult> patch(String url, String body) {
        return request("PATCH", url, Map.of(), body);
    }

    public Future<HttpResult> delete(String url) {
        return request("DELETE", url, Map.of(), null);
    }

    public Future<HttpResult> head(String url) {
        return request("HEAD", url, Map.of(), null);
    }

    public Future<HttpResult> options(String url) {
        return request("OPTIONS", url, Map.of(), null);
    }

    /**
     * Sends a request, retrying according to the configured policy.
     *
     * @param url absolute URL
     * @param body request body, or {@code null} for none
     * @return a future with the first successful response, failed with a
     *         {@link dev.mars.backstop.exception.ResilienceException} when retrying stops, or
     *         with an {@link IllegalStateException} if the client has been closed
     */
    public Future<HttpResult> request(String method, String url, Map<String, String> headers, String body) {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("AsyncResilientHttpClient is closed"));
        }
        RequestDescription description;
        try {
            description = RequestDescription.of(method, url);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        Map<String, String> mdc = new HashMap<>(CorrelationContext.capture());
        mdc.putIfAbsent(CorrelationContext.MDC_CORRELATION_ID, CorrelationContext.newCorrelationId());
        mdc.put(CorrelationContext.MDC_REQUEST_METHOD, description.method());
        mdc.put(CorrelationContext.MDC_REQUEST_URL, description.url());

        try (CorrelationContext.Scope scope = CorrelationContext.apply(mdc)) {
            logger.debug("Sending {}", description);
            return retryExecutor.execute(request -> send(request, headers, body), description);
        }
    }

    private Future<HttpResult> send(RequestDescription description, Map<String, String> headers, String body) {
        HttpRequest<Buffer> request = webClient.requestAbs(HttpMethod.valueOf(description.method()), description.url())
            .timeout(config.getTimeout().toMillis());
        config.getDefaultHeaders().forEach(request::putHeader);
        if (headers != null) {
            headers.forEach(request::putHeader);
        }

        Future<HttpResponse<Buffer>> responseFuture = body != null
            ? request.sendBuffer(Buffer.buffer(body))
            : request.send();

        return responseFuture
            .recover(error -> handleNetworkError(description, error))
            .map(AsyncResilientHttpClient::toResult);
    }

    private Future<HttpResponse<Buffer>> handleNetworkError(RequestDescription description, Throwable error) {
        Throwable classified = TransportErrors.classify(error);
        logger.debug("{} transport failure: {}", description, classified.getMessage());
        return Future.failedFuture(classified);
    }

    private static HttpResult toResult(HttpResponse<Buffer> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : response.headers()) {
            headers.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return new HttpResult(response.statusCode(), headers, response.bodyAsString());
    }

    public ClientConfig getConfig() {
        return config;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsWebClient) {
            webClient.close();
        }
        logger.info("AsyncResilientHttpClient closed");
    }
}
