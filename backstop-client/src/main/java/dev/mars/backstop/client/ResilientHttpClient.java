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
import dev.mars.backstop.retry.RetryExecutor;
import dev.mars.backstop.transport.HttpResult;
import dev.mars.backstop.transport.RequestDescription;
import dev.mars.backstop.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking HTTP client that runs every call through a {@link RetryExecutor}.
 *
 * <p>Built on the JDK {@link HttpClient}. Each attempt gets the configured timeout; I/O failures
 * are classified by {@link TransportErrors} so that timeouts and dropped connections are retried
 * and anything else surfaces immediately.</p>
 *
 * <pre>{@code
 * try (ResilientHttpClient client = new ResilientHttpClient(ClientConfig.defaults())) {
 *     HttpResult result = client.get("https://api.example.com/items");
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ResilientHttpClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ResilientHttpClient.class);

    private final ClientConfig config;
    private final HttpClient httpClient;
    private final ExecutorService ownedExecutor;
    private final RetryExecutor retryExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ResilientHttpClient(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ownedExecutor = Executors.newCachedThreadPool(new ClientThreadFactory());
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.getTimeout())
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
            .executor(ownedExecutor)
            .build();
        this.retryExecutor = new RetryExecutor(config.getRetryPolicy(), config.getCircuitBreaker(), config.getCallbacks());
        logger.info("Created ResilientHttpClient with config: {}", config);
    }

    /**
     * Uses a caller-supplied {@link HttpClient}. Its redirect and executor settings win over
     * {@link ClientConfig#isFollowRedirects()}, and it is left alone on {@link #close()}.
     */
    public ResilientHttpClient(ClientConfig config, HttpClient httpClient) {
        this(config, httpClient, new RetryExecutor(config.getRetryPolicy(), config.getCircuitBreaker(), config.getCallbacks()));
    }

    public ResilientHttpClient(ClientConfig config, HttpClient httpClient, RetryExecutor retryExecutor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.ownedExecutor = null;
        this.retryExecutor = retryExecutor;
    }

    public HttpResult get(String url) throws InterruptedException {
        return request("GET", url, Map.of(), null);
    }

    public HttpResult get(String url, Map<String, String> headers) throws InterruptedException {
        return request("GET", url, headers, null);
    }

    public HttpResult post(String url, String body) throws InterruptedException {
        return request("POST", url, Map.of(), body);
    }

    public HttpResult post(String url, String body, Map<String, String> headers) throws InterruptedException {
        return request("POST", url, headers, body);
    }

    public HttpResult put(String url, String body) throws InterruptedException {
        return request("PUT", url, Map.of(), body);
    }

    public HttpResult patch(String url, String body) throws InterruptedException {
        return request("PATCH", url, Map.of(), body);
    }

    public HttpResult delete(String url) throws InterruptedException {
        return request("DELETE", url, Map.of(), null);
    }

    public HttpResult head(String url) throws InterruptedException {
        return request("HEAD", url, Map.of(), null);
    }

    public HttpResult options(String url) throws InterruptedException {
        return request("OPTIONS", url, Map.of(), null);
    }

    /**
     * Sends a request, retrying according to the configured policy.
     *
     * @param body request body, or {@code null} for none
     * @return the first successful response
     * @throws dev.mars.backstop.exception.ResilienceException when retrying stops without success
     * @throws IllegalStateException if the client has been closed
     * @throws InterruptedException if interrupted while waiting for a response or backing off
     */
    public HttpResult request(String method, String url, Map<String, String> headers, String body)
            throws InterruptedException {
        ensureOpen();
        RequestDescription description = RequestDescription.of(method, url);
        HttpRequest httpRequest = buildRequest(description, headers, body);

        Map<String, String> mdc = new HashMap<>(CorrelationContext.capture());
        mdc.putIfAbsent(CorrelationContext.MDC_CORRELATION_ID, CorrelationContext.newCorrelationId());
        mdc.put(CorrelationContext.MDC_REQUEST_METHOD, description.method());
        mdc.put(CorrelationContext.MDC_REQUEST_URL, description.url());

        try (CorrelationContext.Scope scope = CorrelationContext.apply(mdc)) {
            logger.debug("Sending {}", description);
            return retryExecutor.execute(request -> send(request, httpRequest), description);
        } catch (TransportException e) {
            if (e.getCause() instanceof InterruptedException) {
                throw (InterruptedException) e.getCause();
            }
            throw e;
        }
    }

    private HttpResult send(RequestDescription request, HttpRequest httpRequest) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            TransportException classified = TransportErrors.classify(e);
            logger.debug("{} transport failure ({}): {}", request, classified.getKind(), classified.getMessage());
            throw classified;
        } catch (InterruptedException e) {
            // Unwrapped and rethrown as InterruptedException by request()
            throw new TransportException(TransportException.Kind.OTHER, request + " interrupted", e);
        }
        logger.debug("{} -> {}", request, response.statusCode());
        return new HttpResult(response.statusCode(), flatten(response.headers()), response.body());
    }

    private HttpRequest buildRequest(RequestDescription description, Map<String, String> headers, String body) {
        HttpRequest.BodyPublisher publisher = body != null
            ? HttpRequest.BodyPublishers.ofString(body)
            : HttpRequest.BodyPublishers.noBody();
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(description.url()))
            .timeout(config.getTimeout())
            .method(description.method(), publisher);

        Map<String, String> merged = new LinkedHashMap<>(config.getDefaultHeaders());
        if (headers != null) {
            merged.putAll(headers);
        }
        merged.forEach(builder::header);
        return builder.build();
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : headers.map().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                flat.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return flat;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("ResilientHttpClient is closed");
        }
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
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        logger.info("ResilientHttpClient closed");
    }

    private static final class ClientThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "backstop-http-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
