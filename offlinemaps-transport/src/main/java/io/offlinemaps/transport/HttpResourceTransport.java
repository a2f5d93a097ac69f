package io.offlinemaps.transport;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.offlinemaps.api.errors.NetworkException;
import io.offlinemaps.api.resource.ResourceMetadata;
import io.offlinemaps.api.transport.FetchRequest;
import io.offlinemaps.api.transport.FetchResponse;
import io.offlinemaps.api.transport.ResourceTransport;
import io.offlinemaps.api.transport.TransportOptions;
import io.offlinemaps.api.transport.TransportScheme;
import okhttp3.CacheControl;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Date;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// HTTP-based implementation of [ResourceTransport] using the OkHttp client.
///
/// Key features:
/// - Connection pooling and keepalive shared by all requests
/// - Conditional requests (`If-None-Match`, `If-Modified-Since`) for revalidation
/// - Expiry derived from `Cache-Control: max-age`, falling back to `Expires`
/// - Status classification into transient and permanent [NetworkException]s
///
/// Retries are deliberately not performed here: OkHttp's own connection retry is disabled so
/// the downloader's backoff policy is the only one in effect.
@TransportScheme({"http", "https"})
public class HttpResourceTransport implements ResourceTransport {
    private static final Logger logger = LogManager.getLogger(HttpResourceTransport.class);

    private static final DateTimeFormatter HTTP_DATE =
        DateTimeFormatter.RFC_1123_DATE_TIME.withZone(ZoneOffset.UTC);

    /// HTTP client instance shared by every request through this transport
    private final OkHttpClient httpClient;

    private final TransportOptions options;

    private final Clock clock;

    /// Flag to track if this transport has been closed
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public HttpResourceTransport(TransportOptions options) {
        this(options, Clock.systemUTC());
    }

    HttpResourceTransport(TransportOptions options, Clock clock) {
        this.options = options;
        this.clock = clock;
        this.httpClient = createHttpClient(options);
    }

    /// Creates the OkHttp client.
    ///
    /// The dispatcher limits are raised because the downloader, not OkHttp, bounds concurrency.
    private static OkHttpClient createHttpClient(TransportOptions options) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(128);
        dispatcher.setMaxRequestsPerHost(32);

        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(32, 5, TimeUnit.MINUTES))
            .dispatcher(dispatcher)
            .connectTimeout(options.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(options.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(options.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
            .retryOnConnectionFailure(false)
            .followRedirects(true)
            .build();
    }

    @Override
    public FetchResponse fetch(FetchRequest fetchRequest) {
        validateNotClosed();

        Request.Builder builder = new Request.Builder()
            .url(requestUrl(fetchRequest.url()))
            .header("User-Agent", options.userAgent());
        if (fetchRequest.priorEtag() != null) {
            builder.header("If-None-Match", fetchRequest.priorEtag());
        }
        if (fetchRequest.priorModified() != null) {
            builder.header("If-Modified-Since", HTTP_DATE.format(fetchRequest.priorModified()));
        }

        logger.debug("GET {} ({}{})", fetchRequest.url(), fetchRequest.kind(),
            fetchRequest.isConditional() ? ", conditional" : "");

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResourceMetadata metadata = metadataOf(response);
            if (response.code() == 304) {
                if (!fetchRequest.isConditional()) {
                    throw NetworkException.malformed(fetchRequest.url(), "304 for an unconditional request");
                }
                return FetchResponse.notModified(metadata);
            }
            if (!response.isSuccessful()) {
                throw NetworkException.forStatus(fetchRequest.url(), response.code(), errorBody(response));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw NetworkException.malformed(fetchRequest.url(), "response body is null");
            }
            byte[] payload = body.bytes();
            long declared = body.contentLength();
            if (declared >= 0 && declared != payload.length) {
                throw NetworkException.malformed(fetchRequest.url(),
                    "expected " + declared + " bytes but received " + payload.length);
            }
            return FetchResponse.ok(payload, metadata);
        } catch (IOException e) {
            throw NetworkException.connectionFailure(fetchRequest.url(), e);
        }
    }

    /// Parses a resource URL and appends the access token when one is configured and the URL
    /// does not already carry one.
    HttpUrl requestUrl(String resourceUrl) {
        HttpUrl url = HttpUrl.parse(resourceUrl);
        if (url == null) {
            throw NetworkException.malformed(resourceUrl, "not an http(s) url");
        }
        if (options.accessToken() != null && url.queryParameter("access_token") == null) {
            url = url.newBuilder().addQueryParameter("access_token", options.accessToken()).build();
        }
        return url;
    }

    /// Reads revalidation metadata from response headers.
    private ResourceMetadata metadataOf(Response response) {
        String etag = response.header("ETag");
        Date lastModified = response.headers().getDate("Last-Modified");
        Instant expires = null;
        CacheControl cacheControl = response.cacheControl();
        if (cacheControl.maxAgeSeconds() >= 0) {
            expires = clock.instant().plusSeconds(cacheControl.maxAgeSeconds());
        } else {
            Date expiresHeader = response.headers().getDate("Expires");
            if (expiresHeader != null) {
                expires = expiresHeader.toInstant();
            }
        }
        return new ResourceMetadata(etag, expires, lastModified != null ? lastModified.toInstant() : null);
    }

    private static String errorBody(Response response) {
        try (ResponseBody body = response.body()) {
            if (body == null) {
                return "";
            }
            String text = body.string();
            return text.length() > 200 ? text.substring(0, 200) : text;
        } catch (IOException e) {
            return "(unreadable body: " + e.getMessage() + ")";
        }
    }

    private void validateNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("HttpResourceTransport has been closed");
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }
}
