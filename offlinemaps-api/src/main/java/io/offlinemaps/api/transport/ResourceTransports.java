package io.offlinemaps.api.transport;

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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/// Factory for a [ResourceTransport] that routes each request by URL scheme.
///
/// This factory uses ServiceLoader to discover available transport providers and selects
/// the appropriate implementation based on the @TransportScheme annotation. Providers are
/// not instantiated until a request with a matching scheme arrives.
///
/// Example usage:
/// ```java
/// try (ResourceTransport transport = ResourceTransports.create(TransportOptions.DEFAULTS)) {
///     FetchResponse style = transport.fetch(
///         FetchRequest.unconditional("https://example.com/style.json", ResourceKind.STYLE));
/// }
/// ```
public final class ResourceTransports {

    private ResourceTransports() {
    }

    /// Creates a routing transport over every provider on the class path.
    /// @param options settings passed to each provider's transport
    /// @return a transport that dispatches on the request URL's scheme
    public static ResourceTransport create(TransportOptions options) {
        Map<String, ServiceLoader.Provider<ResourceTransportProvider>> byScheme = new HashMap<>();
        ServiceLoader<ResourceTransportProvider> loader = ServiceLoader.load(ResourceTransportProvider.class);
        loader.stream().forEach(provider -> {
            TransportScheme annotation = provider.type().getAnnotation(TransportScheme.class);
            if (annotation != null) {
                for (String scheme : annotation.value()) {
                    byScheme.putIfAbsent(scheme.toLowerCase(Locale.ROOT), provider);
                }
            }
        });
        return new SchemeRoutingTransport(byScheme, options);
    }

    /// Extracts the lower-case scheme of a URL.
    /// @param url the URL
    /// @return the scheme
    /// @throws NetworkException if the URL is malformed or has no scheme
    public static String schemeOf(String url) {
        try {
            String scheme = new URI(url).getScheme();
            if (scheme == null) {
                throw NetworkException.malformed(url, "url has no scheme");
            }
            return scheme.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            throw new NetworkException(url, NetworkException.NO_STATUS, false, "malformed url: " + url, e);
        }
    }

    private static final class SchemeRoutingTransport implements ResourceTransport {
        private final Map<String, ServiceLoader.Provider<ResourceTransportProvider>> providers;
        private final TransportOptions options;
        private final Map<String, ResourceTransport> transports = new ConcurrentHashMap<>();

        private SchemeRoutingTransport(
            Map<String, ServiceLoader.Provider<ResourceTransportProvider>> providers,
            TransportOptions options
        ) {
            this.providers = Map.copyOf(providers);
            this.options = options;
        }

        @Override
        public FetchResponse fetch(FetchRequest request) {
            String scheme = schemeOf(request.url());
            ServiceLoader.Provider<ResourceTransportProvider> provider = providers.get(scheme);
            if (provider == null) {
                throw NetworkException.malformed(request.url(), "no transport provider for scheme '" + scheme + "'");
            }
            ResourceTransport transport = transports.computeIfAbsent(
                provider.type().getName(),
                name -> provider.get().createTransport(options)
            );
            return transport.fetch(request);
        }

        @Override
        public void close() {
            transports.values().forEach(ResourceTransport::close);
            transports.clear();
        }
    }
}
