package io.offlinemaps.jetty.testserver;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;

/// A JUnit Jupiter extension that shares one [JettyFileServerFixture] per test JVM.
///
/// The server is started on first use and stopped by a shutdown hook. Scripted faults and
/// request counts are reset before each test.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// public class MyTest {
///     @Test
///     public void fetchesStyle() {
///         String style = JettyFileServerExtension.url("styles/basic.json");
///     }
/// }
/// ```
public class JettyFileServerExtension implements BeforeAllCallback, BeforeEachCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);

    /// System property overriding the served directory
    public static final String RESOURCES_ROOT_PROPERTY = "offlinemaps.testserver.root";
    private static final String DEFAULT_RESOURCES_PATH = "src/test/resources/testserver";

    private static final Object lock = new Object();
    private static JettyFileServerFixture server;

    /// Starts the shared server if it is not running yet.
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                Path root = Paths.get(System.getProperty(RESOURCES_ROOT_PROPERTY, DEFAULT_RESOURCES_PATH));
                JettyFileServerFixture fixture = new JettyFileServerFixture(root);
                try {
                    logger.info("Starting Jetty test web server for the module");
                    fixture.start();
                } catch (IOException e) {
                    logger.error("Failed to start Jetty test web server", e);
                    throw new UncheckedIOException("Failed to start Jetty test web server", e);
                }
                server = fixture;
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    synchronized (lock) {
                        if (server != null) {
                            server.close();
                            server = null;
                        }
                    }
                }, "jetty-test-server-shutdown"));
            }
        }
    }

    /// @return the shared fixture, started if necessary
    public static JettyFileServerFixture getServer() {
        initialize();
        return server;
    }

    public static URL getBaseUrl() {
        return getServer().getBaseUrl();
    }

    /// @param relativePath a path relative to the served directory
    /// @return the URL of the resource as a string
    public static String url(String relativePath) {
        return getServer().url(relativePath).toString();
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyFileServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        getServer().faults().reset();
    }
}
