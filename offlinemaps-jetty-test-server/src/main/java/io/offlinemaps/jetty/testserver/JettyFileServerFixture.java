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

import jakarta.servlet.DispatcherType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.FilterHolder;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

/// A test fixture that starts a Jetty web server to host map resources.
///
/// The server listens on a random free port on the loopback interface and serves the files
/// under a resources directory, with ETags and `Cache-Control: max-age=3600`. A
/// [FaultInjectionFilter] in front of the file servlet lets tests script error responses.
///
/// Example usage:
/// ```java
/// try (JettyFileServerFixture server = new JettyFileServerFixture(Path.of("src/test/resources/testserver"))) {
///     server.start();
///     URL styleUrl = server.url("styles/basic.json");
/// }
/// ```
///
/// On close the fixture verifies that no served file was modified while it ran; tests are
/// not allowed to write into the fixture directory.
public class JettyFileServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    private final Path resourcesRoot;
    private final FaultInjectionFilter faults = new FaultInjectionFilter();
    private final Map<Path, FileTime> fileTimestamps = new HashMap<>();
    private Server server;
    private int port;

    /// Creates a fixture serving the given directory.
    /// @param resourcesRoot The root directory containing the resources to serve
    public JettyFileServerFixture(Path resourcesRoot) {
        if (!Files.isDirectory(resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
        this.resourcesRoot = resourcesRoot.toAbsolutePath();
        snapshotTimestamps();
    }

    /// Starts the web server on a random available port.
    /// @throws IOException If the server cannot be started
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toString());
        server.setHandler(context);

        context.addFilter(new FilterHolder(faults), "/*", EnumSet.of(DispatcherType.REQUEST));

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("welcomeServlets", "false");
        defaultServlet.setInitParameter("redirectWelcome", "false");
        defaultServlet.setInitParameter("precompressed", "false");
        defaultServlet.setInitParameter("acceptRanges", "true");
        defaultServlet.setInitParameter("etags", "true");
        defaultServlet.setInitParameter("cacheControl", "max-age=3600,public");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            logger.info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /// @return The base URL of the server, ending in `/`
    public URL getBaseUrl() {
        try {
            return new URL("http://127.0.0.1:" + port + "/");
        } catch (MalformedURLException e) {
            throw new IllegalStateException("Failed to create server URL", e);
        }
    }

    /// Resolves a path against the base URL.
    /// @param relativePath a path relative to the served directory
    /// @return the absolute URL of the resource
    public URL url(String relativePath) {
        try {
            return new URL(getBaseUrl(), relativePath);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid relative path: " + relativePath, e);
        }
    }

    /// @return the filter used to script failures and count requests
    public FaultInjectionFilter faults() {
        return faults;
    }

    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /// Stops the server and verifies that no served file was modified.
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test web server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
            server = null;
        }
        checkForModifiedFiles();
    }

    private void snapshotTimestamps() {
        try (Stream<Path> files = Files.walk(resourcesRoot)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                try {
                    fileTimestamps.put(file, Files.getLastModifiedTime(file));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            logger.debug("Took timestamp snapshot of {} files in {}", fileTimestamps.size(), resourcesRoot);
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to take file timestamp snapshot: {}", e.getMessage());
        }
    }

    private void checkForModifiedFiles() {
        for (Map.Entry<Path, FileTime> entry : fileTimestamps.entrySet()) {
            Path file = entry.getKey();
            try {
                if (!Files.exists(file)) {
                    throw new IllegalStateException(
                        "Unit tests are not allowed to delete files in the testserver directory: " + file);
                }
                if (!Files.getLastModifiedTime(file).equals(entry.getValue())) {
                    throw new IllegalStateException(
                        "Unit tests are not allowed to modify files in the testserver directory: " + file);
                }
            } catch (IOException e) {
                logger.warn("Failed to check {} for modification: {}", file, e.getMessage());
            }
        }
    }

    private static int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to find available port", e);
        }
    }
}
