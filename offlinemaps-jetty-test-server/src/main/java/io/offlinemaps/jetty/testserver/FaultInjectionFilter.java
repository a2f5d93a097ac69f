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

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/// A servlet filter that answers scripted error statuses in front of the file servlet.
///
/// Tests register a number of failures for a request path; each matching request consumes
/// one failure until none remain, after which requests reach the file servlet normally.
/// Every request is counted per path so tests can assert how many transfers happened.
public class FaultInjectionFilter implements Filter {
    private static final Logger logger = LogManager.getLogger(FaultInjectionFilter.class);

    private final Map<String, Fault> faults = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();

    /// Makes the next `count` requests for `path` fail with `status`.
    /// @param path the request path, starting with `/`
    /// @param count how many requests fail
    /// @param status the HTTP status to answer with
    public void failNext(String path, int count, int status) {
        faults.put(path, new Fault(new AtomicInteger(count), status));
    }

    /// @param path the request path, starting with `/`
    /// @return how many requests for the path have been received
    public int requestCount(String path) {
        AtomicInteger count = requestCounts.get(path);
        return count == null ? 0 : count.get();
    }

    /// Clears scripted faults and request counts.
    public void reset() {
        faults.clear();
        requestCounts.clear();
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
        throws IOException, ServletException
    {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String path = httpRequest.getRequestURI();
        requestCounts.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();

        Fault fault = faults.get(path);
        if (fault != null && fault.remaining().getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            logger.debug("injecting HTTP {} for {}", fault.status(), path);
            ((HttpServletResponse) response).sendError(fault.status());
            return;
        }
        chain.doFilter(request, response);
    }

    private record Fault(AtomicInteger remaining, int status) {
    }
}
