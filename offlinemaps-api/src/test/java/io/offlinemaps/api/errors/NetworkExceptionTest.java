package io.offlinemaps.api.errors;


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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class NetworkExceptionTest {

    private static final String URL = "https://maps.test/tiles/1/0/0.pbf";

    @Test
    void testServerErrorsAreTransient() {
        for (int status : new int[]{500, 502, 503, 504, 429, 408}) {
            NetworkException error = NetworkException.forStatus(URL, status, null);
            assertTrue(error.isTransient(), "HTTP " + status + " should be retried");
            assertEquals(status, error.getStatus());
            assertEquals(URL, error.getUrl());
        }
    }

    @Test
    void testClientErrorsArePermanent() {
        for (int status : new int[]{400, 401, 403, 404, 410}) {
            assertFalse(NetworkException.forStatus(URL, status, "").isTransient(),
                "HTTP " + status + " should not be retried");
        }
    }

    @Test
    void testConnectionFailures() {
        IOException cause = new SocketTimeoutException("timeout");
        NetworkException error = NetworkException.connectionFailure(URL, cause);

        assertTrue(error.isTransient());
        assertEquals(NetworkException.NO_STATUS, error.getStatus());
        assertSame(cause, error.getCause());
    }

    @Test
    void testMalformedResponsesArePermanent() {
        NetworkException error = NetworkException.malformed(URL, "truncated body");
        assertFalse(error.isTransient());
        assertTrue(error.getMessage().contains("truncated body"));
    }

    @Test
    void testMessageIncludesDetail() {
        NetworkException error = NetworkException.forStatus(URL, 403, "token expired");
        assertEquals("HTTP 403 fetching " + URL + ": token expired", error.getMessage());
    }
}
