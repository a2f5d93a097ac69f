package io.offlinemaps.api.region;


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

import io.offlinemaps.api.errors.InvalidRegionDefinitionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OfflineRegionDefinitionTest {

    private static final String STYLE = "https://maps.test/styles/basic.json";
    private static final LatLngBounds BOUNDS = new LatLngBounds(37.7, -122.5, 37.8, -122.4);

    @Test
    void testValidDefinition() {
        assertDoesNotThrow(() -> new OfflineRegionDefinition(BOUNDS, 0, 14.5, STYLE, 2.0f, false).validate(22));
        assertDoesNotThrow(() -> new OfflineRegionDefinition(LatLngBounds.WORLD, 3, 3, STYLE, 1.0f, true).validate(22));
    }

    @Test
    void testZoomRange() {
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 5, 4, STYLE, 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, -1, 4, STYLE, 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 0, 23, STYLE, 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, Double.NaN, 4, STYLE, 1.0f, false));
    }

    @Test
    void testBounds() {
        assertInvalid(new OfflineRegionDefinition(new LatLngBounds(10, 0, 5, 1), 0, 1, STYLE, 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(new LatLngBounds(0, -181, 1, 1), 0, 1, STYLE, 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(new LatLngBounds(0, 0, 91, 1), 0, 1, STYLE, 1.0f, false));
        assertFalse(new LatLngBounds(0, 0, Double.POSITIVE_INFINITY, 1).isValid());
        assertTrue(LatLngBounds.WORLD.isValid());
    }

    @Test
    void testPixelRatioAndStyle() {
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 0, 1, STYLE, 0f, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 0, 1, STYLE, Float.NaN, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 0, 1, null, 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 0, 1, "styles/basic.json", 1.0f, false));
        assertInvalid(new OfflineRegionDefinition(BOUNDS, 0, 1, "https://maps.test/a b", 1.0f, false));
    }

    @Test
    void testTerminalDownloadStates() {
        assertTrue(DownloadState.COMPLETE.isTerminal());
        assertTrue(DownloadState.COMPLETE_WITH_ERRORS.isTerminal());
        assertTrue(DownloadState.QUOTA_EXCEEDED.isTerminal());
        assertFalse(DownloadState.DOWNLOADING.isTerminal());
        assertFalse(DownloadState.INACTIVE.isTerminal());
    }

    private static void assertInvalid(OfflineRegionDefinition definition) {
        assertThrows(InvalidRegionDefinitionException.class, () -> definition.validate(22));
    }
}
