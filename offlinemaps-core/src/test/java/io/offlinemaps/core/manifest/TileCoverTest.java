package io.offlinemaps.core.manifest;


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

import io.offlinemaps.api.region.LatLngBounds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class TileCoverTest {

    @Test
    void testWorldCover() {
        assertEquals(1, TileCover.range(LatLngBounds.WORLD, 0).count());
        assertEquals(4, TileCover.range(LatLngBounds.WORLD, 1).count());
        assertEquals(1 + 4 + 16, TileCover.count(LatLngBounds.WORLD, 0, 2));
    }

    @ParameterizedTest
    @CsvSource({"0, 1", "1, 4", "3, 64", "10, 1048576"})
    void testWorldTileCountPerZoom(int z, long expected) {
        assertEquals(expected, TileCover.range(LatLngBounds.WORLD, z).count());
    }

    @Test
    void testPartialCover() {
        LatLngBounds bounds = new LatLngBounds(-30, -180, 85, 150);
        TileCover.TileRange range = TileCover.range(bounds, 4);

        assertEquals(0, range.minX());
        assertEquals(14, range.maxX());
        assertEquals(0, range.minY());
        assertEquals(9, range.maxY());
        assertEquals(150, range.count());
        assertTrue(range.contains(14, 9));
        assertFalse(range.contains(15, 0));
    }

    @Test
    void testColumnsAndRows() {
        assertEquals(0, TileCover.column(-180, 3));
        assertEquals(4, TileCover.column(0, 3));
        assertEquals(7, TileCover.column(180, 3), "east edge clamps to the last column");
        assertEquals(0, TileCover.row(90, 3), "latitudes beyond the projection clamp");
        assertEquals(4, TileCover.row(0, 3));
        assertEquals(7, TileCover.row(-90, 3));
    }

    @Test
    void testRejectsZoomOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> TileCover.range(LatLngBounds.WORLD, -1));
        assertThrows(IllegalArgumentException.class, () -> TileCover.range(LatLngBounds.WORLD, 31));
    }
}
