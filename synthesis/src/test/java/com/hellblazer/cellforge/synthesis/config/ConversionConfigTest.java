/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Cellforge.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.cellforge.synthesis.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ConversionConfigTest {

    @TempDir
    Path tempDir;

    private static ConversionConfig parse(String json) throws IOException {
        return ConversionConfig.fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testLoadFromFile() throws IOException {
        var file = tempDir.resolve("config.json");
        Files.writeString(file, """
                                {
                                  "Tolerances": { "relativeTolerance": true, "relativePrecision": 0.0001, "planeDistance": 0.001 },
                                  "Options": { "forceNoOverlap": true, "enlargeBox": 5.0 },
                                  "NumericFormat": { "planeDistance": "%.3f" },
                                  "Settings": {
                                    "simplify": "full",
                                    "startCell": 100,
                                    "startSurf": 1000,
                                    "voidExclude": ["shield"],
                                    "skipSolids": [0, 3],
                                    "sortEnclosure": true,
                                    "splineSurfaces": "remove",
                                    "enclosureAttribution": "innermost_first"
                                  }
                                }
                                """);
        var config = ConversionConfig.fromJson(file);

        assertTrue(config.tolerances().relativeTolerance());
        assertEquals(0.001, config.tolerances().planeDistance());
        assertEquals(0.001, config.tolerances().scaled(0.001, 2.0));
        assertEquals(1.0, config.tolerances().scaled(0.001, -10_000.0), 1.0e-12);
        assertEquals(Tolerances.getDefault().cylinderDistance(), config.tolerances().cylinderDistance());
        assertTrue(config.options().forceNoOverlap());
        assertEquals(5.0, config.options().enlargeBox());
        assertEquals("%.3f", config.numericFormat().planeDistance());

        var settings = config.settings();
        assertEquals(SimplifyMode.FULL, settings.simplify());
        assertEquals(99, settings.cellOffset());
        assertEquals(999, settings.surfaceOffset());
        assertEquals(List.of("shield"), settings.voidExclude());
        assertEquals(List.of(0, 3), settings.skipSolids());
        assertTrue(settings.sortEnclosure());
        assertEquals(SplineSurfaces.REMOVE, settings.splineSurfaces());
        assertEquals(EnclosureAttribution.INNERMOST_FIRST, settings.enclosureAttribution());
        assertTrue(settings.voidGen(), "unspecified settings keep their defaults");
    }

    @Test
    public void testMissingFile() {
        assertThrows(IOException.class, () -> ConversionConfig.fromJson(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("Unknown keys are rejected at every level")
    public void testUnknownKeys() {
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Tolerance\": {}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Settings\": {\"maxSurfaces\": 3}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Options\": {\"splitTolerance\": 0.1}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Tolerances\": {\"minArea\": 0.01}}"));
    }

    @Test
    public void testTypeErrors() {
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Settings\": {\"maxSurf\": \"many\"}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Settings\": {\"voidGen\": 1}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Settings\": {\"simplify\": \"sometimes\"}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"Tolerances\": {\"value\": -1.0}}"));
        assertThrows(IllegalArgumentException.class, () -> parse("[1, 2]"));
    }

    @Test
    public void testDefaults() throws IOException {
        var config = parse("{}");
        assertEquals(SimplifyMode.VOID, config.settings().simplify());
        assertEquals(0, config.settings().cellOffset());
        assertEquals(10.0, config.settings().boxPadding());
        assertFalse(config.options().forceNoOverlap());
    }
}
