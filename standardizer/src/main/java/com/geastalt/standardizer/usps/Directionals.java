/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.usps;

import java.util.Map;

final class Directionals {

    static final Map<String, String> ENTRIES = Map.ofEntries(
            Map.entry("NORTH", "N"), Map.entry("N", "N"),
            Map.entry("SOUTH", "S"), Map.entry("S", "S"),
            Map.entry("EAST", "E"), Map.entry("E", "E"),
            Map.entry("WEST", "W"), Map.entry("W", "W"),
            Map.entry("NORTHEAST", "NE"), Map.entry("NE", "NE"),
            Map.entry("NORTHWEST", "NW"), Map.entry("NW", "NW"),
            Map.entry("SOUTHEAST", "SE"), Map.entry("SE", "SE"),
            Map.entry("SOUTHWEST", "SW"), Map.entry("SW", "SW")
    );

    private Directionals() {
    }
}
