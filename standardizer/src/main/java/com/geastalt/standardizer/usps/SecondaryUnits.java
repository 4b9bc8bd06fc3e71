/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.usps;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Secondary unit designators, USPS Publication 28 Appendix C2.
 */
final class SecondaryUnits {

    static final Map<String, String> ENTRIES = build();

    /**
     * Designators that never take an identifier (BSMT, REAR, ...), in both spelled-out and abbreviated form.
     */
    static final Set<String> WITHOUT_IDENTIFIER = Set.of(
            "BASEMENT", "BSMT", "FRONT", "FRNT", "LOBBY", "LBBY",
            "LOWER", "LOWR", "PENTHOUSE", "PH", "REAR", "SIDE",
            "UPPER", "UPPR"
    );

    private SecondaryUnits() {
    }

    private static Map<String, String> build() {
        Map<String, String> map = new HashMap<>();
        add(map, "APT", "APARTMENT");
        add(map, "BSMT", "BASEMENT");
        add(map, "BLDG", "BUILDING", "BLD");
        add(map, "DEPT", "DEPARTMENT");
        add(map, "FL", "FLOOR", "FLR");
        add(map, "FRNT", "FRONT");
        add(map, "HNGR", "HANGER", "HANGAR");
        add(map, "KEY");
        add(map, "LBBY", "LOBBY");
        add(map, "LOT");
        add(map, "LOWR", "LOWER");
        add(map, "OFC", "OFFICE");
        add(map, "PH", "PENTHOUSE");
        add(map, "PIER");
        add(map, "REAR");
        add(map, "RM", "ROOM");
        add(map, "SIDE");
        add(map, "SLIP");
        add(map, "SPC", "SPACE");
        add(map, "STOP");
        add(map, "STE", "SUITE");
        add(map, "TRLR", "TRAILER");
        add(map, "UNIT");
        add(map, "UPPR", "UPPER");
        add(map, "#", "NO", "NUMBER");
        return Map.copyOf(map);
    }

    private static void add(Map<String, String> map, String abbreviation, String... names) {
        map.put(abbreviation, abbreviation);
        for (String name : names) {
            map.put(name, abbreviation);
        }
    }
}
