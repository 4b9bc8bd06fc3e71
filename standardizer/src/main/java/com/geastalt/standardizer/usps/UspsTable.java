/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.usps;

import com.geastalt.standardizer.format.ComponentNormalizer;

import java.util.Map;

/**
 * The USPS Publication 28 abbreviation tables.
 * Tables are built once at class initialization and are never mutated, so lookups are safe from any thread.
 */
public enum UspsTable {

    SUFFIXES(StreetSuffixes.ENTRIES),
    DIRECTIONALS(Directionals.ENTRIES),
    STATES(StateCodes.ENTRIES),
    UNITS(SecondaryUnits.ENTRIES);

    private final Map<String, String> entries;

    UspsTable(Map<String, String> entries) {
        this.entries = entries;
    }

    /**
     * Returns the standard abbreviation for {@code key}, or the normalized key itself when the table has no entry.
     * Case and periods in the key are ignored. Never throws.
     */
    public String lookup(String key) {
        String normalized = ComponentNormalizer.normalize(key);
        return entries.getOrDefault(normalized, normalized);
    }

    /**
     * Checks whether {@code key} is a name, variant or abbreviation in this table.
     */
    public boolean contains(String key) {
        return entries.containsKey(ComponentNormalizer.normalize(key));
    }

    /**
     * Secondary unit designators that are used without an identifier.
     */
    public static boolean isUnitWithoutIdentifier(String key) {
        return SecondaryUnits.WITHOUT_IDENTIFIER.contains(ComponentNormalizer.normalize(key));
    }

    /**
     * Checks whether {@code key} appears in any of the tables.
     */
    public static boolean isAddressVocabulary(String key) {
        for (UspsTable table : values()) {
            if (table.contains(key)) {
                return true;
            }
        }
        return false;
    }
}
