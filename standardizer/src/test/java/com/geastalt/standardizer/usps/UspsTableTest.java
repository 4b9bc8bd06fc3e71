/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.usps;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UspsTableTest {

    @ParameterizedTest
    @CsvSource({
            "SUFFIXES, Avenue, AVE",
            "SUFFIXES, av, AVE",
            "SUFFIXES, Boulevard, BLVD",
            "SUFFIXES, St., ST",
            "DIRECTIONALS, Southwest, SW",
            "DIRECTIONALS, n, N",
            "STATES, Illinois, IL",
            "STATES, District of Columbia, DC",
            "STATES, ny, NY",
            "UNITS, Suite, STE",
            "UNITS, Apartment, APT",
            "UNITS, bld, BLDG"
    })
    @DisplayName("Should return the standard abbreviation")
    void shouldReturnStandardAbbreviation(UspsTable table, String key, String expected) {
        assertEquals(expected, table.lookup(key));
    }

    @Test
    @DisplayName("Should map number sign spellings to the number sign")
    void shouldMapNumberSignSpellings() {
        assertEquals("#", UspsTable.UNITS.lookup("#"));
        assertEquals("#", UspsTable.UNITS.lookup("No."));
        assertEquals("#", UspsTable.UNITS.lookup("number"));
    }

    @Test
    @DisplayName("Should return the normalized key when there is no entry")
    void shouldFailOpenForUnknownKeys() {
        assertEquals("UNKNOWNWORDXYZ", UspsTable.SUFFIXES.lookup("Unknownwordxyz"));
        assertEquals("MAIN", UspsTable.SUFFIXES.lookup(" main. "));
    }

    @Test
    @DisplayName("Should treat null and blank keys as empty")
    void shouldHandleNullAndBlank() {
        assertEquals("", UspsTable.STATES.lookup(null));
        assertEquals("", UspsTable.UNITS.lookup("   "));
        assertFalse(UspsTable.UNITS.contains(null));
    }

    @Test
    @DisplayName("Should map every abbreviation to itself")
    void shouldBeIdempotent() {
        for (String key : new String[]{"Avenue", "Boulevard", "Street", "Parkway", "Suite", "Floor", "Texas", "Northeast"}) {
            for (UspsTable table : UspsTable.values()) {
                String once = table.lookup(key);
                assertEquals(once, table.lookup(once), table + " " + key);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"BSMT", "Basement", "REAR", "Penthouse", "lobby"})
    @DisplayName("Should recognize designators that take no identifier")
    void shouldRecognizeDesignatorsWithoutIdentifier(String key) {
        assertTrue(UspsTable.isUnitWithoutIdentifier(key));
    }

    @Test
    @DisplayName("Should not treat identifier-bearing designators as standalone")
    void shouldRejectDesignatorsThatNeedIdentifier() {
        assertFalse(UspsTable.isUnitWithoutIdentifier("STE"));
        assertFalse(UspsTable.isUnitWithoutIdentifier("KEY"));
    }

    @Test
    @DisplayName("Should know address vocabulary across all tables")
    void shouldRecognizeAddressVocabulary() {
        assertTrue(UspsTable.isAddressVocabulary("Suite"));
        assertTrue(UspsTable.isAddressVocabulary("Ohio"));
        assertTrue(UspsTable.isAddressVocabulary("Lane"));
        assertTrue(UspsTable.isAddressVocabulary("West"));
        assertFalse(UspsTable.isAddressVocabulary("Yard"));
    }
}
