/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ComponentFieldTest {

    @Test
    @DisplayName("Should resolve wire names ignoring case and surrounding whitespace")
    void shouldResolveKeys() {
        assertEquals(Optional.of(ComponentField.ZIP_PLUS4), ComponentField.fromKey(" Zip_Plus4 "));
        assertEquals(Optional.empty(), ComponentField.fromKey("zipcode"));
        assertEquals(Optional.empty(), ComponentField.fromKey(null));
    }

    @Test
    @DisplayName("Should resolve uppercase keys under a Turkish default locale")
    void shouldResolveKeysIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));

            assertEquals(Optional.of(ComponentField.ZIP_CODE), ComponentField.fromKey("ZIP_CODE"));
            assertEquals(Optional.of(ComponentField.CITY), ComponentField.fromKey("CITY"));
            assertEquals("62704", ComponentBag.fromMap(Map.of("ZIP_CODE", "62704"))
                    .getOrEmpty(ComponentField.ZIP_CODE));
        } finally {
            Locale.setDefault(original);
        }
    }
}
