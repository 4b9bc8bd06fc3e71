/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ComponentNormalizerTest {

    @Test
    @DisplayName("Should uppercase and remove periods")
    void shouldUppercaseAndRemovePeriods() {
        assertEquals("STE", ComponentNormalizer.normalize("Ste."));
        assertEquals("PO BOX", ComponentNormalizer.normalize("P.O. Box"));
    }

    @Test
    @DisplayName("Should trim and collapse whitespace")
    void shouldCollapseWhitespace() {
        assertEquals("A B", ComponentNormalizer.normalize("  a   b "));
        assertEquals("NEW YORK", ComponentNormalizer.normalize("new\tyork"));
    }

    @Test
    @DisplayName("Should strip parentheses and edge punctuation")
    void shouldStripParenthesesAndEdgePunctuation() {
        assertEquals("MAIN", ComponentNormalizer.normalize("(Main)"));
        assertEquals("AVE", ComponentNormalizer.normalize("Ave,"));
        assertEquals("LOWR LEVEL, UNIT", ComponentNormalizer.normalize(";Lowr Level, Unit;"));
    }

    @Test
    @DisplayName("Should normalize null to empty")
    void shouldNormalizeNullToEmpty() {
        assertEquals("", ComponentNormalizer.normalize(null));
        assertEquals("", ComponentNormalizer.normalize(" , "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Ste.", "  a   b ", "1600 Pennsylvania Ave. N.W.", "(Upper Level), Rear;", "#4B"})
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent(String value) {
        String once = ComponentNormalizer.normalize(value);
        assertEquals(once, ComponentNormalizer.normalize(once));
    }

    @Test
    @DisplayName("Should collapse and trim Unicode spaces")
    void shouldCollapseUnicodeSpaces() {
        assertEquals("A B", ComponentNormalizer.normalize("A\u00A0\u00A0B\u00A0"));
        assertEquals("MAIN ST", ComponentNormalizer.normalize("\u2003Main\u2009St\u3000"));
        assertEquals("", ComponentNormalizer.normalize("\u00A0,\u00A0"));
    }
}
