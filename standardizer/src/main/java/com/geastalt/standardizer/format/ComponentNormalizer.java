/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.format;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for a single address field value: uppercase, no periods or parentheses,
 * no leading or trailing whitespace, commas or semicolons, and single spaces between words.
 */
public final class ComponentNormalizer {

    // (?U) so that no-break and other Unicode spaces count as whitespace
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("(?U)^[\\s,;]+|[\\s,;]+$");

    private ComponentNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        // USPS Pub 28 section 354: parentheses are not part of a standardized address
        String cleaned = value.toUpperCase(Locale.ROOT)
                .replace(".", "")
                .replace("(", "")
                .replace(")", "");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        return EDGE_PUNCTUATION.matcher(cleaned).replaceAll("");
    }
}
