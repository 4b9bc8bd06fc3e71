/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.format;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort ZIP code formatting. Well-formed ZIP and ZIP+4 values come out as {@code 12345} or
 * {@code 12345-6789}; anything else is returned normalized but otherwise untouched.
 */
public final class ZipCodeFormatter {

    private static final Pattern ZIP5 = Pattern.compile("^\\d{5}$");
    private static final Pattern ZIP5_PLUS4 = Pattern.compile("^(\\d{5})\\D?(\\d{4})$");

    private ZipCodeFormatter() {
    }

    public static String format(String zipCode) {
        return format(zipCode, null);
    }

    /**
     * Combines a ZIP code with an optional separate +4 extension and formats the result.
     * A +4 value without a ZIP code is dropped.
     */
    public static String format(String zipCode, String zipPlus4) {
        String zip = ComponentNormalizer.normalize(zipCode);
        String plus4 = ComponentNormalizer.normalize(zipPlus4);
        if (zip.isEmpty()) {
            return "";
        }

        String combined = plus4.isEmpty() ? zip : zip + "-" + plus4;
        Matcher matcher = ZIP5_PLUS4.matcher(combined);
        if (matcher.matches()) {
            return matcher.group(1) + "-" + matcher.group(2);
        }
        return combined;
    }

    public static boolean isWellFormed(String zipCode) {
        String normalized = ComponentNormalizer.normalize(zipCode);
        return ZIP5.matcher(normalized).matches() || ZIP5_PLUS4.matcher(normalized).matches();
    }
}
