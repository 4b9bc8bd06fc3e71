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

/**
 * State, territory and military state names with their two-letter codes, USPS Publication 28 Appendix B.
 */
final class StateCodes {

    static final Map<String, String> ENTRIES = build();

    private StateCodes() {
    }

    private static Map<String, String> build() {
        Map<String, String> map = new HashMap<>();
        add(map, "AL", "ALABAMA");
        add(map, "AK", "ALASKA");
        add(map, "AZ", "ARIZONA");
        add(map, "AR", "ARKANSAS");
        add(map, "CA", "CALIFORNIA");
        add(map, "CO", "COLORADO");
        add(map, "CT", "CONNECTICUT");
        add(map, "DE", "DELAWARE");
        add(map, "DC", "DISTRICT OF COLUMBIA");
        add(map, "FL", "FLORIDA");
        add(map, "GA", "GEORGIA");
        add(map, "HI", "HAWAII");
        add(map, "ID", "IDAHO");
        add(map, "IL", "ILLINOIS");
        add(map, "IN", "INDIANA");
        add(map, "IA", "IOWA");
        add(map, "KS", "KANSAS");
        add(map, "KY", "KENTUCKY");
        add(map, "LA", "LOUISIANA");
        add(map, "ME", "MAINE");
        add(map, "MD", "MARYLAND");
        add(map, "MA", "MASSACHUSETTS");
        add(map, "MI", "MICHIGAN");
        add(map, "MN", "MINNESOTA");
        add(map, "MS", "MISSISSIPPI");
        add(map, "MO", "MISSOURI");
        add(map, "MT", "MONTANA");
        add(map, "NE", "NEBRASKA");
        add(map, "NV", "NEVADA");
        add(map, "NH", "NEW HAMPSHIRE");
        add(map, "NJ", "NEW JERSEY");
        add(map, "NM", "NEW MEXICO");
        add(map, "NY", "NEW YORK");
        add(map, "NC", "NORTH CAROLINA");
        add(map, "ND", "NORTH DAKOTA");
        add(map, "OH", "OHIO");
        add(map, "OK", "OKLAHOMA");
        add(map, "OR", "OREGON");
        add(map, "PA", "PENNSYLVANIA");
        add(map, "RI", "RHODE ISLAND");
        add(map, "SC", "SOUTH CAROLINA");
        add(map, "SD", "SOUTH DAKOTA");
        add(map, "TN", "TENNESSEE");
        add(map, "TX", "TEXAS");
        add(map, "UT", "UTAH");
        add(map, "VT", "VERMONT");
        add(map, "VA", "VIRGINIA");
        add(map, "WA", "WASHINGTON");
        add(map, "WV", "WEST VIRGINIA");
        add(map, "WI", "WISCONSIN");
        add(map, "WY", "WYOMING");

        add(map, "AS", "AMERICAN SAMOA");
        add(map, "FM", "FEDERATED STATES OF MICRONESIA");
        add(map, "GU", "GUAM");
        add(map, "MH", "MARSHALL ISLANDS");
        add(map, "MP", "NORTHERN MARIANA ISLANDS");
        add(map, "PW", "PALAU");
        add(map, "PR", "PUERTO RICO");
        add(map, "VI", "VIRGIN ISLANDS", "US VIRGIN ISLANDS");

        add(map, "AA", "ARMED FORCES AMERICAS");
        add(map, "AE", "ARMED FORCES EUROPE", "ARMED FORCES AFRICA", "ARMED FORCES CANADA",
                "ARMED FORCES MIDDLE EAST");
        add(map, "AP", "ARMED FORCES PACIFIC");
        return Map.copyOf(map);
    }

    private static void add(Map<String, String> map, String code, String... names) {
        map.put(code, code);
        for (String name : names) {
            map.put(name, code);
        }
    }
}
