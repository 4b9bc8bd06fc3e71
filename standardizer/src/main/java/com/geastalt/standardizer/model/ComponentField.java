/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of canonical address component names.
 * Declaration order is the order components appear in an assembled address.
 */
public enum ComponentField {

    ADDRESS_NUMBER_PREFIX("address_number_prefix"),
    ADDRESS_NUMBER("address_number"),
    ADDRESS_NUMBER_SUFFIX("address_number_suffix"),
    STREET_PREDIRECTIONAL("street_predirectional"),
    STREET_PRE_MODIFIER("street_pre_modifier"),
    STREET_PRE_TYPE("street_pre_type"),
    STREET_NAME("street_name"),
    STREET_POST_TYPE("street_post_type"),
    STREET_POSTDIRECTIONAL("street_postdirectional"),
    STREET_POST_MODIFIER("street_post_modifier"),
    SUBADDRESS_TYPE("subaddress_type"),
    SUBADDRESS_IDENTIFIER("subaddress_identifier"),
    OCCUPANCY_TYPE("occupancy_type"),
    OCCUPANCY_IDENTIFIER("occupancy_identifier"),
    USPS_BOX_TYPE("usps_box_type"),
    USPS_BOX_ID("usps_box_id"),
    BUILDING_NAME("building_name"),
    LANDMARK_NAME("landmark_name"),
    CITY("city"),
    STATE("state"),
    ZIP_CODE("zip_code"),
    ZIP_PLUS4("zip_plus4");

    private static final Map<String, ComponentField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ComponentField::getKey, Function.identity()));

    private final String key;

    ComponentField(String key) {
        this.key = key;
    }

    /**
     * The snake_case name used on the wire.
     */
    public String getKey() {
        return key;
    }

    public static Optional<ComponentField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key.trim().toLowerCase(Locale.ROOT)));
    }
}
