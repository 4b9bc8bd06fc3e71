/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A USPS Publication 28 formatted address.
 */
@Value
@Builder
public class StandardizedAddress {

    String addressLine1;
    String addressLine2;
    String city;
    String state;
    String zipCode;

    /**
     * All non-empty lines joined with two spaces.
     */
    String standardized;

    ComponentBag components;

    /**
     * Second street of an intersection; empty for every other address.
     */
    @Builder.Default
    ComponentBag intersectingStreet = ComponentBag.empty();

    public boolean isIntersection() {
        return !intersectingStreet.isEmpty();
    }

    /**
     * Normalized components in wire form, including the second street of an intersection.
     */
    public Map<String, String> componentMap() {
        if (isIntersection()) {
            return ParsedComponents.pair(components, intersectingStreet).toMap();
        }
        return components.toMap();
    }
}
