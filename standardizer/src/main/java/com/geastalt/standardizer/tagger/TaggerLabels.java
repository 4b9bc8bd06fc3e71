/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.tagger;

/**
 * Token labels in the vocabulary of the common CRF address tagger.
 */
public final class TaggerLabels {

    public static final String ADDRESS_NUMBER_PREFIX = "AddressNumberPrefix";
    public static final String ADDRESS_NUMBER = "AddressNumber";
    public static final String ADDRESS_NUMBER_SUFFIX = "AddressNumberSuffix";
    public static final String STREET_NAME_PRE_DIRECTIONAL = "StreetNamePreDirectional";
    public static final String STREET_NAME_PRE_MODIFIER = "StreetNamePreModifier";
    public static final String STREET_NAME_PRE_TYPE = "StreetNamePreType";
    public static final String STREET_NAME = "StreetName";
    public static final String STREET_NAME_POST_TYPE = "StreetNamePostType";
    public static final String STREET_NAME_POST_DIRECTIONAL = "StreetNamePostDirectional";
    public static final String STREET_NAME_POST_MODIFIER = "StreetNamePostModifier";
    public static final String SUBADDRESS_TYPE = "SubaddressType";
    public static final String SUBADDRESS_IDENTIFIER = "SubaddressIdentifier";
    public static final String OCCUPANCY_TYPE = "OccupancyType";
    public static final String OCCUPANCY_IDENTIFIER = "OccupancyIdentifier";
    public static final String USPS_BOX_TYPE = "USPSBoxType";
    public static final String USPS_BOX_ID = "USPSBoxID";
    public static final String USPS_BOX_GROUP_TYPE = "USPSBoxGroupType";
    public static final String USPS_BOX_GROUP_ID = "USPSBoxGroupID";
    public static final String BUILDING_NAME = "BuildingName";
    public static final String LANDMARK_NAME = "LandmarkName";
    public static final String PLACE_NAME = "PlaceName";
    public static final String STATE_NAME = "StateName";
    public static final String ZIP_CODE = "ZipCode";
    public static final String ZIP_PLUS4 = "ZipPlus4";
    public static final String RECIPIENT = "Recipient";
    public static final String NOT_ADDRESS = "NotAddress";
    public static final String INTERSECTION_SEPARATOR = "IntersectionSeparator";
    public static final String CORNER_OF = "CornerOf";

    public static final String SECOND_STREET_PREFIX = "Second";

    private TaggerLabels() {
    }

    /**
     * The label used for the same part of the second street of an intersection,
     * e.g. {@code StreetName -> SecondStreetName}.
     */
    public static String second(String label) {
        return SECOND_STREET_PREFIX + label;
    }

    public static boolean isSecondStreet(String label) {
        return label != null && label.startsWith(SECOND_STREET_PREFIX + "Street");
    }

    public static String withoutSecondPrefix(String label) {
        if (isSecondStreet(label)) {
            return label.substring(SECOND_STREET_PREFIX.length());
        }
        return label;
    }
}
