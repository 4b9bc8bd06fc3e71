/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.service;

import com.geastalt.standardizer.format.ComponentNormalizer;
import com.geastalt.standardizer.format.ZipCodeFormatter;
import com.geastalt.standardizer.model.ComponentBag;
import com.geastalt.standardizer.model.ComponentField;
import com.geastalt.standardizer.model.ParsedComponents;
import com.geastalt.standardizer.model.StandardizedAddress;
import com.geastalt.standardizer.usps.UspsTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.geastalt.standardizer.model.ComponentField.*;

/**
 * Formats labelled address components per USPS Publication 28.
 * <p>
 * Every value is normalized; suffixes, directionals, states and unit designators are replaced by
 * their standard abbreviations; ZIP codes are formatted; and the address lines are assembled.
 * Standardizing the components of a standardized address reproduces it.
 */
@Slf4j
@Service
public class AddressStandardizationService {

    private static final String LINE_SEPARATOR = "  ";
    private static final String INTERSECTION_JOINER = " & ";
    private static final String PO_BOX = "PO BOX";
    private static final String UNIT_NUMBER_SIGN = "#";

    private static final Set<String> PO_BOX_SPELLINGS = Set.of(
            "PO BOX", "P O BOX", "POBOX", "POST OFFICE BOX", "BOX", "PO");

    private static final List<ComponentField> NUMBER_FIELDS = List.of(
            ADDRESS_NUMBER_PREFIX, ADDRESS_NUMBER, ADDRESS_NUMBER_SUFFIX);

    private static final List<ComponentField> STREET_FIELDS = List.of(
            STREET_PREDIRECTIONAL, STREET_PRE_MODIFIER, STREET_PRE_TYPE, STREET_NAME,
            STREET_POST_TYPE, STREET_POSTDIRECTIONAL, STREET_POST_MODIFIER);

    private static final Set<ComponentField> NOT_ON_INTERSECTIONS = EnumSet.of(
            ADDRESS_NUMBER_PREFIX, ADDRESS_NUMBER, ADDRESS_NUMBER_SUFFIX,
            SUBADDRESS_TYPE, SUBADDRESS_IDENTIFIER, OCCUPANCY_TYPE, OCCUPANCY_IDENTIFIER,
            USPS_BOX_TYPE, USPS_BOX_ID, BUILDING_NAME, LANDMARK_NAME);

    private static final List<ComponentField> LOCALITY_FIELDS = List.of(CITY, STATE, ZIP_CODE);

    public StandardizedAddress standardize(ParsedComponents components) {
        if (components instanceof ParsedComponents.Pair pair) {
            return standardize(pair.first(), pair.second());
        }
        if (components instanceof ParsedComponents.Single single) {
            return standardize(single.bag());
        }
        return standardize(ComponentBag.empty());
    }

    public StandardizedAddress standardize(ComponentBag components) {
        ComponentBag std = normalize(components == null ? ComponentBag.empty() : components);

        String line1 = join(std, NUMBER_FIELDS, STREET_FIELDS);
        if (line1.isEmpty() && (std.has(USPS_BOX_TYPE) || std.has(USPS_BOX_ID))) {
            line1 = join(std, List.of(USPS_BOX_TYPE, USPS_BOX_ID));
        }
        String line2 = join(std, List.of(SUBADDRESS_TYPE, SUBADDRESS_IDENTIFIER, OCCUPANCY_TYPE, OCCUPANCY_IDENTIFIER));

        StandardizedAddress address = assemble(line1, line2, std, ComponentBag.empty());
        log.info("Standardized address: {}", address.getStandardized());
        return address;
    }

    /**
     * Standardizes the intersection of two streets. House numbers, units, boxes and building names
     * do not belong on an intersection and are dropped from both sides; city, state and ZIP code
     * are taken from whichever side carries them first.
     */
    public StandardizedAddress standardize(ComponentBag first, ComponentBag second) {
        ComponentBag firstStreet = normalize(streetOnly(first == null ? ComponentBag.empty() : first));
        ComponentBag secondStreet = normalize(streetOnly(second == null ? ComponentBag.empty() : second));

        ComponentBag.Builder merged = firstStreet.toBuilder();
        for (ComponentField field : LOCALITY_FIELDS) {
            if (!merged.has(field)) {
                secondStreet.get(field).ifPresent(value -> merged.put(field, value));
            }
        }
        ComponentBag intersecting = secondStreet.without(EnumSet.of(CITY, STATE, ZIP_CODE, ZIP_PLUS4));

        String firstLine = join(firstStreet, STREET_FIELDS);
        String secondLine = join(intersecting, STREET_FIELDS);
        String line1;
        if (!firstLine.isEmpty() && !secondLine.isEmpty()) {
            line1 = firstLine + INTERSECTION_JOINER + secondLine;
        } else {
            line1 = firstLine.isEmpty() ? secondLine : firstLine;
        }

        StandardizedAddress address = assemble(line1, "", merged.build(), intersecting);
        log.info("Standardized intersection: {}", address.getStandardized());
        return address;
    }

    private StandardizedAddress assemble(String line1, String line2, ComponentBag std, ComponentBag intersecting) {
        String city = std.getOrEmpty(CITY);
        String state = std.getOrEmpty(STATE);
        String zipCode = std.getOrEmpty(ZIP_CODE);

        String lastLine;
        if (!city.isEmpty() && !state.isEmpty()) {
            lastLine = city + ", " + state;
        } else {
            lastLine = city.isEmpty() ? state : city;
        }
        if (!zipCode.isEmpty()) {
            lastLine = lastLine.isEmpty() ? zipCode : lastLine + " " + zipCode;
        }

        List<String> lines = new ArrayList<>();
        for (String line : List.of(line1, line2, lastLine)) {
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }

        return StandardizedAddress.builder()
                .addressLine1(line1)
                .addressLine2(line2)
                .city(city)
                .state(state)
                .zipCode(zipCode)
                .standardized(String.join(LINE_SEPARATOR, lines))
                .components(std)
                .intersectingStreet(intersecting)
                .build();
    }

    private ComponentBag normalize(ComponentBag components) {
        ComponentBag.Builder std = ComponentBag.builder();
        for (ComponentField field : components.fields()) {
            std.put(field, ComponentNormalizer.normalize(components.getOrEmpty(field)));
        }

        std.put(STREET_PREDIRECTIONAL, UspsTable.DIRECTIONALS.lookup(std.get(STREET_PREDIRECTIONAL)));
        std.put(STREET_POSTDIRECTIONAL, UspsTable.DIRECTIONALS.lookup(std.get(STREET_POSTDIRECTIONAL)));
        std.put(STREET_PRE_TYPE, UspsTable.SUFFIXES.lookup(std.get(STREET_PRE_TYPE)));
        std.put(STREET_POST_TYPE, UspsTable.SUFFIXES.lookup(std.get(STREET_POST_TYPE)));
        std.put(STATE, UspsTable.STATES.lookup(std.get(STATE)));

        if (PO_BOX_SPELLINGS.contains(std.get(USPS_BOX_TYPE))) {
            std.put(USPS_BOX_TYPE, PO_BOX);
        }

        normalizeUnits(std);

        std.put(ZIP_CODE, ZipCodeFormatter.format(std.get(ZIP_CODE), std.get(ZIP_PLUS4)));
        std.remove(ZIP_PLUS4);
        return std.build();
    }

    private void normalizeUnits(ComponentBag.Builder std) {
        String unitType = UspsTable.UNITS.lookup(std.get(OCCUPANCY_TYPE));
        String unitId = std.get(OCCUPANCY_IDENTIFIER);
        String subType = UspsTable.UNITS.lookup(std.get(SUBADDRESS_TYPE));
        String subId = std.get(SUBADDRESS_IDENTIFIER);

        // unit data tagged as a building or landmark name, e.g. "BLD C"
        if (unitType.isEmpty() && unitId.isEmpty() && subType.isEmpty() && subId.isEmpty()) {
            for (ComponentField fallback : List.of(BUILDING_NAME, LANDMARK_NAME)) {
                String[] parts = std.get(fallback).split(" ", 2);
                if (!parts[0].isEmpty() && UspsTable.UNITS.contains(parts[0])) {
                    log.debug("Recovered unit from {}: {}", fallback.getKey(), std.get(fallback));
                    unitType = UspsTable.UNITS.lookup(parts[0]);
                    unitId = parts.length > 1 ? parts[1] : "";
                    std.remove(fallback);
                    break;
                }
            }
        }

        if (unitType.isEmpty() && unitId.isEmpty()) {
            unitType = subType;
            unitId = subId;
            subType = "";
            subId = "";
        }

        if (!unitId.isEmpty() && unitType.isEmpty()) {
            if (unitId.startsWith(UNIT_NUMBER_SIGN)) {
                unitId = unitId.substring(1).trim();
            }
            String[] parts = unitId.split(" ", 2);
            if (unitId.isEmpty()) {
                unitType = "";
            } else if (UspsTable.UNITS.contains(parts[0])) {
                unitType = UspsTable.UNITS.lookup(parts[0]);
                unitId = parts.length > 1 ? parts[1] : "";
            } else {
                unitType = UNIT_NUMBER_SIGN;
            }
        }

        std.put(OCCUPANCY_TYPE, unitType);
        std.put(OCCUPANCY_IDENTIFIER, unitId);
        std.put(SUBADDRESS_TYPE, subType);
        std.put(SUBADDRESS_IDENTIFIER, subId);
    }

    private ComponentBag streetOnly(ComponentBag side) {
        Set<ComponentField> dropped = EnumSet.noneOf(ComponentField.class);
        for (ComponentField field : side.fields()) {
            if (NOT_ON_INTERSECTIONS.contains(field)) {
                dropped.add(field);
            }
        }
        if (dropped.isEmpty()) {
            return side;
        }
        log.debug("Dropping {} from intersection street", dropped);
        return side.without(dropped);
    }

    @SafeVarargs
    private static String join(ComponentBag bag, List<ComponentField>... fieldGroups) {
        List<String> parts = new ArrayList<>();
        for (List<ComponentField> fields : fieldGroups) {
            for (ComponentField field : fields) {
                bag.get(field).ifPresent(parts::add);
            }
        }
        return String.join(" ", parts);
    }
}
