/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.service;

import com.geastalt.standardizer.format.ComponentNormalizer;
import com.geastalt.standardizer.model.ComponentBag;
import com.geastalt.standardizer.model.ComponentField;
import com.geastalt.standardizer.usps.UspsTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Moves secondary unit data that a tagger left at the front of the city back into unit fields.
 * <p>
 * A city such as {@code "LOWR LEVEL, UNIT 5 SEATTLE"} has its comma separated leading designator
 * segments peeled off into the next free unit slot (occupancy first, then subaddress). A bare
 * no-identifier designator ({@code BSMT}, {@code REAR}, ...) at the front of the remaining city
 * is moved the same way. Finally a single stray letter at the front of the city is appended to
 * an existing unit identifier ({@code "120"} and {@code "K WALLA WALLA"} become {@code "120 K"}
 * and {@code "WALLA WALLA"}).
 */
@Slf4j
@Component
public class CityComponentRecovery {

    private record UnitSlot(ComponentField type, ComponentField identifier) {
        boolean isFree(ComponentBag.Builder bag) {
            return !bag.has(type) && !bag.has(identifier);
        }
    }

    private static final List<UnitSlot> SLOTS = List.of(
            new UnitSlot(ComponentField.OCCUPANCY_TYPE, ComponentField.OCCUPANCY_IDENTIFIER),
            new UnitSlot(ComponentField.SUBADDRESS_TYPE, ComponentField.SUBADDRESS_IDENTIFIER));

    public ComponentBag recover(ComponentBag components) {
        if (!components.has(ComponentField.CITY)) {
            return components;
        }
        ComponentBag.Builder bag = components.toBuilder();
        peelDesignatorSegments(bag);
        peelBareDesignator(bag);
        recoverIdentifierFragment(bag);

        ComponentBag recovered = bag.build();
        if (!recovered.equals(components)) {
            log.debug("Recovered unit data from city: {} -> {}", components, recovered);
        }
        return recovered;
    }

    private void peelDesignatorSegments(ComponentBag.Builder bag) {
        while (true) {
            String city = bag.get(ComponentField.CITY);
            int comma = city.indexOf(',');
            if (comma < 0) {
                return;
            }
            String before = city.substring(0, comma).trim();
            String after = city.substring(comma + 1).trim();
            if (before.isEmpty() || after.isEmpty()) {
                return;
            }

            String[] parts = before.split("\\s+", 2);
            if (UspsTable.UNITS.contains(parts[0])) {
                nextFreeSlot(bag).ifPresent(slot -> {
                    bag.put(slot.type(), parts[0]);
                    bag.put(slot.identifier(), parts.length > 1 ? parts[1] : null);
                });
                bag.put(ComponentField.CITY, after);
                continue;
            }

            // a lone word that is not address vocabulary is wayfinding text such as "YARD" or "GATE"
            if (parts.length == 1 && !UspsTable.isAddressVocabulary(before)) {
                bag.put(ComponentField.CITY, after);
                continue;
            }
            return;
        }
    }

    private void peelBareDesignator(ComponentBag.Builder bag) {
        String city = bag.get(ComponentField.CITY);
        String[] parts = city.split(" ", 2);
        if (parts.length < 2 || parts[1].isBlank()) {
            return;
        }

        String first = parts[0];
        String rest = parts[1].trim();
        Optional<UnitSlot> slot = nextFreeSlot(bag);
        if (UspsTable.isUnitWithoutIdentifier(first)) {
            slot.ifPresent(free -> bag.put(free.type(), first));
            bag.put(ComponentField.CITY, rest);
        } else if (UspsTable.UNITS.contains(first) && slot.isEmpty()) {
            bag.put(ComponentField.CITY, rest);
        }
    }

    private void recoverIdentifierFragment(ComponentBag.Builder bag) {
        String city = bag.get(ComponentField.CITY);
        if (city.length() < 3 || !Character.isLetter(city.charAt(0)) || city.charAt(1) != ' ') {
            return;
        }
        String fragment = city.substring(0, 1);
        String rest = city.substring(2).trim();
        if (rest.isEmpty()) {
            return;
        }

        for (ComponentField identifier : List.of(ComponentField.OCCUPANCY_IDENTIFIER, ComponentField.SUBADDRESS_IDENTIFIER)) {
            if (bag.has(identifier)) {
                bag.put(identifier, bag.get(identifier) + " " + fragment);
                bag.put(ComponentField.CITY, rest);
                return;
            }
        }
    }

    private static Optional<UnitSlot> nextFreeSlot(ComponentBag.Builder bag) {
        return SLOTS.stream().filter(slot -> slot.isFree(bag)).findFirst();
    }
}
