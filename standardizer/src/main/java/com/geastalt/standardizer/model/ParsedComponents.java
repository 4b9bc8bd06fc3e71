/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Components produced by a parse: one bag for a street address, or two for an intersection.
 */
public sealed interface ParsedComponents {

    /**
     * Key prefix that marks the second street of an intersection in the flat wire form.
     */
    String SECOND_PREFIX = "second_";

    /**
     * Flat wire form. Second-street fields carry the {@value #SECOND_PREFIX} prefix.
     */
    Map<String, String> toMap();

    static ParsedComponents single(ComponentBag bag) {
        return new Single(bag);
    }

    static ParsedComponents pair(ComponentBag first, ComponentBag second) {
        return new Pair(first, second);
    }

    /**
     * Reads the flat wire form. Any non-blank {@value #SECOND_PREFIX} key makes the result a pair.
     */
    static ParsedComponents fromMap(Map<String, String> components) {
        Map<String, String> first = new HashMap<>();
        Map<String, String> second = new HashMap<>();
        if (components != null) {
            components.forEach((key, value) -> {
                if (key == null) {
                    return;
                }
                if (key.startsWith(SECOND_PREFIX)) {
                    second.put(key.substring(SECOND_PREFIX.length()), value);
                } else {
                    first.put(key, value);
                }
            });
        }
        ComponentBag secondBag = ComponentBag.fromMap(second);
        if (secondBag.isEmpty()) {
            return new Single(ComponentBag.fromMap(first));
        }
        return new Pair(ComponentBag.fromMap(first), secondBag);
    }

    record Single(ComponentBag bag) implements ParsedComponents {

        public Single {
            Objects.requireNonNull(bag, "bag");
        }

        @Override
        public Map<String, String> toMap() {
            return bag.toMap();
        }
    }

    record Pair(ComponentBag first, ComponentBag second) implements ParsedComponents {

        public Pair {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }

        @Override
        public Map<String, String> toMap() {
            Map<String, String> map = new LinkedHashMap<>(first.toMap());
            second.toMap().forEach((key, value) -> map.put(SECOND_PREFIX + key, value));
            return map;
        }
    }
}
