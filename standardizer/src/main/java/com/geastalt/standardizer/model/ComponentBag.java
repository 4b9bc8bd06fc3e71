/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from canonical field to value.
 * Blank values are never stored: an absent field is simply missing from the bag.
 */
@EqualsAndHashCode
@ToString
public final class ComponentBag {

    private static final ComponentBag EMPTY = new ComponentBag(new EnumMap<>(ComponentField.class));

    private final Map<ComponentField, String> values;

    private ComponentBag(EnumMap<ComponentField, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ComponentBag empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a bag from wire names. Unknown names and blank values are dropped.
     */
    public static ComponentBag fromMap(Map<String, String> components) {
        Builder builder = builder();
        if (components != null) {
            components.forEach((key, value) ->
                    ComponentField.fromKey(key).ifPresent(field -> builder.put(field, value)));
        }
        return builder.build();
    }

    public Optional<String> get(ComponentField field) {
        return Optional.ofNullable(values.get(field));
    }

    public String getOrEmpty(ComponentField field) {
        return values.getOrDefault(field, "");
    }

    public boolean has(ComponentField field) {
        return values.containsKey(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<ComponentField> fields() {
        return values.keySet();
    }

    /**
     * Returns a copy of this bag without the given fields.
     */
    public ComponentBag without(Set<ComponentField> fields) {
        Builder builder = toBuilder();
        fields.forEach(builder::remove);
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    /**
     * Wire representation, keyed by snake_case name in address order.
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        values.forEach((field, value) -> map.put(field.getKey(), value));
        return map;
    }

    public static final class Builder {

        private final EnumMap<ComponentField, String> values = new EnumMap<>(ComponentField.class);

        private Builder() {
        }

        /**
         * Sets a field. A null or blank value removes it instead.
         */
        public Builder put(ComponentField field, String value) {
            if (value == null || value.isBlank()) {
                values.remove(field);
            } else {
                values.put(field, value);
            }
            return this;
        }

        /**
         * Appends to a field with a single space, or sets it when absent.
         */
        public Builder append(ComponentField field, String value) {
            if (value == null || value.isBlank()) {
                return this;
            }
            values.merge(field, value, (existing, added) -> existing + " " + added);
            return this;
        }

        public Builder remove(ComponentField field) {
            values.remove(field);
            return this;
        }

        public String get(ComponentField field) {
            return values.getOrDefault(field, "");
        }

        public boolean has(ComponentField field) {
            return values.containsKey(field);
        }

        public ComponentBag build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new ComponentBag(new EnumMap<>(values));
        }
    }
}
