/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.mapping;

import com.geastalt.standardizer.model.ComponentBag;
import com.geastalt.standardizer.model.ComponentField;
import com.geastalt.standardizer.tagger.TaggedToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.geastalt.standardizer.tagger.TaggerLabels.*;
import static java.util.Map.entry;

/**
 * Maps tagger labels onto canonical component fields.
 * Every label resolves to exactly one {@link FieldMapping}; labels not in the table are ignored.
 */
@Slf4j
@Component
public class TagMapper {

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s,;]+|[\\s,;]+$");

    private static final Map<String, FieldMapping> MAPPINGS = Map.ofEntries(
            entry(ADDRESS_NUMBER_PREFIX, known(ComponentField.ADDRESS_NUMBER_PREFIX)),
            entry(ADDRESS_NUMBER, known(ComponentField.ADDRESS_NUMBER)),
            entry(ADDRESS_NUMBER_SUFFIX, known(ComponentField.ADDRESS_NUMBER_SUFFIX)),
            entry(STREET_NAME_PRE_DIRECTIONAL, known(ComponentField.STREET_PREDIRECTIONAL)),
            entry(STREET_NAME_PRE_MODIFIER, known(ComponentField.STREET_PRE_MODIFIER)),
            entry(STREET_NAME_PRE_TYPE, known(ComponentField.STREET_PRE_TYPE)),
            entry(STREET_NAME, known(ComponentField.STREET_NAME)),
            entry(STREET_NAME_POST_TYPE, known(ComponentField.STREET_POST_TYPE)),
            entry(STREET_NAME_POST_DIRECTIONAL, known(ComponentField.STREET_POSTDIRECTIONAL)),
            entry(STREET_NAME_POST_MODIFIER, known(ComponentField.STREET_POST_MODIFIER)),
            entry(SUBADDRESS_TYPE, known(ComponentField.SUBADDRESS_TYPE)),
            entry(SUBADDRESS_IDENTIFIER, known(ComponentField.SUBADDRESS_IDENTIFIER)),
            entry(OCCUPANCY_TYPE, known(ComponentField.OCCUPANCY_TYPE)),
            entry(OCCUPANCY_IDENTIFIER, known(ComponentField.OCCUPANCY_IDENTIFIER)),
            entry(PLACE_NAME, known(ComponentField.CITY)),
            entry(STATE_NAME, known(ComponentField.STATE)),
            entry(ZIP_CODE, known(ComponentField.ZIP_CODE)),
            entry(ZIP_PLUS4, known(ComponentField.ZIP_PLUS4)),
            entry(USPS_BOX_TYPE, known(ComponentField.USPS_BOX_TYPE)),
            entry(USPS_BOX_ID, known(ComponentField.USPS_BOX_ID)),
            entry(USPS_BOX_GROUP_TYPE, known(ComponentField.USPS_BOX_TYPE)),
            entry(USPS_BOX_GROUP_ID, known(ComponentField.USPS_BOX_ID)),
            entry(BUILDING_NAME, known(ComponentField.BUILDING_NAME)),
            entry(LANDMARK_NAME, known(ComponentField.LANDMARK_NAME)),
            entry(RECIPIENT, FieldMapping.Ignored.INSTANCE),
            entry(NOT_ADDRESS, FieldMapping.Ignored.INSTANCE),
            entry(INTERSECTION_SEPARATOR, FieldMapping.Ignored.INSTANCE),
            entry(CORNER_OF, FieldMapping.Ignored.INSTANCE));

    public FieldMapping resolve(String label) {
        if (label == null) {
            return FieldMapping.Ignored.INSTANCE;
        }
        return MAPPINGS.getOrDefault(label, FieldMapping.Ignored.INSTANCE);
    }

    /**
     * Builds a component bag from tagged tokens. Tokens that share a field are joined with a
     * single space in the order they were emitted.
     */
    public ComponentBag map(List<TaggedToken> tokens) {
        Map<ComponentField, StringBuilder> values = new EnumMap<>(ComponentField.class);
        for (TaggedToken token : tokens) {
            FieldMapping mapping = resolve(token.label());
            if (mapping instanceof FieldMapping.KnownField known) {
                StringBuilder value = values.computeIfAbsent(known.field(), f -> new StringBuilder());
                if (value.length() > 0) {
                    value.append(' ');
                }
                value.append(token.token());
            } else {
                log.debug("Dropping token '{}' with label {}", token.token(), token.label());
            }
        }

        ComponentBag.Builder bag = ComponentBag.builder();
        values.forEach((field, value) -> bag.put(field, EDGE_PUNCTUATION.matcher(value).replaceAll("")));
        return bag.build();
    }

    private static FieldMapping known(ComponentField field) {
        return new FieldMapping.KnownField(field);
    }
}
