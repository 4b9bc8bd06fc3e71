/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.service;

import com.geastalt.standardizer.mapping.TagMapper;
import com.geastalt.standardizer.model.Classification;
import com.geastalt.standardizer.model.ComponentBag;
import com.geastalt.standardizer.model.ParseResult;
import com.geastalt.standardizer.model.ParsedComponents;
import com.geastalt.standardizer.tagger.AddressTagger;
import com.geastalt.standardizer.tagger.TaggedToken;
import com.geastalt.standardizer.tagger.TaggerLabels;
import com.geastalt.standardizer.tagger.TaggerOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a raw address string into labelled, classified components.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AddressParsingService {

    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private final AddressTagger addressTagger;
    private final AddressClassifier addressClassifier;
    private final TagMapper tagMapper;
    private final CityComponentRecovery cityComponentRecovery;

    /**
     * Parses and classifies {@code raw}. Never throws; a null or blank input yields an empty
     * street address.
     */
    public ParseResult parseAndClassify(String raw) {
        String input = raw == null ? "" : raw;
        TaggerOutput output = addressTagger.tag(clean(input));
        Classification classification = addressClassifier.classify(output);

        ParsedComponents components;
        if (classification instanceof Classification.Intersection) {
            components = splitStreets(output.tokens());
        } else if (classification instanceof Classification.Ambiguous) {
            components = ParsedComponents.single(tagMapper.map(mergeDualAddressNumbers(output.tokens())));
        } else {
            components = ParsedComponents.single(cityComponentRecovery.recover(tagMapper.map(output.tokens())));
        }

        log.info("Parsed address '{}' as {}", input, classification.typeName());
        classification.warning().ifPresent(warning -> log.info("Parse warning for '{}': {}", input, warning));
        return new ParseResult(input, components, classification);
    }

    /**
     * Removes parenthesized notes such as "(UPPER LEVEL)" and any unmatched parentheses.
     */
    static String clean(String raw) {
        String cleaned = PARENTHESIZED.matcher(raw).replaceAll("");
        cleaned = cleaned.replace("(", "").replace(")", "");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    private ParsedComponents splitStreets(List<TaggedToken> tokens) {
        List<TaggedToken> first = new ArrayList<>();
        List<TaggedToken> second = new ArrayList<>();
        for (TaggedToken token : tokens) {
            if (TaggerLabels.isSecondStreet(token.label())) {
                second.add(new TaggedToken(TaggerLabels.withoutSecondPrefix(token.label()), token.token()));
            } else {
                first.add(token);
            }
        }
        ComponentBag firstBag = tagMapper.map(first);
        ComponentBag secondBag = tagMapper.map(second);
        return ParsedComponents.pair(firstBag, secondBag);
    }

    /**
     * Best-effort primary-stream tokens for an ambiguous parse. An address number, separator,
     * address number run is a dual address and becomes one hyphenated number ("1804-1810").
     */
    static List<TaggedToken> mergeDualAddressNumbers(List<TaggedToken> tokens) {
        List<TaggedToken> merged = new ArrayList<>();
        String previous = null;
        TaggedToken heldSeparator = null;

        for (TaggedToken token : tokens) {
            String label = token.label();
            if (TaggerLabels.isSecondStreet(label)) {
                continue;
            }
            if (TaggerLabels.INTERSECTION_SEPARATOR.equals(label) && TaggerLabels.ADDRESS_NUMBER.equals(previous)) {
                heldSeparator = token;
                previous = label;
                continue;
            }
            if (TaggerLabels.ADDRESS_NUMBER.equals(label) && heldSeparator != null) {
                TaggedToken number = merged.remove(merged.size() - 1);
                merged.add(new TaggedToken(TaggerLabels.ADDRESS_NUMBER, number.token() + "-" + token.token()));
                heldSeparator = null;
                previous = label;
                continue;
            }
            if (heldSeparator != null) {
                merged.add(heldSeparator);
                heldSeparator = null;
            }
            merged.add(token);
            previous = label;
        }
        if (heldSeparator != null) {
            merged.add(heldSeparator);
        }
        return merged;
    }
}
