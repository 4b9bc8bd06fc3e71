/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.service;

import com.geastalt.standardizer.model.Classification;
import com.geastalt.standardizer.tagger.ParseMode;
import com.geastalt.standardizer.tagger.TaggedToken;
import com.geastalt.standardizer.tagger.TaggerLabels;
import com.geastalt.standardizer.tagger.TaggerOutput;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether tagger output is a street address, an intersection, or ambiguous.
 */
@Component
public class AddressClassifier {

    private static final List<String> STREET_ADDRESS_ONLY_PREFIXES =
            List.of("AddressNumber", "Occupancy", "Subaddress", "USPSBox");

    public Classification classify(TaggerOutput output) {
        if (output instanceof TaggerOutput.RepeatedLabel repeated) {
            return Classification.ambiguous(
                    "Repeated label '" + repeated.label() + "' detected; parse may be inaccurate.");
        }

        TaggerOutput.Tagged tagged = (TaggerOutput.Tagged) output;
        if (tagged.mode() == ParseMode.INTERSECTION) {
            Set<String> conflicting = streetAddressOnlyLabels(tagged.tokens());
            if (!conflicting.isEmpty()) {
                return Classification.ambiguous("Intersection also contains street address labels "
                        + String.join(", ", conflicting) + "; parse may be inaccurate.");
            }
            return Classification.intersection();
        }

        boolean secondStreet = tagged.tokens().stream()
                .map(TaggedToken::label)
                .anyMatch(TaggerLabels::isSecondStreet);
        if (secondStreet) {
            return Classification.ambiguous("Second street labels found outside an intersection; parse may be inaccurate.");
        }
        return Classification.streetAddress();
    }

    private static Set<String> streetAddressOnlyLabels(List<TaggedToken> tokens) {
        Set<String> labels = new LinkedHashSet<>();
        for (TaggedToken token : tokens) {
            for (String prefix : STREET_ADDRESS_ONLY_PREFIXES) {
                if (token.label().startsWith(prefix)) {
                    labels.add(token.label());
                }
            }
        }
        return labels;
    }
}
