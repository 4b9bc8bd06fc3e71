/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.tagger;

import com.geastalt.standardizer.format.ComponentNormalizer;
import com.geastalt.standardizer.format.ZipCodeFormatter;
import com.geastalt.standardizer.usps.UspsTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static com.geastalt.standardizer.tagger.TaggerLabels.*;

/**
 * Deterministic address tagger driven by the Publication 28 tables.
 * <p>
 * The locality is read from the end of the input (ZIP, then state, then city); the first comma
 * segment is read as the street line; remaining segments are secondary units or place names.
 * A connector word ({@code AND}, {@code &}, {@code AT}, {@code @}) between two streets makes the
 * input an intersection, with the second street tagged using {@code SecondStreet*} labels.
 */
@Slf4j
@Component
public class RuleBasedAddressTagger implements AddressTagger {

    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("(?U)\\s+,");
    private static final Pattern COMMA_WITHOUT_SPACE = Pattern.compile("(?U),(?=\\S)");
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
    private static final Pattern HOUSE_NUMBER = Pattern.compile("^\\d+(-\\d+)?[A-Z]?$");
    private static final Pattern HAS_DIGIT = Pattern.compile(".*\\d.*");

    private static final Set<String> CONNECTORS = Set.of("AND", "&", "AT", "@");

    // Longest forms first
    private static final List<List<String>> PO_BOX_FORMS = List.of(
            List.of("POST", "OFFICE", "BOX"),
            List.of("P", "O", "BOX"),
            List.of("PO", "BOX"),
            List.of("POBOX"),
            List.of("BOX"));

    @Override
    public TaggerOutput tag(String address) {
        List<Token> tokens = tokenize(address);
        if (tokens.isEmpty()) {
            return new TaggerOutput.Tagged(List.of(), ParseMode.STREET_ADDRESS);
        }

        TaggingPass pass = new TaggingPass(tokens);
        pass.run();

        List<TaggedToken> tagged = pass.taggedTokens();
        String repeated = pass.repeatedLabel();
        if (repeated != null) {
            log.debug("Label {} appears in more than one place in '{}'", repeated, address);
            return new TaggerOutput.RepeatedLabel(repeated, tagged);
        }
        log.debug("Tagged '{}' in {} mode: {}", address, pass.mode, tagged);
        return new TaggerOutput.Tagged(tagged, pass.mode);
    }

    static List<Token> tokenize(String address) {
        if (address == null || address.isBlank()) {
            return List.of();
        }
        String spaced = SPACE_BEFORE_COMMA.matcher(address.trim()).replaceAll(",");
        spaced = COMMA_WITHOUT_SPACE.matcher(spaced).replaceAll(", ");

        List<Token> tokens = new ArrayList<>();
        for (String raw : WHITESPACE.split(spaced)) {
            String key = ComponentNormalizer.normalize(raw);
            if (key.isEmpty()) {
                // a bare comma closes the previous segment
                if (!tokens.isEmpty() && raw.contains(",")) {
                    Token last = tokens.remove(tokens.size() - 1);
                    tokens.add(new Token(last.raw(), last.key(), true));
                }
                continue;
            }
            tokens.add(new Token(raw, key, raw.endsWith(",") || raw.endsWith(";")));
        }
        return tokens;
    }

    record Token(String raw, String key, boolean endsSegment) {
    }

    private static final class UnitGroup {
        private final List<Integer> designator = new ArrayList<>();
        private final List<Integer> identifier = new ArrayList<>();
    }

    /**
     * Label assignment for one input. Not thread safe; one instance per call.
     */
    private static final class TaggingPass {

        private final List<Token> tokens;
        private final String[] labels;
        private final List<UnitGroup> units = new ArrayList<>();
        private ParseMode mode = ParseMode.STREET_ADDRESS;

        TaggingPass(List<Token> tokens) {
            this.tokens = tokens;
            this.labels = new String[tokens.size()];
        }

        void run() {
            int end = tokens.size();

            boolean hasZip = false;
            if (end > 1 && ZipCodeFormatter.isWellFormed(key(end - 1))) {
                labels[end - 1] = ZIP_CODE;
                hasZip = true;
                end--;
            }

            boolean hasLocality = hasZip;
            int stateStart = findState(end, hasZip);
            if (stateStart >= 0) {
                label(stateStart, end, STATE_NAME);
                hasLocality = true;
                end = stateStart;
            }

            int cityStart = -1;
            int cityEnd = -1;
            if (hasLocality) {
                int start = segmentStart(end - 1);
                if (start > 0 && !isUnitStart(start)) {
                    cityStart = start;
                    cityEnd = end;
                }
            } else {
                int start = segmentStart(end - 1);
                while (start > 0 && isUnitStart(start)) {
                    start = segmentStart(start - 1);
                }
                if (start > 0) {
                    cityStart = start;
                    cityEnd = Math.min(segmentEnd(start), end);
                }
            }

            int streetEnd = Math.min(segmentEnd(0), cityStart >= 0 ? cityStart : end);
            tagStreetLine(0, streetEnd);

            int k = streetEnd;
            while (k < end) {
                if (k == cityStart) {
                    label(cityStart, cityEnd, PLACE_NAME);
                    k = cityEnd;
                    continue;
                }
                int segmentEnd = Math.min(segmentEnd(k), end);
                tagTail(k, segmentEnd);
                k = segmentEnd;
            }

            assignUnitLabels();
        }

        private int findState(int end, boolean hasZip) {
            for (int length = 3; length >= 1; length--) {
                int start = end - length;
                if (start < 1 || endsSegmentBetween(start, end - 1)) {
                    continue;
                }
                String phrase = phrase(start, end);
                if (!UspsTable.STATES.contains(phrase)) {
                    continue;
                }
                if (hasZip) {
                    return start;
                }
                boolean afterComma = tokens.get(start - 1).endsSegment();
                if (length == 1 && phrase.length() == 2 && (afterComma || !isOtherVocabulary(phrase))) {
                    return start;
                }
                if (afterComma && segmentStart(start - 1) > 0) {
                    return start;
                }
            }
            return -1;
        }

        private void tagStreetLine(int from, int to) {
            if (from >= to) {
                return;
            }

            int boxId = matchPoBox(from, to);
            if (boxId > from) {
                mode = ParseMode.PO_BOX;
                label(from, boxId, USPS_BOX_TYPE);
                labels[boxId] = USPS_BOX_ID;
                tagTail(boxId + 1, to);
                return;
            }

            int connector = findConnector(from, to);
            if (connector > from) {
                if (connector == from + 1 && isHouseNumber(from) && isHouseNumber(connector + 1)) {
                    // dual address such as "1804 & 1810 Main St"
                    labels[from] = ADDRESS_NUMBER;
                    labels[connector] = INTERSECTION_SEPARATOR;
                    tagStreet(connector + 1, to, false);
                    return;
                }
                mode = ParseMode.INTERSECTION;
                tagStreet(from, connector, false);
                labels[connector] = INTERSECTION_SEPARATOR;

                // a third street repeats the separator label, which marks the parse as ambiguous
                int extra = findConnector(connector + 1, to);
                if (extra > connector + 1) {
                    tagStreet(connector + 1, extra, true);
                    labels[extra] = INTERSECTION_SEPARATOR;
                    tagStreet(extra + 1, to, true);
                    return;
                }
                tagStreet(connector + 1, to, true);
                return;
            }

            tagStreet(from, to, false);
        }

        private void tagStreet(int from, int to, boolean second) {
            int i = from;
            if (i < to && !second && isHouseNumber(i)) {
                labels[i] = ADDRESS_NUMBER;
                i++;
            }
            if (i < to - 1 && UspsTable.DIRECTIONALS.contains(key(i))
                    && (!isSuffix(i + 1) || (i + 2 < to && isSuffix(i + 2)))) {
                labels[i] = streetLabel(STREET_NAME_PRE_DIRECTIONAL, second);
                i++;
            }
            if (i >= to) {
                return;
            }

            int nameStart = i;
            int unitStart = findUnitStart(nameStart, to);
            int type = findStreetType(nameStart, unitStart);
            int nameEnd = type >= 0 ? type : unitStart;
            label(nameStart, nameEnd, streetLabel(STREET_NAME, second));

            int next = nameEnd;
            if (type >= 0) {
                labels[type] = streetLabel(STREET_NAME_POST_TYPE, second);
                next = type + 1;
                if (next < unitStart && UspsTable.DIRECTIONALS.contains(key(next))) {
                    labels[next] = streetLabel(STREET_NAME_POST_DIRECTIONAL, second);
                    next++;
                }
            }
            label(next, unitStart, PLACE_NAME);
            tagTail(unitStart, to);
        }

        /**
         * Secondary units and, for anything else, place names.
         */
        private void tagTail(int from, int to) {
            int k = from;
            while (k < to) {
                if (isUnitStart(k)) {
                    k = tagUnit(k, to);
                } else {
                    labels[k] = PLACE_NAME;
                    k++;
                }
            }
        }

        private int tagUnit(int k, int to) {
            UnitGroup unit = new UnitGroup();
            String key = key(k);
            if (key.startsWith("#")) {
                unit.identifier.add(k++);
                if (key.equals("#") && k < to) {
                    unit.identifier.add(k++);
                }
            } else {
                unit.designator.add(k++);
                if (!UspsTable.isUnitWithoutIdentifier(key) && k < to) {
                    if (key(k).equals("#") && k + 1 < to) {
                        unit.identifier.add(k++);
                    }
                    unit.identifier.add(k++);
                }
            }
            units.add(unit);
            return k;
        }

        private void assignUnitLabels() {
            // with two units the first is the larger container
            boolean split = units.size() == 2;
            for (int u = 0; u < units.size(); u++) {
                boolean subaddress = split && u == 0;
                UnitGroup unit = units.get(u);
                unit.designator.forEach(k -> labels[k] = subaddress ? SUBADDRESS_TYPE : OCCUPANCY_TYPE);
                unit.identifier.forEach(k -> labels[k] = subaddress ? SUBADDRESS_IDENTIFIER : OCCUPANCY_IDENTIFIER);
            }
        }

        private int matchPoBox(int from, int to) {
            for (List<String> form : PO_BOX_FORMS) {
                int idIndex = from + form.size();
                if (idIndex >= to) {
                    continue;
                }
                boolean matches = true;
                for (int w = 0; w < form.size() && matches; w++) {
                    matches = form.get(w).equals(key(from + w));
                }
                if (!matches) {
                    continue;
                }
                if (form.size() == 1 && form.get(0).equals("BOX") && !HAS_DIGIT.matcher(key(idIndex)).matches()) {
                    continue;
                }
                return idIndex;
            }
            return -1;
        }

        private int findConnector(int from, int to) {
            for (int k = from + 1; k < to - 1; k++) {
                if (CONNECTORS.contains(key(k))) {
                    return k;
                }
            }
            return -1;
        }

        private int findUnitStart(int nameStart, int to) {
            int searchFrom = nameStart + 1;
            for (int k = nameStart + 1; k < to; k++) {
                if (isSuffix(k)) {
                    searchFrom = k + 1;
                    break;
                }
            }
            for (int k = searchFrom; k < to; k++) {
                if (isUnitStart(k)) {
                    return k;
                }
            }
            return to;
        }

        private int findStreetType(int nameStart, int unitStart) {
            for (int k = nameStart + 1; k < unitStart; k++) {
                if (isSuffix(k) && (k + 1 >= unitStart || !isSuffix(k + 1))) {
                    return k;
                }
            }
            return -1;
        }

        List<TaggedToken> taggedTokens() {
            List<TaggedToken> tagged = new ArrayList<>();
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] != null) {
                    tagged.add(new TaggedToken(labels[i], tokens.get(i).raw()));
                }
            }
            return tagged;
        }

        /**
         * The first label that appears in two runs separated by another label, or null.
         */
        String repeatedLabel() {
            Set<String> closed = new HashSet<>();
            String current = null;
            for (String label : labels) {
                if (label == null || label.equals(current)) {
                    continue;
                }
                if (current != null) {
                    closed.add(current);
                }
                if (closed.contains(label)) {
                    return label;
                }
                current = label;
            }
            return null;
        }

        private String key(int index) {
            return tokens.get(index).key();
        }

        private void label(int from, int to, String label) {
            for (int k = from; k < to; k++) {
                labels[k] = label;
            }
        }

        private String phrase(int from, int to) {
            StringBuilder phrase = new StringBuilder();
            for (int k = from; k < to; k++) {
                if (phrase.length() > 0) {
                    phrase.append(' ');
                }
                phrase.append(key(k));
            }
            return phrase.toString();
        }

        private boolean endsSegmentBetween(int from, int to) {
            for (int k = from; k < to; k++) {
                if (tokens.get(k).endsSegment()) {
                    return true;
                }
            }
            return false;
        }

        private int segmentStart(int index) {
            int k = index;
            while (k > 0 && !tokens.get(k - 1).endsSegment()) {
                k--;
            }
            return k;
        }

        private int segmentEnd(int index) {
            for (int k = index; k < tokens.size(); k++) {
                if (tokens.get(k).endsSegment()) {
                    return k + 1;
                }
            }
            return tokens.size();
        }

        private boolean isHouseNumber(int index) {
            return index < tokens.size() && HOUSE_NUMBER.matcher(key(index)).matches();
        }

        private boolean isSuffix(int index) {
            return UspsTable.SUFFIXES.contains(key(index));
        }

        private boolean isUnitStart(int index) {
            String key = key(index);
            return key.startsWith("#") || UspsTable.UNITS.contains(key);
        }

        private static boolean isOtherVocabulary(String key) {
            return UspsTable.SUFFIXES.contains(key)
                    || UspsTable.DIRECTIONALS.contains(key)
                    || UspsTable.UNITS.contains(key);
        }

        private static String streetLabel(String label, boolean second) {
            return second ? TaggerLabels.second(label) : label;
        }
    }
}
