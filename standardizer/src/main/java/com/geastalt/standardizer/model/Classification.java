/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

import java.util.Optional;

/**
 * The kind of address a parse produced.
 */
public sealed interface Classification {

    /**
     * Display name used on the wire: {@code Street Address}, {@code Intersection} or {@code Ambiguous}.
     */
    String typeName();

    /**
     * A human-readable warning, present only for ambiguous parses.
     */
    default Optional<String> warning() {
        return Optional.empty();
    }

    static Classification streetAddress() {
        return new StreetAddress();
    }

    static Classification intersection() {
        return new Intersection();
    }

    static Classification ambiguous(String diagnostic) {
        return new Ambiguous(diagnostic);
    }

    record StreetAddress() implements Classification {
        @Override
        public String typeName() {
            return "Street Address";
        }
    }

    record Intersection() implements Classification {
        @Override
        public String typeName() {
            return "Intersection";
        }
    }

    record Ambiguous(String diagnostic) implements Classification {

        public Ambiguous {
            if (diagnostic == null || diagnostic.isBlank()) {
                throw new IllegalArgumentException("Ambiguous classification requires a diagnostic");
            }
        }

        @Override
        public String typeName() {
            return "Ambiguous";
        }

        @Override
        public Optional<String> warning() {
            return Optional.of(diagnostic);
        }
    }
}
