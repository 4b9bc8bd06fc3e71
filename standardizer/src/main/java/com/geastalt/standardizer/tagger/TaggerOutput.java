/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.tagger;

import java.util.List;

/**
 * Result of tagging a raw address.
 * A tagger that finds the same label in two separate places reports {@link RepeatedLabel}
 * together with its best-effort tokens rather than failing.
 */
public sealed interface TaggerOutput {

    List<TaggedToken> tokens();

    record Tagged(List<TaggedToken> tokens, ParseMode mode) implements TaggerOutput {
        public Tagged {
            tokens = List.copyOf(tokens);
        }
    }

    record RepeatedLabel(String label, List<TaggedToken> tokens) implements TaggerOutput {
        public RepeatedLabel {
            tokens = List.copyOf(tokens);
        }
    }
}
