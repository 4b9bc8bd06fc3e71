/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.mapping;

import com.geastalt.standardizer.model.ComponentField;

/**
 * Where a tagger label goes: a canonical component field, or nowhere.
 */
public sealed interface FieldMapping {

    record KnownField(ComponentField field) implements FieldMapping {
    }

    enum Ignored implements FieldMapping {
        INSTANCE
    }
}
