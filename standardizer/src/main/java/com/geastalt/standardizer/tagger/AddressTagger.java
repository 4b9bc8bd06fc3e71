/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.tagger;

/**
 * Splits a raw address string into labelled tokens.
 * Implementations must not throw for any non-null input.
 */
public interface AddressTagger {

    TaggerOutput tag(String address);
}
