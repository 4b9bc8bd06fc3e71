/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.tagger;

/**
 * The overall shape the tagger decided the input has.
 */
public enum ParseMode {
    STREET_ADDRESS,
    INTERSECTION,
    PO_BOX
}
