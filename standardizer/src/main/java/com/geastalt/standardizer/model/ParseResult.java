/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.model;

/**
 * Outcome of parsing one raw address string.
 *
 * @param input          the string as received
 * @param components     the labelled components
 * @param classification what kind of address was found
 */
public record ParseResult(String input, ParsedComponents components, Classification classification) {
}
