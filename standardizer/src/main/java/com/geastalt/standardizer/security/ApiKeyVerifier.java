/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.security;

import com.geastalt.standardizer.config.StandardizerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks a presented API key against the configured one in constant time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyVerifier {

    public enum Outcome {
        ACCEPTED,
        MISSING,
        INVALID,
        NOT_CONFIGURED
    }

    private final StandardizerConfig config;

    public String headerName() {
        return config.getSecurity().getHeaderName();
    }

    public Outcome verify(String presentedKey) {
        if (presentedKey == null) {
            return Outcome.MISSING;
        }

        String expected = config.getSecurity().getApiKey();
        if (expected == null || expected.isEmpty()) {
            log.error("No API key configured (standardizer.security.api-key); authenticated endpoints are unavailable");
            return Outcome.NOT_CONFIGURED;
        }

        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presentedKey.getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            log.warn("Rejected request with an invalid API key");
            return Outcome.INVALID;
        }
        return Outcome.ACCEPTED;
    }
}
