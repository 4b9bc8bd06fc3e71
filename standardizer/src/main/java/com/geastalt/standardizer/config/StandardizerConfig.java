/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "standardizer")
public class StandardizerConfig {

    /**
     * Longest accepted raw address, in characters.
     */
    private int maxInputLength = 1000;
    private Security security = new Security();

    @Data
    public static class Security {
        private String apiKey;
        private String headerName = "X-API-Key";
    }
}
