/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.controller;

import com.geastalt.standardizer.config.StandardizerConfig;
import com.geastalt.standardizer.security.ApiKeyVerifier;
import com.geastalt.standardizer.service.AddressParsingService;
import com.geastalt.standardizer.service.AddressStandardizationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AddressController.class)
@EnableConfigurationProperties
@Import({StandardizerConfig.class, ApiKeyVerifier.class})
@TestPropertySource(properties = {"standardizer.security.api-key="})
class AddressControllerWithoutApiKeyTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private AddressParsingService parsingService;

    @MockBean
    private AddressStandardizationService standardizationService;

    @Test
    void parse_fails_when_server_key_is_not_configured() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header("X-API-Key", "anything")
                        .content("{\"address\":\"1 Main St\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").exists());

        verify(parsingService, never()).parseAndClassify(any());
    }

    @Test
    void parse_still_reports_missing_key_first() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"1 Main St\"}"))
                .andExpect(status().isUnauthorized());
    }
}
