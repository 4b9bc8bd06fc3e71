/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.controller;

import com.geastalt.standardizer.config.StandardizerConfig;
import com.geastalt.standardizer.mapping.TagMapper;
import com.geastalt.standardizer.security.ApiKeyVerifier;
import com.geastalt.standardizer.service.AddressClassifier;
import com.geastalt.standardizer.service.AddressParsingService;
import com.geastalt.standardizer.service.AddressStandardizationService;
import com.geastalt.standardizer.service.CityComponentRecovery;
import com.geastalt.standardizer.tagger.RuleBasedAddressTagger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AddressController.class)
@EnableConfigurationProperties
@Import({StandardizerConfig.class, ApiKeyVerifier.class, AddressParsingService.class,
        AddressStandardizationService.class, AddressClassifier.class, TagMapper.class,
        CityComponentRecovery.class, RuleBasedAddressTagger.class})
@TestPropertySource(properties = {
        "standardizer.security.api-key=test-key",
        "standardizer.max-input-length=100"
})
class AddressControllerTest {

    private static final String API_KEY_HEADER = "X-API-Key";

    @Autowired
    private MockMvc mvc;

    @Test
    @DisplayName("Should reject parse requests without an API key")
    void shouldRejectMissingApiKey() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"1 Main St\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Missing API key. Provide an X-API-Key header."));
    }

    @Test
    @DisplayName("Should reject parse requests with a wrong API key")
    void shouldRejectInvalidApiKey() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header(API_KEY_HEADER, "wrong-key")
                        .content("{\"address\":\"1 Main St\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Invalid API key."));
    }

    @Test
    @DisplayName("Should parse a street address")
    void shouldParseStreetAddress() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header(API_KEY_HEADER, "test-key")
                        .content("{\"address\":\"1600 Pennsylvania Avenue NW, Washington, DC 20500\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.input").value("1600 Pennsylvania Avenue NW, Washington, DC 20500"))
                .andExpect(jsonPath("$.type").value("Street Address"))
                .andExpect(jsonPath("$.components.address_number").value("1600"))
                .andExpect(jsonPath("$.components.city").value("Washington"))
                .andExpect(jsonPath("$.warning").doesNotExist());
    }

    @Test
    @DisplayName("Should parse an intersection with second street keys")
    void shouldParseIntersection() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header(API_KEY_HEADER, "test-key")
                        .content("{\"address\":\"Hollywood Blvd and Vine St\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("Intersection"))
                .andExpect(jsonPath("$.components.street_name").value("Hollywood"))
                .andExpect(jsonPath("$.components.second_street_name").value("Vine"));
    }

    @Test
    @DisplayName("Should report an ambiguous parse with a warning")
    void shouldParseAmbiguousAddress() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header(API_KEY_HEADER, "test-key")
                        .content("{\"address\":\"1804 & 1810 Main St\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("Ambiguous"))
                .andExpect(jsonPath("$.warning").isNotEmpty())
                .andExpect(jsonPath("$.components.address_number").value("1804-1810"));
    }

    @Test
    @DisplayName("Should reject blank and over-length parse input")
    void shouldRejectBadParseInput() throws Exception {
        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header(API_KEY_HEADER, "test-key")
                        .content("{\"address\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("address is required"));

        mvc.perform(post("/api/parse").contentType(MediaType.APPLICATION_JSON)
                        .header(API_KEY_HEADER, "test-key")
                        .content("{\"address\":\"" + "1".repeat(101) + "\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should standardize components without an API key")
    void shouldStandardizeComponents() throws Exception {
        mvc.perform(post("/api/standardize").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"components": {"address_number": "350", "street_name": "Fifth",
                                 "street_post_type": "Ave", "occupancy_type": "Suite",
                                 "occupancy_identifier": "3300", "city": "New York",
                                 "state": "NY", "zip_code": "10118"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address_line_1").value("350 FIFTH AVE"))
                .andExpect(jsonPath("$.address_line_2").value("STE 3300"))
                .andExpect(jsonPath("$.city").value("NEW YORK"))
                .andExpect(jsonPath("$.state").value("NY"))
                .andExpect(jsonPath("$.zip_code").value("10118"))
                .andExpect(jsonPath("$.standardized").value("350 FIFTH AVE  STE 3300  NEW YORK, NY 10118"))
                .andExpect(jsonPath("$.components.occupancy_type").value("STE"));
    }

    @Test
    @DisplayName("Should standardize a raw address")
    void shouldStandardizeAddress() throws Exception {
        mvc.perform(post("/api/standardize").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"1600 Pennsylvania Avenue NW, Washington, DC 20500\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.standardized").value("1600 PENNSYLVANIA AVE NW  WASHINGTON, DC 20500"));
    }

    @Test
    @DisplayName("Should prefer components over the raw address")
    void shouldPreferComponents() throws Exception {
        mvc.perform(post("/api/standardize").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\"1 Elm St\",\"components\":{\"occupancy_identifier\":\"3300\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address_line_1").value(""))
                .andExpect(jsonPath("$.address_line_2").value("# 3300"));
    }

    @Test
    @DisplayName("Should standardize an intersection from second street components")
    void shouldStandardizeIntersectionComponents() throws Exception {
        mvc.perform(post("/api/standardize").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"components\":{\"street_name\":\"Hollywood\",\"street_post_type\":\"Blvd\","
                                + "\"second_street_name\":\"Vine\",\"second_street_post_type\":\"St\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address_line_1").value("HOLLYWOOD BLVD & VINE ST"))
                .andExpect(jsonPath("$.components.second_street_post_type").value("ST"));
    }

    @Test
    @DisplayName("Should reject standardize requests with no input")
    void shouldRejectMissingStandardizeInput() throws Exception {
        mvc.perform(post("/api/standardize").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":\" \",\"components\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(AddressController.MISSING_INPUT_MESSAGE));
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
        mvc.perform(post("/api/standardize").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }
}
