/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.controller;

import com.geastalt.standardizer.config.StandardizerConfig;
import com.geastalt.standardizer.dto.ParseAddressRequest;
import com.geastalt.standardizer.dto.ParseAddressResponse;
import com.geastalt.standardizer.dto.StandardizeAddressRequest;
import com.geastalt.standardizer.dto.StandardizeAddressResponse;
import com.geastalt.standardizer.model.ParsedComponents;
import com.geastalt.standardizer.model.ParseResult;
import com.geastalt.standardizer.model.StandardizedAddress;
import com.geastalt.standardizer.security.ApiKeyVerifier;
import com.geastalt.standardizer.service.AddressParsingService;
import com.geastalt.standardizer.service.AddressStandardizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST endpoints for parsing and standardizing addresses.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AddressController {

    static final String MISSING_INPUT_MESSAGE =
            "Provide 'address' (non-empty string) or 'components' (non-empty object).";

    private final AddressParsingService addressParsingService;
    private final AddressStandardizationService addressStandardizationService;
    private final ApiKeyVerifier apiKeyVerifier;
    private final StandardizerConfig config;

    @PostMapping("/parse")
    public ResponseEntity<?> parse(@RequestHeader HttpHeaders headers,
                                   @RequestBody ParseAddressRequest request) {
        String headerName = apiKeyVerifier.headerName();
        ResponseEntity<Map<String, String>> rejection = switch (apiKeyVerifier.verify(headers.getFirst(headerName))) {
            case ACCEPTED -> null;
            case MISSING -> error(HttpStatus.UNAUTHORIZED, "Missing API key. Provide an " + headerName + " header.");
            case INVALID -> error(HttpStatus.FORBIDDEN, "Invalid API key.");
            case NOT_CONFIGURED -> error(HttpStatus.INTERNAL_SERVER_ERROR, "API key authentication is not configured.");
        };
        if (rejection != null) {
            return rejection;
        }

        String address = request.getAddress() == null ? "" : request.getAddress().strip();
        if (address.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "address is required");
        }
        if (address.length() > config.getMaxInputLength()) {
            return tooLong();
        }

        ParseResult result = addressParsingService.parseAndClassify(address);
        return ResponseEntity.ok(ParseAddressResponse.from(result));
    }

    @PostMapping("/standardize")
    public ResponseEntity<?> standardize(@RequestBody StandardizeAddressRequest request) {
        ParsedComponents components;
        if (request.getComponents() != null && !request.getComponents().isEmpty()) {
            components = ParsedComponents.fromMap(request.getComponents());
        } else if (request.getAddress() != null && !request.getAddress().isBlank()) {
            String address = request.getAddress().strip();
            if (address.length() > config.getMaxInputLength()) {
                return tooLong();
            }
            components = addressParsingService.parseAndClassify(address).components();
        } else {
            return error(HttpStatus.BAD_REQUEST, MISSING_INPUT_MESSAGE);
        }

        StandardizedAddress standardized = addressStandardizationService.standardize(components);
        return ResponseEntity.ok(StandardizeAddressResponse.from(standardized));
    }

    private ResponseEntity<Map<String, String>> tooLong() {
        return error(HttpStatus.BAD_REQUEST,
                "address must be at most " + config.getMaxInputLength() + " characters");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        log.warn("Rejecting request with {}: {}", status.value(), message);
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
