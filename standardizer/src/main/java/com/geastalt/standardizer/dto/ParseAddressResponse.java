/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geastalt.standardizer.model.ParseResult;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseAddressResponse {

    private String input;
    private Map<String, String> components;
    private String type;
    private String warning;

    public static ParseAddressResponse from(ParseResult result) {
        return ParseAddressResponse.builder()
                .input(result.input())
                .components(result.components().toMap())
                .type(result.classification().typeName())
                .warning(result.classification().warning().orElse(null))
                .build();
    }
}
