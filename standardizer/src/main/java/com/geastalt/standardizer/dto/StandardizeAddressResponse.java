/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.geastalt.standardizer.model.StandardizedAddress;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class StandardizeAddressResponse {

    @JsonProperty("address_line_1")
    private String addressLine1;

    @JsonProperty("address_line_2")
    private String addressLine2;

    private String city;
    private String state;

    @JsonProperty("zip_code")
    private String zipCode;

    private String standardized;
    private Map<String, String> components;

    public static StandardizeAddressResponse from(StandardizedAddress address) {
        return StandardizeAddressResponse.builder()
                .addressLine1(address.getAddressLine1())
                .addressLine2(address.getAddressLine2())
                .city(address.getCity())
                .state(address.getState())
                .zipCode(address.getZipCode())
                .standardized(address.getStandardized())
                .components(address.componentMap())
                .build();
    }
}
