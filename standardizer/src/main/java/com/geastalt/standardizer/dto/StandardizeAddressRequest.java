/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.standardizer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Either a raw address or already parsed components. When both are given the components win.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StandardizeAddressRequest {
    private String address;
    private Map<String, String> components;
}
