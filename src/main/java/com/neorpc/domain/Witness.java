package com.neorpc.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Invocation/verification script pair (hex) attached to blocks and transactions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Witness(String invocation, String verification) {
}
