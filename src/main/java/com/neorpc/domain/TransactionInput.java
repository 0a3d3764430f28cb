package com.neorpc.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Reference to a previous output being spent: source txid and output index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransactionInput(String txid, int vout) {
}
