package com.neorpc.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * Transaction output (UTXO). Returned on its own by {@code gettxout}.
 *
 * @param n       output index within the transaction
 * @param asset   asset id (hash), e.g. NEO or GAS
 * @param value   amount in asset units
 * @param address receiving address
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Vout(int n, String asset, BigDecimal value, String address) {
}
