package com.neorpc.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * Balance of one asset in the node's open wallet ({@code getbalance}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WalletBalance(BigDecimal balance, BigDecimal confirmed) {
}
