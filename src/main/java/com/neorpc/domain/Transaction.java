package com.neorpc.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Verbose transaction as returned by {@code getrawtransaction <txid> 1} and {@code sendtoaddress}.
 * Block fields (blockhash, confirmations, blocktime) are only set once the transaction is confirmed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class Transaction {

    @JsonProperty("txid")
    private String id;
    private int size;
    /** e.g. ContractTransaction, InvocationTransaction, MinerTransaction. */
    private String type;
    private int version;
    private List<TransactionAttribute> attributes = new ArrayList<>();
    private List<TransactionInput> vin = new ArrayList<>();
    private List<Vout> vout = new ArrayList<>();
    @JsonProperty("sys_fee")
    private BigDecimal systemFee;
    @JsonProperty("net_fee")
    private BigDecimal networkFee;
    private List<Witness> scripts = new ArrayList<>();
    /** Only present on MinerTransaction. */
    private Long nonce;
    private String blockhash;
    private Long confirmations;
    private Long blocktime;
}
