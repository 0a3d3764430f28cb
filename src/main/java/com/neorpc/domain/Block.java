package com.neorpc.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Verbose block as returned by {@code getblock <hash|index> 1}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class Block {

    private String hash;
    private int size;
    private int version;
    private String previousblockhash;
    private String merkleroot;
    /** Unix seconds. */
    private long time;
    private long index;
    private String nonce;
    private String nextconsensus;
    private Witness script;
    private List<Transaction> tx = new ArrayList<>();
    private long confirmations;
    /** Absent for the chain tip. */
    private String nextblockhash;
}
