package com.neorpc.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * NEO node client settings. A client bean is only created when {@code neo.client.nodes} is set.
 */
@ConfigurationProperties(prefix = "neo.client")
@NoArgsConstructor
@Getter
@Setter
public class NeoClientProperties {

    /** Node RPC URIs. With more than one, the node with the highest block count is selected at startup. */
    private List<String> nodes = new ArrayList<>();

    /** TCP connect timeout for RPC calls and ping. */
    private long connectTimeoutMs = 5_000;

    /** Max time to wait for a node's response. */
    private long readTimeoutMs = 30_000;

    /** Local RPC budget (requests per second) for this client. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a limiter permit before failing. */
    private long limiterTimeoutMs = 2_000;

    public void setNodes(List<String> nodes) {
        this.nodes = nodes != null ? nodes : new ArrayList<>();
    }
}
