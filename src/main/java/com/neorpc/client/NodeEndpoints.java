package com.neorpc.client;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Candidate node URIs plus the one currently used for calls. A single URI is selected up front.
 */
public class NodeEndpoints {

    static final String EMPTY_NODES_MESSAGE = "Length of 'nodeURIs' argument must be greater than 0";

    private final List<String> nodeUris;
    private final AtomicReference<String> selected = new AtomicReference<>();

    public NodeEndpoints(List<String> nodeUris) {
        if (nodeUris == null || nodeUris.isEmpty()) {
            throw new IllegalArgumentException(EMPTY_NODES_MESSAGE);
        }
        this.nodeUris = List.copyOf(nodeUris);
        if (this.nodeUris.size() == 1) {
            selected.set(this.nodeUris.get(0));
        }
    }

    public List<String> getNodeUris() {
        return nodeUris;
    }

    public Optional<String> getSelected() {
        return Optional.ofNullable(selected.get());
    }

    void select(String nodeUri) {
        if (!nodeUris.contains(nodeUri)) {
            throw new IllegalArgumentException("Unknown node: " + nodeUri);
        }
        selected.set(nodeUri);
    }
}
