package com.neorpc.client;

import com.neorpc.rpc.RpcException;

/**
 * Resolves the block count reported by one node. Used by {@link BestNodeSelector}.
 */
@FunctionalInterface
public interface BlockHeightResolver {

    /**
     * Block count of the node at the given URI.
     *
     * @throws RpcException if the node cannot be queried
     */
    long getBlockCount(String nodeUri);
}
