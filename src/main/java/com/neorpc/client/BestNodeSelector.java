package com.neorpc.client;

import com.neorpc.rpc.RpcException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Picks the node reporting the highest block count. Nodes are queried one after another in list order;
 * a node that fails is skipped. Ties keep the earlier node.
 */
@Slf4j
public class BestNodeSelector {

    static final String NO_NODES_MESSAGE = "Unable to communicate with any nodes";

    private final BlockHeightResolver blockHeightResolver;

    public BestNodeSelector(BlockHeightResolver blockHeightResolver) {
        this.blockHeightResolver = blockHeightResolver;
    }

    /**
     * @return the best node URI; the only URI when there is one, without querying it
     * @throws RpcException if no node reported a positive block count
     */
    public String select(List<String> nodeUris) {
        if (nodeUris.size() == 1) {
            return nodeUris.get(0);
        }
        String bestNode = null;
        long highestBlock = 0L;
        for (String nodeUri : nodeUris) {
            long blockCount;
            try {
                blockCount = blockHeightResolver.getBlockCount(nodeUri);
            } catch (RpcException e) {
                log.debug("Skipping node {}: {}", nodeUri, e.getMessage());
                continue;
            }
            if (blockCount > highestBlock) {
                highestBlock = blockCount;
                bestNode = nodeUri;
            }
        }
        if (bestNode == null) {
            throw new RpcException(NO_NODES_MESSAGE);
        }
        log.debug("Best node {} at block count {}", bestNode, highestBlock);
        return bestNode;
    }
}
