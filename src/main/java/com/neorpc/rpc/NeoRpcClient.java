package com.neorpc.rpc;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * NEO JSON-RPC transport abstraction. Swapped for a stub in tests.
 */
public interface NeoRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param nodeUri node RPC URI, e.g. "http://seed1.neo.org:10332"
     * @param method  e.g. "getblockcount"
     * @param params  positional params; null or empty for none
     * @return response body as string (JSON); errors with {@link RpcException} on transport or HTTP failure
     */
    Mono<String> call(String nodeUri, String method, List<?> params);
}
