package com.neorpc.rpc;

import java.util.List;

/**
 * JSON-RPC 2.0 request envelope as posted to a NEO node. Params are positional.
 */
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, int id) {

    public static final String VERSION = "2.0";
    public static final int DEFAULT_ID = 1;

    public static JsonRpcRequest of(String method, List<?> params) {
        return new JsonRpcRequest(VERSION, method, params != null ? params : List.of(), DEFAULT_ID);
    }
}
