package com.neorpc.rpc;

import lombok.Getter;

/**
 * Node returned a JSON-RPC error envelope with a non-empty message.
 */
@Getter
public class JsonRpcErrorException extends RpcException {

    private final long code;
    private final String errorMessage;

    public JsonRpcErrorException(long code, String errorMessage) {
        super(String.format("error code: %d, error message: %s", code, errorMessage));
        this.code = code;
        this.errorMessage = errorMessage;
    }
}
