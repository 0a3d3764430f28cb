package com.neorpc.rpc;

import lombok.Getter;

/**
 * Node answered with an HTTP status other than 200.
 */
@Getter
public class RpcStatusException extends RpcException {

    private final int statusCode;

    public RpcStatusException(int statusCode) {
        super(String.format("non-200 status code returned from NEO node, got: '%d'", statusCode));
        this.statusCode = statusCode;
    }
}
