package com.neorpc.rpc;

/**
 * Root of every NEO client failure. Thrown as-is for connection failures, empty or non-JSON bodies,
 * a missing required result, local limiter exhaustion and a client with no selected node.
 * Subclasses: {@link RpcStatusException} (non-200 reply) and {@link JsonRpcErrorException} (node error envelope).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    /**
     * @param cause underlying transport or Jackson failure
     */
    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
