package com.ethindexer.ingestion.adapter;

/**
 * Thrown when an RPC call fails (HTTP, timeout, JSON-RPC error or unparseable payload).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
