package dev.mcpr.jsonrpc;

/**
 * One decoded JSON-RPC document: a {@link JsonRpcRequest}, {@link JsonRpcNotification},
 * {@link JsonRpcResponse} or {@link JsonRpcError}.
 */
public interface JsonRpcMessage {

    /**
     * @return the correlation id, {@code null} for notifications and unattributable errors
     */
    RequestId id();
}
