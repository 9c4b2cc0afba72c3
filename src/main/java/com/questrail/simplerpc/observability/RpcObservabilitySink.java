package com.questrail.simplerpc.observability;

/**
 * Main interface for receiving RPC observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the transport event loop or the registry sweep thread
 * and must not block.</p>
 */
public interface RpcObservabilitySink {
    /**
     * Called for dispatch outcomes that produce no response.
     * @param event the dispatch event
     */
    void onDispatchEvent(RpcDispatchEvent event);

    /**
     * Called when the connection opens or closes, or a send is dropped.
     * @param event the transport event
     */
    void onTransportEvent(RpcTransportEvent event);

    /**
     * Called when a non-fatal failure occurs.
     * @param event the error event
     */
    void onError(RpcErrorEvent event);
}
