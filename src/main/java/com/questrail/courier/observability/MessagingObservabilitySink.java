package com.questrail.courier.observability;

/**
 * Main interface for receiving messaging observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface MessagingObservabilitySink {
    /**
     * Called when a listener starts or stops, or a connection opens or closes.
     * @param event the lifecycle event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called when an error occurs that the core reports instead of throwing.
     * @param event the error event
     */
    void onError(MessagingErrorEvent event);

    /**
     * Called for low-value diagnostics, such as a late reply being discarded.
     * @param message human-readable detail
     */
    default void onDiagnostic(String message) {}
}
