package com.questrail.courier.observability;

/**
 * No-op implementation of MessagingObservabilitySink.
 */
public final class NullObservabilitySink implements MessagingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onError(MessagingErrorEvent event) {}
}
