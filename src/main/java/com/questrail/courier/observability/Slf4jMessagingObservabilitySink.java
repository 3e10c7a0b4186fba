package com.questrail.courier.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MessagingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMessagingObservabilitySink implements MessagingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMessagingObservabilitySink.class);

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.type()) {
            case LISTENER_STARTED:
                log.info("Listening on {}", event.local());
                break;
            case LISTENER_STOPPED:
                log.info("Listener on {} stopped", event.local());
                break;
            case CONNECTION_OPENED:
                log.info("{} connection opened: {} -> {}", event.direction(), event.local(), event.remote());
                break;
            case CONNECTION_CLOSED:
                if (event.cause().isPresent()) {
                    Throwable cause = event.cause().get();
                    log.warn("{} connection {} closed: {}", event.direction(), event.remote(), cause.toString());
                }
                else {
                    log.info("{} connection {} closed", event.direction(), event.remote());
                }
                break;
            default:
                log.debug("Connection event: {}", event);
        }
    }

    @Override
    public void onError(MessagingErrorEvent event) {
        log.error("Messaging error: {}", event.message(), event.cause());
    }

    @Override
    public void onDiagnostic(String message) {
        log.debug(message);
    }
}
