package com.questrail.courier.observability;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Thread-safe sink that records every event for assertions.
 */
public class RecordingObservabilitySink implements MessagingObservabilitySink {
    public final List<ConnectionEvent> connectionEvents = new CopyOnWriteArrayList<>();
    public final List<MessagingErrorEvent> errors = new CopyOnWriteArrayList<>();
    public final List<String> diagnostics = new CopyOnWriteArrayList<>();

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        connectionEvents.add(event);
    }

    @Override
    public void onError(MessagingErrorEvent event) {
        errors.add(event);
    }

    @Override
    public void onDiagnostic(String message) {
        diagnostics.add(message);
    }

    public List<ConnectionEvent> eventsOfType(ConnectionEvent.Type type) {
        return connectionEvents.stream()
                .filter(e -> e.type() == type)
                .collect(Collectors.toList());
    }

    public void clear() {
        connectionEvents.clear();
        errors.clear();
        diagnostics.clear();
    }
}
