package io.energytoken.core.events;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fan-out point for ledger events. Keeps every event in emission order and forwards it
 * to registered listeners. A failing listener is logged and skipped; the state change
 * it reports has already been committed.
 */
public final class EventLog {
    private static final Logger LOG = Logger.getLogger(EventLog.class.getName());

    private final List<LedgerEvent> events = new ArrayList<>();
    private final List<LedgerEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(LedgerEventListener listener) {
        listeners.add(listener);
    }

    public void emit(LedgerEvent event) {
        synchronized (this) {
            events.add(event);
        }
        for (LedgerEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Listener failed on " + event.type() + " event", e);
            }
        }
    }

    public synchronized List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    public synchronized int size() { return events.size(); }
}
