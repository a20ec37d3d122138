package io.github.drompincen.lumenta.runtime.store;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link ResourceStore#subscribe}. Once {@link #unsubscribe()} returns,
 * the listener is not invoked again.
 *
 * <p>Delivery and deactivation share this handle's monitor, so an unsubscribe from another thread
 * waits for a delivery already in progress to this listener. A listener may unsubscribe itself
 * from inside its callback.
 */
public final class Subscription {

    private final long id;
    private final StoreListener listener;
    private final ResourceStore store;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(long id, StoreListener listener, ResourceStore store) {
        this.id = id;
        this.listener = listener;
        this.store = store;
    }

    public long id() {
        return id;
    }

    public boolean isActive() {
        return active.get();
    }

    public void unsubscribe() {
        store.unsubscribe(id);
    }

    synchronized void deliver(StoreEvent event) {
        if (active.get()) {
            listener.onEvent(event);
        }
    }

    synchronized boolean deactivate() {
        return active.compareAndSet(true, false);
    }
}
