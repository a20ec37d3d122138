package io.github.drompincen.lumenta.runtime.store;

@FunctionalInterface
public interface StoreListener {
    void onEvent(StoreEvent event);
}
