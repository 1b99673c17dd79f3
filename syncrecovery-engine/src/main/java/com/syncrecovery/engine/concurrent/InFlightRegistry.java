package com.syncrecovery.engine.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of in-flight asynchronous work keyed by id.
 * 
 * At most one computation runs per key. A caller arriving while one is in
 * flight gets the same future instead of starting a second run.
 */
public class InFlightRegistry<K, V> {

    private static final Logger log = LoggerFactory.getLogger(InFlightRegistry.class);

    private final String name;
    private final ConcurrentHashMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public InFlightRegistry(String name) {
        this.name = name;
    }

    /**
     * Start the task for a key unless one is already running.
     * 
     * @return The running future for the key
     */
    public CompletableFuture<V> runExclusive(K key, Supplier<CompletableFuture<V>> task) {
        CompletableFuture<V> placeholder = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, placeholder);
        if (existing != null) {
            log.debug("{}: {} already in flight, joining existing run", name, key);
            return existing;
        }

        // Key is released before waiters are woken so they can start a new run
        try {
            task.get().whenComplete((result, error) -> {
                inFlight.remove(key, placeholder);
                if (error != null) {
                    placeholder.completeExceptionally(error);
                } else {
                    placeholder.complete(result);
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(key, placeholder);
            placeholder.completeExceptionally(e);
        }
        return placeholder;
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }

    public Set<K> keys() {
        return Set.copyOf(inFlight.keySet());
    }

    /**
     * Cancel every in-flight run.
     */
    public void cancelAll() {
        inFlight.values().forEach(future -> future.cancel(false));
        inFlight.clear();
    }
}
