package io.autotel.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Healthy/unhealthy flag per subscriber identity.
 *
 * <p>Unknown identities report healthy. Owned by one {@link io.autotel.EventQueue}; updated
 * after every delivery outcome and by explicit manual overrides, which persist until the next
 * delivery attempt for that subscriber.
 *
 * <p>This class is thread-safe.
 */
public final class SubscriberHealthRegistry {
    private final Map<String, Boolean> health = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> order = new CopyOnWriteArrayList<>();

    /**
     * Registers an identity as healthy. Re-registering an identity resets it to healthy.
     *
     * @param identity the subscriber identity
     */
    public void register(String identity) {
        Objects.requireNonNull(identity, "identity");
        order.addIfAbsent(identity);
        health.put(identity, Boolean.TRUE);
    }

    public void markHealthy(String identity) {
        set(identity, true);
    }

    public void markUnhealthy(String identity) {
        set(identity, false);
    }

    public void set(String identity, boolean healthy) {
        Objects.requireNonNull(identity, "identity");
        order.addIfAbsent(identity);
        health.put(identity, healthy);
    }

    public boolean isHealthy(String identity) {
        return identity == null || health.getOrDefault(identity, Boolean.TRUE);
    }

    /**
     * Returns a point-in-time copy of all flags, in registration order.
     *
     * @return unmodifiable identity-to-health map
     */
    public Map<String, Boolean> snapshot() {
        Map<String, Boolean> copy = new LinkedHashMap<>();
        for (String identity : order) {
            copy.put(identity, health.getOrDefault(identity, Boolean.TRUE));
        }
        return Collections.unmodifiableMap(copy);
    }
}
