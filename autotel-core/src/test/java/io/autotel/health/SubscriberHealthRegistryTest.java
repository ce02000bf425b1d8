package io.autotel.health;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriberHealthRegistryTest {

    @Test
    void registeredSubscribersStartHealthy() {
        SubscriberHealthRegistry registry = new SubscriberHealthRegistry();
        registry.register("console");

        assertTrue(registry.isHealthy("console"));
    }

    @Test
    void unknownIdentityIsHealthy() {
        SubscriberHealthRegistry registry = new SubscriberHealthRegistry();

        assertTrue(registry.isHealthy("missing"));
        assertTrue(registry.isHealthy(null));
    }

    @Test
    void markAndSetUpdateFlag() {
        SubscriberHealthRegistry registry = new SubscriberHealthRegistry();
        registry.register("console");

        registry.markUnhealthy("console");
        assertFalse(registry.isHealthy("console"));
        registry.markHealthy("console");
        assertTrue(registry.isHealthy("console"));
        registry.set("console", false);
        assertFalse(registry.isHealthy("console"));
    }

    @Test
    void snapshotKeepsRegistrationOrderAndIsDetached() {
        SubscriberHealthRegistry registry = new SubscriberHealthRegistry();
        registry.register("webhook");
        registry.register("console");
        registry.markUnhealthy("webhook");

        Map<String, Boolean> snapshot = registry.snapshot();
        registry.markHealthy("webhook");

        assertEquals(List.of("webhook", "console"), List.copyOf(snapshot.keySet()));
        assertFalse(snapshot.get("webhook"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("x", true));
    }

    @Test
    void nullIdentityRejected() {
        SubscriberHealthRegistry registry = new SubscriberHealthRegistry();

        assertThrows(NullPointerException.class, () -> registry.register(null));
        assertThrows(NullPointerException.class, () -> registry.set(null, true));
    }
}
