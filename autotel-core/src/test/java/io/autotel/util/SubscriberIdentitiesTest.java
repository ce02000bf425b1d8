package io.autotel.util;

import io.autotel.StubSubscriber;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SubscriberIdentitiesTest {

    @Test
    void normalizeTrimsAndLowerCases() {
        assertEquals("posthog", SubscriberIdentities.normalize("  PostHog "));
        assertNull(SubscriberIdentities.normalize(null));
        assertNull(SubscriberIdentities.normalize("   "));
    }

    @Test
    void unnamedSubscribersGetPositionalIdentity() {
        List<String> identities = SubscriberIdentities.assign(List.of(
                new StubSubscriber("Slack"), new StubSubscriber(null), new StubSubscriber("")));

        assertEquals(List.of("slack", "subscriber-1", "subscriber-2"), identities);
    }

    @Test
    void duplicateNamesAreSuffixedWithIndex() {
        List<String> identities = SubscriberIdentities.assign(List.of(
                new StubSubscriber("webhook"), new StubSubscriber("Webhook"), new StubSubscriber("WEBHOOK")));

        assertEquals(List.of("webhook", "webhook-1", "webhook-2"), identities);
    }
}
