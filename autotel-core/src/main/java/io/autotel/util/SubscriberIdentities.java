package io.autotel.util;

import io.autotel.EventSubscriber;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives health and metric identities from subscriber names.
 */
public final class SubscriberIdentities {
    public static final String FALLBACK_PREFIX = "subscriber-";

    private SubscriberIdentities() {
    }

    /**
     * Normalizes a name: trimmed and lower-cased. Returns {@code null} for a null or blank name.
     *
     * @param name the declared name
     * @return the identity, or {@code null}
     */
    public static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Assigns one identity per subscriber, in list order. Unnamed subscribers get
     * {@code subscriber-<index>}; a name already taken gets {@code -<index>} appended.
     *
     * @param subscribers configured subscribers
     * @return identities, index-aligned with {@code subscribers}
     */
    public static List<String> assign(List<? extends EventSubscriber> subscribers) {
        List<String> identities = new ArrayList<>(subscribers.size());
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < subscribers.size(); i++) {
            String identity = normalize(subscribers.get(i).name());
            if (identity == null) {
                identity = FALLBACK_PREFIX + i;
            }
            if (!taken.add(identity)) {
                identity = identity + "-" + i;
                taken.add(identity);
            }
            identities.add(identity);
        }
        return identities;
    }
}
