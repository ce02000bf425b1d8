package io.autotel;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one tracked business occurrence, as handed to {@link EventQueue#enqueue}.
 *
 * <p>Attribute values are scalars ({@link String}, {@link Number}, {@link Boolean}). Entries
 * with a {@code null} value are omitted so callers can pass optional fields without filtering
 * them first. Each record gets a ULID-based {@code eventId} unless one is supplied.
 *
 * <p>The pipeline never creates trace context: a correlation id, when one exists, is attached
 * by the caller before enqueue and forwarded to subscribers as the {@value #CORRELATION_ID}
 * attribute.
 *
 * @see EventQueue
 */
public final class EventRecord {
    public static final String CORRELATION_ID = "correlation_id";

    private final String eventId;
    private final String name;
    private final Map<String, Object> attributes;
    private final Instant timestamp;
    private final String correlationId;

    private EventRecord(Builder builder) {
        this.eventId = builder.eventId == null ? UlidCreator.getMonotonicUlid().toString() : builder.eventId;
        this.name = Objects.requireNonNull(builder.name, "name");
        if (this.name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.correlationId = builder.correlationId;

        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : builder.attributes.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IllegalArgumentException("attribute '" + entry.getKey()
                        + "' must be a String, Number or Boolean, got: " + value.getClass().getName());
            }
            copy.put(entry.getKey(), value);
        }
        this.attributes = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Creates a record with the given attributes, timestamped now.
     *
     * @param name       the event name, e.g. {@code "order.created"}
     * @param attributes scalar attributes; {@code null} values are dropped
     * @return a new record
     */
    public static EventRecord of(String name, Map<String, ?> attributes) {
        return builder(name).attributes(attributes).build();
    }

    public static EventRecord of(String name) {
        return builder(name).build();
    }

    public String eventId() {
        return eventId;
    }

    public String name() {
        return name;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Returns the correlation id supplied by the producer, or {@code null}.
     *
     * @return the correlation id, or {@code null}
     */
    public String correlationId() {
        return correlationId;
    }

    /**
     * Returns the attributes forwarded to subscribers: {@link #attributes()} plus
     * {@value #CORRELATION_ID} when a correlation id is present.
     *
     * @return unmodifiable attribute map
     */
    public Map<String, Object> deliveryAttributes() {
        if (correlationId == null) {
            return attributes;
        }
        Map<String, Object> enriched = new LinkedHashMap<>(attributes);
        enriched.put(CORRELATION_ID, correlationId);
        return Collections.unmodifiableMap(enriched);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EventRecord{eventId=").append(eventId)
                .append(", name=").append(name)
                .append(", timestamp=").append(timestamp);
        if (correlationId != null) {
            sb.append(", correlationId=").append(correlationId);
        }
        return sb.append(", attributes=").append(attributes.size()).append('}').toString();
    }

    /** Builder for {@link EventRecord}. */
    public static final class Builder {
        private final String name;
        private String eventId;
        private Instant timestamp;
        private String correlationId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder attribute(String key, Object value) {
            Objects.requireNonNull(key, "attribute key");
            attributes.put(key, value);
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            if (attributes == null) {
                return this;
            }
            for (Map.Entry<String, ?> entry : attributes.entrySet()) {
                attribute(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public EventRecord build() {
            return new EventRecord(this);
        }
    }
}
