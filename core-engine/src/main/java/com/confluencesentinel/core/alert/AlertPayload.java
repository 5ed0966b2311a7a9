package com.confluencesentinel.core.alert;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Formatted alert handed to an {@link AlertSink}.
 *
 * <p>
 * Carries a human-readable message for chat-style sinks and a structured
 * attribute map for machine consumers. Serialized to JSON by the Kafka sink.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code type}, {@code scopeKey} and
 * {@code timestamp} are required; omitting one throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertPayload implements Serializable {

    private static final long serialVersionUID = 1L;

    private AlertType type;

    /** Instrument or category the confluence was detected on. */
    private String scopeKey;

    /** Time of the triggering event. */
    private Instant timestamp;

    private String title;

    private String message;

    private Map<String, Object> attributes;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public AlertPayload() {
    }

    private AlertPayload(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.scopeKey = Objects.requireNonNull(builder.scopeKey, "scopeKey must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.title = builder.title;
        this.message = builder.message;
        this.attributes = new LinkedHashMap<>(builder.attributes);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AlertType type;
        private String scopeKey;
        private Instant timestamp;
        private String title;
        private String message;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder scopeKey(String scopeKey) {
            this.scopeKey = scopeKey;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder attribute(String name, Object value) {
            this.attributes.put(name, value);
            return this;
        }

        /**
         * @throws NullPointerException if type, scope key or timestamp is missing
         */
        public AlertPayload build() {
            return new AlertPayload(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public AlertType getType() {
        return type;
    }

    public void setType(AlertType type) {
        this.type = type;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public void setScopeKey(String scopeKey) {
        this.scopeKey = scopeKey;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * @return unmodifiable view of the structured attributes
     */
    public Map<String, Object> getAttributes() {
        return attributes != null ? Collections.unmodifiableMap(attributes) : Map.of();
    }

    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertPayload that))
            return false;
        return type == that.type
                && Objects.equals(scopeKey, that.scopeKey)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, scopeKey, timestamp, message);
    }

    @Override
    public String toString() {
        return "AlertPayload{" +
                "type=" + type +
                ", scopeKey='" + scopeKey + '\'' +
                ", timestamp=" + timestamp +
                ", title='" + title + '\'' +
                '}';
    }
}
