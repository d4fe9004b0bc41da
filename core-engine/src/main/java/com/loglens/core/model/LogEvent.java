package com.loglens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single structured log entry flowing through the pipeline.
 *
 * <p>
 * Events are produced by the ingestion layer and are read-only to the
 * engine. Metadata holds free-form structured data (scalars, nested maps or
 * lists) and is exposed as an unmodifiable view.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. Jackson uses the annotated creator when events
 * arrive as JSON. Both paths validate that {@code timestamp}, {@code level},
 * {@code source} and {@code message} are present and non-blank.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LogEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final LogLevel level;
    private final String source;
    private final String message;

    /** Copy of the structured payload. */
    private final Map<String, Object> metadata;

    @JsonCreator
    public LogEvent(@JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("level") LogLevel level,
            @JsonProperty("source") String source,
            @JsonProperty("message") String message,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        this.timestamp = timestamp;
        this.level = level;
        this.source = source;
        this.message = message;
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public LogLevel getLevel() {
        return level;
    }

    public String getSource() {
        return source;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return unmodifiable view of the metadata map
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Retrieve a top-level metadata value.
     *
     * @param key metadata key
     * @return optional containing the value, or empty if absent or null
     */
    public Optional<Object> getMetadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link LogEvent}. Level defaults to {@link LogLevel#INFO}.
     */
    public static class Builder {
        private Instant timestamp;
        private LogLevel level = LogLevel.INFO;
        private String source;
        private String message;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder level(String level) {
            this.level = LogLevel.fromName(level);
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "Metadata key must not be null"), value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        /**
         * @return a new validated {@link LogEvent}
         * @throws IllegalArgumentException if a required field is missing
         */
        public LogEvent build() {
            return new LogEvent(timestamp, level, source, message, metadata);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LogEvent that))
            return false;
        return timestamp.equals(that.timestamp)
                && level == that.level
                && source.equals(that.source)
                && message.equals(that.message)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, level, source, message, metadata);
    }

    @Override
    public String toString() {
        return "[" + timestamp + "] " + level + " " + source + ": " + message;
    }
}
