package com.loglens.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Severity tag carried by every {@link LogEvent}.
 *
 * @since 1.0.0
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL,
    FATAL;

    /**
     * Resolve a level from its name, ignoring case.
     *
     * <p>
     * {@code WARN} is accepted as an alias of {@link #WARNING} because most
     * JVM logging frameworks emit the short form.
     * </p>
     *
     * @param name level name; must not be {@code null} or blank
     * @return the matching level
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static LogLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Log level must not be null or blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: '" + name
                    + "'. Supported: TRACE, DEBUG, INFO, WARNING, ERROR, CRITICAL, FATAL", e);
        }
    }

    /**
     * @return {@code true} for ERROR, CRITICAL and FATAL
     */
    public boolean isErrorOrAbove() {
        return compareTo(ERROR) >= 0;
    }
}
