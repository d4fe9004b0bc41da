package com.loglens.core.config;

/**
 * Raised when configuration, or a definition built from it, is invalid.
 *
 * <p>
 * Thrown while the pipeline is being assembled, never while events flow.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
