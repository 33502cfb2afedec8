package org.calista.unglish.language;

/**
 * Malformed language data. Not recoverable at call time: the generation call (or the load) is aborted.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
