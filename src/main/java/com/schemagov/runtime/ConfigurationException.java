package com.schemagov.runtime;

/**
 * Raised when governance configuration cannot be read or references a policy that does not exist.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
