package com.asrayaos.firstflame.config;

/**
 * Raised when the seeder cannot be configured, most commonly because the store
 * credentials are missing from the environment. No seeding run is attempted.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
