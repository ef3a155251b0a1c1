package com.example.collectfaster;

/**
 * Invalid or conflicting options, raised before any file is touched.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
