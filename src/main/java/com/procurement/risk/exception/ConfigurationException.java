package com.procurement.risk.exception;

/**
 * Malformed weights, knowledge base or deny-list. Raised while the pipeline is
 * being constructed, before any record is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
