package org.adseller.server.exception;

/**
 * Thrown when pricing or audience configuration is malformed. Only raised while the application starts.
 */
@SuppressWarnings("serial")
public class ConfigurationException extends AdSellerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
