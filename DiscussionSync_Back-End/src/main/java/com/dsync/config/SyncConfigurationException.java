package com.dsync.config;

/**
 * Invalid or unusable configuration detected at startup. The application does not start.
 */
public class SyncConfigurationException extends RuntimeException {

    public SyncConfigurationException(String message) {
        super(message);
    }

    public SyncConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
