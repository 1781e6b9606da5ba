package com.slicereport.config;

/**
 * Raised for invalid static configuration such as an unsupported axis or a malformed page template.
 * Always surfaced before any file is read or written.
 */
public class ReportConfigurationException extends IllegalArgumentException {

    public ReportConfigurationException(String message) {
        super(message);
    }

    public ReportConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
