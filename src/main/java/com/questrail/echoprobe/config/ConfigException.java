package com.questrail.echoprobe.config;

/**
 * Fatal startup configuration problem.
 *
 * <p>Raised before any listener binds; the process is expected to report the
 * message and exit.</p>
 */
public final class ConfigException extends RuntimeException
{
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
