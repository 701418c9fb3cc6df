package com.specintel.core.config;

import java.nio.file.Path;

/**
 * Raised when a configuration document cannot be read, cannot be parsed, or does not
 * have the expected top-level shape.
 */
public class MalformedConfigException extends ConfigException {

    public MalformedConfigException(String message, Path source) {
        super(message, source, null);
    }

    public MalformedConfigException(String message, Path source, Throwable cause) {
        super(message, source, cause);
    }
}
