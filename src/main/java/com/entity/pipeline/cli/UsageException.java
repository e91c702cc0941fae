package com.entity.pipeline.cli;

/**
 * Invalid command line. The command prints the message and the usage text and exits with 2.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
