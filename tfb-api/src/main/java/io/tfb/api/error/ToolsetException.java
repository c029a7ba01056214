package io.tfb.api.error;

/**
 * Base of every error the toolset surfaces to its caller.
 * I/O failures are carried as the cause.
 */
public class ToolsetException extends Exception {

    public ToolsetException(String message) {
        super(message);
    }

    public ToolsetException(String message, Throwable cause) {
        super(message, cause);
    }
}
