package org.dxworks.codegraph.engine;

/**
 * A command cannot run as asked, for example a per-function graph requested for a directory
 * or an export path that cannot be written. The only failure that aborts a whole command.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
