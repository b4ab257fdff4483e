package com.wscrape.ssh;

/**
 * Thrown when the remote command cannot be run over the current SSH session.
 * A capture cycle that hits this is abandoned; the next cycle still runs.
 */
public class RemoteCommandException extends Exception {
    public RemoteCommandException(String message) {
        super(message);
    }

    public RemoteCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
