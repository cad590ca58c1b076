package com.questrail.shepherd.session;

/**
 * A session could not be created or reconnected. Any process launched for it
 * has been killed and any partial socket file removed.
 */
public class SessionStartException extends Exception {
    public SessionStartException(String message) {
        super(message);
    }

    public SessionStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
