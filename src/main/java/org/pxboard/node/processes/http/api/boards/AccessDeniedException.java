package org.pxboard.node.processes.http.api.boards;

/**
 * Thrown by route handlers when the caller may not perform the request. Answered with 401
 * for anonymous callers and 403 otherwise.
 */
public class AccessDeniedException extends RuntimeException {

    private final boolean authenticated;

    public AccessDeniedException(final String message, final boolean authenticated) {
        super(message);
        this.authenticated = authenticated;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }
}
