package com.heronix.decora.session;

/**
 * Lifecycle state of the bearer-token session.
 */
public enum SessionState {

    /**
     * No token cached (initial state, and after clear)
     */
    UNAUTHENTICATED,

    /**
     * A credential exchange is in flight
     */
    AUTHENTICATING,

    /**
     * A token is cached and has not expired
     */
    AUTHENTICATED,

    /**
     * A token is cached but its expiration has passed
     */
    EXPIRED
}
