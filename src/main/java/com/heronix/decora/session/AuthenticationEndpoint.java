package com.heronix.decora.session;

import com.heronix.decora.exception.AuthException;

/**
 * Credential exchange against the remote login endpoint.
 */
public interface AuthenticationEndpoint {

    /**
     * Exchange a username and password for a bearer token.
     *
     * @return the raw login response; accessToken and expiresIn may be null
     *         when the endpoint omits them
     * @throws AuthException on transport failure or a non-success response
     */
    LoginResponse login(String username, String password);

    /**
     * Fields of the login response body.
     */
    record LoginResponse(String accessToken, Long expiresIn) {

        @Override
        public String toString() {
            return "LoginResponse[expiresIn=" + expiresIn + "]";
        }
    }
}
