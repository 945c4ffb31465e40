package com.heronix.decora.client;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClient;

import com.heronix.decora.config.DecoraProperties;
import com.heronix.decora.exception.AuthException;
import com.heronix.decora.session.AuthenticationEndpoint;

class DecoraAuthClientTest {

    private StubExchange exchange;
    private DecoraAuthClient client;

    @BeforeEach
    void setUp() {
        DecoraProperties properties = new DecoraProperties();
        properties.getApi().setBaseUrl("https://decora.test/api/");

        exchange = new StubExchange();
        client = new DecoraAuthClient(WebClient.builder().exchangeFunction(exchange), properties);
    }

    @Test
    void postsCredentialsToLoginEndpoint() {
        exchange.respond(HttpStatus.OK, "{\"access_token\":\"abc123\",\"expires_in\":3600}");

        AuthenticationEndpoint.LoginResponse response = client.login("alice", "s3cret");

        assertEquals("abc123", response.accessToken());
        assertEquals(3600L, response.expiresIn());

        ClientRequest request = exchange.lastRequest();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("https://decora.test/api/user/login", request.url().toString());
        assertEquals("HeronixDecoraBridge/1.0", request.headers().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void missingExpiresInIsNull() {
        exchange.respond(HttpStatus.OK, "{\"access_token\":\"abc123\"}");

        assertNull(client.login("alice", "s3cret").expiresIn());
    }

    @Test
    void stringExpiresInIsParsed() {
        exchange.respond(HttpStatus.OK, "{\"access_token\":\"abc123\",\"expires_in\":\"1800\"}");

        assertEquals(1800L, client.login("alice", "s3cret").expiresIn());
    }

    @Test
    void rejectedLoginCarriesStatus() {
        exchange.respond(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid credentials\"}");

        AuthException e = assertThrows(AuthException.class, () -> client.login("alice", "wrong"));
        assertTrue(e.getMessage().contains("401"));
    }
}
