package com.heronix.decora.client;

import java.util.ArrayList;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;

import reactor.core.publisher.Mono;

/**
 * Canned HTTP exchange for WebClient tests. Records every request it receives.
 */
class StubExchange implements ExchangeFunction {

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus status = HttpStatus.OK;
    private String body = "{}";

    StubExchange respond(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
        return this;
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        requests.add(request);
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    int requestCount() {
        return requests.size();
    }
}
