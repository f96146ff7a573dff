package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Canned HTTP exchange for provider clients: every request gets the same status and JSON body
 * and is recorded for assertions.
 */
class StubExchange {

    private final HttpStatus status;
    private final String body;
    final List<ClientRequest> requests = new ArrayList<>();

    StubExchange(HttpStatus status, String body) {
        this.status = status;
        this.body = body;
    }

    static StubExchange ok(String body) {
        return new StubExchange(HttpStatus.OK, body);
    }

    WebClient.Builder builder() {
        return WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
    }

    ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    static GlobalRetryConfig noRetry() {
        GlobalRetryConfig config = new GlobalRetryConfig();
        config.setMaxAttempts(0);
        return config;
    }
}
