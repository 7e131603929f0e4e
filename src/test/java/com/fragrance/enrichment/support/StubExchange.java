package com.fragrance.enrichment.support;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canned HTTP responses for WebClient based tests. Routes on a path
 * fragment, answers 404 for anything unrouted and records every request.
 */
public final class StubExchange implements ExchangeFunction {

    private record Canned(HttpStatus status, String body, MediaType type) {
    }

    private final Map<String, Canned> routes = new LinkedHashMap<>();

    private final List<ClientRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public StubExchange json(final String pathFragment, final String body) {
        routes.put(pathFragment, new Canned(HttpStatus.OK, body, MediaType.APPLICATION_JSON));
        return this;
    }

    public StubExchange html(final String pathFragment, final String body) {
        routes.put(pathFragment, new Canned(HttpStatus.OK, body, MediaType.TEXT_HTML));
        return this;
    }

    public StubExchange status(final String pathFragment, final HttpStatus status) {
        routes.put(pathFragment, new Canned(status, "", MediaType.TEXT_PLAIN));
        return this;
    }

    @Override
    public Mono<ClientResponse> exchange(final ClientRequest request) {
        requests.add(request);
        String path = request.url().getPath();
        Canned canned = routes.entrySet().stream()
                .filter(e -> path.contains(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(new Canned(HttpStatus.NOT_FOUND, "", MediaType.TEXT_PLAIN));
        return Mono.just(ClientResponse.create(canned.status())
                .header(HttpHeaders.CONTENT_TYPE, canned.type().toString())
                .body(canned.body())
                .build());
    }

    public int calls() {
        return requests.size();
    }

    public List<ClientRequest> requests() {
        return List.copyOf(requests);
    }

    public ClientRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
