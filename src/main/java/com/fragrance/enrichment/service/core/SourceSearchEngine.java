package com.fragrance.enrichment.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragrance.enrichment.config.SourceCfg;
import com.fragrance.enrichment.model.FetchOutcome;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * <h2>Shared plumbing for source adapters</h2>
 *
 * <p>Subclasses implement {@link #lookup(Query)} in terms of the protected
 * HTTP helpers. This class wraps every lookup with the response cache, the
 * per-source rate limiter and a Resilience4j {@link Retry}, and folds every
 * failure into an {@link com.fragrance.enrichment.model.FetchStatus#UNAVAILABLE}
 * outcome so callers never see an exception.</p>
 *
 * <p>HTTP status handling:</p>
 * <ul>
 *   <li>404: the source has no such entry, the helper returns empty</li>
 *   <li>429 and 5xx: {@link TransientSourceException}, retried with backoff</li>
 *   <li>other 4xx: {@link SourceResponseException}, not retried</li>
 *   <li>connect failures and timeouts: {@link TransientSourceException}</li>
 * </ul>
 */
@Slf4j
@Getter
public abstract class SourceSearchEngine implements SourceAdapter {

    private final SourceCfg cfg;

    private final WebClient webClient;

    private final ObjectMapper mapper;

    private final RateLimiter rateLimiter;

    private final ResponseCache cache;

    private final Retry retry;

    private final Duration cacheTtl;

    protected SourceSearchEngine(final SourceCfg cfg,
                                 final WebClient.Builder builder,
                                 final ObjectMapper mapper,
                                 final RateLimiter rateLimiter,
                                 final ResponseCache cache,
                                 final Retry retry,
                                 final Duration cacheTtl) {
        this.cfg = cfg;
        this.webClient = builder.clone()
                .defaultHeaders(h -> {
                    h.set(HttpHeaders.USER_AGENT, cfg.getUserAgent());
                    h.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");
                })
                .build();
        this.mapper = mapper;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.retry = retry;
        this.cacheTtl = cacheTtl;
    }

    /**
     * Source-specific lookup.
     *
     * @return the record, or empty when the source has no entry for the query
     * @throws SourceException when the source cannot be used right now
     */
    protected abstract Optional<PartialRecord> lookup(Query query);

    @Override
    public final FetchOutcome fetch(final Query query) {
        Optional<ResponseCache.CacheEntry> hit = cache.get(query, source());
        if (hit.isPresent()) {
            return hit.get().toOutcome(source());
        }

        FetchOutcome outcome = Decorators.ofSupplier(() -> toOutcome(lookup(query)))
                .withRetry(retry)
                .withFallback(List.of(Exception.class), ex -> unavailable(query, ex))
                .decorate()
                .get();

        switch (outcome.getStatus()) {
            case FOUND -> cache.put(query, source(), outcome.getRecord(), cacheTtl);
            case NOT_FOUND -> cache.put(query, source(), null, cacheTtl);
            default -> {
                // unavailable outcomes are never cached
            }
        }
        return outcome;
    }

    private FetchOutcome toOutcome(final Optional<PartialRecord> record) {
        return record
                .filter(r -> !r.isEmpty())
                .map(FetchOutcome::found)
                .orElseGet(() -> FetchOutcome.notFound(source()));
    }

    private FetchOutcome unavailable(final Query query, final Throwable ex) {
        log.warn("{} unavailable for '{}': {}", source().label(), query.getDisplayName(), ex.toString());
        return FetchOutcome.unavailable(source(), ex.getMessage());
    }

    /**
     * GET returning the body as text.
     *
     * @return the body, or empty on 404
     */
    protected Optional<String> getText(final URI uri) {
        return exchange(uri, webClient.get()
                .uri(uri)
                .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_JSON, MediaType.ALL));
    }

    /**
     * GET returning the body parsed as JSON.
     *
     * @return the tree, or empty on 404
     */
    protected Optional<JsonNode> getJson(final URI uri) {
        return getText(uri).map(body -> toJson(uri, body));
    }

    /**
     * Form-encoded POST returning the body as text. Sends the configured
     * referer and its origin, which some HTML sources check.
     */
    protected Optional<String> postForm(final URI uri, final MultiValueMap<String, String> form) {
        WebClient.RequestHeadersSpec<?> spec = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.TEXT_HTML, MediaType.ALL)
                .headers(h -> {
                    if (StringUtils.isNotBlank(cfg.getReferer())) {
                        h.set(HttpHeaders.REFERER, cfg.getReferer());
                        h.set(HttpHeaders.ORIGIN, cfg.getBaseUrl());
                    }
                })
                .body(BodyInserters.fromFormData(form));
        return exchange(uri, spec);
    }

    private Optional<String> exchange(final URI uri, final WebClient.RequestHeadersSpec<?> spec) {
        rateLimiter.acquire(source());
        try {
            Optional<String> body = spec
                    .exchangeToMono(resp -> readBody(uri, resp))
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .timeout(cfg.getTimeout())
                    .onErrorMap(TimeoutException.class,
                            e -> new TransientSourceException(source(), "Timed out after " + cfg.getTimeout(), e))
                    .onErrorMap(WebClientRequestException.class,
                            e -> new TransientSourceException(source(), "Request failed: " + e.getMessage(), e))
                    .onErrorMap(IOException.class,
                            e -> new TransientSourceException(source(), "I/O failure: " + e.getMessage(), e))
                    .block();
            rateLimiter.reportSuccess(source());
            return body == null ? Optional.empty() : body;
        } catch (TransientSourceException ex) {
            rateLimiter.reportFailure(source());
            throw ex;
        }
    }

    private Mono<String> readBody(final URI uri, final ClientResponse resp) {
        HttpStatusCode status = resp.statusCode();
        if (status.is2xxSuccessful()) {
            return resp.bodyToMono(String.class);
        }
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            log.debug("{} has no entry at {}", source().label(), uri.getPath());
            return resp.releaseBody().then(Mono.empty());
        }
        String message = "HTTP " + status.value() + " from " + uri.getPath();
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value() || status.is5xxServerError()) {
            return resp.releaseBody().then(Mono.error(new TransientSourceException(source(), message)));
        }
        return resp.releaseBody().then(Mono.error(new SourceResponseException(source(), message)));
    }

    private JsonNode toJson(final URI uri, final String body) {
        try {
            return mapper.readTree(body);
        } catch (IOException ex) {
            throw new SourceResponseException(source(), "Malformed JSON from " + uri.getPath(), ex);
        }
    }

    /**
     * Builds {@code base + path [+ encoded segments]}.
     */
    protected URI buildUri(@NonNull final String base,
                           @Nullable final String path,
                           final String... segments) {

        UriComponentsBuilder b = UriComponentsBuilder.fromUriString(base);

        if (StringUtils.isNotBlank(path)) {
            b.path(path.startsWith("/") ? path : "/" + path);
        }
        b.pathSegment(segments);
        return b.encode().build().toUri();
    }

    /**
     * Resolves a possibly relative link against the source's base URL.
     */
    protected URI resolve(final String href) {
        return URI.create(StringUtils.appendIfMissing(cfg.getBaseUrl(), "/")).resolve(href);
    }
}
