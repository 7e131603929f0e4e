package com.fragrance.enrichment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared HTTP client for the source adapters. Each adapter resolves absolute
 * URIs from its own {@link SourceCfg} and sets its own user agent; the
 * connection pool and socket timeouts are sized here from the enabled sources
 * and the bulk concurrency.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    static final String DEFAULT_USER_AGENT = "IngredientEnrichment/1.0";

    /** Largest page we are willing to buffer (some monograph pages are big). */
    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    /** Connections per source for one ingredient: a search plus a detail fetch. */
    private static final int CONNECTIONS_PER_LOOKUP = 2;

    @Bean
    public WebClient.Builder sourceWebClientBuilder(
            @Qualifier("enrichmentObjectMapper") final ObjectMapper mapper,
            final SourceProperties sources,
            final EnrichmentProperties props) {

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES);
                })
                .build();

        Collection<SourceCfg> enabled = enabledSources(sources);
        Duration responseTimeout = responseTimeout(enabled);
        int maxConnections = maxConnections(enabled.size(), props.getBulk().getConcurrency());
        log.info("Source HTTP client: {} source(s), {} connection(s), response timeout {}",
                enabled.size(), maxConnections, responseTimeout);

        ConnectionProvider pool = ConnectionProvider.builder("enrichment-sources")
                .maxConnections(maxConnections)
                .pendingAcquireTimeout(responseTimeout)
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.HTTP11)
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout(responseTimeout).toMillis())
                .responseTimeout(responseTimeout)
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    static List<SourceCfg> enabledSources(final SourceProperties sources) {
        return sources.getConfigs().values().stream()
                .filter(SourceCfg::isEnabled)
                .collect(Collectors.toList());
    }

    /** Slowest enabled source; adapters still apply their own tighter timeout per exchange. */
    static Duration responseTimeout(final Collection<SourceCfg> enabled) {
        return enabled.stream()
                .map(SourceCfg::getTimeout)
                .max(Duration::compareTo)
                .orElse(new SourceCfg().getTimeout());
    }

    static Duration connectTimeout(final Duration responseTimeout) {
        return responseTimeout.compareTo(MAX_CONNECT_TIMEOUT) < 0 ? responseTimeout : MAX_CONNECT_TIMEOUT;
    }

    /** Every bulk worker may be talking to every source at once. */
    static int maxConnections(final int enabledSources, final int bulkConcurrency) {
        return Math.max(1, enabledSources) * Math.max(1, bulkConcurrency) * CONNECTIONS_PER_LOOKUP;
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders());
            return Mono.just(res);
        });
    }
}
