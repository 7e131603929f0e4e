package com.fragrance.enrichment.service.goodscents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragrance.enrichment.config.EnrichmentProperties;
import com.fragrance.enrichment.config.SourceConfigFactory;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.parser.GoodScentsPageParser;
import com.fragrance.enrichment.service.core.RateLimiter;
import com.fragrance.enrichment.service.core.ResponseCache;
import com.fragrance.enrichment.service.core.SourceSearchEngine;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.Optional;

/**
 * Odor-profile adapter for The Good Scents Company.
 *
 * <p>Submits the site's search form, follows the first monograph link on the
 * result page and scrapes the monograph. Both requests go through the
 * source's rate limiter, TGSC is slow to forgive bursts.</p>
 */
@Slf4j
@Service("goodScentsAdapter")
@ConditionalOnProperty(prefix = "sources.configs.goodscents", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class GoodScentsSourceAdapter extends SourceSearchEngine {

    private final GoodScentsPageParser parser;

    public GoodScentsSourceAdapter(final GoodScentsPageParser parser,
                                   final SourceConfigFactory factory,
                                   final WebClient.Builder builder,
                                   @Qualifier("enrichmentObjectMapper") final ObjectMapper om,
                                   final RateLimiter rateLimiter,
                                   final ResponseCache cache,
                                   final RetryRegistry retryRegistry,
                                   final EnrichmentProperties props) {
        super(factory.forSource(SourceId.ODOR_PROFILE.configKey()), builder, om, rateLimiter, cache,
                retryRegistry.retry(SourceId.ODOR_PROFILE.configKey()), props.getCache().getTtl());
        this.parser = parser;
    }

    @Override
    public SourceId source() {
        return SourceId.ODOR_PROFILE;
    }

    @Override
    protected Optional<PartialRecord> lookup(final Query query) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("qName", query.getDisplayName());
        form.add("submit", "Search");

        URI searchUri = buildUri(getCfg().getBaseUrl(), getCfg().getSearchPath());
        Optional<String> link = postForm(searchUri, form).flatMap(parser::findDetailLink);
        if (link.isEmpty()) {
            log.info("TGSC: no monograph for '{}'", query.getDisplayName());
            return Optional.empty();
        }

        URI detailUri = resolve(link.get());
        Optional<PartialRecord> record = getText(detailUri).flatMap(html -> parser.parseDetail(html, query));
        record.ifPresent(r -> log.info("TGSC: '{}' → {} (CAS {})",
                query.getDisplayName(), detailUri.getPath(), r.getCasNumber()));
        return record;
    }
}
