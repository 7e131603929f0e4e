package com.fragrance.enrichment.service.pubchem;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragrance.enrichment.config.EnrichmentProperties;
import com.fragrance.enrichment.config.SourceConfigFactory;
import com.fragrance.enrichment.model.PartialRecord;
import com.fragrance.enrichment.model.Query;
import com.fragrance.enrichment.model.SourceId;
import com.fragrance.enrichment.parser.PubChemJsonParser;
import com.fragrance.enrichment.service.core.RateLimiter;
import com.fragrance.enrichment.service.core.ResponseCache;
import com.fragrance.enrichment.service.core.SourceSearchEngine;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Chemical-properties adapter backed by PubChem PUG REST.
 *
 * <p>Two calls per lookup: the property table by name (or by CAS number when
 * the query carries a hint) and the synonym list by compound id, from which
 * the CAS number is taken.</p>
 */
@Slf4j
@Service("pubChemAdapter")
@ConditionalOnProperty(prefix = "sources.configs.pubchem", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class PubChemSourceAdapter extends SourceSearchEngine {

    static final String PROPERTY_LIST = "Title,MolecularFormula,MolecularWeight,IUPACName";

    private final PubChemJsonParser parser;

    public PubChemSourceAdapter(final PubChemJsonParser parser,
                                final SourceConfigFactory factory,
                                final WebClient.Builder builder,
                                @Qualifier("enrichmentObjectMapper") final ObjectMapper om,
                                final RateLimiter rateLimiter,
                                final ResponseCache cache,
                                final RetryRegistry retryRegistry,
                                final EnrichmentProperties props) {
        super(factory.forSource(SourceId.CHEMICAL.configKey()), builder, om, rateLimiter, cache,
                retryRegistry.retry(SourceId.CHEMICAL.configKey()), props.getCache().getTtl());
        this.parser = parser;
    }

    @Override
    public SourceId source() {
        return SourceId.CHEMICAL;
    }

    @Override
    protected Optional<PartialRecord> lookup(final Query query) {
        String term = query.casHintValue().orElse(query.getDisplayName());

        URI propertyUri = buildUri(getCfg().getBaseUrl(), getCfg().getSearchPath(),
                term, "property", PROPERTY_LIST, "JSON");
        Optional<PartialRecord> compound = getJson(propertyUri)
                .flatMap(json -> parser.parseProperties(json, query));
        if (compound.isEmpty()) {
            log.info("PubChem: no compound for '{}'", term);
            return Optional.empty();
        }

        PartialRecord record = compound.get();
        URI synonymUri = buildUri(getCfg().getBaseUrl(), getCfg().getDetailPath(),
                String.valueOf(record.getCompoundId()), "synonyms", "JSON");
        List<String> synonyms = getJson(synonymUri)
                .map(parser::parseSynonyms)
                .orElse(List.of());

        PartialRecord result = parser.withSynonyms(record, synonyms);
        log.info("PubChem: '{}' → CID {} (CAS {})", term, result.getCompoundId(), result.getCasNumber());
        return Optional.of(result);
    }
}
