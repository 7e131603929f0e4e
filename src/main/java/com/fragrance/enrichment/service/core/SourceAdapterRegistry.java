package com.fragrance.enrichment.service.core;

import com.fragrance.enrichment.model.SourceId;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry that wires all source adapters.
 * Central registry – inject this where you need the adapter for a source.
 */
@Slf4j
public class SourceAdapterRegistry {

    private final Map<SourceId, SourceAdapter> bySource;

    public SourceAdapterRegistry(final List<SourceAdapter> adapters) {
        Map<SourceId, SourceAdapter> map = new EnumMap<>(SourceId.class);
        for (SourceAdapter adapter : adapters) {
            if (map.put(adapter.source(), adapter) != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.source());
            }
        }
        this.bySource = Collections.unmodifiableMap(map);
        log.info("Registered source adapters: {}", bySource.keySet());
    }

    public Optional<SourceAdapter> find(final SourceId source) {
        return Optional.ofNullable(bySource.get(source));
    }

    public Collection<SourceAdapter> all() {
        return bySource.values();
    }

    public Set<SourceId> supportedSources() {
        return bySource.keySet();
    }
}
