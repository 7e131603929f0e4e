package com.fragrance.enrichment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds source-specific configuration from <code>application.yml</code>
 * under the <code>sources</code> prefix. Each entry in the bound map
 * corresponds to a {@link SourceCfg} object keyed by the source identifier.
 * <p>
 * Example YAML:
 * <pre>{@code
 * sources:
 *   configs:
 *     pubchem:
 *       base-url: https://pubchem.ncbi.nlm.nih.gov
 *       min-interval: 250ms
 *       # ...
 *     goodscents:
 *       base-url: http://www.thegoodscentscompany.com
 *       # ...
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "sources")
@Getter
@Setter
public class SourceProperties {

    /**
     * Map of source identifiers to their corresponding {@link SourceCfg}
     * instances, preserving insertion order.
     */
    private final Map<String, SourceCfg> configs = new LinkedHashMap<>();

    /**
     * Retrieves the {@link SourceCfg} for the given source name.
     *
     * @param name the source identifier
     * @return the {@link SourceCfg} associated with {@code name}, or {@code null}
     * if no such source is configured
     */
    public SourceCfg forName(final String name) {
        return configs.get(name);
    }

}
