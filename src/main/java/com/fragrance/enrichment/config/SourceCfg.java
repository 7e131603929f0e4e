package com.fragrance.enrichment.config;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Holds configuration properties for one external data source.
 * <p>
 * Each instance encapsulates the endpoint URLs and pacing settings
 * required to look an ingredient up against the source's public pages
 * or REST API.
 * </p>
 */
@Getter
@Setter
public class SourceCfg {

    /**
     * The base URL to which all source-specific paths are relative.
     * <p>For example, "https://pubchem.ncbi.nlm.nih.gov".</p>
     */
    private String baseUrl;

    /**
     * The path (relative to {@link #baseUrl}) used to search by name.
     * <p>For example, "/rest/pug/compound/name".</p>
     */
    private String searchPath;

    /**
     * The path (relative to {@link #baseUrl}) used to fetch a detail record.
     * <p>For example, "/rest/pug/compound/cid".</p>
     */
    private String detailPath;

    /**
     * Referer sent with form posts, for sources that check it.
     */
    private String referer;

    /**
     * User agent sent with every request. PubChem asks for a contact address.
     */
    private String userAgent = "IngredientEnrichment/1.0";

    /**
     * Whether the adapter bean should be active
     */
    private boolean enabled = true;

    /**
     * Minimum time between two granted requests to this source
     */
    private Duration minInterval = Duration.ofSeconds(1);

    /**
     * Blocking timeout for one HTTP exchange
     */
    private Duration timeout = Duration.ofSeconds(30);
}
