package com.fragrance.enrichment.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class JacksonEnrichmentConfig {

    /**
     * The application's single {@link ObjectMapper}.
     * <p>
     * Source adapters inject it by the <b>enrichmentObjectMapper</b> qualifier; being
     * {@link Primary} it also backs the MVC message converters, since Boot's own
     * mapper backs off when one is already defined. Source payloads are read as
     * {@code JsonNode} trees, and request bodies tolerate unknown properties.
     *
     * @return shared ObjectMapper
     */
    @Bean
    @Primary
    @Qualifier("enrichmentObjectMapper")
    public ObjectMapper enrichmentObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
