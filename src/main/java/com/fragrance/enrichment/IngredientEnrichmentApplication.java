package com.fragrance.enrichment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * The main entry point for the Ingredient Enrichment application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>read-only ingredient search across the external sources,</li>
 *   <li>single and bulk enrichment into the ingredient store,</li>
 *   <li>regulatory standards import and limit synchronisation.</li>
 * </ul>
 * It wires together the per-source HTTP adapters, their rate limiters and
 * response cache, the identity matcher, the merge engine and the JDBC store.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/ingredient-enrichment-0.1.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application will listen on the configured port (default
 * 8080) and serve requests under <code>/api/enrichment/</code> and
 * <code>/api/regulatory/</code>.</p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class IngredientEnrichmentApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(IngredientEnrichmentApplication.class, args);
    }
}
