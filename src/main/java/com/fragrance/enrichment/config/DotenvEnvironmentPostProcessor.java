package com.fragrance.enrichment.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.StandardEnvironment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a {@code .env} file so that {@code ${PUBCHEM_MIN_INTERVAL}},
 * {@code ${OWNER_ID}}, {@code ${DB_URL}} and friends resolve from it.
 * <p>
 * The file is read from the directory named by {@code dotenv.directory}
 * (or {@code DOTENV_DIRECTORY}), the working directory by default. Its
 * entries rank below real environment variables and system properties,
 * so a deployment can still override a checked-out file, and above
 * {@code application.yml}. Blank values are skipped and leave the
 * {@code application.yml} default in place.
 * </p>
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    /** Name of the property source holding the .env entries. */
    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    static final String DIRECTORY_PROPERTY = "dotenv.directory";

    private final Log log;

    public DotenvEnvironmentPostProcessor(final DeferredLogFactory logFactory) {
        this.log = logFactory.getLog(DotenvEnvironmentPostProcessor.class);
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        String directory = env.getProperty(DIRECTORY_PROPERTY, ".");
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .filename(".env")
                .ignoreIfMissing()
                .load();

        Map<String, Object> map = new LinkedHashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).stream()
                .filter(e -> StringUtils.isNotBlank(e.getValue()))
                .forEach(e -> map.put(e.getKey(), e.getValue().trim()));
        if (map.isEmpty()) {
            log.debug("No .env entries found in " + directory);
            return;
        }

        MapPropertySource source = new MapPropertySource(PROPERTY_SOURCE_NAME, map);
        MutablePropertySources sources = env.getPropertySources();
        String systemEnv = StandardEnvironment.SYSTEM_ENVIRONMENT_PROPERTY_SOURCE_NAME;
        if (sources.contains(systemEnv)) {
            sources.addAfter(systemEnv, source);
        } else {
            sources.addLast(source);
        }
        log.info("Loaded " + map.size() + " setting(s) from " + directory + "/.env");
    }
}
