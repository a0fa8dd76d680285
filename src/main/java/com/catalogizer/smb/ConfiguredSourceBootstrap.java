package com.catalogizer.smb;

import com.catalogizer.core.manager.ResilientSourceManager;
import com.catalogizer.core.source.DuplicateSourceException;
import com.catalogizer.core.source.Source;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registers the sources listed under {@code catalogizer.resilience.sources} and starts the
 * manager once the context is ready.
 */
@Component
public class ConfiguredSourceBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredSourceBootstrap.class);

    private final ResilientSourceManager manager;
    private final ResilienceProperties properties;

    public ConfiguredSourceBootstrap(ResilientSourceManager manager, ResilienceProperties properties) {
        this.manager = manager;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        int registered = 0;
        for (ResilienceProperties.SourceDefinition definition : properties.getSources()) {
            if (definition.getPath() == null || definition.getPath().isBlank()) {
                log.warn("Skipping configured source '{}' without a path", definition.getName());
                continue;
            }
            try {
                manager.addSource(toSource(definition));
                registered++;
            } catch (DuplicateSourceException e) {
                log.warn("Skipping configured source: {}", e.getMessage());
            }
        }
        manager.start();
        log.info("Registered {} configured sources", registered);
    }

    static Source toSource(ResilienceProperties.SourceDefinition definition) {
        Source source = new Source(definition.getId(), definition.getName(), definition.getPath());
        source.setCredentials(definition.getUsername(), definition.getPassword(), definition.getDomain());
        source.setMaxRetryAttempts(definition.getMaxRetryAttempts());
        source.setRetryDelay(definition.getRetryDelay());
        source.setConnectionTimeout(definition.getConnectionTimeout());
        source.setHealthCheckInterval(definition.getHealthCheckInterval());
        return source;
    }
}
