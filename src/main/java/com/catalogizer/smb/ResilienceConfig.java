package com.catalogizer.smb;

import com.catalogizer.core.connection.SourceConnector;
import com.catalogizer.core.manager.ResilientSourceManager;
import com.catalogizer.core.metrics.SourceMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * TCP reachability check, used unless the application supplies a protocol-aware connector.
     */
    @Bean
    @ConditionalOnMissingBean(SourceConnector.class)
    public SourceConnector sourceConnector() {
        return new SocketSourceConnector();
    }

    @Bean
    public SourceMetrics sourceMetrics(MeterRegistry meterRegistry) {
        return new SourceMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "stop")
    public ResilientSourceManager resilientSourceManager(SourceConnector connector,
                                                         ResilienceProperties properties,
                                                         SourceMetrics sourceMetrics,
                                                         Clock clock) {
        return new ResilientSourceManager(connector, properties.toOptions(), sourceMetrics, clock);
    }
}
