package com.catalogizer.smb;

import com.catalogizer.core.manager.ManagerOptions;
import com.catalogizer.core.source.SourceDefaults;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the resilient source manager.
 *
 * <pre>
 * catalogizer:
 *   resilience:
 *     defaults:
 *       max-retry-attempts: 5
 *       retry-delay: 30s
 *     health-check:
 *       interval: 60s
 *     sources:
 *       - id: nas-media
 *         name: Media NAS
 *         path: smb://nas.local/media
 *         username: catalog
 *         password: ${NAS_PASSWORD:}
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "catalogizer.resilience")
public class ResilienceProperties {

    private Defaults defaults = new Defaults();
    private HealthCheck healthCheck = new HealthCheck();
    private Events events = new Events();
    private Cache cache = new Cache();
    private Duration shutdownTimeout = Duration.ofSeconds(60);
    private List<SourceDefinition> sources = new ArrayList<>();

    public Defaults getDefaults() { return defaults; }
    public void setDefaults(Defaults defaults) { this.defaults = defaults; }
    public HealthCheck getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheck healthCheck) { this.healthCheck = healthCheck; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    public List<SourceDefinition> getSources() { return sources; }
    public void setSources(List<SourceDefinition> sources) { this.sources = sources; }

    public ManagerOptions toOptions() {
        return new ManagerOptions(
                events.queueCapacity,
                cache.maxSize,
                healthCheck.interval,
                healthCheck.timeout,
                healthCheck.monitorTimeout,
                shutdownTimeout,
                new SourceDefaults(defaults.maxRetryAttempts, defaults.retryDelay,
                        defaults.connectionTimeout, defaults.healthCheckInterval));
    }

    public static class Defaults {
        private int maxRetryAttempts = 5;
        private Duration retryDelay = Duration.ofSeconds(30);
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(60);

        public int getMaxRetryAttempts() { return maxRetryAttempts; }
        public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }
        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
        public Duration getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
    }

    public static class HealthCheck {
        private Duration interval = Duration.ofSeconds(60);
        private Duration timeout = Duration.ofSeconds(30);
        private Duration monitorTimeout = Duration.ofSeconds(10);

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getMonitorTimeout() { return monitorTimeout; }
        public void setMonitorTimeout(Duration monitorTimeout) { this.monitorTimeout = monitorTimeout; }
    }

    public static class Events {
        private int queueCapacity = 1000;

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Cache {
        private int maxSize = 1000;

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
    }

    /**
     * A source registered at startup. Unset tunables fall back to {@link Defaults}.
     */
    public static class SourceDefinition {
        private String id = "";
        private String name = "";
        private String path = "";
        private String username;
        private String password;
        private String domain;
        private int maxRetryAttempts;
        private Duration retryDelay;
        private Duration connectionTimeout;
        private Duration healthCheckInterval;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }
        public int getMaxRetryAttempts() { return maxRetryAttempts; }
        public void setMaxRetryAttempts(int maxRetryAttempts) { this.maxRetryAttempts = maxRetryAttempts; }
        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
        public Duration getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
    }
}
