/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.margo.agent.deployment.model.DeploymentProfileTypes;
import org.margo.agent.util.SerializerFactory;
import org.margo.agent.util.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Agent settings, read from YAML:
 * <pre>
 * deviceId: device-001
 * dataDir: /var/lib/margo
 * runtimes: [helm.v3]
 * monitoring:
 *   pollInterval: 30s
 * watcher:
 *   stopTimeout: 1m
 * </pre>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentConfiguration {
    public static final String DEFAULT_CONFIG_RESOURCE = "agent-config.yaml";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    private static final List<String> KNOWN_RUNTIMES =
            Arrays.asList(DeploymentProfileTypes.HELM_V3, DeploymentProfileTypes.COMPOSE);

    private String deviceId;
    // null keeps the state store in memory only
    private String dataDir;
    private List<String> runtimes = new ArrayList<>();
    private MonitoringConfiguration monitoring = new MonitoringConfiguration();
    private WatcherConfiguration watcher = new WatcherConfiguration();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonitoringConfiguration {
        @JsonDeserialize(using = DurationDeserializer.class)
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WatcherConfiguration {
        // null waits for the watch tasks until they exit
        @JsonDeserialize(using = DurationDeserializer.class)
        private Duration stopTimeout;
    }

    /**
     * Read and validate a configuration file.
     *
     * @param file YAML file
     * @return the configuration
     * @throws AgentConfigurationException if the file cannot be read or is invalid
     */
    public static AgentConfiguration load(Path file) throws AgentConfigurationException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new AgentConfigurationException(String.format("failed to read configuration %s", file), e);
        }
    }

    /**
     * Read and validate the configuration bundled on the classpath as {@value #DEFAULT_CONFIG_RESOURCE}.
     *
     * @return the configuration
     * @throws AgentConfigurationException if the resource is missing or invalid
     */
    public static AgentConfiguration loadDefault() throws AgentConfigurationException {
        try (InputStream in = AgentConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new AgentConfigurationException(
                        String.format("configuration resource %s not found", DEFAULT_CONFIG_RESOURCE));
            }
            return load(in);
        } catch (IOException e) {
            throw new AgentConfigurationException(
                    String.format("failed to read configuration resource %s", DEFAULT_CONFIG_RESOURCE), e);
        }
    }

    /**
     * Read and validate a configuration.
     *
     * @param in YAML content
     * @return the configuration
     * @throws AgentConfigurationException if the content is not valid YAML or the configuration is invalid
     */
    public static AgentConfiguration load(InputStream in) throws AgentConfigurationException {
        AgentConfiguration configuration;
        try {
            configuration = SerializerFactory.getFailSafeYamlObjectMapper().readValue(in, AgentConfiguration.class);
        } catch (IOException e) {
            throw new AgentConfigurationException("failed to parse configuration: " + e.getMessage(), e);
        }
        if (configuration == null) {
            throw new AgentConfigurationException("configuration is empty");
        }
        configuration.validate();
        return configuration;
    }

    /**
     * Check the configuration is complete and consistent.
     *
     * @throws AgentConfigurationException describing the first problem found
     */
    public void validate() throws AgentConfigurationException {
        if (StringUtils.isBlank(deviceId)) {
            throw new AgentConfigurationException("deviceId is required");
        }
        if (Utils.isEmpty(runtimes)) {
            throw new AgentConfigurationException("at least one runtime must be enabled");
        }
        for (String runtime : runtimes) {
            if (!KNOWN_RUNTIMES.contains(runtime)) {
                throw new AgentConfigurationException(
                        String.format("unknown runtime %s (known: %s)", runtime, KNOWN_RUNTIMES));
            }
        }
        Duration pollInterval = getPollInterval();
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new AgentConfigurationException("monitoring.pollInterval must be positive");
        }
        Duration stopTimeout = getStopTimeout();
        if (stopTimeout != null && stopTimeout.isNegative()) {
            throw new AgentConfigurationException("watcher.stopTimeout must not be negative");
        }
    }

    public boolean isRuntimeEnabled(String type) {
        return runtimes != null && runtimes.contains(type);
    }

    @JsonIgnore
    public Duration getPollInterval() {
        if (monitoring == null || monitoring.getPollInterval() == null) {
            return DEFAULT_POLL_INTERVAL;
        }
        return monitoring.getPollInterval();
    }

    @JsonIgnore
    @Nullable
    public Duration getStopTimeout() {
        return watcher == null ? null : watcher.getStopTimeout();
    }

    @JsonIgnore
    @Nullable
    public Path getDataPath() {
        return StringUtils.isBlank(dataDir) ? null : Paths.get(dataDir);
    }
}
