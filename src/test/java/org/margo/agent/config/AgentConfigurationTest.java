/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AgentConfigurationTest {

    @Test
    void GIVEN_full_config_WHEN_load_THEN_all_settings_read() throws Exception {
        AgentConfiguration configuration = load("config/agent-config.yaml");

        assertThat(configuration.getDeviceId(), is("device-001"));
        assertThat(configuration.getDataPath(), is(Paths.get("/tmp/margo-agent")));
        assertThat(configuration.getRuntimes(), contains("helm.v3", "compose"));
        assertThat(configuration.getPollInterval(), is(Duration.ofMillis(500)));
        assertThat(configuration.getStopTimeout(), is(Duration.ofMinutes(1)));
        assertThat(configuration.isRuntimeEnabled("compose"), is(true));
    }

    @Test
    void GIVEN_minimal_config_WHEN_load_THEN_defaults_applied() throws Exception {
        AgentConfiguration configuration = load("config/agent-config-minimal.yaml");

        assertThat(configuration.getPollInterval(), is(Duration.ofSeconds(30)));
        assertThat(configuration.getStopTimeout(), is(nullValue()));
        assertThat(configuration.getDataPath(), is(nullValue()));
        assertThat(configuration.isRuntimeEnabled("compose"), is(false));
    }

    @Test
    void GIVEN_unparseable_interval_WHEN_load_THEN_configuration_error() {
        AgentConfigurationException e = assertThrows(AgentConfigurationException.class,
                () -> load("config/agent-config-bad-interval.yaml"));
        assertThat(e.getMessage(), containsString("soon"));
    }

    @Test
    void GIVEN_unknown_runtime_WHEN_load_THEN_configuration_error() {
        AgentConfigurationException e = assertThrows(AgentConfigurationException.class,
                () -> load("config/agent-config-unknown-runtime.yaml"));
        assertThat(e.getMessage(), containsString("wasm"));
    }

    @Test
    void GIVEN_missing_device_id_or_runtimes_WHEN_load_THEN_configuration_error() {
        assertThrows(AgentConfigurationException.class, () -> parse("runtimes: [helm.v3]"));
        assertThrows(AgentConfigurationException.class, () -> parse("deviceId: d1"));
        assertThrows(AgentConfigurationException.class,
                () -> parse("deviceId: d1\nruntimes: [helm.v3]\nmonitoring:\n  pollInterval: 0s"));
        assertThrows(AgentConfigurationException.class, () -> parse("deviceId: [unclosed"));
    }

    @Test
    void GIVEN_numeric_and_iso_durations_WHEN_load_THEN_parsed() throws Exception {
        AgentConfiguration configuration = parse(
                "deviceId: d1\nruntimes: [helm.v3]\nmonitoring:\n  pollInterval: 15\nwatcher:\n  stopTimeout: PT2M");

        assertThat(configuration.getPollInterval(), is(Duration.ofSeconds(15)));
        assertThat(configuration.getStopTimeout(), is(Duration.ofMinutes(2)));
    }

    @Test
    void GIVEN_config_file_WHEN_load_from_path_THEN_read(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("agent.yaml");
        java.nio.file.Files.write(file, "deviceId: d9\nruntimes: [compose]\n".getBytes(StandardCharsets.UTF_8));

        assertThat(AgentConfiguration.load(file).getDeviceId(), is("d9"));
        assertThrows(AgentConfigurationException.class, () -> AgentConfiguration.load(dir.resolve("missing.yaml")));
    }

    @Test
    void GIVEN_bundled_config_WHEN_loadDefault_THEN_read() throws Exception {
        AgentConfiguration configuration = AgentConfiguration.loadDefault();

        assertThat(configuration.getDeviceId(), is("test-device"));
        assertThat(configuration.getPollInterval(), is(Duration.ofMillis(50)));
    }

    private static AgentConfiguration load(String resource) throws AgentConfigurationException {
        InputStream in = AgentConfigurationTest.class.getClassLoader().getResourceAsStream(resource);
        return AgentConfiguration.load(in);
    }

    private static AgentConfiguration parse(String yaml) throws AgentConfigurationException {
        return AgentConfiguration.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
