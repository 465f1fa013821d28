/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.margo.agent.config.AgentConfiguration;
import org.margo.agent.database.InMemoryAgentDatabase;
import org.margo.agent.deployment.exceptions.UnsupportedProfileTypeException;
import org.margo.agent.deployment.model.ComponentState;
import org.margo.agent.deployment.model.WorkloadHealth;
import org.margo.agent.workload.helm.HelmClient;
import org.margo.agent.workload.helm.HelmReleaseStatus;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.margo.agent.testcommons.TestManifests.HELM_SINGLE;
import static org.margo.agent.testcommons.TestManifests.appState;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DeviceAgentTest {
    @TempDir
    Path dataDir;

    @Mock
    private HelmClient helmClient;

    @Test
    void GIVEN_helm_runtime_WHEN_workload_deployed_and_stored_THEN_installed_and_watched() throws Exception {
        lenient().when(helmClient.getReleaseStatus(eq("app-1-web"), isNull()))
                .thenReturn(HelmReleaseStatus.builder().status("deployed").build());
        DeviceAgent agent = new DeviceAgent(configuration(dataDir.toString(), "helm.v3", "compose"), helmClient);
        agent.start();

        agent.getWorkloadManager().deploy(appState("app-1", HELM_SINGLE));
        agent.getDatabase().upsertDesiredState(appState("app-1", HELM_SINGLE));
        agent.getDatabase().setCurrentState("app-1", appState("app-1", HELM_SINGLE));

        verify(helmClient).installChart(any());
        await().atMost(Duration.ofSeconds(5)).until(
                () -> agent.getWorkloadWatcher().getDeploymentStatus("app-1").getHealth() == WorkloadHealth.HEALTHY);
        await().atMost(Duration.ofSeconds(5)).until(
                () -> !agent.getDatabase().getDeployment("app-1").getComponentStatus().isEmpty());
        assertThat(agent.getDatabase().getDeployment("app-1").getComponentStatus().get("web").getState(),
                is(ComponentState.INSTALLED));

        agent.stop();
        assertThat(agent.getWorkloadWatcher().isStarted(), is(false));
        assertThat(Files.exists(dataDir.resolve(InMemoryAgentDatabase.DUMP_FILE_NAME)), is(true));
    }

    @Test
    void GIVEN_dumped_workload_WHEN_agent_restarted_THEN_workload_watched_again() throws Exception {
        DeviceAgent first = new DeviceAgent(configuration(dataDir.toString(), "helm.v3"), helmClient);
        first.start();
        first.getDatabase().upsertDesiredState(appState("app-1", HELM_SINGLE));
        first.stop();

        DeviceAgent second = new DeviceAgent(configuration(dataDir.toString(), "helm.v3"), helmClient);
        second.start();
        try {
            assertThat(second.getDatabase().listDeployments().size(), is(1));
            assertThat(second.getDatabase().getDeployment("app-1").getDesiredState(),
                    is(appState("app-1", HELM_SINGLE)));
        } finally {
            second.stop();
        }
    }

    @Test
    void GIVEN_helm_enabled_without_client_WHEN_deploy_helm_workload_THEN_unsupported() throws Exception {
        DeviceAgent agent = new DeviceAgent(configuration(null, "helm.v3", "compose"), null);

        UnsupportedProfileTypeException e = assertThrows(UnsupportedProfileTypeException.class,
                () -> agent.getWorkloadManager().deploy(appState("app-1", HELM_SINGLE)));

        assertThat(e.getAvailableTypes(), is(Collections.singletonList("compose")));
        agent.stop();
    }

    private static AgentConfiguration configuration(String dataDir, String... runtimes) {
        AgentConfiguration configuration = new AgentConfiguration();
        configuration.setDeviceId("test-device");
        configuration.setDataDir(dataDir);
        configuration.setRuntimes(Arrays.asList(runtimes));
        configuration.getMonitoring().setPollInterval(Duration.ofMillis(20));
        return configuration;
    }
}
