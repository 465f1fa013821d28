/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.monitoring;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.margo.agent.database.AgentDatabase;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.database.exceptions.DeploymentNotFoundException;
import org.margo.agent.deployment.exceptions.DeploymentStateException;
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.exceptions.WorkloadBackendException;
import org.margo.agent.deployment.model.ComponentState;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.deployment.model.Deployment;
import org.margo.agent.deployment.model.WorkloadHealth;
import org.margo.agent.workload.CancellationSignal;
import org.margo.agent.workload.WatchContext;
import org.margo.agent.workload.helm.HelmClient;
import org.margo.agent.workload.helm.HelmClientException;
import org.margo.agent.workload.helm.HelmReleaseStatus;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.margo.agent.testcommons.TestManifests.HELM_APP;
import static org.margo.agent.testcommons.TestManifests.HELM_NO_COMPONENTS;
import static org.margo.agent.testcommons.TestManifests.HELM_SINGLE;
import static org.margo.agent.testcommons.TestManifests.appState;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HelmMonitorTest {
    private static final Duration FAST_POLL = Duration.ofMillis(20);

    @Mock
    private AgentDatabase database;
    @Mock
    private HelmClient helmClient;

    private ExecutorService executor;
    private HelmMonitor monitor;

    @BeforeEach
    void beforeEach() {
        executor = Executors.newCachedThreadPool();
        monitor = new HelmMonitor(database, helmClient, FAST_POLL);
    }

    @AfterEach
    void afterEach() {
        executor.shutdownNow();
    }

    @Test
    void GIVEN_deployed_release_WHEN_getStatus_THEN_installed_and_healthy() throws Exception {
        when(database.getDeployment("app-1")).thenReturn(deployed("app-1", HELM_APP));
        when(helmClient.getReleaseStatus("app-1-frontend", "demo")).thenReturn(release("deployed"));

        ComponentStatus status = monitor.getStatus("app-1", null);

        assertThat(status.getName(), is("frontend"));
        assertThat(status.getState(), is(ComponentState.INSTALLED));
        assertThat(status.getHealth(), is(WorkloadHealth.HEALTHY));
        assertThat(status.getMessage(), is("Install complete"));
    }

    @Test
    void GIVEN_named_component_WHEN_getStatus_THEN_release_of_that_component_queried() throws Exception {
        when(database.getDeployment("app-1")).thenReturn(deployed("app-1", HELM_APP));
        when(helmClient.getReleaseStatus("app-1-backend", "demo")).thenReturn(release("pending-upgrade"));

        ComponentStatus status = monitor.getStatus("app-1", "backend");

        assertThat(status.getName(), is("backend"));
        assertThat(status.getState(), is(ComponentState.INSTALLING));
        assertThat(status.getHealth(), is(WorkloadHealth.UNHEALTHY));
    }

    @Test
    void GIVEN_only_desired_state_WHEN_getStatus_THEN_resolved_from_desired_state() throws Exception {
        when(database.getDeployment("app-2"))
                .thenReturn(Deployment.builder().appId("app-2").desiredState(appState("app-2", HELM_SINGLE)).build());
        when(helmClient.getReleaseStatus(eq("app-2-web"), isNull())).thenReturn(release("failed"));

        ComponentStatus status = monitor.getStatus("app-2", null);

        assertThat(status.getState(), is(ComponentState.FAILED));
        assertThat(status.getHealth(), is(WorkloadHealth.UNHEALTHY));
    }

    @Test
    void GIVEN_unknown_or_stateless_deployment_WHEN_getStatus_THEN_unknown_without_backend_call() throws Exception {
        when(database.getDeployment("missing")).thenThrow(new DeploymentNotFoundException("missing"));
        when(database.getDeployment("empty")).thenReturn(Deployment.builder().appId("empty").build());

        assertThat(monitor.getStatus("missing", null).getState(), is(ComponentState.UNKNOWN));
        assertThat(monitor.getStatus("empty", "web").getHealth(), is(WorkloadHealth.UNKNOWN));
        verify(helmClient, never()).getReleaseStatus(anyString(), any());
    }

    @Test
    void GIVEN_unknown_component_WHEN_getStatus_THEN_unknown() throws Exception {
        when(database.getDeployment("app-1")).thenReturn(deployed("app-1", HELM_APP));

        ComponentStatus status = monitor.getStatus("app-1", "sidecar");

        assertThat(status.getName(), is("sidecar"));
        assertThat(status.getState(), is(ComponentState.UNKNOWN));
        assertThat(status.getMessage(), containsString("sidecar"));
    }

    @Test
    void GIVEN_helm_failure_WHEN_getStatus_THEN_backend_error_keeps_cause() throws Exception {
        HelmClientException cause = new HelmClientException("release: not found");
        when(database.getDeployment("app-1")).thenReturn(deployed("app-1", HELM_APP));
        when(helmClient.getReleaseStatus(anyString(), any())).thenThrow(cause);

        WorkloadBackendException e =
                assertThrows(WorkloadBackendException.class, () -> monitor.getStatus("app-1", null));

        assertThat(e.getOperation(), is("get-status"));
        assertThat(e.getAppId(), is("app-1"));
        assertThat(e.getCause(), is(cause));
        assertThat(e.getErrorType().isRetryable(), is(true));
    }

    @Test
    void GIVEN_store_failure_WHEN_getStatus_THEN_state_error() throws Exception {
        when(database.getDeployment("app-1")).thenThrow(new DatabaseException("disk gone"));

        DeploymentStateException e =
                assertThrows(DeploymentStateException.class, () -> monitor.getStatus("app-1", null));
        assertThat(e.getMessage(), is("failed to get deployment app-1: disk gone"));
    }

    @Test
    void GIVEN_workload_with_two_components_WHEN_watch_THEN_each_component_polled_until_cancelled()
            throws Exception {
        when(database.getDeployment("app-1")).thenReturn(deployed("app-1", HELM_APP));
        when(helmClient.getReleaseStatus(anyString(), eq("demo"))).thenReturn(release("deployed"));
        CancellationSignal signal = new CancellationSignal();
        List<CompletableFuture<Void>> tasks = new CopyOnWriteArrayList<>();

        monitor.watch("app-1", new WatchContext("app-1", signal,
                (name, task) -> tasks.add(CompletableFuture.runAsync(task, executor))));

        assertThat(tasks, hasSize(2));
        verify(database, timeout(5000).atLeastOnce()).upsertComponentStatus(eq("app-1"),
                argThat(s -> "frontend".equals(s.getName()) && s.getHealth() == WorkloadHealth.HEALTHY));
        verify(database, timeout(5000).atLeastOnce()).upsertComponentStatus(eq("app-1"),
                argThat(s -> "backend".equals(s.getName()) && s.getState() == ComponentState.INSTALLED));

        signal.cancel();
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
    }

    @Test
    void GIVEN_failing_tick_WHEN_polling_THEN_loop_keeps_going() throws Exception {
        when(database.getDeployment("app-2"))
                .thenReturn(Deployment.builder().appId("app-2").desiredState(appState("app-2", HELM_SINGLE)).build());
        when(helmClient.getReleaseStatus(eq("app-2-web"), isNull()))
                .thenThrow(new HelmClientException("timeout"))
                .thenReturn(release("deployed"));
        CancellationSignal signal = new CancellationSignal();
        List<CompletableFuture<Void>> tasks = new CopyOnWriteArrayList<>();

        monitor.watch("app-2", new WatchContext("app-2", signal,
                (name, task) -> tasks.add(CompletableFuture.runAsync(task, executor))));

        verify(database, timeout(5000).atLeastOnce()).upsertComponentStatus(eq("app-2"),
                argThat(s -> s.getHealth() == WorkloadHealth.HEALTHY));
        monitor.stopWatching("app-2");
        assertThat(signal.isCancelled(), is(true));
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
    }

    @Test
    void GIVEN_workload_without_components_WHEN_watch_THEN_validation_error_and_nothing_launched()
            throws Exception {
        when(database.getDeployment("app-3")).thenReturn(deployed("app-3", HELM_NO_COMPONENTS));
        List<Runnable> launched = new CopyOnWriteArrayList<>();

        assertThrows(InvalidDeploymentException.class, () -> monitor.watch("app-3",
                new WatchContext("app-3", new CancellationSignal(), (name, task) -> launched.add(task))));
        assertThat(launched, hasSize(0));
    }

    @Test
    void GIVEN_unknown_workload_WHEN_watch_THEN_state_error() throws Exception {
        when(database.getDeployment("missing")).thenThrow(new DeploymentNotFoundException("missing"));

        assertThrows(DeploymentStateException.class, () -> monitor.watch("missing",
                new WatchContext("missing", new CancellationSignal(), (name, task) -> {
                })));
    }

    @Test
    void GIVEN_not_positive_interval_WHEN_construct_THEN_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new HelmMonitor(database, helmClient, Duration.ZERO));
        assertThat(new HelmMonitor(database, helmClient).getType(), is("helm.v3"));
    }

    @Test
    void GIVEN_not_watched_WHEN_stopWatching_THEN_no_op() throws Exception {
        monitor.stopWatching("never-watched");

        verify(helmClient, never()).getReleaseStatus(anyString(), any());
    }

    private static Deployment deployed(String appId, String manifest) {
        return Deployment.builder()
                .appId(appId)
                .desiredState(appState(appId, manifest))
                .currentState(appState(appId, manifest))
                .build();
    }

    private static HelmReleaseStatus release(String status) {
        return HelmReleaseStatus.builder().status(status).revision(1).description(
                "deployed".equals(status) ? "Install complete" : null).build();
    }
}
