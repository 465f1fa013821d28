/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.monitoring;

import org.margo.agent.database.AgentDatabase;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.database.exceptions.DeploymentNotFoundException;
import org.margo.agent.deployment.converter.AppDeploymentConverter;
import org.margo.agent.deployment.exceptions.DeploymentStateException;
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.exceptions.WorkloadBackendException;
import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.deployment.model.Deployment;
import org.margo.agent.deployment.model.DeploymentProfileComponent;
import org.margo.agent.deployment.model.DeploymentProfileTypes;
import org.margo.agent.workload.CancellationSignal;
import org.margo.agent.workload.ReleaseNames;
import org.margo.agent.workload.WatchContext;
import org.margo.agent.workload.helm.HelmClient;
import org.margo.agent.workload.helm.HelmClientException;
import org.margo.agent.workload.helm.HelmReleaseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * Supervises Helm workloads by polling the status of the release behind every component at a fixed interval.
 */
public class HelmMonitor implements WorkloadMonitor {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    private static final String APP_ID_LOG_KEY = "appId";
    private static final String COMPONENT_LOG_KEY = "component";
    private static final String RELEASE_LOG_KEY = "release";
    private static final Logger logger = LoggerFactory.getLogger(HelmMonitor.class);

    private final AgentDatabase database;
    private final HelmClient helmClient;
    private final Duration pollInterval;
    private final Map<String, CancellationSignal> watches = new ConcurrentHashMap<>();

    public HelmMonitor(AgentDatabase database, HelmClient helmClient) {
        this(database, helmClient, DEFAULT_POLL_INTERVAL);
    }

    /**
     * Constructor.
     *
     * @param database     state store to read workloads from and report status to
     * @param helmClient   Helm backend
     * @param pollInterval time between two status polls of a component
     */
    public HelmMonitor(AgentDatabase database, HelmClient helmClient, Duration pollInterval) {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("poll interval must be positive");
        }
        this.database = database;
        this.helmClient = helmClient;
        this.pollInterval = pollInterval;
    }

    @Override
    public String getType() {
        return DeploymentProfileTypes.HELM_V3;
    }

    @Override
    public void watch(String appId, WatchContext context) throws WorkloadException {
        AppDeployment deployment = loadAppDeployment(appId);
        if (deployment == null) {
            throw new InvalidDeploymentException(String.format("deployment %s has no state to watch", appId));
        }
        List<DeploymentProfileComponent> components = deployment.getComponents();
        if (components.isEmpty()) {
            throw new InvalidDeploymentException(String.format("deployment %s has no components", appId));
        }

        CancellationSignal signal = context.getSignal();
        CancellationSignal previous = watches.put(appId, signal);
        if (previous != null && previous != signal) {
            previous.cancel();
        }
        for (DeploymentProfileComponent component : components) {
            String componentName = component.getName();
            String release = ReleaseNames.generate(appId, componentName);
            context.launch("helm-monitor-" + release, () -> poll(appId, componentName, release, signal));
        }
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue("components", components.size())
                .addKeyValue("pollInterval", pollInterval).log("Watching helm workload");
    }

    @Override
    public void stopWatching(String appId) {
        CancellationSignal signal = watches.remove(appId);
        if (signal != null) {
            signal.cancel();
            logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).log("Stopped watching helm workload");
        }
    }

    @Override
    public ComponentStatus getStatus(String appId, @Nullable String componentName) throws WorkloadException {
        AppDeployment deployment;
        try {
            deployment = loadAppDeployment(appId);
        } catch (DeploymentStateException e) {
            if (e.getCause() instanceof DeploymentNotFoundException) {
                return ComponentStatus.unknown(componentName, e.getCause().getMessage());
            }
            throw e;
        }
        if (deployment == null) {
            return ComponentStatus.unknown(componentName, "deployment has no state yet");
        }
        DeploymentProfileComponent component = resolveComponent(deployment, componentName);
        if (component == null) {
            return ComponentStatus.unknown(componentName,
                    componentName == null ? "deployment has no components"
                            : String.format("component %s not found", componentName));
        }

        String release = ReleaseNames.generate(appId, component.getName());
        HelmReleaseStatus releaseStatus;
        try {
            releaseStatus = helmClient.getReleaseStatus(release, deployment.getNamespace());
        } catch (HelmClientException e) {
            throw new WorkloadBackendException("get-status", appId,
                    String.format("failed to get status of release %s", release), e);
        }
        String helmStatus = releaseStatus == null ? null : releaseStatus.getStatus();
        return ComponentStatus.builder()
                .name(component.getName())
                .state(HelmStatusMapper.toComponentState(helmStatus))
                .health(HelmStatusMapper.classifyHealth(helmStatus))
                .message(releaseStatus == null ? null : releaseStatus.getDescription())
                .lastUpdated(Instant.now())
                .build();
    }

    private void poll(String appId, String componentName, String release, CancellationSignal signal) {
        logger.atDebug().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue(COMPONENT_LOG_KEY, componentName)
                .addKeyValue(RELEASE_LOG_KEY, release).log("Started polling component status");
        try {
            while (!signal.await(pollInterval)) {
                pollOnce(appId, componentName, signal);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        watches.remove(appId, signal);
        logger.atDebug().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue(COMPONENT_LOG_KEY, componentName)
                .log("Stopped polling component status");
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void pollOnce(String appId, String componentName, CancellationSignal signal) {
        try {
            ComponentStatus status = getStatus(appId, componentName);
            // the watch may have been superseded while the backend was queried
            if (signal.isCancelled()) {
                return;
            }
            database.upsertComponentStatus(appId, status);
            logger.atTrace().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue(COMPONENT_LOG_KEY, componentName)
                    .addKeyValue("state", status.getState()).addKeyValue("health", status.getHealth())
                    .log("Updated component status");
        } catch (WorkloadException | DatabaseException | RuntimeException e) {
            logger.atWarn().setCause(e).addKeyValue(APP_ID_LOG_KEY, appId)
                    .addKeyValue(COMPONENT_LOG_KEY, componentName).log("Failed to poll component status");
        }
    }

    /**
     * Decode the state the workload's releases are resolved from.
     *
     * @return the decoded deployment, null if the workload has neither a current nor a desired state
     * @throws DeploymentStateException if the store does not know the workload or cannot be read
     */
    @Nullable
    private AppDeployment loadAppDeployment(String appId) throws WorkloadException {
        Deployment deployment;
        try {
            deployment = database.getDeployment(appId);
        } catch (DatabaseException e) {
            throw new DeploymentStateException(appId, e);
        }
        AppState state = deployment == null ? null : deployment.getEffectiveState();
        if (state == null) {
            return null;
        }
        return AppDeploymentConverter.convertFromAppState(state);
    }

    @Nullable
    private static DeploymentProfileComponent resolveComponent(AppDeployment deployment,
                                                               @Nullable String componentName) {
        List<DeploymentProfileComponent> components = deployment.getComponents();
        if (components.isEmpty()) {
            return null;
        }
        if (componentName == null) {
            return components.get(0);
        }
        for (DeploymentProfileComponent component : components) {
            if (componentName.equals(component.getName())) {
                return component;
            }
        }
        return null;
    }
}
