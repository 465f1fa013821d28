/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.deployers;

import org.apache.commons.lang3.StringUtils;
import org.margo.agent.database.AgentDatabase;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.deployment.converter.AppDeploymentConverter;
import org.margo.agent.deployment.exceptions.DeploymentStateException;
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.exceptions.WorkloadBackendException;
import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.deployment.model.Deployment;
import org.margo.agent.deployment.model.DeploymentProfileComponent;
import org.margo.agent.deployment.model.DeploymentProfileTypes;
import org.margo.agent.deployment.model.HelmComponentProperties;
import org.margo.agent.util.Utils;
import org.margo.agent.workload.ReleaseNames;
import org.margo.agent.workload.helm.HelmChartRequest;
import org.margo.agent.workload.helm.HelmClient;
import org.margo.agent.workload.helm.HelmClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Installs one Helm release per component of a workload.
 */
public class HelmDeployer implements WorkloadDeployer {
    private static final String APP_ID_LOG_KEY = "appId";
    private static final String RELEASE_LOG_KEY = "release";
    private static final Logger logger = LoggerFactory.getLogger(HelmDeployer.class);

    private final AgentDatabase database;
    private final HelmClient helmClient;

    public HelmDeployer(AgentDatabase database, HelmClient helmClient) {
        this.database = database;
        this.helmClient = helmClient;
    }

    @Override
    public String getType() {
        return DeploymentProfileTypes.HELM_V3;
    }

    @Override
    public void deploy(AppDeployment deployment) throws WorkloadException {
        List<HelmChartRequest> requests = buildRequests(deployment);
        for (HelmChartRequest request : requests) {
            logger.atInfo().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId())
                    .addKeyValue(RELEASE_LOG_KEY, request.getReleaseName())
                    .addKeyValue("chart", request.getChartRepository())
                    .addKeyValue("revision", request.getRevision()).log("Installing helm release");
            try {
                helmClient.installChart(request);
            } catch (HelmClientException e) {
                throw new WorkloadBackendException("deploy", deployment.getAppId(),
                        String.format("failed to install release %s", request.getReleaseName()), e);
            }
        }
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId()).log("Deployed helm workload");
    }

    @Override
    public void update(AppDeployment deployment) throws WorkloadException {
        List<HelmChartRequest> requests = buildRequests(deployment);
        for (HelmChartRequest request : requests) {
            logger.atInfo().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId())
                    .addKeyValue(RELEASE_LOG_KEY, request.getReleaseName())
                    .addKeyValue("revision", request.getRevision()).log("Upgrading helm release");
            try {
                helmClient.upgradeChart(request);
            } catch (HelmClientException e) {
                throw new WorkloadBackendException("update", deployment.getAppId(),
                        String.format("failed to upgrade release %s", request.getReleaseName()), e);
            }
        }
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId()).log("Updated helm workload");
    }

    @Override
    public void remove(String appId) throws WorkloadException {
        if (StringUtils.isBlank(appId)) {
            throw new InvalidDeploymentException("app ID is required");
        }
        Deployment deployment;
        try {
            deployment = database.getDeployment(appId);
        } catch (DatabaseException e) {
            throw new DeploymentStateException(appId, e);
        }
        AppState currentState = deployment.getCurrentState();
        if (currentState == null) {
            throw new InvalidDeploymentException(
                    String.format("deployment %s has no current state to remove", appId));
        }
        AppDeployment current = AppDeploymentConverter.convertFromAppState(currentState);

        // every release is attempted; the first failure is thrown with the rest suppressed
        WorkloadBackendException failure = null;
        for (DeploymentProfileComponent component : current.getComponents()) {
            String release = ReleaseNames.generate(appId, component.getName());
            logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue(RELEASE_LOG_KEY, release)
                    .log("Uninstalling helm release");
            try {
                helmClient.uninstallChart(release, current.getNamespace());
            } catch (HelmClientException e) {
                WorkloadBackendException wrapped = new WorkloadBackendException("remove", appId,
                        String.format("failed to uninstall release %s", release), e);
                if (failure == null) {
                    failure = wrapped;
                } else {
                    failure.addSuppressed(wrapped);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).log("Removed helm workload");
    }

    // Validates every component before the first backend call.
    private List<HelmChartRequest> buildRequests(AppDeployment deployment) throws InvalidDeploymentException {
        if (deployment == null || StringUtils.isBlank(deployment.getAppId())) {
            throw new InvalidDeploymentException("app ID is required");
        }
        String appId = deployment.getAppId();
        List<DeploymentProfileComponent> components = deployment.getComponents();
        if (components.isEmpty()) {
            throw new InvalidDeploymentException(String.format("deployment %s has no components", appId));
        }
        Map<String, Map<String, Object>> values = AppDeploymentConverter.convertParametersToValues(
                deployment.getSpec().getParameters());

        List<HelmChartRequest> requests = new ArrayList<>();
        for (DeploymentProfileComponent component : components) {
            if (StringUtils.isBlank(component.getName())) {
                throw new InvalidDeploymentException(
                        String.format("deployment %s has a component without a name", appId));
            }
            HelmComponentProperties properties = component.asHelmProperties();
            if (StringUtils.isBlank(properties.getRepository())) {
                throw new InvalidDeploymentException(String.format(
                        "component %s of deployment %s has no chart repository", component.getName(), appId));
            }
            if (properties.getRevision() == null) {
                throw new InvalidDeploymentException(String.format(
                        "component %s of deployment %s has no chart revision", component.getName(), appId));
            }
            requests.add(HelmChartRequest.builder()
                    .releaseName(ReleaseNames.generate(appId, component.getName()))
                    .chartRepository(properties.getRepository())
                    .revision(properties.getRevision())
                    .namespace(deployment.getNamespace())
                    .wait(Boolean.TRUE.equals(properties.getWait()))
                    .timeout(parseTimeout(appId, component.getName(), properties.getTimeout()))
                    .values(values.getOrDefault(component.getName(), Collections.emptyMap()))
                    .build());
        }
        return requests;
    }

    private static Duration parseTimeout(String appId, String componentName, String timeout)
            throws InvalidDeploymentException {
        if (Utils.isEmpty(timeout)) {
            return null;
        }
        try {
            return Utils.parseDuration(timeout);
        } catch (IllegalArgumentException e) {
            throw new InvalidDeploymentException(String.format("component %s of deployment %s has invalid timeout %s",
                    componentName, appId, timeout), e);
        }
    }
}
