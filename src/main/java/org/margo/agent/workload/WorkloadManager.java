/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

import org.apache.commons.lang3.StringUtils;
import org.margo.agent.database.AgentDatabase;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.deployment.converter.AppDeploymentConverter;
import org.margo.agent.deployment.exceptions.DeploymentStateException;
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.deployment.model.Deployment;
import org.margo.agent.workload.deployers.WorkloadDeployer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for applying workloads: decodes the state, picks the deployer of its profile type and runs it.
 */
public class WorkloadManager {
    private static final String APP_ID_LOG_KEY = "appId";
    private static final String PROFILE_TYPE_LOG_KEY = "profileType";
    private static final Logger logger = LoggerFactory.getLogger(WorkloadManager.class);

    private final AgentDatabase database;
    private final StrategyRegistry<WorkloadDeployer> deployers;

    public WorkloadManager(AgentDatabase database, StrategyRegistry<WorkloadDeployer> deployers) {
        this.database = database;
        this.deployers = deployers;
    }

    /**
     * Install a workload.
     *
     * @param desiredState state to install
     * @throws WorkloadException if the state is invalid, its type unsupported or the backend fails
     */
    public void deploy(AppState desiredState) throws WorkloadException {
        AppDeployment deployment = decode(desiredState);
        WorkloadDeployer deployer = deployers.get(deployment.getProfileType());
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId())
                .addKeyValue(PROFILE_TYPE_LOG_KEY, deployer.getType()).log("Deploying workload");
        deployer.deploy(deployment);
    }

    /**
     * Move an installed workload to a new state.
     *
     * @param desiredState state to move to
     * @throws WorkloadException if the state is invalid, its type unsupported or the backend fails
     */
    public void update(AppState desiredState) throws WorkloadException {
        AppDeployment deployment = decode(desiredState);
        WorkloadDeployer deployer = deployers.get(deployment.getProfileType());
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId())
                .addKeyValue(PROFILE_TYPE_LOG_KEY, deployer.getType()).log("Updating workload");
        deployer.update(deployment);
    }

    /**
     * Remove a workload with the deployer of its current profile type, falling back to the desired one.
     *
     * @param appId workload id
     * @throws WorkloadException if the workload is unknown, its type unsupported or the backend fails
     */
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
        AppState state = deployment.getEffectiveState();
        if (state == null) {
            throw new InvalidDeploymentException(String.format("deployment %s has no state to remove", appId));
        }
        WorkloadDeployer deployer = deployers.get(AppDeploymentConverter.convertFromAppState(state).getProfileType());
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue(PROFILE_TYPE_LOG_KEY, deployer.getType())
                .log("Removing workload");
        deployer.remove(appId);
    }

    private static AppDeployment decode(AppState state) throws InvalidDeploymentException {
        if (state == null || StringUtils.isBlank(state.getAppId())) {
            throw new InvalidDeploymentException("app ID is required");
        }
        return AppDeploymentConverter.convertFromAppState(state);
    }
}
