/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.deployers;

import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.workload.ProfileTypeStrategy;

/**
 * Applies workloads of one deployment profile type to its backend. Deployers never write to the state store.
 */
public interface WorkloadDeployer extends ProfileTypeStrategy {

    /**
     * Install every component of a workload.
     *
     * @param deployment the workload
     * @throws WorkloadException if the workload is invalid or the backend fails
     */
    void deploy(AppDeployment deployment) throws WorkloadException;

    /**
     * Move every component of an installed workload to the given desired state.
     *
     * @param deployment the new desired state of the workload
     * @throws WorkloadException if the workload is invalid or the backend fails
     */
    void update(AppDeployment deployment) throws WorkloadException;

    /**
     * Remove every component of a workload, as recorded in its current state.
     *
     * @param appId workload id
     * @throws WorkloadException if the workload has no current state or the backend fails
     */
    void remove(String appId) throws WorkloadException;
}
