/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.monitoring;

import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.workload.ProfileTypeStrategy;
import org.margo.agent.workload.WatchContext;

import javax.annotation.Nullable;

/**
 * Observes the running workloads of one deployment profile type and reports component status to the state store.
 */
public interface WorkloadMonitor extends ProfileTypeStrategy {

    /**
     * Start supervising a workload. Launches the polling tasks through the context and returns without waiting for
     * them; they run until the context's signal is cancelled.
     *
     * @param appId   workload id
     * @param context cancellation signal and task launcher of this watch
     * @throws WorkloadException if the workload cannot be resolved or the type is not supported yet
     */
    void watch(String appId, WatchContext context) throws WorkloadException;

    /**
     * Stop supervising a workload. Does nothing if the workload is not watched.
     *
     * @param appId workload id
     * @throws WorkloadException if the type is not supported yet
     */
    void stopWatching(String appId) throws WorkloadException;

    /**
     * Query the backend for the current status of one component.
     *
     * @param appId         workload id
     * @param componentName component to query, null for the first component of the profile
     * @return the status, {@code UNKNOWN} when the workload has no state to resolve
     * @throws WorkloadException if the state store or the backend fails
     */
    ComponentStatus getStatus(String appId, @Nullable String componentName) throws WorkloadException;
}
