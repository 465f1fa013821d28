/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.monitoring;

import org.margo.agent.deployment.exceptions.StrategyNotImplementedException;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.deployment.model.DeploymentProfileTypes;
import org.margo.agent.workload.WatchContext;

import javax.annotation.Nullable;

// Registered so compose workloads resolve to a strategy; supervision is not available yet.
public class ComposeMonitor implements WorkloadMonitor {

    @Override
    public String getType() {
        return DeploymentProfileTypes.COMPOSE;
    }

    @Override
    public void watch(String appId, WatchContext context) throws StrategyNotImplementedException {
        throw new StrategyNotImplementedException("docker compose monitoring not yet implemented");
    }

    @Override
    public void stopWatching(String appId) throws StrategyNotImplementedException {
        throw new StrategyNotImplementedException("docker compose monitoring not yet implemented");
    }

    @Override
    public ComponentStatus getStatus(String appId, @Nullable String componentName) {
        return ComponentStatus.unknown(componentName, "docker compose status not yet implemented");
    }
}
