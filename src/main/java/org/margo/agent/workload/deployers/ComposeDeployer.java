/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.deployers;

import org.margo.agent.deployment.exceptions.StrategyNotImplementedException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.DeploymentProfileTypes;

public class ComposeDeployer implements WorkloadDeployer {

    @Override
    public String getType() {
        return DeploymentProfileTypes.COMPOSE;
    }

    @Override
    public void deploy(AppDeployment deployment) throws StrategyNotImplementedException {
        throw new StrategyNotImplementedException("docker compose deployment not yet implemented");
    }

    @Override
    public void update(AppDeployment deployment) throws StrategyNotImplementedException {
        throw new StrategyNotImplementedException("docker compose update not yet implemented");
    }

    @Override
    public void remove(String appId) throws StrategyNotImplementedException {
        throw new StrategyNotImplementedException("docker compose removal not yet implemented");
    }
}
