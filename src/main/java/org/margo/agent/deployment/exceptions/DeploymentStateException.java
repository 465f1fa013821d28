/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

import lombok.Getter;

/**
 * Reading the workload from the agent state store failed.
 */
public class DeploymentStateException extends WorkloadException {
    static final long serialVersionUID = -6511273802640118263L;

    @Getter
    private final String appId;

    public DeploymentStateException(String appId, Throwable cause) {
        super(String.format("failed to get deployment %s: %s", appId, cause.getMessage()), cause,
                WorkloadErrorType.STATE_STORE_ERROR);
        this.appId = appId;
    }
}
