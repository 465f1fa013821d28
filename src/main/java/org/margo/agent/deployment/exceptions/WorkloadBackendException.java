/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

import lombok.Getter;

/**
 * The deployment or monitoring backend failed. The backend's own exception is kept as the cause.
 */
@Getter
public class WorkloadBackendException extends WorkloadException {
    static final long serialVersionUID = 3155784401268230418L;

    private final String operation;
    private final String appId;

    /**
     * Constructor.
     *
     * @param operation operation that failed, e.g. "deploy"
     * @param appId     workload the operation was for
     * @param message   what failed
     * @param cause     backend failure
     */
    public WorkloadBackendException(String operation, String appId, String message, Throwable cause) {
        super(String.format("[%s:%s] %s: %s", operation, appId, message, cause.getMessage()), cause,
                WorkloadErrorType.BACKEND_ERROR);
        this.operation = operation;
        this.appId = appId;
    }
}
