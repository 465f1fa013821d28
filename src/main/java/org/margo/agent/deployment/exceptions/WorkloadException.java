/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

import lombok.Getter;

// root class for all workload reconciliation exceptions
@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class WorkloadException extends Exception {
    static final long serialVersionUID = -4263491787316432951L;

    @Getter
    private final WorkloadErrorType errorType;

    public WorkloadException(String message, WorkloadErrorType errorType) {
        super(message);
        this.errorType = errorType;
    }

    public WorkloadException(String message, Throwable cause, WorkloadErrorType errorType) {
        super(message, cause);
        this.errorType = errorType;
    }
}
