/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class InvalidDeploymentException extends WorkloadException {
    static final long serialVersionUID = 6204175243318859013L;

    public InvalidDeploymentException(String message) {
        super(message, WorkloadErrorType.VALIDATION_ERROR);
    }

    public InvalidDeploymentException(String message, Throwable cause) {
        super(message, cause, WorkloadErrorType.VALIDATION_ERROR);
    }
}
