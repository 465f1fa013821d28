/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class WorkloadLifecycleException extends WorkloadException {
    static final long serialVersionUID = 1927403385260171194L;

    public WorkloadLifecycleException(String message, Throwable cause) {
        super(message, cause, WorkloadErrorType.LIFECYCLE_ERROR);
    }
}
