/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class StrategyNotImplementedException extends WorkloadException {
    static final long serialVersionUID = 8871036270458312650L;

    public StrategyNotImplementedException(String message) {
        super(message, WorkloadErrorType.NOT_IMPLEMENTED);
    }
}
