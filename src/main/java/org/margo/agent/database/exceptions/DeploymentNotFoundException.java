/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.database.exceptions;

import lombok.Getter;

public class DeploymentNotFoundException extends DatabaseException {
    static final long serialVersionUID = -3069318652010741475L;

    @Getter
    private final String appId;

    public DeploymentNotFoundException(String appId) {
        super(String.format("deployment %s not found", appId));
        this.appId = appId;
    }
}
