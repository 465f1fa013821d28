/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.model;

/**
 * Profile type tags of the backends shipped with the agent. Profile types are free-form strings supplied by the
 * desired state, so this is not a closed set.
 */
public final class DeploymentProfileTypes {
    public static final String HELM_V3 = "helm.v3";
    public static final String COMPOSE = "compose";

    private DeploymentProfileTypes() {
    }
}
