/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

/**
 * A backend strategy selected by the deployment profile type of a workload.
 */
public interface ProfileTypeStrategy {

    /**
     * Deployment profile type handled by this strategy, e.g. {@code helm.v3}.
     *
     * @return profile type
     */
    String getType();
}
