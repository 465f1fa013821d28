/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.monitoring;

import org.margo.agent.deployment.model.ComponentState;
import org.margo.agent.deployment.model.WorkloadHealth;

/**
 * Maps Helm release statuses to component health and state. Statuses are matched exactly, case included.
 */
public final class HelmStatusMapper {
    public static final String STATUS_DEPLOYED = "deployed";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_UNINSTALLING = "uninstalling";
    public static final String STATUS_UNINSTALLED = "uninstalled";
    public static final String STATUS_PENDING_INSTALL = "pending-install";
    public static final String STATUS_PENDING_UPGRADE = "pending-upgrade";
    public static final String STATUS_PENDING_ROLLBACK = "pending-rollback";

    private HelmStatusMapper() {
    }

    /**
     * Health of a release from its Helm status.
     *
     * @param helmStatus raw Helm release status, may be null
     * @return HEALTHY when deployed, UNHEALTHY when failed or in transition, UNKNOWN otherwise
     */
    public static WorkloadHealth classifyHealth(String helmStatus) {
        if (helmStatus == null) {
            return WorkloadHealth.UNKNOWN;
        }
        switch (helmStatus) {
            case STATUS_DEPLOYED:
                return WorkloadHealth.HEALTHY;
            case STATUS_FAILED:
            case STATUS_UNINSTALLING:
            case STATUS_PENDING_INSTALL:
            case STATUS_PENDING_UPGRADE:
            case STATUS_PENDING_ROLLBACK:
                return WorkloadHealth.UNHEALTHY;
            default:
                return WorkloadHealth.UNKNOWN;
        }
    }

    /**
     * Lifecycle state of a component from the Helm status of its release.
     *
     * @param helmStatus raw Helm release status, may be null
     * @return component state, UNKNOWN for unrecognized statuses
     */
    public static ComponentState toComponentState(String helmStatus) {
        if (helmStatus == null) {
            return ComponentState.UNKNOWN;
        }
        switch (helmStatus) {
            case STATUS_DEPLOYED:
                return ComponentState.INSTALLED;
            case STATUS_FAILED:
                return ComponentState.FAILED;
            case STATUS_PENDING_INSTALL:
            case STATUS_PENDING_UPGRADE:
            case STATUS_PENDING_ROLLBACK:
                return ComponentState.INSTALLING;
            case STATUS_UNINSTALLING:
                return ComponentState.REMOVING;
            case STATUS_UNINSTALLED:
                return ComponentState.REMOVED;
            default:
                return ComponentState.UNKNOWN;
        }
    }
}
