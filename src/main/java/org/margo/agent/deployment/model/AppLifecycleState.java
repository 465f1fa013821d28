/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.model;

/**
 * Lifecycle tag the fleet manager attaches to a workload's desired state.
 */
public enum AppLifecycleState {
    RUNNING, UPDATING, REMOVING
}
