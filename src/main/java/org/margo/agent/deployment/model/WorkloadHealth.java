/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.model;

public enum WorkloadHealth {
    HEALTHY, UNHEALTHY, UNKNOWN
}
