/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.model;

public enum ComponentState {
    UNKNOWN,
    PENDING,
    INSTALLING,
    // healthy-equivalent, the component is deployed and running
    INSTALLED,
    FAILED,
    REMOVING,
    REMOVED
}
