/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

/**
 * Coarse classification of workload failures, used by callers to decide whether retrying can help.
 */
public enum WorkloadErrorType {
    // rejected before any side effect
    VALIDATION_ERROR,
    UNSUPPORTED_PROFILE_TYPE,
    BACKEND_ERROR,
    STATE_STORE_ERROR,
    NOT_IMPLEMENTED,
    LIFECYCLE_ERROR;

    public boolean isRetryable() {
        return this == BACKEND_ERROR || this == STATE_STORE_ERROR;
    }
}
