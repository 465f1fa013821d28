/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.exceptions;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * No strategy is registered for the requested deployment profile type.
 */
@Getter
public class UnsupportedProfileTypeException extends WorkloadException {
    static final long serialVersionUID = -1728450396212045177L;

    private final String requestedType;
    private final List<String> availableTypes;

    /**
     * Constructor.
     *
     * @param requestedType  profile type that was asked for
     * @param availableTypes profile types that have a registered strategy
     */
    public UnsupportedProfileTypeException(String requestedType, List<String> availableTypes) {
        super(String.format("unsupported deployment profile type: %s (available: %s)", requestedType,
                availableTypes), WorkloadErrorType.UNSUPPORTED_PROFILE_TYPE);
        this.requestedType = requestedType;
        this.availableTypes = Collections.unmodifiableList(availableTypes);
    }
}
