/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.helm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Release information as reported by Helm. The status is Helm's raw release status, e.g. {@code deployed} or
 * {@code pending-upgrade}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HelmReleaseStatus {
    private String releaseName;
    private String namespace;
    private String status;
    private int revision;
    private String description;
}
