/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload.helm;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

@Value
@Builder
public class HelmChartRequest {
    String releaseName;
    // chart reference, e.g. oci://registry/charts/app
    String chartRepository;
    String namespace;
    String revision;
    boolean wait;
    Duration timeout;
    Map<String, Object> values;
}
