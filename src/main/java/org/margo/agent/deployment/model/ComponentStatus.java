/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComponentStatus {
    private String name;

    @Builder.Default
    private ComponentState state = ComponentState.UNKNOWN;

    @Builder.Default
    private WorkloadHealth health = WorkloadHealth.UNKNOWN;

    private String message;

    private Instant lastUpdated;

    /**
     * Status reported when nothing is known about a component yet.
     *
     * @param componentName component name, may be null when no component could be resolved
     * @param message       why the status is unknown
     * @return an unknown status stamped with the current time
     */
    public static ComponentStatus unknown(String componentName, String message) {
        return ComponentStatus.builder()
                .name(componentName)
                .message(message)
                .lastUpdated(Instant.now())
                .build();
    }
}
