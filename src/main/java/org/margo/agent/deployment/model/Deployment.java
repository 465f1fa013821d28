/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A workload as tracked by the agent state store: what the fleet manager wants, what was last applied, and the
 * latest status of each component.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Deployment {
    private String appId;

    // never null for an active workload
    private AppState desiredState;

    // null until the first successful deploy
    private AppState currentState;

    @Builder.Default
    private Map<String, ComponentStatus> componentStatus = new HashMap<>();

    /**
     * State to resolve backend resources from: the current state when the workload has been deployed, the desired
     * state otherwise.
     *
     * @return current state, else desired state, else null
     */
    @JsonIgnore
    @Nullable
    public AppState getEffectiveState() {
        return currentState != null ? currentState : desiredState;
    }

    /**
     * Copy that can be handed out without exposing the store's own maps.
     *
     * @return a copy of this deployment
     */
    public Deployment copy() {
        Map<String, ComponentStatus> statuses = new HashMap<>();
        if (componentStatus != null) {
            componentStatus.forEach((name, status) -> statuses.put(name, status.toBuilder().build()));
        }
        return toBuilder()
                .desiredState(desiredState == null ? null : desiredState.toBuilder().build())
                .currentState(currentState == null ? null : currentState.toBuilder().build())
                .componentStatus(statuses)
                .build();
    }
}
