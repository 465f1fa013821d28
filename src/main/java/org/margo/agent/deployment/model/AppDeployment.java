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

import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Normalized deployment specification decoded from an {@link AppState}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppDeployment {
    private String apiVersion;
    private String kind;
    private AppDeploymentMetadata metadata;
    private AppDeploymentSpec spec;

    @JsonIgnore
    @Nullable
    public String getAppId() {
        return metadata == null ? null : metadata.getId();
    }

    @JsonIgnore
    @Nullable
    public String getNamespace() {
        return metadata == null ? null : metadata.getNamespace();
    }

    @JsonIgnore
    @Nullable
    public String getProfileType() {
        if (spec == null || spec.getDeploymentProfile() == null) {
            return null;
        }
        return spec.getDeploymentProfile().getType();
    }

    /**
     * Components of the deployment profile in declaration order.
     *
     * @return the components, empty if the profile has none
     */
    @JsonIgnore
    public List<DeploymentProfileComponent> getComponents() {
        if (spec == null || spec.getDeploymentProfile() == null
                || spec.getDeploymentProfile().getComponents() == null) {
            return Collections.emptyList();
        }
        return spec.getDeploymentProfile().getComponents();
    }
}
