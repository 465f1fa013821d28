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
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.util.SerializerFactory;

import java.util.Collections;
import java.util.Map;

/**
 * One named unit of a deployment profile. The properties are backend specific; Helm components read them through
 * {@link #asHelmProperties()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeploymentProfileComponent {
    private String name;
    private Map<String, Object> properties;

    public HelmComponentProperties asHelmProperties() throws InvalidDeploymentException {
        return convertProperties(HelmComponentProperties.class);
    }

    private <T> T convertProperties(Class<T> type) throws InvalidDeploymentException {
        Map<String, Object> source = properties == null ? Collections.emptyMap() : properties;
        try {
            return SerializerFactory.getFailSafeJsonObjectMapper().convertValue(source, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidDeploymentException(
                    String.format("invalid %s properties for component %s", type.getSimpleName(), name), e);
        }
    }
}
