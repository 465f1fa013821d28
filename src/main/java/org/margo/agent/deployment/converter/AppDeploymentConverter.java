/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.lang3.StringUtils;
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.AppDeploymentMetadata;
import org.margo.agent.deployment.model.AppLifecycleState;
import org.margo.agent.deployment.model.AppParameter;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.util.SerializerFactory;
import org.margo.agent.util.Utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts between the state-store representation of a workload and its normalized deployment specification.
 */
public final class AppDeploymentConverter {
    private static final String POINTER_SEPARATOR = "\\.";

    private AppDeploymentConverter() {
        // So that this can't be initialized
    }

    /**
     * Decode the deployment manifest carried by an app state.
     *
     * @param appState state-store representation of the workload
     * @return the decoded deployment; its metadata id is the app id
     * @throws InvalidDeploymentException if the manifest is missing or malformed
     */
    public static AppDeployment convertFromAppState(AppState appState) throws InvalidDeploymentException {
        if (appState == null) {
            throw new InvalidDeploymentException("app state is required");
        }
        if (StringUtils.isBlank(appState.getAppDeploymentYaml())) {
            throw new InvalidDeploymentException(
                    String.format("app %s has no deployment manifest", appState.getAppId()));
        }

        byte[] manifest;
        try {
            manifest = Base64.getDecoder().decode(appState.getAppDeploymentYaml().trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidDeploymentException(
                    String.format("deployment manifest of app %s is not valid base64", appState.getAppId()), e);
        }

        AppDeployment deployment;
        try {
            deployment = SerializerFactory.getFailSafeYamlObjectMapper().readValue(manifest, AppDeployment.class);
        } catch (IOException e) {
            throw new InvalidDeploymentException(
                    String.format("failed to parse deployment manifest of app %s", appState.getAppId()), e);
        }
        if (deployment == null) {
            throw new InvalidDeploymentException(
                    String.format("deployment manifest of app %s is empty", appState.getAppId()));
        }

        if (deployment.getMetadata() == null) {
            deployment.setMetadata(new AppDeploymentMetadata());
        }
        // the state store is keyed by app id, which wins over whatever the manifest carries
        if (!Utils.isEmpty(appState.getAppId())) {
            deployment.getMetadata().setId(appState.getAppId());
        }
        if (StringUtils.isBlank(deployment.getProfileType())) {
            throw new InvalidDeploymentException(
                    String.format("deployment profile type of app %s is missing", appState.getAppId()));
        }
        return deployment;
    }

    /**
     * Encode a deployment into the state-store representation.
     *
     * @param deployment deployment specification, its metadata id becomes the app id
     * @param appVersion version of the app
     * @param lifecycle  lifecycle tag
     * @return the app state carrying the base64 encoded YAML manifest
     * @throws InvalidDeploymentException if the deployment cannot be serialized
     */
    public static AppState convertToAppState(AppDeployment deployment, String appVersion,
                                             AppLifecycleState lifecycle) throws InvalidDeploymentException {
        String yaml;
        try {
            yaml = SerializerFactory.getFailSafeYamlObjectMapper().writeValueAsString(deployment);
        } catch (JsonProcessingException e) {
            throw new InvalidDeploymentException("failed to serialize deployment manifest", e);
        }
        return AppState.builder()
                .appId(deployment.getAppId())
                .appVersion(appVersion)
                .appState(lifecycle)
                .appDeploymentYaml(Base64.getEncoder().encodeToString(yaml.getBytes(StandardCharsets.UTF_8)))
                .build();
    }

    /**
     * Turn deployment parameters into per-component value overrides. Each parameter target pointer
     * {@code a.b.c} becomes the nested entry {@code {a: {b: {c: value}}}} in the values of every component the target
     * names.
     *
     * @param parameters deployment parameters, may be null
     * @return component name to value overrides
     * @throws InvalidDeploymentException if a target has no pointer or two pointers collide
     */
    public static Map<String, Map<String, Object>> convertParametersToValues(Map<String, AppParameter> parameters)
            throws InvalidDeploymentException {
        Map<String, Map<String, Object>> componentValues = new HashMap<>();
        if (Utils.isEmpty(parameters)) {
            return componentValues;
        }
        for (Map.Entry<String, AppParameter> parameter : parameters.entrySet()) {
            AppParameter appParameter = parameter.getValue();
            if (appParameter == null || Utils.isEmpty(appParameter.getTargets())) {
                continue;
            }
            for (AppParameter.ParameterTarget target : appParameter.getTargets()) {
                if (target == null || StringUtils.isBlank(target.getPointer())) {
                    throw new InvalidDeploymentException(
                            String.format("parameter %s has a target without a pointer", parameter.getKey()));
                }
                if (Utils.isEmpty(target.getComponents())) {
                    continue;
                }
                for (String component : target.getComponents()) {
                    Map<String, Object> values = componentValues.computeIfAbsent(component, k -> new HashMap<>());
                    putAtPointer(values, target.getPointer(), appParameter.getValue(), parameter.getKey());
                }
            }
        }
        return componentValues;
    }

    @SuppressWarnings("unchecked")
    private static void putAtPointer(Map<String, Object> values, String pointer, Object value, String parameterName)
            throws InvalidDeploymentException {
        String[] path = pointer.trim().split(POINTER_SEPARATOR);
        Map<String, Object> node = values;
        for (int i = 0; i < path.length - 1; i++) {
            Object child = node.computeIfAbsent(path[i], k -> new HashMap<String, Object>());
            if (!(child instanceof Map)) {
                throw new InvalidDeploymentException(String.format(
                        "parameter %s pointer %s conflicts with the value already set at %s", parameterName,
                        pointer, path[i]));
            }
            node = (Map<String, Object>) child;
        }
        String leaf = path[path.length - 1];
        if (node.get(leaf) instanceof Map) {
            throw new InvalidDeploymentException(String.format(
                    "parameter %s pointer %s conflicts with the values already set below %s", parameterName,
                    pointer, leaf));
        }
        node.put(leaf, value);
    }
}
