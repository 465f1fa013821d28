/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.deployment.converter;

import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.exceptions.WorkloadErrorType;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.AppLifecycleState;
import org.margo.agent.deployment.model.AppParameter;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.deployment.model.DeploymentProfileTypes;
import org.margo.agent.deployment.model.HelmComponentProperties;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.margo.agent.testcommons.TestManifests.HELM_APP;
import static org.margo.agent.testcommons.TestManifests.HELM_SINGLE;
import static org.margo.agent.testcommons.TestManifests.NO_PROFILE;
import static org.margo.agent.testcommons.TestManifests.appState;
import static org.margo.agent.testcommons.TestManifests.encode;

class AppDeploymentConverterTest {

    @Test
    void GIVEN_helm_manifest_WHEN_convertFromAppState_THEN_deployment_decoded_with_app_id() throws Exception {
        AppDeployment deployment = AppDeploymentConverter.convertFromAppState(appState("app-1", HELM_APP));

        assertThat(deployment.getAppId(), is("app-1"));
        assertThat(deployment.getNamespace(), is("demo"));
        assertThat(deployment.getProfileType(), is(DeploymentProfileTypes.HELM_V3));
        assertThat(deployment.getComponents(), hasSize(2));
        assertThat(deployment.getComponents().get(0).getName(), is("frontend"));

        HelmComponentProperties properties = deployment.getComponents().get(0).asHelmProperties();
        assertThat(properties.getRepository(), is("oci://registry.example.com/charts/frontend"));
        assertThat(properties.getRevision(), is("1.2.0"));
        assertThat(properties.getWait(), is(true));
        assertThat(properties.getTimeout(), is("5m"));
    }

    @Test
    void GIVEN_manifest_without_namespace_WHEN_convertFromAppState_THEN_namespace_null() throws Exception {
        AppDeployment deployment = AppDeploymentConverter.convertFromAppState(appState("app-2", HELM_SINGLE));

        assertThat(deployment.getAppId(), is("app-2"));
        assertThat(deployment.getNamespace(), is(nullValue()));
    }

    @Test
    void GIVEN_invalid_base64_WHEN_convertFromAppState_THEN_validation_error() {
        AppState state = AppState.builder().appId("app-1").appDeploymentYaml("%%% not base64 %%%").build();

        InvalidDeploymentException e = assertThrows(InvalidDeploymentException.class,
                () -> AppDeploymentConverter.convertFromAppState(state));
        assertThat(e.getMessage(), containsString("base64"));
        assertThat(e.getErrorType(), is(WorkloadErrorType.VALIDATION_ERROR));
    }

    @Test
    void GIVEN_malformed_yaml_WHEN_convertFromAppState_THEN_validation_error() {
        AppState state = AppState.builder().appId("app-1").appDeploymentYaml(encode("spec: [unclosed")).build();

        assertThrows(InvalidDeploymentException.class, () -> AppDeploymentConverter.convertFromAppState(state));
    }

    @Test
    void GIVEN_missing_manifest_or_profile_WHEN_convertFromAppState_THEN_validation_error() {
        assertThrows(InvalidDeploymentException.class,
                () -> AppDeploymentConverter.convertFromAppState(AppState.builder().appId("app-1").build()));
        assertThrows(InvalidDeploymentException.class,
                () -> AppDeploymentConverter.convertFromAppState(appState("app-1", NO_PROFILE)));
        assertThrows(InvalidDeploymentException.class, () -> AppDeploymentConverter.convertFromAppState(null));
    }

    @Test
    void GIVEN_deployment_WHEN_convertToAppState_THEN_decodes_back_to_same_deployment() throws Exception {
        AppDeployment original = AppDeploymentConverter.convertFromAppState(appState("app-1", HELM_APP));

        AppState state = AppDeploymentConverter.convertToAppState(original, "2.0.0", AppLifecycleState.UPDATING);

        assertThat(state.getAppId(), is("app-1"));
        assertThat(state.getAppVersion(), is("2.0.0"));
        assertThat(state.getAppState(), is(AppLifecycleState.UPDATING));
        assertThat(AppDeploymentConverter.convertFromAppState(state), is(original));
    }

    @Test
    void GIVEN_parameters_WHEN_convertParametersToValues_THEN_nested_values_per_component() throws Exception {
        AppDeployment deployment = AppDeploymentConverter.convertFromAppState(appState("app-1", HELM_APP));

        Map<String, Map<String, Object>> values =
                AppDeploymentConverter.convertParametersToValues(deployment.getSpec().getParameters());

        Map<String, Object> frontendImage = new HashMap<>();
        frontendImage.put("tag", "1.2.0");
        Map<String, Object> frontend = new HashMap<>();
        frontend.put("replicaCount", 3);
        frontend.put("image", frontendImage);
        assertThat(values.get("frontend"), is(frontend));
        assertThat(values.get("backend"), is(Collections.singletonMap("image", frontendImage)));
    }

    @Test
    void GIVEN_conflicting_pointers_WHEN_convertParametersToValues_THEN_validation_error() {
        Map<String, AppParameter> parameters = new HashMap<>();
        parameters.put("a", AppParameter.builder().value("x").targets(Collections.singletonList(
                AppParameter.ParameterTarget.builder().pointer("image").components(Arrays.asList("web")).build()))
                .build());
        parameters.put("b", AppParameter.builder().value("y").targets(Collections.singletonList(
                AppParameter.ParameterTarget.builder().pointer("image.tag").components(Arrays.asList("web")).build()))
                .build());

        assertThrows(InvalidDeploymentException.class,
                () -> AppDeploymentConverter.convertParametersToValues(parameters));
    }

    @Test
    void GIVEN_no_parameters_WHEN_convertParametersToValues_THEN_empty() throws Exception {
        assertThat(AppDeploymentConverter.convertParametersToValues(null).isEmpty(), is(true));
    }
}
