/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class SerializerFactory {

    // manifests and dumps come from other agent versions and the fleet manager, so ignore unknowns
    private static final ObjectMapper FAIL_SAFE_JSON_OBJECT_MAPPER = configure(new ObjectMapper());

    private static final ObjectMapper FAIL_SAFE_YAML_OBJECT_MAPPER = configure(new ObjectMapper(new YAMLFactory()));

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static ObjectMapper getFailSafeJsonObjectMapper() {
        return FAIL_SAFE_JSON_OBJECT_MAPPER;
    }

    public static ObjectMapper getFailSafeYamlObjectMapper() {
        return FAIL_SAFE_YAML_OBJECT_MAPPER;
    }

    private SerializerFactory() {
    }
}
