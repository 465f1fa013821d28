/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.margo.agent.util.Utils;

import java.io.IOException;
import java.time.Duration;

/**
 * Reads durations written as {@code 30s}, {@code 500ms}, {@code 5m}, ISO-8601 or a number of seconds.
 */
public class DurationDeserializer extends StdDeserializer<Duration> {
    static final long serialVersionUID = 2749021387745210456L;

    public DurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return Duration.ofSeconds(p.getLongValue());
        }
        String text = p.getValueAsString();
        try {
            return Utils.parseDuration(text);
        } catch (IllegalArgumentException e) {
            throw ctxt.weirdStringException(text, Duration.class, e.getMessage());
        }
    }
}
