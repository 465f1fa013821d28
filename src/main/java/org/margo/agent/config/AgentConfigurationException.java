/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.config;

@SuppressWarnings("checkstyle:MissingJavadocMethod")
public class AgentConfigurationException extends Exception {
    static final long serialVersionUID = -1520788271436921633L;

    public AgentConfigurationException(String message) {
        super(message);
    }

    public AgentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
