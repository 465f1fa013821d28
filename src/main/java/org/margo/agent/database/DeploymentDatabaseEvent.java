/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.database;

import lombok.Value;
import org.margo.agent.deployment.model.Deployment;

import java.time.Instant;

/**
 * Change notification published by the agent state store. The deployment is a snapshot taken when the change was
 * made; for {@link EventType#DEPLOYMENT_DELETED} it is the last known state.
 */
@Value
public class DeploymentDatabaseEvent {
    EventType type;
    Deployment deployment;
    Instant timestamp;

    public enum EventType {
        DEPLOYMENT_ADDED,
        DEPLOYMENT_DELETED,
        DEPLOYMENT_CHANGED,
        COMPONENT_STATUS_UPDATED
    }
}
