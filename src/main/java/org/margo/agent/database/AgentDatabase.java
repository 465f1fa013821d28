/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.database;

import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.deployment.model.Deployment;

/**
 * The part of the agent state store the reconciliation engine consumes.
 */
public interface AgentDatabase {

    /**
     * Read a deployment.
     *
     * @param appId workload id
     * @return a snapshot of the deployment
     * @throws DatabaseException if the deployment is unknown or cannot be read
     */
    Deployment getDeployment(String appId) throws DatabaseException;

    /**
     * Record the latest status of one component of a deployment.
     *
     * @param appId  workload id
     * @param status component status, keyed by its name
     * @throws DatabaseException if the deployment is unknown or cannot be written
     */
    void upsertComponentStatus(String appId, ComponentStatus status) throws DatabaseException;

    /**
     * Register for change events.
     *
     * @param subscriber the subscriber
     * @throws DatabaseException if a subscriber with the same id is already registered
     */
    void subscribe(DeploymentDatabaseSubscriber subscriber) throws DatabaseException;

    /**
     * Stop delivering change events to a subscriber.
     *
     * @param subscriberId id of the subscriber
     * @throws DatabaseException if no such subscriber is registered
     */
    void unsubscribe(String subscriberId) throws DatabaseException;
}
