/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.database;

import org.margo.agent.deployment.exceptions.WorkloadException;

public interface DeploymentDatabaseSubscriber {

    /**
     * Stable identifier of the subscriber, unique per database.
     *
     * @return subscriber id
     */
    String getSubscriberId();

    /**
     * Handle a change of the state store. Events for one subscriber are delivered one at a time, in publication
     * order.
     *
     * @param event the change
     * @throws WorkloadException if the subscriber failed to handle the change; the database logs it
     */
    void onDatabaseEvent(DeploymentDatabaseEvent event) throws WorkloadException;
}
