/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.margo.agent.workload.monitoring.WorkloadMonitor;

// One active watch of the workload watcher.
@Getter
@AllArgsConstructor
class WatchRegistration {
    private final String appId;
    private final WorkloadMonitor monitor;
    private final CancellationSignal signal;

    void cancel() {
        signal.cancel();
    }
}
