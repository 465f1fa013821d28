/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.function.BiConsumer;

/**
 * What a monitor gets when asked to watch a workload: the signal that ends the watch and the launcher for its
 * polling tasks. Tasks must be started through {@link #launch} so the watcher can join them on stop.
 */
@AllArgsConstructor
public class WatchContext {
    @Getter
    private final String appId;
    @Getter
    private final CancellationSignal signal;
    private final BiConsumer<String, Runnable> launcher;

    /**
     * Run a long-lived task for this watch.
     *
     * @param taskName name used in logs
     * @param task     the task, expected to return once the signal is cancelled
     */
    public void launch(String taskName, Runnable task) {
        launcher.accept(taskName, task);
    }
}
