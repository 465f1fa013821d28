/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.util;

import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks sharing a key one after the other, in submission order, while tasks with different keys run
 * concurrently on the backing executor. Keys must implement hashCode and equals.
 */
public class OrderedExecutorService implements Executor {
    private static final Logger logger = LoggerFactory.getLogger(OrderedExecutorService.class);
    private final Executor executor;
    // key -> tasks waiting behind the one currently running for that key
    @Getter(AccessLevel.PACKAGE)
    private final Map<Object, Queue<Runnable>> pendingByKey = new HashMap<>();

    public OrderedExecutorService(Executor executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }

    /**
     * Run the task after every task previously submitted with the same key has finished. A null key means no
     * ordering.
     *
     * @param task the runnable task
     * @param key  the key by which to order the tasks
     */
    public void execute(Runnable task, Object key) {
        if (key == null) {
            execute(task);
            return;
        }
        synchronized (pendingByKey) {
            Queue<Runnable> pending = pendingByKey.get(key);
            if (pending != null) {
                // a task for this key is in flight, it hands over to us when done
                pending.add(task);
                return;
            }
            pendingByKey.put(key, new ArrayDeque<>());
        }
        try {
            executor.execute(() -> drain(key, task));
        } catch (RejectedExecutionException e) {
            synchronized (pendingByKey) {
                pendingByKey.remove(key);
            }
            throw e;
        }
    }

    /**
     * Whether no keyed task is running or waiting.
     *
     * @return true if idle
     */
    public boolean isIdle() {
        synchronized (pendingByKey) {
            return pendingByKey.isEmpty();
        }
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void drain(Object key, Runnable first) {
        Runnable next = first;
        while (next != null) {
            try {
                next.run();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).addKeyValue("key", key).log("Error executing ordered task");
            }
            synchronized (pendingByKey) {
                Queue<Runnable> pending = pendingByKey.get(key);
                next = pending == null ? null : pending.poll();
                if (next == null) {
                    pendingByKey.remove(key);
                }
            }
        }
    }
}
