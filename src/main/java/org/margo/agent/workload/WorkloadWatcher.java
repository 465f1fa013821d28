/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

import org.apache.commons.lang3.StringUtils;
import org.margo.agent.database.AgentDatabase;
import org.margo.agent.database.DeploymentDatabaseEvent;
import org.margo.agent.database.DeploymentDatabaseSubscriber;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.deployment.converter.AppDeploymentConverter;
import org.margo.agent.deployment.exceptions.DeploymentStateException;
import org.margo.agent.deployment.exceptions.InvalidDeploymentException;
import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.exceptions.WorkloadLifecycleException;
import org.margo.agent.deployment.model.AppDeployment;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.deployment.model.Deployment;
import org.margo.agent.workload.monitoring.WorkloadMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

/**
 * Keeps one watch per workload in the state store: a workload added to the store gets supervised by the monitor of
 * its profile type, a workload deleted from the store stops being supervised.
 *
 * <p>Events are handled one at a time on the store's delivery thread and never wait for the tasks they start. Every
 * task launched for a watch is tracked so that {@link #stop()} can wait for all of them to exit.</p>
 */
public class WorkloadWatcher implements DeploymentDatabaseSubscriber {
    public static final String SUBSCRIBER_ID = "workload-watcher";
    private static final String APP_ID_LOG_KEY = "appId";
    private static final String PROFILE_TYPE_LOG_KEY = "profileType";
    private static final Logger logger = LoggerFactory.getLogger(WorkloadWatcher.class);

    private final AgentDatabase database;
    private final StrategyRegistry<WorkloadMonitor> monitors;
    private final Executor executor;
    @Nullable
    private final Duration stopTimeout;

    private final Object watchesLock = new Object();
    private final Map<String, WatchRegistration> activeWatches = new HashMap<>();
    // guarded by watchesLock
    private boolean closed;
    private final Set<CompletableFuture<Void>> runningTasks = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public WorkloadWatcher(AgentDatabase database, StrategyRegistry<WorkloadMonitor> monitors, Executor executor) {
        this(database, monitors, executor, null);
    }

    /**
     * Constructor.
     *
     * @param database    state store to subscribe to
     * @param monitors    monitor per deployment profile type
     * @param executor    executor running the watch tasks, one thread per watched component
     * @param stopTimeout longest time {@link #stop()} waits for the watch tasks, null to wait until they exit
     */
    public WorkloadWatcher(AgentDatabase database, StrategyRegistry<WorkloadMonitor> monitors, Executor executor,
                           @Nullable Duration stopTimeout) {
        this.database = database;
        this.monitors = monitors;
        this.executor = executor;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public String getSubscriberId() {
        return SUBSCRIBER_ID;
    }

    /**
     * Subscribe to the state store. Calling it again while started does nothing.
     *
     * @throws WorkloadLifecycleException if the subscription is rejected
     */
    public void start() throws WorkloadLifecycleException {
        if (!started.compareAndSet(false, true)) {
            logger.atWarn().log("Workload watcher is already started");
            return;
        }
        synchronized (watchesLock) {
            closed = false;
        }
        try {
            database.subscribe(this);
        } catch (DatabaseException e) {
            started.set(false);
            throw new WorkloadLifecycleException("failed to subscribe to the agent database", e);
        }
        logger.atInfo().addKeyValue("monitors", monitors.getAvailableTypes()).log("Workload watcher started");
    }

    /**
     * Unsubscribe, cancel every watch and wait for every watch task to exit. When a stop timeout is configured, tasks
     * still running after it are left to finish on their own. Events still in delivery once stopping has begun are
     * ignored.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            logger.atWarn().log("Workload watcher is not started");
            return;
        }
        try {
            database.unsubscribe(SUBSCRIBER_ID);
        } catch (DatabaseException e) {
            logger.atWarn().setCause(e).log("Failed to unsubscribe from the agent database");
        }
        List<WatchRegistration> registrations;
        synchronized (watchesLock) {
            closed = true;
            registrations = new ArrayList<>(activeWatches.values());
            activeWatches.clear();
            registrations.forEach(WatchRegistration::cancel);
        }
        for (WatchRegistration registration : registrations) {
            stopMonitor(registration);
        }
        awaitRunningTasks();
        logger.atInfo().addKeyValue("cancelledWatches", registrations.size()).log("Workload watcher stopped");
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public void onDatabaseEvent(DeploymentDatabaseEvent event) throws WorkloadException {
        Deployment deployment = event.getDeployment();
        switch (event.getType()) {
            case DEPLOYMENT_ADDED:
                if (deployment.getDesiredState() == null) {
                    logger.atDebug().addKeyValue(APP_ID_LOG_KEY, deployment.getAppId())
                            .log("Added deployment has no desired state, not watching it");
                    return;
                }
                startWatching(deployment.getDesiredState());
                break;
            case DEPLOYMENT_DELETED:
                stopWatching(deployment.getAppId());
                break;
            default:
                break;
        }
    }

    /**
     * Supervise a workload with the monitor of its profile type, replacing any watch it already has. Does nothing once
     * the watcher is stopping.
     *
     * @param desiredState desired state of the workload
     * @throws WorkloadException if the state cannot be decoded, the type has no monitor or the monitor fails
     */
    public void startWatching(AppState desiredState) throws WorkloadException {
        if (desiredState == null || StringUtils.isBlank(desiredState.getAppId())) {
            throw new InvalidDeploymentException("app ID is required");
        }
        String appId = desiredState.getAppId();
        AppDeployment appDeployment = AppDeploymentConverter.convertFromAppState(desiredState);
        WorkloadMonitor monitor = monitors.get(appDeployment.getProfileType());

        WatchRegistration registration = new WatchRegistration(appId, monitor, new CancellationSignal());
        WatchRegistration previous;
        synchronized (watchesLock) {
            if (closed) {
                logger.atDebug().addKeyValue(APP_ID_LOG_KEY, appId).log("Watcher is stopped, not watching workload");
                return;
            }
            previous = activeWatches.remove(appId);
            if (previous != null) {
                previous.cancel();
            }
            activeWatches.put(appId, registration);
        }
        if (previous != null) {
            logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).log("Replaced existing watch");
        }

        try {
            monitor.watch(appId, new WatchContext(appId, registration.getSignal(),
                    (taskName, task) -> launch(registration, taskName, task)));
        } catch (WorkloadException e) {
            synchronized (watchesLock) {
                activeWatches.remove(appId, registration);
            }
            registration.cancel();
            throw e;
        }
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).addKeyValue(PROFILE_TYPE_LOG_KEY, monitor.getType())
                .log("Started watching workload");
    }

    /**
     * Stop supervising a workload. Does nothing if it is not watched.
     *
     * @param appId workload id
     */
    public void stopWatching(String appId) {
        WatchRegistration registration;
        synchronized (watchesLock) {
            registration = activeWatches.remove(appId);
        }
        if (registration == null) {
            logger.atDebug().addKeyValue(APP_ID_LOG_KEY, appId).log("Workload is not watched");
            return;
        }
        registration.cancel();
        stopMonitor(registration);
        logger.atInfo().addKeyValue(APP_ID_LOG_KEY, appId).log("Stopped watching workload");
    }

    /**
     * Query the status of the first component of a workload.
     *
     * @param appId workload id
     * @return component status, {@code UNKNOWN} when the workload has no state
     * @throws DeploymentStateException if the workload is not in the store or cannot be read
     * @throws WorkloadException        if the workload cannot be decoded or monitored
     */
    public ComponentStatus getDeploymentStatus(String appId) throws WorkloadException {
        return getDeploymentStatus(appId, null);
    }

    /**
     * Query the status of a component of a workload.
     *
     * @param appId         workload id
     * @param componentName component to query, null for the first component
     * @return component status, {@code UNKNOWN} when the workload has neither a current nor a desired state
     * @throws DeploymentStateException if the workload is not in the store or cannot be read
     * @throws WorkloadException        if the workload cannot be decoded or monitored
     */
    public ComponentStatus getDeploymentStatus(String appId, @Nullable String componentName)
            throws WorkloadException {
        if (StringUtils.isBlank(appId)) {
            throw new InvalidDeploymentException("app ID is required");
        }
        Deployment deployment;
        try {
            deployment = database.getDeployment(appId);
        } catch (DatabaseException e) {
            throw new DeploymentStateException(appId, e);
        }
        AppState state = deployment.getEffectiveState();
        if (state == null) {
            return ComponentStatus.unknown(componentName, "deployment has no state yet");
        }
        AppDeployment appDeployment = AppDeploymentConverter.convertFromAppState(state);
        WorkloadMonitor monitor = monitors.get(appDeployment.getProfileType());
        return monitor.getStatus(appId, componentName);
    }

    // visible for tests
    Map<String, WatchRegistration> getActiveWatches() {
        synchronized (watchesLock) {
            return Collections.unmodifiableMap(new HashMap<>(activeWatches));
        }
    }

    // visible for tests
    int getRunningTaskCount() {
        return runningTasks.size();
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void launch(WatchRegistration registration, String taskName, Runnable task) {
        synchronized (watchesLock) {
            // tasks of a cancelled watch are never started
            if (registration.getSignal().isCancelled()) {
                logger.atDebug().addKeyValue(APP_ID_LOG_KEY, registration.getAppId()).addKeyValue("task", taskName)
                        .log("Watch is cancelled, not launching task");
                return;
            }
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.atError().setCause(e).addKeyValue("task", taskName).log("Watch task failed");
                }
            }, executor);
            runningTasks.add(future);
            future.whenComplete((result, error) -> runningTasks.remove(future));
        }
    }

    private void stopMonitor(WatchRegistration registration) {
        try {
            registration.getMonitor().stopWatching(registration.getAppId());
        } catch (WorkloadException e) {
            logger.atWarn().setCause(e).addKeyValue(APP_ID_LOG_KEY, registration.getAppId())
                    .log("Monitor failed to stop watching workload");
        }
    }

    private void awaitRunningTasks() {
        List<CompletableFuture<Void>> tasks = new ArrayList<>(runningTasks);
        if (tasks.isEmpty()) {
            return;
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
        try {
            if (stopTimeout == null) {
                all.get();
            } else {
                all.get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            logger.atWarn().addKeyValue("stopTimeout", stopTimeout).addKeyValue("runningTasks", runningTasks.size())
                    .log("Watch tasks did not exit in time, leaving them to finish on their own");
        } catch (ExecutionException e) {
            // tasks catch their own errors, this is not expected
            logger.atWarn().setCause(e).log("Watch task ended with an error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atWarn().log("Interrupted while waiting for watch tasks to exit");
        }
    }
}
