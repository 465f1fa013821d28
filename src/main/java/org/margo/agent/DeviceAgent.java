/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent;

import lombok.Getter;
import org.margo.agent.config.AgentConfiguration;
import org.margo.agent.database.InMemoryAgentDatabase;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.deployment.exceptions.WorkloadLifecycleException;
import org.margo.agent.deployment.model.DeploymentProfileTypes;
import org.margo.agent.workload.StrategyRegistry;
import org.margo.agent.workload.WorkloadManager;
import org.margo.agent.workload.WorkloadWatcher;
import org.margo.agent.workload.deployers.ComposeDeployer;
import org.margo.agent.workload.deployers.HelmDeployer;
import org.margo.agent.workload.deployers.WorkloadDeployer;
import org.margo.agent.workload.helm.HelmClient;
import org.margo.agent.workload.monitoring.ComposeMonitor;
import org.margo.agent.workload.monitoring.HelmMonitor;
import org.margo.agent.workload.monitoring.WorkloadMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * Wires the reconciliation engine of one device: state store, deployers, monitors and the workload watcher.
 */
public class DeviceAgent {
    private static final Logger logger = LoggerFactory.getLogger(DeviceAgent.class);
    private static final long EXECUTOR_SHUTDOWN_SECONDS = 5;

    private final AgentConfiguration configuration;
    private final ExecutorService eventExecutor;
    private final ExecutorService watchExecutor;
    @Getter
    private final InMemoryAgentDatabase database;
    @Getter
    private final WorkloadManager workloadManager;
    @Getter
    private final WorkloadWatcher workloadWatcher;

    /**
     * Constructor.
     *
     * @param configuration validated agent configuration
     * @param helmClient    Helm backend, null if Helm is not available on this device
     */
    public DeviceAgent(AgentConfiguration configuration, @Nullable HelmClient helmClient) {
        this.configuration = configuration;
        this.eventExecutor = Executors.newCachedThreadPool(namedThreads("agent-db-events"));
        this.watchExecutor = Executors.newCachedThreadPool(namedThreads("workload-watch"));
        this.database = new InMemoryAgentDatabase(configuration.getDataPath(), eventExecutor);

        List<WorkloadDeployer> deployers = new ArrayList<>();
        List<WorkloadMonitor> monitors = new ArrayList<>();
        if (configuration.isRuntimeEnabled(DeploymentProfileTypes.HELM_V3)) {
            if (helmClient == null) {
                logger.atWarn().addKeyValue("runtime", DeploymentProfileTypes.HELM_V3)
                        .log("Runtime is enabled but no helm client is available, skipping it");
            } else {
                deployers.add(new HelmDeployer(database, helmClient));
                monitors.add(new HelmMonitor(database, helmClient, configuration.getPollInterval()));
            }
        }
        if (configuration.isRuntimeEnabled(DeploymentProfileTypes.COMPOSE)) {
            deployers.add(new ComposeDeployer());
            monitors.add(new ComposeMonitor());
        }
        this.workloadManager = new WorkloadManager(database, new StrategyRegistry<>(deployers));
        this.workloadWatcher = new WorkloadWatcher(database, new StrategyRegistry<>(monitors), watchExecutor,
                configuration.getStopTimeout());
    }

    /**
     * Start watching workloads, then restore the state store so restored workloads are watched too.
     *
     * @throws WorkloadLifecycleException if the watcher cannot subscribe or the store cannot be restored
     */
    public void start() throws WorkloadLifecycleException {
        workloadWatcher.start();
        try {
            database.start();
        } catch (DatabaseException e) {
            workloadWatcher.stop();
            throw new WorkloadLifecycleException("failed to start the agent database", e);
        }
        logger.atInfo().addKeyValue("deviceId", configuration.getDeviceId())
                .addKeyValue("runtimes", configuration.getRuntimes()).log("Device agent started");
    }

    /**
     * Stop the watcher, dump the state store and release the worker threads.
     */
    public void stop() {
        workloadWatcher.stop();
        try {
            database.stop();
        } catch (DatabaseException e) {
            logger.atError().setCause(e).log("Failed to stop the agent database");
        }
        shutdown(eventExecutor);
        shutdown(watchExecutor);
        logger.atInfo().addKeyValue("deviceId", configuration.getDeviceId()).log("Device agent stopped");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
