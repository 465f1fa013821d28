/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.database;

import com.fasterxml.jackson.core.type.TypeReference;
import org.margo.agent.database.DeploymentDatabaseEvent.EventType;
import org.margo.agent.database.exceptions.DatabaseException;
import org.margo.agent.database.exceptions.DeploymentNotFoundException;
import org.margo.agent.deployment.exceptions.WorkloadException;
import org.margo.agent.deployment.model.AppState;
import org.margo.agent.deployment.model.ComponentStatus;
import org.margo.agent.deployment.model.Deployment;
import org.margo.agent.util.OrderedExecutorService;
import org.margo.agent.util.SerializerFactory;
import org.margo.agent.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.Nullable;

/**
 * Agent state store kept in memory and dumped to {@value #DUMP_FILE_NAME} in the data directory on stop.
 *
 * <p>Change events are delivered on the given executor, strictly in publication order for each subscriber and
 * independently across subscribers. A subscriber that fails or is slow never affects the others or the writer.</p>
 */
public class InMemoryAgentDatabase implements AgentDatabase {
    public static final String DUMP_FILE_NAME = "agent.dump.json";
    private static final String TEMP_FILE_SUFFIX = ".tmp";
    private static final String APP_ID_LOG_KEY = "appId";
    private static final String SUBSCRIBER_ID_LOG_KEY = "subscriberId";
    private static final String EVENT_TYPE_LOG_KEY = "eventType";
    private static final TypeReference<Map<String, Deployment>> DUMP_TYPE =
            new TypeReference<Map<String, Deployment>>() {
            };
    private static final Logger logger = LoggerFactory.getLogger(InMemoryAgentDatabase.class);

    @Nullable
    private final Path dataDir;
    private final OrderedExecutorService eventExecutor;
    private final Object lock = new Object();
    private final Map<String, Deployment> deployments = new HashMap<>();
    private final Map<String, DeploymentDatabaseSubscriber> subscribers = new LinkedHashMap<>();
    private volatile boolean delivering = true;

    /**
     * Constructor.
     *
     * @param dataDir  directory holding the dump file, null to keep nothing across restarts
     * @param executor executor delivering change events
     */
    public InMemoryAgentDatabase(@Nullable Path dataDir, Executor executor) {
        this.dataDir = dataDir;
        this.eventExecutor = new OrderedExecutorService(executor);
    }

    /**
     * Restore the deployments dumped by a previous run, if any, and announce each of them to the current subscribers
     * as added.
     *
     * @throws DatabaseException if the dump exists but cannot be read
     */
    public void start() throws DatabaseException {
        delivering = true;
        if (dataDir == null) {
            return;
        }
        Path dumpFile = dataDir.resolve(DUMP_FILE_NAME);
        if (!Files.exists(dumpFile)) {
            logger.atDebug().addKeyValue("file", dumpFile).log("No state dump to restore");
            return;
        }
        Map<String, Deployment> restored;
        try {
            restored = SerializerFactory.getFailSafeJsonObjectMapper().readValue(dumpFile.toFile(), DUMP_TYPE);
        } catch (IOException e) {
            throw new DatabaseException(String.format("failed to restore state dump %s", dumpFile), e);
        }
        synchronized (lock) {
            deployments.clear();
            if (restored != null) {
                restored.forEach((appId, deployment) -> {
                    deployment.setAppId(appId);
                    if (deployment.getComponentStatus() == null) {
                        deployment.setComponentStatus(new HashMap<>());
                    }
                    deployments.put(appId, deployment);
                    publish(EventType.DEPLOYMENT_ADDED, deployment);
                });
            }
        }
        logger.atInfo().addKeyValue("file", dumpFile).addKeyValue("deployments", restored == null ? 0 : restored.size())
                .log("Restored state dump");
    }

    /**
     * Stop delivering events and dump the deployments. The dump is written to a temporary file first and then moved
     * over the previous dump, so a crash never leaves a partial dump behind.
     *
     * @throws DatabaseException if the dump cannot be written
     */
    public void stop() throws DatabaseException {
        delivering = false;
        if (dataDir == null) {
            return;
        }
        Map<String, Deployment> snapshot = new LinkedHashMap<>();
        for (Deployment deployment : listDeployments()) {
            snapshot.put(deployment.getAppId(), deployment);
        }
        Path dumpFile = dataDir.resolve(DUMP_FILE_NAME);
        Path tempFile = dataDir.resolve(DUMP_FILE_NAME + TEMP_FILE_SUFFIX);
        try {
            Files.createDirectories(dataDir);
            SerializerFactory.getFailSafeJsonObjectMapper().writerWithDefaultPrettyPrinter()
                    .writeValue(tempFile.toFile(), snapshot);
            try {
                Files.move(tempFile, dumpFile, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, dumpFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DatabaseException(String.format("failed to write state dump %s", dumpFile), e);
        }
        logger.atInfo().addKeyValue("file", dumpFile).addKeyValue("deployments", snapshot.size())
                .log("Wrote state dump");
    }

    /**
     * Record the desired state of a workload. Publishes {@link EventType#DEPLOYMENT_ADDED} for a workload the store
     * did not know, {@link EventType#DEPLOYMENT_CHANGED} otherwise.
     *
     * @param desiredState desired state, keyed by its app id
     * @throws DatabaseException if the app id is missing
     */
    public void upsertDesiredState(AppState desiredState) throws DatabaseException {
        if (desiredState == null || Utils.isEmpty(desiredState.getAppId())) {
            throw new DatabaseException("app ID is required");
        }
        String appId = desiredState.getAppId();
        synchronized (lock) {
            Deployment existing = deployments.get(appId);
            if (existing == null) {
                Deployment deployment = Deployment.builder().appId(appId)
                        .desiredState(desiredState.toBuilder().build()).build();
                deployments.put(appId, deployment);
                publish(EventType.DEPLOYMENT_ADDED, deployment);
            } else {
                existing.setDesiredState(desiredState.toBuilder().build());
                publish(EventType.DEPLOYMENT_CHANGED, existing);
            }
        }
    }

    /**
     * Record the state that was last applied for a workload.
     *
     * @param appId        workload id
     * @param currentState applied state, null to clear it
     * @throws DeploymentNotFoundException if the workload is unknown
     */
    public void setCurrentState(String appId, @Nullable AppState currentState) throws DeploymentNotFoundException {
        synchronized (lock) {
            Deployment existing = find(appId);
            existing.setCurrentState(currentState == null ? null : currentState.toBuilder().build());
            publish(EventType.DEPLOYMENT_CHANGED, existing);
        }
    }

    /**
     * Forget a workload. Publishes {@link EventType#DEPLOYMENT_DELETED} with its last known state.
     *
     * @param appId workload id
     * @throws DeploymentNotFoundException if the workload is unknown
     */
    public void removeDeployment(String appId) throws DeploymentNotFoundException {
        synchronized (lock) {
            Deployment removed = find(appId);
            deployments.remove(appId);
            publish(EventType.DEPLOYMENT_DELETED, removed);
        }
    }

    @Override
    public Deployment getDeployment(String appId) throws DeploymentNotFoundException {
        synchronized (lock) {
            return find(appId).copy();
        }
    }

    /**
     * Snapshot of every deployment, ordered by app id.
     *
     * @return deployment copies
     */
    public List<Deployment> listDeployments() {
        List<Deployment> result = new ArrayList<>();
        synchronized (lock) {
            deployments.values().forEach(d -> result.add(d.copy()));
        }
        result.sort(Comparator.comparing(Deployment::getAppId));
        return result;
    }

    @Override
    public void upsertComponentStatus(String appId, ComponentStatus status) throws DatabaseException {
        if (status == null || Utils.isEmpty(status.getName())) {
            throw new DatabaseException("component name is required");
        }
        synchronized (lock) {
            Deployment existing = find(appId);
            if (existing.getComponentStatus() == null) {
                existing.setComponentStatus(new HashMap<>());
            }
            existing.getComponentStatus().put(status.getName(), status.toBuilder().build());
            publish(EventType.COMPONENT_STATUS_UPDATED, existing);
        }
    }

    @Override
    public void subscribe(DeploymentDatabaseSubscriber subscriber) throws DatabaseException {
        String subscriberId = subscriber.getSubscriberId();
        synchronized (lock) {
            if (subscribers.containsKey(subscriberId)) {
                throw new DatabaseException(String.format("subscriber %s is already registered", subscriberId));
            }
            subscribers.put(subscriberId, subscriber);
        }
        logger.atDebug().addKeyValue(SUBSCRIBER_ID_LOG_KEY, subscriberId).log("Subscriber registered");
    }

    @Override
    public void unsubscribe(String subscriberId) throws DatabaseException {
        synchronized (lock) {
            if (subscribers.remove(subscriberId) == null) {
                throw new DatabaseException(String.format("subscriber %s is not registered", subscriberId));
            }
        }
        logger.atDebug().addKeyValue(SUBSCRIBER_ID_LOG_KEY, subscriberId).log("Subscriber removed");
    }

    private Deployment find(String appId) throws DeploymentNotFoundException {
        Deployment deployment = deployments.get(appId);
        if (deployment == null) {
            throw new DeploymentNotFoundException(appId);
        }
        return deployment;
    }

    // Caller holds the lock, so the order events are queued in is the order changes were made in.
    private void publish(EventType type, Deployment deployment) {
        Instant now = Instant.now();
        for (DeploymentDatabaseSubscriber subscriber : subscribers.values()) {
            DeploymentDatabaseEvent event = new DeploymentDatabaseEvent(type, deployment.copy(), now);
            try {
                eventExecutor.execute(() -> deliver(subscriber, event), subscriber.getSubscriberId());
            } catch (RejectedExecutionException e) {
                logger.atWarn().setCause(e).addKeyValue(SUBSCRIBER_ID_LOG_KEY, subscriber.getSubscriberId())
                        .addKeyValue(EVENT_TYPE_LOG_KEY, type).log("Event executor rejected delivery");
            }
        }
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void deliver(DeploymentDatabaseSubscriber subscriber, DeploymentDatabaseEvent event) {
        if (!delivering) {
            return;
        }
        synchronized (lock) {
            if (subscribers.get(subscriber.getSubscriberId()) != subscriber) {
                return;
            }
        }
        try {
            subscriber.onDatabaseEvent(event);
        } catch (WorkloadException | RuntimeException e) {
            logger.atError().setCause(e).addKeyValue(SUBSCRIBER_ID_LOG_KEY, subscriber.getSubscriberId())
                    .addKeyValue(EVENT_TYPE_LOG_KEY, event.getType())
                    .addKeyValue(APP_ID_LOG_KEY, event.getDeployment().getAppId())
                    .log("Subscriber failed to handle event");
        }
    }

    // visible for tests
    boolean isDeliveryIdle() {
        return eventExecutor.isIdle();
    }
}
