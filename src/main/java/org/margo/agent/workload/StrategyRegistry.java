/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.workload;

import org.margo.agent.deployment.exceptions.UnsupportedProfileTypeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable profile type to strategy map, built once at construction.
 *
 * @param <T> strategy kind
 */
public class StrategyRegistry<T extends ProfileTypeStrategy> {
    private final Map<String, T> strategies;

    /**
     * Constructor.
     *
     * @param strategies strategies to register
     * @throws IllegalArgumentException if two strategies handle the same profile type
     */
    public StrategyRegistry(Collection<? extends T> strategies) {
        Map<String, T> byType = new HashMap<>();
        for (T strategy : strategies) {
            T previous = byType.putIfAbsent(strategy.getType(), strategy);
            if (previous != null) {
                throw new IllegalArgumentException(
                        String.format("duplicate strategy for deployment profile type %s", strategy.getType()));
            }
        }
        this.strategies = Collections.unmodifiableMap(byType);
    }

    /**
     * Look up the strategy for a profile type.
     *
     * @param type deployment profile type
     * @return the registered strategy
     * @throws UnsupportedProfileTypeException if no strategy handles the type
     */
    public T get(String type) throws UnsupportedProfileTypeException {
        T strategy = type == null ? null : strategies.get(type);
        if (strategy == null) {
            throw new UnsupportedProfileTypeException(type, getAvailableTypes());
        }
        return strategy;
    }

    /**
     * Registered profile types in alphabetical order.
     *
     * @return profile types
     */
    public List<String> getAvailableTypes() {
        List<String> types = new ArrayList<>(strategies.keySet());
        Collections.sort(types);
        return types;
    }
}
