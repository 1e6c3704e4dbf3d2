/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbiter.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbiter.scene;

import com.hellblazer.arbiter.common.RegionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Supplies the immutable rule snapshot of every loaded region and enforces the exactly-one-provider contract.
 * <p>
 * Registration rules:
 * <ul>
 *   <li>A region with exactly one registered provider exposes that provider's snapshot</li>
 *   <li>A region with zero providers, or a second provider registered on top of the first, is misconfigured: the
 *   registration is refused with {@link SceneRuleConfigurationException} and the region falls back to
 *   {@link SceneRuleSnapshot#restrictive()} until it is released</li>
 * </ul>
 * Listeners are told about every change of effective rules so that engagement can apply the scene override.
 * <p>
 * Usage:
 * <pre>
 * gate.bind(region, providersFoundInScene);   // on region load
 * var rules = gate.snapshotFor(actor.region());
 * gate.release(region);                       // on region unload
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SceneRuleGate {
    private static final Logger log = LoggerFactory.getLogger(SceneRuleGate.class);

    private final Map<RegionId, SceneRuleSnapshot> active;
    private final Map<RegionId, Integer>           misconfigured;
    private final List<SceneRuleListener>          listeners;

    public SceneRuleGate() {
        this.active = new ConcurrentHashMap<>();
        this.misconfigured = new ConcurrentHashMap<>();
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public void addListener(SceneRuleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SceneRuleListener listener) {
        listeners.remove(listener);
    }

    /**
     * Validate the providers discovered in a freshly loaded region and activate the single one.
     *
     * @param region    region being loaded
     * @param providers every rule provider found in the region
     * @return the activated snapshot
     * @throws SceneRuleConfigurationException if there is not exactly one valid provider
     */
    public SceneRuleSnapshot bind(RegionId region, Collection<SceneRuleSnapshot> providers) {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(providers, "providers");
        if (providers.size() != 1) {
            throw misconfigured(region, providers.size());
        }
        return register(region, providers.iterator().next());
    }

    /**
     * Register a single provider's snapshot for a region.
     *
     * @throws SceneRuleConfigurationException if the region already has a provider, or the snapshot is not valid
     */
    public SceneRuleSnapshot register(RegionId region, SceneRuleSnapshot rules) {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(rules, "rules");
        var previousError = misconfigured.get(region);
        if (previousError != null) {
            throw misconfigured(region, previousError + 1);
        }
        if (active.containsKey(region)) {
            throw misconfigured(region, 2);
        }
        if (!rules.valid()) {
            throw misconfigured(region, 0);
        }
        active.put(region, rules);
        log.info("Registered scene rules for region '{}': {}", region, rules);
        notifyListeners(region, rules);
        return rules;
    }

    /**
     * Forget a region (unloaded). Clears any misconfiguration so the region may be bound again.
     */
    public void release(RegionId region) {
        misconfigured.remove(region);
        if (active.remove(region) != null) {
            log.info("Released scene rules for region '{}'", region);
            notifyListeners(region, SceneRuleSnapshot.restrictive());
        }
    }

    /**
     * The effective rules of a region: its registered snapshot, or the restrictive sentinel.
     */
    public SceneRuleSnapshot snapshotFor(RegionId region) {
        if (region == null) {
            return SceneRuleSnapshot.restrictive();
        }
        return active.getOrDefault(region, SceneRuleSnapshot.restrictive());
    }

    public boolean isActive(RegionId region) {
        return region != null && active.containsKey(region);
    }

    private SceneRuleConfigurationException misconfigured(RegionId region, int providerCount) {
        var error = new SceneRuleConfigurationException(region, providerCount);
        misconfigured.put(region, providerCount);
        log.error("CRITICAL: {}", error.getMessage());
        var previous = active.remove(region);
        if (previous != null) {
            notifyListeners(region, SceneRuleSnapshot.restrictive());
        }
        return error;
    }

    private void notifyListeners(RegionId region, SceneRuleSnapshot rules) {
        for (var listener : listeners) {
            try {
                listener.onRulesActivated(region, rules);
            } catch (RuntimeException e) {
                log.warn("Scene rule listener {} failed for region '{}'", listener, region, e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("SceneRuleGate{active=%d, misconfigured=%d}", active.size(), misconfigured.size());
    }
}
