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
package com.hellblazer.arbiter.actor;

import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.ActorIdGenerator;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.faction.FactionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Authoritative per-actor identity and state for one world.
 * <p>
 * Mutations are expected to arrive from the world's single writer; reads may come from any thread. Every mutation
 * replaces the actor's {@link Actor} record, so readers never observe a partially applied change.
 * <p>
 * Death and revival are owned by external pipelines; the registry only records the outcome and notifies
 * {@link ActorChangeListener}s.
 *
 * @author hal.hildebrand
 */
public class ActorRegistry implements ActorLookup {
    private static final Logger log = LoggerFactory.getLogger(ActorRegistry.class);

    private final Map<ActorId, Actor>          actors;
    private final ActorIdGenerator             idGenerator;
    private final List<ActorChangeListener>    listeners;

    public ActorRegistry() {
        this(new ActorIdGenerator());
    }

    public ActorRegistry(ActorIdGenerator idGenerator) {
        this.actors = new ConcurrentHashMap<>();
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID generator cannot be null");
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public void addListener(ActorChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ActorChangeListener listener) {
        listeners.remove(listener);
    }

    // ===== Lifecycle =====

    /**
     * Spawn a living actor with no controller.
     */
    public Actor spawn(ActorType type, FactionId faction, RegionId region) {
        return insert(Actor.spawned(idGenerator.generateID(), type, faction, region));
    }

    /**
     * Spawn a summon or pet linked to a living controller.
     */
    public Actor spawnControlled(ActorType type, FactionId faction, RegionId region, ActorId controllerId) {
        requireKnown(controllerId);
        var actor = Actor.spawned(idGenerator.generateID(), type, faction, region).withController(controllerId);
        return insert(actor);
    }

    /**
     * Remove an actor. Controller links pointing at it are cleared.
     *
     * @return the last snapshot, or empty if the actor was unknown
     */
    public Optional<Actor> despawn(ActorId id) {
        var removed = actors.remove(id);
        if (removed == null) {
            return Optional.empty();
        }
        for (var actor : actors.values()) {
            if (id.equals(actor.controllerId())) {
                actors.computeIfPresent(actor.id(), (k, a) -> a.withController(null));
            }
        }
        log.debug("Despawned {}", removed);
        notifyListeners(l -> l.onActorDespawned(removed));
        return Optional.of(removed);
    }

    /**
     * Record a death decided by the death pipeline. Idempotent.
     */
    public Actor kill(ActorId id) {
        var before = requireKnown(id);
        if (!before.alive()) {
            return before;
        }
        var after = update(id, a -> a.withAlive(false));
        log.debug("Killed {}", after);
        notifyListeners(l -> l.onActorDied(after));
        return after;
    }

    /**
     * Record a resurrection decided by the respawn pipeline. Clears law flags. Idempotent.
     */
    public Actor revive(ActorId id) {
        var before = requireKnown(id);
        if (before.alive()) {
            return before;
        }
        var after = update(id, a -> a.withAlive(true).withLawFlags(Set.of()));
        log.debug("Revived {}", after);
        notifyListeners(l -> l.onActorRevived(after));
        return after;
    }

    /**
     * Move an actor to a different region.
     */
    public Actor moveToRegion(ActorId id, RegionId region) {
        Objects.requireNonNull(region, "region");
        var before = requireKnown(id);
        if (before.region().equals(region)) {
            return before;
        }
        var after = update(id, a -> a.withRegion(region));
        log.debug("{} moved from {} to {}", id, before.region(), region);
        notifyListeners(l -> l.onActorRegionChanged(after, before.region(), region));
        return after;
    }

    // ===== State mutation =====

    public Actor setFaction(ActorId id, FactionId faction) {
        Objects.requireNonNull(faction, "faction");
        requireKnown(id);
        return update(id, a -> a.withFaction(faction));
    }

    public Actor setLawFlags(ActorId id, Set<LawFlag> flags) {
        requireKnown(id);
        return update(id, a -> a.withLawFlags(flags));
    }

    public Actor setPvpEnabled(ActorId id, boolean enabled) {
        requireKnown(id);
        return update(id, a -> a.withPvpEnabled(enabled));
    }

    public Actor setController(ActorId id, ActorId controllerId) {
        requireKnown(id);
        if (controllerId != null) {
            requireKnown(controllerId);
        }
        return update(id, a -> a.withController(controllerId));
    }

    public Actor updateVitals(ActorId id, ActorVitals vitals) {
        Objects.requireNonNull(vitals, "vitals");
        requireKnown(id);
        return update(id, a -> a.withVitals(vitals));
    }

    // ===== Retrieval =====

    @Override
    public Actor get(ActorId id) {
        return id == null ? null : actors.get(id);
    }

    public Optional<Actor> find(ActorId id) {
        return Optional.ofNullable(get(id));
    }

    public boolean contains(ActorId id) {
        return id != null && actors.containsKey(id);
    }

    public Collection<Actor> all() {
        return List.copyOf(actors.values());
    }

    public List<Actor> actorsIn(RegionId region) {
        return actors.values().stream().filter(a -> a.region().equals(region)).collect(Collectors.toList());
    }

    public int size() {
        return actors.size();
    }

    // ===== Internals =====

    private Actor insert(Actor actor) {
        actors.put(actor.id(), actor);
        log.debug("Spawned {}", actor);
        notifyListeners(l -> l.onActorSpawned(actor));
        return actor;
    }

    private Actor update(ActorId id, UnaryOperator<Actor> change) {
        var updated = actors.computeIfPresent(id, (k, a) -> change.apply(a));
        if (updated == null) {
            throw new IllegalArgumentException("Unknown actor: " + id);
        }
        return updated;
    }

    private Actor requireKnown(ActorId id) {
        Objects.requireNonNull(id, "id");
        var actor = actors.get(id);
        if (actor == null) {
            throw new IllegalArgumentException("Unknown actor: " + id);
        }
        return actor;
    }

    private void notifyListeners(Consumer<ActorChangeListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Actor change listener {} failed", listener, e);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("ActorRegistry{actors=%d, listeners=%d}", actors.size(), listeners.size());
    }
}
