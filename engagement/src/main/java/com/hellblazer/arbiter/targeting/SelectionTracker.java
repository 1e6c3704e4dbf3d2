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
package com.hellblazer.arbiter.targeting;

import com.hellblazer.arbiter.actor.Actor;
import com.hellblazer.arbiter.actor.ActorChangeListener;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.ServerClock;
import com.hellblazer.arbiter.event.EngagementEvent;
import com.hellblazer.arbiter.event.EngagementEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Per-viewer current selection. Selection is bookkeeping only: it never refreshes engagement.
 * <p>
 * Registered as an {@link ActorChangeListener}, the tracker drops selections whose target despawned and
 * attack-driven selections whose target died. Passive selections of a corpse survive so it can still be looted
 * or inspected.
 *
 * @author hal.hildebrand
 */
public class SelectionTracker implements ActorChangeListener {
    private static final Logger log = LoggerFactory.getLogger(SelectionTracker.class);

    private final Map<ActorId, Selection> selections = new ConcurrentHashMap<>();
    private final EngagementEventBus      events;
    private final ServerClock             clock;

    public SelectionTracker(EngagementEventBus events, ServerClock clock) {
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Replace the viewer's selection. Re-selecting the same target with the same kind publishes nothing.
     */
    public Selection select(ActorId viewer, ActorId target, SelectionKind kind) {
        Objects.requireNonNull(viewer, "viewer");
        var selection = new Selection(target, kind);
        var previous = selections.put(viewer, selection);
        if (!selection.equals(previous)) {
            log.debug("{} selected {} ({})", viewer, target, kind);
            events.publish(new EngagementEvent.SelectionChanged(viewer, previous, selection, clock.now()));
        }
        return selection;
    }

    /**
     * Report a refused selection or attack intent to the requester.
     */
    public void denied(ActorId viewer, ActorId target, DenyReason reason) {
        Objects.requireNonNull(viewer, "viewer");
        log.debug("{} denied targeting {}: {}", viewer, target, reason);
        events.publish(new EngagementEvent.TargetIntentDenied(viewer, target, reason, clock.now()));
    }

    public Optional<Selection> current(ActorId viewer) {
        return viewer == null ? Optional.empty() : Optional.ofNullable(selections.get(viewer));
    }

    /**
     * Clear the viewer's selection whatever its kind.
     *
     * @return true if a selection was removed
     */
    public boolean clear(ActorId viewer) {
        var previous = selections.remove(viewer);
        if (previous == null) {
            return false;
        }
        events.publish(new EngagementEvent.SelectionChanged(viewer, previous, null, clock.now()));
        return true;
    }

    /**
     * Clear the viewer's selection only if it was attack-driven.
     *
     * @return true if a selection was removed
     */
    public boolean clearAttackDriven(ActorId viewer) {
        var previous = selections.get(viewer);
        if (previous == null || !previous.isAttackDriven() || !selections.remove(viewer, previous)) {
            return false;
        }
        events.publish(new EngagementEvent.SelectionChanged(viewer, previous, null, clock.now()));
        return true;
    }

    /**
     * Viewers whose current selection points at the target
     */
    public List<ActorId> selectorsOf(ActorId target) {
        return selections.entrySet()
                         .stream()
                         .filter(e -> e.getValue().targetId().equals(target))
                         .map(Map.Entry::getKey)
                         .collect(Collectors.toList());
    }

    public int size() {
        return selections.size();
    }

    @Override
    public void onActorDespawned(Actor actor) {
        selections.remove(actor.id());
        for (var viewer : selectorsOf(actor.id())) {
            clear(viewer);
        }
    }

    @Override
    public void onActorDied(Actor actor) {
        for (var viewer : selectorsOf(actor.id())) {
            clearAttackDriven(viewer);
        }
    }
}
