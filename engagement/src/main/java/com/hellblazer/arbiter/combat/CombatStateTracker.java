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
package com.hellblazer.arbiter.combat;

import com.hellblazer.arbiter.actor.Actor;
import com.hellblazer.arbiter.actor.ActorChangeListener;
import com.hellblazer.arbiter.actor.ActorRegistry;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.common.ServerClock;
import com.hellblazer.arbiter.config.EngagementConfig;
import com.hellblazer.arbiter.event.EngagementEvent.CombatStateChanged;
import com.hellblazer.arbiter.event.EngagementEventBus;
import com.hellblazer.arbiter.external.CombatCancelable;
import com.hellblazer.arbiter.scene.SceneRuleGate;
import com.hellblazer.arbiter.scene.SceneRuleListener;
import com.hellblazer.arbiter.scene.SceneRuleSnapshot;
import com.hellblazer.arbiter.targeting.SelectionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single source of truth for "is this actor in combat".
 * <p>
 * Per actor it keeps an {@link EngagementState}; the derived state is IN_COMBAT while the attacker-side pursuit
 * flag is set or the disengage window is still open, PEACEFUL otherwise, and DEAD overrides both. Transitions:
 * <ul>
 *   <li>validated hostile intent: attacker only, sets the pursuit flag and extends the window</li>
 *   <li>hostile resolution: extends the window of attacker and victim, pursuit flag untouched</li>
 *   <li>engagement ended: clears the pursuit flag, the window expires on its own</li>
 *   <li>scene override: a region without combat forces everyone in it to PEACEFUL with a closed window</li>
 * </ul>
 * The window only ever grows through {@code max(until, now + disengage)}. Dead and unknown actors ignore refreshes.
 * <p>
 * Leaving combat cancels the scheduled auto-attack, drops an attack-driven selection and forgets the aggression
 * target. Movement is never touched. Every derived state change is published as {@link CombatStateChanged}.
 * <p>
 * All mutators must be called from the world authority thread. {@link #getCombatState} and
 * {@link #remainingSeconds} may be read from anywhere.
 *
 * @author hal.hildebrand
 */
public class CombatStateTracker implements ActorChangeListener, SceneRuleListener {
    private static final Logger log = LoggerFactory.getLogger(CombatStateTracker.class);

    private final Map<ActorId, EngagementState> states    = new ConcurrentHashMap<>();
    private final Map<ActorId, CombatState>     published = new ConcurrentHashMap<>();
    private final ActorRegistry                 actors;
    private final SceneRuleGate                 scenes;
    private final SelectionTracker              selections;
    private final CombatCancelable              cancelable;
    private final EngagementEventBus            events;
    private final ServerClock                   clock;
    private final EngagementConfig              config;

    public CombatStateTracker(ActorRegistry actors, SceneRuleGate scenes, SelectionTracker selections,
                              CombatCancelable cancelable, EngagementEventBus events, ServerClock clock,
                              EngagementConfig config) {
        this.actors = Objects.requireNonNull(actors, "actors");
        this.scenes = Objects.requireNonNull(scenes, "scenes");
        this.selections = Objects.requireNonNull(selections, "selections");
        this.cancelable = cancelable == null ? CombatCancelable.NONE : cancelable;
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.config = Objects.requireNonNull(config, "config");
    }

    // ===== Combat execution callbacks =====

    public void onHostileIntentValidated(ActorId attacker) {
        onHostileIntentValidated(attacker, null);
    }

    /**
     * An attack or harmful cast was allowed. Sets the attacker's pursuit flag and extends its window.
     */
    public void onHostileIntentValidated(ActorId attacker, ActorId target) {
        if (!canRefresh(attacker)) {
            return;
        }
        var until = clock.now() + config.disengageSeconds();
        states.merge(attacker, EngagementState.IDLE.refreshedUntil(until).engaging(target),
                     (old, fresh) -> old.refreshedUntil(until).engaging(target != null ? target
                                                                                        : old.engagedTargetId()));
        evaluate(attacker);
    }

    /**
     * A scheduled hostile action resolved with a hit, miss or damage application. Extends both windows.
     */
    public void onHostileResolution(ActorId attacker, ActorId victim) {
        var until = clock.now() + config.disengageSeconds();
        for (var id : new ActorId[] { attacker, victim }) {
            if (canRefresh(id)) {
                states.merge(id, EngagementState.IDLE.refreshedUntil(until), (old, fresh) -> old.refreshedUntil(until));
                evaluate(id);
            }
        }
    }

    /**
     * The attacker's engagement ended: explicit cancel, or its target became dead, despawned or illegal.
     */
    public void onEngagementEnded(ActorId attacker) {
        var updated = states.computeIfPresent(attacker, (id, s) -> s.disengaged());
        if (updated != null) {
            log.debug("{} engagement ended", attacker);
            evaluate(attacker);
        }
    }

    /**
     * The actor was selected as a target. Only extends its window when targeting is configured to do so.
     */
    public void onTargeted(ActorId target) {
        if (!config.targetedExtendsEngagement() || !canRefresh(target)) {
            return;
        }
        var until = clock.now() + config.disengageSeconds();
        states.merge(target, EngagementState.IDLE.refreshedUntil(until), (old, fresh) -> old.refreshedUntil(until));
        evaluate(target);
    }

    /**
     * End every engagement aimed at the target.
     *
     * @return the attackers whose engagement was ended
     */
    public List<ActorId> endEngagementsTargeting(ActorId target) {
        var ended = new ArrayList<ActorId>();
        for (var entry : states.entrySet()) {
            var state = entry.getValue();
            if (state.hasActiveHostileEngagement() && target.equals(state.engagedTargetId())) {
                ended.add(entry.getKey());
            }
        }
        for (var attacker : ended) {
            onEngagementEnded(attacker);
        }
        return ended;
    }

    /**
     * Attacker to target for every active engagement with a known target
     */
    public Map<ActorId, ActorId> activeEngagements() {
        var engagements = new HashMap<ActorId, ActorId>();
        states.forEach((attacker, state) -> {
            if (state.hasActiveHostileEngagement() && state.engagedTargetId() != null) {
                engagements.put(attacker, state.engagedTargetId());
            }
        });
        return engagements;
    }

    // ===== Scene override =====

    /**
     * Close the actor's window immediately, cancel pending attacks and drop attack-driven selection.
     */
    public void forcePeaceful(ActorId id) {
        var actor = actors.get(id);
        if (actor == null || !actor.alive()) {
            return;
        }
        var previous = states.put(id, EngagementState.IDLE);
        if (previous != null && !previous.equals(EngagementState.IDLE)) {
            log.debug("{} forced peaceful in {}", id, actor.region());
        }
        if (evaluate(id) == null) {
            cancelable.cancelScheduledAttack(id);
            selections.clearAttackDriven(id);
        }
    }

    /**
     * Apply the scene override for an actor arriving in a region.
     */
    public void onRegionEntered(ActorId id, RegionId region) {
        if (!scenes.snapshotFor(region).allowsCombat()) {
            forcePeaceful(id);
        }
    }

    @Override
    public void onRulesActivated(RegionId region, SceneRuleSnapshot rules) {
        if (rules.allowsCombat()) {
            return;
        }
        for (var actor : actors.actorsIn(region)) {
            forcePeaceful(actor.id());
        }
    }

    // ===== Sweep =====

    /**
     * Periodic pass over every tracked actor. An engagement whose window has closed is ended, and every derived
     * state change is applied and published.
     *
     * @return the state changes applied by this pass
     */
    public List<CombatStateChanged> sweep() {
        var now = clock.now();
        var changes = new ArrayList<CombatStateChanged>();
        for (var id : List.copyOf(states.keySet())) {
            states.computeIfPresent(id, (k, s) -> s.hasActiveHostileEngagement() && now >= s.combatUntilTime()
                                                  ? s.disengaged() : s);
            var change = evaluate(id);
            if (change != null) {
                changes.add(change);
            }
        }
        return changes;
    }

    // ===== Queries =====

    public CombatState getCombatState(ActorId id) {
        var actor = actors.get(id);
        if (actor == null) {
            return CombatState.PEACEFUL;
        }
        if (!actor.alive()) {
            return CombatState.DEAD;
        }
        return states.getOrDefault(id, EngagementState.IDLE).isInCombat(clock.now()) ? CombatState.IN_COMBAT
                                                                                     : CombatState.PEACEFUL;
    }

    /**
     * Seconds left in the disengage window, for display only
     */
    public double remainingSeconds(ActorId id) {
        return states.getOrDefault(id, EngagementState.IDLE).remaining(clock.now());
    }

    public EngagementState engagement(ActorId id) {
        return states.getOrDefault(id, EngagementState.IDLE);
    }

    public boolean isInCombat(ActorId id) {
        return getCombatState(id) == CombatState.IN_COMBAT;
    }

    // ===== Actor lifecycle =====

    @Override
    public void onActorDied(Actor actor) {
        var id = actor.id();
        states.remove(id);
        cancelable.cancelScheduledAttack(id);
        selections.clearAttackDriven(id);
        endEngagementsTargeting(id);
        evaluate(id);
    }

    @Override
    public void onActorRevived(Actor actor) {
        states.remove(actor.id());
        evaluate(actor.id());
    }

    @Override
    public void onActorDespawned(Actor actor) {
        var id = actor.id();
        states.remove(id);
        published.remove(id);
        cancelable.cancelScheduledAttack(id);
        endEngagementsTargeting(id);
    }

    @Override
    public void onActorRegionChanged(Actor actor, RegionId from, RegionId to) {
        onRegionEntered(actor.id(), to);
    }

    // ===== Internals =====

    private boolean canRefresh(ActorId id) {
        var actor = actors.get(id);
        if (actor == null || !actor.alive()) {
            log.debug("Ignoring engagement refresh of {}: {}", id, actor == null ? "unknown" : "dead");
            return false;
        }
        if (!scenes.snapshotFor(actor.region()).allowsCombat()) {
            log.debug("Ignoring engagement refresh of {}: {} disallows combat", id, actor.region());
            return false;
        }
        return true;
    }

    private CombatStateChanged evaluate(ActorId id) {
        var current = getCombatState(id);
        var previous = published.getOrDefault(id, CombatState.PEACEFUL);
        if (current == previous) {
            return null;
        }
        published.put(id, current);
        if (previous == CombatState.IN_COMBAT && current == CombatState.PEACEFUL) {
            leaveCombat(id);
        }
        var change = new CombatStateChanged(id, previous, current, clock.now());
        log.debug("{} {} -> {}", id, previous, current);
        events.publish(change);
        return change;
    }

    private void leaveCombat(ActorId id) {
        cancelable.cancelScheduledAttack(id);
        selections.clearAttackDriven(id);
        states.computeIfPresent(id, (k, s) -> s.hasActiveHostileEngagement() ? s : s.disengaged());
    }

    @Override
    public String toString() {
        return String.format("CombatStateTracker{tracked=%d}", states.size());
    }
}
