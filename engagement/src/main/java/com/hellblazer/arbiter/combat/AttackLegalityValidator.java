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
import com.hellblazer.arbiter.actor.ActorLookup;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.external.RangeGate;
import com.hellblazer.arbiter.external.StatusSource;
import com.hellblazer.arbiter.external.VisibilitySource;
import com.hellblazer.arbiter.scene.SceneRuleFlag;
import com.hellblazer.arbiter.scene.SceneRuleGate;
import com.hellblazer.arbiter.scene.SceneRuleSnapshot;
import com.hellblazer.arbiter.targeting.DenyReason;
import com.hellblazer.arbiter.targeting.DispositionQuery;
import com.hellblazer.arbiter.targeting.TargetingResolver;

import java.util.Objects;

/**
 * Single allow/deny decision for a hostile intent. A short-circuit chain; the first failing gate supplies the
 * reason:
 * <ol>
 *   <li>both actors known</li>
 *   <li>attacker alive</li>
 *   <li>target alive</li>
 *   <li>attacker's region permits combat</li>
 *   <li>attacker's region permits damage</li>
 *   <li>region permits PvP, when both are players</li>
 *   <li>same region, in range, line of sight</li>
 *   <li>attacker not status gated for the action kind</li>
 *   <li>attacker perceives target</li>
 *   <li>disposition is HOSTILE</li>
 * </ol>
 * Never mutates actor or engagement state, so it may run on any request thread.
 *
 * @author hal.hildebrand
 */
public class AttackLegalityValidator {

    private final ActorLookup       actors;
    private final SceneRuleGate     scenes;
    private final TargetingResolver targeting;
    private final RangeGate         range;
    private final StatusSource      status;
    private final VisibilitySource  visibility;

    public AttackLegalityValidator(ActorLookup actors, SceneRuleGate scenes, TargetingResolver targeting,
                                   RangeGate range, StatusSource status, VisibilitySource visibility) {
        this.actors = Objects.requireNonNull(actors, "actors");
        this.scenes = Objects.requireNonNull(scenes, "scenes");
        this.targeting = Objects.requireNonNull(targeting, "targeting");
        this.range = Objects.requireNonNull(range, "range");
        this.status = Objects.requireNonNull(status, "status");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public AttackResult canAttack(AttackQuery query) {
        Objects.requireNonNull(query, "query");
        var attacker = actors.get(query.attackerId());
        var target = actors.get(query.targetId());
        if (attacker == null || target == null) {
            return AttackResult.denied(DenyReason.UNKNOWN_ACTOR);
        }
        if (!attacker.alive()) {
            return AttackResult.denied(DenyReason.ATTACKER_DEAD);
        }
        if (!target.alive()) {
            return AttackResult.denied(DenyReason.TARGET_DEAD);
        }
        var scene = scenes.snapshotFor(attacker.region());
        var sceneDenial = checkScene(attacker, target, scene);
        if (sceneDenial != null) {
            return sceneDenial;
        }
        if (!attacker.sameRegion(target) || !range.isSatisfied(attacker.id(), target.id(), query.actionKind())) {
            return AttackResult.denied(DenyReason.RANGE_OR_LINE_OF_SIGHT);
        }
        if (status.isActionBlocked(attacker.id(), query.actionKind())) {
            return AttackResult.denied(DenyReason.STATUS_GATED);
        }
        return checkHostility(attacker, target, scene);
    }

    /**
     * Whether an existing engagement may continue. Range and status gates are skipped so that a pursuer may chase a
     * fleeing target and a stunned attacker keeps its engagement; every other gate of {@link #canAttack} applies.
     * A target that has left the attacker's region ends the engagement.
     */
    public AttackResult checkEngagement(ActorId attackerId, ActorId targetId) {
        var attacker = actors.get(attackerId);
        var target = actors.get(targetId);
        if (attacker == null || target == null) {
            return AttackResult.denied(DenyReason.UNKNOWN_ACTOR);
        }
        if (!attacker.alive()) {
            return AttackResult.denied(DenyReason.ATTACKER_DEAD);
        }
        if (!target.alive()) {
            return AttackResult.denied(DenyReason.TARGET_DEAD);
        }
        var scene = scenes.snapshotFor(attacker.region());
        var sceneDenial = checkScene(attacker, target, scene);
        if (sceneDenial != null) {
            return sceneDenial;
        }
        if (!attacker.sameRegion(target)) {
            return AttackResult.denied(DenyReason.RANGE_OR_LINE_OF_SIGHT);
        }
        return checkHostility(attacker, target, scene);
    }

    private AttackResult checkScene(Actor attacker, Actor target, SceneRuleSnapshot scene) {
        if (!scene.allows(SceneRuleFlag.COMBAT_ALLOWED)) {
            return AttackResult.denied(DenyReason.REGION_DISALLOWS_COMBAT);
        }
        if (!scene.allows(SceneRuleFlag.DAMAGE_ALLOWED)) {
            return AttackResult.denied(DenyReason.REGION_DISALLOWS_DAMAGE);
        }
        if (attacker.isPlayer() && target.isPlayer() && !scene.allows(SceneRuleFlag.PVP_ALLOWED)) {
            return AttackResult.denied(DenyReason.PVP_NOT_ALLOWED);
        }
        return null;
    }

    private AttackResult checkHostility(Actor attacker, Actor target, SceneRuleSnapshot scene) {
        if (!visibility.canPerceive(attacker.id(), target.id())) {
            return AttackResult.denied(DenyReason.TARGET_NOT_PERCEIVABLE);
        }
        var disposition = targeting.resolve(new DispositionQuery(attacker, target, scene, true, true, true));
        return disposition.isHostile() ? AttackResult.ALLOWED : AttackResult.denied(DenyReason.NOT_HOSTILE);
    }
}
