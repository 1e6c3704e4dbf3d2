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
import com.hellblazer.arbiter.actor.ActorLookup;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.external.VisibilitySource;
import com.hellblazer.arbiter.faction.FactionRelation;
import com.hellblazer.arbiter.faction.FactionRelationService;
import com.hellblazer.arbiter.scene.SceneRuleFlag;
import com.hellblazer.arbiter.scene.SceneRuleGate;

import java.util.Objects;

/**
 * Two-phase targeting evaluation: eligibility, then disposition.
 * <p>
 * Disposition order is fixed:
 * <ol>
 *   <li>identity: a viewer looking at itself is {@link Disposition#SELF}</li>
 *   <li>eligibility: any failure is {@link Disposition#INVALID} carrying the deny reason</li>
 *   <li>base relation from {@link FactionRelationService}</li>
 *   <li>scene override: a region without hostile actors downgrades HOSTILE to NEUTRAL</li>
 *   <li>PvP override: between two players in a region without PvP, HOSTILE becomes NEUTRAL</li>
 *   <li>relation mapped to disposition</li>
 * </ol>
 * Downgrades never produce FRIENDLY. The resolver holds no mutable state and is safe to call from any thread.
 *
 * @author hal.hildebrand
 */
public class TargetingResolver {

    private final FactionRelationService relations;
    private final ActorLookup            actors;
    private final SceneRuleGate          scenes;
    private final VisibilitySource       visibility;

    public TargetingResolver(FactionRelationService relations, ActorLookup actors, SceneRuleGate scenes,
                             VisibilitySource visibility) {
        this.relations = Objects.requireNonNull(relations, "relations");
        this.actors = Objects.requireNonNull(actors, "actors");
        this.scenes = Objects.requireNonNull(scenes, "scenes");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    /**
     * Eligibility phase. The first failing check wins.
     */
    public Eligibility checkEligibility(DispositionQuery query) {
        Objects.requireNonNull(query, "query");
        var viewer = query.viewer();
        var target = query.target();
        if (viewer == null || target == null) {
            return Eligibility.denied(DenyReason.UNKNOWN_ACTOR);
        }
        if (viewer.id().equals(target.id())) {
            return Eligibility.granted();
        }
        if (!target.alive()) {
            return Eligibility.denied(DenyReason.TARGET_DEAD);
        }
        if (!query.viewerCanPerceiveTarget()) {
            return Eligibility.denied(DenyReason.TARGET_NOT_PERCEIVABLE);
        }
        if (query.requireRangeGate() && !query.inRange()) {
            return Eligibility.denied(DenyReason.RANGE_OR_LINE_OF_SIGHT);
        }
        return Eligibility.granted();
    }

    /**
     * Disposition phase over fully assembled inputs.
     */
    public DispositionResult resolve(DispositionQuery query) {
        Objects.requireNonNull(query, "query");
        var viewer = query.viewer();
        var target = query.target();
        if (viewer != null && target != null && viewer.id().equals(target.id())) {
            return DispositionResult.self();
        }

        var eligibility = checkEligibility(query);
        if (!eligibility.eligible()) {
            return DispositionResult.invalid(eligibility.reason());
        }

        var relation = relations.relation(viewer, target);
        var scene = query.scene();

        if (relation == FactionRelation.HOSTILE && !scene.allows(SceneRuleFlag.HOSTILE_ACTORS_ALLOWED)) {
            relation = FactionRelation.NEUTRAL;
        }
        if (relation == FactionRelation.HOSTILE && viewer.isPlayer() && target.isPlayer()
            && !scene.allows(SceneRuleFlag.PVP_ALLOWED)) {
            relation = FactionRelation.NEUTRAL;
        }
        return DispositionResult.of(Disposition.of(relation));
    }

    /**
     * Resolve by id, using the viewer's region rules and the visibility source. No range gate applies.
     */
    public DispositionResult resolveDisposition(ActorId viewerId, ActorId targetId) {
        return resolve(queryFor(viewerId, targetId));
    }

    /**
     * Resolve by id with a range gate answer already computed by the caller.
     */
    public DispositionResult resolveDisposition(ActorId viewerId, ActorId targetId, boolean inRange) {
        return resolve(queryFor(viewerId, targetId).withRangeGate(inRange));
    }

    /**
     * Assemble a query from authoritative state. An actor in another region is never perceivable.
     */
    public DispositionQuery queryFor(ActorId viewerId, ActorId targetId) {
        var viewer = actors.get(viewerId);
        var target = actors.get(targetId);
        if (viewer == null) {
            return DispositionQuery.of(null, target, null, false);
        }
        var scene = scenes.snapshotFor(viewer.region());
        if (target == null) {
            return DispositionQuery.of(viewer, null, scene, false);
        }
        return DispositionQuery.of(viewer, target, scene, canPerceive(viewer, target));
    }

    private boolean canPerceive(Actor viewer, Actor target) {
        if (viewer.id().equals(target.id())) {
            return true;
        }
        return viewer.sameRegion(target) && visibility.canPerceive(viewer.id(), target.id());
    }
}
