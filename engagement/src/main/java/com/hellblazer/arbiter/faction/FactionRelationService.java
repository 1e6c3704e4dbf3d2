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
package com.hellblazer.arbiter.faction;

import com.hellblazer.arbiter.actor.Actor;
import com.hellblazer.arbiter.actor.ActorLookup;

import java.util.Objects;

/**
 * Pure social relationship rules.
 * <p>
 * Resolution order (fixed):
 * <ol>
 *   <li>Controller inheritance: summons and pets are evaluated through their controller, on both sides</li>
 *   <li>Baseline relation from the {@link FactionRelationMatrix}</li>
 *   <li>Flagged-law override: a law-enforcing viewer treats a flagged player as HOSTILE</li>
 * </ol>
 * Does not know about scenes, range or visibility; those belong to the targeting layer. Holds no mutable state,
 * so it may be called concurrently without synchronization.
 *
 * @author hal.hildebrand
 */
public class FactionRelationService {

    /**
     * Controller chains longer than this are cut off; the last resolved actor stands in.
     */
    public static final int MAX_CONTROLLER_DEPTH = 4;

    private final FactionRelationMatrix matrix;
    private final ActorLookup           actors;

    public FactionRelationService(FactionRelationMatrix matrix, ActorLookup actors) {
        this.matrix = Objects.requireNonNull(matrix, "matrix");
        this.actors = Objects.requireNonNull(actors, "actors");
    }

    /**
     * Determine how the viewer perceives the target socially.
     *
     * @param viewer observing actor
     * @param target observed actor
     * @return FRIENDLY, NEUTRAL or HOSTILE
     */
    public FactionRelation relation(Actor viewer, Actor target) {
        Objects.requireNonNull(viewer, "viewer");
        Objects.requireNonNull(target, "target");

        var effectiveViewer = socialStanding(viewer);
        var effectiveTarget = socialStanding(target);

        var relation = matrix.baseline(effectiveViewer.faction(), effectiveTarget.faction());

        if (effectiveTarget.isPlayer()) {
            for (var flag : effectiveTarget.lawFlags()) {
                if (matrix.enforces(effectiveViewer.faction(), flag)) {
                    return FactionRelation.HOSTILE;
                }
            }
        }
        return relation;
    }

    public boolean isHostile(Actor viewer, Actor target) {
        return relation(viewer, target) == FactionRelation.HOSTILE;
    }

    /**
     * Resolve the actor whose social standing applies to the given actor: the root of its controller chain.
     * Unknown controllers fall back to the last known actor in the chain.
     */
    public Actor socialStanding(Actor actor) {
        var current = actor;
        for (int depth = 0; depth < MAX_CONTROLLER_DEPTH && current.controllerId() != null; depth++) {
            var controller = actors.get(current.controllerId());
            if (controller == null) {
                break;
            }
            current = controller;
        }
        return current;
    }

    public FactionRelationMatrix matrix() {
        return matrix;
    }
}
