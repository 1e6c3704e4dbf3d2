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
package com.hellblazer.arbiter.world;

import com.hellblazer.arbiter.actor.ActorRegistry;
import com.hellblazer.arbiter.combat.CombatStateTracker;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.scene.SceneRuleGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Region travel. Portals that require it refuse actors still in combat; a successful move goes through the
 * {@link ActorRegistry}, whose region change notification applies the destination's scene override.
 *
 * @author hal.hildebrand
 */
public class RegionTransitionService {
    private static final Logger log = LoggerFactory.getLogger(RegionTransitionService.class);

    private final ActorRegistry      actors;
    private final CombatStateTracker tracker;
    private final SceneRuleGate      scenes;

    public RegionTransitionService(ActorRegistry actors, CombatStateTracker tracker, SceneRuleGate scenes) {
        this.actors = Objects.requireNonNull(actors, "actors");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.scenes = Objects.requireNonNull(scenes, "scenes");
    }

    /**
     * @param actorId            traveller
     * @param destination        region to enter
     * @param requireOutOfCombat whether the portal refuses actors in combat
     */
    public TransitionResult requestTransition(ActorId actorId, RegionId destination, boolean requireOutOfCombat) {
        Objects.requireNonNull(destination, "destination");
        var actor = actors.get(actorId);
        if (actor == null) {
            return TransitionResult.UNKNOWN_ACTOR;
        }
        if (!actor.alive()) {
            return TransitionResult.DENIED_DEAD;
        }
        if (actor.region().equals(destination)) {
            return TransitionResult.ALREADY_THERE;
        }
        if (!scenes.isActive(destination)) {
            log.debug("{} cannot travel to {}: no active scene rules", actorId, destination);
            return TransitionResult.DESTINATION_NOT_LOADED;
        }
        if (requireOutOfCombat && tracker.isInCombat(actorId)) {
            log.debug("{} cannot travel to {} while in combat", actorId, destination);
            return TransitionResult.DENIED_IN_COMBAT;
        }
        actors.moveToRegion(actorId, destination);
        return TransitionResult.MOVED;
    }
}
