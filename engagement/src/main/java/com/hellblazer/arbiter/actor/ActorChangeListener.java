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

import com.hellblazer.arbiter.common.RegionId;

/**
 * Observer interface for actor lifecycle changes.
 * Enables loose coupling between the actor registry and the engagement and selection trackers.
 *
 * @author hal.hildebrand
 */
public interface ActorChangeListener {

    /**
     * Called when an actor is added to the registry.
     *
     * @param actor Spawned actor
     */
    default void onActorSpawned(Actor actor) {
    }

    /**
     * Called when an actor is removed from the registry.
     *
     * @param actor Last snapshot of the removed actor
     */
    default void onActorDespawned(Actor actor) {
    }

    /**
     * Called when the death pipeline kills an actor.
     *
     * @param actor Actor snapshot after death
     */
    default void onActorDied(Actor actor) {
    }

    /**
     * Called when the resurrection pipeline revives an actor.
     *
     * @param actor Actor snapshot after revival
     */
    default void onActorRevived(Actor actor) {
    }

    /**
     * Called when an actor moves between regions.
     *
     * @param actor Actor snapshot after the move
     * @param from  Previous region
     * @param to    New region
     */
    default void onActorRegionChanged(Actor actor, RegionId from, RegionId to) {
    }
}
