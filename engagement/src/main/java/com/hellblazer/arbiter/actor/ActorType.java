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

/**
 * Kind of actor participating in targeting and combat.
 *
 * @author hal.hildebrand
 */
public enum ActorType {
    PLAYER,
    MONSTER,
    NPC,
    GUARD,
    SUMMON,
    PET,
    DESTRUCTIBLE;

    public boolean isPlayer() {
        return this == PLAYER;
    }

    /**
     * @return true if actors of this type may carry a controller link
     */
    public boolean isControllable() {
        return this == SUMMON || this == PET;
    }
}
