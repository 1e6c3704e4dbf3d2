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

import com.hellblazer.arbiter.common.ActorId;

/**
 * Per-actor engagement timer state.
 *
 * @param combatUntilTime            absolute server time at which the disengage window closes
 * @param hasActiveHostileEngagement attacker-side pursuit flag
 * @param engagedTargetId            current aggression target, or null
 * @author hal.hildebrand
 */
public record EngagementState(double combatUntilTime, boolean hasActiveHostileEngagement, ActorId engagedTargetId) {

    public static final EngagementState IDLE = new EngagementState(0.0, false, null);

    public boolean isInCombat(double now) {
        return hasActiveHostileEngagement || now < combatUntilTime;
    }

    /**
     * Extend the disengage window. Never shortens it.
     */
    public EngagementState refreshedUntil(double until) {
        return new EngagementState(Math.max(combatUntilTime, until), hasActiveHostileEngagement, engagedTargetId);
    }

    public EngagementState engaging(ActorId target) {
        return new EngagementState(combatUntilTime, true, target);
    }

    public EngagementState disengaged() {
        return new EngagementState(combatUntilTime, false, null);
    }

    public double remaining(double now) {
        return Math.max(0.0, combatUntilTime - now);
    }
}
