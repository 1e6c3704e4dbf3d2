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
package com.hellblazer.arbiter.config;

import com.hellblazer.arbiter.external.ActionKind;

/**
 * Engagement tunables.
 *
 * @param disengageSeconds          time an actor stays in combat after the last combat-extending event
 * @param sweepIntervalMillis       fixed interval of the engagement sweep; also the world tick length
 * @param targetedExtendsEngagement whether merely being targeted refreshes the target's disengage window.
 *                                  Disabled unless a design decision turns it on
 * @param meleeRange                maximum melee reach in meters
 * @param rangedRange               maximum ranged weapon reach in meters
 * @param spellRange                maximum harmful spell reach in meters
 * @param rangeBuffer               tolerance added to every range to absorb movement between ticks
 * @author hal.hildebrand
 */
public record EngagementConfig(double disengageSeconds, long sweepIntervalMillis, boolean targetedExtendsEngagement,
                               double meleeRange, double rangedRange, double spellRange, double rangeBuffer) {

    public static final double DEFAULT_DISENGAGE_SECONDS = 10.0;
    public static final long   DEFAULT_SWEEP_INTERVAL_MS = 250;

    public EngagementConfig {
        requireNonNegative("disengageSeconds", disengageSeconds);
        requireNonNegative("meleeRange", meleeRange);
        requireNonNegative("rangedRange", rangedRange);
        requireNonNegative("spellRange", spellRange);
        requireNonNegative("rangeBuffer", rangeBuffer);
        if (sweepIntervalMillis <= 0) {
            throw new IllegalArgumentException("sweepIntervalMillis must be positive: " + sweepIntervalMillis);
        }
    }

    public static EngagementConfig defaults() {
        return new EngagementConfig(DEFAULT_DISENGAGE_SECONDS, DEFAULT_SWEEP_INTERVAL_MS, false, 2.25, 12.0, 10.0,
                                    0.5);
    }

    /**
     * Maximum allowed distance for an action, buffer included
     */
    public double maxRange(ActionKind kind) {
        var base = switch (kind) {
            case MELEE_ATTACK -> meleeRange;
            case RANGED_ATTACK -> rangedRange;
            case HARMFUL_SPELL -> spellRange;
        };
        return base + rangeBuffer;
    }

    public double sweepIntervalSeconds() {
        return sweepIntervalMillis / 1000.0;
    }

    public EngagementConfig withDisengageSeconds(double seconds) {
        return new EngagementConfig(seconds, sweepIntervalMillis, targetedExtendsEngagement, meleeRange, rangedRange,
                                    spellRange, rangeBuffer);
    }

    public EngagementConfig withTargetedExtendsEngagement(boolean enabled) {
        return new EngagementConfig(disengageSeconds, sweepIntervalMillis, enabled, meleeRange, rangedRange,
                                    spellRange, rangeBuffer);
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }
}
