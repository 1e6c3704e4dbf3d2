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
import com.hellblazer.arbiter.config.EngagementConfig;
import com.hellblazer.arbiter.external.ActionKind;
import com.hellblazer.arbiter.external.LineOfSightSource;
import com.hellblazer.arbiter.external.PositionSource;
import com.hellblazer.arbiter.external.RangeGate;

import java.util.Objects;

/**
 * Euclidean reach check against the per-action maximum range plus buffer, followed by an optional line-of-sight
 * test. Actors without a known position never satisfy the gate.
 *
 * @author hal.hildebrand
 */
public class DistanceRangeGate implements RangeGate {

    private final PositionSource    positions;
    private final LineOfSightSource lineOfSight;
    private final EngagementConfig  config;

    public DistanceRangeGate(PositionSource positions, EngagementConfig config) {
        this(positions, LineOfSightSource.CLEAR, config);
    }

    public DistanceRangeGate(PositionSource positions, LineOfSightSource lineOfSight, EngagementConfig config) {
        this.positions = Objects.requireNonNull(positions, "positions");
        this.lineOfSight = lineOfSight == null ? LineOfSightSource.CLEAR : lineOfSight;
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public boolean isSatisfied(ActorId attacker, ActorId target, ActionKind kind) {
        var from = positions.positionOf(attacker);
        var to = positions.positionOf(target);
        if (from == null || to == null) {
            return false;
        }
        if (from.distance(to) > config.maxRange(kind)) {
            return false;
        }
        return lineOfSight.hasLineOfSight(from, to);
    }
}
