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
package com.hellblazer.arbiter.event;

import com.hellblazer.arbiter.combat.CombatState;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.targeting.DenyReason;
import com.hellblazer.arbiter.targeting.Selection;

import java.util.Objects;

/**
 * Read-only notifications published by the engagement core. Consumers render or react to them but never derive
 * authoritative decisions from them.
 *
 * @author hal.hildebrand
 */
public sealed interface EngagementEvent
    permits EngagementEvent.SelectionChanged, EngagementEvent.TargetIntentDenied, EngagementEvent.CombatStateChanged {

    /**
     * Actor the event concerns
     */
    ActorId actor();

    /**
     * Authoritative server time of the event
     */
    double time();

    /**
     * @param previous prior selection, null if none
     * @param current  new selection, null if cleared
     */
    record SelectionChanged(ActorId actor, Selection previous, Selection current, double time)
    implements EngagementEvent {
        public SelectionChanged {
            Objects.requireNonNull(actor, "actor");
        }
    }

    record TargetIntentDenied(ActorId actor, ActorId target, DenyReason reason, double time)
    implements EngagementEvent {
        public TargetIntentDenied {
            Objects.requireNonNull(actor, "actor");
            Objects.requireNonNull(reason, "reason");
        }
    }

    record CombatStateChanged(ActorId actor, CombatState previous, CombatState current, double time)
    implements EngagementEvent {
        public CombatStateChanged {
            Objects.requireNonNull(actor, "actor");
            Objects.requireNonNull(previous, "previous");
            Objects.requireNonNull(current, "current");
        }
    }
}
