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
import com.hellblazer.arbiter.external.ActionKind;

import java.util.Objects;

/**
 * A hostile intent awaiting a legality decision. Actor ids may be null; they resolve to an unknown-actor denial.
 *
 * @author hal.hildebrand
 */
public record AttackQuery(ActorId attackerId, ActorId targetId, ActionKind actionKind) {

    public AttackQuery {
        Objects.requireNonNull(actionKind, "actionKind");
    }

    public static AttackQuery melee(ActorId attackerId, ActorId targetId) {
        return new AttackQuery(attackerId, targetId, ActionKind.MELEE_ATTACK);
    }
}
