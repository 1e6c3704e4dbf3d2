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

import com.hellblazer.arbiter.targeting.DenyReason;

import java.util.Objects;

/**
 * Allowed, or denied with exactly one stable reason.
 *
 * @author hal.hildebrand
 */
public record AttackResult(boolean allowed, DenyReason reason) {

    public static final AttackResult ALLOWED = new AttackResult(true, DenyReason.NONE);

    public AttackResult {
        Objects.requireNonNull(reason, "reason");
        if (allowed != (reason == DenyReason.NONE)) {
            throw new IllegalArgumentException("Inconsistent attack result: allowed=" + allowed + ", " + reason);
        }
    }

    public static AttackResult denied(DenyReason reason) {
        return new AttackResult(false, reason);
    }

    @Override
    public String toString() {
        return allowed ? "Allowed" : "Denied(" + reason + ")";
    }
}
