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
package com.hellblazer.arbiter.targeting;

/**
 * Stable reasons a targeting or attack request is refused. The numeric codes are part of the wire contract with
 * clients and must never be renumbered.
 *
 * @author hal.hildebrand
 */
public enum DenyReason {
    NONE(0),
    UNKNOWN_ACTOR(1),
    TARGET_DEAD(2),
    ATTACKER_DEAD(3),
    TARGET_NOT_PERCEIVABLE(4),
    REGION_DISALLOWS_COMBAT(11),
    REGION_DISALLOWS_DAMAGE(12),
    PVP_NOT_ALLOWED(13),
    NOT_HOSTILE(20),
    RANGE_OR_LINE_OF_SIGHT(21),
    STATUS_GATED(22);

    private final int code;

    DenyReason(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static DenyReason fromCode(int code) {
        for (var reason : values()) {
            if (reason.code == code) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown deny reason code: " + code);
    }
}
