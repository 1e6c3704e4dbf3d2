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
package com.hellblazer.arbiter.common;

/**
 * Long-based actor identifier. Stable for the lifetime of a spawned actor and never reused within a world.
 *
 * @author hal.hildebrand
 */
public final class ActorId implements Comparable<ActorId> {
    private final long id;

    public ActorId(long id) {
        this.id = id;
    }

    public static ActorId of(long id) {
        return new ActorId(id);
    }

    public long getValue() {
        return id;
    }

    public String toDebugString() {
        return "Actor[" + id + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActorId that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public int compareTo(ActorId other) {
        return Long.compare(this.id, other.id);
    }

    @Override
    public String toString() {
        return String.valueOf(id);
    }
}
