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

import java.util.Objects;

/**
 * String-based identifier of a loaded region (scene). Human-readable so that rule registration failures can name
 * the offending region in the log.
 *
 * @author hal.hildebrand
 */
public final class RegionId implements Comparable<RegionId> {
    private final String id;

    public RegionId(String id) {
        this.id = Objects.requireNonNull(id, "ID cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Region ID cannot be blank");
        }
    }

    public static RegionId of(String id) {
        return new RegionId(id);
    }

    @Override
    public int compareTo(RegionId other) {
        return this.id.compareTo(other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RegionId that)) {
            return false;
        }
        return id.equals(that.id);
    }

    public String getValue() {
        return id;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
