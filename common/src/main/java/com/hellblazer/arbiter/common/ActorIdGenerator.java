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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequential actor ID generator. Thread-safe. IDs start at 1 so that 0 never denotes a live actor.
 *
 * @author hal.hildebrand
 */
public class ActorIdGenerator {
    private final AtomicLong counter;

    public ActorIdGenerator() {
        this(1L);
    }

    public ActorIdGenerator(long startValue) {
        if (startValue < 1) {
            throw new IllegalArgumentException("Start value must be positive: " + startValue);
        }
        this.counter = new AtomicLong(startValue);
    }

    public ActorId generateID() {
        return new ActorId(counter.getAndIncrement());
    }

    /**
     * Get the next value that will be handed out, without incrementing
     */
    public long getCurrentValue() {
        return counter.get();
    }
}
