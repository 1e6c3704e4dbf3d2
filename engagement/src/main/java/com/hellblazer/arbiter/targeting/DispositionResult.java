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

import java.util.Objects;

/**
 * @author hal.hildebrand
 */
public record DispositionResult(boolean eligible, Disposition disposition, DenyReason reason) {

    private static final DispositionResult SELF = new DispositionResult(true, Disposition.SELF, DenyReason.NONE);

    public DispositionResult {
        Objects.requireNonNull(disposition, "disposition");
        Objects.requireNonNull(reason, "reason");
    }

    public static DispositionResult self() {
        return SELF;
    }

    public static DispositionResult invalid(DenyReason reason) {
        return new DispositionResult(false, Disposition.INVALID, reason);
    }

    public static DispositionResult of(Disposition disposition) {
        return new DispositionResult(true, disposition, DenyReason.NONE);
    }

    public boolean isHostile() {
        return disposition == Disposition.HOSTILE;
    }
}
