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
package com.hellblazer.arbiter.scene;

import java.util.EnumSet;
import java.util.Set;

/**
 * Canonical region context taxonomy. Each loaded region declares exactly one.
 * <p>
 * Safe contexts resolve to no permissions at all; the dungeon resolves to every permission.
 *
 * @author hal.hildebrand
 */
public enum SceneContext {
    MAINLAND_HOUSING(false),
    HOTNOW_VILLAGE(false),
    DUNGEON(true);

    private final boolean dangerous;

    SceneContext(boolean dangerous) {
        this.dangerous = dangerous;
    }

    public boolean isDangerous() {
        return dangerous;
    }

    /**
     * @return the canonical permission set of this context (a fresh, mutable copy)
     */
    public Set<SceneRuleFlag> defaultFlags() {
        return dangerous ? EnumSet.allOf(SceneRuleFlag.class) : EnumSet.noneOf(SceneRuleFlag.class);
    }
}
