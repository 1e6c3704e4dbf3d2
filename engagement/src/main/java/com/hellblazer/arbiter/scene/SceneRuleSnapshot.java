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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable permission snapshot of one region. Replaced wholesale on transition, never mutated.
 * <p>
 * The {@link #restrictive()} sentinel stands in for regions with no valid rule registration: it carries no context
 * and grants nothing.
 *
 * @param context region context, null only for the restrictive sentinel
 * @param flags   granted permissions (immutable copy)
 * @param valid   true if this snapshot came from exactly one rule provider
 * @author hal.hildebrand
 */
public record SceneRuleSnapshot(SceneContext context, Set<SceneRuleFlag> flags, boolean valid) {

    private static final SceneRuleSnapshot RESTRICTIVE = new SceneRuleSnapshot(null, Set.of(), false);

    public SceneRuleSnapshot {
        Objects.requireNonNull(flags, "flags");
        if (valid && context == null) {
            throw new IllegalArgumentException("A valid snapshot requires a context");
        }
        flags = flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
    }

    /**
     * Snapshot carrying the canonical permissions of the context
     */
    public static SceneRuleSnapshot of(SceneContext context) {
        return new SceneRuleSnapshot(Objects.requireNonNull(context, "context"), context.defaultFlags(), true);
    }

    /**
     * Snapshot with explicit permissions, for regions that deviate from their context's defaults
     */
    public static SceneRuleSnapshot of(SceneContext context, Collection<SceneRuleFlag> flags) {
        return new SceneRuleSnapshot(Objects.requireNonNull(context, "context"),
                                     flags.isEmpty() ? Set.of() : EnumSet.copyOf(flags), true);
    }

    public static SceneRuleSnapshot restrictive() {
        return RESTRICTIVE;
    }

    public boolean allows(SceneRuleFlag flag) {
        return flags.contains(flag);
    }

    public boolean allowsCombat() {
        return allows(SceneRuleFlag.COMBAT_ALLOWED);
    }

    @Override
    public String toString() {
        return valid ? String.format("SceneRules{%s, %s}", context, flags) : "SceneRules{RESTRICTIVE}";
    }
}
