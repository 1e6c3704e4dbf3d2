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
package com.hellblazer.arbiter.faction;

import com.hellblazer.arbiter.actor.LawFlag;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable faction relationship table keyed by (viewer faction, target faction), plus the law-enforcement table
 * mapping each {@link LawFlag} to the factions that treat a flagged actor as hostile.
 * <p>
 * Baseline resolution order:
 * <ol>
 *   <li>NEUTRAL on either side resolves to NEUTRAL</li>
 *   <li>Same faction resolves to FRIENDLY</li>
 *   <li>Explicit table entry</li>
 *   <li>Default relation</li>
 * </ol>
 * The table is fully materialized at build time so lookups are a pair of array reads.
 *
 * @author hal.hildebrand
 */
public final class FactionRelationMatrix {

    private final FactionRelation[][]          table;
    private final FactionRelation              defaultRelation;
    private final Map<LawFlag, Set<FactionId>> lawEnforcement;

    private FactionRelationMatrix(FactionRelation[][] table, FactionRelation defaultRelation,
                                  Map<LawFlag, Set<FactionId>> lawEnforcement) {
        this.table = table;
        this.defaultRelation = defaultRelation;
        this.lawEnforcement = lawEnforcement;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The built-in table: players and guards are hostile to monsters (both ways), the village is friendly with
     * players and guards, murderers are hunted by players, guards and the village, criminals by guards.
     */
    public static FactionRelationMatrix standard() {
        return builder().symmetric(FactionId.PLAYERS, FactionId.MONSTERS, FactionRelation.HOSTILE)
                        .symmetric(FactionId.GUARDS, FactionId.MONSTERS, FactionRelation.HOSTILE)
                        .symmetric(FactionId.VILLAGE, FactionId.PLAYERS, FactionRelation.FRIENDLY)
                        .symmetric(FactionId.VILLAGE, FactionId.GUARDS, FactionRelation.FRIENDLY)
                        .lawEnforcement(LawFlag.MURDERER,
                                        Set.of(FactionId.PLAYERS, FactionId.GUARDS, FactionId.VILLAGE))
                        .lawEnforcement(LawFlag.CRIMINAL, Set.of(FactionId.GUARDS))
                        .build();
    }

    /**
     * Baseline relation between two factions, ignoring per-actor flags.
     */
    public FactionRelation baseline(FactionId viewer, FactionId target) {
        return table[viewer.ordinal()][target.ordinal()];
    }

    /**
     * @return true if the viewer faction treats actors carrying the flag as hostile
     */
    public boolean enforces(FactionId viewer, LawFlag flag) {
        return lawEnforcement.getOrDefault(flag, Set.of()).contains(viewer);
    }

    public FactionRelation defaultRelation() {
        return defaultRelation;
    }

    public Set<FactionId> enforcersOf(LawFlag flag) {
        return lawEnforcement.getOrDefault(flag, Set.of());
    }

    @Override
    public String toString() {
        return String.format("FactionRelationMatrix{default=%s, lawEnforcement=%s}", defaultRelation,
                             lawEnforcement);
    }

    public static final class Builder {
        private final Map<FactionId, Map<FactionId, FactionRelation>> entries         = new EnumMap<>(FactionId.class);
        private final Map<LawFlag, Set<FactionId>>                    lawEnforcement  = new EnumMap<>(LawFlag.class);
        private       FactionRelation                                 defaultRelation = FactionRelation.NEUTRAL;

        private Builder() {
        }

        public Builder relation(FactionId viewer, FactionId target, FactionRelation relation) {
            Objects.requireNonNull(viewer, "viewer");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(relation, "relation");
            entries.computeIfAbsent(viewer, k -> new EnumMap<>(FactionId.class)).put(target, relation);
            return this;
        }

        public Builder symmetric(FactionId a, FactionId b, FactionRelation relation) {
            return relation(a, b, relation).relation(b, a, relation);
        }

        public Builder defaultRelation(FactionRelation relation) {
            this.defaultRelation = Objects.requireNonNull(relation, "relation");
            return this;
        }

        public Builder lawEnforcement(LawFlag flag, Collection<FactionId> enforcers) {
            Objects.requireNonNull(flag, "flag");
            lawEnforcement.put(flag, enforcers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(enforcers)));
            return this;
        }

        public FactionRelationMatrix build() {
            var factions = FactionId.values();
            var table = new FactionRelation[factions.length][factions.length];
            for (var viewer : factions) {
                for (var target : factions) {
                    table[viewer.ordinal()][target.ordinal()] = resolve(viewer, target);
                }
            }
            return new FactionRelationMatrix(table, defaultRelation, Map.copyOf(lawEnforcement));
        }

        private FactionRelation resolve(FactionId viewer, FactionId target) {
            if (viewer == FactionId.NEUTRAL || target == FactionId.NEUTRAL) {
                return FactionRelation.NEUTRAL;
            }
            if (viewer == target) {
                return FactionRelation.FRIENDLY;
            }
            var row = entries.get(viewer);
            if (row != null && row.containsKey(target)) {
                return row.get(target);
            }
            return defaultRelation;
        }
    }
}
