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
package com.hellblazer.arbiter.actor;

import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.faction.FactionId;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of an actor's authoritative identity and state.
 * <p>
 * The {@link ActorRegistry} replaces the record wholesale on every mutation, so a reader holding an Actor always
 * sees a consistent view, and legality queries can run on any thread without locking.
 * <p>
 * The controller link is a relation used for social inheritance (summons, pets), never an ownership link.
 *
 * @param id           stable identifier
 * @param type         actor kind
 * @param faction      faction membership
 * @param alive        false once the death pipeline has killed the actor
 * @param region       region the actor currently occupies
 * @param lawFlags     crime flags (immutable copy)
 * @param pvpEnabled   consensual PvP toggle, informational only
 * @param vitals       authoritative vitals
 * @param controllerId controlling actor for summons and pets, or null
 * @author hal.hildebrand
 */
public record Actor(ActorId id, ActorType type, FactionId faction, boolean alive, RegionId region,
                    Set<LawFlag> lawFlags, boolean pvpEnabled, ActorVitals vitals, ActorId controllerId) {

    public Actor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(faction, "faction");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(vitals, "vitals");
        lawFlags = lawFlags == null || lawFlags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(lawFlags));
        if (controllerId != null) {
            if (!type.isControllable()) {
                throw new IllegalArgumentException(type + " actors cannot have a controller: " + id);
            }
            if (controllerId.equals(id)) {
                throw new IllegalArgumentException("Actor cannot control itself: " + id);
            }
        }
    }

    /**
     * Create a freshly spawned, living actor with no flags and no controller
     */
    public static Actor spawned(ActorId id, ActorType type, FactionId faction, RegionId region) {
        return new Actor(id, type, faction, true, region, Set.of(), false, ActorVitals.NONE, null);
    }

    public Optional<ActorId> controller() {
        return Optional.ofNullable(controllerId);
    }

    public boolean isPlayer() {
        return type.isPlayer();
    }

    public boolean hasLawFlag(LawFlag flag) {
        return lawFlags.contains(flag);
    }

    public boolean sameRegion(Actor other) {
        return region.equals(other.region);
    }

    public Actor withAlive(boolean newAlive) {
        return new Actor(id, type, faction, newAlive, region, lawFlags, pvpEnabled, vitals, controllerId);
    }

    public Actor withFaction(FactionId newFaction) {
        return new Actor(id, type, newFaction, alive, region, lawFlags, pvpEnabled, vitals, controllerId);
    }

    public Actor withRegion(RegionId newRegion) {
        return new Actor(id, type, faction, alive, newRegion, lawFlags, pvpEnabled, vitals, controllerId);
    }

    public Actor withLawFlags(Set<LawFlag> newFlags) {
        return new Actor(id, type, faction, alive, region, newFlags, pvpEnabled, vitals, controllerId);
    }

    public Actor withPvpEnabled(boolean enabled) {
        return new Actor(id, type, faction, alive, region, lawFlags, enabled, vitals, controllerId);
    }

    public Actor withVitals(ActorVitals newVitals) {
        return new Actor(id, type, faction, alive, region, lawFlags, pvpEnabled, newVitals, controllerId);
    }

    public Actor withController(ActorId newController) {
        return new Actor(id, type, faction, alive, region, lawFlags, pvpEnabled, vitals, newController);
    }

    @Override
    public String toString() {
        return String.format("Actor(id=%s, type=%s, faction=%s, alive=%s, region=%s)", id, type, faction, alive,
                             region);
    }
}
