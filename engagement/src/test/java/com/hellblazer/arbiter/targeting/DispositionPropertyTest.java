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

import com.hellblazer.arbiter.actor.Actor;
import com.hellblazer.arbiter.actor.ActorType;
import com.hellblazer.arbiter.actor.LawFlag;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.external.VisibilitySource;
import com.hellblazer.arbiter.faction.FactionId;
import com.hellblazer.arbiter.faction.FactionRelationMatrix;
import com.hellblazer.arbiter.faction.FactionRelationService;
import com.hellblazer.arbiter.scene.SceneContext;
import com.hellblazer.arbiter.scene.SceneRuleFlag;
import com.hellblazer.arbiter.scene.SceneRuleGate;
import com.hellblazer.arbiter.scene.SceneRuleSnapshot;
import net.jqwik.api.*;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Disposition properties over arbitrary actors, factions, law flags and region rules.
 *
 * @author hal.hildebrand
 */
@Label("Disposition Property-Based Tests")
class DispositionPropertyTest {

    private static final RegionId REGION = RegionId.of("anywhere");

    private final TargetingResolver resolver = new TargetingResolver(
    new FactionRelationService(FactionRelationMatrix.standard(), id -> null), id -> null, new SceneRuleGate(),
    VisibilitySource.ALL_VISIBLE);

    @Property
    @Label("An actor always sees itself as SELF, alive or dead")
    void selfIsAlwaysSelf(@ForAll("actors") Actor actor, @ForAll("scenes") SceneRuleSnapshot scene,
                          @ForAll boolean perceivable, @ForAll boolean inRange) {
        var result = resolver.resolve(new DispositionQuery(actor, actor, scene, perceivable, true, inRange));

        assertEquals(Disposition.SELF, result.disposition());
        assertTrue(result.eligible());
    }

    @Property
    @Label("A dead target is INVALID regardless of faction")
    void deadTargetIsInvalid(@ForAll("actors") Actor viewer, @ForAll("actors") Actor target,
                             @ForAll("scenes") SceneRuleSnapshot scene) {
        var dead = withId(target, viewer.id().getValue() + 1).withAlive(false);

        var result = resolver.resolve(DispositionQuery.of(viewer, dead, scene, true));

        assertEquals(Disposition.INVALID, result.disposition());
        assertEquals(DenyReason.TARGET_DEAD, result.reason());
    }

    @Property
    @Label("Players are never HOSTILE to players where PvP is disallowed")
    void noPvpMeansNoHostilePlayers(@ForAll FactionId viewerFaction, @ForAll FactionId targetFaction,
                                    @ForAll Set<LawFlag> flags, @ForAll("scenes") SceneRuleSnapshot scene) {
        Assume.that(!scene.allows(SceneRuleFlag.PVP_ALLOWED));
        var viewer = Actor.spawned(ActorId.of(1), ActorType.PLAYER, viewerFaction, REGION);
        var target = Actor.spawned(ActorId.of(2), ActorType.PLAYER, targetFaction, REGION).withLawFlags(flags);

        var result = resolver.resolve(DispositionQuery.of(viewer, target, scene, true));

        assertNotEquals(Disposition.HOSTILE, result.disposition());
    }

    @Property
    @Label("Regions without hostile actors never yield HOSTILE")
    void noHostileActorsMeansNoHostile(@ForAll("actors") Actor viewer, @ForAll("actors") Actor target,
                                       @ForAll("scenes") SceneRuleSnapshot scene) {
        Assume.that(!scene.allows(SceneRuleFlag.HOSTILE_ACTORS_ALLOWED));
        var other = withId(target, viewer.id().getValue() + 1);

        var result = resolver.resolve(DispositionQuery.of(viewer, other, scene, true));

        assertNotEquals(Disposition.HOSTILE, result.disposition());
    }

    @Property
    @Label("Scene downgrades never turn a relation FRIENDLY")
    void downgradeNeverFriendly(@ForAll("actors") Actor viewer, @ForAll("actors") Actor target,
                                @ForAll("scenes") SceneRuleSnapshot scene) {
        var other = withId(target, viewer.id().getValue() + 1);
        var permissive = SceneRuleSnapshot.of(SceneContext.DUNGEON);

        var open = resolver.resolve(DispositionQuery.of(viewer, other, permissive, true));
        var gated = resolver.resolve(DispositionQuery.of(viewer, other, scene, true));

        if (open.disposition() != Disposition.FRIENDLY) {
            assertNotEquals(Disposition.FRIENDLY, gated.disposition());
        }
    }

    @Provide
    Arbitrary<Actor> actors() {
        var types = Arbitraries.of(ActorType.PLAYER, ActorType.MONSTER, ActorType.NPC, ActorType.GUARD,
                                   ActorType.DESTRUCTIBLE);
        var factions = Arbitraries.of(FactionId.class);
        var flags = Arbitraries.of(LawFlag.class).set();
        var ids = Arbitraries.longs().between(1, 1_000_000);
        return Combinators.combine(ids, types, factions, flags, Arbitraries.of(true, false))
                          .as((id, type, faction, lawFlags, alive) -> Actor.spawned(ActorId.of(id), type, faction,
                                                                                    REGION)
                                                                           .withLawFlags(lawFlags)
                                                                           .withAlive(alive));
    }

    @Provide
    Arbitrary<SceneRuleSnapshot> scenes() {
        var flags = Arbitraries.of(SceneRuleFlag.class).set();
        return Combinators.combine(Arbitraries.of(SceneContext.class), flags).as(SceneRuleSnapshot::of);
    }

    private static Actor withId(Actor actor, long id) {
        return new Actor(ActorId.of(id), actor.type(), actor.faction(), actor.alive(), actor.region(),
                         actor.lawFlags(), actor.pvpEnabled(), actor.vitals(), actor.controllerId());
    }
}
