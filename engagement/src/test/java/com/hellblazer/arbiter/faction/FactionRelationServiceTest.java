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

import com.hellblazer.arbiter.actor.ActorRegistry;
import com.hellblazer.arbiter.actor.ActorType;
import com.hellblazer.arbiter.actor.LawFlag;
import com.hellblazer.arbiter.common.RegionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.hellblazer.arbiter.faction.FactionRelation.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class FactionRelationServiceTest {

    private static final RegionId REGION = RegionId.of("crypt");

    private ActorRegistry          registry;
    private FactionRelationService service;

    @BeforeEach
    void setUp() {
        registry = new ActorRegistry();
        service = new FactionRelationService(FactionRelationMatrix.standard(), registry);
    }

    @Test
    void testStandardBaseline() {
        var matrix = FactionRelationMatrix.standard();

        assertEquals(HOSTILE, matrix.baseline(FactionId.PLAYERS, FactionId.MONSTERS));
        assertEquals(HOSTILE, matrix.baseline(FactionId.MONSTERS, FactionId.PLAYERS));
        assertEquals(HOSTILE, matrix.baseline(FactionId.GUARDS, FactionId.MONSTERS));
        assertEquals(FRIENDLY, matrix.baseline(FactionId.VILLAGE, FactionId.PLAYERS));
        assertEquals(FRIENDLY, matrix.baseline(FactionId.PLAYERS, FactionId.PLAYERS));
        assertEquals(NEUTRAL, matrix.baseline(FactionId.PLAYERS, FactionId.GUARDS));
    }

    @Test
    void testNeutralFactionWinsOverSameFaction() {
        var matrix = FactionRelationMatrix.builder().relation(FactionId.NEUTRAL, FactionId.PLAYERS, HOSTILE).build();

        assertEquals(NEUTRAL, matrix.baseline(FactionId.NEUTRAL, FactionId.NEUTRAL));
        assertEquals(NEUTRAL, matrix.baseline(FactionId.NEUTRAL, FactionId.PLAYERS));
    }

    @Test
    void testDefaultRelationFillsGaps() {
        var matrix = FactionRelationMatrix.builder().defaultRelation(HOSTILE).build();

        assertEquals(HOSTILE, matrix.baseline(FactionId.VILLAGE, FactionId.GUARDS));
        assertEquals(FRIENDLY, matrix.baseline(FactionId.GUARDS, FactionId.GUARDS));
    }

    @Test
    void testMurdererIsHostileToEnforcers() {
        var murderer = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);
        registry.setLawFlags(murderer.id(), Set.of(LawFlag.MURDERER));
        var guard = registry.spawn(ActorType.GUARD, FactionId.GUARDS, REGION);
        var villager = registry.spawn(ActorType.NPC, FactionId.VILLAGE, REGION);
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);

        var flagged = registry.get(murderer.id());
        assertEquals(HOSTILE, service.relation(guard, flagged));
        assertEquals(HOSTILE, service.relation(villager, flagged));
        assertEquals(HOSTILE, service.relation(player, flagged));
        assertEquals(FRIENDLY, service.relation(flagged, player), "The override applies to the flagged target only");
    }

    @Test
    void testCriminalIsHostileToGuardsOnly() {
        var criminal = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);
        registry.setLawFlags(criminal.id(), Set.of(LawFlag.CRIMINAL));
        var guard = registry.spawn(ActorType.GUARD, FactionId.GUARDS, REGION);
        var villager = registry.spawn(ActorType.NPC, FactionId.VILLAGE, REGION);

        var flagged = registry.get(criminal.id());
        assertTrue(service.isHostile(guard, flagged));
        assertEquals(FRIENDLY, service.relation(villager, flagged));
    }

    @Test
    void testLawFlagsOnNonPlayersAreIgnored() {
        var monster = registry.spawn(ActorType.MONSTER, FactionId.VILLAGE, REGION);
        registry.setLawFlags(monster.id(), Set.of(LawFlag.MURDERER));
        var guard = registry.spawn(ActorType.GUARD, FactionId.GUARDS, REGION);

        assertEquals(FRIENDLY, service.relation(guard, registry.get(monster.id())));
    }

    @Test
    void testMurderersPetIsHostileToGuards() {
        var owner = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);
        registry.setLawFlags(owner.id(), Set.of(LawFlag.MURDERER));
        var pet = registry.spawnControlled(ActorType.PET, FactionId.NEUTRAL, REGION, owner.id());
        var guard = registry.spawn(ActorType.GUARD, FactionId.GUARDS, REGION);

        assertEquals(HOSTILE, service.relation(guard, pet));
    }

    @Test
    void testPlayersSummonIsHostileToMonsters() {
        var owner = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);
        var summon = registry.spawnControlled(ActorType.SUMMON, FactionId.NEUTRAL, REGION, owner.id());
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, REGION);

        assertEquals(HOSTILE, service.relation(monster, summon));
        assertEquals(HOSTILE, service.relation(summon, monster), "Inheritance applies to the viewer as well");
    }

    @Test
    void testMissingControllerFallsBackToActor() {
        var owner = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);
        var summon = registry.spawnControlled(ActorType.SUMMON, FactionId.MONSTERS, REGION, owner.id());
        var snapshot = registry.get(summon.id());
        registry.despawn(owner.id());

        assertSame(snapshot, service.socialStanding(snapshot));
    }

    @Test
    void testLawEnforcementTableIsConfigurable() {
        var matrix = FactionRelationMatrix.builder()
                                          .lawEnforcement(LawFlag.CRIMINAL, List.of(FactionId.VILLAGE))
                                          .build();

        assertTrue(matrix.enforces(FactionId.VILLAGE, LawFlag.CRIMINAL));
        assertFalse(matrix.enforces(FactionId.GUARDS, LawFlag.CRIMINAL));
        assertEquals(Set.of(FactionId.VILLAGE), matrix.enforcersOf(LawFlag.CRIMINAL));
    }
}
