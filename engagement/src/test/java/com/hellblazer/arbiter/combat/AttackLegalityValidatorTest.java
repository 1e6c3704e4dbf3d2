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
package com.hellblazer.arbiter.combat;

import com.hellblazer.arbiter.actor.ActorRegistry;
import com.hellblazer.arbiter.actor.ActorType;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.external.ActionKind;
import com.hellblazer.arbiter.external.RangeGate;
import com.hellblazer.arbiter.external.StatusSource;
import com.hellblazer.arbiter.external.VisibilitySource;
import com.hellblazer.arbiter.faction.FactionId;
import com.hellblazer.arbiter.faction.FactionRelationMatrix;
import com.hellblazer.arbiter.faction.FactionRelationService;
import com.hellblazer.arbiter.scene.SceneContext;
import com.hellblazer.arbiter.scene.SceneRuleFlag;
import com.hellblazer.arbiter.scene.SceneRuleGate;
import com.hellblazer.arbiter.scene.SceneRuleSnapshot;
import com.hellblazer.arbiter.targeting.DenyReason;
import com.hellblazer.arbiter.targeting.TargetingResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AttackLegalityValidatorTest {

    private static final RegionId CRYPT   = RegionId.of("crypt");
    private static final RegionId HOUSING = RegionId.of("housing");

    @Mock
    private StatusSource     status;
    @Mock
    private VisibilitySource visibility;
    @Mock
    private RangeGate        range;

    private ActorRegistry           registry;
    private SceneRuleGate           gate;
    private AttackLegalityValidator validator;

    @BeforeEach
    void setUp() {
        registry = new ActorRegistry();
        gate = new SceneRuleGate();
        gate.register(CRYPT, SceneRuleSnapshot.of(SceneContext.DUNGEON));
        gate.register(HOUSING, SceneRuleSnapshot.of(SceneContext.MAINLAND_HOUSING));

        when(visibility.canPerceive(any(), any())).thenReturn(true);
        when(range.isSatisfied(any(), any(), any())).thenReturn(true);
        when(status.isActionBlocked(any(), any())).thenReturn(false);

        var resolver = new TargetingResolver(new FactionRelationService(FactionRelationMatrix.standard(), registry),
                                             registry, gate, visibility);
        validator = new AttackLegalityValidator(registry, gate, resolver, range, status, visibility);
    }

    @Test
    void testPlayerMayAttackMonsterInDungeon() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);

        assertEquals(AttackResult.ALLOWED, validator.canAttack(AttackQuery.melee(player.id(), monster.id())));
    }

    @Test
    void testUnknownActors() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);

        assertEquals(DenyReason.UNKNOWN_ACTOR,
                     validator.canAttack(AttackQuery.melee(player.id(), ActorId.of(77))).reason());
        assertEquals(DenyReason.UNKNOWN_ACTOR, validator.canAttack(AttackQuery.melee(null, player.id())).reason());
    }

    @Test
    void testDeadAttackerIsCheckedBeforeDeadTarget() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        registry.kill(player.id());
        registry.kill(monster.id());

        assertEquals(DenyReason.ATTACKER_DEAD, validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
        registry.revive(player.id());
        assertEquals(DenyReason.TARGET_DEAD, validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
    }

    @Test
    void testSafeRegionDisallowsCombat() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, HOUSING);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, HOUSING);

        assertEquals(DenyReason.REGION_DISALLOWS_COMBAT,
                     validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
        verifyNoInteractions(range);
    }

    @Test
    void testRegionWithoutDamage() {
        var rules = EnumSet.allOf(SceneRuleFlag.class);
        rules.remove(SceneRuleFlag.DAMAGE_ALLOWED);
        var arena = RegionId.of("arena");
        gate.register(arena, SceneRuleSnapshot.of(SceneContext.DUNGEON, rules));
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, arena);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, arena);

        assertEquals(DenyReason.REGION_DISALLOWS_DAMAGE,
                     validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
    }

    @Test
    void testRegionWithoutPvp() {
        var rules = EnumSet.allOf(SceneRuleFlag.class);
        rules.remove(SceneRuleFlag.PVP_ALLOWED);
        var arena = RegionId.of("arena");
        gate.register(arena, SceneRuleSnapshot.of(SceneContext.DUNGEON, rules));
        var a = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, arena);
        var b = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, arena);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, arena);

        assertEquals(DenyReason.PVP_NOT_ALLOWED, validator.canAttack(AttackQuery.melee(a.id(), b.id())).reason());
        assertTrue(validator.canAttack(AttackQuery.melee(a.id(), monster.id())).allowed());
    }

    @Test
    void testRegionWithoutHostileActorsDeniesAsNotHostile() {
        var rules = EnumSet.allOf(SceneRuleFlag.class);
        rules.remove(SceneRuleFlag.HOSTILE_ACTORS_ALLOWED);
        var shrine = RegionId.of("shrine");
        gate.register(shrine, SceneRuleSnapshot.of(SceneContext.DUNGEON, rules));
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, shrine);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, shrine);

        assertEquals(DenyReason.NOT_HOSTILE, validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
    }

    @Test
    void testOutOfRange() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        when(range.isSatisfied(player.id(), monster.id(), ActionKind.RANGED_ATTACK)).thenReturn(false);

        var query = new AttackQuery(player.id(), monster.id(), ActionKind.RANGED_ATTACK);

        assertEquals(DenyReason.RANGE_OR_LINE_OF_SIGHT, validator.canAttack(query).reason());
        assertTrue(validator.canAttack(AttackQuery.melee(player.id(), monster.id())).allowed());
    }

    @Test
    void testCrossRegionFailsRangeWithoutAskingTheGate() {
        var other = RegionId.of("crypt-2");
        gate.register(other, SceneRuleSnapshot.of(SceneContext.DUNGEON));
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, other);

        assertEquals(DenyReason.RANGE_OR_LINE_OF_SIGHT,
                     validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
        verifyNoInteractions(range);
    }

    @Test
    void testStatusGatingIsPerActionKind() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        when(status.isActionBlocked(player.id(), ActionKind.HARMFUL_SPELL)).thenReturn(true);

        assertEquals(DenyReason.STATUS_GATED,
                     validator.canAttack(new AttackQuery(player.id(), monster.id(), ActionKind.HARMFUL_SPELL))
                              .reason());
        assertTrue(validator.canAttack(AttackQuery.melee(player.id(), monster.id())).allowed());
    }

    @Test
    void testStealthedTarget() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        when(visibility.canPerceive(player.id(), monster.id())).thenReturn(false);

        assertEquals(DenyReason.TARGET_NOT_PERCEIVABLE,
                     validator.canAttack(AttackQuery.melee(player.id(), monster.id())).reason());
    }

    @Test
    void testFriendlyTargetIsNotHostile() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var villager = registry.spawn(ActorType.NPC, FactionId.VILLAGE, CRYPT);

        assertEquals(DenyReason.NOT_HOSTILE, validator.canAttack(AttackQuery.melee(player.id(), villager.id())).reason());
        assertEquals(DenyReason.NOT_HOSTILE, validator.canAttack(AttackQuery.melee(player.id(), player.id())).reason());
    }

    @Test
    void testValidationDoesNotMutateState() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        var before = registry.all();

        validator.canAttack(AttackQuery.melee(player.id(), monster.id()));

        assertEquals(before, registry.all());
    }

    @Test
    void testEngagementCheckIgnoresRangeAndStatus() {
        var player = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        when(range.isSatisfied(any(), any(), any())).thenReturn(false);
        when(status.isActionBlocked(any(), any())).thenReturn(true);

        assertTrue(validator.checkEngagement(player.id(), monster.id()).allowed());

        registry.moveToRegion(monster.id(), HOUSING);
        assertEquals(DenyReason.RANGE_OR_LINE_OF_SIGHT, validator.checkEngagement(player.id(), monster.id()).reason());

        registry.moveToRegion(player.id(), HOUSING);
        assertEquals(DenyReason.REGION_DISALLOWS_COMBAT, validator.checkEngagement(player.id(), monster.id()).reason());
    }
}
