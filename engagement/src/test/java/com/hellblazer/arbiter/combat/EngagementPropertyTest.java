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
import com.hellblazer.arbiter.common.FrameClock;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.config.EngagementConfig;
import com.hellblazer.arbiter.event.EngagementEventBus;
import com.hellblazer.arbiter.external.ActionKind;
import com.hellblazer.arbiter.external.CombatCancelable;
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
import com.hellblazer.arbiter.targeting.SelectionTracker;
import com.hellblazer.arbiter.targeting.TargetingResolver;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@Label("Engagement Property-Based Tests")
class EngagementPropertyTest {

    private static final RegionId REGION = RegionId.of("region");

    @Property
    @Label("Repeated validation never shortens the window and keeps the pursuit flag")
    void validationIsMonotonic(@ForAll @IntRange(min = 0, max = 1000) int start,
                               @ForAll @IntRange(min = 0, max = 9) int gap) {
        var clock = new FrameClock(1.0, start);
        var registry = new ActorRegistry();
        var gate = new SceneRuleGate();
        gate.register(REGION, SceneRuleSnapshot.of(SceneContext.DUNGEON));
        var bus = new EngagementEventBus();
        var tracker = new CombatStateTracker(registry, gate, new SelectionTracker(bus, clock), CombatCancelable.NONE,
                                             bus, clock, EngagementConfig.defaults());
        var attacker = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, REGION);

        tracker.onHostileIntentValidated(attacker.id());
        var first = tracker.engagement(attacker.id()).combatUntilTime();
        clock.advance(gap);
        tracker.onHostileIntentValidated(attacker.id());
        var second = tracker.engagement(attacker.id());

        assertTrue(second.combatUntilTime() >= first);
        assertTrue(second.hasActiveHostileEngagement());
        assertEquals(CombatState.IN_COMBAT, tracker.getCombatState(attacker.id()));
    }

    @Property
    @Label("No pair may attack in a region that disallows combat")
    void noCombatRegionDeniesEveryPair(@ForAll ActorType attackerType, @ForAll FactionId attackerFaction,
                                       @ForAll ActorType targetType, @ForAll FactionId targetFaction,
                                       @ForAll Set<SceneRuleFlag> flags, @ForAll SceneContext context,
                                       @ForAll ActionKind kind) {
        Assume.that(!attackerType.isControllable() && !targetType.isControllable());
        var granted = EnumSet.noneOf(SceneRuleFlag.class);
        granted.addAll(flags);
        granted.remove(SceneRuleFlag.COMBAT_ALLOWED);
        var registry = new ActorRegistry();
        var gate = new SceneRuleGate();
        gate.register(REGION, SceneRuleSnapshot.of(context, granted));
        var resolver = new TargetingResolver(new FactionRelationService(FactionRelationMatrix.standard(), registry),
                                             registry, gate, VisibilitySource.ALL_VISIBLE);
        var validator = new AttackLegalityValidator(registry, gate, resolver, RangeGate.UNLIMITED, StatusSource.NONE,
                                                    VisibilitySource.ALL_VISIBLE);
        var attacker = registry.spawn(attackerType, attackerFaction, REGION);
        var target = registry.spawn(targetType, targetFaction, REGION);

        var result = validator.canAttack(new AttackQuery(attacker.id(), target.id(), kind));

        assertFalse(result.allowed());
    }
}
