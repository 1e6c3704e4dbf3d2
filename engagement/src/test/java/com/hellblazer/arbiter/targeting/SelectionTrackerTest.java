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

import com.hellblazer.arbiter.actor.ActorRegistry;
import com.hellblazer.arbiter.actor.ActorType;
import com.hellblazer.arbiter.common.FrameClock;
import com.hellblazer.arbiter.common.RegionId;
import com.hellblazer.arbiter.event.EngagementEvent;
import com.hellblazer.arbiter.event.EngagementEventBus;
import com.hellblazer.arbiter.faction.FactionId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SelectionTrackerTest {

    private static final RegionId CRYPT = RegionId.of("crypt");

    private ActorRegistry         registry;
    private SelectionTracker      tracker;
    private List<EngagementEvent> events;

    @BeforeEach
    void setUp() {
        var bus = new EngagementEventBus();
        events = new ArrayList<>();
        bus.subscribe(events::add);
        registry = new ActorRegistry();
        tracker = new SelectionTracker(bus, new FrameClock(0.25));
        registry.addListener(tracker);
    }

    @Test
    void testSelectPublishesOnlyOnChange() {
        var viewer = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var target = registry.spawn(ActorType.NPC, FactionId.VILLAGE, CRYPT);

        tracker.select(viewer.id(), target.id(), SelectionKind.SELECT);
        tracker.select(viewer.id(), target.id(), SelectionKind.SELECT);
        tracker.select(viewer.id(), target.id(), SelectionKind.INTERACT);

        assertEquals(2, events.size());
        var last = (EngagementEvent.SelectionChanged) events.get(1);
        assertEquals(SelectionKind.SELECT, last.previous().kind());
        assertEquals(SelectionKind.INTERACT, last.current().kind());
        assertEquals(SelectionKind.INTERACT, tracker.current(viewer.id()).orElseThrow().kind());
    }

    @Test
    void testClearAttackDrivenPreservesPassiveSelection() {
        var viewer = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var target = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);

        tracker.select(viewer.id(), target.id(), SelectionKind.SELECT);
        assertFalse(tracker.clearAttackDriven(viewer.id()));
        assertTrue(tracker.current(viewer.id()).isPresent());

        tracker.select(viewer.id(), target.id(), SelectionKind.ATTACK);
        assertTrue(tracker.clearAttackDriven(viewer.id()));
        assertTrue(tracker.current(viewer.id()).isEmpty());
    }

    @Test
    void testDeadTargetDropsOnlyAttackSelections() {
        var attacker = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var looter = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var monster = registry.spawn(ActorType.MONSTER, FactionId.MONSTERS, CRYPT);
        tracker.select(attacker.id(), monster.id(), SelectionKind.ATTACK);
        tracker.select(looter.id(), monster.id(), SelectionKind.INTERACT);

        registry.kill(monster.id());

        assertTrue(tracker.current(attacker.id()).isEmpty());
        assertEquals(monster.id(), tracker.current(looter.id()).orElseThrow().targetId());
    }

    @Test
    void testDespawnedTargetDropsEverySelection() {
        var viewer = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);
        var target = registry.spawn(ActorType.NPC, FactionId.VILLAGE, CRYPT);
        tracker.select(viewer.id(), target.id(), SelectionKind.INTERACT);
        tracker.select(target.id(), viewer.id(), SelectionKind.SELECT);

        registry.despawn(target.id());

        assertTrue(tracker.current(viewer.id()).isEmpty());
        assertTrue(tracker.current(target.id()).isEmpty());
        assertEquals(0, tracker.size());
    }

    @Test
    void testDeniedPublishesReason() {
        var viewer = registry.spawn(ActorType.PLAYER, FactionId.PLAYERS, CRYPT);

        tracker.denied(viewer.id(), null, DenyReason.UNKNOWN_ACTOR);

        var denied = (EngagementEvent.TargetIntentDenied) events.get(0);
        assertEquals(DenyReason.UNKNOWN_ACTOR, denied.reason());
        assertEquals(1, denied.reason().getCode());
    }

    @Test
    void testReasonCodesAreStable() {
        assertEquals(0, DenyReason.NONE.getCode());
        assertEquals(11, DenyReason.REGION_DISALLOWS_COMBAT.getCode());
        assertEquals(20, DenyReason.NOT_HOSTILE.getCode());
        assertEquals(DenyReason.STATUS_GATED, DenyReason.fromCode(22));
        assertThrows(IllegalArgumentException.class, () -> DenyReason.fromCode(99));
    }
}
