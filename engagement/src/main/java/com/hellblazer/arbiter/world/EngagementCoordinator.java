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
package com.hellblazer.arbiter.world;

import com.hellblazer.arbiter.combat.AttackLegalityValidator;
import com.hellblazer.arbiter.combat.AttackQuery;
import com.hellblazer.arbiter.combat.AttackResult;
import com.hellblazer.arbiter.combat.CombatStateTracker;
import com.hellblazer.arbiter.common.ActorId;
import com.hellblazer.arbiter.targeting.Disposition;
import com.hellblazer.arbiter.targeting.DispositionResult;
import com.hellblazer.arbiter.targeting.SelectionKind;
import com.hellblazer.arbiter.targeting.SelectionTracker;
import com.hellblazer.arbiter.targeting.TargetingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the combat execution engine and of client targeting requests. Validates intents, records
 * attack-driven selection and forwards lifecycle callbacks to the {@link CombatStateTracker}.
 * <p>
 * Every method mutates engagement or selection state and must run on the world authority thread.
 *
 * @author hal.hildebrand
 */
public class EngagementCoordinator {
    private static final Logger log = LoggerFactory.getLogger(EngagementCoordinator.class);

    private final AttackLegalityValidator validator;
    private final TargetingResolver       targeting;
    private final SelectionTracker        selections;
    private final CombatStateTracker      tracker;

    public EngagementCoordinator(AttackLegalityValidator validator, TargetingResolver targeting,
                                 SelectionTracker selections, CombatStateTracker tracker) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.targeting = Objects.requireNonNull(targeting, "targeting");
        this.selections = Objects.requireNonNull(selections, "selections");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
    }

    /**
     * Validate a hostile intent. When allowed, the attacker engages and its selection becomes attack-driven;
     * when denied, the attacker is told why.
     */
    public AttackResult requestAttack(AttackQuery query) {
        var result = validator.canAttack(query);
        if (!result.allowed()) {
            if (query.attackerId() != null) {
                selections.denied(query.attackerId(), query.targetId(), result.reason());
            }
            return result;
        }
        tracker.onHostileIntentValidated(query.attackerId(), query.targetId());
        selections.select(query.attackerId(), query.targetId(), SelectionKind.ATTACK);
        tracker.onTargeted(query.targetId());
        return result;
    }

    /**
     * Passive selection or interaction. Never refreshes the viewer's engagement.
     *
     * @throws IllegalArgumentException for {@link SelectionKind#ATTACK}; attack selections come from
     *                                  {@link #requestAttack}
     */
    public DispositionResult select(ActorId viewer, ActorId target, SelectionKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (kind.isAttackDriven()) {
            throw new IllegalArgumentException("Attack selections are made through requestAttack");
        }
        var disposition = targeting.resolveDisposition(viewer, target);
        if (disposition.disposition() == Disposition.INVALID) {
            if (viewer != null) {
                selections.denied(viewer, target, disposition.reason());
            }
            return disposition;
        }
        selections.select(viewer, target, kind);
        if (disposition.disposition() != Disposition.SELF) {
            tracker.onTargeted(target);
        }
        return disposition;
    }

    public boolean clearSelection(ActorId viewer) {
        return selections.clear(viewer);
    }

    /**
     * A scheduled hostile action resolved.
     */
    public void reportResolution(ActorId attacker, ActorId victim) {
        tracker.onHostileResolution(attacker, victim);
    }

    /**
     * The engine cancelled the attacker's auto-attack.
     */
    public void cancelAttack(ActorId attacker) {
        tracker.onEngagementEnded(attacker);
    }

    /**
     * End every engagement whose target is no longer legal to pursue.
     *
     * @return attackers whose engagement was ended
     */
    public List<ActorId> revalidateEngagements() {
        var ended = new ArrayList<ActorId>();
        tracker.activeEngagements().forEach((attacker, target) -> {
            var check = validator.checkEngagement(attacker, target);
            if (!check.allowed()) {
                log.debug("Ending engagement {} -> {}: {}", attacker, target, check.reason());
                tracker.onEngagementEnded(attacker);
                ended.add(attacker);
            }
        });
        return ended;
    }
}
