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

import com.hellblazer.arbiter.actor.ActorRegistry;
import com.hellblazer.arbiter.combat.AttackLegalityValidator;
import com.hellblazer.arbiter.combat.CombatStateTracker;
import com.hellblazer.arbiter.combat.DistanceRangeGate;
import com.hellblazer.arbiter.common.FrameClock;
import com.hellblazer.arbiter.config.ArbiterConfigLoader;
import com.hellblazer.arbiter.config.EngagementConfig;
import com.hellblazer.arbiter.event.EngagementEventBus;
import com.hellblazer.arbiter.external.CombatCancelable;
import com.hellblazer.arbiter.external.LineOfSightSource;
import com.hellblazer.arbiter.external.PositionSource;
import com.hellblazer.arbiter.external.RangeGate;
import com.hellblazer.arbiter.external.StatusSource;
import com.hellblazer.arbiter.external.VisibilitySource;
import com.hellblazer.arbiter.faction.FactionRelationMatrix;
import com.hellblazer.arbiter.faction.FactionRelationService;
import com.hellblazer.arbiter.scene.SceneRuleGate;
import com.hellblazer.arbiter.targeting.SelectionTracker;
import com.hellblazer.arbiter.targeting.TargetingResolver;

/**
 * One world's engagement core, wired together. Construct through {@link #builder()}.
 *
 * @author hal.hildebrand
 */
public class Arbiter implements AutoCloseable {

    private final EngagementConfig        config;
    private final FrameClock              clock;
    private final ActorRegistry           actors;
    private final SceneRuleGate           scenes;
    private final FactionRelationService  relations;
    private final EngagementEventBus      events;
    private final TargetingResolver       targeting;
    private final SelectionTracker        selections;
    private final AttackLegalityValidator validator;
    private final CombatStateTracker      tracker;
    private final EngagementCoordinator   coordinator;
    private final RegionTransitionService transitions;
    private final WorldAuthority          authority;

    private Arbiter(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock != null ? builder.clock : new FrameClock(config.sweepIntervalSeconds());
        this.actors = new ActorRegistry();
        this.scenes = new SceneRuleGate();
        this.events = new EngagementEventBus();
        this.relations = new FactionRelationService(builder.matrix, actors);
        this.targeting = new TargetingResolver(relations, actors, scenes, builder.visibility);
        this.selections = new SelectionTracker(events, clock);
        this.tracker = new CombatStateTracker(actors, scenes, selections, builder.cancelable, events, clock, config);

        RangeGate range = builder.range;
        if (range == null) {
            range = builder.positions != null ? new DistanceRangeGate(builder.positions, builder.lineOfSight, config)
                                              : RangeGate.UNLIMITED;
        }
        this.validator = new AttackLegalityValidator(actors, scenes, targeting, range, builder.status,
                                                     builder.visibility);
        this.coordinator = new EngagementCoordinator(validator, targeting, selections, tracker);
        this.transitions = new RegionTransitionService(actors, tracker, scenes);
        this.authority = new WorldAuthority(clock, frame -> coordinator.revalidateEngagements(), tracker::sweep);

        actors.addListener(selections);
        actors.addListener(tracker);
        scenes.addListener(tracker);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder seeded from {@code /arbiter.json} and {@code /factions.json} on the classpath
     */
    public static Builder fromClasspath() {
        var loader = new ArbiterConfigLoader();
        return builder().config(loader.loadEngagementConfig()).factions(loader.loadFactionMatrix());
    }

    /**
     * Tick at the configured sweep interval
     */
    public void start() {
        authority.start(config.sweepIntervalMillis());
    }

    @Override
    public void close() {
        authority.close();
    }

    public EngagementConfig getConfig() {
        return config;
    }

    public FrameClock getClock() {
        return clock;
    }

    public ActorRegistry getActors() {
        return actors;
    }

    public SceneRuleGate getScenes() {
        return scenes;
    }

    public FactionRelationService getRelations() {
        return relations;
    }

    public EngagementEventBus getEvents() {
        return events;
    }

    public TargetingResolver getTargeting() {
        return targeting;
    }

    public SelectionTracker getSelections() {
        return selections;
    }

    public AttackLegalityValidator getValidator() {
        return validator;
    }

    public CombatStateTracker getTracker() {
        return tracker;
    }

    public EngagementCoordinator getCoordinator() {
        return coordinator;
    }

    public RegionTransitionService getTransitions() {
        return transitions;
    }

    public WorldAuthority getAuthority() {
        return authority;
    }

    public static class Builder {
        private EngagementConfig      config      = EngagementConfig.defaults();
        private FactionRelationMatrix matrix      = FactionRelationMatrix.standard();
        private FrameClock            clock;
        private StatusSource          status      = StatusSource.NONE;
        private VisibilitySource      visibility  = VisibilitySource.ALL_VISIBLE;
        private CombatCancelable      cancelable  = CombatCancelable.NONE;
        private RangeGate             range;
        private PositionSource        positions;
        private LineOfSightSource     lineOfSight = LineOfSightSource.CLEAR;

        public Builder config(EngagementConfig config) {
            this.config = config;
            return this;
        }

        public Builder factions(FactionRelationMatrix matrix) {
            this.matrix = matrix;
            return this;
        }

        public Builder clock(FrameClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder status(StatusSource status) {
            this.status = status;
            return this;
        }

        public Builder visibility(VisibilitySource visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder cancelable(CombatCancelable cancelable) {
            this.cancelable = cancelable;
            return this;
        }

        /**
         * Explicit range gate; takes precedence over {@link #positions}
         */
        public Builder range(RangeGate range) {
            this.range = range;
            return this;
        }

        /**
         * Use a {@link DistanceRangeGate} over these positions
         */
        public Builder positions(PositionSource positions) {
            this.positions = positions;
            return this;
        }

        public Builder lineOfSight(LineOfSightSource lineOfSight) {
            this.lineOfSight = lineOfSight;
            return this;
        }

        public Arbiter build() {
            if (config == null || matrix == null || status == null || visibility == null) {
                throw new IllegalStateException("config, factions, status and visibility are required");
            }
            return new Arbiter(this);
        }
    }
}
