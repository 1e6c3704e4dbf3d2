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
import com.hellblazer.arbiter.scene.SceneRuleSnapshot;

/**
 * Inputs of one disposition computation. Either actor may be null, which resolves to {@link Disposition#INVALID}.
 *
 * @param viewer                  observing actor
 * @param target                  observed actor
 * @param scene                   rules of the viewer's region
 * @param viewerCanPerceiveTarget stealth and reveal answer from the visibility source
 * @param requireRangeGate        whether the range gate takes part in eligibility
 * @param inRange                 range gate answer, ignored unless {@code requireRangeGate}
 * @author hal.hildebrand
 */
public record DispositionQuery(Actor viewer, Actor target, SceneRuleSnapshot scene, boolean viewerCanPerceiveTarget,
                               boolean requireRangeGate, boolean inRange) {

    public DispositionQuery {
        if (scene == null) {
            scene = SceneRuleSnapshot.restrictive();
        }
    }

    /**
     * Query without a range gate
     */
    public static DispositionQuery of(Actor viewer, Actor target, SceneRuleSnapshot scene, boolean canPerceive) {
        return new DispositionQuery(viewer, target, scene, canPerceive, false, true);
    }

    public DispositionQuery withRangeGate(boolean satisfied) {
        return new DispositionQuery(viewer, target, scene, viewerCanPerceiveTarget, true, satisfied);
    }
}
