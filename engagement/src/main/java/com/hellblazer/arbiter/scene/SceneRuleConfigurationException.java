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
package com.hellblazer.arbiter.scene;

import com.hellblazer.arbiter.common.RegionId;

/**
 * Raised when a region does not have exactly one rule provider. The region is left maximally restrictive.
 *
 * @author hal.hildebrand
 */
public class SceneRuleConfigurationException extends IllegalStateException {
    private final RegionId region;
    private final int      providerCount;

    public SceneRuleConfigurationException(RegionId region, int providerCount) {
        super(String.format("Region '%s' has %d scene rule providers; exactly one is required", region,
                            providerCount));
        this.region = region;
        this.providerCount = providerCount;
    }

    public RegionId getRegion() {
        return region;
    }

    public int getProviderCount() {
        return providerCount;
    }
}
