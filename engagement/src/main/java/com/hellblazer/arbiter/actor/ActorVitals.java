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

/**
 * The single authoritative vitals record of an actor. UI and combat both read this value through {@link Actor};
 * only the registry replaces it.
 *
 * @param health     current health
 * @param maxHealth  maximum health
 * @param mana       current mana
 * @param maxMana    maximum mana
 * @param stamina    current stamina
 * @param maxStamina maximum stamina
 * @author hal.hildebrand
 */
public record ActorVitals(int health, int maxHealth, int mana, int maxMana, int stamina, int maxStamina) {

    public static final ActorVitals NONE = new ActorVitals(0, 0, 0, 0, 0, 0);

    public ActorVitals {
        checkPool("health", health, maxHealth);
        checkPool("mana", mana, maxMana);
        checkPool("stamina", stamina, maxStamina);
    }

    public static ActorVitals full(int maxHealth, int maxMana, int maxStamina) {
        return new ActorVitals(maxHealth, maxHealth, maxMana, maxMana, maxStamina, maxStamina);
    }

    public ActorVitals withHealth(int newHealth) {
        return new ActorVitals(Math.max(0, Math.min(newHealth, maxHealth)), maxHealth, mana, maxMana, stamina,
                               maxStamina);
    }

    public boolean isDepleted() {
        return maxHealth > 0 && health == 0;
    }

    private static void checkPool(String name, int current, int max) {
        if (max < 0 || current < 0 || current > max) {
            throw new IllegalArgumentException(
            String.format("Invalid %s pool: %d/%d", name, current, max));
        }
    }
}
