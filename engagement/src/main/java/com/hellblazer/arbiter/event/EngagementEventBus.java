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
package com.hellblazer.arbiter.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous fan-out of {@link EngagementEvent}s. Delivery happens on the publishing thread, which is the world
 * authority for every event the core publishes. A failing listener is logged and skipped; the rest still receive
 * the event.
 *
 * @author hal.hildebrand
 */
public class EngagementEventBus {
    private static final Logger log = LoggerFactory.getLogger(EngagementEventBus.class);

    private final List<EngagementEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(EngagementEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Subscribe to one kind of event only
     */
    public <E extends EngagementEvent> EngagementEventListener subscribe(Class<E> type, Consumer<? super E> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        EngagementEventListener listener = event -> {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        };
        listeners.add(listener);
        return listener;
    }

    public void unsubscribe(EngagementEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(EngagementEvent event) {
        Objects.requireNonNull(event, "event");
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Engagement listener {} failed on {}", listener, event, e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
