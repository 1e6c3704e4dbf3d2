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
package com.hellblazer.arbiter.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe frame counter that doubles as a deterministic server clock. Time is derived purely from the frame
 * count and a fixed frame duration, so two servers replaying the same frames observe identical times.
 *
 * @author hal.hildebrand
 */
public class FrameClock implements ServerClock {
    private final AtomicLong frameCounter;
    private final double    frameSeconds;

    /**
     * Create a new FrameClock at frame 0
     *
     * @param frameSeconds duration of a single frame in seconds
     */
    public FrameClock(double frameSeconds) {
        this(frameSeconds, 0L);
    }

    /**
     * Create a new FrameClock with specified initial frame count
     *
     * @param frameSeconds duration of a single frame in seconds
     * @param initialFrame the initial frame count
     */
    public FrameClock(double frameSeconds, long initialFrame) {
        if (frameSeconds <= 0.0 || Double.isNaN(frameSeconds)) {
            throw new IllegalArgumentException("Frame duration must be positive: " + frameSeconds);
        }
        if (initialFrame < 0) {
            throw new IllegalArgumentException("Initial frame must be non-negative: " + initialFrame);
        }
        this.frameSeconds = frameSeconds;
        this.frameCounter = new AtomicLong(initialFrame);
    }

    /**
     * Get the current frame number
     *
     * @return the current frame count
     */
    public long getCurrentFrame() {
        return frameCounter.get();
    }

    public double getFrameSeconds() {
        return frameSeconds;
    }

    /**
     * Increment the frame counter and return the new value
     *
     * @return the new frame count after incrementing
     */
    public long incrementFrame() {
        return frameCounter.incrementAndGet();
    }

    /**
     * Advance by a number of frames
     *
     * @param frames number of frames, must be non-negative
     * @return the new frame count
     */
    public long advance(long frames) {
        if (frames < 0) {
            throw new IllegalArgumentException("Cannot rewind the server clock: " + frames);
        }
        return frameCounter.addAndGet(frames);
    }

    /**
     * Set the frame counter to a specific value. The clock never runs backwards.
     *
     * @param frame the new frame count
     */
    public void setFrame(long frame) {
        frameCounter.updateAndGet(current -> {
            if (frame < current) {
                throw new IllegalArgumentException(
                "Cannot rewind the server clock from frame " + current + " to " + frame);
            }
            return frame;
        });
    }

    @Override
    public double now() {
        return frameCounter.get() * frameSeconds;
    }

    @Override
    public String toString() {
        return String.format("FrameClock[frame=%d, frameSeconds=%.3f, now=%.3fs]", getCurrentFrame(), frameSeconds,
                             now());
    }
}
