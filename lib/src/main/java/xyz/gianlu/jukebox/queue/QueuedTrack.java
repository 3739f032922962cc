/*
 * Copyright 2022 devgianlu
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package xyz.gianlu.jukebox.queue;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import xyz.gianlu.jukebox.playable.Playable;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Playable} sitting in a {@link TrackQueue}, together with who asked for it and how it should be ordered.
 * Entries are compared by identity, two entries wrapping the same playable are different entries.
 *
 * @author devgianlu
 */
public final class QueuedTrack {
    private static final AtomicLong NEXT_ID = new AtomicLong(1);
    public final Playable playable;
    public final long userId;
    public final long trackId;
    private final long startPosition;
    private volatile boolean priority;
    private volatile int rank;

    public QueuedTrack(@NotNull Playable playable, long userId, boolean priority) {
        this(playable, userId, priority, 0);
    }

    public QueuedTrack(@NotNull Playable playable, long userId, boolean priority, long startPosition) {
        if (startPosition < 0) throw new IllegalArgumentException("Invalid start position: " + startPosition);

        this.playable = playable;
        this.userId = userId;
        this.priority = priority;
        this.startPosition = startPosition;
        this.trackId = NEXT_ID.getAndIncrement();
        randomize();
    }

    /**
     * @return A new entry for the same playable, with a new id and no priority
     */
    @NotNull
    @Contract("-> new")
    public QueuedTrack makeClone() {
        return new QueuedTrack(playable, userId, false, startPosition);
    }

    public boolean isPriority() {
        return priority;
    }

    void setPriority(boolean priority) {
        this.priority = priority;
    }

    int rank() {
        return rank;
    }

    void setRank(int rank) {
        this.rank = rank;
    }

    void randomize() {
        rank = ThreadLocalRandom.current().nextInt();
    }

    /**
     * @return Where playback should start, in milliseconds
     */
    public long startPosition() {
        return startPosition;
    }

    /**
     * @return How long this entry will play for, in milliseconds
     */
    public long effectiveDuration() {
        return Math.max(0, playable.durationMillis() - startPosition);
    }

    public boolean isStream() {
        return playable.isStream();
    }

    @Override
    public String toString() {
        return "QueuedTrack{" + playable.title() + ", trackId=" + trackId + ", userId=" + userId
                + (priority ? ", priority" : "") + "}";
    }
}
