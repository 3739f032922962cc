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

package xyz.gianlu.jukebox.player;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.gianlu.jukebox.common.NameThreadFactory;
import xyz.gianlu.jukebox.common.Utils;
import xyz.gianlu.jukebox.loader.PlaybackController;
import xyz.gianlu.jukebox.queue.QueuedTrack;
import xyz.gianlu.jukebox.queue.TrackQueue;

import java.io.Closeable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A player that produces no audio: every track "plays" for its effective duration, multiplied by the time scale.
 * Streams play until skipped.
 *
 * @author devgianlu
 */
public final class SimulatedPlayer implements PlaybackController, Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedPlayer.class);
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(new NameThreadFactory((r) -> "simulated-player-" + r.hashCode()));
    private final TrackQueue queue;
    private final double timeScale;
    private QueuedTrack current = null;
    private ScheduledFuture<?> endFuture = null;
    private long remainingMillis = 0;
    private long startedAt = 0;
    private boolean paused;

    public SimulatedPlayer(@NotNull TrackQueue queue, double timeScale, boolean startPaused) {
        if (timeScale < 0) throw new IllegalArgumentException("timeScale can't be negative: " + timeScale);

        this.queue = queue;
        this.timeScale = timeScale;
        this.paused = startPaused;
    }

    @Override
    public synchronized boolean isPlaying() {
        return current != null && !paused;
    }

    @Override
    public synchronized boolean isPaused() {
        return paused;
    }

    @Override
    public synchronized void play() {
        if (current != null || paused) return;
        playNext();
    }

    @Override
    public synchronized int trackCount() {
        return queue.size() + (current == null ? 0 : 1);
    }

    @Nullable
    public synchronized QueuedTrack current() {
        return current;
    }

    /**
     * @return The playback position of the current track in its own time, or {@code -1} if nothing is playing
     */
    public synchronized long position() {
        if (current == null) return -1;

        long played = (long) (current.effectiveDuration() * timeScale) - remaining();
        long position = timeScale == 0 ? 0 : (long) (played / timeScale);
        return current.startPosition() + Math.max(0, position);
    }

    public synchronized void pause() {
        if (paused) return;

        if (current != null) {
            remainingMillis = remaining();
            cancelEnd();
            LOGGER.info("Paused {}.", current);
        }

        paused = true;
    }

    public synchronized void resume() {
        if (!paused) return;

        paused = false;
        if (current == null) {
            playNext();
        } else {
            LOGGER.info("Resumed {}.", current);
            scheduleEnd(current, remainingMillis);
        }
    }

    public synchronized void skip() {
        if (current == null) return;

        LOGGER.info("Skipped {}.", current);
        cancelEnd();
        queue.skipped();
        current = null;
        if (!paused) playNext();
    }

    /**
     * Forgets the current track, used when the queue is cleared.
     */
    public synchronized void stop() {
        cancelEnd();
        current = null;
    }

    private void playNext() {
        current = queue.provideNext();
        if (current == null) {
            LOGGER.info("Queue ended.");
            return;
        }

        LOGGER.info("Now playing {} ({}).", current.playable.title(), current.isStream() ? "stream" : Utils.formatDuration(current.effectiveDuration()));
        scheduleEnd(current, (long) (current.effectiveDuration() * timeScale));
    }

    private long remaining() {
        if (paused || endFuture == null) return remainingMillis;
        return Math.max(0, remainingMillis - TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
    }

    private void scheduleEnd(@NotNull QueuedTrack track, long delay) {
        remainingMillis = delay;
        startedAt = System.nanoTime();
        if (track.isStream()) return;

        endFuture = scheduler.schedule(() -> trackEnded(track), delay, TimeUnit.MILLISECONDS);
    }

    private void cancelEnd() {
        if (endFuture != null) {
            endFuture.cancel(false);
            endFuture = null;
        }
    }

    private synchronized void trackEnded(@NotNull QueuedTrack track) {
        if (current != track || paused) return;

        LOGGER.debug("{} ended.", track);
        endFuture = null;
        current = null;
        playNext();
    }

    @Override
    public void close() {
        synchronized (this) {
            cancelEnd();
            current = null;
        }

        scheduler.shutdownNow();
    }
}
