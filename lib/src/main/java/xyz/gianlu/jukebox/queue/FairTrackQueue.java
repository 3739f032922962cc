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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A {@link TrackQueue} that interleaves the tracks of different users instead of appending them, and shuffles by
 * sorting on a per-entry rank. All methods synchronize on the instance.
 *
 * @author devgianlu
 */
public final class FairTrackQueue implements TrackQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(FairTrackQueue.class);
    private final List<QueuedTrack> queue = new ArrayList<>();
    private List<QueuedTrack> cachedShuffledQueue = Collections.emptyList();
    private boolean shouldUpdateShuffledQueue = true;
    private QueuedTrack lastTrack = null;
    private boolean shuffle = false;
    private RepeatMode repeatMode = RepeatMode.NONE;

    public FairTrackQueue() {
    }

    /**
     * Finds where a track should go so that users take turns: a user who already has many tracks
     * ahead is placed behind the tracks of the others.
     */
    private int findInsertionPoint(@NotNull QueuedTrack track) {
        Map<Long, Integer> trackCount = new HashMap<>();
        long insertionOwner = track.userId;
        trackCount.put(insertionOwner, 1);
        if (lastTrack != null) trackCount.merge(lastTrack.userId, 1, Integer::sum);

        for (int i = 0; i < queue.size(); i++) {
            long owner = queue.get(i).userId;
            int count = trackCount.merge(owner, 1, Integer::sum);
            if (owner != insertionOwner && count > trackCount.get(insertionOwner))
                return i;
        }

        return queue.size();
    }

    private void checkNotQueued(@NotNull QueuedTrack track) {
        for (QueuedTrack queued : queue)
            if (queued == track) throw new IllegalArgumentException(track + " is already queued!");
    }

    @Override
    public synchronized void add(@NotNull QueuedTrack track) {
        checkNotQueued(track);
        shouldUpdateShuffledQueue = true;

        int index = findInsertionPoint(track);
        queue.add(index, track);
        LOGGER.trace("{} added to queue at {}.", track, index);
    }

    @Override
    public synchronized void addAll(@NotNull Collection<QueuedTrack> tracks) {
        for (QueuedTrack track : tracks) add(track);
    }

    @Override
    public synchronized void addFirst(@NotNull QueuedTrack track) {
        checkNotQueued(track);
        shouldUpdateShuffledQueue = true;

        track.setRank(Integer.MIN_VALUE);
        queue.add(0, track);
        LOGGER.trace("{} added to queue head.", track);
    }

    @Override
    public synchronized void addAllFirst(@NotNull Collection<QueuedTrack> tracks) {
        List<QueuedTrack> reversed = new ArrayList<>(tracks);
        Collections.reverse(reversed);
        for (QueuedTrack track : reversed) addFirst(track);
    }

    @Override
    public synchronized boolean remove(@NotNull QueuedTrack track) {
        if (queue.remove(track)) {
            shouldUpdateShuffledQueue = true;
            return true;
        } else {
            return false;
        }
    }

    @Override
    public synchronized void removeAll(@NotNull Collection<QueuedTrack> tracks) {
        if (queue.removeAll(tracks)) shouldUpdateShuffledQueue = true;
    }

    @Override
    public synchronized void removeAllById(@NotNull Collection<Long> trackIds) {
        if (queue.removeIf(track -> trackIds.contains(track.trackId))) shouldUpdateShuffledQueue = true;
    }

    @Override
    public synchronized @NotNull QueuedTrack getTrack(int index) {
        return asListOrdered().get(index);
    }

    @Override
    public synchronized @NotNull List<QueuedTrack> getTracksInRange(int startIndex, int endIndex) {
        int from = Math.min(startIndex, endIndex);
        int to = Math.max(startIndex, endIndex);

        List<QueuedTrack> result = new ArrayList<>();
        int i = 0;
        for (QueuedTrack track : asListOrdered()) {
            if (i >= to) break;
            if (i >= from) result.add(track);
            i++;
        }

        // Ranges are requested to remove tracks
        if (!result.isEmpty()) shouldUpdateShuffledQueue = true;
        return result;
    }

    @Override
    public synchronized @NotNull List<QueuedTrack> asList() {
        return new ArrayList<>(queue);
    }

    /**
     * When shuffling, sorts the queue by rank and spreads the ranks evenly over {@code (0, Integer.MAX_VALUE)} so
     * that a track re-added with {@link Integer#MAX_VALUE} lands last. The result is cached until the next mutation.
     */
    @Override
    public synchronized @NotNull List<QueuedTrack> asListOrdered() {
        if (!shuffle) return asList();
        if (!shouldUpdateShuffledQueue) return cachedShuffledQueue;

        List<QueuedTrack> list = new ArrayList<>(queue);
        list.sort(Comparator.comparingInt(QueuedTrack::rank));

        int size = list.size();
        for (int i = 0; i < size; i++) {
            QueuedTrack track = list.get(i);
            if (track.isPriority()) track.setRank(Integer.MIN_VALUE);
            else track.setRank((int) ((i / (size + 1.0) + 1.0 / (size + 1.0)) * Integer.MAX_VALUE));
        }

        cachedShuffledQueue = Collections.unmodifiableList(list);
        shouldUpdateShuffledQueue = false;
        return cachedShuffledQueue;
    }

    @Override
    public synchronized @Nullable QueuedTrack peek() {
        if (queue.isEmpty()) return null;
        else if (shuffle) return asListOrdered().get(0);
        else return queue.get(0);
    }

    @Override
    public synchronized @Nullable QueuedTrack provideNext() {
        if (repeatMode == RepeatMode.SINGLE && lastTrack != null)
            return lastTrack.makeClone();

        if (repeatMode == RepeatMode.ALL && lastTrack != null) {
            QueuedTrack clone = lastTrack.makeClone();
            if (shuffle) clone.setRank(Integer.MAX_VALUE);
            queue.add(clone);
            shouldUpdateShuffledQueue = true;
        }

        if (queue.isEmpty()) {
            lastTrack = null;
            return null;
        }

        if (shuffle) {
            lastTrack = asListOrdered().get(0);
            queue.remove(lastTrack);
            shouldUpdateShuffledQueue = true;
        } else {
            lastTrack = queue.remove(0);
        }

        return lastTrack;
    }

    @Override
    public synchronized void skipped() {
        lastTrack = null;
    }

    @Override
    public synchronized @Nullable QueuedTrack lastTrack() {
        return lastTrack;
    }

    @Override
    public synchronized void clear() {
        lastTrack = null;
        queue.clear();
        shouldUpdateShuffledQueue = true;
        LOGGER.trace("Queue has been cleared.");
    }

    @Override
    public synchronized int size() {
        return queue.size();
    }

    @Override
    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public synchronized long durationMillis() {
        long duration = 0;
        for (QueuedTrack track : queue)
            if (!track.isStream()) duration += track.effectiveDuration();

        return duration;
    }

    @Override
    public synchronized int streamsCount() {
        int streams = 0;
        for (QueuedTrack track : queue)
            if (track.isStream()) streams++;

        return streams;
    }

    @Override
    public synchronized void reshuffle() {
        for (QueuedTrack track : queue) {
            track.randomize();
            track.setPriority(false);
        }

        shouldUpdateShuffledQueue = true;
    }

    @Override
    public synchronized boolean isUserTrackOwner(long userId, @NotNull Collection<Long> trackIds) {
        for (QueuedTrack track : queue) {
            if (trackIds.contains(track.trackId) && track.userId != userId)
                return false;
        }

        return true;
    }

    @Override
    public synchronized boolean isShuffle() {
        return shuffle;
    }

    /**
     * Turning shuffle on drops every priority flag, priority tracks keep their place only until the next reorder.
     */
    @Override
    public synchronized void setShuffle(boolean shuffle) {
        this.shuffle = shuffle;
        if (shuffle) {
            shouldUpdateShuffledQueue = true;
            for (QueuedTrack track : queue) track.setPriority(false);
        }
    }

    @Override
    public synchronized @NotNull RepeatMode repeatMode() {
        return repeatMode;
    }

    @Override
    public synchronized void setRepeatMode(@NotNull RepeatMode mode) {
        this.repeatMode = mode;
    }
}
